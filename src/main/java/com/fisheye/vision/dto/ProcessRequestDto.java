package com.fisheye.vision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fisheye.vision.core.pipeline.ProcessingRequest;
import lombok.Data;

import java.util.List;

/**
 * 处理请求
 */
@Data
public class ProcessRequestDto {
    @JsonProperty("input_reference")
    private String inputReference;

    private boolean unwarp;
    private boolean analyze;
    private boolean rotate;

    @JsonProperty("views_to_analyze")
    private List<String> viewsToAnalyze;  // N/S/E/W/B，默认 ["N"]

    private String prompt;
    private String model;

    private Integer fov;  // 整数度

    @JsonProperty("view_angle")
    private Integer viewAngle;  // 偏离光轴的俯仰角

    @JsonProperty("rotation_angle")
    private Integer rotationAngle;

    @JsonProperty("output_location")
    private String outputLocation;

    @JsonProperty("results_location")
    private String resultsLocation;

    public ProcessingRequest toProcessingRequest() {
        return ProcessingRequest.builder()
                .inputReference(inputReference)
                .unwarp(unwarp)
                .analyze(analyze)
                .rotate(rotate)
                .viewsToAnalyze(viewsToAnalyze)
                .prompt(prompt)
                .model(model)
                .fov(fov)
                .viewAngle(viewAngle)
                .rotationAngle(rotationAngle)
                .outputLocation(outputLocation)
                .resultsLocation(resultsLocation)
                .build();
    }
}
