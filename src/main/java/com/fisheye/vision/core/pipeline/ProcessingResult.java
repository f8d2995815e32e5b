package com.fisheye.vision.core.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fisheye.vision.core.analysis.AnalysisResult;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 处理结果清单，同时作为 manifest JSON 写入存储
 */
@Data
@JsonPropertyOrder({"input_reference", "views", "analysis", "rotated_image", "processed_at",
        "config", "results_manifest", "artifact_errors"})
public class ProcessingResult {
    @JsonProperty("input_reference")
    private String inputReference;

    // 视角代码 -> 产物地址
    private Map<String, String> views = new LinkedHashMap<>();

    // 视角代码 -> {text, error, data}
    private Map<String, AnalysisResult> analysis = new LinkedHashMap<>();

    @JsonProperty("rotated_image")
    private String rotatedImage;

    @JsonProperty("processed_at")
    private String processedAt;

    private Map<String, Object> config = new LinkedHashMap<>();

    @JsonProperty("results_manifest")
    private String resultsManifest;

    @JsonProperty("artifact_errors")
    private Map<String, String> artifactErrors = new LinkedHashMap<>();
}
