package com.fisheye.vision.core.pipeline;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 处理请求（未校验的原始输入）
 * <p>
 * viewsToAnalyze 为视角代码（N/S/E/W/B），为空时默认只分析北向；
 * 其余可选字段为 null 时使用配置默认值
 */
@Value
@Builder(toBuilder = true)
public class ProcessingRequest {
    String inputReference;
    boolean unwarp;
    boolean analyze;
    boolean rotate;
    List<String> viewsToAnalyze;
    String prompt;
    String model;
    Integer rotationAngle;
    Integer fov;
    Integer viewAngle;
    String outputLocation;
    String resultsLocation;
}
