package com.fisheye.vision.core.pipeline;

import com.fisheye.vision.core.projection.ViewDirection;
import com.fisheye.vision.core.storage.StorageUri;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * 校验并补全默认值后的请求
 * <p>
 * unwarpViews 在请求 unwarp 时为配置视角与分析视角的并集，否则为空；
 * outputPrefix / resultsPrefix 为 null 表示写在输入旁边
 */
@Value
@Builder
public class ProcessingPlan {
    StorageUri input;
    Set<PipelineStage> stages;
    List<ViewDirection> unwarpViews;
    List<ViewDirection> analyzeViews;
    int fov;
    int viewAngle;
    Integer rotationAngle;
    String prompt;
    String model;
    StorageUri outputPrefix;
    StorageUri resultsPrefix;

    public boolean has(PipelineStage stage) {
        return stages.contains(stage);
    }
}
