package com.fisheye.vision.core.pipeline;

import java.util.EnumSet;

/**
 * 请求可选的处理阶段
 */
public enum PipelineStage {
    UNWARP,
    ROTATE,
    ANALYZE;

    public static EnumSet<PipelineStage> of(boolean unwarp, boolean rotate, boolean analyze) {
        EnumSet<PipelineStage> stages = EnumSet.noneOf(PipelineStage.class);
        if (unwarp) {
            stages.add(UNWARP);
        }
        if (rotate) {
            stages.add(ROTATE);
        }
        if (analyze) {
            stages.add(ANALYZE);
        }
        return stages;
    }
}
