package com.fisheye.vision.core.pipeline;

/**
 * 单次请求的处理状态
 * <p>
 * VALIDATING -> FETCHING_INPUT -> (UNWARPING / ROTATING / ANALYZING) -> BUILDING_MANIFEST -> DONE，
 * 任一致命错误进入 FAILED
 */
public enum PipelineState {
    VALIDATING,
    FETCHING_INPUT,
    UNWARPING,
    ROTATING,
    ANALYZING,
    BUILDING_MANIFEST,
    DONE,
    FAILED
}
