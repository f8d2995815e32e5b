package com.fisheye.vision.core.pipeline;

import com.fisheye.vision.core.analysis.VisionModel;
import com.fisheye.vision.core.image.ImageCodec;
import com.fisheye.vision.core.projection.ViewDirection;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * 流水线默认参数，由配置文件装配
 */
@Value
@Builder
public class PipelineSettings {
    @Builder.Default
    int fov = 90;
    @Builder.Default
    int viewAngle = 45;
    @Builder.Default
    int viewWidth = 1080;
    @Builder.Default
    int viewHeight = 810;
    // 下视图输出为正方形
    @Builder.Default
    int belowSize = 1080;
    @Builder.Default
    List<ViewDirection> unwarpViews = Arrays.asList(ViewDirection.values());
    @Builder.Default
    String model = VisionModel.DEFAULT.getId();
    @Builder.Default
    int jpegQuality = ImageCodec.DEFAULT_JPEG_QUALITY;
    @Builder.Default
    Duration viewTimeout = Duration.ofSeconds(60);

    public static PipelineSettings defaults() {
        return PipelineSettings.builder().build();
    }
}
