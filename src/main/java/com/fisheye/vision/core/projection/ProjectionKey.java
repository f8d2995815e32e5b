package com.fisheye.vision.core.projection;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 映射表缓存键：视角 + 源分辨率
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ProjectionKey {
    private final ViewSpec viewSpec;
    private final int sourceWidth;
    private final int sourceHeight;

    public ProjectionKey(ViewSpec viewSpec, int sourceWidth, int sourceHeight) {
        if (viewSpec == null) {
            throw new IllegalArgumentException("View spec cannot be null");
        }
        this.viewSpec = viewSpec;
        this.sourceWidth = sourceWidth;
        this.sourceHeight = sourceHeight;
    }
}
