package com.fisheye.vision.core.projection;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 虚拟透视相机描述，所有字段相同即视为同一视角
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ViewSpec {
    private final ViewDirection direction;
    private final double fieldOfViewDegrees;
    private final double tiltDegrees;
    private final int outputWidth;
    private final int outputHeight;

    public ViewSpec(ViewDirection direction, double fieldOfViewDegrees, double tiltDegrees,
                    int outputWidth, int outputHeight) {
        if (direction == null) {
            throw new IllegalArgumentException("View direction cannot be null");
        }
        if (fieldOfViewDegrees <= 0 || fieldOfViewDegrees >= 180) {
            throw new IllegalArgumentException("Field of view must be in (0, 180): " + fieldOfViewDegrees);
        }
        if (outputWidth <= 0 || outputHeight <= 0) {
            throw new IllegalArgumentException("Output size must be positive: " + outputWidth + "x" + outputHeight);
        }
        this.direction = direction;
        this.fieldOfViewDegrees = fieldOfViewDegrees;
        this.tiltDegrees = direction.effectiveTilt(tiltDegrees);
        this.outputWidth = outputWidth;
        this.outputHeight = outputHeight;
    }
}
