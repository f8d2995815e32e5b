package com.fisheye.vision.core.projection;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 虚拟透视相机朝向
 * <p>
 * 偏航角绕镜头光轴测量，以图像上方为北、顺时针为正；
 * 四个水平方向共享请求的俯仰角，BELOW 使用固定俯仰角（沿光轴正视）且不偏航
 */
public enum ViewDirection {
    NORTH("N", "North", 0.0, false),
    SOUTH("S", "South", 180.0, false),
    EAST("E", "East", 90.0, false),
    WEST("W", "West", -90.0, false),
    BELOW("B", "Below", 0.0, true);

    /**
     * BELOW 视角相对光轴的固定倾角
     */
    public static final double BELOW_TILT_DEGREES = 0.0;

    private static final List<String> CODES = Collections.unmodifiableList(
            Arrays.stream(values()).map(ViewDirection::getCode).collect(Collectors.toList()));

    private final String code;
    private final String displayName;
    private final double yawDegrees;
    private final boolean fixedTilt;

    ViewDirection(String code, String displayName, double yawDegrees, boolean fixedTilt) {
        this.code = code;
        this.displayName = displayName;
        this.yawDegrees = yawDegrees;
        this.fixedTilt = fixedTilt;
    }

    public String getCode() { return code; }
    public String getDisplayName() { return displayName; }
    public double getYawDegrees() { return yawDegrees; }
    public boolean hasFixedTilt() { return fixedTilt; }

    /**
     * 该方向实际使用的俯仰角
     */
    public double effectiveTilt(double requestedTiltDegrees) {
        return fixedTilt ? BELOW_TILT_DEGREES : requestedTiltDegrees;
    }

    /**
     * 按规范标识（N/S/E/W/B）查找，大小写敏感
     *
     * @throws IllegalArgumentException 未知标识
     */
    public static ViewDirection fromCode(String code) {
        for (ViewDirection direction : values()) {
            if (direction.code.equals(code)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown view identifier: " + code + ". Valid: " + CODES);
    }

    public static boolean isValidCode(String code) {
        return code != null && CODES.contains(code);
    }

    public static List<String> codes() {
        return CODES;
    }
}
