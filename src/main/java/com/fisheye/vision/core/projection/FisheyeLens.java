package com.fisheye.vision.core.projection;

/**
 * 鱼眼镜头参数
 * <p>
 * 光心以源图宽高的比例给出，鱼眼圆半径以 min(宽, 高) / 2 的比例给出，
 * 因此同一镜头参数可用于任意分辨率的源帧
 */
public final class FisheyeLens {
    private final LensModel model;
    private final double fieldOfViewDegrees;
    private final double centerXFraction;
    private final double centerYFraction;
    private final double radiusFraction;

    public FisheyeLens(LensModel model, double fieldOfViewDegrees,
                       double centerXFraction, double centerYFraction, double radiusFraction) {
        if (model == null) {
            throw new IllegalArgumentException("Lens model cannot be null");
        }
        if (fieldOfViewDegrees <= 0 || fieldOfViewDegrees > 360) {
            throw new IllegalArgumentException("Lens field of view must be in (0, 360]: " + fieldOfViewDegrees);
        }
        if (model == LensModel.STEREOGRAPHIC && fieldOfViewDegrees >= 360) {
            throw new IllegalArgumentException("Stereographic lens field of view must be below 360");
        }
        if (radiusFraction <= 0) {
            throw new IllegalArgumentException("Radius fraction must be positive: " + radiusFraction);
        }
        this.model = model;
        this.fieldOfViewDegrees = fieldOfViewDegrees;
        this.centerXFraction = centerXFraction;
        this.centerYFraction = centerYFraction;
        this.radiusFraction = radiusFraction;
    }

    /**
     * 180° 等距鱼眼，光心位于画面中心，鱼眼圆内切于画面
     */
    public static FisheyeLens defaultLens() {
        return new FisheyeLens(LensModel.EQUIDISTANT, 180.0, 0.5, 0.5, 1.0);
    }

    public double opticalCenterX(int sourceWidth) {
        return sourceWidth * centerXFraction;
    }

    public double opticalCenterY(int sourceHeight) {
        return sourceHeight * centerYFraction;
    }

    public double circleRadius(int sourceWidth, int sourceHeight) {
        return Math.min(sourceWidth, sourceHeight) / 2.0 * radiusFraction;
    }

    /**
     * 镜头可见的最大极角（弧度）
     */
    public double maxPolarAngle() {
        return Math.toRadians(fieldOfViewDegrees / 2.0);
    }

    /**
     * 极角对应的归一化半径，超出视场的角度夹到边缘
     */
    public double normalizedRadius(double theta) {
        double maxTheta = maxPolarAngle();
        double clamped = Math.min(Math.max(theta, 0.0), maxTheta);
        return model.normalizedRadius(clamped, maxTheta);
    }

    public LensModel getModel() { return model; }
    public double getFieldOfViewDegrees() { return fieldOfViewDegrees; }
    public double getCenterXFraction() { return centerXFraction; }
    public double getCenterYFraction() { return centerYFraction; }
    public double getRadiusFraction() { return radiusFraction; }

    @Override
    public String toString() {
        return String.format("FisheyeLens[%s, fov=%.1f°, center=(%.3f,%.3f), radius=%.3f]",
                model, fieldOfViewDegrees, centerXFraction, centerYFraction, radiusFraction);
    }
}
