package com.fisheye.vision.core.projection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 映射表构建器
 * <p>
 * 对每个输出像素：
 * 1. 在虚拟透视相机像平面上生成单位方向向量（焦距由视场角决定）
 * 2. 先绕相机 X 轴俯仰（偏离光轴 tilt 度），再绕光轴偏航到目标方向
 * 3. 由旋转后向量的极角 theta 与方位角 phi 按镜头模型求鱼眼半径
 * 4. 以光心和鱼眼圆半径换算为源图像素坐标
 * <p>
 * 纯函数，无副作用；耗时与输出像素数成正比，结果应通过 {@link ProjectionMapCache} 复用
 */
public class ProjectionMapBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionMapBuilder.class);

    private final FisheyeLens lens;

    public ProjectionMapBuilder(FisheyeLens lens) {
        if (lens == null) {
            throw new IllegalArgumentException("Lens cannot be null");
        }
        this.lens = lens;
    }

    public ProjectionMap build(ProjectionKey key) {
        return build(key.getViewSpec(), key.getSourceWidth(), key.getSourceHeight());
    }

    public ProjectionMap build(ViewSpec spec, int sourceWidth, int sourceHeight) {
        if (sourceWidth <= 0 || sourceHeight <= 0) {
            throw new IllegalArgumentException("Source size must be positive: " + sourceWidth + "x" + sourceHeight);
        }
        long start = System.nanoTime();

        int outW = spec.getOutputWidth();
        int outH = spec.getOutputHeight();
        float[] xs = new float[outW * outH];
        float[] ys = new float[outW * outH];

        double focal = outW / (2.0 * Math.tan(Math.toRadians(spec.getFieldOfViewDegrees()) / 2.0));
        double tilt = Math.toRadians(spec.getTiltDegrees());
        double yaw = Math.toRadians(spec.getDirection().getYawDegrees());
        double cosT = Math.cos(tilt);
        double sinT = Math.sin(tilt);
        double cosY = Math.cos(yaw);
        double sinY = Math.sin(yaw);

        double cx = lens.opticalCenterX(sourceWidth);
        double cy = lens.opticalCenterY(sourceHeight);
        double radius = lens.circleRadius(sourceWidth, sourceHeight);
        double halfW = outW / 2.0;
        double halfH = outH / 2.0;

        int i = 0;
        for (int v = 0; v < outH; v++) {
            for (int u = 0; u < outW; u++) {
                // 相机坐标：x 向右，y 向上，z 沿视线
                double x = (u - halfW) / focal;
                double y = -(v - halfH) / focal;
                double z = 1.0;
                double norm = Math.sqrt(x * x + y * y + z * z);
                x /= norm;
                y /= norm;
                z /= norm;

                // 俯仰：视线从光轴向图像上方（北）倾斜
                double ty = y * cosT + z * sinT;
                double tz = -y * sinT + z * cosT;

                // 偏航：绕光轴顺时针旋转
                double wx = x * cosY + ty * sinY;
                double wy = -x * sinY + ty * cosY;

                double theta = Math.acos(Math.max(-1.0, Math.min(1.0, tz)));
                double phi = Math.atan2(wx, wy);
                double r = lens.normalizedRadius(theta) * radius;

                xs[i] = (float) (cx + r * Math.sin(phi));
                ys[i] = (float) (cy - r * Math.cos(phi));
                i++;
            }
        }

        ProjectionMap map = new ProjectionMap(spec, sourceWidth, sourceHeight, xs, ys);
        logger.debug("Built projection map for {} from {}x{} in {} ms",
                spec, sourceWidth, sourceHeight, (System.nanoTime() - start) / 1_000_000);
        return map;
    }

    public FisheyeLens getLens() { return lens; }
}
