package com.fisheye.vision.core.projection;

/**
 * 鱼眼镜头径向映射模型
 * <p>
 * 将入射光线与光轴夹角 theta 映射为归一化半径（0 为光心，1 为鱼眼圆边缘），
 * maxTheta 为镜头半视场角。不同镜头的实际模型需要用标定点验证
 */
public enum LensModel {
    /**
     * 等距投影 r = f * theta
     */
    EQUIDISTANT {
        @Override
        public double normalizedRadius(double theta, double maxTheta) {
            return theta / maxTheta;
        }
    },

    /**
     * 等立体角投影 r = 2f * sin(theta / 2)
     */
    EQUISOLID {
        @Override
        public double normalizedRadius(double theta, double maxTheta) {
            return Math.sin(theta / 2) / Math.sin(maxTheta / 2);
        }
    },

    /**
     * 体视投影 r = 2f * tan(theta / 2)
     */
    STEREOGRAPHIC {
        @Override
        public double normalizedRadius(double theta, double maxTheta) {
            return Math.tan(theta / 2) / Math.tan(maxTheta / 2);
        }
    };

    public abstract double normalizedRadius(double theta, double maxTheta);
}
