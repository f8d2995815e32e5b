package com.fisheye.vision.core.transform;

import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * 90° 整数倍顺时针旋转
 * <p>
 * 基于转置/翻转实现，无插值、无损；90° 与 270° 交换宽高
 */
public class RotationOperator {

    public static boolean isSupported(int angle) {
        return angle == 90 || angle == 180 || angle == 270;
    }

    /**
     * @param image 源图（不修改）
     * @param angle 顺时针角度，只允许 90 / 180 / 270
     * @throws IllegalArgumentException 角度不合法
     */
    public Mat rotate(Mat image, int angle) {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Image cannot be null or empty");
        }
        int rotateCode;
        switch (angle) {
            case 90:
                rotateCode = Core.ROTATE_90_CLOCKWISE;
                break;
            case 180:
                rotateCode = Core.ROTATE_180;
                break;
            case 270:
                rotateCode = Core.ROTATE_90_COUNTERCLOCKWISE;
                break;
            default:
                throw new IllegalArgumentException("Rotation angle must be 90, 180 or 270, got: " + angle);
        }
        Mat rotated = new Mat();
        Core.rotate(image, rotated, rotateCode);
        return rotated;
    }
}
