package com.fisheye.vision.core.image;

import org.opencv.core.Mat;

/**
 * 鱼眼源帧
 * <p>
 * 封装解码后的 BGR 图像，仅在单个请求内使用；调用方不得修改 {@link #getImage()} 返回的矩阵
 */
public final class FisheyeFrame {
    private final Mat image;
    private final int width;
    private final int height;

    private FisheyeFrame(Mat image) {
        this.image = image;
        this.width = image.cols();
        this.height = image.rows();
    }

    public static FisheyeFrame of(Mat image) {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Fisheye frame cannot be null or empty");
        }
        return new FisheyeFrame(image);
    }

    /**
     * 从编码字节（JPEG/PNG）解码
     */
    public static FisheyeFrame decode(byte[] encoded) {
        return new FisheyeFrame(ImageCodec.decode(encoded));
    }

    public Mat getImage() { return image; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }

    public void release() {
        image.release();
    }

    @Override
    public String toString() {
        return "FisheyeFrame{" + width + "x" + height + ", channels=" + image.channels() + '}';
    }
}
