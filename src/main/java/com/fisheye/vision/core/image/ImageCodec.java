package com.fisheye.vision.core.image;

import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;

/**
 * 图像编解码工具
 */
public final class ImageCodec {

    public static final int DEFAULT_JPEG_QUALITY = 90;

    private ImageCodec() {
    }

    /**
     * 解码为 3 通道 BGR 图像
     *
     * @throws IllegalArgumentException 字节为空或无法解码
     */
    public static Mat decode(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new IllegalArgumentException("Image bytes are empty");
        }
        MatOfByte buffer = new MatOfByte(encoded);
        try {
            Mat image = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_COLOR);
            if (image == null || image.empty()) {
                throw new IllegalArgumentException("Unable to decode image (" + encoded.length + " bytes)");
            }
            return image;
        } finally {
            buffer.release();
        }
    }

    public static byte[] encodeJpeg(Mat image) {
        return encodeJpeg(image, DEFAULT_JPEG_QUALITY);
    }

    public static byte[] encodeJpeg(Mat image, int quality) {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Cannot encode an empty image");
        }
        MatOfByte buffer = new MatOfByte();
        MatOfInt params = new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, quality);
        try {
            if (!Imgcodecs.imencode(".jpg", image, buffer, params)) {
                throw new IllegalStateException("JPEG encoding failed");
            }
            return buffer.toArray();
        } finally {
            buffer.release();
            params.release();
        }
    }
}
