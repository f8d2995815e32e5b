package com.fisheye.vision.core.image;

import com.fisheye.vision.config.NativeLibraryLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import static org.junit.jupiter.api.Assertions.*;

class ImageCodecTest {

    @BeforeAll
    static void loadOpenCV() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Test
    void encodedJpegDecodesToFrame() {
        Mat image = new Mat(40, 60, CvType.CV_8UC3, new Scalar(10, 120, 200));
        byte[] jpeg = ImageCodec.encodeJpeg(image);
        assertEquals((byte) 0xFF, jpeg[0]);
        assertEquals((byte) 0xD8, jpeg[1]);

        FisheyeFrame frame = FisheyeFrame.decode(jpeg);
        assertEquals(60, frame.getWidth());
        assertEquals(40, frame.getHeight());
        assertEquals(3, frame.getImage().channels());
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> ImageCodec.decode(new byte[]{1, 2, 3, 4}));
        assertThrows(IllegalArgumentException.class, () -> ImageCodec.decode(new byte[0]));
    }

    @Test
    void rejectsEmptyMat() {
        assertThrows(IllegalArgumentException.class, () -> ImageCodec.encodeJpeg(new Mat()));
    }
}
