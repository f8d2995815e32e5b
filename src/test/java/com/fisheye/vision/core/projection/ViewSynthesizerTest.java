package com.fisheye.vision.core.projection;

import com.fisheye.vision.config.NativeLibraryLoader;
import com.fisheye.vision.core.image.FisheyeFrame;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import static org.junit.jupiter.api.Assertions.*;

class ViewSynthesizerTest {

    private final ProjectionMapBuilder builder = new ProjectionMapBuilder(FisheyeLens.defaultLens());
    private final ViewSynthesizer synthesizer = new ViewSynthesizer();

    @BeforeAll
    static void loadOpenCV() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    private static FisheyeFrame gradientFrame(int width, int height) {
        Mat image = new Mat(height, width, CvType.CV_8UC3);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.put(y, x, x % 256, y % 256, (x + y) % 256);
            }
        }
        return FisheyeFrame.of(image);
    }

    @Test
    void outputHasViewSize() {
        FisheyeFrame frame = gradientFrame(200, 200);
        ProjectionMap map = builder.build(new ViewSpec(ViewDirection.NORTH, 90, 45, 64, 48), 200, 200);
        Mat view = synthesizer.synthesize(frame, map);
        assertEquals(64, view.cols());
        assertEquals(48, view.rows());
        assertEquals(CvType.CV_8UC3, view.type());
    }

    @Test
    void sameInputsGiveIdenticalPixels() {
        FisheyeFrame frame = gradientFrame(200, 200);
        ProjectionMap map = builder.build(new ViewSpec(ViewDirection.WEST, 90, 45, 40, 30), 200, 200);
        Mat first = synthesizer.synthesize(frame, map);
        Mat second = synthesizer.synthesize(frame, map);
        Mat diff = new Mat();
        Core.absdiff(first, second, diff);
        Scalar sum = Core.sumElems(diff);
        assertEquals(0.0, sum.val[0] + sum.val[1] + sum.val[2]);
    }

    @Test
    void centerPixelSamplesOpticalCenter() {
        Mat image = Mat.zeros(101, 101, CvType.CV_8UC3);
        Imgproc.circle(image, new Point(50, 50), 3, new Scalar(255, 255, 255), -1);
        FisheyeFrame frame = FisheyeFrame.of(image);
        ProjectionMap map = builder.build(new ViewSpec(ViewDirection.BELOW, 60, 0, 21, 21), 101, 101);
        Mat view = synthesizer.synthesize(frame, map);
        assertTrue(view.get(10, 10)[0] > 200);
        assertEquals(0.0, view.get(0, 0)[0]);
    }

    @Test
    void rejectsFrameOfAnotherResolution() {
        FisheyeFrame frame = gradientFrame(100, 80);
        ProjectionMap map = builder.build(new ViewSpec(ViewDirection.EAST, 90, 45, 10, 10), 200, 200);
        assertThrows(IllegalArgumentException.class, () -> synthesizer.synthesize(frame, map));
    }
}
