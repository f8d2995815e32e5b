package com.fisheye.vision.core.projection;

import com.fisheye.vision.core.image.FisheyeFrame;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * 视角合成：按映射表双线性采样源帧，映射到源图之外的像素填充黑色
 */
public class ViewSynthesizer {

    private static final Scalar BACKGROUND = new Scalar(0, 0, 0);

    public Mat synthesize(FisheyeFrame frame, ProjectionMap map) {
        if (frame.getWidth() != map.getSourceWidth() || frame.getHeight() != map.getSourceHeight()) {
            throw new IllegalArgumentException(String.format(
                    "Projection map built for %dx%d cannot be applied to a %dx%d frame",
                    map.getSourceWidth(), map.getSourceHeight(), frame.getWidth(), frame.getHeight()));
        }
        Mat output = new Mat();
        Imgproc.remap(frame.getImage(), output, map.mapX(), map.mapY(),
                Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, BACKGROUND);
        return output;
    }
}
