package com.fisheye.vision.core.pipeline;

import com.fisheye.vision.core.image.FisheyeFrame;
import com.fisheye.vision.core.transform.RotationOperator;
import org.opencv.core.Mat;

/**
 * 旋转阶段：对原始鱼眼帧整体旋转
 */
public class RotateStage {

    private final RotationOperator operator;

    public RotateStage(RotationOperator operator) {
        this.operator = operator;
    }

    public Mat run(FisheyeFrame frame, int angle) {
        return operator.rotate(frame.getImage(), angle);
    }
}
