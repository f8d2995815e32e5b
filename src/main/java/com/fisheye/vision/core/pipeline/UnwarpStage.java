package com.fisheye.vision.core.pipeline;

import com.fisheye.vision.core.image.FisheyeFrame;
import com.fisheye.vision.core.projection.ProjectionKey;
import com.fisheye.vision.core.projection.ProjectionMap;
import com.fisheye.vision.core.projection.ProjectionMapBuilder;
import com.fisheye.vision.core.projection.ProjectionMapCache;
import com.fisheye.vision.core.projection.ViewDirection;
import com.fisheye.vision.core.projection.ViewSpec;
import com.fisheye.vision.core.projection.ViewSynthesizer;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 展开阶段：为每个视角取（或构建）映射表并合成透视图
 */
public class UnwarpStage {
    private static final Logger logger = LoggerFactory.getLogger(UnwarpStage.class);

    private final ProjectionMapBuilder builder;
    private final ProjectionMapCache cache;
    private final ViewSynthesizer synthesizer;
    private final PipelineSettings settings;

    public UnwarpStage(ProjectionMapBuilder builder, ProjectionMapCache cache,
                       ViewSynthesizer synthesizer, PipelineSettings settings) {
        this.builder = builder;
        this.cache = cache;
        this.synthesizer = synthesizer;
        this.settings = settings;
    }

    public ViewSpec specFor(ViewDirection direction, double fov, double viewAngle) {
        if (direction == ViewDirection.BELOW) {
            return new ViewSpec(direction, fov, viewAngle, settings.getBelowSize(), settings.getBelowSize());
        }
        return new ViewSpec(direction, fov, viewAngle, settings.getViewWidth(), settings.getViewHeight());
    }

    public Mat synthesize(FisheyeFrame frame, ViewDirection direction, double fov, double viewAngle) {
        ProjectionKey key = new ProjectionKey(specFor(direction, fov, viewAngle), frame.getWidth(), frame.getHeight());
        ProjectionMap map = cache.getOrBuild(key, builder::build);
        return synthesizer.synthesize(frame, map);
    }

    /**
     * @return 按请求顺序排列的视角图像
     */
    public Map<ViewDirection, Mat> run(FisheyeFrame frame, List<ViewDirection> directions, double fov, double viewAngle) {
        long start = System.currentTimeMillis();
        Map<ViewDirection, Mat> views = new LinkedHashMap<>();
        for (ViewDirection direction : directions) {
            views.put(direction, synthesize(frame, direction, fov, viewAngle));
        }
        logger.info("Unwarped {} views from {} in {} ms", views.size(), frame,
                System.currentTimeMillis() - start);
        return Collections.unmodifiableMap(views);
    }
}
