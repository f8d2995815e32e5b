package com.fisheye.vision.core.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fisheye.vision.core.analysis.AnalysisResult;
import com.fisheye.vision.core.image.FisheyeFrame;
import com.fisheye.vision.core.image.ImageCodec;
import com.fisheye.vision.core.projection.ViewDirection;
import com.fisheye.vision.core.storage.ArtifactKeys;
import com.fisheye.vision.core.storage.ArtifactStorage;
import com.fisheye.vision.core.storage.StorageUri;
import com.fisheye.vision.exception.PipelineException;
import com.fisheye.vision.exception.ValidationException;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 请求编排器
 * <p>
 * 无状态，可被多个请求并发调用。执行顺序：
 * 1. 校验请求
 * 2. 读取并解码输入帧
 * 3. 展开视角并写入存储（单个视角写入失败只记录错误）
 * 4. 旋转原图并写入存储
 * 5. 并发分析各视角（单个视角失败只记录在该视角下）
 * 6. 汇总结果，manifest 只写一次
 * <p>
 * 校验失败、输入不存在、读取重试耗尽属于致命错误，直接抛出且不写 manifest
 * <p>
 * 指定 output_location / results_location 时，产物按输入 key 的完整相对路径放在前缀下，
 * 同名文件位于不同目录时互不覆盖
 */
public class ProcessingOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingOrchestrator.class);

    static final String MANIFEST_ARTIFACT = "manifest";
    static final String ROTATED_ARTIFACT = "rotated_image";
    static final String VIEW_ARTIFACT_PREFIX = "view_";

    private final ArtifactStorage storage;
    private final RequestValidator validator;
    private final UnwarpStage unwarpStage;
    private final RotateStage rotateStage;
    private final AnalyzeStage analyzeStage;
    private final PipelineSettings settings;
    private final Supplier<String> defaultPrompt;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ProcessingOrchestrator(ArtifactStorage storage, RequestValidator validator,
                                  UnwarpStage unwarpStage, RotateStage rotateStage, AnalyzeStage analyzeStage,
                                  PipelineSettings settings, Supplier<String> defaultPrompt,
                                  ObjectMapper objectMapper, Clock clock) {
        this.storage = storage;
        this.validator = validator;
        this.unwarpStage = unwarpStage;
        this.rotateStage = rotateStage;
        this.analyzeStage = analyzeStage;
        this.settings = settings;
        this.defaultPrompt = defaultPrompt;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ProcessingResult process(ProcessingRequest request) {
        long start = System.currentTimeMillis();
        Instant processedAt = Instant.now(clock);
        String input = request == null ? null : request.getInputReference();
        PipelineState state = PipelineState.VALIDATING;
        FisheyeFrame frame = null;
        List<Mat> owned = new ArrayList<>();
        try {
            logger.info("Processing {}", input);
            ProcessingPlan plan = validator.validate(request, defaultPrompt);
            logger.info("Stages {} for {}", plan.getStages(), plan.getInput());

            state = transition(state, PipelineState.FETCHING_INPUT, input);
            frame = fetch(plan.getInput());

            ProcessingResult result = new ProcessingResult();
            result.setInputReference(plan.getInput().toString());
            result.setProcessedAt(processedAt.toString());
            result.setConfig(configEcho(plan));

            Map<ViewDirection, byte[]> encodedViews = new LinkedHashMap<>();
            if (plan.has(PipelineStage.UNWARP)) {
                state = transition(state, PipelineState.UNWARPING, input);
                Map<ViewDirection, Mat> views = unwarpStage.run(frame, plan.getUnwarpViews(),
                        plan.getFov(), plan.getViewAngle());
                owned.addAll(views.values());
                for (Map.Entry<ViewDirection, Mat> entry : views.entrySet()) {
                    byte[] jpeg = ImageCodec.encodeJpeg(entry.getValue(), settings.getJpegQuality());
                    encodedViews.put(entry.getKey(), jpeg);
                    persistView(plan, entry.getKey(), jpeg, result);
                }
            }

            if (plan.has(PipelineStage.ROTATE)) {
                state = transition(state, PipelineState.ROTATING, input);
                Mat rotated = rotateStage.run(frame, plan.getRotationAngle());
                owned.add(rotated);
                byte[] jpeg = ImageCodec.encodeJpeg(rotated, settings.getJpegQuality());
                StorageUri target = sibling(plan.getInput(), ArtifactKeys.rotatedKey(plan.getInput().getKey()));
                String stored = store(ROTATED_ARTIFACT, result, () -> storage.putImage(jpeg, target.toString()));
                result.setRotatedImage(stored);
            }

            if (plan.has(PipelineStage.ANALYZE)) {
                state = transition(state, PipelineState.ANALYZING, input);
                Map<ViewDirection, byte[]> toAnalyze = new LinkedHashMap<>();
                for (ViewDirection direction : plan.getAnalyzeViews()) {
                    byte[] jpeg = encodedViews.get(direction);
                    if (jpeg == null) {
                        // 未请求展开时按需合成，不落盘
                        Mat view = unwarpStage.synthesize(frame, direction, plan.getFov(), plan.getViewAngle());
                        owned.add(view);
                        jpeg = ImageCodec.encodeJpeg(view, settings.getJpegQuality());
                    }
                    toAnalyze.put(direction, jpeg);
                }
                Map<ViewDirection, AnalysisResult> outcomes = analyzeStage.run(toAnalyze, plan.getPrompt(), plan.getModel());
                for (Map.Entry<ViewDirection, AnalysisResult> entry : outcomes.entrySet()) {
                    result.getAnalysis().put(entry.getKey().getCode(), entry.getValue());
                }
            }

            state = transition(state, PipelineState.BUILDING_MANIFEST, input);
            writeManifest(plan, processedAt, result);

            transition(state, PipelineState.DONE, input);
            logger.info("Processed {} in {} ms: {} views, {} analyses, {} artifact errors",
                    input, System.currentTimeMillis() - start, result.getViews().size(),
                    result.getAnalysis().size(), result.getArtifactErrors().size());
            return result;
        } catch (PipelineException e) {
            logger.warn("Processing {} failed in state {}: {}", input, state, e.getMessage());
            transition(state, PipelineState.FAILED, input);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Processing {} failed in state {}", input, state, e);
            transition(state, PipelineState.FAILED, input);
            throw e;
        } finally {
            for (Mat mat : owned) {
                mat.release();
            }
            if (frame != null) {
                frame.release();
            }
        }
    }

    private FisheyeFrame fetch(StorageUri input) {
        byte[] bytes = storage.getImage(input.toString());
        try {
            return FisheyeFrame.decode(bytes);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Input is not a decodable image: " + input, e);
        }
    }

    private void persistView(ProcessingPlan plan, ViewDirection direction, byte[] jpeg, ProcessingResult result) {
        String key = ArtifactKeys.viewKey(plan.getInput().getKey(), direction);
        StorageUri target = plan.getOutputPrefix() != null
                ? plan.getOutputPrefix().resolve(key)
                : sibling(plan.getInput(), key);
        String stored = store(VIEW_ARTIFACT_PREFIX + direction.getCode(), result,
                () -> storage.putImage(jpeg, target.toString()));
        if (stored != null) {
            result.getViews().put(direction.getCode(), stored);
        }
    }

    private void writeManifest(ProcessingPlan plan, Instant processedAt, ProcessingResult result) {
        String key = ArtifactKeys.manifestKey(plan.getInput().getKey(), processedAt);
        StorageUri target = plan.getResultsPrefix() != null
                ? plan.getResultsPrefix().resolve(key)
                : sibling(plan.getInput(), key);
        result.setResultsManifest(target.toString());
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize manifest for {}", plan.getInput(), e);
            result.setResultsManifest(null);
            result.getArtifactErrors().put(MANIFEST_ARTIFACT, "Failed to serialize manifest: " + e.getMessage());
            return;
        }
        String stored = store(MANIFEST_ARTIFACT, result, () -> storage.putJson(json, target.toString()));
        result.setResultsManifest(stored);
    }

    /**
     * 写入单个产物，失败时记录到 artifact_errors 并返回 null
     */
    private String store(String artifact, ProcessingResult result, Supplier<String> write) {
        try {
            return write.get();
        } catch (RuntimeException e) {
            logger.warn("Failed to store artifact {} for {}: {}", artifact, result.getInputReference(), e.getMessage());
            result.getArtifactErrors().put(artifact, e.getMessage());
            return null;
        }
    }

    private Map<String, Object> configEcho(ProcessingPlan plan) {
        Map<String, Object> config = new LinkedHashMap<>();
        List<String> stages = new ArrayList<>();
        for (PipelineStage stage : plan.getStages()) {
            stages.add(stage.name().toLowerCase());
        }
        config.put("stages", stages);
        config.put("unwarp", plan.has(PipelineStage.UNWARP));
        config.put("analyze", plan.has(PipelineStage.ANALYZE));
        config.put("rotate", plan.has(PipelineStage.ROTATE));
        config.put("fov", plan.getFov());
        config.put("view_angle", plan.getViewAngle());
        if (plan.has(PipelineStage.UNWARP)) {
            config.put("unwarp_views", codes(plan.getUnwarpViews()));
            if (plan.getOutputPrefix() != null) {
                config.put("output_location", plan.getOutputPrefix().toString());
            }
        }
        if (plan.has(PipelineStage.ROTATE)) {
            config.put("rotation_angle", plan.getRotationAngle());
        }
        if (plan.has(PipelineStage.ANALYZE)) {
            config.put("views_to_analyze", codes(plan.getAnalyzeViews()));
            config.put("model", plan.getModel());
            config.put("prompt", plan.getPrompt());
        }
        if (plan.getResultsPrefix() != null) {
            config.put("results_location", plan.getResultsPrefix().toString());
        }
        return config;
    }

    private static List<String> codes(List<ViewDirection> directions) {
        List<String> codes = new ArrayList<>();
        for (ViewDirection direction : directions) {
            codes.add(direction.getCode());
        }
        return codes;
    }

    private static StorageUri sibling(StorageUri input, String key) {
        return new StorageUri(input.getScheme(), input.getBucket(), key);
    }

    private static PipelineState transition(PipelineState from, PipelineState to, String input) {
        logger.debug("{}: {} -> {}", input, from, to);
        return to;
    }
}
