package com.fisheye.vision.core.pipeline;

import com.fisheye.vision.core.projection.ViewDirection;
import com.fisheye.vision.core.storage.StorageUri;
import com.fisheye.vision.core.transform.RotationOperator;
import com.fisheye.vision.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 请求校验
 * <p>
 * 在读取任何存储之前同步执行，失败抛出 {@link ValidationException}
 */
public class RequestValidator {

    private final PipelineSettings settings;

    public RequestValidator(PipelineSettings settings) {
        this.settings = settings;
    }

    /**
     * @param request       原始请求
     * @param defaultPrompt 请求未带提示词且需要分析时才会调用
     */
    public ProcessingPlan validate(ProcessingRequest request, Supplier<String> defaultPrompt) {
        if (request == null) {
            throw new ValidationException("Request cannot be null");
        }
        if (request.getInputReference() == null || request.getInputReference().isBlank()) {
            throw new ValidationException("input_reference is required");
        }
        StorageUri input = parseUri(request.getInputReference(), "input_reference", false);

        EnumSet<PipelineStage> stages = PipelineStage.of(request.isUnwarp(), request.isRotate(), request.isAnalyze());
        if (stages.isEmpty()) {
            throw new ValidationException("At least one of unwarp, analyze or rotate must be requested");
        }

        if (stages.contains(PipelineStage.ROTATE)) {
            Integer angle = request.getRotationAngle();
            if (angle == null) {
                throw new ValidationException("rotation_angle is required when rotate is requested");
            }
            if (!RotationOperator.isSupported(angle)) {
                throw new ValidationException("rotation_angle must be one of 90, 180, 270, got: " + angle);
            }
        }

        List<ViewDirection> analyzeViews = resolveViews(request.getViewsToAnalyze());

        int fov = request.getFov() != null ? request.getFov() : settings.getFov();
        if (!(fov > 0 && fov < 180)) {
            throw new ValidationException("fov must be in (0, 180), got: " + fov);
        }
        int viewAngle = request.getViewAngle() != null ? request.getViewAngle() : settings.getViewAngle();
        if (!(viewAngle >= 0 && viewAngle <= 90)) {
            throw new ValidationException("view_angle must be in [0, 90], got: " + viewAngle);
        }

        List<ViewDirection> unwarpViews = Collections.emptyList();
        if (stages.contains(PipelineStage.UNWARP)) {
            Set<ViewDirection> union = new LinkedHashSet<>(settings.getUnwarpViews());
            if (stages.contains(PipelineStage.ANALYZE)) {
                union.addAll(analyzeViews);
            }
            unwarpViews = Collections.unmodifiableList(new ArrayList<>(union));
        }

        String prompt = null;
        String model = null;
        if (stages.contains(PipelineStage.ANALYZE)) {
            prompt = isBlank(request.getPrompt()) ? defaultPrompt.get() : request.getPrompt();
            if (isBlank(prompt)) {
                throw new ValidationException("No prompt given and no default prompt is available");
            }
            model = isBlank(request.getModel()) ? settings.getModel() : request.getModel();
        }

        return ProcessingPlan.builder()
                .input(input)
                .stages(Collections.unmodifiableSet(stages))
                .unwarpViews(unwarpViews)
                .analyzeViews(stages.contains(PipelineStage.ANALYZE) ? analyzeViews : Collections.emptyList())
                .fov(fov)
                .viewAngle(viewAngle)
                .rotationAngle(stages.contains(PipelineStage.ROTATE) ? request.getRotationAngle() : null)
                .prompt(prompt)
                .model(model)
                .outputPrefix(isBlank(request.getOutputLocation())
                        ? null : parseUri(request.getOutputLocation(), "output_location", true))
                .resultsPrefix(isBlank(request.getResultsLocation())
                        ? null : parseUri(request.getResultsLocation(), "results_location", true))
                .build();
    }

    /**
     * 视角代码去重并保持顺序，为空时默认北向
     */
    private List<ViewDirection> resolveViews(List<String> codes) {
        if (codes == null || codes.isEmpty()) {
            return Collections.singletonList(ViewDirection.NORTH);
        }
        Set<ViewDirection> views = new LinkedHashSet<>();
        for (String code : codes) {
            if (!ViewDirection.isValidCode(code)) {
                throw new ValidationException("Unknown view '" + code + "', expected one of " + ViewDirection.codes());
            }
            views.add(ViewDirection.fromCode(code));
        }
        return Collections.unmodifiableList(new ArrayList<>(views));
    }

    private static StorageUri parseUri(String value, String field, boolean prefix) {
        try {
            return prefix ? StorageUri.parsePrefix(value) : StorageUri.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid " + field + ": " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
