package com.fisheye.vision.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fisheye.vision.core.analysis.OpenAiVisionClient;
import com.fisheye.vision.core.analysis.VisionAnalysisClient;
import com.fisheye.vision.core.pipeline.AnalyzeStage;
import com.fisheye.vision.core.pipeline.PipelineSettings;
import com.fisheye.vision.core.pipeline.ProcessingOrchestrator;
import com.fisheye.vision.core.pipeline.RequestValidator;
import com.fisheye.vision.core.pipeline.RotateStage;
import com.fisheye.vision.core.pipeline.UnwarpStage;
import com.fisheye.vision.core.projection.FisheyeLens;
import com.fisheye.vision.core.projection.LensModel;
import com.fisheye.vision.core.projection.ProjectionMapBuilder;
import com.fisheye.vision.core.projection.ProjectionMapCache;
import com.fisheye.vision.core.projection.ViewDirection;
import com.fisheye.vision.core.projection.ViewSynthesizer;
import com.fisheye.vision.core.storage.ArtifactStorage;
import com.fisheye.vision.core.storage.LocalArtifactStorage;
import com.fisheye.vision.core.transform.RotationOperator;
import com.fisheye.vision.service.PromptLibraryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 流水线组件装配
 */
@Configuration
public class PipelineConfig {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public FisheyeLens fisheyeLens(YamlConfig config) {
        YamlConfig.LensConfig lens = config.getLens();
        LensModel model = LensModel.valueOf(lens.getModel().trim().toUpperCase(Locale.ROOT));
        logger.info("Fisheye lens: {} {}°, center=({}, {}), radius={}",
                model, lens.getFov(), lens.getCenterX(), lens.getCenterY(), lens.getRadius());
        return new FisheyeLens(model, lens.getFov(), lens.getCenterX(), lens.getCenterY(), lens.getRadius());
    }

    @Bean
    public PipelineSettings pipelineSettings(YamlConfig config) {
        YamlConfig.DefaultsConfig defaults = config.getDefaults();
        List<ViewDirection> unwarpViews = new ArrayList<>();
        for (String code : defaults.getUnwarpViews()) {
            unwarpViews.add(ViewDirection.fromCode(code));
        }
        return PipelineSettings.builder()
                .fov(defaults.getFov())
                .viewAngle(defaults.getViewAngle())
                .viewWidth(defaults.getViewWidth())
                .viewHeight(defaults.getViewHeight())
                .belowSize(defaults.getBelowSize())
                .unwarpViews(unwarpViews)
                .model(config.getAnalysis().getModel())
                .jpegQuality(defaults.getJpegQuality())
                .viewTimeout(Duration.ofSeconds(config.getAnalysis().getViewTimeoutSeconds()))
                .build();
    }

    @Bean
    public ArtifactStorage artifactStorage(YamlConfig config) {
        YamlConfig.StorageConfig storage = config.getStorage();
        return new LocalArtifactStorage(Path.of(storage.getRoot()), storage.getMaxAttempts(), storage.getBackoffMillis());
    }

    @Bean
    public VisionAnalysisClient visionAnalysisClient(YamlConfig config) {
        YamlConfig.AnalysisConfig analysis = config.getAnalysis();
        if (analysis.getApiKey() == null || analysis.getApiKey().isBlank()) {
            logger.warn("No vision service API key configured, analysis calls will likely be rejected");
        }
        return new OpenAiVisionClient(analysis.getBaseUrl(), analysis.getApiKey(),
                Duration.ofSeconds(analysis.getTimeoutSeconds()), analysis.getMaxAttempts(),
                analysis.getBackoffMillis(), analysis.getMaxTokens());
    }

    @Bean
    public ProjectionMapCache projectionMapCache() {
        return new ProjectionMapCache();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor(YamlConfig config) {
        int threads = Math.max(1, config.getAnalysis().getMaxConcurrency());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "analysis-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        logger.info("Analysis executor with {} threads", threads);
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProcessingOrchestrator processingOrchestrator(ArtifactStorage storage, VisionAnalysisClient client,
                                                         FisheyeLens lens, ProjectionMapCache cache,
                                                         PipelineSettings settings, ExecutorService analysisExecutor,
                                                         PromptLibraryService promptLibrary,
                                                         ObjectMapper objectMapper, Clock clock) {
        UnwarpStage unwarpStage = new UnwarpStage(new ProjectionMapBuilder(lens), cache, new ViewSynthesizer(), settings);
        return new ProcessingOrchestrator(storage, new RequestValidator(settings), unwarpStage,
                new RotateStage(new RotationOperator()),
                new AnalyzeStage(client, analysisExecutor, settings.getViewTimeout()),
                settings, promptLibrary::getDefaultPrompt, objectMapper, clock);
    }
}
