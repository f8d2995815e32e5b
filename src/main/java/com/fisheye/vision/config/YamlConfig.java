package com.fisheye.vision.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "fisheye-vision")
public class YamlConfig {
    private LensConfig lens = new LensConfig();
    private DefaultsConfig defaults = new DefaultsConfig();
    private StorageConfig storage = new StorageConfig();
    private AnalysisConfig analysis = new AnalysisConfig();
    private PromptsConfig prompts = new PromptsConfig();
    private TriggerConfig trigger = new TriggerConfig();

    @Data
    public static class LensConfig {
        private String model = "EQUIDISTANT";  // EQUIDISTANT, EQUISOLID, STEREOGRAPHIC
        private double fov = 180.0;
        // 光心和半径均为比例值
        private double centerX = 0.5;
        private double centerY = 0.5;
        private double radius = 1.0;
    }

    @Data
    public static class DefaultsConfig {
        private int fov = 90;
        private int viewAngle = 45;
        private int viewWidth = 1080;
        private int viewHeight = 810;
        private int belowSize = 1080;
        private List<String> unwarpViews = new ArrayList<>(Arrays.asList("N", "S", "E", "W", "B"));
        private int jpegQuality = 90;
    }

    @Data
    public static class StorageConfig {
        private String root = "./data/storage";
        private int maxAttempts = 3;
        private long backoffMillis = 200;
    }

    @Data
    public static class AnalysisConfig {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o";
        private int timeoutSeconds = 60;       // 单次 HTTP 调用超时
        private int viewTimeoutSeconds = 120;  // 单个视角的总期限（含重试）
        private int maxAttempts = 3;
        private long backoffMillis = 500;
        private int maxTokens = 1000;
        private int maxConcurrency = 8;
    }

    @Data
    public static class PromptsConfig {
        private String location = "local://config/";
        private String defaultName = "default";
    }

    @Data
    public static class TriggerConfig {
        private String scheme = "local";
        private boolean unwarp = true;
        private boolean analyze = true;
        private boolean rotate = false;
        private Integer rotationAngle;
        private List<String> viewsToAnalyze = new ArrayList<>(Arrays.asList("N"));
        private String outputLocation;
        private String resultsLocation;
    }
}
