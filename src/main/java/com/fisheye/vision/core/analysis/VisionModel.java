package com.fisheye.vision.core.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 支持视觉输入的模型目录
 */
public enum VisionModel {
    GPT_4O("gpt-4o", "GPT-4o", Provider.OPENAI,
            "Capable GPT-4o model for vision analysis", "standard"),
    GPT_4O_MINI("gpt-4o-mini", "GPT-4o Mini", Provider.OPENAI,
            "Smaller, faster, and cheaper GPT-4o variant", "economy"),
    GPT_4_TURBO("gpt-4-turbo", "GPT-4 Turbo", Provider.OPENAI,
            "Legacy GPT-4 Turbo with vision", "legacy"),
    CLAUDE_SONNET_4("claude-sonnet-4-20250514", "Claude Sonnet 4", Provider.ANTHROPIC,
            "Balanced Anthropic model with vision capabilities", "standard"),
    CLAUDE_OPUS_4("claude-opus-4-20250514", "Claude Opus 4", Provider.ANTHROPIC,
            "Most capable Anthropic model", "premium"),
    GEMINI_2_0_FLASH("gemini/gemini-2.0-flash", "Gemini 2.0 Flash", Provider.GOOGLE,
            "Fast multimodal Gemini model", "economy"),
    GEMINI_2_5_PRO("gemini/gemini-2.5-pro", "Gemini 2.5 Pro", Provider.GOOGLE,
            "Advanced multimodal Gemini model", "standard"),
    KIMI_K2_5("novita/moonshotai/kimi-k2.5", "Kimi K2.5", Provider.NOVITA,
            "Moonshot AI Kimi K2.5 served by Novita", "standard");

    public static final VisionModel DEFAULT = GPT_4O;

    public enum Provider {
        OPENAI, ANTHROPIC, GOOGLE, NOVITA;

        public String id() {
            return name().toLowerCase();
        }
    }

    private final String id;
    private final String displayName;
    private final Provider provider;
    private final String description;
    private final String tier;

    VisionModel(String id, String displayName, Provider provider, String description, String tier) {
        this.id = id;
        this.displayName = displayName;
        this.provider = provider;
        this.description = description;
        this.tier = tier;
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public Provider getProvider() { return provider; }
    public String getDescription() { return description; }
    public String getTier() { return tier; }

    /**
     * 按模型标识查找，未收录时返回 null
     */
    public static VisionModel findById(String id) {
        for (VisionModel model : values()) {
            if (model.id.equals(id)) {
                return model;
            }
        }
        return null;
    }

    /**
     * 供 API 输出的模型列表
     */
    public static List<Map<String, Object>> describeAll() {
        List<Map<String, Object>> models = new ArrayList<>();
        for (VisionModel model : values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", model.id);
            entry.put("name", model.displayName);
            entry.put("provider", model.provider.id());
            entry.put("description", model.description);
            entry.put("tier", model.tier);
            entry.put("supports_vision", true);
            models.add(entry);
        }
        return models;
    }
}
