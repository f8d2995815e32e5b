package com.fisheye.vision.core.analysis;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.lang.reflect.Type;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模型回复解析
 * <p>
 * 原文作为 text 保留；若包含 ```json 代码块（或整段就是 JSON 对象），解析为结构化 data
 */
public final class AnalysisResponseParser {

    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*(.*?)```",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() { }.getType();
    private static final Gson GSON = new Gson();

    private AnalysisResponseParser() {
    }

    public static AnalysisResult parse(String content) {
        if (content == null || content.isBlank()) {
            return AnalysisResult.failure("Vision service returned an empty response");
        }
        return AnalysisResult.success(content, extractData(content));
    }

    static Map<String, Object> extractData(String content) {
        String candidate = null;
        Matcher matcher = FENCED_JSON.matcher(content);
        if (matcher.find()) {
            candidate = matcher.group(1).trim();
        } else {
            String trimmed = content.trim();
            if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
                candidate = trimmed;
            }
        }
        if (candidate == null || !candidate.startsWith("{")) {
            return null;
        }
        try {
            return GSON.fromJson(candidate, MAP_TYPE);
        } catch (JsonParseException e) {
            return null;
        }
    }
}
