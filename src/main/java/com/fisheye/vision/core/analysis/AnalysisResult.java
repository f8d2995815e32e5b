package com.fisheye.vision.core.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个视角的分析结果：成功时 text 非空，失败时 error 非空
 * <p>
 * data 为模型回复中 JSON 代码块解析出的结构化内容（可为 null）
 */
public final class AnalysisResult {
    private final String text;
    private final String error;
    private final Map<String, Object> data;

    private AnalysisResult(String text, String error, Map<String, Object> data) {
        this.text = text;
        this.error = error;
        this.data = data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static AnalysisResult success(String text, Map<String, Object> data) {
        return new AnalysisResult(text, null, data);
    }

    public static AnalysisResult success(String text) {
        return new AnalysisResult(text, null, null);
    }

    public static AnalysisResult failure(String error) {
        return new AnalysisResult(null, error == null ? "Unknown analysis error" : error, null);
    }

    @JsonProperty("text")
    public String getText() { return text; }

    @JsonProperty("error")
    public String getError() { return error; }

    @JsonProperty("data")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Map<String, Object> getData() { return data; }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "AnalysisResult{text=" + abbreviate(text) + '}' : "AnalysisResult{error=" + error + '}';
    }

    private static String abbreviate(String value) {
        if (value == null || value.length() <= 80) {
            return value;
        }
        return value.substring(0, 80) + "...";
    }
}
