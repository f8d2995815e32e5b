package com.fisheye.vision.controller;

import com.fisheye.vision.config.YamlConfig;
import com.fisheye.vision.core.analysis.VisionModel;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 视觉模型目录
 */
@RestController
@RequestMapping("/api/models")
@Tag(name = "模型目录", description = "可用的视觉大模型")
public class ModelController {

    @Autowired
    private YamlConfig yamlConfig;

    @GetMapping
    @Operation(summary = "列出可用模型", description = "返回支持图像输入的模型列表及默认模型")
    public ResponseEntity<Map<String, Object>> listModels() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("models", VisionModel.describeAll());
        response.put("default", yamlConfig.getAnalysis().getModel());
        return ResponseEntity.ok(response);
    }
}
