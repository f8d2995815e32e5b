package com.fisheye.vision.controller;

import com.fisheye.vision.dto.PromptRequest;
import com.fisheye.vision.service.PromptLibraryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 提示词版本管理
 */
@RestController
@RequestMapping("/api/prompts")
@Tag(name = "提示词管理", description = "提示词的查询、新建与版本推送")
public class PromptController {
    private static final Logger logger = LoggerFactory.getLogger(PromptController.class);

    @Autowired
    private PromptLibraryService promptLibrary;

    @GetMapping
    @Operation(summary = "列出提示词", description = "默认返回每个名称的最新版本；all=true 时返回所有版本")
    public ResponseEntity<Map<String, Object>> list(
            @Parameter(description = "是否列出所有版本")
            @RequestParam(defaultValue = "false") boolean all) {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("prompts", all ? promptLibrary.listPrompts() : promptLibrary.getPromptNames());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to list prompts", e);
            return ErrorResponses.of(e);
        }
    }

    @GetMapping("/{name}")
    @Operation(summary = "获取最新版本提示词")
    public ResponseEntity<Map<String, Object>> latest(@PathVariable String name) {
        return fetch(name, null);
    }

    @GetMapping("/{name}/{version}")
    @Operation(summary = "获取指定版本提示词")
    public ResponseEntity<Map<String, Object>> byVersion(@PathVariable String name, @PathVariable int version) {
        return fetch(name, version);
    }

    @PostMapping
    @Operation(
            summary = "新建或推送提示词",
            description = """
                    名称已存在时推送新版本（返回 200，action=pushed），
                    否则以版本 0 新建（返回 201，action=created）。

                    名称必须以字母开头，只能包含字母、数字和下划线。
                    """
    )
    public ResponseEntity<Map<String, Object>> save(@RequestBody PromptRequest request) {
        try {
            Map<String, Object> response = new HashMap<>(promptLibrary.save(request.getName(), request.getContent()));
            response.put("status", "success");
            HttpStatus status = "created".equals(response.get("action")) ? HttpStatus.CREATED : HttpStatus.OK;
            return ResponseEntity.status(status).body(response);
        } catch (Exception e) {
            logger.warn("Failed to save prompt {}: {}", request.getName(), e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    private ResponseEntity<Map<String, Object>> fetch(String name, Integer version) {
        try {
            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("name", name);
            if (version != null) {
                response.put("version", version);
            }
            response.put("content", promptLibrary.getPrompt(name, version));
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.warn("Failed to get prompt {} v{}: {}", name, version, e.getMessage());
            return ErrorResponses.of(e);
        }
    }
}
