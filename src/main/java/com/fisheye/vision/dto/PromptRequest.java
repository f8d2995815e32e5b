package com.fisheye.vision.dto;

import lombok.Data;

/**
 * 新建或推送提示词
 */
@Data
public class PromptRequest {
    private String name;
    private String content;
}
