package com.fisheye.vision.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fisheyeVisionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Fisheye Vision System API")
                        .description("""
                                鱼眼图像处理与视觉分析 API 文档

                                ## 功能概述

                                输入一张鱼眼帧，生成多个方向的透视视图，可选旋转原图，
                                并调用视觉大模型分析各视图，最终输出结果清单（manifest）。

                                ### 视角说明
                                | 代码 | 方向 | 说明 |
                                |------|------|------|
                                | `N` | 北 | 偏航 0° |
                                | `E` | 东 | 偏航 90° |
                                | `S` | 南 | 偏航 180° |
                                | `W` | 西 | 偏航 -90° |
                                | `B` | 下 | 沿光轴正视，输出为正方形 |

                                ### 存储地址
                                所有图像和清单以 `scheme://bucket/key` 寻址，例如 `local://inputs/session1/frame.jpg`。

                                ### 错误响应格式
                                ```json
                                {
                                  "status": "error",
                                  "type": "validation_error | not_found | transient_error | internal_error",
                                  "message": "错误信息"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Fisheye Vision Team"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为 POST 接口补充统一的错误响应说明
     */
    @Bean
    public OpenApiCustomizer errorResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().addApiResponse("400", createErrorResponse("请求参数错误"));
                pathItem.getPost().getResponses().addApiResponse("500", createErrorResponse("服务内部错误"));
            }
        });
    }

    private ApiResponse createErrorResponse(String description) {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "type", new Schema<>().type("string").description("错误类型").example("validation_error"),
                "message", new Schema<>().type("string").description("错误信息")
        ));

        return new ApiResponse()
                .description(description)
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
