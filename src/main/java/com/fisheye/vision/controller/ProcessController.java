package com.fisheye.vision.controller;

import com.fisheye.vision.core.pipeline.ProcessingOrchestrator;
import com.fisheye.vision.core.pipeline.ProcessingResult;
import com.fisheye.vision.dto.ProcessRequestDto;
import com.fisheye.vision.dto.TriggerRequest;
import com.fisheye.vision.exception.PipelineException;
import com.fisheye.vision.service.TriggerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 鱼眼帧处理控制器
 */
@RestController
@RequestMapping("/api/process")
@Tag(name = "图像处理", description = "鱼眼展开、旋转与视觉分析")
public class ProcessController {
    private static final Logger logger = LoggerFactory.getLogger(ProcessController.class);

    @Autowired
    private ProcessingOrchestrator orchestrator;

    @Autowired
    private TriggerService triggerService;

    @PostMapping
    @Operation(
            summary = "处理单帧鱼眼图像",
            description = """
                    读取 input_reference 指向的鱼眼帧，按请求执行展开、旋转、分析，返回结果清单。

                    **请求示例**：
                    ```json
                    {
                      "input_reference": "local://inputs/session1/frame.jpg",
                      "unwarp": true,
                      "analyze": true,
                      "views_to_analyze": ["N", "S"],
                      "rotate": true,
                      "rotation_angle": 90
                    }
                    ```

                    **说明**：
                    - unwarp / analyze / rotate 至少选一个
                    - rotate 必须同时给出 rotation_angle（90 / 180 / 270）
                    - 单个视角分析失败记录在 analysis 中对应视角下，不影响其他视角
                    """
    )
    public ResponseEntity<?> process(@RequestBody ProcessRequestDto request) {
        try {
            ProcessingResult result = orchestrator.process(request.toProcessingRequest());
            return ResponseEntity.ok(result);
        } catch (PipelineException | IllegalArgumentException e) {
            logger.warn("Process request for {} rejected: {}", request.getInputReference(), e.getMessage());
            return ErrorResponses.of(e);
        } catch (Exception e) {
            logger.error("Process request for {} failed", request.getInputReference(), e);
            return ErrorResponses.of(e);
        }
    }

    @PostMapping("/trigger")
    @Operation(
            summary = "处理上传通知",
            description = "按配置中的 trigger 默认参数逐条处理新上传的鱼眼帧，单条失败不影响其他记录"
    )
    public ResponseEntity<Map<String, Object>> trigger(@RequestBody TriggerRequest request) {
        return ResponseEntity.ok(triggerService.handle(request));
    }
}
