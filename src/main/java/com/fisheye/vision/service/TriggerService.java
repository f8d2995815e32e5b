package com.fisheye.vision.service;

import com.fisheye.vision.config.YamlConfig;
import com.fisheye.vision.core.pipeline.ProcessingOrchestrator;
import com.fisheye.vision.core.pipeline.ProcessingRequest;
import com.fisheye.vision.core.pipeline.ProcessingResult;
import com.fisheye.vision.core.storage.StorageUri;
import com.fisheye.vision.dto.TriggerRequest;
import com.fisheye.vision.exception.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 上传通知处理
 * <p>
 * 每条记录按配置中的 trigger 默认参数处理，单条失败只记录在该条结果中
 */
@Service
public class TriggerService {
    private static final Logger logger = LoggerFactory.getLogger(TriggerService.class);

    @Autowired
    private ProcessingOrchestrator orchestrator;

    @Autowired
    private YamlConfig config;

    public Map<String, Object> handle(TriggerRequest request) {
        List<Map<String, Object>> results = new ArrayList<>();
        List<TriggerRequest.TriggerRecord> records = request == null || request.getRecords() == null
                ? new ArrayList<>() : request.getRecords();
        for (TriggerRequest.TriggerRecord record : records) {
            results.add(handleRecord(record));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("processed", results.size());
        response.put("results", results);
        return response;
    }

    private Map<String, Object> handleRecord(TriggerRequest.TriggerRecord record) {
        Map<String, Object> item = new LinkedHashMap<>();
        try {
            String input = new StorageUri(config.getTrigger().getScheme(), record.getBucket(), record.getKey()).toString();
            item.put("input_reference", input);
            logger.info("Upload notification for {}", input);
            ProcessingResult result = orchestrator.process(toRequest(input));
            item.put("status", "success");
            item.put("result", result);
        } catch (PipelineException e) {
            logger.warn("Upload notification for {}/{} failed: {}", record.getBucket(), record.getKey(), e.getMessage());
            item.put("status", "error");
            item.put("type", e.getErrorType());
            item.put("message", e.getMessage());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid upload notification {}/{}: {}", record.getBucket(), record.getKey(), e.getMessage());
            item.put("status", "error");
            item.put("type", "validation_error");
            item.put("message", e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Upload notification for {}/{} failed", record.getBucket(), record.getKey(), e);
            item.put("status", "error");
            item.put("type", "internal_error");
            item.put("message", e.getMessage());
        }
        return item;
    }

    private ProcessingRequest toRequest(String input) {
        YamlConfig.TriggerConfig trigger = config.getTrigger();
        return ProcessingRequest.builder()
                .inputReference(input)
                .unwarp(trigger.isUnwarp())
                .analyze(trigger.isAnalyze())
                .rotate(trigger.isRotate())
                .rotationAngle(trigger.getRotationAngle())
                .viewsToAnalyze(trigger.getViewsToAnalyze())
                .outputLocation(trigger.getOutputLocation())
                .resultsLocation(trigger.getResultsLocation())
                .build();
    }
}
