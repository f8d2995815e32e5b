package com.fisheye.vision.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 存储上传通知，每条记录对应一个新上传的鱼眼帧
 */
@Data
public class TriggerRequest {
    private List<TriggerRecord> records = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TriggerRecord {
        private String bucket;
        private String key;
    }
}
