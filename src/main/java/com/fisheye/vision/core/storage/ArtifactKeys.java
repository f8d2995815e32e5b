package com.fisheye.vision.core.storage;

import com.fisheye.vision.core.projection.ViewDirection;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * 派生产物 key 的命名规则，纯字符串运算
 * <p>
 * 示例（输入 session1/frame.jpg）：
 * - 北向视角：session1/frame_N.jpg
 * - 旋转图：session1/frame_rotated.jpg
 * - 结果清单：session1/frame_results_20260127_143052.json
 */
public final class ArtifactKeys {

    public static final String ROTATED_SUFFIX = "rotated";
    private static final DateTimeFormatter MANIFEST_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private ArtifactKeys() {
    }

    /**
     * 在扩展名前插入 _suffix；无扩展名时直接追加
     */
    public static String withSuffix(String key, String suffix) {
        int dot = extensionIndex(key);
        if (dot < 0) {
            return key + "_" + suffix;
        }
        return key.substring(0, dot) + "_" + suffix + key.substring(dot);
    }

    /**
     * 替换扩展名；无扩展名时直接追加
     */
    public static String withExtension(String key, String extension) {
        int dot = extensionIndex(key);
        String base = dot < 0 ? key : key.substring(0, dot);
        return base + "." + extension;
    }

    public static String viewKey(String inputKey, ViewDirection direction) {
        return withSuffix(inputKey, direction.getCode());
    }

    public static String rotatedKey(String inputKey) {
        return withSuffix(inputKey, ROTATED_SUFFIX);
    }

    public static String manifestKey(String inputKey, Instant processedAt) {
        return withExtension(withSuffix(inputKey, "results_" + MANIFEST_TIMESTAMP.format(processedAt)), "json");
    }

    /**
     * 只在最后一个路径段中查找扩展名，忽略以点开头的文件名
     */
    private static int extensionIndex(String key) {
        int slash = key.lastIndexOf('/');
        int dot = key.lastIndexOf('.');
        if (dot <= slash + 1) {
            return -1;
        }
        return dot;
    }
}
