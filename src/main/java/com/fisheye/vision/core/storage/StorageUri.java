package com.fisheye.vision.core.storage;

import lombok.EqualsAndHashCode;

/**
 * 存储地址 scheme://bucket/key
 * <p>
 * key 为空时表示前缀（例如输出目录 local://outputs/）
 */
@EqualsAndHashCode
public final class StorageUri {
    private static final String SEPARATOR = "://";

    private final String scheme;
    private final String bucket;
    private final String key;

    public StorageUri(String scheme, String bucket, String key) {
        if (scheme == null || scheme.isBlank()) {
            throw new IllegalArgumentException("Storage scheme cannot be empty");
        }
        if (bucket == null || bucket.isBlank() || bucket.contains("/")) {
            throw new IllegalArgumentException("Invalid storage bucket: " + bucket);
        }
        this.scheme = scheme;
        this.bucket = bucket;
        this.key = key == null ? "" : stripLeadingSlashes(key);
    }

    /**
     * 解析对象地址，key 不能为空
     */
    public static StorageUri parse(String uri) {
        StorageUri parsed = parsePrefix(uri);
        if (parsed.key.isEmpty() || parsed.key.endsWith("/")) {
            throw new IllegalArgumentException("Storage URI does not name an object: " + uri);
        }
        return parsed;
    }

    /**
     * 解析前缀地址，允许 key 为空
     */
    public static StorageUri parsePrefix(String uri) {
        if (uri == null) {
            throw new IllegalArgumentException("Storage URI cannot be null");
        }
        int sep = uri.indexOf(SEPARATOR);
        if (sep <= 0) {
            throw new IllegalArgumentException("Invalid storage URI: " + uri);
        }
        String scheme = uri.substring(0, sep);
        String path = uri.substring(sep + SEPARATOR.length());
        int slash = path.indexOf('/');
        String bucket = slash < 0 ? path : path.substring(0, slash);
        String key = slash < 0 ? "" : path.substring(slash + 1);
        if (bucket.isEmpty()) {
            throw new IllegalArgumentException("Invalid storage URI: " + uri);
        }
        return new StorageUri(scheme, bucket, key);
    }

    /**
     * 在当前前缀下拼接相对 key
     */
    public StorageUri resolve(String relativeKey) {
        String child = stripLeadingSlashes(relativeKey);
        if (key.isEmpty()) {
            return new StorageUri(scheme, bucket, child);
        }
        String base = key.endsWith("/") ? key : key + "/";
        return new StorageUri(scheme, bucket, base + child);
    }

    private static String stripLeadingSlashes(String value) {
        int i = 0;
        while (i < value.length() && value.charAt(i) == '/') {
            i++;
        }
        return value.substring(i);
    }

    public String getScheme() { return scheme; }
    public String getBucket() { return bucket; }
    public String getKey() { return key; }

    @Override
    public String toString() {
        return scheme + SEPARATOR + bucket + "/" + key;
    }
}
