package com.fisheye.vision.core.analysis;

/**
 * 视觉服务返回的错误
 * <p>
 * 408 / 429 / 5xx 视为临时故障可重试；认证、参数错误以及无法解析的响应不重试
 */
public class VisionServiceException extends RuntimeException {
    private final int statusCode;
    private final boolean retryable;

    public VisionServiceException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = isRetryableStatus(statusCode);
    }

    public VisionServiceException(String message) {
        super(message);
        this.statusCode = -1;
        this.retryable = false;
    }

    public static boolean isRetryableStatus(int statusCode) {
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }

    public int getStatusCode() { return statusCode; }
    public boolean isRetryable() { return retryable; }
}
