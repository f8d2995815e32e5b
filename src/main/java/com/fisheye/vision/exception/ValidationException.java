package com.fisheye.vision.exception;

/**
 * 请求校验失败（缺少处理模式、旋转角度非法、未知视角等）
 * 致命错误，不重试
 */
public class ValidationException extends PipelineException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorType() {
        return "validation_error";
    }
}
