package com.fisheye.vision.exception;

/**
 * 处理流水线异常基类
 * <p>
 * 所有请求级致命错误都继承自该类，控制器据此映射 HTTP 状态码
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 错误类型标识，写入错误响应的 type 字段
     */
    public abstract String getErrorType();
}
