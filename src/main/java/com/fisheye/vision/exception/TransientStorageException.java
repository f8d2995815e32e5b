package com.fisheye.vision.exception;

/**
 * 存储读写的临时性故障，重试耗尽后抛出
 */
public class TransientStorageException extends PipelineException {

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorType() {
        return "transient_error";
    }
}
