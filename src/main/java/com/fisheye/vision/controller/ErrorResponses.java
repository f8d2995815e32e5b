package com.fisheye.vision.controller;

import com.fisheye.vision.exception.ArtifactNotFoundException;
import com.fisheye.vision.exception.PipelineException;
import com.fisheye.vision.exception.TransientStorageException;
import com.fisheye.vision.exception.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * 异常到错误响应的映射
 * <p>
 * ValidationException / IllegalArgumentException -> 400，
 * ArtifactNotFoundException -> 404，TransientStorageException -> 503，其余 -> 500
 */
final class ErrorResponses {

    private ErrorResponses() {
    }

    static HttpStatus statusOf(Exception e) {
        if (e instanceof ValidationException || e instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof ArtifactNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof TransientStorageException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static ResponseEntity<Map<String, Object>> of(Exception e) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("type", typeOf(e));
        response.put("message", e.getMessage());
        return ResponseEntity.status(statusOf(e)).body(response);
    }

    private static String typeOf(Exception e) {
        if (e instanceof PipelineException) {
            return ((PipelineException) e).getErrorType();
        }
        if (e instanceof IllegalArgumentException) {
            return "validation_error";
        }
        return "internal_error";
    }
}
