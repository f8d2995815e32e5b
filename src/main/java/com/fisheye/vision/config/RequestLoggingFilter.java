package com.fisheye.vision.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_REQUEST_BODY = 1000;
    private static final int MAX_RESPONSE_BODY = 5000;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String path = request.getRequestURI();

        // 图片产物直接放行，不缓存二进制内容
        if (path.startsWith("/api/artifacts/")) {
            filterChain.doFilter(request, response);
            return;
        }

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        long startTime = System.currentTimeMillis();

        try {
            logger.info("=== Incoming Request ===");
            logger.info("Method: {} {}", request.getMethod(), path);
            filterChain.doFilter(requestWrapper, responseWrapper);
        } finally {
            long duration = System.currentTimeMillis() - startTime;

            if (request.getMethod().equalsIgnoreCase("POST") || request.getMethod().equalsIgnoreCase("PUT")) {
                byte[] content = requestWrapper.getContentAsByteArray();
                if (content.length > 0) {
                    String body = new String(content, StandardCharsets.UTF_8);
                    if (body.length() > MAX_REQUEST_BODY) {
                        body = body.substring(0, MAX_REQUEST_BODY) + "...";
                    }
                    logger.info("Request Body: {}", body);
                }
            }

            byte[] responseContent = responseWrapper.getContentAsByteArray();
            String contentType = response.getContentType();
            if (responseContent.length > 0 && responseContent.length < MAX_RESPONSE_BODY
                    && contentType != null && (contentType.contains("json") || contentType.contains("text"))) {
                logger.info("Response Body: {}", new String(responseContent, StandardCharsets.UTF_8));
            }

            // 必须回写，否则客户端收不到响应体
            responseWrapper.copyBodyToResponse();

            logger.info("Duration: {} ms | Status: {}", duration, response.getStatus());
            logger.info("======================");
        }
    }
}
