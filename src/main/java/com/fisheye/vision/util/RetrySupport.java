package com.fisheye.vision.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * 有界指数退避重试
 * <p>
 * 第 n 次失败后等待 backoffMillis * 2^(n-1) 毫秒；不可重试的异常或线程被中断时立即抛出
 */
public final class RetrySupport {
    private static final Logger logger = LoggerFactory.getLogger(RetrySupport.class);

    // 退避指数上限，防止位移溢出
    private static final int MAX_BACKOFF_SHIFT = 16;

    private RetrySupport() {
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws Exception;
    }

    public static <T> T execute(String operation, int maxAttempts, long backoffMillis,
                                Predicate<Exception> retryable, Attempt<T> attempt) throws Exception {
        int attempts = Math.max(1, maxAttempts);
        for (int i = 1; ; i++) {
            try {
                return attempt.run();
            } catch (Exception e) {
                if (i >= attempts || !retryable.test(e) || Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                long delay = backoffDelay(backoffMillis, i);
                logger.warn("{} failed (attempt {}/{}): {}. Retrying in {} ms",
                        operation, i, attempts, e.getMessage(), delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    /**
     * 第 attempt 次失败后的等待时间
     */
    public static long backoffDelay(long backoffMillis, int attempt) {
        int shift = Math.min(Math.max(attempt - 1, 0), MAX_BACKOFF_SHIFT);
        return Math.max(0, backoffMillis) << shift;
    }
}
