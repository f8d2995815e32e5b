package com.fisheye.vision.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetrySupportTest {

    @Test
    void retriesUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        String result = RetrySupport.execute("flaky", 3, 1, e -> e instanceof IOException, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("transient");
            }
            return "ok";
        });
        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void stopsAtMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        IOException e = assertThrows(IOException.class, () ->
                RetrySupport.execute("always failing", 2, 1, ex -> true, () -> {
                    calls.incrementAndGet();
                    throw new IOException("down");
                }));
        assertEquals("down", e.getMessage());
        assertEquals(2, calls.get());
    }

    @Test
    void nonRetryableFailsImmediately() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(IllegalStateException.class, () ->
                RetrySupport.execute("fatal", 5, 1, ex -> ex instanceof IOException, () -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("fatal");
                }));
        assertEquals(1, calls.get());
    }

    @Test
    void backoffDoubles() {
        assertEquals(500, RetrySupport.backoffDelay(500, 1));
        assertEquals(1000, RetrySupport.backoffDelay(500, 2));
        assertEquals(2000, RetrySupport.backoffDelay(500, 3));
        assertEquals(0, RetrySupport.backoffDelay(-5, 2));
    }
}
