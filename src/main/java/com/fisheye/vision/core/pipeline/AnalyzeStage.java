package com.fisheye.vision.core.pipeline;

import com.fisheye.vision.core.analysis.AnalysisResult;
import com.fisheye.vision.core.analysis.VisionAnalysisClient;
import com.fisheye.vision.core.projection.ViewDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 分析阶段：各视角并发调用视觉服务
 * <p>
 * 每个任务自行把异常转换为失败结果，互不影响；
 * 每个视角的期限从该视角的调用真正开始时计时，在共享线程池中排队的时间不计入，
 * 超过期限仍未完成的任务被取消并记为超时，不会拖慢其他视角或其他请求
 */
public class AnalyzeStage {
    private static final Logger logger = LoggerFactory.getLogger(AnalyzeStage.class);
    private static final long START_POLL_MILLIS = 50;

    private final VisionAnalysisClient client;
    private final ExecutorService executor;
    private final Duration viewTimeout;

    public AnalyzeStage(VisionAnalysisClient client, ExecutorService executor, Duration viewTimeout) {
        this.client = client;
        this.executor = executor;
        this.viewTimeout = viewTimeout;
    }

    public Map<ViewDirection, AnalysisResult> run(Map<ViewDirection, byte[]> images, String prompt, String model) {
        Map<ViewDirection, ViewTask> tasks = new LinkedHashMap<>();
        for (Map.Entry<ViewDirection, byte[]> entry : images.entrySet()) {
            ViewDirection direction = entry.getKey();
            byte[] jpeg = entry.getValue();
            ViewTask task = new ViewTask();
            try {
                task.future = executor.submit(() -> {
                    task.started.complete(System.nanoTime());
                    return analyzeOne(direction, jpeg, prompt, model);
                });
            } catch (RejectedExecutionException e) {
                logger.error("Analysis of view {} rejected by executor", direction.getCode(), e);
                task.rejected = true;
            }
            tasks.put(direction, task);
        }

        Map<ViewDirection, AnalysisResult> results = new LinkedHashMap<>();
        boolean interrupted = false;
        for (Map.Entry<ViewDirection, ViewTask> entry : tasks.entrySet()) {
            ViewDirection direction = entry.getKey();
            ViewTask task = entry.getValue();
            if (task.rejected) {
                results.put(direction, AnalysisResult.failure("Analysis rejected: executor unavailable"));
            } else if (interrupted) {
                task.future.cancel(true);
                results.put(direction, AnalysisResult.failure("Analysis cancelled"));
            } else {
                try {
                    results.put(direction, collect(direction, task));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    logger.warn("Analysis of {} views interrupted", tasks.size());
                    task.future.cancel(true);
                    results.put(direction, AnalysisResult.failure("Analysis cancelled"));
                }
            }
        }
        return Collections.unmodifiableMap(results);
    }

    private AnalysisResult analyzeOne(ViewDirection direction, byte[] jpeg, String prompt, String model) {
        try {
            AnalysisResult result = client.analyze(jpeg, prompt, model);
            if (result == null) {
                return AnalysisResult.failure("Vision service returned no result");
            }
            if (!result.isSuccess()) {
                logger.warn("Analysis of view {} failed: {}", direction.getCode(), result.getError());
            }
            return result;
        } catch (Exception e) {
            logger.error("Analysis of view {} threw an exception", direction.getCode(), e);
            return AnalysisResult.failure("Analysis failed: " + e.getMessage());
        }
    }

    /**
     * 等待任务开始执行，再按其开始时间计算剩余期限
     */
    private AnalysisResult collect(ViewDirection direction, ViewTask task) throws InterruptedException {
        Long startedAt = awaitStart(task);
        if (startedAt == null) {
            return AnalysisResult.failure("Analysis cancelled before it started");
        }
        long remaining = startedAt + viewTimeout.toNanos() - System.nanoTime();
        try {
            return task.future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            task.future.cancel(true);
            logger.warn("Analysis of view {} timed out after {} ms", direction.getCode(), viewTimeout.toMillis());
            return AnalysisResult.failure("Analysis timed out after " + viewTimeout.toMillis() + " ms");
        } catch (CancellationException e) {
            return AnalysisResult.failure("Analysis cancelled");
        } catch (ExecutionException e) {
            return AnalysisResult.failure("Analysis failed: " + e.getCause().getMessage());
        }
    }

    /**
     * 返回任务开始执行的时刻（nanoTime）；任务已被取消或线程池已终止而不会再执行时返回 null
     */
    private Long awaitStart(ViewTask task) throws InterruptedException {
        while (true) {
            try {
                return task.started.get(START_POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if ((task.future.isDone() || executor.isTerminated()) && !task.started.isDone()) {
                    return null;
                }
            } catch (ExecutionException e) {
                return null;
            }
        }
    }

    private static final class ViewTask {
        private final CompletableFuture<Long> started = new CompletableFuture<>();
        private Future<AnalysisResult> future;
        private boolean rejected;
    }
}
