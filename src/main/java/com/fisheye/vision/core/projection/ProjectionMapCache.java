package com.fisheye.vision.core.projection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * 进程级映射表缓存
 * <p>
 * 键为 (ViewSpec, 源宽, 源高)，条目构建后不可变且永不失效。
 * 未命中时在锁外构建，并发竞争时以先写入者为准，重复计算是允许的
 */
public class ProjectionMapCache {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionMapCache.class);

    private final ConcurrentMap<ProjectionKey, ProjectionMap> maps = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ProjectionMap getOrBuild(ProjectionKey key, Function<ProjectionKey, ProjectionMap> builder) {
        ProjectionMap cached = maps.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        ProjectionMap built = builder.apply(key);
        ProjectionMap existing = maps.putIfAbsent(key, built);
        if (existing != null) {
            logger.debug("Projection map for {} was built concurrently, keeping first entry", key.getViewSpec());
            return existing;
        }
        logger.info("Cached projection map for {} ({}x{} source), cache size: {}",
                key.getViewSpec().getDirection(), key.getSourceWidth(), key.getSourceHeight(), maps.size());
        return built;
    }

    /**
     * 预置条目（测试或预热用），已存在时保持原值
     */
    public void preload(ProjectionMap map) {
        ProjectionKey key = new ProjectionKey(map.getViewSpec(), map.getSourceWidth(), map.getSourceHeight());
        maps.putIfAbsent(key, map);
    }

    public boolean contains(ProjectionKey key) {
        return maps.containsKey(key);
    }

    public int size() { return maps.size(); }
    public long getHitCount() { return hits.get(); }
    public long getMissCount() { return misses.get(); }
}
