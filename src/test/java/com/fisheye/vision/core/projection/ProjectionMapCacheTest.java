package com.fisheye.vision.core.projection;

import com.fisheye.vision.config.NativeLibraryLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionMapCacheTest {

    private final ProjectionMapBuilder builder = new ProjectionMapBuilder(FisheyeLens.defaultLens());

    @BeforeAll
    static void loadOpenCV() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Test
    void buildsOncePerKey() {
        ProjectionMapCache cache = new ProjectionMapCache();
        AtomicInteger builds = new AtomicInteger();
        ProjectionKey key = new ProjectionKey(new ViewSpec(ViewDirection.NORTH, 90, 45, 32, 24), 640, 480);

        ProjectionMap first = cache.getOrBuild(key, k -> {
            builds.incrementAndGet();
            return builder.build(k);
        });
        ProjectionMap second = cache.getOrBuild(key, k -> {
            builds.incrementAndGet();
            return builder.build(k);
        });

        assertSame(first, second);
        assertEquals(1, builds.get());
        assertEquals(1, cache.getHitCount());
        assertEquals(1, cache.getMissCount());
    }

    @Test
    void differentResolutionsAreSeparateEntries() {
        ProjectionMapCache cache = new ProjectionMapCache();
        ViewSpec spec = new ViewSpec(ViewDirection.EAST, 90, 45, 16, 16);
        cache.getOrBuild(new ProjectionKey(spec, 640, 480), builder::build);
        cache.getOrBuild(new ProjectionKey(spec, 800, 600), builder::build);
        assertEquals(2, cache.size());
    }

    @Test
    void concurrentCallersSeeTheSameEntry() throws Exception {
        ProjectionMapCache cache = new ProjectionMapCache();
        ProjectionKey key = new ProjectionKey(new ViewSpec(ViewDirection.SOUTH, 90, 45, 32, 32), 500, 500);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<ProjectionMap>> tasks = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                tasks.add(() -> cache.getOrBuild(key, builder::build));
            }
            List<Future<ProjectionMap>> futures = pool.invokeAll(tasks);
            ProjectionMap expected = futures.get(0).get();
            for (Future<ProjectionMap> future : futures) {
                assertSame(expected, future.get());
            }
            assertEquals(1, cache.size());
        } finally {
            pool.shutdownNow();
        }
    }
}
