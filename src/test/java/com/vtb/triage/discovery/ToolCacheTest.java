package com.vtb.triage.discovery;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ToolCacheTest {
    
    private static final byte[] CONTENT = "#!/bin/sh\necho semgrep\n".getBytes(StandardCharsets.UTF_8);
    
    @TempDir
    Path root;
    
    @Test
    void concurrentInstallsWriteOnce() throws Exception {
        ToolCache cache = new ToolCache(root);
        String sha = CacheDownloadStrategyTest.sha256(CONTENT);
        AtomicInteger writes = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        
        try {
            List<Future<Path>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                Callable<Path> install = () -> {
                    start.await();
                    return cache.install("semgrep", "1.45.0", sha, temp -> {
                        writes.incrementAndGet();
                        Files.write(temp, CONTENT);
                    });
                };
                futures.add(executor.submit(install));
            }
            start.countDown();
            
            HashSet<Path> paths = new HashSet<>();
            for (Future<Path> future : futures) {
                paths.add(future.get(10, TimeUnit.SECONDS));
            }
            
            assertEquals(1, writes.get(), "Загрузка должна выполниться один раз");
            assertEquals(1, paths.size());
            assertArrayEquals(CONTENT, Files.readAllBytes(cache.entryPath("semgrep", "1.45.0")));
        } finally {
            executor.shutdownNow();
        }
    }
    
    @Test
    void listCachedReportsNameAndVersion() throws Exception {
        ToolCache cache = new ToolCache(root);
        String sha = CacheDownloadStrategyTest.sha256(CONTENT);
        cache.install("semgrep", "1.45.0", sha, temp -> Files.write(temp, CONTENT));
        cache.install("semgrep", "1.50.0", sha, temp -> Files.write(temp, CONTENT));
        
        List<ToolCache.CachedTool> cached = cache.listCached();
        
        assertEquals(2, cached.size());
        assertTrue(cached.stream().allMatch(t -> t.name().equals("semgrep")));
        assertEquals(2L * CONTENT.length, cache.sizeBytes());
    }
    
    @Test
    void emptyCacheHasNothing() throws Exception {
        ToolCache cache = new ToolCache(root.resolve("missing"));
        
        assertTrue(cache.listCached().isEmpty());
        assertEquals(0, cache.sizeBytes());
        assertTrue(cache.lookup("bandit", "1.7.5").isEmpty());
    }
}
