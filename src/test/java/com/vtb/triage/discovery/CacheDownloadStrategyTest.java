package com.vtb.triage.discovery;

import com.sun.net.httpserver.HttpServer;
import com.vtb.triage.config.EngineConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class CacheDownloadStrategyTest {
    
    private static final byte[] TOOL_BODY = "#!/bin/sh\necho 'nuclei 3.1.0'\n".getBytes(StandardCharsets.UTF_8);
    
    @TempDir
    Path cacheDir;
    
    private HttpServer server;
    private String baseUrl;
    private final AtomicInteger downloads = new AtomicInteger();
    
    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/nuclei", exchange -> {
            downloads.incrementAndGet();
            exchange.sendResponseHeaders(200, TOOL_BODY.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(TOOL_BODY);
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }
    
    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }
    
    @Test
    void downloadsVerifiesAndCachesTool() throws Exception {
        ToolCache cache = new ToolCache(cacheDir);
        CacheDownloadStrategy strategy = strategy(cache, sha256(TOOL_BODY), false);
        
        Optional<ToolHandle> handle = strategy.find("nuclei", new ArrayList<>());
        
        assertTrue(handle.isPresent(), "Инструмент должен быть загружен");
        assertEquals("3.1.0", handle.get().getVersion());
        assertEquals(cache.entryPath("nuclei", "3.1.0"), handle.get().getPath());
        assertTrue(Files.isExecutable(handle.get().getPath()));
        
        assertTrue(strategy.find("nuclei", new ArrayList<>()).isPresent());
        assertEquals(1, downloads.get(), "Повторный поиск берёт инструмент из кэша");
        
        List<ToolCache.CachedTool> cached = cache.listCached();
        assertEquals(1, cached.size());
        assertEquals(TOOL_BODY.length, cache.sizeBytes());
    }
    
    @Test
    void checksumMismatchLeavesNoFiles() throws Exception {
        ToolCache cache = new ToolCache(cacheDir);
        CacheDownloadStrategy strategy = strategy(cache, "deadbeef", false);
        
        assertTrue(strategy.find("nuclei", new ArrayList<>()).isEmpty());
        assertTrue(cache.lookup("nuclei", "3.1.0").isEmpty());
        try (Stream<Path> files = Files.walk(cacheDir)) {
            assertTrue(files.noneMatch(Files::isRegularFile), "Временный файл должен быть удалён");
        }
    }
    
    @Test
    void offlineModeNeverDownloads() {
        CacheDownloadStrategy strategy = strategy(new ToolCache(cacheDir), sha256(TOOL_BODY), true);
        
        assertTrue(strategy.find("nuclei", new ArrayList<>()).isEmpty());
        assertEquals(0, downloads.get());
    }
    
    @Test
    void plainHttpToRemoteHostIsRejected() {
        ToolDownloader downloader = new ToolDownloader(Duration.ofSeconds(1));
        
        IOException error = assertThrows(IOException.class,
            () -> downloader.download("http://downloads.example.com/tool", cacheDir.resolve("tool")));
        assertTrue(error.getMessage().contains("HTTPS"));
    }
    
    private CacheDownloadStrategy strategy(ToolCache cache, String sha256, boolean offline) {
        EngineConfig.ToolSpec spec = new EngineConfig.ToolSpec();
        spec.setVersion("3.1.0");
        spec.setSha256(sha256);
        spec.setUrls(Map.of("any", baseUrl + "/nuclei?v={version}"));
        return new CacheDownloadStrategy(cache, new ToolDownloader(Duration.ofSeconds(5)),
            Map.of("nuclei", spec), offline);
    }
    
    static String sha256(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
