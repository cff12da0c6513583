package com.vtb.triage.discovery;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Загрузка бинарников инструментов по HTTPS.
 * Обычный HTTP разрешён только для loopback-адресов.
 */
@Slf4j
public class ToolDownloader {
    
    private final OkHttpClient httpClient;
    
    public ToolDownloader(Duration timeout) {
        long seconds = Math.max(1, timeout.getSeconds());
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(seconds, TimeUnit.SECONDS)
            .readTimeout(seconds, TimeUnit.SECONDS)
            .writeTimeout(seconds, TimeUnit.SECONDS)
            .callTimeout(seconds, TimeUnit.SECONDS)
            .followRedirects(true)
            .retryOnConnectionFailure(false)
            .build();
    }
    
    public void download(String url, Path destination) throws IOException {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IOException("Некорректный URL загрузки: " + url);
        }
        if (!parsed.isHttps() && !isLoopback(parsed.host())) {
            throw new IOException("Разрешены только HTTPS-загрузки: " + url);
        }
        
        log.info("Загрузка {}", url);
        Request request = new Request.Builder().url(parsed).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " при загрузке " + url);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Пустой ответ при загрузке " + url);
            }
            try (InputStream in = body.byteStream()) {
                Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }
    
    private static boolean isLoopback(String host) {
        return "localhost".equalsIgnoreCase(host) || "127.0.0.1".equals(host) || "::1".equals(host);
    }
}
