package com.vtb.triage.adapters;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Запуск внешнего инструмента с тайм-аутом.
 * stdout и stderr вычитываются параллельно, чтобы процесс не блокировался на полном буфере.
 */
@Slf4j
public class ProcessRunner {
    
    /**
     * Результат завершившегося процесса
     */
    public record Result(int exitCode, String stdout, String stderr) {
    }
    
    private static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);
    
    /** Сколько ждать дочитывания потоков после выхода процесса */
    private final Duration drainTimeout;
    
    public ProcessRunner() {
        this(DEFAULT_DRAIN_TIMEOUT);
    }
    
    public ProcessRunner(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }
    
    /**
     * @throws AdapterParseException процесс завершился, но его вывод не дочитан
     *                               (поток держит открытым порождённый процесс)
     */
    public Result run(List<String> command, Duration timeout, Path workingDir)
            throws AdapterTimeoutException, AdapterExecutionException, AdapterParseException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        
        log.debug("Запуск: {}", String.join(" ", command));
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new AdapterExecutionException("Не удалось запустить " + command.get(0) + ": " + e.getMessage(), e);
        }
        
        StreamCollector stdout = new StreamCollector(process.getInputStream(), "stdout");
        StreamCollector stderr = new StreamCollector(process.getErrorStream(), "stderr");
        stdout.start();
        stderr.start();
        
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                killQuietly(process);
                throw new AdapterTimeoutException(command.get(0) + " не завершился за " + timeout.toSeconds() + " с");
            }
            stdout.join(drainTimeout.toMillis());
            stderr.join(drainTimeout.toMillis());
            if (stdout.isAlive()) {
                stdout.abandon();
                stderr.abandon();
                throw new AdapterParseException(command.get(0) + ": stdout не закрыт через "
                    + drainTimeout.toMillis() + " мс после выхода, вывод мог быть обрезан");
            }
            if (stderr.isAlive()) {
                stderr.abandon();
                log.debug("{}: stderr не дочитан, используется накопленное", command.get(0));
            }
            return new Result(process.exitValue(), stdout.content(), stderr.content());
        } catch (InterruptedException e) {
            killQuietly(process);
            Thread.currentThread().interrupt();
            throw new AdapterTimeoutException(command.get(0) + " прерван по бюджету запуска", e);
        }
    }
    
    private static void killQuietly(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
    
    private static final class StreamCollector extends Thread {
        private final InputStream stream;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        
        StreamCollector(InputStream stream, String label) {
            super("process-" + label);
            this.stream = stream;
            setDaemon(true);
        }
        
        @Override
        public void run() {
            try (InputStream in = stream) {
                in.transferTo(buffer);
            } catch (IOException e) {
                log.debug("Поток {} закрыт: {}", getName(), e.getMessage());
            }
        }
        
        void abandon() {
            try {
                stream.close();
            } catch (IOException e) {
                log.debug("Поток {} не закрыт: {}", getName(), e.getMessage());
            }
        }
        
        String content() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
