package com.example.ttsgateway.service.backend.espeak;

import com.example.ttsgateway.config.EspeakProperties;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

class ProcessEspeakRunner implements EspeakRunner {

    private final EspeakProperties properties;
    private final Semaphore processSemaphore;

    ProcessEspeakRunner(EspeakProperties properties) {
        this.properties = properties;
        this.processSemaphore = createSemaphore(properties.getConcurrencyMaxProcesses());
    }

    @Override
    public byte[] run(List<String> args, byte[] stdin) {
        boolean acquired = false;
        Process process = null;
        Thread stdoutThread = null;
        Thread stderrThread = null;
        try {
            acquired = acquirePermit();
            List<String> command = new ArrayList<>(args.size() + 1);
            command.add(properties.getExecutable());
            command.addAll(args);
            process = new ProcessBuilder(command).start();

            StreamCapture stdout = new StreamCapture(process.getInputStream(), Integer.MAX_VALUE);
            StreamCapture stderr = new StreamCapture(process.getErrorStream(), properties.getMaxStderrBytes());
            stdoutThread = startDaemon("espeak-stdout", stdout::readToEnd);
            stderrThread = startDaemon("espeak-stderr", stderr::readToEnd);

            try (OutputStream in = process.getOutputStream()) {
                if (stdin != null) {
                    in.write(stdin);
                }
            }

            boolean finished = process.waitFor(properties.getTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(2, TimeUnit.SECONDS);
                joinQuietly(stdoutThread);
                joinQuietly(stderrThread);
                throw new EspeakException("espeak timed out: " + sanitize(stderr.asString()));
            }

            stdoutThread.join();
            joinQuietly(stderrThread);
            if (process.exitValue() != 0) {
                throw new EspeakException("espeak exited with " + process.exitValue() + ": " + sanitize(stderr.asString()));
            }
            return stdout.bytes();
        } catch (InterruptedException ex) {
            destroy(process, stdoutThread, stderrThread);
            Thread.currentThread().interrupt();
            throw new EspeakException("espeak interrupted", ex);
        } catch (IOException ex) {
            destroy(process, stdoutThread, stderrThread);
            if (isMissingExecutable(ex)) {
                throw new EspeakException("espeak executable not found: " + properties.getExecutable(), ex);
            }
            throw new EspeakException("espeak I/O failure: " + ex.getMessage(), ex);
        } finally {
            if (acquired) {
                processSemaphore.release();
            }
        }
    }

    private boolean acquirePermit() throws InterruptedException {
        if (processSemaphore == null) {
            return false;
        }
        processSemaphore.acquire();
        return true;
    }

    private static Semaphore createSemaphore(Integer maxProcesses) {
        if (maxProcesses == null || maxProcesses < 1) {
            return null;
        }
        return new Semaphore(maxProcesses);
    }

    private static Thread startDaemon(String name, Runnable task) {
        Thread thread = new Thread(task, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void destroy(Process process, Thread stdoutThread, Thread stderrThread) {
        if (process == null) {
            return;
        }
        process.destroyForcibly();
        if (stdoutThread != null) {
            joinQuietly(stdoutThread);
        }
        if (stderrThread != null) {
            joinQuietly(stderrThread);
        }
    }

    private static void joinQuietly(Thread thread) {
        try {
            thread.join(1000);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static String sanitize(String value) {
        String singleLine = value.trim().replaceAll("\\s+", " ");
        return singleLine.length() <= 240 ? singleLine : singleLine.substring(0, 240);
    }

    private static boolean isMissingExecutable(IOException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("error=2")
                || normalized.contains("no such file")
                || normalized.contains("cannot find the file");
    }

    private static final class StreamCapture {

        private final InputStream inputStream;
        private final int maxBytes;
        private final ByteArrayOutputStream output = new ByteArrayOutputStream();

        private StreamCapture(InputStream inputStream, int maxBytes) {
            this.inputStream = inputStream;
            this.maxBytes = Math.max(1, maxBytes);
        }

        private void readToEnd() {
            byte[] buffer = new byte[8192];
            int read;
            try {
                while ((read = inputStream.read(buffer)) >= 0) {
                    int available = maxBytes - output.size();
                    if (available <= 0) {
                        continue;
                    }
                    output.write(buffer, 0, Math.min(available, read));
                }
            } catch (IOException ignored) {
                // stream closed by a killed process; keep what was captured
            }
        }

        private synchronized byte[] bytes() {
            return output.toByteArray();
        }

        private synchronized String asString() {
            return output.toString(StandardCharsets.UTF_8);
        }
    }
}
