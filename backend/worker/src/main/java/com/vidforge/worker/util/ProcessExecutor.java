package com.vidforge.worker.util;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 외부 프로세스(FFmpeg) 실행 유틸리티
 * - 출력은 최대 1000줄까지만 보관
 * - 타임아웃 시 프로세스 강제 종료
 * - 실행 전 PathValidator 로 인자 검증
 */
@Slf4j
public final class ProcessExecutor {

    private static final int MAX_OUTPUT_LINES = 1000;

    private ProcessExecutor() {
    }

    @Getter
    @RequiredArgsConstructor
    public static class Result {
        private final int exitCode;
        private final String output;

        public boolean isSuccess() {
            return exitCode == 0;
        }

        public String outputTail(int maxChars) {
            return output.length() <= maxChars ? output : output.substring(output.length() - maxChars);
        }
    }

    public static Result execute(List<String> command, String taskName, long timeout, TimeUnit unit)
            throws IOException, InterruptedException, TimeoutException {

        String joined = String.join(" ", command);
        log.debug("[ProcessExecutor] Starting {}: {}", taskName, joined.substring(0, Math.min(200, joined.length())));

        PathValidator.validateCommandArgs(command);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        Process process = pb.start();

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineCount = 0;
            while ((line = reader.readLine()) != null) {
                if (lineCount < MAX_OUTPUT_LINES) {
                    output.append(line).append('\n');
                    lineCount++;
                }
            }
        }

        boolean completed = process.waitFor(timeout, unit);
        if (!completed) {
            process.destroyForcibly();
            log.error("[ProcessExecutor] {} TIMEOUT after {} {}", taskName, timeout, unit);
            throw new TimeoutException("Process timeout: " + taskName + " (" + timeout + " " + unit + ")");
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            log.warn("[ProcessExecutor] {} failed with exit code {}", taskName, exitCode);
        } else {
            log.debug("[ProcessExecutor] {} completed", taskName);
        }
        return new Result(exitCode, output.toString());
    }

    /**
     * 실행 후 종료 코드가 0 이 아니면 IOException
     */
    public static void executeOrThrow(List<String> command, String taskName, long timeout, TimeUnit unit)
            throws IOException, InterruptedException, TimeoutException {
        Result result = execute(command, taskName, timeout, unit);
        if (!result.isSuccess()) {
            throw new IOException(taskName + " failed with exit code " + result.getExitCode()
                    + ": " + result.outputTail(300));
        }
    }
}
