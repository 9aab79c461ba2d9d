package com.vidforge.worker.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * FFmpeg 인자 / 작업 파일 경로 검증
 * - Path traversal, 명령 구분자 차단
 * - 허용된 작업 디렉토리 밖의 절대경로 차단 (심볼릭 링크 해석 포함)
 */
@Slf4j
public final class PathValidator {

    private static final Set<String> ALLOWED_DIRECTORIES = new CopyOnWriteArraySet<>(
            List.of(Paths.get(System.getProperty("java.io.tmpdir")).toAbsolutePath().normalize().toString()));

    private static final String[] FORBIDDEN_PATTERNS = {
            "..", "\0", "\n", "\r", ";", "|", "&", "$(", "`"
    };

    private PathValidator() {
    }

    /**
     * 렌더 작업 디렉토리 등록 (설정으로 tmpdir 밖을 지정한 경우)
     */
    public static void allowDirectory(Path dir) {
        String normalized = dir.toAbsolutePath().normalize().toString();
        if (ALLOWED_DIRECTORIES.add(normalized)) {
            log.info("[PathValidator] Allowed directory registered: {}", normalized);
        }
    }

    public static boolean isSafe(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        for (String pattern : FORBIDDEN_PATTERNS) {
            if (path.contains(pattern)) {
                log.warn("[PathValidator] Forbidden pattern '{}' in path: {}", pattern, truncate(path));
                return false;
            }
        }
        return true;
    }

    public static boolean isWithinAllowedDirectory(Path path) {
        if (path == null) {
            return false;
        }
        Path normalized = path.toAbsolutePath().normalize();
        if (!startsWithAllowed(normalized)) {
            log.warn("[PathValidator] Path outside allowed directories: {}", truncate(normalized.toString()));
            return false;
        }
        if (Files.exists(normalized)) {
            try {
                Path real = normalized.toRealPath();
                if (!startsWithAllowed(real)) {
                    log.warn("[PathValidator] Symlink traversal detected! normalized: {}, real: {}",
                            truncate(normalized.toString()), truncate(real.toString()));
                    return false;
                }
            } catch (IOException e) {
                log.warn("[PathValidator] Failed to resolve real path: {}", truncate(normalized.toString()));
                return false;
            }
        }
        return true;
    }

    public static String validateForFFmpeg(Path path) {
        if (path == null) {
            throw new SecurityException("Path is null");
        }
        String pathStr = path.toAbsolutePath().normalize().toString();
        if (!isSafe(pathStr) || !isWithinAllowedDirectory(path)) {
            throw new SecurityException("Unsafe path for FFmpeg: " + truncate(pathStr));
        }
        return pathStr;
    }

    /**
     * 명령 인자 검증
     * - 옵션(-로 시작), 숫자, 코덱/포맷 이름은 통과
     * - ".." 포함 인자는 거부
     * - 절대경로는 허용 디렉토리 내부여야 함
     */
    public static void validateCommandArgs(List<String> args) {
        if (args == null) {
            return;
        }
        for (String arg : args) {
            if (arg == null || arg.isEmpty() || arg.startsWith("-")) {
                continue;
            }
            if (arg.matches("^[0-9:x]+$") || arg.matches("^[0-9]+\\.[0-9]+$") || arg.matches("^[a-z0-9_]+$")) {
                continue;
            }
            if (arg.contains("..")) {
                throw new SecurityException("Relative path traversal rejected: " + truncate(arg));
            }
            if (arg.startsWith("/") && !arg.equals("/dev/null")) {
                validateForFFmpeg(Paths.get(arg));
            }
        }
    }

    private static boolean startsWithAllowed(Path path) {
        for (String dir : ALLOWED_DIRECTORIES) {
            if (path.startsWith(dir)) {
                return true;
            }
        }
        return false;
    }

    private static String truncate(String str) {
        return str.length() <= 100 ? str : str.substring(0, 100) + "...";
    }
}
