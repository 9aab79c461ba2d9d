package com.vidforge.worker.storage;

import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * 로컬 파일 시스템 기반 저장소
 * S3가 비활성화되어 있을 때 사용 (개발 / 단일 노드)
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "aws.s3.enabled", havingValue = "false", matchIfMissing = true)
public class LocalStorageService implements StorageService {

    private final Path root;

    public LocalStorageService(@Value("${worker.storage.local-path:${java.io.tmpdir}/vidforge/storage}") String rootPath) {
        this.root = Paths.get(rootPath).toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create local storage directory " + root, e);
        }
        log.info("[LocalStorage] Initialized - path: {}", root);
    }

    @Override
    public String upload(String key, Path file, String contentType) {
        try {
            Path target = resolve(key);
            Files.createDirectories(target.getParent());
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("[LocalStorage] Saved {}", target);
            return key;
        } catch (IOException e) {
            log.error("[LocalStorage] Failed to save {}", key, e);
            throw new JobException(ErrorCode.STORAGE_UPLOAD_FAILED, "Local storage failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void download(String key, Path target) {
        Path source = resolve(key);
        if (!Files.exists(source)) {
            throw new JobException(ErrorCode.STORAGE_DOWNLOAD_FAILED, "File not found: " + key);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("[LocalStorage] Failed to read {}", key, e);
            throw new JobException(ErrorCode.STORAGE_DOWNLOAD_FAILED, "Local storage read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(resolve(key));
            log.info("[LocalStorage] Deleted {}", key);
        } catch (IOException e) {
            throw new JobException(ErrorCode.STORAGE_UPLOAD_FAILED, "Local delete failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.exists(resolve(key));
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    private Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new SecurityException("Storage key escapes storage root: " + key);
        }
        return path;
    }
}
