package com.vidforge.worker.storage;

import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.config.S3Config;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * AWS S3 기반 렌더 산출물 저장소
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "aws.s3.enabled", havingValue = "true")
public class S3StorageService implements StorageService {

    private final S3Client s3Client;
    private final S3Config s3Config;

    public S3StorageService(S3Client s3Client, S3Config s3Config) {
        this.s3Client = s3Client;
        this.s3Config = s3Config;
        log.info("[S3Storage] Initialized - bucket: {}, region: {}", s3Config.getBucket(), s3Config.getRegion());
    }

    @Override
    public String upload(String key, Path file, String contentType) {
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(s3Config.getBucket())
                    .key(key)
                    .contentType(contentType)
                    .contentLength(Files.size(file))
                    .build();

            s3Client.putObject(request, RequestBody.fromFile(file));

            log.info("[S3Storage] Uploaded {}/{} ({} bytes)", s3Config.getBucket(), key, request.contentLength());
            return key;
        } catch (IOException | S3Exception e) {
            log.error("[S3Storage] Failed to upload {}", key, e);
            throw new JobException(ErrorCode.STORAGE_UPLOAD_FAILED, "S3 upload failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void download(String key, Path target) {
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                    .bucket(s3Config.getBucket())
                    .key(key)
                    .build();

            Files.createDirectories(target.getParent());
            Files.deleteIfExists(target);
            s3Client.getObject(request, ResponseTransformer.toFile(target));
        } catch (NoSuchKeyException e) {
            log.warn("[S3Storage] Object not found: {}", key);
            throw new JobException(ErrorCode.STORAGE_DOWNLOAD_FAILED, "Object not found: " + key, e);
        } catch (IOException | S3Exception e) {
            log.error("[S3Storage] Failed to download {}", key, e);
            throw new JobException(ErrorCode.STORAGE_DOWNLOAD_FAILED, "S3 download failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(s3Config.getBucket())
                    .key(key)
                    .build());
            log.info("[S3Storage] Deleted {}", key);
        } catch (S3Exception e) {
            log.error("[S3Storage] Failed to delete {}", key, e);
            throw new JobException(ErrorCode.STORAGE_UPLOAD_FAILED, "S3 delete failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(s3Config.getBucket())
                    .key(key)
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new JobException(ErrorCode.STORAGE_DOWNLOAD_FAILED, "S3 head object failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
