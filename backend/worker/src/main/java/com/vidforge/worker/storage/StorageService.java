package com.vidforge.worker.storage;

import java.nio.file.Path;

/**
 * 렌더 산출물 저장소
 * S3 또는 로컬 파일 시스템을 추상화
 */
public interface StorageService {

    /**
     * 파일 업로드
     * @param key 저장 키 (예: renders/chunked/{jobId}_{millis}.mp4)
     * @param file 업로드할 로컬 파일
     * @param contentType MIME 타입
     * @return 저장된 위치 (키)
     */
    String upload(String key, Path file, String contentType);

    /**
     * 저장소의 객체를 로컬 파일로 내려받는다
     */
    void download(String key, Path target);

    void delete(String key);

    boolean exists(String key);

    /**
     * S3가 활성화되어 있는지 확인
     */
    boolean isEnabled();
}
