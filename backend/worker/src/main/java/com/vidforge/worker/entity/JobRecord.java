package com.vidforge.worker.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * render_jobs 테이블 행
 * scenes / renderConfig / progress 는 JSON 문자열로 저장된다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRecord {
    private String jobId;
    private String ownerId;
    private String status;
    private String scenes;
    private String renderConfig;
    private String progress;
    private String externalRenderId;
    private String externalStorageLocation;
    private String outputLocation;
    private Boolean reviewOverride;
    private String errorMessage;
    private String workerId;
    private String leaseId;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
