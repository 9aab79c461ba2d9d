package com.vidforge.worker.entity;

import com.vidforge.common.enums.JobStatus;
import com.vidforge.worker.entity.progress.JobProgress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 영상 조립 작업
 *
 * updatedAt 은 모든 쓰기에서 갱신되며 정체 감지의 유일한 기준이다.
 * externalRenderId / externalStorageLocation 은 원격 렌더가 진행중일 때만 존재한다.
 * leaseId 가 바뀌면 이전 소유 워커의 진행 중 쓰기는 더 이상 반영되지 않는다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    private String jobId;
    private String ownerId;
    private JobStatus status;
    private List<Scene> scenes;             // 렌더 순서
    private RenderConfig renderConfig;
    private JobProgress progress;
    private String externalRenderId;
    private String externalStorageLocation;
    private String outputLocation;          // 성공 시에만 설정
    private boolean reviewOverride;         // needs_review 씬에 대한 사람 승인
    private String errorMessage;
    private String workerId;
    private String leaseId;                 // claim / 복구 인수마다 새로 발급, 진행 중 쓰기의 소유 확인 기준
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public List<Scene> sceneList() {
        return scenes != null ? scenes : new ArrayList<>();
    }

    public JobProgress progressOrEmpty() {
        if (progress == null) {
            progress = new JobProgress();
        }
        return progress;
    }
}
