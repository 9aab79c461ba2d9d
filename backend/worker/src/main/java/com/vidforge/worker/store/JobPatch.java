package com.vidforge.worker.store;

import com.vidforge.common.enums.JobStatus;
import com.vidforge.worker.entity.Scene;
import com.vidforge.worker.entity.progress.JobProgress;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Set;

/**
 * 작업 부분 갱신 내용
 * null 필드는 변경하지 않는다. 외부 렌더 핸들은 clearExternalRender 로만 지운다.
 */
@Getter
@Builder(toBuilder = true)
public class JobPatch {
    private final JobStatus status;
    private final List<Scene> scenes;
    private final JobProgress progress;
    private final String externalRenderId;
    private final String externalStorageLocation;
    private final boolean clearExternalRender;
    private final String outputLocation;
    private final String errorMessage;
    private final Boolean reviewOverride;
    private final String workerId;

    /** null 이 아니면 행의 lease 가 이 값일 때만 반영 (다른 워커가 인수한 작업에 쓰지 않도록) */
    private final String expectedLeaseId;

    /** 비어 있으면 무조건 반영 (last-writer-wins) */
    @Singular
    private final Set<JobStatus> expectedStatuses;

    public static JobPatch progressOnly(JobProgress progress) {
        return JobPatch.builder().progress(progress).build();
    }
}
