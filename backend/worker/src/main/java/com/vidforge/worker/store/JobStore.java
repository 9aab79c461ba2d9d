package com.vidforge.worker.store;

import com.vidforge.common.enums.JobStatus;
import com.vidforge.worker.entity.Job;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 작업 저장소
 *
 * 워커 간 상호 배제는 조건부 쓰기(claimJob / adoptJob / 기대 상태·lease 가 지정된 updateJob / resetIfStale)로만 이루어진다.
 * claimJob 과 adoptJob 은 새 leaseId 를 발급하고, 진행 중 쓰기는 그 lease 로 소유를 확인한다.
 * 모든 쓰기는 updatedAt 을 현재 시각으로 갱신한다.
 */
public interface JobStore {

    /**
     * 가장 오래된 fromStatus 작업 하나를 claimedStatus 로 전이시키며 가져온다.
     * 다른 워커가 먼저 전이시켰다면 빈 값을 반환한다.
     */
    Optional<Job> claimJob(JobStatus fromStatus, JobStatus claimedStatus, String workerId);

    /**
     * 재시작 복구용 인수: 상태가 statuses 중 하나이고 updatedAt 이 조회 시점 값 그대로일 때만
     * workerId 와 새 lease 를 기록한다. 그 사이 다른 워커가 썼다면 빈 값을 반환한다.
     */
    Optional<Job> adoptJob(String jobId, Collection<JobStatus> statuses, LocalDateTime expectedUpdatedAt,
                           String workerId);

    /**
     * 부분 갱신. patch 에 기대 상태가 있으면 현재 상태가 그 중 하나일 때만,
     * 기대 lease 가 있으면 행의 lease 가 같을 때만 반영된다.
     * @return 반영 여부
     */
    boolean updateJob(String jobId, JobPatch patch);

    Optional<Job> getJob(String jobId);

    List<Job> scanByStatus(Collection<JobStatus> statuses);

    /**
     * updatedAt 이 cutoff 보다 오래된 작업 조회 (정체 후보)
     */
    List<Job> scanStale(Collection<JobStatus> statuses, LocalDateTime cutoff);

    /**
     * 상태가 여전히 fromStatus 이고 updatedAt 이 cutoff 이전일 때만 toStatus 로 되돌린다.
     */
    boolean resetIfStale(String jobId, JobStatus fromStatus, JobStatus toStatus, LocalDateTime cutoff);

    void insertJob(Job job);
}
