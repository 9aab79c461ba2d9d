package com.vidforge.worker.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidforge.common.enums.JobStatus;
import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.entity.JobRecord;
import com.vidforge.worker.entity.RenderConfig;
import com.vidforge.worker.entity.Scene;
import com.vidforge.worker.mapper.JobMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * MySQL(render_jobs) 기반 작업 저장소
 * 여러 행에 걸친 트랜잭션은 사용하지 않는다.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MyBatisJobStore implements JobStore {

    private static final TypeReference<List<Scene>> SCENE_LIST = new TypeReference<>() {};

    private final JobMapper jobMapper;
    private final JobProgressCodec progressCodec;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Optional<Job> claimJob(JobStatus fromStatus, JobStatus claimedStatus, String workerId) {
        Optional<String> candidate = jobMapper.findOldestIdByStatus(fromStatus.getCode());
        if (candidate.isEmpty()) {
            return Optional.empty();
        }

        String jobId = candidate.get();
        int claimed = jobMapper.claim(jobId, fromStatus.getCode(), claimedStatus.getCode(), workerId, newLeaseId(), now());
        if (claimed == 0) {
            log.debug("[JobStore] Lost claim race - jobId={}, from={}", jobId, fromStatus.getCode());
            return Optional.empty();
        }

        try {
            return getJob(jobId);
        } catch (JobException e) {
            // claim 한 워커가 진행할 수 없으므로 바로 error 로 내린다
            log.error("[JobStore] jobId={} - claimed record is unreadable, marking error: {}", jobId, e.getMessage());
            updateJob(jobId, JobPatch.builder()
                    .status(JobStatus.ERROR)
                    .errorMessage(e.toJobMessage())
                    .expectedStatus(claimedStatus)
                    .build());
            return Optional.empty();
        }
    }

    @Override
    public Optional<Job> adoptJob(String jobId, Collection<JobStatus> statuses, LocalDateTime expectedUpdatedAt,
                                  String workerId) {
        if (statuses.isEmpty() || expectedUpdatedAt == null) {
            return Optional.empty();
        }
        int adopted = jobMapper.adopt(jobId, codes(statuses), expectedUpdatedAt, workerId, newLeaseId(), now());
        if (adopted == 0) {
            log.info("[JobStore] jobId={} - not adopted, record changed since scan", jobId);
            return Optional.empty();
        }
        return getJob(jobId);
    }

    @Override
    public boolean updateJob(String jobId, JobPatch patch) {
        JobRecord row = JobRecord.builder()
                .jobId(jobId)
                .status(patch.getStatus() != null ? patch.getStatus().getCode() : null)
                .scenes(patch.getScenes() != null ? writeJson(patch.getScenes()) : null)
                .progress(patch.getProgress() != null ? progressCodec.write(patch.getProgress()) : null)
                .externalRenderId(patch.getExternalRenderId())
                .externalStorageLocation(patch.getExternalStorageLocation())
                .outputLocation(patch.getOutputLocation())
                .errorMessage(patch.getErrorMessage())
                .reviewOverride(patch.getReviewOverride())
                .workerId(patch.getWorkerId())
                .updatedAt(now())
                .build();

        List<String> expected = patch.getExpectedStatuses().stream()
                .map(JobStatus::getCode)
                .collect(Collectors.toList());

        return jobMapper.update(row, patch.isClearExternalRender(), expected, patch.getExpectedLeaseId()) > 0;
    }

    @Override
    public Optional<Job> getJob(String jobId) {
        return jobMapper.findById(jobId).map(this::toJob);
    }

    @Override
    public List<Job> scanByStatus(Collection<JobStatus> statuses) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        return readAll(jobMapper.findByStatuses(codes(statuses)));
    }

    @Override
    public List<Job> scanStale(Collection<JobStatus> statuses, LocalDateTime cutoff) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        return readAll(jobMapper.findStale(codes(statuses), cutoff));
    }

    @Override
    public boolean resetIfStale(String jobId, JobStatus fromStatus, JobStatus toStatus, LocalDateTime cutoff) {
        return jobMapper.resetIfStale(jobId, fromStatus.getCode(), toStatus.getCode(), cutoff, now()) > 0;
    }

    @Override
    public void insertJob(Job job) {
        LocalDateTime now = now();
        jobMapper.insert(JobRecord.builder()
                .jobId(job.getJobId())
                .ownerId(job.getOwnerId())
                .status((job.getStatus() != null ? job.getStatus() : JobStatus.QUEUED).getCode())
                .scenes(writeJson(job.sceneList()))
                .renderConfig(job.getRenderConfig() != null ? writeJson(job.getRenderConfig()) : null)
                .progress(progressCodec.write(job.progressOrEmpty()))
                .reviewOverride(job.isReviewOverride())
                .createdAt(job.getCreatedAt() != null ? job.getCreatedAt() : now)
                .updatedAt(now)
                .build());
    }

    /**
     * 스캔 결과 중 읽을 수 없는 행은 건너뛴다 (한 행 때문에 스캔 전체가 멈추지 않도록)
     */
    private List<Job> readAll(List<JobRecord> rows) {
        List<Job> jobs = new ArrayList<>(rows.size());
        for (JobRecord row : rows) {
            try {
                jobs.add(toJob(row));
            } catch (JobException e) {
                log.error("[JobStore] jobId={} - skipping unreadable record: {}", row.getJobId(), e.getMessage());
            }
        }
        return jobs;
    }

    private Job toJob(JobRecord row) {
        try {
            return Job.builder()
                    .jobId(row.getJobId())
                    .ownerId(row.getOwnerId())
                    .status(JobStatus.fromCode(row.getStatus()))
                    .scenes(row.getScenes() != null ? objectMapper.readValue(row.getScenes(), SCENE_LIST) : null)
                    .renderConfig(row.getRenderConfig() != null
                            ? objectMapper.readValue(row.getRenderConfig(), RenderConfig.class) : null)
                    .progress(progressCodec.read(row.getJobId(), row.getProgress()))
                    .externalRenderId(row.getExternalRenderId())
                    .externalStorageLocation(row.getExternalStorageLocation())
                    .outputLocation(row.getOutputLocation())
                    .reviewOverride(Boolean.TRUE.equals(row.getReviewOverride()))
                    .errorMessage(row.getErrorMessage())
                    .workerId(row.getWorkerId())
                    .leaseId(row.getLeaseId())
                    .createdAt(row.getCreatedAt())
                    .updatedAt(row.getUpdatedAt())
                    .build();
        } catch (JsonProcessingException e) {
            throw new JobException(ErrorCode.JOB_RECORD_CORRUPTED,
                    "Invalid JSON column in job " + row.getJobId() + ": " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new JobException(ErrorCode.JOB_RECORD_CORRUPTED,
                    "Invalid status in job " + row.getJobId() + ": " + e.getMessage(), e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JobException(ErrorCode.INTERNAL_ERROR, "Failed to serialize job column", e);
        }
    }

    private List<String> codes(Collection<JobStatus> statuses) {
        return statuses.stream().map(JobStatus::getCode).collect(Collectors.toList());
    }

    private String newLeaseId() {
        return UUID.randomUUID().toString();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
