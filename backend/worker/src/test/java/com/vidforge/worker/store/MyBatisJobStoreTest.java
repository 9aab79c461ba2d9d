package com.vidforge.worker.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidforge.common.enums.JobStatus;
import com.vidforge.worker.config.HttpClientConfig;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.entity.JobRecord;
import com.vidforge.worker.mapper.JobMapper;
import com.vidforge.worker.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MyBatisJobStoreTest {

    @Mock
    private JobMapper jobMapper;

    private MyBatisJobStore store;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = HttpClientConfig.createObjectMapper();
        store = new MyBatisJobStore(jobMapper, new JobProgressCodec(objectMapper), objectMapper,
                MutableClock.startingAt("2026-03-01T10:00:00Z"));
    }

    private JobRecord row(String jobId, String status, String scenes) {
        return JobRecord.builder()
                .jobId(jobId)
                .status(status)
                .scenes(scenes)
                .createdAt(LocalDateTime.of(2026, 3, 1, 9, 0))
                .updatedAt(LocalDateTime.of(2026, 3, 1, 9, 0))
                .build();
    }

    @Test
    void testClaimJob_LostRace_Empty() {
        // Given
        when(jobMapper.findOldestIdByStatus("queued")).thenReturn(Optional.of("job-1"));
        when(jobMapper.claim(eq("job-1"), eq("queued"), eq("generating"), eq("worker-a"), anyString(), any())).thenReturn(0);

        // When
        Optional<Job> claimed = store.claimJob(JobStatus.QUEUED, JobStatus.GENERATING, "worker-a");

        // Then
        assertTrue(claimed.isEmpty());
        verify(jobMapper, never()).findById(anyString());
    }

    @Test
    void testClaimJob_Won_ReturnsJob() {
        // Given
        when(jobMapper.findOldestIdByStatus("queued")).thenReturn(Optional.of("job-1"));
        when(jobMapper.claim(eq("job-1"), eq("queued"), eq("generating"), eq("worker-a"), anyString(), any())).thenReturn(1);
        when(jobMapper.findById("job-1")).thenReturn(Optional.of(
                row("job-1", "generating", "[{\"sceneId\":\"s1\",\"durationSeconds\":12.5}]")));

        // When
        Job job = store.claimJob(JobStatus.QUEUED, JobStatus.GENERATING, "worker-a").orElseThrow();

        // Then
        assertEquals(JobStatus.GENERATING, job.getStatus());
        assertEquals(12.5, job.getScenes().get(0).getDurationSeconds());
    }

    @Test
    void testClaimJob_UnreadableRow_MarkedError() {
        // Given
        when(jobMapper.findOldestIdByStatus("queued")).thenReturn(Optional.of("job-1"));
        when(jobMapper.claim(eq("job-1"), eq("queued"), eq("generating"), eq("worker-a"), anyString(), any())).thenReturn(1);
        when(jobMapper.findById("job-1")).thenReturn(Optional.of(row("job-1", "generating", "{broken")));
        when(jobMapper.update(any(), anyBoolean(), anyList(), any())).thenReturn(1);

        // When
        Optional<Job> claimed = store.claimJob(JobStatus.QUEUED, JobStatus.GENERATING, "worker-a");

        // Then
        assertTrue(claimed.isEmpty());
        ArgumentCaptor<JobRecord> rowCaptor = ArgumentCaptor.forClass(JobRecord.class);
        verify(jobMapper).update(rowCaptor.capture(), eq(false), eq(List.of("generating")), isNull());
        assertEquals("error", rowCaptor.getValue().getStatus());
        assertTrue(rowCaptor.getValue().getErrorMessage().startsWith("[J006]"));
    }

    @Test
    void testUpdateJob_GuardedWriteNotApplied() {
        // Given
        when(jobMapper.update(any(), anyBoolean(), anyList(), any())).thenReturn(0);

        // When
        boolean applied = store.updateJob("job-1", JobPatch.builder()
                .status(JobStatus.RENDER_QUEUED)
                .expectedStatuses(JobStatus.RENDER_ACTIVE)
                .build());

        // Then
        assertFalse(applied);
        verify(jobMapper).update(any(), eq(false), argThat(codes ->
                codes.size() == 2 && codes.contains("lambda_pending") && codes.contains("rendering")), isNull());
    }

    @Test
    void testScanByStatus_SkipsUnreadableRows() {
        // Given
        when(jobMapper.findByStatuses(anyList())).thenReturn(List.of(
                row("job-ok", "rendering", "[]"),
                row("job-bad", "rendering", "not json"),
                row("job-unknown", "paused", "[]")));

        // When
        List<Job> jobs = store.scanByStatus(JobStatus.RENDER_ACTIVE);

        // Then
        assertEquals(1, jobs.size());
        assertEquals("job-ok", jobs.get(0).getJobId());
    }

    @Test
    void testUpdateJob_LeaseGuardPassedToMapper() {
        // Given
        when(jobMapper.update(any(), anyBoolean(), anyList(), any())).thenReturn(1);

        // When
        boolean applied = store.updateJob("job-1", JobPatch.builder()
                .status(JobStatus.RENDERING)
                .expectedStatuses(JobStatus.RENDER_ACTIVE)
                .expectedLeaseId("lease-a")
                .build());

        // Then
        assertTrue(applied);
        verify(jobMapper).update(any(), eq(false), anyList(), eq("lease-a"));
    }

    @Test
    void testAdoptJob_RecordChangedSinceScan_Empty() {
        // Given
        LocalDateTime scannedAt = LocalDateTime.of(2026, 3, 1, 9, 0);
        when(jobMapper.adopt(eq("job-1"), anyList(), eq(scannedAt), eq("worker-b"), anyString(), any())).thenReturn(0);

        // When
        Optional<Job> adopted = store.adoptJob("job-1", JobStatus.RENDER_ACTIVE, scannedAt, "worker-b");

        // Then
        assertTrue(adopted.isEmpty());
        verify(jobMapper, never()).findById(any());
    }

    @Test
    void testAdoptJob_Won_ReturnsRecordWithNewLease() {
        // Given
        LocalDateTime scannedAt = LocalDateTime.of(2026, 3, 1, 9, 0);
        AtomicReference<String> issuedLease = new AtomicReference<>();
        when(jobMapper.adopt(eq("job-1"), anyList(), eq(scannedAt), eq("worker-b"), anyString(), any()))
                .thenAnswer(inv -> {
                    issuedLease.set(inv.getArgument(4));
                    return 1;
                });
        when(jobMapper.findById("job-1")).thenAnswer(inv -> {
            JobRecord record = row("job-1", "rendering", "[]");
            record.setWorkerId("worker-b");
            record.setLeaseId(issuedLease.get());
            return Optional.of(record);
        });

        // When
        Optional<Job> adopted = store.adoptJob("job-1", JobStatus.RENDER_ACTIVE, scannedAt, "worker-b");

        // Then
        assertTrue(adopted.isPresent());
        assertEquals("worker-b", adopted.get().getWorkerId());
        assertNotNull(adopted.get().getLeaseId());
        assertEquals(issuedLease.get(), adopted.get().getLeaseId());
    }
}
