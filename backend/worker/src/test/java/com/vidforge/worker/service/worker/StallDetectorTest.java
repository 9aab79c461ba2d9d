package com.vidforge.worker.service.worker;

import com.vidforge.common.enums.JobStatus;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.entity.progress.ChunkRenderState;
import com.vidforge.worker.entity.progress.JobProgress;
import com.vidforge.worker.testsupport.InMemoryJobStore;
import com.vidforge.worker.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static com.vidforge.worker.testsupport.TestJobs.job;
import static com.vidforge.worker.testsupport.TestJobs.scene;
import static org.junit.jupiter.api.Assertions.*;

class StallDetectorTest {

    private MutableClock clock;
    private InMemoryJobStore store;
    private WorkerProperties properties;
    private StallDetector detector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        store = new InMemoryJobStore(clock);
        properties = new WorkerProperties();
        detector = new StallDetector(store, properties, clock);
    }

    private void insertAt(String jobId, JobStatus status, Duration age) {
        store.insertJob(job(jobId, status, List.of(scene("s1", 10))));
        store.touch(jobId, LocalDateTime.now(clock).minus(age));
    }

    @Test
    void testRenderJob_JustOverThreshold_Requeued() {
        // Given
        insertAt("job-stale", JobStatus.RENDERING, Duration.ofMinutes(10).plusSeconds(1));

        // When
        int reset = detector.detect();

        // Then
        assertEquals(1, reset);
        assertEquals(JobStatus.RENDER_QUEUED, store.require("job-stale").getStatus());
    }

    @Test
    void testRenderJob_JustUnderThreshold_Untouched() {
        // Given
        insertAt("job-fresh", JobStatus.LAMBDA_PENDING, Duration.ofMinutes(10).minusSeconds(1));

        // When
        int reset = detector.detect();

        // Then
        assertEquals(0, reset);
        assertEquals(JobStatus.LAMBDA_PENDING, store.require("job-fresh").getStatus());
    }

    @Test
    void testGeneratingJob_UsesGenerationThreshold() {
        // Given
        insertAt("job-gen-stale", JobStatus.GENERATING, Duration.ofMinutes(5).plusSeconds(1));
        insertAt("job-gen-fresh", JobStatus.GENERATING, Duration.ofMinutes(5).minusSeconds(1));

        // When
        detector.detect();

        // Then
        assertEquals(JobStatus.QUEUED, store.require("job-gen-stale").getStatus());
        assertEquals(JobStatus.GENERATING, store.require("job-gen-fresh").getStatus());
    }

    @Test
    void testIdleAndTerminalStates_NeverReset() {
        // Given
        Duration old = Duration.ofHours(5);
        insertAt("job-queued", JobStatus.QUEUED, old);
        insertAt("job-awaiting", JobStatus.AWAITING_RENDER, old);
        insertAt("job-render-queued", JobStatus.RENDER_QUEUED, old);
        insertAt("job-complete", JobStatus.COMPLETE, old);
        insertAt("job-error", JobStatus.ERROR, old);

        // When
        int reset = detector.detect();

        // Then
        assertEquals(0, reset);
        assertEquals(JobStatus.COMPLETE, store.require("job-complete").getStatus());
        assertEquals(JobStatus.ERROR, store.require("job-error").getStatus());
    }

    @Test
    void testReset_KeepsProgressAndActiveChunk() {
        // Given
        Job job = job("job-progress", JobStatus.RENDERING, List.of(scene("s1", 10)));
        JobProgress progress = new JobProgress();
        progress.renderOrNew().setTotalChunks(3);
        progress.renderOrNew().setActiveChunk(ChunkRenderState.builder().chunkIndex(1).externalRenderId("r-1").build());
        job.setProgress(progress);
        store.insertJob(job);
        store.touch("job-progress", LocalDateTime.now(clock).minusHours(1));

        // When
        detector.detect();

        // Then
        Job after = store.require("job-progress");
        assertEquals(JobStatus.RENDER_QUEUED, after.getStatus());
        assertEquals(3, after.getProgress().getRender().getTotalChunks());
        assertEquals("r-1", after.getProgress().getRender().getActiveChunk().getExternalRenderId());
    }

    @Test
    void testReset_LosesToConcurrentWrite() {
        // Given: 스캔 이후 소유 워커가 갱신한 작업은 되돌리지 않는다
        insertAt("job-race", JobStatus.RENDERING, Duration.ofMinutes(30));
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getStall().getRenderThreshold());
        store.touch("job-race", LocalDateTime.now(clock));

        // When
        boolean reset = store.resetIfStale("job-race", JobStatus.RENDERING, JobStatus.RENDER_QUEUED, cutoff);

        // Then
        assertFalse(reset);
        assertEquals(JobStatus.RENDERING, store.require("job-race").getStatus());
    }
}
