package com.vidforge.worker.service.worker;

import com.vidforge.common.enums.JobStatus;
import com.vidforge.worker.config.WorkerIdentity;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.testsupport.InMemoryJobStore;
import com.vidforge.worker.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.vidforge.worker.testsupport.TestJobs.job;
import static com.vidforge.worker.testsupport.TestJobs.scene;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobPollerTest {

    @Mock
    private JobGenerationService jobGenerationService;

    @Mock
    private JobRenderService jobRenderService;

    @Mock
    private JobFailureHandler failureHandler;

    private MutableClock clock;
    private InMemoryJobStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        store = new InMemoryJobStore(clock);
    }

    private JobPoller poller(String workerId) {
        return new JobPoller(store, jobGenerationService, jobRenderService, failureHandler, new WorkerIdentity(workerId));
    }

    @Test
    void testTick_RenderQueuedTakesPriority() throws Exception {
        // Given
        store.insertJob(job("job-gen", JobStatus.QUEUED, List.of(scene("s1", 10))));
        clock.advance(Duration.ofSeconds(1));
        store.insertJob(job("job-render", JobStatus.RENDER_QUEUED, List.of(scene("s1", 10))));

        // When
        boolean worked = poller("worker-a").tick();

        // Then
        assertTrue(worked);
        verify(jobRenderService).render(argThat(j -> j.getJobId().equals("job-render")));
        verifyNoInteractions(jobGenerationService);
        Job claimed = store.require("job-render");
        assertEquals(JobStatus.LAMBDA_PENDING, claimed.getStatus());
        assertEquals("worker-a", claimed.getWorkerId());
        assertEquals(JobStatus.QUEUED, store.require("job-gen").getStatus());
    }

    @Test
    void testTick_ClaimsOldestQueuedJob() throws Exception {
        // Given
        store.insertJob(job("job-old", JobStatus.QUEUED, List.of(scene("s1", 10))));
        clock.advance(Duration.ofSeconds(5));
        store.insertJob(job("job-new", JobStatus.QUEUED, List.of(scene("s1", 10))));

        // When
        poller("worker-a").tick();

        // Then
        verify(jobGenerationService).generate(argThat(j -> j.getJobId().equals("job-old")));
        assertEquals(JobStatus.GENERATING, store.require("job-old").getStatus());
        assertEquals(JobStatus.QUEUED, store.require("job-new").getStatus());
    }

    @Test
    void testTick_NothingToDo() throws Exception {
        // Given
        store.insertJob(job("job-awaiting", JobStatus.AWAITING_RENDER, List.of(scene("s1", 10))));

        // When
        boolean worked = poller("worker-a").tick();

        // Then
        assertFalse(worked);
        verifyNoInteractions(jobGenerationService, jobRenderService);
    }

    @Test
    void testTick_StepFailure_MarksJobFailed() throws Exception {
        // Given
        store.insertJob(job("job-broken", JobStatus.QUEUED, List.of(scene("s1", 10))));
        IllegalStateException failure = new IllegalStateException("boom");
        doThrow(failure).when(jobGenerationService).generate(any());

        // When
        poller("worker-a").tick();

        // Then
        verify(failureHandler).markFailed(argThat(j -> j.getJobId().equals("job-broken")), eq(failure));
    }

    @Test
    void testTick_OwnershipLost_NoFailureWrite() throws Exception {
        // Given
        store.insertJob(job("job-lost", JobStatus.QUEUED, List.of(scene("s1", 10))));
        doThrow(new JobOwnershipLostException("job-lost", "scene s1")).when(jobGenerationService).generate(any());

        // When
        poller("worker-a").tick();

        // Then
        verifyNoInteractions(failureHandler);
    }

    @Test
    void testConcurrentWorkers_EachJobClaimedOnce() throws Exception {
        // Given
        int jobCount = 20;
        for (int i = 0; i < jobCount; i++) {
            store.insertJob(job("job-" + i, JobStatus.QUEUED, List.of(scene("s1", 10))));
            clock.advance(Duration.ofMillis(10));
        }
        ConcurrentHashMap<String, AtomicInteger> claims = new ConcurrentHashMap<>();
        doAnswer(inv -> {
            Job job = inv.getArgument(0);
            claims.computeIfAbsent(job.getJobId(), id -> new AtomicInteger()).incrementAndGet();
            return null;
        }).when(jobGenerationService).generate(any());

        int workers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);

        // When
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                JobPoller poller = poller("worker-" + w);
                results.add(pool.submit(() -> {
                    start.await();
                    int handled = 0;
                    while (poller.tick()) {
                        handled++;
                    }
                    return handled;
                }));
            }
            start.countDown();

            int total = 0;
            for (Future<Integer> result : results) {
                total += result.get(10, TimeUnit.SECONDS);
            }

            // Then
            assertEquals(jobCount, total);
            assertEquals(jobCount, claims.size());
            claims.forEach((id, count) -> assertEquals(1, count.get(), id + " claimed more than once"));
            for (int i = 0; i < jobCount; i++) {
                assertEquals(JobStatus.GENERATING, store.require("job-" + i).getStatus());
            }
            assertEquals(Optional.empty(), store.claimJob(JobStatus.QUEUED, JobStatus.GENERATING, "late"));
        } finally {
            pool.shutdownNow();
        }
    }
}
