package com.vidforge.worker.service.render;

import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.entity.progress.ChunkResult;
import com.vidforge.worker.entity.progress.RenderStage;
import com.vidforge.worker.storage.LocalStorageService;
import com.vidforge.worker.testsupport.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ChunkConcatenationServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void testMissingChunk_AssemblyFailedAndWorkDirCleaned() throws Exception {
        // Given
        MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        WorkerProperties properties = new WorkerProperties();
        properties.getRender().setWorkDir(tempDir.resolve("work").toString());
        LocalStorageService storage = new LocalStorageService(tempDir.resolve("store").toString());
        storage.upload("chunks/c0.mp4", Files.writeString(tempDir.resolve("c0.mp4"), "c0"), "video/mp4");

        ChunkConcatenationService service = new ChunkConcatenationService(storage, new RestTemplate(),
                new RenderStatusProjector(clock), properties, clock);

        RenderStage stage = new RenderStage();
        stage.setTotalChunks(2);
        stage.addChunkResult(ChunkResult.builder().chunkIndex(0).outputLocation("chunks/c0.mp4").success(true).build());
        stage.addChunkResult(ChunkResult.builder().chunkIndex(1).outputLocation("chunks/c1.mp4").success(true).build());
        RecordingCallbacks callbacks = new RecordingCallbacks();

        // When
        JobException e = assertThrows(JobException.class, () -> service.concatenate("job-concat", stage, callbacks));

        // Then
        assertEquals(ErrorCode.RENDER_ASSEMBLY_FAILED, e.getErrorCode());
        assertEquals(2, callbacks.statuses.size(), "Download progress is reported per chunk");
        try (Stream<Path> left = Files.list(tempDir.resolve("work"))) {
            assertEquals(0, left.count(), "Job work directory should be removed");
        }
    }
}
