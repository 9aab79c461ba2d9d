package com.vidforge.worker.service.render;

import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.config.HttpClientConfig;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.dto.RenderDto;
import com.vidforge.worker.entity.Scene;
import com.vidforge.worker.testsupport.TestJobs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.vidforge.worker.testsupport.TestJobs.scene;
import static org.junit.jupiter.api.Assertions.*;

class ChunkPlannerTest {

    private ChunkPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new ChunkPlanner(new WorkerProperties(), HttpClientConfig.createObjectMapper());
    }

    private RenderDto.RenderSpec spec(List<Scene> scenes) {
        return RenderDto.RenderSpec.builder()
                .jobId("job-plan")
                .compositionId("LongVideo")
                .fps(30)
                .inputProps(TestJobs.renderConfig().getInputProps())
                .scenes(scenes)
                .build();
    }

    @Test
    void testPlan_GreedySplitOnWholeScenes() {
        // Given: 4 x 50s scenes, max 120s per chunk
        List<Scene> scenes = List.of(scene("s1", 50), scene("s2", 50), scene("s3", 50), scene("s4", 50));

        // When
        List<RenderDto.ChunkPlan> chunks = planner.plan(spec(scenes), 120);

        // Then
        assertEquals(2, chunks.size());
        assertEquals(0, chunks.get(0).getStartFrame());
        assertEquals(2999, chunks.get(0).getEndFrame());
        assertEquals(3000, chunks.get(1).getStartFrame());
        assertEquals(5999, chunks.get(1).getEndFrame());
        assertEquals(100.0, chunks.get(1).getEndTimeSeconds() - chunks.get(1).getStartTimeSeconds(), 0.001);
        assertEquals(1500, chunks.get(1).getScenes().get(1).getChunkStartFrame(),
                "Scene start frame should be relative to its chunk");
    }

    @Test
    void testPlan_CoversTimelineWithoutGaps() {
        // Given
        List<Scene> scenes = List.of(scene("s1", 12.5), scene("s2", 40), scene("s3", 33.3), scene("s4", 7),
                scene("s5", 61), scene("s6", 3));

        // When
        List<RenderDto.ChunkPlan> chunks = planner.plan(spec(scenes), 60);

        // Then
        int expectedStart = 0;
        int sceneCount = 0;
        for (RenderDto.ChunkPlan chunk : chunks) {
            assertEquals(expectedStart, chunk.getStartFrame(), "Chunk " + chunk.getChunkIndex() + " should start where the previous ended");
            assertTrue(chunk.getEndFrame() >= chunk.getStartFrame());
            expectedStart = chunk.getEndFrame() + 1;
            sceneCount += chunk.getScenes().size();
        }
        assertEquals(scenes.size(), sceneCount, "Every scene belongs to exactly one chunk");
    }

    @Test
    void testPlan_OverlongSceneFormsOwnChunk() {
        // Given
        List<Scene> scenes = List.of(scene("s1", 30), scene("s2", 200), scene("s3", 30));

        // When
        List<RenderDto.ChunkPlan> chunks = planner.plan(spec(scenes), 120);

        // Then
        assertEquals(3, chunks.size());
        assertEquals("s2", chunks.get(1).getScenes().get(0).getSceneId());
        assertEquals(1, chunks.get(1).getScenes().size());
    }

    @Test
    void testPlan_NoScenes_Fails() {
        // When
        JobException e = assertThrows(JobException.class, () -> planner.plan(spec(List.of()), 120));

        // Then
        assertEquals(ErrorCode.JOB_HAS_NO_SCENES, e.getErrorCode());
    }

    @Test
    void testPlan_ZeroDuration_Fails() {
        // When
        JobException e = assertThrows(JobException.class,
                () -> planner.plan(spec(List.of(scene("s1", 0), scene("s2", 0))), 120));

        // Then
        assertEquals(ErrorCode.JOB_HAS_NO_SCENES, e.getErrorCode());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testBuildChunkSpec_DisablesSoundDesignAndMarksChunk() {
        // Given
        RenderDto.RenderSpec spec = spec(List.of(scene("s1", 50), scene("s2", 50), scene("s3", 50)));
        List<RenderDto.ChunkPlan> chunks = planner.plan(spec, 120);

        // When
        RenderDto.ChunkSpec chunkSpec = planner.buildChunkSpec(spec, chunks.get(1), chunks.size());

        // Then
        Map<String, Object> props = chunkSpec.getInputProps();
        assertEquals(true, props.get("isChunk"));
        assertEquals(1, props.get("chunkIndex"));
        assertEquals("test", props.get("title"));
        assertFalse(props.containsKey("soundEffectsBaseUrl"));

        Map<String, Object> soundDesign = (Map<String, Object>) props.get("soundDesignConfig");
        assertEquals(false, soundDesign.get("enabled"));
        assertEquals(false, soundDesign.get("ambientLayer"));
        assertEquals(false, soundDesign.get("transitionSounds"));
        assertEquals(false, soundDesign.get("impactSounds"));

        List<Map<String, Object>> scenes = (List<Map<String, Object>>) props.get("scenes");
        assertEquals(1, scenes.size());
        assertEquals("s3", scenes.get(0).get("sceneId"));
        assertEquals(0, scenes.get(0).get("chunkStartFrame"));

        assertEquals(3000, chunkSpec.getStartFrame());
        assertEquals(4499, chunkSpec.getEndFrame());
        assertEquals("job-plan_chunk_1.mp4", chunkSpec.getOutName());
    }
}
