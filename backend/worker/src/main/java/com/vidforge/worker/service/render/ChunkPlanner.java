package com.vidforge.worker.service.render;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.dto.RenderDto;
import com.vidforge.worker.entity.Scene;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 렌더 타임라인을 청크로 분할
 *
 * 씬 단위 greedy 분할: 다음 씬을 더하면 최대 길이를 넘고 현재 청크가 비어 있지 않으면 새 청크를 시작한다.
 * 최대 길이보다 긴 씬 하나는 단독 청크가 된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChunkPlanner {

    private static final TypeReference<Map<String, Object>> PROPS = new TypeReference<>() {};

    private final WorkerProperties workerProperties;
    private final ObjectMapper objectMapper;

    public List<RenderDto.ChunkPlan> plan(RenderDto.RenderSpec spec) {
        return plan(spec, workerProperties.getRender().getMaxChunkDurationSeconds());
    }

    public List<RenderDto.ChunkPlan> plan(RenderDto.RenderSpec spec, double maxChunkDurationSeconds) {
        List<Scene> scenes = spec.getScenes();
        if (scenes == null || scenes.isEmpty()) {
            throw new JobException(ErrorCode.JOB_HAS_NO_SCENES, "Job " + spec.getJobId() + " has no scenes to render");
        }
        int fps = spec.getFps();

        List<RenderDto.ChunkPlan> chunks = new ArrayList<>();
        List<RenderDto.ChunkScene> current = new ArrayList<>();
        double chunkDuration = 0;
        int chunkStartFrame = 0;
        double chunkStartTime = 0;
        int globalFrame = 0;
        double globalTime = 0;

        for (int i = 0; i < scenes.size(); i++) {
            Scene scene = scenes.get(i);
            double sceneDuration = scene.durationOrZero();
            int sceneFrames = (int) Math.round(sceneDuration * fps);

            if (!current.isEmpty() && chunkDuration + sceneDuration > maxChunkDurationSeconds) {
                chunks.add(buildChunk(chunks.size(), chunkStartFrame, globalFrame, chunkStartTime, globalTime, current));
                current = new ArrayList<>();
                chunkDuration = 0;
                chunkStartFrame = globalFrame;
                chunkStartTime = globalTime;
            }

            current.add(RenderDto.ChunkScene.builder()
                    .sceneId(scene.getSceneId())
                    .sceneIndex(i)
                    .chunkStartFrame(globalFrame - chunkStartFrame)
                    .durationInFrames(sceneFrames)
                    .build());
            chunkDuration += sceneDuration;
            globalFrame += sceneFrames;
            globalTime += sceneDuration;
        }

        if (globalFrame == 0) {
            throw new JobException(ErrorCode.JOB_HAS_NO_SCENES, "Job " + spec.getJobId() + " has zero total duration");
        }
        chunks.add(buildChunk(chunks.size(), chunkStartFrame, globalFrame, chunkStartTime, globalTime, current));

        log.info("[ChunkPlanner] jobId={} - {} chunks from {} scenes ({} frames, {}s)",
                spec.getJobId(), chunks.size(), scenes.size(), globalFrame, String.format("%.1f", globalTime));
        return chunks;
    }

    /**
     * 원격 실행기로 보낼 청크 요청 생성
     * 청크는 사운드 디자인을 끄고 렌더한다 (병합 후 경계에서 효과음이 겹치지 않도록).
     */
    public RenderDto.ChunkSpec buildChunkSpec(RenderDto.RenderSpec spec, RenderDto.ChunkPlan chunk, int totalChunks) {
        Map<String, Object> props = new HashMap<>();
        if (spec.getInputProps() != null) {
            props.putAll(spec.getInputProps());
        }

        List<Map<String, Object>> chunkScenes = new ArrayList<>();
        for (RenderDto.ChunkScene cs : chunk.getScenes()) {
            Map<String, Object> sceneProps = new LinkedHashMap<>(
                    objectMapper.convertValue(spec.getScenes().get(cs.getSceneIndex()), PROPS));
            sceneProps.remove("analysis");
            sceneProps.put("chunkStartFrame", cs.getChunkStartFrame());
            sceneProps.put("durationInFrames", cs.getDurationInFrames());
            chunkScenes.add(sceneProps);
        }
        props.put("scenes", chunkScenes);
        props.put("isChunk", true);
        props.put("chunkIndex", chunk.getChunkIndex());

        Map<String, Object> soundDesign = new HashMap<>();
        Object existing = props.get("soundDesignConfig");
        if (existing instanceof Map) {
            ((Map<?, ?>) existing).forEach((k, v) -> soundDesign.put(String.valueOf(k), v));
        }
        soundDesign.put("enabled", false);
        soundDesign.put("ambientLayer", false);
        soundDesign.put("transitionSounds", false);
        soundDesign.put("impactSounds", false);
        props.put("soundDesignConfig", soundDesign);
        props.remove("soundEffectsBaseUrl");

        return RenderDto.ChunkSpec.builder()
                .jobId(spec.getJobId())
                .chunkIndex(chunk.getChunkIndex())
                .totalChunks(totalChunks)
                .compositionId(spec.getCompositionId())
                .serveUrl(spec.getServeUrl())
                .fps(spec.getFps())
                .width(spec.getWidth())
                .height(spec.getHeight())
                .startFrame(chunk.getStartFrame())
                .endFrame(chunk.getEndFrame())
                .inputProps(props)
                .outName(spec.getJobId() + "_chunk_" + chunk.getChunkIndex() + ".mp4")
                .build();
    }

    private RenderDto.ChunkPlan buildChunk(int index, int startFrame, int endFrameExclusive,
                                           double startTime, double endTime, List<RenderDto.ChunkScene> scenes) {
        return RenderDto.ChunkPlan.builder()
                .chunkIndex(index)
                .startFrame(startFrame)
                .endFrame(endFrameExclusive - 1)
                .startTimeSeconds(startTime)
                .endTimeSeconds(endTime)
                .scenes(List.copyOf(scenes))
                .build();
    }
}
