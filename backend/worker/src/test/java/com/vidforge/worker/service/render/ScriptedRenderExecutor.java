package com.vidforge.worker.service.render;

import com.vidforge.worker.dto.RenderDto;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 청크별 상태 응답을 미리 정해 두는 원격 실행기
 * 디스패치된 청크는 renderId "render-{chunkIndex}-{n}" 을 받는다.
 */
class ScriptedRenderExecutor implements RenderExecutorClient {

    private final List<RenderDto.ChunkSpec> dispatched = new ArrayList<>();
    private final Map<String, Deque<RenderDto.ChunkStatusResult>> scripts = new HashMap<>();
    private final Deque<RuntimeException> dispatchFailures = new ArrayDeque<>();
    private Function<Integer, List<RenderDto.ChunkStatusResult>> defaultScript =
            index -> List.of(RenderDto.ChunkStatusResult.inProgress(50),
                    RenderDto.ChunkStatusResult.complete("renders/chunk_" + index + ".mp4"));

    void defaultScript(Function<Integer, List<RenderDto.ChunkStatusResult>> script) {
        this.defaultScript = script;
    }

    void script(String renderId, RenderDto.ChunkStatusResult... results) {
        scripts.put(renderId, new ArrayDeque<>(List.of(results)));
    }

    void failNextDispatch(RuntimeException e) {
        dispatchFailures.add(e);
    }

    List<RenderDto.ChunkSpec> getDispatched() {
        return dispatched;
    }

    List<Integer> dispatchedIndexes() {
        List<Integer> indexes = new ArrayList<>();
        dispatched.forEach(s -> indexes.add(s.getChunkIndex()));
        return indexes;
    }

    @Override
    public synchronized RenderDto.RenderHandle dispatch(RenderDto.ChunkSpec spec) {
        if (!dispatchFailures.isEmpty()) {
            throw dispatchFailures.poll();
        }
        dispatched.add(spec);
        String renderId = "render-" + spec.getChunkIndex() + "-" + dispatched.size();
        scripts.computeIfAbsent(renderId, id -> new ArrayDeque<>(defaultScript.apply(spec.getChunkIndex())));
        return new RenderDto.RenderHandle(renderId, "executor-bucket");
    }

    @Override
    public synchronized RenderDto.ChunkStatusResult checkStatus(String externalRenderId, String externalStorageLocation) {
        Deque<RenderDto.ChunkStatusResult> script = scripts.get(externalRenderId);
        if (script == null || script.isEmpty()) {
            return RenderDto.ChunkStatusResult.notFound();
        }
        return script.size() > 1 ? script.poll() : script.peek();
    }
}
