package com.vidforge.worker.service.render;

import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.entity.progress.ChunkResult;
import com.vidforge.worker.entity.progress.RenderStage;
import com.vidforge.worker.storage.StorageService;
import com.vidforge.worker.util.PathValidator;
import com.vidforge.worker.util.ProcessExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * 완료된 청크들을 하나의 영상으로 병합
 * 다운로드 → ffmpeg concat (재인코딩 없음) → 업로드 → 임시 파일 정리
 */
@Slf4j
@Service
public class ChunkConcatenationService {

    private static final String OUTPUT_PREFIX = "renders/chunked/";

    private final StorageService storageService;
    private final RestTemplate restTemplate;
    private final RenderStatusProjector statusProjector;
    private final WorkerProperties workerProperties;
    private final Clock clock;
    private final Path workRoot;

    public ChunkConcatenationService(StorageService storageService, RestTemplate restTemplate,
                                     RenderStatusProjector statusProjector, WorkerProperties workerProperties,
                                     Clock clock) {
        this.storageService = storageService;
        this.restTemplate = restTemplate;
        this.statusProjector = statusProjector;
        this.workerProperties = workerProperties;
        this.clock = clock;
        this.workRoot = Paths.get(workerProperties.getRender().getWorkDir()).toAbsolutePath().normalize();
        PathValidator.allowDirectory(workRoot);
    }

    /**
     * @return 최종 영상 저장 위치
     */
    public String concatenate(String jobId, RenderStage stage, RenderCallbacks callbacks) throws InterruptedException {
        List<ChunkResult> results = new ArrayList<>(stage.getChunkResults());
        results.sort(Comparator.comparingInt(ChunkResult::getChunkIndex));

        long millis = clock.millis();
        Path workDir = workRoot.resolve(jobId + "_" + millis);
        try {
            Files.createDirectories(workDir);

            List<Path> chunkFiles = new ArrayList<>();
            for (ChunkResult result : results) {
                callbacks.onProgress(statusProjector.downloading(stage, result.getChunkIndex()));
                Path target = workDir.resolve("chunk_" + result.getChunkIndex() + ".mp4");
                fetch(result.getOutputLocation(), target);
                chunkFiles.add(target);
                log.info("[ChunkConcat] jobId={} - downloaded chunk {} ({} bytes)",
                        jobId, result.getChunkIndex(), Files.size(target));
            }

            callbacks.onProgress(statusProjector.concatenating(stage));
            Path listFile = workDir.resolve("concat_list.txt");
            StringBuilder list = new StringBuilder();
            for (Path file : chunkFiles) {
                list.append("file '").append(PathValidator.validateForFFmpeg(file)).append("'\n");
            }
            Files.writeString(listFile, list.toString(), StandardCharsets.UTF_8);

            Path output = workDir.resolve("final.mp4");
            List<String> command = List.of(
                    "ffmpeg", "-y",
                    "-f", "concat",
                    "-safe", "0",
                    "-i", PathValidator.validateForFFmpeg(listFile),
                    "-c", "copy",
                    PathValidator.validateForFFmpeg(output)
            );
            ProcessExecutor.executeOrThrow(command, "ChunkConcat(" + jobId + ")",
                    workerProperties.getRender().getFfmpegTimeout().toMillis(), TimeUnit.MILLISECONDS);

            callbacks.onProgress(statusProjector.uploading(stage));
            String key = OUTPUT_PREFIX + jobId + "_" + millis + ".mp4";
            String location = storageService.upload(key, output, "video/mp4");
            log.info("[ChunkConcat] jobId={} - final video uploaded: {}", jobId, location);
            return location;
        } catch (IOException | TimeoutException | SecurityException e) {
            throw new JobException(ErrorCode.RENDER_ASSEMBLY_FAILED,
                    "Chunk concatenation failed for job " + jobId + ": " + e.getMessage(), e);
        } catch (JobException e) {
            if (e.getErrorCode() != ErrorCode.STORAGE_DOWNLOAD_FAILED && e.getErrorCode() != ErrorCode.STORAGE_UPLOAD_FAILED) {
                throw e;
            }
            throw new JobException(ErrorCode.RENDER_ASSEMBLY_FAILED,
                    "Chunk concatenation failed for job " + jobId + ": " + e.getMessage(), e);
        } finally {
            cleanup(jobId, workDir);
        }
    }

    private void fetch(String location, Path target) throws IOException {
        if (location == null || location.isBlank()) {
            throw new IOException("Chunk has no output location");
        }
        if (location.startsWith("http://") || location.startsWith("https://")) {
            try {
                restTemplate.execute(URI.create(location), HttpMethod.GET, null, response -> {
                    Files.copy(response.getBody(), target, StandardCopyOption.REPLACE_EXISTING);
                    return null;
                });
            } catch (RestClientException e) {
                throw new IOException("Failed to download " + location + ": " + e.getMessage(), e);
            }
        } else {
            storageService.download(location, target);
        }
    }

    private void cleanup(String jobId, Path workDir) {
        if (!Files.exists(workDir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(workDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            log.warn("[ChunkConcat] jobId={} - failed to clean up {}: {}", jobId, workDir, e.getMessage());
        }
    }
}
