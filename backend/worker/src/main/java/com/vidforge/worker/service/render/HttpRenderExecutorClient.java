package com.vidforge.worker.service.render;

import com.vidforge.common.enums.ChunkExecutionStatus;
import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.dto.RenderDto;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;

/**
 * HTTP 렌더 실행기 클라이언트
 * - 429 또는 한도 초과 메시지 → RenderRateLimitedException
 * - 404 / "not found" / NoSuchKey → not_found
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpRenderExecutorClient implements RenderExecutorClient {

    private final RestTemplate restTemplate;
    private final WorkerProperties workerProperties;

    @Override
    public RenderDto.RenderHandle dispatch(RenderDto.ChunkSpec chunkSpec) {
        String url = baseUrl() + "/v1/renders";
        try {
            DispatchResponse response = restTemplate.postForObject(url, chunkSpec, DispatchResponse.class);
            if (response == null || response.getRenderId() == null) {
                throw new JobException(ErrorCode.RENDER_DISPATCH_FAILED,
                        "Executor returned no render id for chunk " + chunkSpec.getChunkIndex());
            }
            return new RenderDto.RenderHandle(response.getRenderId(), response.getBucketName());
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                    || RenderRateLimitedException.isRateLimitMessage(e.getResponseBodyAsString())) {
                throw new RenderRateLimitedException("Executor rate limited: " + e.getStatusText(), e);
            }
            throw new JobException(ErrorCode.RENDER_DISPATCH_FAILED,
                    "Chunk dispatch rejected (" + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            if (RenderRateLimitedException.isRateLimitMessage(e.getMessage())) {
                throw new RenderRateLimitedException("Executor rate limited: " + e.getMessage(), e);
            }
            throw new JobException(ErrorCode.RENDER_DISPATCH_FAILED, "Chunk dispatch failed: " + e.getMessage(), e);
        }
    }

    @Override
    public RenderDto.ChunkStatusResult checkStatus(String externalRenderId, String externalStorageLocation) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl())
                .path("/v1/renders/{renderId}/progress")
                .queryParam("bucket", externalStorageLocation)
                .buildAndExpand(externalRenderId)
                .toUriString();
        try {
            ProgressResponse progress = restTemplate.getForObject(url, ProgressResponse.class);
            if (progress == null) {
                throw new JobException(ErrorCode.EXTERNAL_SERVICE_UNAVAILABLE, "Empty progress response for " + externalRenderId);
            }
            return toStatus(progress);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value() || isNotFoundMessage(e.getResponseBodyAsString())) {
                return RenderDto.ChunkStatusResult.notFound();
            }
            throw new JobException(ErrorCode.EXTERNAL_SERVICE_UNAVAILABLE,
                    "Progress check failed (" + e.getStatusCode().value() + ") for " + externalRenderId, e);
        } catch (RestClientException e) {
            if (isNotFoundMessage(e.getMessage())) {
                return RenderDto.ChunkStatusResult.notFound();
            }
            throw new JobException(ErrorCode.EXTERNAL_SERVICE_UNAVAILABLE,
                    "Progress check failed for " + externalRenderId + ": " + e.getMessage(), e);
        }
    }

    private RenderDto.ChunkStatusResult toStatus(ProgressResponse progress) {
        int percent = (int) Math.round(progress.getOverallProgress() * 100);
        if (progress.getErrors() != null && !progress.getErrors().isEmpty()) {
            return RenderDto.ChunkStatusResult.builder()
                    .status(ChunkExecutionStatus.FAILED)
                    .percent(percent)
                    .error(String.join(", ", progress.getErrors()))
                    .build();
        }
        if (progress.isDone()) {
            if (progress.getOutputFile() != null) {
                return RenderDto.ChunkStatusResult.complete(progress.getOutputFile());
            }
            return RenderDto.ChunkStatusResult.failed("Render completed but no output file generated");
        }
        return RenderDto.ChunkStatusResult.inProgress(percent);
    }

    private boolean isNotFoundMessage(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase();
        return lower.contains("not found") || lower.contains("nosuchkey");
    }

    private String baseUrl() {
        return workerProperties.getServices().getRenderExecutorUrl();
    }

    @Getter
    @Setter
    @NoArgsConstructor
    static class DispatchResponse {
        private String renderId;
        private String bucketName;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    static class ProgressResponse {
        private boolean done;
        private double overallProgress;
        private String outputFile;
        private List<String> errors;
    }
}
