package com.vidforge.worker.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.entity.progress.JobProgress;
import com.vidforge.worker.entity.progress.RenderStatus;
import com.vidforge.worker.entity.progress.ServiceFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * progress 컬럼 직렬화
 *
 * - version 이 없는 문서: 초기 포맷(errors / serviceFailures / renderStatus 만 존재) → v2 로 변환
 * - version == 2: 그대로 읽되 stage 태그가 맞지 않으면 실패
 * - version > 2: 이 워커가 모르는 포맷이므로 거부
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobProgressCodec {

    private final ObjectMapper objectMapper;

    public JobProgress read(String jobId, String json) {
        if (json == null || json.isBlank()) {
            return new JobProgress();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new JobException(ErrorCode.PROGRESS_CORRUPTED, "Unparseable progress for job " + jobId, e);
        }
        if (root == null || root.isNull()) {
            return new JobProgress();
        }
        if (!root.isObject()) {
            throw new JobException(ErrorCode.PROGRESS_CORRUPTED, "Progress for job " + jobId + " is not an object");
        }

        JsonNode versionNode = root.get("version");
        if (versionNode == null || versionNode.isNull()) {
            return upgradeLegacy(jobId, root);
        }

        int version = versionNode.asInt(-1);
        if (version > JobProgress.CURRENT_VERSION) {
            throw new JobException(ErrorCode.PROGRESS_SCHEMA_UNSUPPORTED,
                    "Progress version " + version + " of job " + jobId + " is newer than supported version "
                            + JobProgress.CURRENT_VERSION);
        }
        if (version < JobProgress.CURRENT_VERSION) {
            // v1 은 버전 필드 없이 저장되었음
            throw new JobException(ErrorCode.PROGRESS_SCHEMA_UNSUPPORTED,
                    "Unknown progress version " + version + " for job " + jobId);
        }

        try {
            return objectMapper.treeToValue(root, JobProgress.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new JobException(ErrorCode.PROGRESS_CORRUPTED,
                    "Invalid progress document for job " + jobId + ": " + e.getMessage(), e);
        }
    }

    public String write(JobProgress progress) {
        if (progress == null) {
            return null;
        }
        progress.setVersion(JobProgress.CURRENT_VERSION);
        try {
            return objectMapper.writeValueAsString(progress);
        } catch (JsonProcessingException e) {
            throw new JobException(ErrorCode.INTERNAL_ERROR, "Failed to serialize progress", e);
        }
    }

    private JobProgress upgradeLegacy(String jobId, JsonNode root) {
        log.info("[ProgressCodec] Upgrading legacy progress document - jobId={}", jobId);
        JobProgress progress = new JobProgress();
        try {
            if (root.hasNonNull("currentStep")) {
                progress.setCurrentStep(root.get("currentStep").asText());
            }

            List<String> errors = new ArrayList<>();
            JsonNode errorsNode = root.get("errors");
            if (errorsNode != null && errorsNode.isArray()) {
                errorsNode.forEach(e -> errors.add(e.isTextual() ? e.asText() : e.toString()));
            }
            progress.setErrors(errors);

            List<ServiceFailure> failures = new ArrayList<>();
            JsonNode failuresNode = root.get("serviceFailures");
            if (failuresNode != null && failuresNode.isArray()) {
                for (JsonNode f : failuresNode) {
                    failures.add(objectMapper.treeToValue(f, ServiceFailure.class));
                }
            }
            progress.setServiceFailures(failures);

            if (root.hasNonNull("renderStatus")) {
                progress.setRenderStatus(objectMapper.treeToValue(root.get("renderStatus"), RenderStatus.class));
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new JobException(ErrorCode.PROGRESS_CORRUPTED,
                    "Invalid legacy progress document for job " + jobId, e);
        }
        return progress;
    }
}
