package com.vidforge.worker.entity.progress;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 작업 진행 상태 (버전 관리되는 구조)
 *
 * version 2
 * - generation: 에셋 생성 단계 기록 (stage=generation)
 * - render: 청크 렌더 단계 기록 (stage=render), 재시작 시 이어하기의 근거
 * - renderStatus: UI 용 파생 값, 언제든 render 로부터 다시 계산 가능
 */
@Getter
@Setter
@NoArgsConstructor
public class JobProgress {

    public static final int CURRENT_VERSION = 2;

    private int version = CURRENT_VERSION;
    private String currentStep;
    private GenerationStage generation;
    private RenderStage render;
    private RenderStatus renderStatus;
    private List<String> errors = new ArrayList<>();
    private List<ServiceFailure> serviceFailures = new ArrayList<>();
    private List<OverrideAudit> overrideAudits = new ArrayList<>();

    public GenerationStage generationOrNew() {
        if (generation == null) {
            generation = new GenerationStage();
        }
        return generation;
    }

    public RenderStage renderOrNew() {
        if (render == null) {
            render = new RenderStage();
        }
        return render;
    }

    public void addError(String error) {
        if (errors == null) {
            errors = new ArrayList<>();
        }
        errors.add(error);
    }

    public void addServiceFailure(String service, String error, LocalDateTime timestamp) {
        if (serviceFailures == null) {
            serviceFailures = new ArrayList<>();
        }
        serviceFailures.add(new ServiceFailure(service, timestamp, error));
    }

    public void addOverrideAudit(OverrideAudit audit) {
        if (overrideAudits == null) {
            overrideAudits = new ArrayList<>();
        }
        overrideAudits.add(audit);
    }
}
