package com.vidforge.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_ERROR("C001", "워커 내부 오류가 발생했습니다."),
    INVALID_REQUEST("C002", "잘못된 요청입니다."),

    // Job
    JOB_NOT_FOUND("J001", "작업을 찾을 수 없습니다."),
    INVALID_JOB_STATE("J002", "현재 작업 상태에서는 요청을 처리할 수 없습니다."),
    JOB_HAS_NO_SCENES("J003", "렌더할 씬이 없습니다."),
    PROGRESS_SCHEMA_UNSUPPORTED("J004", "지원하지 않는 진행 상태 스키마 버전입니다."),
    PROGRESS_CORRUPTED("J005", "진행 상태 데이터를 읽을 수 없습니다."),
    JOB_RECORD_CORRUPTED("J006", "작업 레코드를 읽을 수 없습니다."),

    // Generation
    ASSET_GENERATION_FAILED("G001", "씬 에셋 생성에 실패했습니다."),
    SCENE_ANALYSIS_FAILED("G002", "씬 품질 분석에 실패했습니다."),

    // Render
    RENDER_CONFIG_MISSING("R001", "렌더 설정이 누락되었습니다."),
    RENDER_DISPATCH_FAILED("R002", "렌더 청크 디스패치에 실패했습니다."),
    RENDER_RATE_LIMITED("R003", "렌더 실행기 요청 한도를 초과했습니다."),
    RENDER_CHUNK_FAILED("R004", "렌더 청크가 실패했습니다."),
    RENDER_CHUNK_TIMEOUT("R005", "렌더 청크 시간이 초과되었습니다."),
    RENDER_ASSEMBLY_FAILED("R006", "청크 병합에 실패했습니다."),

    // Storage
    STORAGE_UPLOAD_FAILED("S001", "파일 업로드에 실패했습니다."),
    STORAGE_DOWNLOAD_FAILED("S002", "파일 다운로드에 실패했습니다."),

    // External
    EXTERNAL_SERVICE_UNAVAILABLE("E001", "외부 서비스를 사용할 수 없습니다.");

    private final String code;
    private final String message;
}
