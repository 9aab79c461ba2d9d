package com.vidforge.worker.entity.progress;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 관리자 강제 렌더 기록
 * 게이트가 막았던 사유를 그대로 남긴다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverrideAudit {
    private String adminId;
    private String reason;
    private List<String> bypassedReasons;
    private LocalDateTime overriddenAt;
}
