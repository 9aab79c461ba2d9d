package com.vidforge.worker.entity;

import com.vidforge.common.enums.IssueSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisIssue {
    private IssueSeverity severity;
    private String category;
    private String description;
}
