package com.vidforge.worker.entity.progress;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ServiceFailure {
    private String service;
    private LocalDateTime timestamp;
    private String error;
}
