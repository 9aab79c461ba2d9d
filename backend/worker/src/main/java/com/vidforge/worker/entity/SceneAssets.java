package com.vidforge.worker.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SceneAssets {
    private String imageUrl;
    private String videoUrl;
    private String audioUrl;
    private String provider;          // 에셋을 만든 생성 서비스
    private LocalDateTime generatedAt;

    public boolean hasAnyAsset() {
        return notBlank(imageUrl) || notBlank(videoUrl);
    }

    /**
     * 품질 분석에 넘길 대표 에셋 (영상 우선)
     */
    public String primaryAssetRef() {
        return notBlank(videoUrl) ? videoUrl : imageUrl;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
