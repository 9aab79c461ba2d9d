package com.vidforge.worker.service.analysis;

import com.vidforge.worker.entity.Scene;
import com.vidforge.worker.entity.SceneAnalysis;

/**
 * 씬 품질 분석 서비스 (best-effort)
 */
public interface SceneAnalysisClient {

    boolean isAvailable();

    SceneAnalysis analyzeScene(String assetRef, Scene scene);
}
