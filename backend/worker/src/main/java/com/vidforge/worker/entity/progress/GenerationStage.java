package com.vidforge.worker.entity.progress;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class GenerationStage extends StageProgress {
    private int totalScenes;
    private int completedScenes;
    private List<String> failedSceneIds = new ArrayList<>();
    private int analyzedScenes;
    private boolean analysisDone;

    public void markSceneFailed(String sceneId) {
        if (failedSceneIds == null) {
            failedSceneIds = new ArrayList<>();
        }
        if (!failedSceneIds.contains(sceneId)) {
            failedSceneIds.add(sceneId);
        }
    }

    public void clearSceneFailure(String sceneId) {
        if (failedSceneIds != null) {
            failedSceneIds.remove(sceneId);
        }
    }
}
