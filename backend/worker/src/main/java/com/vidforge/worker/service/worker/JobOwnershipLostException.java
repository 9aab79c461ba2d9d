package com.vidforge.worker.service.worker;

import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;

/**
 * 진행 중 조건부 쓰기가 반영되지 않음 (정체 감지기가 되돌렸거나 다른 워커가 가져감)
 * 이 워커는 더 이상 작업을 건드리지 않는다.
 */
public class JobOwnershipLostException extends JobException {

    public JobOwnershipLostException(String jobId, String phase) {
        super(ErrorCode.INVALID_JOB_STATE, "Job " + jobId + " is no longer owned by this worker (" + phase + ")");
    }
}
