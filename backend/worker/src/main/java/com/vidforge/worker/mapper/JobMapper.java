package com.vidforge.worker.mapper;

import com.vidforge.worker.entity.JobRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Mapper
public interface JobMapper {

    void insert(JobRecord job);

    Optional<JobRecord> findById(String jobId);

    /**
     * 가장 오래된(created_at) 작업 id
     */
    Optional<String> findOldestIdByStatus(String status);

    /**
     * 조건부 claim - 현재 상태가 fromStatus 일 때만 전이 (영향 행 수 0 이면 경쟁에서 진 것)
     */
    int claim(@Param("jobId") String jobId,
              @Param("fromStatus") String fromStatus,
              @Param("toStatus") String toStatus,
              @Param("workerId") String workerId,
              @Param("leaseId") String leaseId,
              @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * 조건부 인수 - 상태가 statuses 중 하나이고 updated_at 이 조회 시점 그대로일 때만 소유자 / lease 교체
     */
    int adopt(@Param("jobId") String jobId,
              @Param("statuses") List<String> statuses,
              @Param("expectedUpdatedAt") LocalDateTime expectedUpdatedAt,
              @Param("workerId") String workerId,
              @Param("leaseId") String leaseId,
              @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * 부분 갱신 (row 의 null 필드는 유지)
     * expectedStatuses 가 비어 있지 않으면 현재 상태가 그 중 하나일 때만,
     * expectedLeaseId 가 있으면 lease_id 가 같을 때만 반영
     */
    int update(@Param("row") JobRecord row,
               @Param("clearExternalRender") boolean clearExternalRender,
               @Param("expectedStatuses") List<String> expectedStatuses,
               @Param("expectedLeaseId") String expectedLeaseId);

    List<JobRecord> findByStatuses(@Param("statuses") List<String> statuses);

    List<JobRecord> findStale(@Param("statuses") List<String> statuses,
                              @Param("cutoff") LocalDateTime cutoff);

    int resetIfStale(@Param("jobId") String jobId,
                     @Param("fromStatus") String fromStatus,
                     @Param("toStatus") String toStatus,
                     @Param("cutoff") LocalDateTime cutoff,
                     @Param("updatedAt") LocalDateTime updatedAt);
}
