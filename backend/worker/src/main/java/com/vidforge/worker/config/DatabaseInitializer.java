package com.vidforge.worker.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * 워커 시작 시 render_jobs 스키마 보정
 * WorkerBootstrap(복구 → 폴러 시작) 보다 먼저 실행되어야 한다.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
@ConditionalOnProperty(name = "worker.schema.auto-migrate", havingValue = "true", matchIfMissing = true)
public class DatabaseInitializer implements ApplicationRunner {

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS render_jobs (
                job_id VARCHAR(64) NOT NULL PRIMARY KEY,
                owner_id VARCHAR(64) NULL,
                status VARCHAR(32) NOT NULL,
                scenes LONGTEXT NULL COMMENT '씬 목록 (JSON)',
                render_config TEXT NULL COMMENT '렌더 설정 (JSON)',
                progress LONGTEXT NULL COMMENT '진행 상태 (JSON, versioned)',
                external_render_id VARCHAR(255) NULL,
                external_storage_location VARCHAR(1024) NULL,
                output_location VARCHAR(1024) NULL,
                review_override TINYINT(1) NOT NULL DEFAULT 0,
                error_message TEXT NULL,
                worker_id VARCHAR(128) NULL,
                lease_id VARCHAR(64) NULL COMMENT '현재 소유 lease (claim / 복구 인수마다 교체)',
                created_at DATETIME(3) NOT NULL,
                updated_at DATETIME(3) NOT NULL,
                INDEX idx_render_jobs_status_created (status, created_at),
                INDEX idx_render_jobs_status_updated (status, updated_at)
            ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4
            """;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void run(ApplicationArguments args) {
        log.info("[DatabaseInitializer] Running render_jobs schema migrations...");

        jdbcTemplate.execute(CREATE_TABLE_SQL);

        // 초기 버전 테이블에는 없던 컬럼들
        addColumnIfNotExists("render_jobs", "review_override",
                "ALTER TABLE render_jobs ADD COLUMN review_override TINYINT(1) NOT NULL DEFAULT 0 COMMENT 'needs_review 사람 승인 여부' AFTER output_location");
        addColumnIfNotExists("render_jobs", "worker_id",
                "ALTER TABLE render_jobs ADD COLUMN worker_id VARCHAR(128) NULL COMMENT 'claim 한 워커' AFTER error_message");
        addColumnIfNotExists("render_jobs", "lease_id",
                "ALTER TABLE render_jobs ADD COLUMN lease_id VARCHAR(64) NULL COMMENT '현재 소유 lease (claim / 복구 인수마다 교체)' AFTER worker_id");
        addColumnIfNotExists("render_jobs", "render_config",
                "ALTER TABLE render_jobs ADD COLUMN render_config TEXT NULL COMMENT '렌더 설정 (JSON)' AFTER scenes");

        log.info("[DatabaseInitializer] Schema migrations completed.");
    }

    private void addColumnIfNotExists(String tableName, String columnName, String alterSql) {
        String checkSql = """
                SELECT COUNT(*) FROM information_schema.COLUMNS
                WHERE TABLE_SCHEMA = DATABASE()
                AND TABLE_NAME = ?
                AND COLUMN_NAME = ?
                """;

        Integer count = jdbcTemplate.queryForObject(checkSql, Integer.class, tableName, columnName);

        if (count == null || count == 0) {
            log.info("[DatabaseInitializer] Adding column {} to table {}...", columnName, tableName);
            jdbcTemplate.execute(alterSql);
        } else {
            log.debug("[DatabaseInitializer] Column {} already exists in table {}.", columnName, tableName);
        }
    }
}
