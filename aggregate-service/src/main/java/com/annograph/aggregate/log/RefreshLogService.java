package com.annograph.aggregate.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

@Service
public class RefreshLogService {

    private static final Logger log = LoggerFactory.getLogger(RefreshLogService.class);

    private final JdbcTemplate jdbcTemplate;

    public RefreshLogService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void write(String view, String reason, int rowCount, double durationMs, String status) {
        try {
            jdbcTemplate.update(
                    "INSERT INTO aggregate_refresh_log (view_name, reason, row_count, duration_ms, status) VALUES (?, ?, ?, ?, ?)",
                    view,
                    reason == null ? "" : reason,
                    rowCount,
                    durationMs,
                    status
            );
        } catch (Exception ex) {
            log.debug("aggregate_refresh_log write skipped: {}", ex.getMessage());
        }
    }
}
