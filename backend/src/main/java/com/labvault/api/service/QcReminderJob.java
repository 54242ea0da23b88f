package com.labvault.api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Daily check for quality control results that failed more than a day ago.
 * Each one is logged as an alert against its automate.
 */
@Slf4j
@Component
public class QcReminderJob {

    public static final String JOB_NAME = "qc-reminder";

    private static final String OVERDUE_QC_SQL = """
            SELECT a.name AS automate_name, q.test_name AS test_name
            FROM quality_control_results q
            JOIN automates a ON a.id = q.automate_id
            WHERE q.status = 'fail' AND q.timestamp < ?
            ORDER BY q.timestamp
            """;

    private final JobRegistry jobRegistry;
    private final JdbcTemplate jdbcTemplate;

    @Value("${jobs.qc-reminder.enabled:true}")
    private boolean enabled;

    @Value("${jobs.qc-reminder.cron:0 0 8 * * *}")
    private String cron;

    public QcReminderJob(JobRegistry jobRegistry, JdbcTemplate jdbcTemplate) {
        this.jobRegistry = jobRegistry;
        this.jdbcTemplate = jdbcTemplate;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void register() {
        if (!enabled) {
            log.info("QC reminder job disabled");
            return;
        }
        jobRegistry.register(JOB_NAME, cron, this::checkOverdueQc);
    }

    /**
     * @return number of overdue failed QC results found
     */
    public int checkOverdueQc() {
        log.info("Executing QC reminder check...");
        Timestamp threshold = Timestamp.from(Instant.now().minus(Duration.ofHours(24)));
        List<Map<String, Object>> overdue;
        try {
            overdue = jdbcTemplate.queryForList(OVERDUE_QC_SQL, threshold);
        } catch (DataAccessException e) {
            log.warn("QC reminder check skipped: {}", e.getMostSpecificCause().getMessage());
            return 0;
        }

        if (!overdue.isEmpty()) {
            log.warn("Found {} overdue QC results", overdue.size());
            for (Map<String, Object> row : overdue) {
                log.warn("QC Alert: {} - {} failed QC check", row.get("automate_name"), row.get("test_name"));
            }
        }
        return overdue.size();
    }
}
