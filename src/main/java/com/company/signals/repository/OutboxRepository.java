package com.company.signals.repository;

import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.DeadLetterEvent;
import com.company.signals.domain.ErrorGroup;
import com.company.signals.domain.HourlyThroughput;
import com.company.signals.domain.OrgUsage;
import com.company.signals.domain.QueueCounters;
import com.company.signals.domain.UsageRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Aggregate queries over the metering outbox table.
 * The table name comes from configuration and is validated as a plain identifier
 * before it is spliced into SQL; every other value is bound.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class OutboxRepository {

    private static final String STUCK_LEASE_AGE = "interval '5 minutes'";

    private static final RowMapper<ErrorGroup> ERROR_GROUP_MAPPER = (rs, rowNum) ->
            new ErrorGroup(rs.getString("last_error"), rs.getLong("count"));

    private final JdbcTemplate jdbcTemplate;
    private final SignalsProperties properties;

    public QueueCounters countQueue(int hours) {
        String sql = """
            SELECT
                COUNT(*) FILTER (WHERE sent_at IS NULL AND attempts < ?) AS pending,
                COUNT(*) FILTER (WHERE sent_at IS NOT NULL) AS sent,
                COUNT(*) FILTER (WHERE attempts >= ?) AS dead_letter,
                COUNT(*) FILTER (WHERE lease_until IS NOT NULL AND lease_until > now()) AS leased,
                COUNT(*) AS total
            FROM %s
            WHERE created_at > now() - make_interval(hours => ?)
            """.formatted(table());

        int threshold = deadLetterThreshold();
        return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> QueueCounters.builder()
                .pending(rs.getLong("pending"))
                .sent(rs.getLong("sent"))
                .deadLetter(rs.getLong("dead_letter"))
                .currentlyLeased(rs.getLong("leased"))
                .total(rs.getLong("total"))
                .build(), threshold, threshold, hours);
    }

    /**
     * Undelivered rows whose lease expired more than five minutes ago
     */
    public long countStuckLeases() {
        String sql = """
            SELECT COUNT(*) FROM %s
            WHERE lease_until < now() - %s
            AND sent_at IS NULL
            AND attempts < ?
            """.formatted(table(), STUCK_LEASE_AGE);

        Long count = jdbcTemplate.queryForObject(sql, Long.class, deadLetterThreshold());
        return count == null ? 0 : count;
    }

    /**
     * Sent events per hour, newest first, at most the last 24 hours
     */
    public List<HourlyThroughput> hourlyThroughput(int hours) {
        String sql = """
            SELECT date_trunc('hour', sent_at) AS hour, COUNT(*) AS events_sent
            FROM %s
            WHERE sent_at > now() - make_interval(hours => ?)
            GROUP BY 1
            ORDER BY 1 DESC
            LIMIT 24
            """.formatted(table());

        return jdbcTemplate.query(sql, (rs, rowNum) -> new HourlyThroughput(
                toInstant(rs.getTimestamp("hour")),
                rs.getLong("events_sent")), Math.min(hours, 24));
    }

    public List<ErrorGroup> topErrors(int hours) {
        String sql = """
            SELECT last_error, COUNT(*) AS count
            FROM %s
            WHERE attempts > 0
            AND created_at > now() - make_interval(hours => ?)
            GROUP BY last_error
            ORDER BY count DESC
            LIMIT 5
            """.formatted(table());

        return jdbcTemplate.query(sql, ERROR_GROUP_MAPPER, hours);
    }

    public List<ErrorGroup> deadLetterErrors() {
        String sql = """
            SELECT last_error, COUNT(*) AS count
            FROM %s
            WHERE attempts >= ?
            AND sent_at IS NULL
            GROUP BY last_error
            ORDER BY count DESC
            LIMIT 5
            """.formatted(table());

        return jdbcTemplate.query(sql, ERROR_GROUP_MAPPER, deadLetterThreshold());
    }

    /**
     * Per-org recent totals next to the baseline window scaled down to the recent
     * window length. Orgs present in only one window come back with nulls on the other side.
     */
    public List<UsageRow> usageComparison(int hours, int baselineHours) {
        String sql = """
            WITH recent AS (
                SELECT org_id, SUM(total_tokens) AS recent_tokens, COUNT(*) AS recent_requests
                FROM %1$s
                WHERE created_at > now() - make_interval(hours => ?)
                GROUP BY org_id
            ),
            baseline AS (
                SELECT org_id,
                    SUM(total_tokens) / GREATEST(?::numeric / ?::numeric, 1) AS avg_tokens,
                    COUNT(*) / GREATEST(?::numeric / ?::numeric, 1) AS avg_requests
                FROM %1$s
                WHERE created_at > now() - make_interval(hours => ?)
                AND created_at <= now() - make_interval(hours => ?)
                GROUP BY org_id
            )
            SELECT COALESCE(r.org_id, b.org_id)::text AS org_id,
                r.recent_tokens, r.recent_requests,
                b.avg_tokens AS baseline_tokens, b.avg_requests AS baseline_requests
            FROM recent r
            FULL OUTER JOIN baseline b ON r.org_id = b.org_id
            ORDER BY COALESCE(r.recent_tokens, 0) DESC
            LIMIT 50
            """.formatted(table());

        return jdbcTemplate.query(sql, (rs, rowNum) -> UsageRow.builder()
                        .orgId(rs.getString("org_id"))
                        .recentTokens(nullableDouble(rs, "recent_tokens"))
                        .recentRequests(nullableDouble(rs, "recent_requests"))
                        .baselineTokens(nullableDouble(rs, "baseline_tokens"))
                        .baselineRequests(nullableDouble(rs, "baseline_requests"))
                        .build(),
                hours,
                baselineHours, hours,
                baselineHours, hours,
                baselineHours, hours);
    }

    /**
     * Token usage of chat completions grouped by org, provider, model family and status
     */
    public List<OrgUsage> llmUsage(int hours, String orgId) {
        String sql = """
            SELECT org_id::text AS org_id, provider_name, model_family, status_bucket,
                COUNT(*) AS request_count,
                SUM(total_tokens) AS total_tokens,
                SUM(prompt_tokens) AS prompt_tokens,
                SUM(completion_tokens) AS completion_tokens,
                MIN(created_at) AS first_event,
                MAX(created_at) AS last_event
            FROM %s
            WHERE created_at > now() - make_interval(hours => ?)
            AND feature = 'chat_completion'
            AND (?::text IS NULL OR org_id::text = ?)
            GROUP BY org_id, provider_name, model_family, status_bucket
            ORDER BY total_tokens DESC NULLS LAST
            LIMIT 50
            """.formatted(table());

        return jdbcTemplate.query(sql, (rs, rowNum) -> OrgUsage.builder()
                .orgId(rs.getString("org_id"))
                .provider(rs.getString("provider_name"))
                .modelFamily(rs.getString("model_family"))
                .statusBucket(rs.getString("status_bucket"))
                .count(rs.getLong("request_count"))
                .totalTokens(rs.getObject("total_tokens", Long.class))
                .promptTokens(rs.getObject("prompt_tokens", Long.class))
                .completionTokens(rs.getObject("completion_tokens", Long.class))
                .firstEvent(toInstant(rs.getTimestamp("first_event")))
                .lastEvent(toInstant(rs.getTimestamp("last_event")))
                .build(), hours, orgId, orgId);
    }

    /**
     * Every other metered feature grouped by org, service, feature and status
     */
    public List<OrgUsage> otherUsage(int hours, String orgId) {
        String sql = """
            SELECT org_id::text AS org_id, service, feature, status_bucket,
                COUNT(*) AS call_count,
                MIN(created_at) AS first_event,
                MAX(created_at) AS last_event
            FROM %s
            WHERE created_at > now() - make_interval(hours => ?)
            AND feature != 'chat_completion'
            AND (?::text IS NULL OR org_id::text = ?)
            GROUP BY org_id, service, feature, status_bucket
            ORDER BY call_count DESC
            LIMIT 50
            """.formatted(table());

        return jdbcTemplate.query(sql, (rs, rowNum) -> OrgUsage.builder()
                .orgId(rs.getString("org_id"))
                .service(rs.getString("service"))
                .feature(rs.getString("feature"))
                .statusBucket(rs.getString("status_bucket"))
                .count(rs.getLong("call_count"))
                .firstEvent(toInstant(rs.getTimestamp("first_event")))
                .lastEvent(toInstant(rs.getTimestamp("last_event")))
                .build(), hours, orgId, orgId);
    }

    /**
     * Clears attempts, lease and last error on the oldest dead letters so the
     * outbox worker claims them again.
     *
     * @param orgId optional org filter, null for all orgs
     * @return the rows that were reset, with the error they last failed with
     */
    public List<DeadLetterEvent> resetDeadLetters(int maxEvents, String orgId) {
        String sql = """
            WITH target AS (
                SELECT id, last_error FROM %1$s
                WHERE attempts >= ?
                AND sent_at IS NULL
                AND (?::text IS NULL OR org_id::text = ?)
                ORDER BY created_at ASC
                LIMIT ?
                FOR UPDATE SKIP LOCKED
            )
            UPDATE %1$s o
            SET attempts = 0, lease_until = NULL, lease_owner = NULL, last_error = NULL
            FROM target
            WHERE o.id = target.id
            RETURNING o.id::text AS id, o.org_id::text AS org_id, o.created_at, target.last_error
            """.formatted(table());

        List<DeadLetterEvent> events = jdbcTemplate.query(sql, (rs, rowNum) -> new DeadLetterEvent(
                rs.getString("id"),
                rs.getString("org_id"),
                toInstant(rs.getTimestamp("created_at")),
                rs.getString("last_error")), deadLetterThreshold(), orgId, orgId, maxEvents);

        log.info("Reset {} dead-letter events (org filter: {})", events.size(), orgId == null ? "all" : orgId);
        return events;
    }

    private String table() {
        return properties.getMetering().getOutboxTable();
    }

    private int deadLetterThreshold() {
        return properties.getMetering().getDeadLetterThreshold();
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        BigDecimal value = rs.getBigDecimal(column);
        return value == null ? null : value.doubleValue();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
