package com.flagship.tax_submission.sequence;

import com.flagship.tax_submission.document.DocumentKind;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Per-tenant document numbering.
 *
 * Counters are keyed by (tenant, kind code, series) and advanced by a single
 * atomic upsert, so concurrent callers never read-modify-write and never get
 * the same value. Numbering starts at 1.
 *
 * Each reservation commits on its own: a number is consumed even if the
 * caller later fails, so gaps are possible but duplicates are not.
 *
 * Uses JDBC directly; the counter row is never loaded as an entity.
 */
@Service
public class SequenceCounter {

    private static final String NEXT_VALUE_SQL = """
        INSERT INTO sequence_counters (tenant_id, kind_code, series, current_value, updated_at)
        VALUES (?, ?, ?, 1, CURRENT_TIMESTAMP)
        ON CONFLICT (tenant_id, kind_code, series)
        DO UPDATE SET current_value = sequence_counters.current_value + 1,
                      updated_at = CURRENT_TIMESTAMP
        RETURNING current_value
        """;

    private final JdbcTemplate jdbcTemplate;

    public SequenceCounter(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Reserves the next number for a document kind and series.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public long next(String tenantId, DocumentKind kind, String series) {
        return next(tenantId, kind.getCode(), series);
    }

    /**
     * Reserves the next number under an arbitrary kind code.
     * Used directly for numbering that is not a document kind, such as void communications.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public long next(String tenantId, String kindCode, String series) {
        if (tenantId == null || kindCode == null || series == null) {
            throw new IllegalArgumentException("tenantId, kindCode and series are required");
        }

        Long value = jdbcTemplate.queryForObject(NEXT_VALUE_SQL, Long.class, tenantId, kindCode, series);
        if (value == null) {
            throw new IllegalStateException(
                String.format("Counter upsert returned no value for %s/%s/%s", tenantId, kindCode, series));
        }
        return value;
    }

    /**
     * Reads the last reserved number without advancing it.
     */
    @Transactional(readOnly = true)
    public Optional<Long> current(String tenantId, String kindCode, String series) {
        return jdbcTemplate.query(
            "SELECT current_value FROM sequence_counters WHERE tenant_id = ? AND kind_code = ? AND series = ?",
            (rs, rowNum) -> rs.getLong("current_value"),
            tenantId, kindCode, series
        ).stream().findFirst();
    }

    /**
     * Renders a document number: series, dash, sequence zero-padded to 8 digits.
     */
    public static String format(String series, long sequence) {
        if (sequence < 1 || sequence > 99_999_999L) {
            throw new IllegalArgumentException("Sequence out of range: " + sequence);
        }
        return String.format("%s-%08d", series, sequence);
    }
}
