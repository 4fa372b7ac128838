package com.flagship.cash_ledger.consolidation;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.cash_ledger.common.jdbc.SqlTimestamps.instant;
import static com.flagship.cash_ledger.common.jdbc.SqlTimestamps.utc;

/**
 * Per-tenant consolidation watermark and the lease that serializes runs
 * across instances. The watermark only ever moves forward.
 */
@Repository
@RequiredArgsConstructor
public class WatermarkRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<Instant> find(String tenantId) {
        return jdbcTemplate.query(
            "SELECT watermark FROM consolidation_watermarks WHERE tenant_id = ?",
            (rs, rowNum) -> instant(rs, "watermark"), tenantId
        ).stream().findFirst();
    }

    /**
     * Moves the watermark to {@code watermark} unless it is already at or past it.
     */
    public void advance(String tenantId, Instant watermark, Instant now) {
        int updated = jdbcTemplate.update(
            "UPDATE consolidation_watermarks SET watermark = ?, updated_at = ? WHERE tenant_id = ? AND watermark < ?",
            utc(watermark), utc(now), tenantId, utc(watermark));
        if (updated == 0) {
            insertIfAbsent(tenantId, watermark, now);
        }
    }

    /**
     * Takes the tenant lease if it is free or expired. A single conditional
     * update, so two instances can never both succeed.
     *
     * @return true if {@code owner} now holds the lease
     */
    public boolean tryAcquireLease(String tenantId, UUID owner, Instant now, Instant until) {
        insertIfAbsent(tenantId, Instant.EPOCH, now);
        return jdbcTemplate.update(
            "UPDATE consolidation_watermarks SET lease_owner = ?, lease_until = ? " +
            "WHERE tenant_id = ? AND (lease_until IS NULL OR lease_until <= ?)",
            owner, utc(until), tenantId, utc(now)) == 1;
    }

    public void releaseLease(String tenantId, UUID owner) {
        jdbcTemplate.update(
            "UPDATE consolidation_watermarks SET lease_owner = NULL, lease_until = NULL " +
            "WHERE tenant_id = ? AND lease_owner = ?",
            tenantId, owner);
    }

    private void insertIfAbsent(String tenantId, Instant watermark, Instant now) {
        jdbcTemplate.update(
            "INSERT INTO consolidation_watermarks (tenant_id, watermark, updated_at) VALUES (?, ?, ?) " +
            "ON CONFLICT DO NOTHING",
            tenantId, utc(watermark), utc(now));
    }
}
