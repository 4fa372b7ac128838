package com.flagship.cash_ledger.identity;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.cash_ledger.common.jdbc.SqlTimestamps.instant;
import static com.flagship.cash_ledger.common.jdbc.SqlTimestamps.utc;

/**
 * JDBC access to identities and identity links.
 */
@Repository
@RequiredArgsConstructor
public class IdentityRepository {

    private static final RowMapper<Identity> IDENTITY_MAPPER = (rs, rowNum) -> Identity.builder()
        .id(rs.getObject("id", UUID.class))
        .tenantId(rs.getString("tenant_id"))
        .fingerprint(rs.getString("fingerprint"))
        .canonicalKind(CanonicalKind.valueOf(rs.getString("canonical_kind")))
        .lowConfidence(rs.getBoolean("low_confidence"))
        .createdAt(instant(rs, "created_at"))
        .touchedAt(instant(rs, "touched_at"))
        .build();

    private static final RowMapper<IdentityLink> LINK_MAPPER = (rs, rowNum) -> IdentityLink.builder()
        .id(rs.getObject("id", UUID.class))
        .tenantId(rs.getString("tenant_id"))
        .identityId(rs.getObject("identity_id", UUID.class))
        .rawEventId(rs.getObject("raw_event_id", UUID.class))
        .confidence(rs.getDouble("confidence"))
        .reason(rs.getString("reason"))
        .createdAt(instant(rs, "created_at"))
        .build();

    private final JdbcTemplate jdbcTemplate;

    /**
     * Single conditional insert on (tenant_id, fingerprint). Concurrent callers
     * with the same fingerprint all see exactly one row afterwards.
     *
     * @return true if this call created the row
     */
    public boolean insertIfAbsent(String tenantId, Fingerprint fingerprint, Instant now) {
        int rows = jdbcTemplate.update(
            "INSERT INTO identities (id, tenant_id, fingerprint, canonical_kind, low_confidence, created_at, touched_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?) ON CONFLICT DO NOTHING",
            UUID.randomUUID(),
            tenantId,
            fingerprint.getKey(),
            fingerprint.getCanonicalKind().name(),
            fingerprint.isLowConfidence(),
            utc(now),
            utc(now)
        );
        return rows == 1;
    }

    public Optional<Identity> findByFingerprint(String tenantId, String fingerprint) {
        return jdbcTemplate.query(
            "SELECT * FROM identities WHERE tenant_id = ? AND fingerprint = ?",
            IDENTITY_MAPPER, tenantId, fingerprint
        ).stream().findFirst();
    }

    public Optional<Identity> findById(String tenantId, UUID id) {
        return jdbcTemplate.query(
            "SELECT * FROM identities WHERE tenant_id = ? AND id = ?",
            IDENTITY_MAPPER, tenantId, id
        ).stream().findFirst();
    }

    public List<Identity> findByKind(String tenantId, CanonicalKind kind) {
        return jdbcTemplate.query(
            "SELECT * FROM identities WHERE tenant_id = ? AND canonical_kind = ? ORDER BY created_at, id",
            IDENTITY_MAPPER, tenantId, kind.name()
        );
    }

    public List<Identity> findTouchedSince(String tenantId, CanonicalKind kind, Instant since) {
        return jdbcTemplate.query(
            "SELECT * FROM identities WHERE tenant_id = ? AND canonical_kind = ? AND touched_at >= ? " +
            "ORDER BY touched_at, id",
            IDENTITY_MAPPER, tenantId, kind.name(), utc(since)
        );
    }

    public List<String> findTenantIds() {
        return jdbcTemplate.queryForList("SELECT DISTINCT tenant_id FROM identities ORDER BY tenant_id", String.class);
    }

    public void insertLink(IdentityLink link) {
        jdbcTemplate.update(
            "INSERT INTO identity_links (id, tenant_id, identity_id, raw_event_id, confidence, reason, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            link.getId(),
            link.getTenantId(),
            link.getIdentityId(),
            link.getRawEventId(),
            link.getConfidence(),
            truncate(link.getReason()),
            utc(link.getCreatedAt())
        );
    }

    public List<IdentityLink> findLinks(UUID identityId) {
        return jdbcTemplate.query(
            "SELECT * FROM identity_links WHERE identity_id = ? ORDER BY created_at, id",
            LINK_MAPPER, identityId
        );
    }

    public double minLinkConfidence(UUID identityId) {
        Double min = jdbcTemplate.queryForObject(
            "SELECT MIN(confidence) FROM identity_links WHERE identity_id = ?", Double.class, identityId);
        return min != null ? min : Fingerprint.FULL_CONFIDENCE;
    }

    public void markLowConfidence(UUID identityId) {
        jdbcTemplate.update("UPDATE identities SET low_confidence = TRUE WHERE id = ?", identityId);
    }

    /**
     * Bumps touched_at so the next consolidation pass picks the identities up again.
     */
    public void touch(Collection<UUID> identityIds, Instant now) {
        for (UUID id : identityIds) {
            jdbcTemplate.update("UPDATE identities SET touched_at = ? WHERE id = ?", utc(now), id);
        }
    }

    private static String truncate(String reason) {
        return reason.length() <= 512 ? reason : reason.substring(0, 509) + "...";
    }
}
