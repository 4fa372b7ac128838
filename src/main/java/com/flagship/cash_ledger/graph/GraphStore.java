package com.flagship.cash_ledger.graph;

import com.flagship.cash_ledger.identity.IdentityRepository;
import com.flagship.cash_ledger.observability.CashLedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.flagship.cash_ledger.common.jdbc.SqlTimestamps.instant;
import static com.flagship.cash_ledger.common.jdbc.SqlTimestamps.utc;

/**
 * Typed, weighted edges between identities.
 *
 * Edges are never updated or deleted, and there is at most one per
 * (from, to, kind, origin). Adding one touches both endpoints so the next
 * consolidation pass revisits them.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class GraphStore {

    private static final RowMapper<IdentityEdge> EDGE_MAPPER = (rs, rowNum) -> IdentityEdge.builder()
        .id(rs.getObject("id", UUID.class))
        .tenantId(rs.getString("tenant_id"))
        .fromIdentityId(rs.getObject("from_identity_id", UUID.class))
        .toIdentityId(rs.getObject("to_identity_id", UUID.class))
        .kind(EdgeKind.valueOf(rs.getString("kind")))
        .weight(rs.getDouble("weight"))
        .reason(rs.getString("reason"))
        .origin(EdgeOrigin.valueOf(rs.getString("origin")))
        .createdAt(instant(rs, "created_at"))
        .build();

    private final JdbcTemplate jdbcTemplate;
    private final IdentityRepository identityRepository;
    private final CashLedgerMetrics metrics;
    private final Clock clock;

    @Transactional
    public IdentityEdge addEdge(String tenantId, UUID from, UUID to, EdgeKind kind,
                                double weight, String reason, EdgeOrigin origin) {
        if (weight <= 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("Edge weight must be in (0, 1]: " + weight);
        }
        Instant now = clock.instant();
        IdentityEdge edge = IdentityEdge.builder()
            .id(UUID.randomUUID())
            .tenantId(tenantId)
            .fromIdentityId(from)
            .toIdentityId(to)
            .kind(kind)
            .weight(weight)
            .reason(reason.length() <= 512 ? reason : reason.substring(0, 509) + "...")
            .origin(origin)
            .createdAt(now)
            .build();

        int inserted = jdbcTemplate.update(
            "INSERT INTO identity_edges (id, tenant_id, from_identity_id, to_identity_id, kind, weight, reason, origin, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT DO NOTHING",
            edge.getId(), tenantId, from, to, kind.name(), weight, edge.getReason(), origin.name(), utc(now)
        );
        if (inserted == 0) {
            IdentityEdge existing = jdbcTemplate.queryForObject(
                "SELECT * FROM identity_edges WHERE tenant_id = ? AND from_identity_id = ? AND to_identity_id = ? " +
                "AND kind = ? AND origin = ?",
                EDGE_MAPPER, tenantId, from, to, kind.name(), origin.name());
            log.debug("{} edge {} -> {} ({}) already exists as {}", kind, from, to, origin, existing.getId());
            return existing;
        }
        identityRepository.touch(List.of(from, to), now);
        metrics.recordEdgeCreated(kind.name(), origin.name());

        log.debug("Added {} edge {} -> {} (weight={}, origin={}): {}", kind, from, to, weight, origin, reason);
        return edge;
    }

    public List<IdentityEdge> outgoing(String tenantId, UUID identityId, EdgeKind kind) {
        return jdbcTemplate.query(
            "SELECT * FROM identity_edges WHERE tenant_id = ? AND from_identity_id = ? AND kind = ? ORDER BY created_at, id",
            EDGE_MAPPER, tenantId, identityId, kind.name()
        );
    }

    public List<IdentityEdge> incoming(String tenantId, UUID identityId, EdgeKind kind) {
        return jdbcTemplate.query(
            "SELECT * FROM identity_edges WHERE tenant_id = ? AND to_identity_id = ? AND kind = ? ORDER BY created_at, id",
            EDGE_MAPPER, tenantId, identityId, kind.name()
        );
    }

    public boolean hasOutgoing(String tenantId, UUID identityId, EdgeKind kind) {
        return count("from_identity_id", tenantId, identityId, kind) > 0;
    }

    public boolean hasIncoming(String tenantId, UUID identityId, EdgeKind kind) {
        return count("to_identity_id", tenantId, identityId, kind) > 0;
    }

    /**
     * Every edge touching the identity, in either direction.
     */
    public List<IdentityEdge> edgesOf(String tenantId, UUID identityId) {
        return jdbcTemplate.query(
            "SELECT * FROM identity_edges WHERE tenant_id = ? AND (from_identity_id = ? OR to_identity_id = ?) " +
            "ORDER BY created_at, id",
            EDGE_MAPPER, tenantId, identityId, identityId
        );
    }

    /** Identities with at least one outgoing edge of the kind. */
    public Set<UUID> sourcesOf(String tenantId, EdgeKind kind) {
        return new HashSet<>(jdbcTemplate.queryForList(
            "SELECT DISTINCT from_identity_id FROM identity_edges WHERE tenant_id = ? AND kind = ?",
            UUID.class, tenantId, kind.name()));
    }

    /** Identities with at least one incoming edge of the kind. */
    public Set<UUID> targetsOf(String tenantId, EdgeKind kind) {
        return new HashSet<>(jdbcTemplate.queryForList(
            "SELECT DISTINCT to_identity_id FROM identity_edges WHERE tenant_id = ? AND kind = ?",
            UUID.class, tenantId, kind.name()));
    }

    private int count(String column, String tenantId, UUID identityId, EdgeKind kind) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM identity_edges WHERE tenant_id = ? AND " + column + " = ? AND kind = ?",
            Integer.class, tenantId, identityId, kind.name());
        return count != null ? count : 0;
    }
}
