package com.flagship.cash_ledger.ingest;

import com.flagship.cash_ledger.common.json.JsonColumnCodec;
import com.flagship.cash_ledger.identity.CanonicalKind;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.cash_ledger.common.jdbc.SqlTimestamps.instant;
import static com.flagship.cash_ledger.common.jdbc.SqlTimestamps.utc;

/**
 * Append-only store of raw events.
 *
 * The natural key (tenant, source, kind, external_id) is the only
 * synchronization for ingestion: a conflicting insert is a no-op.
 */
@Repository
@RequiredArgsConstructor
public class RawEventStore {

    private static final String COLUMNS =
        "r.id, r.tenant_id, r.source, r.kind, r.external_id, r.occurred_at, r.amount, r.currency, " +
        "r.account_ref, r.counterparty, r.parent_external_id, r.payload, r.received_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnCodec jsonColumnCodec;

    /**
     * Inserts the event unless its natural key is already stored.
     *
     * @return true if a row was written, false on a natural-key conflict
     */
    public boolean insertIfAbsent(RawEvent event) {
        int rows = jdbcTemplate.update(
            "INSERT INTO raw_events (id, tenant_id, source, kind, external_id, occurred_at, amount, currency, " +
            "account_ref, counterparty, parent_external_id, payload, received_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT DO NOTHING",
            event.getId(),
            event.getTenantId(),
            event.getSource(),
            event.getKind().name(),
            event.getExternalId(),
            utc(event.getOccurredAt()),
            event.getAmount(),
            event.getCurrency(),
            event.getAccountRef(),
            event.getCounterparty(),
            event.getParentExternalId(),
            jsonColumnCodec.write(event.getPayload()),
            utc(event.getReceivedAt())
        );
        return rows == 1;
    }

    public Optional<RawEvent> findByNaturalKey(String tenantId, String source, RawEventKind kind, String externalId) {
        List<RawEvent> events = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM raw_events r " +
            "WHERE r.tenant_id = ? AND r.source = ? AND r.kind = ? AND r.external_id = ?",
            rowMapper(),
            tenantId, source, kind.name(), externalId
        );
        return events.stream().findFirst();
    }

    public long countByTenant(String tenantId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM raw_events WHERE tenant_id = ?", Long.class, tenantId);
        return count != null ? count : 0L;
    }

    /**
     * Raw events backing one identity, oldest first.
     */
    public List<RawEvent> findLinkedTo(UUID identityId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM raw_events r " +
            "JOIN identity_links l ON l.raw_event_id = r.id " +
            "WHERE l.identity_id = ? ORDER BY r.received_at, r.id",
            rowMapper(),
            identityId
        );
    }

    /**
     * Raw events backing every identity of one canonical kind, grouped by identity.
     */
    public Map<UUID, List<RawEvent>> findLinkedByIdentityKind(String tenantId, CanonicalKind kind) {
        Map<UUID, List<RawEvent>> grouped = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT l.identity_id AS linked_identity_id, " + COLUMNS + " FROM raw_events r " +
            "JOIN identity_links l ON l.raw_event_id = r.id " +
            "JOIN identities i ON i.id = l.identity_id " +
            "WHERE i.tenant_id = ? AND i.canonical_kind = ? " +
            "ORDER BY l.identity_id, r.received_at, r.id",
            (RowCallbackHandler) rs -> {
                UUID identityId = rs.getObject("linked_identity_id", UUID.class);
                grouped.computeIfAbsent(identityId, id -> new ArrayList<>()).add(mapRow(rs));
            },
            tenantId, kind.name()
        );
        return grouped;
    }

    private RowMapper<RawEvent> rowMapper() {
        return (rs, rowNum) -> mapRow(rs);
    }

    private RawEvent mapRow(ResultSet rs) throws SQLException {
        RawEventKind kind = RawEventKind.valueOf(rs.getString("kind"));
        return RawEvent.builder()
            .id(rs.getObject("id", UUID.class))
            .tenantId(rs.getString("tenant_id"))
            .source(rs.getString("source"))
            .kind(kind)
            .externalId(rs.getString("external_id"))
            .occurredAt(instant(rs, "occurred_at"))
            .amount(rs.getBigDecimal("amount"))
            .currency(rs.getString("currency"))
            .accountRef(rs.getString("account_ref"))
            .counterparty(rs.getString("counterparty"))
            .parentExternalId(rs.getString("parent_external_id"))
            .payload(jsonColumnCodec.read(rs.getString("payload"), kind.payloadType()))
            .receivedAt(instant(rs, "received_at"))
            .build();
    }

}
