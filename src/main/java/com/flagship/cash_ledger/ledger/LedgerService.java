package com.flagship.cash_ledger.ledger;

import com.flagship.cash_ledger.common.json.JsonColumnCodec;
import com.flagship.cash_ledger.ledger.event.LedgerEntryRecordedEvent;
import com.flagship.cash_ledger.observability.CashLedgerMetrics;
import com.flagship.cash_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.cash_ledger.common.jdbc.SqlTimestamps.instant;
import static com.flagship.cash_ledger.common.jdbc.SqlTimestamps.utc;

/**
 * Appends entries to the cash ledger and answers ledger queries.
 *
 * Entries are never updated or deleted. The unique (tenant, identity) key
 * makes {@link #record} idempotent: a replay of the same identity writes
 * nothing, whatever the recomputed content would have been.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    public static final String AGGREGATE_TYPE = "LedgerEntry";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnCodec jsonColumnCodec;
    private final OutboxService outboxService;
    private final CashLedgerMetrics metrics;

    /**
     * Writes the entry unless one already exists for its identity.
     *
     * @return the entry if it was written, empty if the identity already had one
     */
    @Transactional
    public Optional<CashLedgerEntry> record(CashLedgerEntry entry) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO cash_ledger_entries (id, tenant_id, identity_id, posted_at, direction, amount, currency, " +
            "classification_key, confidence, provenance, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT DO NOTHING",
            entry.getId(),
            entry.getTenantId(),
            entry.getIdentityId(),
            utc(entry.getPostedAt()),
            entry.getDirection().name(),
            entry.getAmount(),
            entry.getCurrency(),
            entry.getClassificationKey(),
            entry.getConfidence(),
            jsonColumnCodec.write(entry.getProvenance()),
            utc(entry.getCreatedAt())
        );
        if (inserted == 0) {
            log.debug("Ledger entry already exists for identity {}", entry.getIdentityId());
            return Optional.empty();
        }

        outboxService.saveEvent(AGGREGATE_TYPE, entry.getId(),
            LedgerEntryRecordedEvent.EVENT_TYPE, LedgerEntryRecordedEvent.from(entry));
        metrics.recordLedgerEntry(entry.getProvenance().getPath().name());

        log.info("Recorded ledger entry: identityId={}, {} {} {}, postedAt={}, path={}",
            entry.getIdentityId(), entry.getDirection(), entry.getAmount().toPlainString(), entry.getCurrency(),
            entry.getPostedAt(), entry.getProvenance().getPath());
        return Optional.of(entry);
    }

    public boolean existsForIdentity(String tenantId, UUID identityId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM cash_ledger_entries WHERE tenant_id = ? AND identity_id = ?",
            Integer.class, tenantId, identityId);
        return count != null && count > 0;
    }

    public Optional<CashLedgerEntry> findByIdentity(String tenantId, UUID identityId) {
        return jdbcTemplate.query(
            "SELECT * FROM cash_ledger_entries WHERE tenant_id = ? AND identity_id = ?",
            entryMapper(), tenantId, identityId
        ).stream().findFirst();
    }

    /**
     * Entries posted in [from, to), ordered by posting time. Either bound may be null.
     */
    public List<CashLedgerEntry> findByTenantAndRange(String tenantId, Instant from, Instant to) {
        StringBuilder sql = new StringBuilder("SELECT * FROM cash_ledger_entries WHERE tenant_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(tenantId);
        if (from != null) {
            sql.append(" AND posted_at >= ?");
            args.add(utc(from));
        }
        if (to != null) {
            sql.append(" AND posted_at < ?");
            args.add(utc(to));
        }
        sql.append(" ORDER BY posted_at, id");
        return jdbcTemplate.query(sql.toString(), entryMapper(), args.toArray());
    }

    public long countByTenant(String tenantId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM cash_ledger_entries WHERE tenant_id = ?", Long.class, tenantId);
        return count != null ? count : 0L;
    }

    private RowMapper<CashLedgerEntry> entryMapper() {
        return (rs, rowNum) -> CashLedgerEntry.builder()
            .id(rs.getObject("id", UUID.class))
            .tenantId(rs.getString("tenant_id"))
            .identityId(rs.getObject("identity_id", UUID.class))
            .postedAt(instant(rs, "posted_at"))
            .direction(Direction.valueOf(rs.getString("direction")))
            .amount(rs.getBigDecimal("amount"))
            .currency(rs.getString("currency"))
            .classificationKey(rs.getString("classification_key"))
            .confidence(rs.getDouble("confidence"))
            .provenance(jsonColumnCodec.read(rs.getString("provenance"), LedgerProvenance.class))
            .createdAt(instant(rs, "created_at"))
            .build();
    }
}
