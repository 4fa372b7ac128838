package com.flagship.cash_ledger.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One normalized record as published by a connector.
 *
 * Fields are deliberately loose (kind is a string, payload is a tree) so a
 * malformed record is rejected on its own instead of failing the whole batch
 * at deserialization time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawEventCommand {

    /** Only read from Kafka messages; the REST path takes the tenant from the URL. */
    @JsonProperty("tenant_id")
    private String tenantId;

    @JsonProperty("source")
    private String source;

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("external_id")
    private String externalId;

    @JsonProperty("occurred_at")
    private Instant occurredAt;

    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("account_ref")
    private String accountRef;

    @JsonProperty("counterparty")
    private String counterparty;

    @JsonProperty("parent_external_id")
    private String parentExternalId;

    @JsonProperty("payload")
    private JsonNode payload;
}
