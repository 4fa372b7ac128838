package com.flagship.cash_ledger.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one ingestion batch.
 */
@Value
@Builder
public class IngestionResult {

    @JsonProperty("stored")
    int stored;

    @JsonProperty("deduplicated")
    int deduplicated;

    @JsonProperty("rejected")
    int rejected;

    @Singular
    @JsonProperty("rejections")
    List<Rejection> rejections;

    @Value
    public static class Rejection {
        @JsonProperty("external_id")
        String externalId;

        @JsonProperty("reason")
        String reason;
    }
}
