package com.flagship.cash_ledger.common.json;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for every JSON column the service writes.
 *
 * <pre>
 * {"schema_version": 1, "body": { ... }}
 * </pre>
 *
 * Bodies evolve additively. Readers ignore fields they do not know and the
 * version tells a reader which shape it is looking at.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VersionedJson {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    @JsonProperty("schema_version")
    private int schemaVersion;

    @JsonProperty("body")
    private JsonNode body;
}
