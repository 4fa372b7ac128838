package com.flagship.cash_ledger.common.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the schema-versioned JSON columns.
 */
@Component
@RequiredArgsConstructor
public class JsonColumnCodec {

    private final ObjectMapper objectMapper;

    public String write(Object body) {
        JsonNode node = body == null ? NullNode.getInstance() : objectMapper.valueToTree(body);
        return serialize(new VersionedJson(VersionedJson.CURRENT_SCHEMA_VERSION, node));
    }

    public <T> T read(String column, Class<T> type) {
        JsonNode body = readBody(column);
        if (body == null || body.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored JSON body does not match " + type.getSimpleName(), e);
        }
    }

    public JsonNode readBody(String column) {
        if (column == null || column.isBlank()) {
            return null;
        }
        try {
            VersionedJson envelope = objectMapper.readValue(column, VersionedJson.class);
            if (envelope.getSchemaVersion() > VersionedJson.CURRENT_SCHEMA_VERSION) {
                throw new IllegalStateException("Unsupported schema version " + envelope.getSchemaVersion());
            }
            return envelope.getBody();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored JSON column is not a versioned envelope", e);
        }
    }

    public <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private String serialize(VersionedJson envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize JSON column", e);
        }
    }
}
