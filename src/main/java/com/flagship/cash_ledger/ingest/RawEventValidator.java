package com.flagship.cash_ledger.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.cash_ledger.ingest.dto.RawEventCommand;
import com.flagship.cash_ledger.ingest.payload.BalanceTransactionPayload;
import com.flagship.cash_ledger.ingest.payload.EventPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Turns an inbound command into a {@link RawEvent}, or rejects it.
 */
@Component
@RequiredArgsConstructor
public class RawEventValidator {

    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");
    private static final Pattern SOURCE = Pattern.compile("^[a-z0-9_\\-]{1,32}$");
    private static final int MAX_SCALE = 4;
    private static final int MAX_EXTERNAL_ID_LENGTH = 255;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RawEvent validate(String tenantId, RawEventCommand command) {
        String externalId = command.getExternalId();

        if (tenantId == null || tenantId.isBlank()) {
            throw new InvalidRawEventException(externalId, "tenant is required");
        }
        if (tenantId.length() > 64) {
            throw new InvalidRawEventException(externalId, "tenant must be at most 64 characters");
        }
        if (externalId == null || externalId.isBlank()) {
            throw new InvalidRawEventException(null, "external_id is required");
        }
        if (externalId.length() > MAX_EXTERNAL_ID_LENGTH) {
            throw new InvalidRawEventException(externalId, "external_id is longer than " + MAX_EXTERNAL_ID_LENGTH);
        }

        String source = command.getSource() == null ? null : command.getSource().trim().toLowerCase(Locale.ROOT);
        if (source == null || !SOURCE.matcher(source).matches()) {
            throw new InvalidRawEventException(externalId, "source is required and must match " + SOURCE.pattern());
        }

        RawEventKind kind = parseKind(externalId, command.getKind());

        if (command.getOccurredAt() == null) {
            throw new InvalidRawEventException(externalId, "occurred_at is required");
        }

        BigDecimal amount = command.getAmount();
        if (amount == null) {
            throw new InvalidRawEventException(externalId, "amount is required");
        }
        if (amount.signum() == 0) {
            throw new InvalidRawEventException(externalId, "amount must not be zero");
        }
        if (amount.stripTrailingZeros().scale() > MAX_SCALE) {
            throw new InvalidRawEventException(externalId, "amount has more than " + MAX_SCALE + " decimal places");
        }

        String currency = command.getCurrency() == null ? null : command.getCurrency().trim().toUpperCase(Locale.ROOT);
        if (currency == null || !CURRENCY.matcher(currency).matches()) {
            throw new InvalidRawEventException(externalId, "currency must be a 3-letter ISO code");
        }

        EventPayload payload = readPayload(externalId, kind, command.getPayload());
        if (payload instanceof BalanceTransactionPayload balance && balance.getSubType() == null) {
            throw new InvalidRawEventException(externalId, "balance transaction requires payload.sub_type");
        }

        return RawEvent.builder()
            .id(UUID.randomUUID())
            .tenantId(tenantId)
            .source(source)
            .kind(kind)
            .externalId(externalId.trim())
            .occurredAt(command.getOccurredAt())
            .amount(amount)
            .currency(currency)
            .accountRef(blankToNull(command.getAccountRef()))
            .counterparty(blankToNull(command.getCounterparty()))
            .parentExternalId(blankToNull(command.getParentExternalId()))
            .payload(payload)
            .receivedAt(clock.instant())
            .build();
    }

    private RawEventKind parseKind(String externalId, String kind) {
        if (kind == null || kind.isBlank()) {
            throw new InvalidRawEventException(externalId, "kind is required");
        }
        try {
            return RawEventKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRawEventException(externalId, "unknown kind: " + kind);
        }
    }

    private EventPayload readPayload(String externalId, RawEventKind kind, JsonNode node) {
        JsonNode body = node == null || node.isNull() ? objectMapper.createObjectNode() : node;
        if (!body.isObject()) {
            throw new InvalidRawEventException(externalId, "payload must be a JSON object");
        }
        try {
            return objectMapper.treeToValue(body, kind.payloadType());
        } catch (Exception e) {
            throw new InvalidRawEventException(externalId, "payload is not a valid " + kind + " payload", e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
