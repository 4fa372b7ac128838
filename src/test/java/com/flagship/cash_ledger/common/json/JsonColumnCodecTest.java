package com.flagship.cash_ledger.common.json;

import com.flagship.cash_ledger.config.JacksonConfig;
import com.flagship.cash_ledger.review.ExceptionKind;
import com.flagship.cash_ledger.review.context.ExceptionContext;
import com.flagship.cash_ledger.review.context.TimingDriftContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JsonColumnCodecTest {

    private final JsonColumnCodec codec = new JsonColumnCodec(new JacksonConfig().objectMapper());

    @Test
    @DisplayName("Exception context is stored in a versioned envelope and read back by its type tag")
    void polymorphicContextInEnvelope() {
        UUID payoutId = UUID.randomUUID();
        TimingDriftContext drift = TimingDriftContext.builder()
            .matcher("payout-settlement")
            .subjectIdentityId(payoutId)
            .reason(TimingDriftContext.Reason.UNSETTLED)
            .expectedAmount(new BigDecimal("120.00"))
            .expectedArrival(LocalDate.of(2024, 3, 5))
            .daysPastExpected(9)
            .build();

        String column = codec.write(drift);
        ExceptionContext read = codec.read(column, ExceptionContext.class);

        assertTrue(column.contains("\"schema_version\":1"));
        assertTrue(column.contains("\"type\":\"TIMING_DRIFT\""));
        TimingDriftContext back = assertInstanceOf(TimingDriftContext.class, read);
        assertEquals(ExceptionKind.TIMING_DRIFT, back.kind());
        assertEquals(payoutId, back.getSubjectIdentityId());
        assertEquals(LocalDate.of(2024, 3, 5), back.getExpectedArrival());
        assertEquals("TIMING_DRIFT:payout-settlement:" + payoutId, back.dedupeKey());
    }

    @Test
    @DisplayName("Unknown body fields are ignored")
    void additiveBodies() {
        String column = "{\"schema_version\":1,\"body\":{\"type\":\"TIMING_DRIFT\",\"matcher\":\"m\",\"added_later\":true}}";

        ExceptionContext read = codec.read(column, ExceptionContext.class);

        assertEquals("m", read.getMatcher());
    }

    @Test
    @DisplayName("A newer schema version is rejected")
    void newerSchemaVersion() {
        String column = "{\"schema_version\":99,\"body\":{}}";

        assertThrows(IllegalStateException.class, () -> codec.readBody(column));
        assertNull(codec.readBody(null));
    }
}
