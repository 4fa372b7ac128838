package com.flagship.cash_ledger.health;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness for load balancers, independent of Actuator.
 *
 * UP only when the database answers and the ledger schema has been migrated.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", "cash-ledger");
        response.put("timestamp", clock.instant().toString());

        boolean schemaReady = ledgerSchemaReadable();
        response.put("database", schemaReady ? "UP" : "DOWN");
        response.put("status", schemaReady ? "UP" : "DOWN");

        return ResponseEntity.status(schemaReady ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    private boolean ledgerSchemaReadable() {
        try {
            jdbcTemplate.queryForObject("SELECT COUNT(*) FROM consolidation_watermarks WHERE 1 = 0", Long.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("Health check failed: {}", e.getMessage());
            return false;
        }
    }
}
