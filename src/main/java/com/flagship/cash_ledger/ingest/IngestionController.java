package com.flagship.cash_ledger.ingest;

import com.flagship.cash_ledger.ingest.dto.IngestRawEventsRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Batch ingestion of normalized raw events from connectors.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}/raw-events")
@RequiredArgsConstructor
@Slf4j
public class IngestionController {

    private final IngestionService ingestionService;

    /**
     * Stores a batch. Per-record rejections are reported in the body; the
     * request itself succeeds as long as the batch could be read.
     */
    @PostMapping
    public ResponseEntity<IngestionResult> ingest(@PathVariable String tenantId,
                                                  @Valid @RequestBody IngestRawEventsRequest request) {
        log.info("Received raw event batch: tenantId={}, size={}", tenantId, request.getEvents().size());
        return ResponseEntity.ok(ingestionService.ingest(tenantId, request.getEvents()));
    }
}
