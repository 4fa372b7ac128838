package com.flagship.cash_ledger.consolidation;

import com.flagship.cash_ledger.consolidation.dto.ConsolidationRequest;
import com.flagship.cash_ledger.consolidation.dto.ConsolidationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * On-demand consolidation trigger.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}/consolidations")
@RequiredArgsConstructor
@Slf4j
public class ConsolidationController {

    private final ConsolidationService consolidationService;

    @PostMapping
    public ResponseEntity<ConsolidationResponse> consolidate(@PathVariable String tenantId,
                                                             @RequestBody(required = false) ConsolidationRequest request) {
        if (request == null || request.getSince() == null) {
            log.info("Consolidation requested from watermark: tenantId={}", tenantId);
            return ResponseEntity.ok(ConsolidationResponse.from(consolidationService.consolidateFromWatermark(tenantId)));
        }
        log.info("Consolidation requested: tenantId={}, since={}", tenantId, request.getSince());
        return ResponseEntity.ok(ConsolidationResponse.from(consolidationService.consolidate(tenantId, request.getSince())));
    }
}
