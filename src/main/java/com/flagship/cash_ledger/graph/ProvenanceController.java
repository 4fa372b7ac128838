package com.flagship.cash_ledger.graph;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class ProvenanceController {

    private final ProvenanceService provenanceService;

    @GetMapping("/api/tenants/{tenantId}/identities/{identityId}/provenance")
    public ResponseEntity<ProvenanceGraph> provenance(@PathVariable String tenantId, @PathVariable UUID identityId) {
        return ResponseEntity.ok(provenanceService.trace(tenantId, identityId));
    }
}
