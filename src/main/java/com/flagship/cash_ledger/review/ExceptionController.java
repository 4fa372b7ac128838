package com.flagship.cash_ledger.review;

import com.flagship.cash_ledger.review.dto.ExceptionResponse;
import com.flagship.cash_ledger.review.dto.ResolveExceptionRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Human review surface over the exception queue.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ExceptionController {

    private final ExceptionManager exceptionManager;

    /**
     * Lists a tenant's exceptions, open ones unless a status is given.
     */
    @GetMapping("/api/tenants/{tenantId}/exceptions")
    public ResponseEntity<List<ExceptionResponse>> list(@PathVariable String tenantId,
                                                        @RequestParam(required = false) ExceptionKind kind,
                                                        @RequestParam(required = false) ExceptionStatus status) {
        return ResponseEntity.ok(exceptionManager.list(tenantId, kind, status).stream()
            .map(ExceptionResponse::from)
            .toList());
    }

    @GetMapping("/api/exceptions/{id}")
    public ResponseEntity<ExceptionResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(ExceptionResponse.from(exceptionManager.get(id)));
    }

    @PostMapping("/api/exceptions/{id}/resolution")
    public ResponseEntity<ExceptionResponse> resolve(@PathVariable UUID id,
                                                     @Valid @RequestBody ResolveExceptionRequest request) {
        log.info("Resolution submitted for exception {} with {} edge(s)", id,
            request.getEdges() == null ? 0 : request.getEdges().size());
        ExceptionRecord resolved = exceptionManager.resolve(id, request.toProposals(), request.getNote());
        return ResponseEntity.ok(ExceptionResponse.from(resolved));
    }
}
