package com.flagship.cash_ledger.graph;

import com.flagship.cash_ledger.common.exception.ResourceNotFoundException;
import com.flagship.cash_ledger.identity.IdentitySnapshot;
import com.flagship.cash_ledger.identity.IdentitySnapshots;
import com.flagship.cash_ledger.ledger.CashLedgerEntry;
import com.flagship.cash_ledger.ledger.LedgerService;
import com.flagship.cash_ledger.review.ExceptionManager;
import com.flagship.cash_ledger.review.ExceptionRecord;
import com.flagship.cash_ledger.review.dto.ExceptionResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Answers "why is this number in the ledger" by walking the identity graph.
 */
@Service
@RequiredArgsConstructor
public class ProvenanceService {

    static final int MAX_NODES = 200;

    private final IdentitySnapshots identitySnapshots;
    private final GraphStore graphStore;
    private final LedgerService ledgerService;
    private final ExceptionManager exceptionManager;

    /**
     * Breadth-first traversal from the identity over edges in both directions,
     * bounded to {@value #MAX_NODES} nodes.
     *
     * @throws ResourceNotFoundException if the identity does not exist for the tenant
     */
    @Transactional(readOnly = true)
    public ProvenanceGraph trace(String tenantId, UUID identityId) {
        IdentitySnapshot root = identitySnapshots.load(tenantId, identityId)
            .orElseThrow(() -> new ResourceNotFoundException("Identity not found: " + identityId));

        Map<UUID, IdentitySnapshot> visited = new LinkedHashMap<>();
        Map<UUID, IdentityEdge> edges = new LinkedHashMap<>();
        Deque<UUID> queue = new ArrayDeque<>();
        visited.put(root.getId(), root);
        queue.add(root.getId());
        boolean truncated = false;

        while (!queue.isEmpty()) {
            UUID current = queue.poll();
            for (IdentityEdge edge : graphStore.edgesOf(tenantId, current)) {
                UUID neighbour = edge.getFromIdentityId().equals(current) ? edge.getToIdentityId() : edge.getFromIdentityId();
                if (!visited.containsKey(neighbour)) {
                    if (visited.size() >= MAX_NODES) {
                        truncated = true;
                        continue;
                    }
                    identitySnapshots.load(tenantId, neighbour).ifPresent(snapshot -> {
                        visited.put(neighbour, snapshot);
                        queue.add(neighbour);
                    });
                }
                if (visited.containsKey(neighbour)) {
                    edges.putIfAbsent(edge.getId(), edge);
                }
            }
        }

        List<CashLedgerEntry> entries = new ArrayList<>();
        Map<UUID, ExceptionRecord> exceptions = new LinkedHashMap<>();
        for (UUID id : visited.keySet()) {
            ledgerService.findByIdentity(tenantId, id).ifPresent(entries::add);
            exceptionManager.findBySubject(tenantId, id).forEach(e -> exceptions.putIfAbsent(e.getId(), e));
        }

        return ProvenanceGraph.builder()
            .rootIdentityId(root.getId())
            .nodes(visited.values().stream().map(ProvenanceService::node).toList())
            .edges(new ArrayList<>(edges.values()))
            .ledgerEntries(entries)
            .exceptions(exceptions.values().stream()
                .sorted(Comparator.comparing(ExceptionRecord::getCreatedAt))
                .map(ExceptionResponse::from)
                .toList())
            .truncated(truncated)
            .build();
    }

    private static ProvenanceGraph.Node node(IdentitySnapshot snapshot) {
        List<ProvenanceGraph.RawEventRef> events = snapshot.getEvents().stream()
            .map(event -> ProvenanceGraph.RawEventRef.builder()
                .rawEventId(event.getId())
                .source(event.getSource())
                .kind(event.getKind())
                .externalId(event.getExternalId())
                .occurredAt(event.getOccurredAt())
                .amount(event.getAmount())
                .currency(event.getCurrency())
                .counterparty(event.getCounterparty())
                .build())
            .toList();
        return ProvenanceGraph.Node.builder()
            .identityId(snapshot.getId())
            .canonicalKind(snapshot.getKind())
            .lowConfidence(snapshot.getIdentity().isLowConfidence())
            .rawEvents(events)
            .build();
    }
}
