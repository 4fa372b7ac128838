package com.flagship.cash_ledger.identity;

import com.flagship.cash_ledger.ingest.RawEvent;
import com.flagship.cash_ledger.ingest.RawEventStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Loads identities together with their backing raw events.
 */
@Component
@RequiredArgsConstructor
public class IdentitySnapshots {

    private final IdentityRepository identityRepository;
    private final RawEventStore rawEventStore;

    public Optional<IdentitySnapshot> load(String tenantId, UUID identityId) {
        return identityRepository.findById(tenantId, identityId)
            .map(identity -> new IdentitySnapshot(identity, rawEventStore.findLinkedTo(identity.getId())));
    }

    /**
     * Every identity of the kind that has at least one linked raw event.
     */
    public List<IdentitySnapshot> loadAll(String tenantId, CanonicalKind kind) {
        Map<UUID, List<RawEvent>> events = rawEventStore.findLinkedByIdentityKind(tenantId, kind);
        return identityRepository.findByKind(tenantId, kind).stream()
            .filter(identity -> events.containsKey(identity.getId()))
            .map(identity -> new IdentitySnapshot(identity, events.get(identity.getId())))
            .toList();
    }
}
