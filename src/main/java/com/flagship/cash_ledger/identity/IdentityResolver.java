package com.flagship.cash_ledger.identity;

import com.flagship.cash_ledger.ingest.InvalidRawEventException;
import com.flagship.cash_ledger.ingest.RawEvent;
import com.flagship.cash_ledger.observability.CashLedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Maps raw events to canonical identities.
 *
 * Writes at most one identity and exactly one link per call. Never rewrites
 * an existing fingerprint. Must run inside the transaction that stored the
 * raw event so a stored event always has its link.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityResolver {

    private final FingerprintEngine fingerprintEngine;
    private final IdentityRepository identityRepository;
    private final CashLedgerMetrics metrics;
    private final Clock clock;

    /**
     * Resolves a stored raw event to its identity.
     *
     * @throws InvalidRawEventException if the fingerprint already belongs to an identity of another kind
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public IdentityLink resolve(RawEvent event) {
        Fingerprint fingerprint = fingerprintEngine.fingerprint(event);
        Instant now = clock.instant();

        boolean created = identityRepository.insertIfAbsent(event.getTenantId(), fingerprint, now);
        Identity identity = identityRepository.findByFingerprint(event.getTenantId(), fingerprint.getKey())
            .orElseThrow(() -> new IllegalStateException(
                "Identity vanished after insert-or-fetch: " + fingerprint.getKey()));

        if (identity.getCanonicalKind() != fingerprint.getCanonicalKind()) {
            throw new InvalidRawEventException(event.getExternalId(), String.format(
                "fingerprint collides with %s identity %s but event resolves to %s",
                identity.getCanonicalKind(), identity.getId(), fingerprint.getCanonicalKind()));
        }

        IdentityLink link = IdentityLink.builder()
            .id(UUID.randomUUID())
            .tenantId(event.getTenantId())
            .identityId(identity.getId())
            .rawEventId(event.getId())
            .confidence(fingerprint.getConfidence())
            .reason((created ? "new identity: " : "merged: ") + fingerprint.getReason())
            .createdAt(now)
            .identityCreated(created)
            .build();
        identityRepository.insertLink(link);

        if (fingerprint.isLowConfidence() && !identity.isLowConfidence()) {
            identityRepository.markLowConfidence(identity.getId());
        }
        if (!created) {
            identityRepository.touch(List.of(identity.getId()), now);
        }

        metrics.recordIdentityResolution(fingerprint.getCanonicalKind().name(), created, fingerprint.isLowConfidence());
        if (fingerprint.isLowConfidence()) {
            log.warn("Low-confidence fingerprint: rawEventId={}, identityId={}, reason={}",
                event.getId(), identity.getId(), fingerprint.getReason());
        } else {
            log.debug("Resolved raw event {} to identity {} (created={})", event.getId(), identity.getId(), created);
        }
        return link;
    }
}
