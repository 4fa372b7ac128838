package com.flagship.cash_ledger.review.context;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.cash_ledger.review.ExceptionKind;

import java.util.Set;
import java.util.UUID;

/**
 * Structured, kind-specific detail of an exception: everything a reviewer
 * needs to decide without re-deriving the ambiguity.
 *
 * Stored inside the versioned JSON envelope with a {@code type} tag. Fields
 * are only ever added.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AmbiguousMatchContext.class, name = "AMBIGUOUS_MATCH"),
    @JsonSubTypes.Type(value = NoMatchContext.class, name = "NO_MATCH"),
    @JsonSubTypes.Type(value = GhostRecordContext.class, name = "GHOST_RECORD"),
    @JsonSubTypes.Type(value = TimingDriftContext.class, name = "TIMING_DRIFT")
})
public interface ExceptionContext {

    ExceptionKind kind();

    /** Name of the matcher or detector that raised it. */
    String getMatcher();

    /** The identity the question is about. */
    UUID getSubjectIdentityId();

    /** Subject plus every candidate identity mentioned. */
    Set<UUID> referencedIdentityIds();

    default String dedupeKey() {
        return kind().name() + ":" + getMatcher() + ":" + getSubjectIdentityId();
    }
}
