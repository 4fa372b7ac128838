package com.flagship.cash_ledger.review;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExceptionRecordRepository extends JpaRepository<ExceptionRecordEntity, UUID> {

    Optional<ExceptionRecordEntity> findFirstByTenantIdAndDedupeKeyAndStatusOrderByCreatedAtDesc(
        String tenantId, String dedupeKey, ExceptionStatus status);

    List<ExceptionRecordEntity> findByTenantIdAndDedupeKeyAndStatus(
        String tenantId, String dedupeKey, ExceptionStatus status);

    List<ExceptionRecordEntity> findByTenantIdAndStatusOrderByCreatedAtAsc(String tenantId, ExceptionStatus status);

    List<ExceptionRecordEntity> findByTenantIdAndStatusAndKindOrderByCreatedAtAsc(
        String tenantId, ExceptionStatus status, ExceptionKind kind);

    /**
     * Identities referenced by any exception in the given status.
     */
    @Query("""
        SELECT DISTINCT s FROM ExceptionRecordEntity e JOIN e.subjectIdentityIds s
        WHERE e.tenantId = :tenantId AND e.status = :status
        """)
    List<UUID> findSubjectIdentityIds(@Param("tenantId") String tenantId, @Param("status") ExceptionStatus status);

    @Query("""
        SELECT DISTINCT e FROM ExceptionRecordEntity e JOIN e.subjectIdentityIds s
        WHERE e.tenantId = :tenantId AND s = :identityId
        ORDER BY e.createdAt ASC
        """)
    List<ExceptionRecordEntity> findBySubject(@Param("tenantId") String tenantId, @Param("identityId") UUID identityId);

    long countByStatus(ExceptionStatus status);
}
