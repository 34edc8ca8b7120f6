package com.flagship.tax_submission.store;

import com.flagship.tax_submission.document.DocumentState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for documents. Every lookup is scoped by tenant id.
 */
@Repository
public interface DocumentRepository extends JpaRepository<DocumentEntity, UUID>,
        JpaSpecificationExecutor<DocumentEntity> {

    Optional<DocumentEntity> findByTenantIdAndDocumentNumber(String tenantId, String documentNumber);

    Optional<DocumentEntity> findByTenantIdAndIdempotencyKey(String tenantId, String idempotencyKey);

    /**
     * Conditional state change: only applies if the document is still in the
     * expected state. Returns the number of rows changed (0 or 1).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE DocumentEntity d
        SET d.state = :to, d.updatedAt = :now
        WHERE d.tenantId = :tenantId AND d.documentNumber = :documentNumber AND d.state = :from
        """)
    int transitionState(@Param("tenantId") String tenantId,
                        @Param("documentNumber") String documentNumber,
                        @Param("from") DocumentState from,
                        @Param("to") DocumentState to,
                        @Param("now") Instant now);

    long countByState(DocumentState state);
}
