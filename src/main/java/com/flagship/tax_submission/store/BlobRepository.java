package com.flagship.tax_submission.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BlobRepository extends JpaRepository<BlobEntity, String> {

    /**
     * Lists keys without loading content.
     */
    @Query("""
        SELECT b.blobKey FROM BlobEntity b
        WHERE b.tenantId = :tenantId AND b.blobKey LIKE :pattern
        ORDER BY b.blobKey ASC
        """)
    List<String> findKeys(@Param("tenantId") String tenantId, @Param("pattern") String pattern);
}
