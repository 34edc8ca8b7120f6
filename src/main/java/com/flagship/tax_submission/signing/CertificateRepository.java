package com.flagship.tax_submission.signing;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface CertificateRepository extends JpaRepository<CertificateEntity, String> {

    List<CertificateEntity> findByNotAfterBeforeOrderByNotAfterAsc(Instant cutoff);
}
