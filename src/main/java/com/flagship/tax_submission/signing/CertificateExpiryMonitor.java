package com.flagship.tax_submission.signing;

import com.flagship.tax_submission.observability.SubmissionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Daily scan for signing certificates close to expiry.
 */
@Component
@ConditionalOnProperty(name = "certificates.expiry-monitor.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class CertificateExpiryMonitor {

    private final CertificateStore certificateStore;
    private final SubmissionMetrics metrics;
    private final Clock clock;
    private final int warningDays;

    public CertificateExpiryMonitor(CertificateStore certificateStore,
                                    SubmissionMetrics metrics,
                                    Clock clock,
                                    @Value("${certificates.expiry-warning-days:30}") int warningDays) {
        this.certificateStore = certificateStore;
        this.metrics = metrics;
        this.clock = clock;
        this.warningDays = warningDays;
    }

    @Scheduled(cron = "${certificates.expiry-monitor.cron:0 0 6 * * *}")
    public List<CertificateRegistration> checkExpiringCertificates() {
        Instant cutoff = clock.instant().plus(Duration.ofDays(warningDays));
        List<CertificateRegistration> expiring = certificateStore.findExpiringBefore(cutoff);

        for (CertificateRegistration certificate : expiring) {
            if (certificate.getDaysToExpiry() < 0) {
                log.warn("Certificate for tenant {} EXPIRED on {}; signing is blocked",
                    certificate.getTenantId(), certificate.getNotAfter());
            } else {
                log.warn("Certificate for tenant {} expires on {} ({} days left)",
                    certificate.getTenantId(), certificate.getNotAfter(), certificate.getDaysToExpiry());
            }
        }

        metrics.setExpiringCertificates(expiring.size());
        log.debug("Certificate expiry scan complete: {} within {} days", expiring.size(), warningDays);
        return expiring;
    }
}
