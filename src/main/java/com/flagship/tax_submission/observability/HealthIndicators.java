package com.flagship.tax_submission.observability;

import com.flagship.tax_submission.outbox.OutboxEventRepository;
import com.flagship.tax_submission.signing.CertificateEntity;
import com.flagship.tax_submission.signing.CertificateRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Readiness checks for the submission pipeline's infrastructure.
 */
public class HealthIndicators {

    /**
     * Outbox backlog. Document lifecycle events that pile up mean downstream
     * consumers are falling behind on issued and accepted documents.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countUnpublished();
                long deadLetters = outboxRepository.countDeadLetters(maxRetries);

                Health.Builder builder;
                if (backlog >= BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.down();
                } else if (backlog >= BACKLOG_WARNING_THRESHOLD || deadLetters > 0) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }

                return builder
                        .withDetail("backlogSize", backlog)
                        .withDetail("deadLetters", deadLetters)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Signing certificates. A tenant whose certificate expired can no longer
     * submit anything, so expired certificates report WARNING with the tenants
     * affected; certificates inside the warning window are listed as details.
     */
    @Component("signingCertificatesHealth")
    public static class SigningCertificatesHealthIndicator implements HealthIndicator {

        private final CertificateRepository certificateRepository;
        private final Clock clock;
        private final int warningDays;

        public SigningCertificatesHealthIndicator(CertificateRepository certificateRepository, Clock clock,
                                                  @Value("${certificates.expiry-warning-days:30}") int warningDays) {
            this.certificateRepository = certificateRepository;
            this.clock = clock;
            this.warningDays = warningDays;
        }

        @Override
        public Health health() {
            try {
                Instant now = Instant.now(clock);
                List<CertificateEntity> soon = certificateRepository
                        .findByNotAfterBeforeOrderByNotAfterAsc(now.plus(Duration.ofDays(warningDays)));
                List<String> expired = soon.stream()
                        .filter(certificate -> certificate.getNotAfter().isBefore(now))
                        .map(CertificateEntity::getTenantId)
                        .toList();
                List<String> expiring = soon.stream()
                        .filter(certificate -> !certificate.getNotAfter().isBefore(now))
                        .map(CertificateEntity::getTenantId)
                        .toList();

                Health.Builder builder = expired.isEmpty() ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("expiredTenants", expired)
                        .withDetail("expiringTenants", expiring)
                        .withDetail("warningDays", warningDays)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Redis backs the idempotency fast path only; losing it degrades, never fails.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency keys fall back to the documents table";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }

                try (var connection = connectionFactory.getConnection()) {
                    String reply = connection.ping();
                    if ("PONG".equals(reply)) {
                        return Health.up().withDetail("response", reply).build();
                    }
                    return degraded("Unexpected ping reply: " + reply);
                }

            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
        }
    }

    /**
     * The producer behind the outbox publisher.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka producer metrics available")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
