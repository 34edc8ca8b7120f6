package com.flagship.tax_submission.observability;

import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.store.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the database-backed gauges: the outbox backlog and the number of
 * documents still open with the authority.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final SubmissionMetrics submissionMetrics;
    private final DocumentRepository documentRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshMetrics() {
        outboxMetrics.refreshMetrics();
        refreshDocumentGauges();
    }

    void refreshDocumentGauges() {
        try {
            long pending = documentRepository.countByState(DocumentState.PENDING);
            long submitted = documentRepository.countByState(DocumentState.SUBMITTED);
            submissionMetrics.setOpenDocuments(pending, submitted);
        } catch (DataAccessException e) {
            log.warn("Failed to refresh document gauges: {}", e.getMessage());
        }
    }
}
