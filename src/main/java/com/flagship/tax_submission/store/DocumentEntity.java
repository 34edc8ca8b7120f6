package com.flagship.tax_submission.store;

import com.flagship.tax_submission.document.CurrencyCode;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.document.DocumentState;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for issued documents.
 *
 * Key design principles:
 * - No @Setter: issued content is immutable once written
 * - State is changed only by the conditional update in {@link DocumentRepository}
 * - Parties, items and the transmission error log are JSON columns
 * - The idempotency key is a persistence concern and never reaches the domain model
 */
@Entity
@Table(
    name = "documents",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_documents_tenant_number", columnNames = {"tenant_id", "document_number"}),
        @UniqueConstraint(name = "uq_documents_tenant_idempotency", columnNames = {"tenant_id", "idempotency_key"})
    },
    indexes = {
        @Index(name = "idx_documents_tenant_state", columnList = "tenant_id, state"),
        @Index(name = "idx_documents_tenant_issued_at", columnList = "tenant_id, issued_at")
    }
)
@Getter
@Builder(access = AccessLevel.PACKAGE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DocumentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 11)
    private String tenantId;

    @Column(name = "document_number", nullable = false, updatable = false, length = 20)
    private String documentNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private DocumentKind kind;

    @Column(nullable = false, updatable = false, length = 4)
    private String series;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private long sequenceNumber;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Column(nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String issuer;

    @Column(nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String recipient;

    @Column(nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String items;

    @Column(nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "tax_amount", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal taxAmount;

    @Column(nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal total;

    @Column(name = "referenced_number", updatable = false, length = 20)
    private String referencedNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "referenced_kind", updatable = false, length = 20)
    private DocumentKind referencedKind;

    @Column(name = "reference_reason_code", updatable = false, length = 2)
    private String referenceReasonCode;

    @Column(name = "reference_description", updatable = false, length = 500)
    private String referenceDescription;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DocumentState state;

    @Column(name = "raw_xml", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String rawXml;

    @Column(name = "signed_xml_key", length = 300)
    private String signedXmlKey;

    @Column(name = "receipt_code", length = 20)
    private String receiptCode;

    @Column(name = "receipt_message", columnDefinition = "TEXT")
    private String receiptMessage;

    @Column(name = "receipt_ticket", length = 100)
    private String receiptTicket;

    @Column(name = "receipt_received_at")
    private Instant receiptReceivedAt;

    @Column(name = "receipt_body_key", length = 300)
    private String receiptBodyKey;

    @Column(name = "transmission_errors", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String transmissionErrors;

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    void attachSignedXml(String blobKey) {
        if (this.signedXmlKey != null && !this.signedXmlKey.equals(blobKey)) {
            throw new IllegalStateException(
                "Document " + documentNumber + " already has signed XML at " + signedXmlKey);
        }
        this.signedXmlKey = blobKey;
    }

    void attachReceipt(String code, String message, String ticket, Instant receivedAt, String bodyKey) {
        this.receiptCode = code;
        this.receiptMessage = message;
        this.receiptTicket = ticket;
        this.receiptReceivedAt = receivedAt;
        this.receiptBodyKey = bodyKey;
    }

    void recordTransmissionErrors(String errorsJson) {
        this.transmissionErrors = errorsJson;
    }
}
