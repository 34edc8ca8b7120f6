package com.flagship.tax_submission.voiding;

import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.generation.dto.DocumentResponse;
import com.flagship.tax_submission.observability.CorrelationContext;
import com.flagship.tax_submission.voiding.dto.CreditNoteRequestDto;
import com.flagship.tax_submission.voiding.dto.VoidCommunicationRequest;
import com.flagship.tax_submission.voiding.dto.VoidCommunicationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for voiding accepted documents.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}")
@RequiredArgsConstructor
@Slf4j
public class VoidingController {

    private final VoidingService voidingService;

    @PostMapping("/documents/{invoiceNumber}/credit-notes")
    public ResponseEntity<DocumentResponse> issueCreditNote(@PathVariable String tenantId,
                                                            @PathVariable String invoiceNumber,
                                                            @Valid @RequestBody CreditNoteRequestDto request) {
        CorrelationContext.putDocument(tenantId, invoiceNumber);
        try {
            Document creditNote = voidingService.issueCreditNote(tenantId, invoiceNumber, request.toDomain());
            return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(creditNote));
        } finally {
            CorrelationContext.clearDocument();
        }
    }

    @PostMapping("/void-communications")
    public ResponseEntity<VoidCommunicationResponse> issueVoidCommunication(
            @PathVariable String tenantId,
            @Valid @RequestBody VoidCommunicationRequest request) {
        VoidCommunication communication = voidingService.issueVoidCommunication(tenantId,
            request.getVoidDate(), request.getDocumentNumbers(), request.getReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(VoidCommunicationResponse.from(communication));
    }

    @GetMapping("/void-communications")
    public ResponseEntity<List<String>> listVoidCommunications(@PathVariable String tenantId) {
        return ResponseEntity.ok(voidingService.listVoidCommunications(tenantId));
    }

    @GetMapping(value = "/void-communications/{communicationNumber}", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<byte[]> getVoidCommunication(@PathVariable String tenantId,
                                                       @PathVariable String communicationNumber) {
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_XML)
            .body(voidingService.getVoidCommunicationXml(tenantId, communicationNumber));
    }
}
