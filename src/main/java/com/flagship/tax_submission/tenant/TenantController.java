package com.flagship.tax_submission.tenant;

import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.exception.InputValidationException;
import com.flagship.tax_submission.exception.NotFoundException;
import com.flagship.tax_submission.sequence.SeriesService;
import com.flagship.tax_submission.signing.CertificateRegistration;
import com.flagship.tax_submission.signing.CertificateStore;
import com.flagship.tax_submission.tenant.dto.CertificateResponse;
import com.flagship.tax_submission.tenant.dto.RegisterTenantRequest;
import com.flagship.tax_submission.tenant.dto.SeriesRequest;
import com.flagship.tax_submission.tenant.dto.SeriesResponse;
import com.flagship.tax_submission.tenant.dto.TenantResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * REST controller for tenant administration: registration, activation,
 * numbering series and the signing certificate.
 */
@RestController
@RequestMapping("/api/tenants")
@RequiredArgsConstructor
@Slf4j
public class TenantController {

    private final TenantService tenantService;
    private final SeriesService seriesService;
    private final CertificateStore certificateStore;

    @PostMapping
    public ResponseEntity<TenantResponse> registerTenant(@Valid @RequestBody RegisterTenantRequest request) {
        Tenant tenant = tenantService.register(request.getTenantId(), request.getLegalName(),
            request.getTradeName(), request.getAddress(), request.getAuthorityUsername(),
            request.getAuthorityPassword());
        return ResponseEntity.status(HttpStatus.CREATED).body(TenantResponse.from(tenant));
    }

    @GetMapping("/{tenantId}")
    public ResponseEntity<TenantResponse> getTenant(@PathVariable String tenantId) {
        return ResponseEntity.ok(TenantResponse.from(tenantService.getTenant(tenantId)));
    }

    @PostMapping("/{tenantId}/activate")
    public ResponseEntity<TenantResponse> activate(@PathVariable String tenantId) {
        return ResponseEntity.ok(TenantResponse.from(tenantService.setActive(tenantId, true)));
    }

    @PostMapping("/{tenantId}/deactivate")
    public ResponseEntity<TenantResponse> deactivate(@PathVariable String tenantId) {
        return ResponseEntity.ok(TenantResponse.from(tenantService.setActive(tenantId, false)));
    }

    @PostMapping("/{tenantId}/series")
    public ResponseEntity<SeriesResponse> registerSeries(@PathVariable String tenantId,
                                                         @Valid @RequestBody SeriesRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(SeriesResponse.from(seriesService.register(tenantId, request.getKind(), request.getSeries())));
    }

    @GetMapping("/{tenantId}/series")
    public ResponseEntity<List<SeriesResponse>> listSeries(@PathVariable String tenantId) {
        return ResponseEntity.ok(seriesService.list(tenantId).stream().map(SeriesResponse::from).toList());
    }

    @DeleteMapping("/{tenantId}/series/{kind}/{series}")
    public ResponseEntity<SeriesResponse> deactivateSeries(@PathVariable String tenantId,
                                                           @PathVariable DocumentKind kind,
                                                           @PathVariable String series) {
        return ResponseEntity.ok(SeriesResponse.from(seriesService.deactivate(tenantId, kind, series)));
    }

    /**
     * Uploads (or replaces) the tenant's PKCS#12 signing certificate.
     */
    @PutMapping(value = "/{tenantId}/certificate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<CertificateResponse> uploadCertificate(@PathVariable String tenantId,
                                                                 @RequestPart("certificate") MultipartFile file,
                                                                 @RequestParam("passphrase") String passphrase) {
        tenantService.getTenant(tenantId);
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new InputValidationException("certificate", "Unable to read uploaded certificate", e);
        }

        CertificateRegistration registration = certificateStore.register(tenantId, content, passphrase);
        log.info("Certificate uploaded: file={}, size={}", file.getOriginalFilename(), content.length);
        return ResponseEntity.ok(CertificateResponse.from(registration));
    }

    @GetMapping("/{tenantId}/certificate")
    public ResponseEntity<CertificateResponse> certificateStatus(@PathVariable String tenantId) {
        tenantService.getTenant(tenantId);
        return certificateStore.status(tenantId)
            .map(CertificateResponse::from)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new NotFoundException("Certificate", tenantId));
    }
}
