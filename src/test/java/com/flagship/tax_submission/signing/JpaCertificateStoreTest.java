package com.flagship.tax_submission.signing;

import com.flagship.tax_submission.TestDocuments;
import com.flagship.tax_submission.crypto.SecretCipher;
import com.flagship.tax_submission.exception.CertificateExpiredException;
import com.flagship.tax_submission.exception.CertificateOwnershipMismatchException;
import com.flagship.tax_submission.exception.InputValidationException;
import com.flagship.tax_submission.store.TenantIsolatedStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Certificate registration and loading.
 *
 * These tests verify that:
 * - A valid PKCS#12 is stored under the tenant's prefix with an encrypted passphrase
 * - Unreadable, expired or foreign certificates are refused before anything is stored
 * - A stored certificate can be opened again
 */
@ExtendWith(MockitoExtension.class)
class JpaCertificateStoreTest {

    private static final String TENANT = TestDocuments.TENANT_A;
    private static final Instant NOW = Instant.parse("2024-03-15T15:30:00Z");

    @Mock
    private CertificateRepository certificateRepository;

    @Mock
    private TenantIsolatedStore store;

    private SecretCipher secretCipher;
    private JpaCertificateStore certificateStore;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printExpectedException(Exception e) {
        System.out.println("EXPECTED EXCEPTION: " + e.getClass().getSimpleName() + " - " + e.getMessage());
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        secretCipher = new SecretCipher(Base64.getEncoder().encodeToString(new byte[32]));
        certificateStore = new JpaCertificateStore(certificateRepository, store, secretCipher,
            Clock.fixed(NOW, ZoneOffset.UTC), 30);
    }

    private static StoredCertificate certificateValidFor(String fiscalId, int days) {
        return TestCertificates.issue(fiscalId, NOW.minus(Duration.ofDays(10)), NOW.plus(Duration.ofDays(days)));
    }

    @Test
    @DisplayName("Registering a valid keystore stores the file and encrypted passphrase")
    void testRegister() {
        printTestHeader("Register Certificate");

        byte[] pkcs12 = TestCertificates.pkcs12(certificateValidFor(TENANT, 200));
        when(certificateRepository.findById(TENANT)).thenReturn(Optional.empty());
        when(certificateRepository.save(any(CertificateEntity.class))).thenAnswer(i -> i.getArgument(0));

        CertificateRegistration registration = certificateStore.register(TENANT, pkcs12, TestCertificates.PASSPHRASE);
        printOutput("Registration", registration);

        verify(store).putBlob(TENANT, TENANT + "/certificates/" + TENANT + ".p12", pkcs12,
            JpaCertificateStore.PKCS12_CONTENT_TYPE);

        ArgumentCaptor<CertificateEntity> saved = ArgumentCaptor.forClass(CertificateEntity.class);
        verify(certificateRepository).save(saved.capture());
        assertNotEquals(TestCertificates.PASSPHRASE, saved.getValue().getEncryptedPassphrase());
        assertEquals(TestCertificates.PASSPHRASE, secretCipher.decrypt(saved.getValue().getEncryptedPassphrase()));

        assertEquals(TENANT, registration.getTenantId());
        assertEquals(200, registration.getDaysToExpiry());
        assertFalse(registration.isExpiringSoon());
        assertTrue(registration.getSubject().contains(TENANT));
        printSuccess("Certificate registered");
    }

    @Test
    @DisplayName("A certificate close to expiry is accepted but flagged")
    void testExpiringSoon() {
        byte[] pkcs12 = TestCertificates.pkcs12(certificateValidFor(TENANT, 10));
        when(certificateRepository.findById(TENANT)).thenReturn(Optional.empty());
        when(certificateRepository.save(any(CertificateEntity.class))).thenAnswer(i -> i.getArgument(0));

        CertificateRegistration registration = certificateStore.register(TENANT, pkcs12, TestCertificates.PASSPHRASE);

        assertTrue(registration.isExpiringSoon());
        assertEquals(10, registration.getDaysToExpiry());
    }

    @Test
    @DisplayName("A wrong passphrase is an input problem on the certificate field")
    void testWrongPassphrase() {
        printTestHeader("Wrong Passphrase");

        byte[] pkcs12 = TestCertificates.pkcs12(certificateValidFor(TENANT, 200));

        InputValidationException e = assertThrows(InputValidationException.class,
            () -> certificateStore.register(TENANT, pkcs12, "not-the-passphrase"));
        printExpectedException(e);

        assertEquals("certificate", e.getField());
        verify(store, never()).putBlob(anyString(), anyString(), any(), anyString());
        printSuccess("Nothing stored");
    }

    @Test
    @DisplayName("Empty files, blank passphrases and malformed tenant ids are refused")
    void testInputChecks() {
        assertEquals("certificate", assertThrows(InputValidationException.class,
            () -> certificateStore.register(TENANT, new byte[0], "x")).getField());
        assertEquals("passphrase", assertThrows(InputValidationException.class,
            () -> certificateStore.register(TENANT, new byte[]{1}, " ")).getField());
        assertEquals("tenantId", assertThrows(InputValidationException.class,
            () -> certificateStore.register("123", new byte[]{1}, "x")).getField());
    }

    @Test
    @DisplayName("Expired and foreign certificates are refused")
    void testExpiredAndForeign() {
        printTestHeader("Expired And Foreign Certificates");

        byte[] expired = TestCertificates.pkcs12(
            TestCertificates.issue(TENANT, NOW.minus(Duration.ofDays(400)), NOW.minus(Duration.ofDays(5))));
        CertificateExpiredException expiredError = assertThrows(CertificateExpiredException.class,
            () -> certificateStore.register(TENANT, expired, TestCertificates.PASSPHRASE));
        printExpectedException(expiredError);

        byte[] foreign = TestCertificates.pkcs12(certificateValidFor(TestDocuments.TENANT_B, 200));
        CertificateOwnershipMismatchException foreignError = assertThrows(CertificateOwnershipMismatchException.class,
            () -> certificateStore.register(TENANT, foreign, TestCertificates.PASSPHRASE));
        printExpectedException(foreignError);
        assertEquals(TestDocuments.TENANT_B, foreignError.getCertificateOwner());

        verify(store, never()).putBlob(anyString(), anyString(), any(), anyString());
        printSuccess("Unusable certificates rejected");
    }

    @Test
    @DisplayName("A stored certificate is opened with the decrypted passphrase")
    void testFind() {
        StoredCertificate original = certificateValidFor(TENANT, 200);
        byte[] pkcs12 = TestCertificates.pkcs12(original);
        String blobKey = TENANT + "/certificates/" + TENANT + ".p12";
        CertificateEntity entity = CertificateEntity.create(TENANT, blobKey,
            secretCipher.encrypt(TestCertificates.PASSPHRASE), "CN=x", "CN=x", "1",
            original.getNotBefore(), original.getNotAfter(), NOW);
        when(certificateRepository.findById(TENANT)).thenReturn(Optional.of(entity));
        when(store.getBlob(TENANT, blobKey)).thenReturn(Optional.of(pkcs12));

        StoredCertificate loaded = certificateStore.find(TENANT).orElseThrow();

        assertEquals(original.getCertificate(), loaded.getCertificate());
        assertEquals(TENANT, loaded.getTenantId());
        assertNotNull(loaded.getPrivateKey());
    }

    @Test
    @DisplayName("Metadata pointing to a missing file means no certificate")
    void testFindMissingBlob() {
        CertificateEntity entity = CertificateEntity.create(TENANT, TENANT + "/certificates/" + TENANT + ".p12",
            "ignored", "CN=x", "CN=x", "1", NOW, NOW.plus(Duration.ofDays(1)), NOW);
        when(certificateRepository.findById(TENANT)).thenReturn(Optional.of(entity));
        when(store.getBlob(eq(TENANT), anyString())).thenReturn(Optional.empty());

        assertTrue(certificateStore.find(TENANT).isEmpty());
    }
}
