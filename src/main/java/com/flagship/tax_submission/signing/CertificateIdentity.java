package com.flagship.tax_submission.signing;

import lombok.extern.slf4j.Slf4j;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.security.auth.x500.X500Principal;
import java.security.cert.X509Certificate;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the fiscal id a certificate was issued to.
 *
 * The subject's SERIALNUMBER attribute wins; otherwise the first standalone
 * 11-digit run anywhere in the subject DN.
 */
@Slf4j
final class CertificateIdentity {

    private static final String SERIAL_NUMBER_OID = "2.5.4.5";
    private static final String SERIAL_NUMBER = "SERIALNUMBER";
    private static final Pattern FISCAL_ID = Pattern.compile("(?<!\\d)\\d{11}(?!\\d)");

    private CertificateIdentity() {
    }

    static Optional<String> fiscalId(X509Certificate certificate) {
        return fiscalId(certificate.getSubjectX500Principal());
    }

    static Optional<String> fiscalId(X500Principal subject) {
        String dn = subject.getName(X500Principal.RFC2253, Map.of(SERIAL_NUMBER_OID, SERIAL_NUMBER));

        try {
            for (Rdn rdn : new LdapName(dn).getRdns()) {
                if (SERIAL_NUMBER.equalsIgnoreCase(rdn.getType())) {
                    Optional<String> id = firstFiscalId(String.valueOf(rdn.getValue()));
                    if (id.isPresent()) {
                        return id;
                    }
                }
            }
        } catch (InvalidNameException e) {
            log.warn("Unparseable certificate subject {}: {}", dn, e.getMessage());
        }

        return firstFiscalId(dn);
    }

    private static Optional<String> firstFiscalId(String text) {
        Matcher matcher = FISCAL_ID.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }
}
