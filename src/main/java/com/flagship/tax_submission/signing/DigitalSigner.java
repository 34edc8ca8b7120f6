package com.flagship.tax_submission.signing;

import com.flagship.tax_submission.exception.CertificateExpiredException;
import com.flagship.tax_submission.exception.CertificateNotFoundException;
import com.flagship.tax_submission.exception.CertificateOwnershipMismatchException;
import com.flagship.tax_submission.exception.MalformedDocumentException;
import com.flagship.tax_submission.exception.SigningFailedException;
import com.flagship.tax_submission.observability.SubmissionMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.crypto.MarshalException;
import javax.xml.crypto.dsig.CanonicalizationMethod;
import javax.xml.crypto.dsig.DigestMethod;
import javax.xml.crypto.dsig.Reference;
import javax.xml.crypto.dsig.SignatureMethod;
import javax.xml.crypto.dsig.SignedInfo;
import javax.xml.crypto.dsig.Transform;
import javax.xml.crypto.dsig.XMLSignature;
import javax.xml.crypto.dsig.XMLSignatureException;
import javax.xml.crypto.dsig.XMLSignatureFactory;
import javax.xml.crypto.dsig.dom.DOMSignContext;
import javax.xml.crypto.dsig.keyinfo.KeyInfo;
import javax.xml.crypto.dsig.keyinfo.KeyInfoFactory;
import javax.xml.crypto.dsig.keyinfo.X509Data;
import javax.xml.crypto.dsig.spec.C14NMethodParameterSpec;
import javax.xml.crypto.dsig.spec.TransformParameterSpec;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies an enveloped XML-DSig signature (RSA-SHA256, SHA-256 digest,
 * inclusive C14N) to a tenant's document.
 *
 * The signature is computed on a parsed copy and then spliced into the
 * original text, so every byte of the input survives: removing the
 * ds:Signature element gives back the input. It lands inside
 * ext:ExtensionContent, or as the root's last child when that placeholder is
 * missing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DigitalSigner {

    public static final String EXTENSIONS_NS =
        "urn:oasis:names:specification:ubl:schema:xsd:CommonExtensionComponents-2";
    static final String SIGNATURE_PREFIX = "ds";
    static final String SIGNATURE_ID_PREFIX = "SIGN-";

    private static final Pattern EXTENSION_CONTENT_START =
        Pattern.compile("<((?:[A-Za-z_][\\w.-]*:)?ExtensionContent)(\\s[^>]*?)?(/?)>");

    private final CertificateStore certificateStore;
    private final Clock clock;
    private final SubmissionMetrics metrics;

    /**
     * Signs {@code rawXml} with the tenant's certificate.
     *
     * @throws MalformedDocumentException if the XML is blank or not well-formed
     * @throws CertificateNotFoundException if the tenant has no certificate
     * @throws CertificateExpiredException if now is outside the certificate's validity window
     * @throws CertificateOwnershipMismatchException if the certificate belongs to another fiscal id
     */
    public String sign(String tenantId, String rawXml) {
        long startTime = System.currentTimeMillis();
        try {
            Document document = SecureXml.parse(rawXml);
            StoredCertificate certificate = requireUsableCertificate(tenantId);

            Element placeholder = findExtensionContent(document);
            Element parent = placeholder != null ? placeholder : document.getDocumentElement();
            Element signature = createSignature(tenantId, certificate, parent);

            String signed = splice(rawXml, serialize(signature), placeholder != null,
                document.getDocumentElement().getTagName());

            metrics.recordSigning("success");
            log.info("Signed document for tenant {} in {}ms", tenantId, System.currentTimeMillis() - startTime);
            return signed;

        } catch (RuntimeException e) {
            metrics.recordSigning("failure");
            log.warn("Signing failed for tenant {}: {}", tenantId, e.getMessage());
            throw e;
        }
    }

    private StoredCertificate requireUsableCertificate(String tenantId) {
        StoredCertificate certificate = certificateStore.find(tenantId)
            .orElseThrow(() -> new CertificateNotFoundException(tenantId));

        Instant now = clock.instant();
        if (!certificate.isValidAt(now)) {
            throw new CertificateExpiredException(tenantId, certificate.getNotBefore(), certificate.getNotAfter());
        }

        String owner = CertificateIdentity.fiscalId(certificate.getCertificate()).orElse(null);
        if (!tenantId.equals(owner)) {
            throw new CertificateOwnershipMismatchException(tenantId, owner);
        }
        return certificate;
    }

    private Element createSignature(String tenantId, StoredCertificate certificate, Element parent) {
        try {
            XMLSignatureFactory factory = XMLSignatureFactory.getInstance("DOM");

            Reference reference = factory.newReference("",
                factory.newDigestMethod(DigestMethod.SHA256, null),
                List.of(factory.newTransform(Transform.ENVELOPED, (TransformParameterSpec) null)),
                null, null);

            SignedInfo signedInfo = factory.newSignedInfo(
                factory.newCanonicalizationMethod(CanonicalizationMethod.INCLUSIVE, (C14NMethodParameterSpec) null),
                factory.newSignatureMethod(SignatureMethod.RSA_SHA256, null),
                List.of(reference));

            X509Certificate x509 = certificate.getCertificate();
            KeyInfoFactory keyInfoFactory = factory.getKeyInfoFactory();
            X509Data x509Data = keyInfoFactory.newX509Data(List.of(x509));
            KeyInfo keyInfo = keyInfoFactory.newKeyInfo(List.of(x509Data));

            DOMSignContext context = new DOMSignContext(certificate.getPrivateKey(), parent);
            context.setDefaultNamespacePrefix(SIGNATURE_PREFIX);

            XMLSignature signature = factory.newXMLSignature(signedInfo, keyInfo, null,
                SIGNATURE_ID_PREFIX + tenantId, null);
            signature.sign(context);

            return (Element) parent.getLastChild();

        } catch (GeneralSecurityException | MarshalException | XMLSignatureException e) {
            throw new SigningFailedException("Unable to sign document for tenant " + tenantId, e);
        }
    }

    private static Element findExtensionContent(Document document) {
        NodeList nodes = document.getElementsByTagNameNS(EXTENSIONS_NS, "ExtensionContent");
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                return (Element) node;
            }
        }
        return null;
    }

    private static String serialize(Element signature) {
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(signature), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new SigningFailedException("Unable to serialize signature element", e);
        }
    }

    /**
     * Inserts the serialized signature into the original text.
     */
    static String splice(String rawXml, String signatureXml, boolean intoExtensionContent, String rootName) {
        if (intoExtensionContent) {
            Matcher matcher = EXTENSION_CONTENT_START.matcher(rawXml);
            if (matcher.find()) {
                String name = matcher.group(1);
                if ("/".equals(matcher.group(3))) {
                    String attributes = matcher.group(2) != null ? matcher.group(2) : "";
                    String expanded = "<" + name + attributes + ">" + signatureXml + "</" + name + ">";
                    return rawXml.substring(0, matcher.start()) + expanded + rawXml.substring(matcher.end());
                }
                int endTag = rawXml.indexOf("</" + name, matcher.end());
                int insertAt = endTag >= 0 ? endTag : matcher.end();
                return rawXml.substring(0, insertAt) + signatureXml + rawXml.substring(insertAt);
            }
        }

        int rootEnd = rawXml.lastIndexOf("</");
        if (rootEnd >= 0) {
            return rawXml.substring(0, rootEnd) + signatureXml + rawXml.substring(rootEnd);
        }

        // self-closing root
        int selfClose = rawXml.lastIndexOf("/>");
        if (selfClose < 0) {
            throw new MalformedDocumentException("Root element has no closing tag to sign into");
        }
        return rawXml.substring(0, selfClose) + ">" + signatureXml + "</" + rootName + ">"
            + rawXml.substring(selfClose + 2);
    }
}
