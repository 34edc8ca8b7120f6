package com.flagship.tax_submission.voiding;

import com.flagship.tax_submission.TestDocuments;
import com.flagship.tax_submission.tenant.Tenant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * These tests verify that:
 * - The communication carries its number, reference date and issue date
 * - Each receipt becomes one numbered line split into series and number
 * - The signature slot comes first and is empty
 */
class VoidCommunicationXmlWriterTest {

    private final VoidCommunicationXmlWriter writer = new VoidCommunicationXmlWriter();
    private final Tenant tenant = TestDocuments.tenant(TestDocuments.TENANT_A);

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static org.w3c.dom.Document parse(String xml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    private static String text(Element parent, String ns, String name) {
        NodeList nodes = parent.getElementsByTagNameNS(ns, name);
        return nodes.getLength() == 0 ? null : nodes.item(0).getTextContent();
    }

    @Test
    @DisplayName("Header fields and one line per receipt")
    void testStructure() throws Exception {
        printTestHeader("Void Communication Structure");

        String xml = writer.write(tenant, "RA-20240315-1", LocalDate.of(2024, 3, 15), LocalDate.of(2024, 3, 14),
            List.of("B001-00000003", "B002-00000017"), "Error en el importe");
        printOutput("XML", xml);

        org.w3c.dom.Document dom = parse(xml);
        Element root = dom.getDocumentElement();
        assertEquals("VoidedDocuments", root.getLocalName());
        assertEquals(VoidCommunicationXmlWriter.VOIDED_DOCUMENTS_NS, root.getNamespaceURI());
        assertEquals("UBLExtensions", root.getFirstChild().getLocalName());
        assertTrue(xml.contains("<ext:ExtensionContent></ext:ExtensionContent>"));

        assertEquals("RA-20240315-1", text(root, VoidCommunicationXmlWriter.CBC_NS, "ID"));
        assertEquals("2024-03-14", text(root, VoidCommunicationXmlWriter.CBC_NS, "ReferenceDate"));
        assertEquals("2024-03-15", text(root, VoidCommunicationXmlWriter.CBC_NS, "IssueDate"));

        NodeList lines = dom.getElementsByTagNameNS(VoidCommunicationXmlWriter.SAC_NS, "VoidedDocumentsLine");
        assertEquals(2, lines.getLength());

        Element second = (Element) lines.item(1);
        assertEquals("2", text(second, VoidCommunicationXmlWriter.CBC_NS, "LineID"));
        assertEquals("03", text(second, VoidCommunicationXmlWriter.CBC_NS, "DocumentTypeCode"));
        assertEquals("B002", text(second, VoidCommunicationXmlWriter.SAC_NS, "DocumentSerialID"));
        assertEquals("00000017", text(second, VoidCommunicationXmlWriter.SAC_NS, "DocumentNumberID"));
        assertEquals("Error en el importe", text(second, VoidCommunicationXmlWriter.SAC_NS, "VoidReasonDescription"));

        printSuccess("Communication rendered");
    }

    @Test
    @DisplayName("The supplier and signature reference name the issuing tenant")
    void testIssuer() throws Exception {
        printTestHeader("Void Communication Issuer");

        String xml = writer.write(tenant, "RA-20240315-1", LocalDate.of(2024, 3, 15), LocalDate.of(2024, 3, 15),
            List.of("B001-00000003"), "Error");
        org.w3c.dom.Document dom = parse(xml);

        assertEquals(TestDocuments.TENANT_A,
            text(dom.getDocumentElement(), VoidCommunicationXmlWriter.CBC_NS, "CustomerAssignedAccountID"));
        assertEquals(tenant.getLegalName(),
            text(dom.getDocumentElement(), VoidCommunicationXmlWriter.CBC_NS, "RegistrationName"));
        assertEquals("#SIGN-" + TestDocuments.TENANT_A,
            text(dom.getDocumentElement(), VoidCommunicationXmlWriter.CBC_NS, "URI"));

        printSuccess("Issuer rendered");
    }

    @Test
    @DisplayName("Reasons containing a CDATA terminator survive intact")
    void testReasonEscaping() throws Exception {
        printTestHeader("Reason Escaping");

        String reason = "Monto <incorrecto> ]]> & duplicado";
        String xml = writer.write(tenant, "RA-20240315-2", LocalDate.of(2024, 3, 15), LocalDate.of(2024, 3, 15),
            List.of("B001-00000003"), reason);
        org.w3c.dom.Document dom = parse(xml);
        String parsed = text(dom.getDocumentElement(), VoidCommunicationXmlWriter.SAC_NS, "VoidReasonDescription");
        printOutput("Parsed reason", parsed);

        assertEquals(reason, parsed);

        printSuccess("Reason preserved");
    }
}
