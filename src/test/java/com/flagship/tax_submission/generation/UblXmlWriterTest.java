package com.flagship.tax_submission.generation;

import com.flagship.tax_submission.TestDocuments;
import com.flagship.tax_submission.document.CurrencyCode;
import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.document.DocumentReference;
import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.document.LineItem;
import com.flagship.tax_submission.document.Party;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UblXmlWriterTest {

    private static final ZoneId LIMA = ZoneId.of("America/Lima");

    private final UblXmlWriter writer = new UblXmlWriter();

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

    private static String cbc(org.w3c.dom.Document dom, String name) {
        NodeList nodes = dom.getElementsByTagNameNS(UblXmlWriter.CBC_NS, name);
        return nodes.getLength() == 0 ? null : nodes.item(0).getTextContent();
    }

    @Test
    @DisplayName("Receipts render under the Invoice root with an empty signature slot first")
    void testReceiptStructure() throws Exception {
        printTestHeader("Receipt Structure");

        Document receipt = TestDocuments.receipt(TestDocuments.TENANT_A, "B001-00000001", DocumentState.PENDING);
        String xml = writer.write(receipt, LIMA);
        printOutput("XML length", xml.length());

        org.w3c.dom.Document dom = parse(xml);
        Element root = dom.getDocumentElement();
        assertEquals("Invoice", root.getLocalName());
        assertEquals(UblXmlWriter.INVOICE_NS, root.getNamespaceURI());

        Node first = root.getFirstChild();
        assertEquals("UBLExtensions", first.getLocalName());
        Element content = (Element) dom.getElementsByTagNameNS(UblXmlWriter.EXT_NS, "ExtensionContent").item(0);
        assertEquals("", content.getTextContent());
        assertTrue(xml.contains("<ext:ExtensionContent></ext:ExtensionContent>"));

        assertEquals("B001-00000001", cbc(dom, "ID"));
        assertEquals("03", cbc(dom, "InvoiceTypeCode"));
        assertEquals("PEN", cbc(dom, "DocumentCurrencyCode"));
        assertEquals("118.00", cbc(dom, "PayableAmount"));
        assertEquals(1, dom.getElementsByTagNameNS(UblXmlWriter.CAC_NS, "InvoiceLine").getLength());
        printSuccess("UBL skeleton rendered");
    }

    @Test
    @DisplayName("Issue date and time are rendered in the configured zone")
    void testIssueDateInZone() throws Exception {
        Document late = TestDocuments.receipt(TestDocuments.TENANT_A, "B001-00000002", DocumentState.PENDING)
            .toBuilder().issuedAt(Instant.parse("2024-03-16T03:15:00Z")).build();

        org.w3c.dom.Document dom = parse(writer.write(late, LIMA));

        assertEquals("2024-03-15", cbc(dom, "IssueDate"));
        assertEquals("22:15:00", cbc(dom, "IssueTime"));
    }

    @Test
    @DisplayName("Credit notes use the CreditNote root and carry the reference")
    void testCreditNote() throws Exception {
        printTestHeader("Credit Note");

        DocumentReference reference = new DocumentReference("F001-00000004", DocumentKind.INVOICE, "01",
            "Anulacion de la operacion");
        Document creditNote = Document.issue(TestDocuments.TENANT_A, DocumentKind.CREDIT_NOTE, "NC01", 1,
            "NC01-00000001", TestDocuments.ISSUED_AT, CurrencyCode.USD,
            TestDocuments.tenant(TestDocuments.TENANT_A).asIssuer(), TestDocuments.customer(),
            List.of(TestDocuments.vatLine("Licencia", "1", "100.00")), reference, null);

        org.w3c.dom.Document dom = parse(writer.write(creditNote, LIMA));

        assertEquals("CreditNote", dom.getDocumentElement().getLocalName());
        assertEquals(UblXmlWriter.CREDIT_NOTE_NS, dom.getDocumentElement().getNamespaceURI());
        assertNull(cbc(dom, "InvoiceTypeCode"));
        assertEquals("F001-00000004", cbc(dom, "ReferenceID"));
        assertEquals("01", cbc(dom, "ResponseCode"));
        assertEquals("USD", cbc(dom, "DocumentCurrencyCode"));
        assertEquals(1, dom.getElementsByTagNameNS(UblXmlWriter.CAC_NS, "CreditNoteLine").getLength());
        printSuccess("Credit note rendered");
    }

    @Test
    @DisplayName("Free text survives CDATA, including a literal ]]>")
    void testCdataEscaping() throws Exception {
        String tricky = "Widget <A&B> ]]> deluxe";
        LineItem item = new LineItem(tricky, BigDecimal.ONE, "NIU", new BigDecimal("10.00"), "10",
            new BigDecimal("1.80"), new BigDecimal("10.00"));
        Document document = Document.issue(TestDocuments.TENANT_A, DocumentKind.RECEIPT, "B001", 3,
            "B001-00000003", TestDocuments.ISSUED_AT, CurrencyCode.PEN,
            TestDocuments.tenant(TestDocuments.TENANT_A).asIssuer(), new Party("1", "45678912", "O'Brien & Co", null),
            List.of(item), null, null);

        org.w3c.dom.Document dom = parse(writer.write(document, LIMA));

        assertEquals(tricky, cbc(dom, "Description"));
        NodeList names = dom.getElementsByTagNameNS(UblXmlWriter.CBC_NS, "RegistrationName");
        assertEquals("O'Brien & Co", names.item(1).getTextContent());
    }

    @Test
    @DisplayName("Exonerated lines carry a zero percent and the exoneration scheme")
    void testExoneratedLine() throws Exception {
        LineItem book = new LineItem("Libro", BigDecimal.ONE, "NIU", new BigDecimal("40.00"), "20",
            BigDecimal.ZERO, new BigDecimal("40.00"));
        Document document = Document.issue(TestDocuments.TENANT_A, DocumentKind.RECEIPT, "B001", 4,
            "B001-00000004", TestDocuments.ISSUED_AT, CurrencyCode.PEN,
            TestDocuments.tenant(TestDocuments.TENANT_A).asIssuer(), TestDocuments.consumer(),
            List.of(book), null, null);

        String xml = writer.write(document, LIMA);

        assertTrue(xml.contains("<cbc:Percent>0.00</cbc:Percent>"));
        assertTrue(xml.contains("<cbc:ID>9997</cbc:ID>"));
        assertTrue(xml.contains("<cbc:TaxExemptionReasonCode>20</cbc:TaxExemptionReasonCode>"));
    }
}
