package com.flagship.tax_submission.generation;

import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.document.DocumentReference;
import com.flagship.tax_submission.document.LineItem;
import com.flagship.tax_submission.document.Party;
import com.flagship.tax_submission.document.Totals;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Renders a document as UBL 2.1 XML.
 *
 * Invoices and receipts use the Invoice root, credit notes the CreditNote
 * root. The first child is an empty ext:ExtensionContent reserved for the
 * digital signature, written as an explicit start/end tag pair.
 */
@Component
public class UblXmlWriter {

    static final String INVOICE_NS = "urn:oasis:names:specification:ubl:schema:xsd:Invoice-2";
    static final String CREDIT_NOTE_NS = "urn:oasis:names:specification:ubl:schema:xsd:CreditNote-2";
    static final String CAC_NS = "urn:oasis:names:specification:ubl:schema:xsd:CommonAggregateComponents-2";
    static final String CBC_NS = "urn:oasis:names:specification:ubl:schema:xsd:CommonBasicComponents-2";
    static final String EXT_NS = "urn:oasis:names:specification:ubl:schema:xsd:CommonExtensionComponents-2";

    private static final String CAC = "cac";
    private static final String CBC = "cbc";
    private static final String EXT = "ext";

    private static final String INVOICE_OPERATION_TYPE = "0101";
    private static final String DEFAULT_COUNTRY = "PE";
    private static final BigDecimal VAT_RATE = new BigDecimal("18.00");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    /**
     * Tax scheme (catalog 05) a line falls under, by its catalog 07 treatment.
     */
    enum TaxScheme {
        VAT("1000", "IGV", "VAT"),
        EXONERATED("9997", "EXO", "VAT"),
        UNAFFECTED("9998", "INA", "FRE"),
        EXPORT("9995", "EXP", "FRE");

        final String id;
        final String name;
        final String typeCode;

        TaxScheme(String id, String name, String typeCode) {
            this.id = id;
            this.name = name;
            this.typeCode = typeCode;
        }

        static TaxScheme forTreatment(String treatment) {
            if (treatment.startsWith("1")) {
                return VAT;
            }
            if (treatment.startsWith("2")) {
                return EXONERATED;
            }
            if (treatment.startsWith("3")) {
                return UNAFFECTED;
            }
            return EXPORT;
        }
    }

    public String write(Document document, ZoneId zone) {
        boolean creditNote = document.getKind() == DocumentKind.CREDIT_NOTE;
        String rootNs = creditNote ? CREDIT_NOTE_NS : INVOICE_NS;
        String root = creditNote ? "CreditNote" : "Invoice";
        String currency = document.getCurrency().name();
        LocalDateTime issued = LocalDateTime.ofInstant(document.getIssuedAt(), zone);

        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter w = XMLOutputFactory.newInstance().createXMLStreamWriter(out);
            w.writeStartDocument("UTF-8", "1.0");

            w.writeStartElement("", root, rootNs);
            w.writeDefaultNamespace(rootNs);
            w.writeNamespace(CAC, CAC_NS);
            w.writeNamespace(CBC, CBC_NS);
            w.writeNamespace(EXT, EXT_NS);

            w.writeStartElement(EXT, "UBLExtensions", EXT_NS);
            w.writeStartElement(EXT, "UBLExtension", EXT_NS);
            w.writeStartElement(EXT, "ExtensionContent", EXT_NS);
            w.writeCharacters("");
            w.writeEndElement();
            w.writeEndElement();
            w.writeEndElement();

            cbc(w, "UBLVersionID", "2.1");
            cbc(w, "CustomizationID", "2.0");
            cbc(w, "ID", document.getDocumentNumber());
            cbc(w, "IssueDate", issued.toLocalDate().toString());
            cbc(w, "IssueTime", issued.format(TIME));

            if (!creditNote) {
                w.writeStartElement(CBC, "InvoiceTypeCode", CBC_NS);
                w.writeAttribute("listID", INVOICE_OPERATION_TYPE);
                w.writeCharacters(document.getKind().getCode());
                w.writeEndElement();
            }

            cbc(w, "DocumentCurrencyCode", currency);

            if (creditNote && document.getReference() != null) {
                writeReference(w, document.getReference());
            }

            writeSupplier(w, document.getIssuer());
            writeCustomer(w, document.getRecipient());
            writeTotals(w, document.getTotals(), currency);

            int line = 1;
            for (LineItem item : document.getItems()) {
                writeLine(w, line++, item, currency, creditNote);
            }

            w.writeEndElement();
            w.writeEndDocument();
            w.flush();
            w.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to render UBL for " + document.getDocumentNumber(), e);
        }
        return out.toString();
    }

    private static void writeReference(XMLStreamWriter w, DocumentReference reference) throws XMLStreamException {
        w.writeStartElement(CAC, "DiscrepancyResponse", CAC_NS);
        cbc(w, "ReferenceID", reference.getDocumentNumber());
        cbc(w, "ResponseCode", reference.getReasonCode());
        cdata(w, "Description", reference.getDescription());
        w.writeEndElement();

        w.writeStartElement(CAC, "BillingReference", CAC_NS);
        w.writeStartElement(CAC, "InvoiceDocumentReference", CAC_NS);
        cbc(w, "ID", reference.getDocumentNumber());
        if (reference.getKind() != null) {
            cbc(w, "DocumentTypeCode", reference.getKind().getCode());
        }
        w.writeEndElement();
        w.writeEndElement();
    }

    private static void writeSupplier(XMLStreamWriter w, Party issuer) throws XMLStreamException {
        w.writeStartElement(CAC, "AccountingSupplierParty", CAC_NS);
        w.writeStartElement(CAC, "Party", CAC_NS);

        writeIdentification(w, issuer);

        w.writeStartElement(CAC, "PartyName", CAC_NS);
        cdata(w, "Name", issuer.getName());
        w.writeEndElement();

        w.writeStartElement(CAC, "PartyLegalEntity", CAC_NS);
        cdata(w, "RegistrationName", issuer.getName());
        w.writeStartElement(CAC, "RegistrationAddress", CAC_NS);
        cbc(w, "AddressTypeCode", "0000");
        writeAddressLines(w, issuer.getAddress());
        w.writeEndElement();
        w.writeEndElement();

        w.writeEndElement();
        w.writeEndElement();
    }

    private static void writeCustomer(XMLStreamWriter w, Party recipient) throws XMLStreamException {
        w.writeStartElement(CAC, "AccountingCustomerParty", CAC_NS);
        w.writeStartElement(CAC, "Party", CAC_NS);

        writeIdentification(w, recipient);

        w.writeStartElement(CAC, "PartyLegalEntity", CAC_NS);
        cdata(w, "RegistrationName", recipient.getName());
        if (recipient.getAddress() != null && !recipient.getAddress().isBlank()) {
            w.writeStartElement(CAC, "RegistrationAddress", CAC_NS);
            writeAddressLines(w, recipient.getAddress());
            w.writeEndElement();
        }
        w.writeEndElement();

        w.writeEndElement();
        w.writeEndElement();
    }

    private static void writeIdentification(XMLStreamWriter w, Party party) throws XMLStreamException {
        w.writeStartElement(CAC, "PartyIdentification", CAC_NS);
        w.writeStartElement(CBC, "ID", CBC_NS);
        w.writeAttribute("schemeID", party.getIdType());
        w.writeCharacters(party.getIdNumber());
        w.writeEndElement();
        w.writeEndElement();
    }

    private static void writeAddressLines(XMLStreamWriter w, String address) throws XMLStreamException {
        w.writeStartElement(CAC, "AddressLine", CAC_NS);
        cdata(w, "Line", address != null ? address : "-");
        w.writeEndElement();
        w.writeStartElement(CAC, "Country", CAC_NS);
        cbc(w, "IdentificationCode", DEFAULT_COUNTRY);
        w.writeEndElement();
    }

    private static void writeTotals(XMLStreamWriter w, Totals totals, String currency) throws XMLStreamException {
        w.writeStartElement(CAC, "TaxTotal", CAC_NS);
        amount(w, "TaxAmount", totals.getTax(), currency);
        w.writeStartElement(CAC, "TaxSubtotal", CAC_NS);
        amount(w, "TaxableAmount", totals.getSubtotal(), currency);
        amount(w, "TaxAmount", totals.getTax(), currency);
        w.writeStartElement(CAC, "TaxCategory", CAC_NS);
        writeScheme(w, TaxScheme.VAT);
        w.writeEndElement();
        w.writeEndElement();
        w.writeEndElement();

        w.writeStartElement(CAC, "LegalMonetaryTotal", CAC_NS);
        amount(w, "PayableAmount", totals.getTotal(), currency);
        w.writeEndElement();
    }

    private static void writeLine(XMLStreamWriter w, int index, LineItem item, String currency, boolean creditNote)
            throws XMLStreamException {
        TaxScheme scheme = TaxScheme.forTreatment(item.getTaxTreatment());

        w.writeStartElement(CAC, creditNote ? "CreditNoteLine" : "InvoiceLine", CAC_NS);
        cbc(w, "ID", String.valueOf(index));

        w.writeStartElement(CBC, creditNote ? "CreditedQuantity" : "InvoicedQuantity", CBC_NS);
        w.writeAttribute("unitCode", item.getUnitCode());
        w.writeCharacters(item.getQuantity().stripTrailingZeros().toPlainString());
        w.writeEndElement();

        amount(w, "LineExtensionAmount", item.getTotal(), currency);

        w.writeStartElement(CAC, "PricingReference", CAC_NS);
        w.writeStartElement(CAC, "AlternativeConditionPrice", CAC_NS);
        amount(w, "PriceAmount", item.getUnitPrice(), currency);
        cbc(w, "PriceTypeCode", "01");
        w.writeEndElement();
        w.writeEndElement();

        w.writeStartElement(CAC, "TaxTotal", CAC_NS);
        amount(w, "TaxAmount", item.getTax(), currency);
        w.writeStartElement(CAC, "TaxSubtotal", CAC_NS);
        amount(w, "TaxableAmount", item.getTotal(), currency);
        amount(w, "TaxAmount", item.getTax(), currency);
        w.writeStartElement(CAC, "TaxCategory", CAC_NS);
        cbc(w, "Percent", (scheme == TaxScheme.VAT ? VAT_RATE : BigDecimal.ZERO.setScale(2)).toPlainString());
        cbc(w, "TaxExemptionReasonCode", item.getTaxTreatment());
        writeScheme(w, scheme);
        w.writeEndElement();
        w.writeEndElement();
        w.writeEndElement();

        w.writeStartElement(CAC, "Item", CAC_NS);
        cdata(w, "Description", item.getDescription());
        w.writeEndElement();

        w.writeStartElement(CAC, "Price", CAC_NS);
        amount(w, "PriceAmount", item.getUnitPrice(), currency);
        w.writeEndElement();

        w.writeEndElement();
    }

    private static void writeScheme(XMLStreamWriter w, TaxScheme scheme) throws XMLStreamException {
        w.writeStartElement(CAC, "TaxScheme", CAC_NS);
        cbc(w, "ID", scheme.id);
        cbc(w, "Name", scheme.name);
        cbc(w, "TaxTypeCode", scheme.typeCode);
        w.writeEndElement();
    }

    private static void cbc(XMLStreamWriter w, String name, String text) throws XMLStreamException {
        w.writeStartElement(CBC, name, CBC_NS);
        w.writeCharacters(text);
        w.writeEndElement();
    }

    /**
     * Free text (names, addresses, descriptions) goes into CDATA. A literal
     * "]]>" is split across two sections.
     */
    private static void cdata(XMLStreamWriter w, String name, String text) throws XMLStreamException {
        w.writeStartElement(CBC, name, CBC_NS);
        String[] parts = text.split("]]>", -1);
        for (int i = 0; i < parts.length; i++) {
            String part = i < parts.length - 1 ? parts[i] + "]]" : parts[i];
            w.writeCData(i > 0 ? ">" + part : part);
        }
        w.writeEndElement();
    }

    private static void amount(XMLStreamWriter w, String name, BigDecimal value, String currency)
            throws XMLStreamException {
        w.writeStartElement(CBC, name, CBC_NS);
        w.writeAttribute("currencyID", currency);
        w.writeCharacters(Totals.round(value).toPlainString());
        w.writeEndElement();
    }
}
