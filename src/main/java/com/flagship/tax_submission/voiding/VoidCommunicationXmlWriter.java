package com.flagship.tax_submission.voiding;

import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.tenant.Tenant;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.time.LocalDate;
import java.util.List;

/**
 * Renders a VoidedDocuments communication.
 *
 * Like issued documents, it opens with an empty ext:ExtensionContent for
 * the signature. Each line names one receipt by series and number.
 */
@Component
public class VoidCommunicationXmlWriter {

    static final String VOIDED_DOCUMENTS_NS = "urn:sunat:names:specification:ubl:peru:schema:xsd:VoidedDocuments-1";
    static final String SAC_NS = "urn:sunat:names:specification:ubl:peru:schema:xsd:SunatAggregateComponents-1";
    static final String CAC_NS = "urn:oasis:names:specification:ubl:schema:xsd:CommonAggregateComponents-2";
    static final String CBC_NS = "urn:oasis:names:specification:ubl:schema:xsd:CommonBasicComponents-2";
    static final String EXT_NS = "urn:oasis:names:specification:ubl:schema:xsd:CommonExtensionComponents-2";

    private static final String SAC = "sac";
    private static final String CAC = "cac";
    private static final String CBC = "cbc";
    private static final String EXT = "ext";

    public String write(Tenant issuer, String communicationNumber, LocalDate issueDate, LocalDate voidDate,
                        List<String> documentNumbers, String reason) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter w = XMLOutputFactory.newInstance().createXMLStreamWriter(out);
            w.writeStartDocument("UTF-8", "1.0");

            w.writeStartElement("", "VoidedDocuments", VOIDED_DOCUMENTS_NS);
            w.writeDefaultNamespace(VOIDED_DOCUMENTS_NS);
            w.writeNamespace(CAC, CAC_NS);
            w.writeNamespace(CBC, CBC_NS);
            w.writeNamespace(EXT, EXT_NS);
            w.writeNamespace(SAC, SAC_NS);

            w.writeStartElement(EXT, "UBLExtensions", EXT_NS);
            w.writeStartElement(EXT, "UBLExtension", EXT_NS);
            w.writeStartElement(EXT, "ExtensionContent", EXT_NS);
            w.writeCharacters("");
            w.writeEndElement();
            w.writeEndElement();
            w.writeEndElement();

            cbc(w, "UBLVersionID", "2.0");
            cbc(w, "CustomizationID", "1.0");
            cbc(w, "ID", communicationNumber);
            cbc(w, "ReferenceDate", voidDate.toString());
            cbc(w, "IssueDate", issueDate.toString());

            writeSignatureReference(w, issuer);
            writeSupplier(w, issuer);

            int line = 1;
            for (String documentNumber : documentNumbers) {
                writeLine(w, line++, documentNumber, reason);
            }

            w.writeEndElement();
            w.writeEndDocument();
            w.flush();
            w.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to render void communication " + communicationNumber, e);
        }
        return out.toString();
    }

    private static void writeSignatureReference(XMLStreamWriter w, Tenant issuer) throws XMLStreamException {
        w.writeStartElement(CAC, "Signature", CAC_NS);
        cbc(w, "ID", issuer.getTenantId());
        w.writeStartElement(CAC, "SignatoryParty", CAC_NS);
        w.writeStartElement(CAC, "PartyIdentification", CAC_NS);
        cbc(w, "ID", issuer.getTenantId());
        w.writeEndElement();
        w.writeStartElement(CAC, "PartyName", CAC_NS);
        cdata(w, CBC, CBC_NS, "Name", issuer.getLegalName());
        w.writeEndElement();
        w.writeEndElement();
        w.writeStartElement(CAC, "DigitalSignatureAttachment", CAC_NS);
        w.writeStartElement(CAC, "ExternalReference", CAC_NS);
        cbc(w, "URI", "#SIGN-" + issuer.getTenantId());
        w.writeEndElement();
        w.writeEndElement();
        w.writeEndElement();
    }

    private static void writeSupplier(XMLStreamWriter w, Tenant issuer) throws XMLStreamException {
        w.writeStartElement(CAC, "AccountingSupplierParty", CAC_NS);
        cbc(w, "CustomerAssignedAccountID", issuer.getTenantId());
        cbc(w, "AdditionalAccountID", "6");
        w.writeStartElement(CAC, "Party", CAC_NS);
        w.writeStartElement(CAC, "PartyLegalEntity", CAC_NS);
        cdata(w, CBC, CBC_NS, "RegistrationName", issuer.getLegalName());
        w.writeEndElement();
        w.writeEndElement();
        w.writeEndElement();
    }

    private static void writeLine(XMLStreamWriter w, int index, String documentNumber, String reason)
            throws XMLStreamException {
        int dash = documentNumber.lastIndexOf('-');
        String series = documentNumber.substring(0, dash);
        String number = documentNumber.substring(dash + 1);

        w.writeStartElement(SAC, "VoidedDocumentsLine", SAC_NS);
        cbc(w, "LineID", String.valueOf(index));
        cbc(w, "DocumentTypeCode", DocumentKind.RECEIPT.getCode());
        sac(w, "DocumentSerialID", series);
        sac(w, "DocumentNumberID", number);
        cdata(w, SAC, SAC_NS, "VoidReasonDescription", reason);
        w.writeEndElement();
    }

    private static void cbc(XMLStreamWriter w, String name, String text) throws XMLStreamException {
        w.writeStartElement(CBC, name, CBC_NS);
        w.writeCharacters(text);
        w.writeEndElement();
    }

    private static void sac(XMLStreamWriter w, String name, String text) throws XMLStreamException {
        w.writeStartElement(SAC, name, SAC_NS);
        w.writeCharacters(text);
        w.writeEndElement();
    }

    private static void cdata(XMLStreamWriter w, String prefix, String ns, String name, String text)
            throws XMLStreamException {
        w.writeStartElement(prefix, name, ns);
        String[] parts = text.split("]]>", -1);
        for (int i = 0; i < parts.length; i++) {
            String part = i < parts.length - 1 ? parts[i] + "]]" : parts[i];
            w.writeCData(i > 0 ? ">" + part : part);
        }
        w.writeEndElement();
    }
}
