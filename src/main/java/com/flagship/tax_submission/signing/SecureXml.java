package com.flagship.tax_submission.signing;

import com.flagship.tax_submission.exception.MalformedDocumentException;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;

/**
 * Namespace-aware DOM parsing with DOCTYPEs and external entities disabled.
 */
public final class SecureXml {

    private static final ErrorHandler RAISING_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            // warnings do not make a document malformed
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private SecureXml() {
    }

    /**
     * @throws MalformedDocumentException if the text is blank, not well-formed or declares a DOCTYPE
     */
    public static Document parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new MalformedDocumentException("XML document is empty");
        }
        try {
            DocumentBuilder builder = newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            throw new MalformedDocumentException("XML document is not well-formed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedDocumentException("XML document could not be read", e);
        }
    }

    static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(RAISING_HANDLER);
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }
}
