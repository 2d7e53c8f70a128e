package com.eveapi.client.parser;

import com.eveapi.client.common.EveApiParseException;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;

/**
 * Parses response bodies into DOM documents.
 *
 * <p>The factory is hardened once: DOCTYPE declarations and external entities are
 * rejected, CDATA sections are merged into text and comments are dropped.
 * A new {@link DocumentBuilder} is created per call, so the reader can be shared
 * across threads.</p>
 */
@Component
public class XmlDocumentReader {

    private final DocumentBuilderFactory factory = createSecureDocumentBuilderFactory();

    /**
     * @param xml complete XML document
     * @return the parsed document
     * @throws EveApiParseException if {@code xml} is not well-formed
     */
    public Document read(final String xml) {
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException ex) {
            throw new EveApiParseException("Cannot parse EVE API response: " + ex.getMessage(), ex);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser is not configured correctly", ex);
        }
    }

    private static DocumentBuilderFactory createSecureDocumentBuilderFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("Cannot configure secure XML parsing", ex);
        }
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        factory.setCoalescing(true);
        factory.setIgnoringComments(true);
        return factory;
    }
}
