package com.eveapi.client.parser;

import org.w3c.dom.Document;

/**
 * Converts a parsed API response document into a schema-free map.
 */
@FunctionalInterface
public interface DocumentConverter {

    /**
     * @param document complete response document
     * @return newly built read-only map whose only top-level key is the document element's tag name;
     * never {@code null}
     */
    ResultValue.Node convert(Document document);

}
