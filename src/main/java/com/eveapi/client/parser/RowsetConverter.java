package com.eveapi.client.parser;

import com.eveapi.client.common.MalformedResponseException;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <h2>Rowset Converter</h2>
 *
 * <p>EVE API result sets arrive as repeated flat {@code row} elements:</p>
 * <pre>{@code
 * <rowset name="characters" key="characterID" columns="name,characterID">
 *   <row name="fcydo" characterID="270095316"/>
 *   <row name="hcydo" characterID="499939401"/>
 * </rowset>
 * }</pre>
 * <p>They are indexed by their key attribute instead of position:</p>
 * <pre>
 * {270095316: {name: fcydo, characterID: 270095316},
 *  499939401: {name: hcydo, characterID: 499939401}}
 * </pre>
 */
public final class RowsetConverter {

    /** Tag of a keyed collection. */
    public static final String ROWSET_TAG = "rowset";

    /** Tag of one record inside a {@link #ROWSET_TAG}. */
    public static final String ROW_TAG = "row";

    /** Rowset attribute naming the key attribute of its rows. */
    public static final String KEY_ATTRIBUTE = "key";

    /** Rowset attribute naming the map key the rowset is stored under. */
    public static final String NAME_ATTRIBUTE = "name";

    private RowsetConverter() {
    }

    /**
     * Indexes the {@code row} children of {@code rowset} by {@code keyAttribute}.
     * A later row with an already seen key replaces the earlier one entirely.
     *
     * @param rowset       the {@code rowset} element
     * @param targetPath   where the result will be stored; used in error messages
     * @param keyAttribute row attribute holding the unique row key
     * @return row key → all attributes of that row, as raw strings
     * @throws MalformedResponseException if a row lacks {@code keyAttribute}
     */
    public static ResultValue.Node convert(final Element rowset,
                                           final KeyPath targetPath,
                                           final String keyAttribute) {
        ResultValue.Node rows = ResultValue.Node.empty();
        NodeList children = rowset.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() != Node.ELEMENT_NODE || !ROW_TAG.equals(child.getNodeName())) {
                continue;
            }
            Element row = (Element) child;
            if (!row.hasAttribute(keyAttribute)) {
                throw new MalformedResponseException("Row in rowset '" + targetPath
                        + "' has no key attribute '" + keyAttribute + "'");
            }
            rows.children().put(row.getAttribute(keyAttribute),
                    ResultValue.Node.ofStrings(attributesOf(row)));
        }
        return rows;
    }

    /**
     * @return attribute name → value of {@code element}; empty when it has none
     */
    static Map<String, String> attributesOf(final Element element) {
        NamedNodeMap attrs = element.getAttributes();
        Map<String, String> out = new LinkedHashMap<>(attrs.getLength());
        for (int i = 0; i < attrs.getLength(); i++) {
            Node attr = attrs.item(i);
            out.put(attr.getNodeName(), attr.getNodeValue());
        }
        return out;
    }
}
