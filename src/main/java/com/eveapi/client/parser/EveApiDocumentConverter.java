package com.eveapi.client.parser;

import com.eveapi.client.common.MalformedResponseException;
import com.eveapi.client.config.EveApiProperties;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.Map;

/**
 * <h2>EVE API document converter</h2>
 *
 * <p>Turns any EVE API response into nested maps without knowing its schema:</p>
 * <ul>
 *   <li>non-blank text of an element is stored under {@code <path>.text};</li>
 *   <li>attributes of an element are stored under {@code <path>.attributes};</li>
 *   <li>child elements are stored under {@code <path>.<tagName>};</li>
 *   <li>a {@code rowset} is transparent: its attributes go to
 *       {@code <parent>.attributes} and its rows, keyed by the attribute named in
 *       {@code key}, go to {@code <parent>.<name>} (see {@link RowsetConverter}); an empty
 *       rowset adds nothing there.</li>
 * </ul>
 *
 * <p>Example, for {@code /server/ServerStatus}:</p>
 * <pre>{@code
 * <eveapi version="2">
 *   <currentTime>2011-08-30 22:36:14</currentTime>
 *   <result>
 *     <serverOpen>True</serverOpen>
 *     <onlinePlayers>30356</onlinePlayers>
 *   </result>
 * </eveapi>
 * }</pre>
 * <pre>
 * {eveapi: {attributes: {version: 2},
 *           currentTime: {text: 2011-08-30 22:36:14},
 *           result: {serverOpen: {text: True}, onlinePlayers: {text: 30356}}}}
 * </pre>
 *
 * <p>Stateless and thread-safe. Every call builds a fresh map.</p>
 */
@Component
public class EveApiDocumentConverter implements DocumentConverter {

    /** Key holding an element's trimmed text. */
    public static final String TEXT_KEY = "text";

    /** Key holding an element's attribute map. */
    public static final String ATTRIBUTES_KEY = "attributes";

    /** Nesting limit used when none is configured. */
    public static final int DEFAULT_MAX_DEPTH = 64;

    private final int maxDepth;

    public EveApiDocumentConverter() {
        this(DEFAULT_MAX_DEPTH);
    }

    public EveApiDocumentConverter(final int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    @Autowired
    public EveApiDocumentConverter(final EveApiProperties props) {
        this(props.getConversion().getMaxDepth());
    }

    /**
     * @return read-only result, see {@link ResultValue.Node#readOnly()}
     */
    @Override
    public ResultValue.Node convert(final Document document) {
        return convert(document, KeyPath.root(), 0).readOnly();
    }

    /**
     * Converts the children of {@code element}, which sits at {@code path}.
     *
     * @param element element whose content is converted
     * @param path    location of {@code element} in the overall result
     * @return map rooted at the top of the overall result, to be merged by the caller
     */
    public ResultValue.Node convert(final Element element, final KeyPath path) {
        return convert(element, path, path.depth());
    }

    private ResultValue.Node convert(final Node parent, final KeyPath path, final int depth) {
        if (depth > maxDepth) {
            throw new MalformedResponseException("Element '" + path + "' is nested deeper than "
                    + maxDepth + " levels");
        }
        ResultValue.Node result = ResultValue.Node.empty();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            switch (child.getNodeType()) {
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> {
                    String text = StringUtils.trimToEmpty(child.getNodeValue());
                    if (!text.isEmpty()) {
                        DeepMerge.merge(result,
                                PathKeyedMaps.build(path.append(TEXT_KEY), new ResultValue.Leaf(text)));
                    }
                }
                case Node.ELEMENT_NODE -> convertElement((Element) child, path, depth, result);
                default -> {
                    // comments and processing instructions carry no data
                }
            }
        }
        return result;
    }

    private void convertElement(final Element child,
                                final KeyPath path,
                                final int depth,
                                final ResultValue.Node result) {
        boolean rowset = RowsetConverter.ROWSET_TAG.equals(child.getTagName());
        KeyPath childPath = rowset ? path : path.append(child.getTagName());

        Map<String, String> attributes = RowsetConverter.attributesOf(child);
        if (!attributes.isEmpty()) {
            DeepMerge.merge(result, PathKeyedMaps.build(childPath.append(ATTRIBUTES_KEY),
                    ResultValue.Node.ofStrings(attributes)));
        }

        if (rowset) {
            String name = requireAttribute(attributes, RowsetConverter.NAME_ATTRIBUTE, path);
            String key = requireAttribute(attributes, RowsetConverter.KEY_ATTRIBUTE, path);
            KeyPath target = path.append(name);
            ResultValue.Node rows = RowsetConverter.convert(child, target, key);
            // a rowset without rows leaves no entry under its name
            if (rows.size() > 0) {
                DeepMerge.merge(result, PathKeyedMaps.build(target, rows));
            }
        } else {
            DeepMerge.merge(result, convert(child, childPath, depth + 1));
        }
    }

    private static String requireAttribute(final Map<String, String> attributes,
                                           final String name,
                                           final KeyPath path) {
        String value = attributes.get(name);
        if (value == null) {
            throw new MalformedResponseException("rowset under '" + path + "' has no '" + name + "' attribute");
        }
        return value;
    }
}
