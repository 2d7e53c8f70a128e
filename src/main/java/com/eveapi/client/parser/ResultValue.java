package com.eveapi.client.parser;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <h2>ResultValue</h2>
 *
 * <p>Schema-free value produced by converting an EVE API document: either a
 * {@link Leaf} holding a raw string or a {@link Node} holding further named
 * values.</p>
 *
 * <pre>{@code
 * ResultValue.Node result = client.send(EveApiMethods.SERVER_STATUS, Map.of()).result();
 * String players = result.text(KeyPath.parse("eveapi.result.onlinePlayers.text")).orElse("0");
 * }</pre>
 *
 * <p>Both variants serialize with Jackson as plain JSON (a string or an object).</p>
 */
public sealed interface ResultValue permits ResultValue.Leaf, ResultValue.Node {

    /**
     * String leaf. Values are kept exactly as they appear in the document.
     *
     * @param value raw text or attribute value, never {@code null}
     */
    record Leaf(String value) implements ResultValue {

        public Leaf {
            Objects.requireNonNull(value, "value");
        }

        @JsonValue
        @Override
        public String value() {
            return value;
        }
    }

    /**
     * Map node. Children keep insertion (document) order.
     *
     * <p>Nodes are mutable while a conversion builds them. Documents handed out by
     * {@link DocumentConverter#convert(org.w3c.dom.Document)} are {@link #readOnly()}.</p>
     *
     * @param children named child values
     */
    record Node(Map<String, ResultValue> children) implements ResultValue {

        public Node {
            Objects.requireNonNull(children, "children");
        }

        @JsonValue
        @Override
        public Map<String, ResultValue> children() {
            return children;
        }

        /**
         * @return a new node with no children
         */
        public static Node empty() {
            return new Node(new LinkedHashMap<>());
        }

        /**
         * Wraps a flat string map, such as an element's attributes, into a node of leaves.
         *
         * @param values attribute name → value
         * @return new node preserving the iteration order of {@code values}
         */
        public static Node ofStrings(final Map<String, String> values) {
            Node node = empty();
            values.forEach((k, v) -> node.children().put(k, new Leaf(v)));
            return node;
        }

        public Optional<ResultValue> get(final String key) {
            return Optional.ofNullable(children.get(key));
        }

        /**
         * Follows {@code path} from this node.
         *
         * @param path segments to follow; an empty path resolves to this node
         * @return the value at {@code path}, or empty when a segment is missing or
         * passes through a leaf
         */
        public Optional<ResultValue> find(final KeyPath path) {
            ResultValue current = this;
            for (String segment : path.segments()) {
                if (!(current instanceof Node node)) {
                    return Optional.empty();
                }
                current = node.children().get(segment);
                if (current == null) {
                    return Optional.empty();
                }
            }
            return Optional.of(current);
        }

        /**
         * @return the string at {@code path}, or empty if absent or not a leaf
         */
        public Optional<String> text(final KeyPath path) {
            return find(path)
                    .filter(Leaf.class::isInstance)
                    .map(v -> ((Leaf) v).value());
        }

        /**
         * @return the map at {@code path}, or empty if absent or not a node
         */
        public Optional<Node> node(final KeyPath path) {
            return find(path)
                    .filter(Node.class::isInstance)
                    .map(Node.class::cast);
        }

        public int size() {
            return children.size();
        }

        /**
         * Converts this node into nested {@code Map<String, Object>} instances
         * whose leaves are {@link String}s.
         *
         * @return a detached copy safe to hand to code that expects plain maps
         */
        public Map<String, Object> toPlainMap() {
            Map<String, Object> out = new LinkedHashMap<>(children.size());
            children.forEach((k, v) -> out.put(k, v instanceof Node n ? n.toPlainMap() : ((Leaf) v).value()));
            return out;
        }

        /**
         * @return a deep copy sharing no mutable map with this node
         */
        public Node copy() {
            Node out = empty();
            children.forEach((k, v) -> out.children().put(k, v instanceof Node n ? n.copy() : v));
            return out;
        }

        /**
         * @return a deep copy whose maps reject modification
         */
        public Node readOnly() {
            Map<String, ResultValue> out = new LinkedHashMap<>(children.size());
            children.forEach((k, v) -> out.put(k, v instanceof Node n ? n.readOnly() : v));
            return new Node(Collections.unmodifiableMap(out));
        }
    }
}
