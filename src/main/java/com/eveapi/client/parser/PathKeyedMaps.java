package com.eveapi.client.parser;

import java.util.List;

/**
 * Builds single-branch nested maps.
 */
public final class PathKeyedMaps {

    private PathKeyedMaps() {
    }

    /**
     * Builds {@code {k1: {k2: {... {kn: value}}}}}.
     *
     * <pre>{@code
     * PathKeyedMaps.build(KeyPath.of("one", "two"), new Leaf("three"));
     * // {one={two=three}}
     * }</pre>
     *
     * @param path  non-empty key path
     * @param value value stored under the last segment
     * @return a newly allocated node
     * @throws IllegalArgumentException if {@code path} is empty
     */
    public static ResultValue.Node build(final KeyPath path, final ResultValue value) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Key path must contain at least one segment");
        }
        List<String> segments = path.segments();
        ResultValue current = value;
        for (int i = segments.size() - 1; i >= 0; i--) {
            ResultValue.Node parent = ResultValue.Node.empty();
            parent.children().put(segments.get(i), current);
            current = parent;
        }
        return (ResultValue.Node) current;
    }
}
