package com.eveapi.client.parser;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Ordered key segments locating a value inside a {@link ResultValue.Node}, root first.
 *
 * @param segments immutable segment list
 */
public record KeyPath(List<String> segments) {

    private static final KeyPath ROOT = new KeyPath(List.of());

    public KeyPath {
        segments = List.copyOf(segments);
    }

    public static KeyPath root() {
        return ROOT;
    }

    public static KeyPath of(final String... segments) {
        return new KeyPath(Arrays.asList(segments));
    }

    /**
     * Splits a dotted path such as {@code eveapi.result.serverOpen.text}.
     * Segments that themselves contain dots must be built with {@link #of(String...)}.
     *
     * @param dotted dotted path; blank yields {@link #root()}
     * @return the parsed path
     */
    public static KeyPath parse(final String dotted) {
        if (StringUtils.isBlank(dotted)) {
            return ROOT;
        }
        return new KeyPath(Arrays.asList(StringUtils.split(dotted, '.')));
    }

    /**
     * @return a new path with {@code segment} appended
     */
    public KeyPath append(final String segment) {
        List<String> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new KeyPath(next);
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
