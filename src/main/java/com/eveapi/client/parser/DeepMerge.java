package com.eveapi.client.parser;

import java.util.Map;

/**
 * Recursive map union used to fold partial conversion results together.
 *
 * <p>Unlike {@link Map#putAll(Map)}, sub-maps present on both sides are merged
 * instead of overwritten:</p>
 * <pre>
 * {key1: {key2: {a: "x"}}}  merge  {key1: {key2: {b: "y"}}}
 *   = {key1: {key2: {a: "x", b: "y"}}}
 * </pre>
 * <p>Any other collision (leaf/leaf, leaf/map, map/leaf) is resolved in favour
 * of the incoming value.</p>
 */
public final class DeepMerge {

    private DeepMerge() {
    }

    /**
     * Overlays {@code src} onto {@code dst} in place.
     *
     * <p>{@code dst} must be an accumulator owned by the caller. Incoming maps are
     * copied before being stored, so {@code src} is left untouched and never
     * aliased by {@code dst}.</p>
     *
     * @param dst accumulator, mutated
     * @param src values to overlay
     * @return {@code dst}
     */
    public static ResultValue.Node merge(final ResultValue.Node dst, final ResultValue.Node src) {
        Map<String, ResultValue> target = dst.children();
        src.children().forEach((key, incoming) -> {
            ResultValue existing = target.get(key);
            if (existing instanceof ResultValue.Node existingNode
                    && incoming instanceof ResultValue.Node incomingNode) {
                merge(existingNode, incomingNode);
            } else if (incoming instanceof ResultValue.Node incomingNode) {
                target.put(key, incomingNode.copy());
            } else {
                target.put(key, incoming);
            }
        });
        return dst;
    }
}
