package com.eveapi.client.parser;

import static com.eveapi.client.parser.XmlFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DeepMergeTest {

    @Test
    void merge_should_union_disjoint_maps() {
        ResultValue.Node dst = node("a", "1", "b", node("c", "2"));
        ResultValue.Node src = node("d", "3", "e", node("f", "4"));

        DeepMerge.merge(dst, src);

        assertThat(dst.size()).isEqualTo(4);
        assertThat(dst).isEqualTo(node("a", "1", "b", node("c", "2"), "d", "3", "e", node("f", "4")));
    }

    @Test
    void merge_should_combine_sub_maps_sharing_a_key() {
        ResultValue.Node dst = node("a", node("b", "1"));

        DeepMerge.merge(dst, node("a", node("c", "2")));

        assertThat(dst).isEqualTo(node("a", node("b", "1", "c", "2")));
    }

    @Test
    void merge_should_recurse_through_several_levels() {
        ResultValue.Node dst = node("key1", node("key2", node("key3a", "some value")));

        DeepMerge.merge(dst, node("key1", node("key2", node("key3b", "some new value"))));

        assertThat(dst).isEqualTo(
                node("key1", node("key2", node("key3a", "some value", "key3b", "some new value"))));
    }

    @Test
    void merge_should_replace_string_with_incoming_map() {
        ResultValue.Node dst = node("a", "x");

        DeepMerge.merge(dst, node("a", node("b", "1")));

        assertThat(dst).isEqualTo(node("a", node("b", "1")));
    }

    @Test
    void merge_should_replace_map_with_incoming_string() {
        ResultValue.Node dst = node("a", node("b", "1"));

        DeepMerge.merge(dst, node("a", "x"));

        assertThat(dst).isEqualTo(node("a", "x"));
    }

    @Test
    void merge_should_let_incoming_string_win() {
        ResultValue.Node dst = node("a", "old");

        DeepMerge.merge(dst, node("a", "new"));

        assertThat(dst).isEqualTo(node("a", "new"));
    }

    @Test
    void merge_should_return_destination() {
        ResultValue.Node dst = node();

        assertThat(DeepMerge.merge(dst, node("a", "1"))).isSameAs(dst);
    }

    @Test
    void merge_should_not_alias_source_maps() {
        ResultValue.Node inner = node("b", "1");
        ResultValue.Node src = node("a", inner);
        ResultValue.Node dst = node();

        DeepMerge.merge(dst, src);
        DeepMerge.merge(dst, node("a", node("c", "2")));

        assertThat(inner).isEqualTo(node("b", "1"));
        assertThat(dst).isEqualTo(node("a", node("b", "1", "c", "2")));
    }
}
