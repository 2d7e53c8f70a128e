package com.eveapi.client.parser;

import static com.eveapi.client.parser.XmlFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.eveapi.client.config.JacksonEveApiConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

class ResultValueTest {

    private final ObjectMapper mapper =
            new JacksonEveApiConfig().eveApiObjectMapper(new Jackson2ObjectMapperBuilder());

    @Test
    void node_should_serialize_as_plain_json_object() throws JsonProcessingException {
        ResultValue.Node value = node("eveapi", node("attributes", node("version", "2"), "result", node()));

        assertThat(mapper.writeValueAsString(value))
                .isEqualTo("{\"eveapi\":{\"attributes\":{\"version\":\"2\"},\"result\":{}}}");
    }

    @Test
    void lookups_should_follow_paths_and_check_types() {
        ResultValue.Node value = node("a", node("b", "leaf"));

        assertThat(value.text(KeyPath.parse("a.b"))).contains("leaf");
        assertThat(value.text(KeyPath.parse("a"))).isEmpty();
        assertThat(value.node(KeyPath.parse("a"))).contains(node("b", "leaf"));
        assertThat(value.find(KeyPath.parse("a.b.c"))).isEmpty();
        assertThat(value.find(KeyPath.root())).contains(value);
    }

    @Test
    void toPlainMap_should_unwrap_leaves() {
        ResultValue.Node value = node("a", node("b", "1"), "c", "2");

        assertThat(value.toPlainMap()).isEqualTo(Map.of("a", Map.of("b", "1"), "c", "2"));
    }

    @Test
    void copy_should_not_share_nested_maps() {
        ResultValue.Node original = node("a", node("b", "1"));

        ResultValue.Node copy = original.copy();
        copy.node(KeyPath.of("a")).orElseThrow().children().put("c", new ResultValue.Leaf("2"));

        assertThat(original).isEqualTo(node("a", node("b", "1")));
    }

    @Test
    void readOnly_should_reject_changes_at_every_level() {
        ResultValue.Node value = node("a", node("b", "1"));

        ResultValue.Node frozen = value.readOnly();

        assertThat(frozen).isEqualTo(value);
        assertThatThrownBy(() -> frozen.children().put("c", new ResultValue.Leaf("2")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> frozen.node(KeyPath.of("a")).orElseThrow().children().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(frozen.copy().children().put("c", new ResultValue.Leaf("2"))).isNull();
    }

    @Test
    void keyPath_should_parse_and_append() {
        KeyPath path = KeyPath.parse("eveapi.result");

        assertThat(path.append("rows").segments()).containsExactly("eveapi", "result", "rows");
        assertThat(path.depth()).isEqualTo(2);
        assertThat(KeyPath.parse("  ").isEmpty()).isTrue();
        assertThat(KeyPath.of("a.b", "c")).hasToString("a.b.c");
    }
}
