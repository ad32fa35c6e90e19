package io.eskema.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonValuesTest {

    @Test
    void fromNodeProducesPlainValues() throws Exception {
        var node = new ObjectMapper().readTree("{\"a\":[1,\"two\",null],\"b\":{\"c\":true}}");

        Object value = JsonValues.fromNode(node);

        assertThat(value).isInstanceOf(Map.class);
        var map = (Map<?, ?>) value;
        assertThat(map.get("a")).isEqualTo(Arrays.asList(1, "two", null));
        assertThat(map.get("b")).isEqualTo(Map.of("c", true));
    }

    @Test
    void nullAndMissingNodesBecomeNull() {
        assertThat(JsonValues.fromNode(null)).isNull();
        assertThat(JsonValues.fromNode(new ObjectMapper().missingNode())).isNull();
    }

    @Test
    void parseRejectsMalformedText() {
        assertThatThrownBy(() -> JsonValues.parse("{oops"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Failed to parse JSON");
        assertThat(JsonValues.tryParse("{oops")).isEmpty();
        assertThat(JsonValues.tryParse("[1]")).contains(List.of(1));
    }

    @Test
    void prettifyKeepsStringsAndNumbersApart() {
        assertThat(JsonValues.prettify("10")).isEqualTo("\"10\"");
        assertThat(JsonValues.prettify(10)).isEqualTo("10");
        assertThat(JsonValues.prettify(null)).isEqualTo("null");
    }

    @Test
    void typeName() {
        assertThat(JsonValues.typeName(null)).isEqualTo("null");
        assertThat(JsonValues.typeName("x")).isEqualTo("String");
    }
}
