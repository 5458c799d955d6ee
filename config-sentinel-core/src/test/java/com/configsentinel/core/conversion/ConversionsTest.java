package com.configsentinel.core.conversion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.AbstractMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Conversions}.
 */
class ConversionsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    record Endpoint(String host, int port) {}

    @Test
    void stringify_textNode_hasNoQuotes() {
        assertThat(Conversions.stringify(NODES.textNode("abc"))).isEqualTo("abc");
        assertThat(Conversions.stringify(NODES.arrayNode().add(1).add(2))).isEqualTo("[1,2]");
        assertThat(Conversions.stringify(null)).isEqualTo("null");
    }

    @ParameterizedTest
    @CsvSource({
        "Integer, Json Number",
        "double, Json Number",
        "String, Json String",
        "LocalDate, Json String",
        "Boolean, Json Boolean",
        "Map, Json Object",
        "List, Json Array",
        "String[], Json Array",
        "Widget, Widget"
    })
    void equivalentJsonType_mapsJavaNames(String javaName, String expected) {
        assertThat(Conversions.equivalentJsonType(javaName)).isEqualTo(expected);
    }

    @Test
    void isNullOrEmpty_detectsEmptyValues() throws Exception {
        JsonNode node = MAPPER.readTree("""
            {"nullValue": null, "blank": "  ", "emptyArray": [], "emptyObject": {}, "zero": 0, "text": "x"}
            """);

        assertThat(Conversions.isNullOrEmpty(node.get("nullValue"))).isTrue();
        assertThat(Conversions.isNullOrEmpty(node.get("blank"))).isTrue();
        assertThat(Conversions.isNullOrEmpty(node.get("emptyArray"))).isTrue();
        assertThat(Conversions.isNullOrEmpty(node.get("emptyObject"))).isTrue();
        assertThat(Conversions.isNullOrEmpty(node.get("zero"))).isFalse();
        assertThat(Conversions.isNullOrEmpty(node.get("text"))).isFalse();
        assertThat(Conversions.isNullOrEmpty(null)).isTrue();
        assertThat(Conversions.isNullOrEmpty(List.of())).isTrue();
        assertThat(Conversions.isNullOrEmpty(Map.of())).isTrue();
        assertThat(Conversions.isNullOrEmpty(new int[0])).isTrue();
    }

    @Test
    void isNullOrEmpty_looksThroughOneWrapper() {
        assertThat(Conversions.isNullOrEmpty(Optional.empty())).isTrue();
        assertThat(Conversions.isNullOrEmpty(Optional.of(" "))).isTrue();
        assertThat(Conversions.isNullOrEmpty(Optional.of("value"))).isFalse();
        assertThat(Conversions.isNullOrEmpty(new AbstractMap.SimpleEntry<>("key", ""))).isTrue();
        assertThat(Conversions.isNullOrEmpty(new AbstractMap.SimpleEntry<>("key", "value"))).isFalse();
    }

    @Test
    void isNullOrEmpty_nestedWrapper_isJudgedByRendering() {
        assertThat(Conversions.isNullOrEmpty(Optional.of(Optional.empty()))).isFalse();
    }

    @Test
    void sizeOf_countsContainers() throws Exception {
        assertThat(Conversions.sizeOf(MAPPER.readTree("[1, 2, 3]"))).hasValue(3);
        assertThat(Conversions.sizeOf(MAPPER.readTree("{\"a\": 1}"))).hasValue(1);
        assertThat(Conversions.sizeOf(List.of("a", "b"))).hasValue(2);
        assertThat(Conversions.sizeOf(new String[] {"a"})).hasValue(1);
        assertThat(Conversions.sizeOf(new Endpoint("localhost", 80))).hasValue(2);
        assertThat(Conversions.sizeOf("text")).isEmpty();
        assertThat(Conversions.sizeOf(NODES.numberNode(1))).isEmpty();
    }

    @Test
    void toMap_record_convertsMembers() {
        Optional<Map<String, Object>> map = Conversions.toMap(new Endpoint("localhost", 8080));

        assertThat(map).isPresent();
        assertThat(map.get()).containsEntry("host", "localhost").containsEntry("port", 8080);
    }

    @Test
    void toMap_jsonObject_unwrapsValues() throws Exception {
        Optional<Map<String, Object>> map = Conversions.toMap(MAPPER.readTree("""
            {"name": "db", "tags": ["a", "b"], "nested": {"enabled": true}}
            """));

        assertThat(map).isPresent();
        assertThat(map.get().get("name")).isEqualTo("db");
        assertThat(map.get().get("tags")).isEqualTo(List.of("a", "b"));
        assertThat(map.get().get("nested")).isEqualTo(Map.of("enabled", true));
    }

    @Test
    void toMap_scalar_returnsEmpty() {
        assertThat(Conversions.toMap("text")).isEmpty();
        assertThat(Conversions.toMap(42)).isEmpty();
    }

    @Test
    void toNode_convertsJavaValues() {
        JsonNode node = Conversions.toNode(Map.of("port", 8080, "tags", List.of("a")));

        assertThat(node.get("port").intValue()).isEqualTo(8080);
        assertThat(node.get("tags").isArray()).isTrue();
        assertThat(node.get("tags").get(0).textValue()).isEqualTo("a");
        assertThat(Conversions.toNode(null).isNull()).isTrue();
    }

    @Test
    void convertScalar_numericString_convertsExactly() {
        assertThat(Conversions.convertScalar("57", Integer.class)).isEqualTo(57);
        assertThat(Conversions.convertScalar(3.0, Integer.class)).isEqualTo(3);
        assertThat(Conversions.convertScalar("2.5", Double.class)).isEqualTo(2.5);
        assertThat(Conversions.convertScalar(7, BigDecimal.class)).isEqualByComparingTo("7");
    }

    @Test
    void convertScalar_lossyOrInvalid_throws() {
        assertThatThrownBy(() -> Conversions.convertScalar("I'm still a string!", Integer.class))
            .isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> Conversions.convertScalar(3.5, Integer.class))
            .isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> Conversions.convertScalar(10_000_000_000L, Integer.class))
            .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void convertScalar_booleanAndCharacter() {
        assertThat(Conversions.convertScalar("TRUE", Boolean.class)).isTrue();
        assertThat(Conversions.convertScalar("x", Character.class)).isEqualTo('x');
        assertThatThrownBy(() -> Conversions.convertScalar("yes", Boolean.class))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void convertScalar_enum_usesConstantName() {
        assertThat(Conversions.convertScalar("FATAL", com.configsentinel.core.model.Severity.class))
            .isEqualTo(com.configsentinel.core.model.Severity.FATAL);
    }
}
