package com.configsentinel.core.translator.impl;

import com.configsentinel.core.conversion.ValueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MapTranslator}.
 */
class MapTranslatorTest {

    private MapTranslator translator;
    private Map<String, Object> settings;

    @BeforeEach
    void setUp() {
        translator = new MapTranslator();
        settings = new LinkedHashMap<>();
        settings.put("name", "orders");
        settings.put("port", 8080);
        settings.put("portText", "57");
        settings.put("ports", List.of(80, 443));
        settings.put("database", Map.of("host", "db"));
        settings.put("startedAt", "2024-03-15T10:30:00");
        settings.put("blank", "  ");
        settings.put("nothing", null);
        settings.put("optionalEmpty", Optional.empty());
    }

    @Test
    void collectionContains_nullValueCountsAsPresent() {
        assertThat(translator.collectionContains(settings, "nothing")).isTrue();
        assertThat(translator.collectionContains(settings, "missing")).isFalse();
    }

    @Test
    void getCollectionKeys_returnsInsertionOrder() {
        assertThat(translator.getCollectionKeys(settings)).startsWith("name", "port", "portText", "ports");
    }

    @Test
    void fieldValueIsNullOrEmpty_handlesNullBlankAndWrappers() {
        assertThat(translator.fieldValueIsNullOrEmpty(settings, "nothing")).isTrue();
        assertThat(translator.fieldValueIsNullOrEmpty(settings, "blank")).isTrue();
        assertThat(translator.fieldValueIsNullOrEmpty(settings, "optionalEmpty")).isTrue();
        assertThat(translator.fieldValueIsNullOrEmpty(settings, "name")).isFalse();
    }

    @Test
    void tryCastValue_coercesValues() {
        assertThat(translator.tryCastValue(settings, "port", ValueType.of(Integer.class))).contains(8080);
        assertThat(translator.tryCastValue(settings, "port", ValueType.of(Long.class))).contains(8080L);
        assertThat(translator.tryCastValue(settings, "portText", ValueType.of(int.class))).contains(57);
        assertThat(translator.tryCastValue(settings, "ports", ValueType.listOf(String.class)))
            .contains(List.of("80", "443"));
        assertThat(translator.tryCastValue(settings, "database", ValueType.map())).contains(Map.of("host", "db"));
        assertThat(translator.tryCastValue(settings, "startedAt", ValueType.of(LocalDateTime.class)))
            .contains(LocalDateTime.of(2024, 3, 15, 10, 30));
    }

    @Test
    void tryCastValue_failures_returnEmpty() {
        assertThat(translator.tryCastValue(settings, "name", ValueType.of(Integer.class))).isEmpty();
        assertThat(translator.tryCastValue(settings, "nothing", ValueType.of(Integer.class))).isEmpty();
        assertThat(translator.tryCastValue(settings, "name", ValueType.listOf(Integer.class))).isEmpty();
    }

    @Test
    void insertFieldValue_mutableMap_putsValue() {
        Map<String, Object> target = new HashMap<>();

        translator.insertFieldValue(target, "timeout", 30);

        assertThat(target).containsEntry("timeout", 30);
    }

    @Test
    void insertFieldValue_unmodifiableMap_throwsUnsupported() {
        Map<String, Object> frozen = Map.of("name", "orders");

        assertThatThrownBy(() -> translator.insertFieldValue(frozen, "timeout", 30))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("unmodifiable map");
    }
}
