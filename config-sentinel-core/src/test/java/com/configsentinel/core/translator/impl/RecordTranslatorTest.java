package com.configsentinel.core.translator.impl;

import com.configsentinel.core.conversion.ValueType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RecordTranslator}.
 */
class RecordTranslatorTest {

    record Pool(int size, int idleTimeout) {}

    record Database(String host, String port, Pool pool, List<String> replicas, String comment) {}

    static class MutableSettings {
        String name;
        Integer retries;
    }

    private final RecordTranslator translator = new RecordTranslator();
    private final Database database = new Database("db", "5432", new Pool(10, 30), List.of("r1", "r2"), null);

    @Test
    void collectionContains_checksComponents() {
        assertThat(translator.collectionContains(database, "host")).isTrue();
        assertThat(translator.collectionContains(database, "user")).isFalse();
        assertThat(translator.collectionContains("plain string", "length")).isFalse();
    }

    @Test
    void getCollectionKeys_returnsComponentOrder() {
        assertThat(translator.getCollectionKeys(database))
            .containsExactly("host", "port", "pool", "replicas", "comment");
    }

    @Test
    void getCollectionKeys_leafValue_throwsUnsupported() {
        assertThatThrownBy(() -> translator.getCollectionKeys(42))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("has no named members");
    }

    @Test
    void tryCastValue_convertsMembers() {
        assertThat(translator.tryCastValue(database, "port", ValueType.of(Integer.class))).contains(5432);
        assertThat(translator.tryCastValue(database, "host", ValueType.of(Integer.class))).isEmpty();
        assertThat(translator.tryCastValue(database, "comment", ValueType.of(String.class))).isEmpty();
        assertThat(translator.tryCastValue(database, "replicas", ValueType.listOf(String.class)))
            .contains(List.of("r1", "r2"));
    }

    @Test
    void tryCastValue_nestedRecordToMap_walksMembers() {
        assertThat(translator.tryCastValue(database, "pool", ValueType.map()))
            .contains(Map.of("size", 10, "idleTimeout", 30));
    }

    @Test
    void tryCastValue_nestedRecordAsItself_isIdentity() {
        assertThat(translator.tryCastValue(database, "pool", ValueType.of(Pool.class))).contains(new Pool(10, 30));
    }

    @Test
    void fieldValueIsNullOrEmpty_nullComponent_returnsTrue() {
        assertThat(translator.fieldValueIsNullOrEmpty(database, "comment")).isTrue();
        assertThat(translator.fieldValueIsNullOrEmpty(database, "host")).isFalse();
    }

    @Test
    void insertFieldValue_record_throwsUnsupported() {
        assertThatThrownBy(() -> translator.insertFieldValue(database, "host", "other"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void insertFieldValue_mutableObject_setsField() {
        MutableSettings settings = new MutableSettings();

        translator.insertFieldValue(settings, "retries", 3);

        assertThat(settings.retries).isEqualTo(3);
        assertThat(translator.fieldValueIsNullOrEmpty(settings, "name")).isTrue();
    }

    @Test
    void insertFieldValue_unknownMember_throwsIllegalArgument() {
        assertThatThrownBy(() -> translator.insertFieldValue(new MutableSettings(), "timeout", 3))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
