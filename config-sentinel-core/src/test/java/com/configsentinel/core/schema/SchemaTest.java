package com.configsentinel.core.schema;

import com.configsentinel.core.constraint.Constraints;
import com.configsentinel.core.conversion.ValueType;
import com.configsentinel.core.model.Severity;
import com.configsentinel.core.model.ValidationError;
import com.configsentinel.core.model.ValidationResult;
import com.configsentinel.core.translator.impl.JsonNodeTranslator;
import com.configsentinel.core.translator.impl.MapTranslator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Schema}.
 */
class SchemaTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JsonNodeTranslator translator = new JsonNodeTranslator();
    private Schema schema;

    @BeforeEach
    void setUp() {
        Schema databaseSchema = new Schema(
            Field.builder("host", "Database host", String.class).build(),
            Field.builder("port", "Database port", Integer.class)
                .optional()
                .defaultValue(5432)
                .build());

        schema = new Schema(
            Field.builder("name", "Service name", String.class)
                .constraint(Constraints.constrainStringLength(3, 30))
                .build(),
            Field.builder("port", "Listening port", Integer.class)
                .constraint(Constraints.constrainValue(1024, 65535))
                .build(),
            Field.builder("timeout", "Request timeout in seconds", Integer.class)
                .optional()
                .defaultValue(30)
                .build(),
            Field.builder("tags", "Free-form tags", ValueType.listOf(String.class))
                .optional()
                .build(),
            Field.builder("database", "Database connection", ObjectNode.class)
                .optional()
                .constraint(Constraints.applySchema(databaseSchema))
                .build());
    }

    private static ObjectNode json(String text) throws Exception {
        return (ObjectNode) MAPPER.readTree(text);
    }

    private static List<String> messages(ValidationResult result) {
        return result.errors().stream().map(ValidationError::message).toList();
    }

    // ==================== Field Management ====================

    @Test
    void addField_duplicateName_throwsException() {
        assertThatThrownBy(() -> schema.addField(Field.builder("port", "Another port", Long.class).build()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("port");
    }

    @Test
    void addFields_duplicateInBatch_addsNothing() {
        List<Field<?>> batch = List.of(
            Field.builder("a", "A", String.class).build(),
            Field.builder("a", "A again", String.class).build());

        assertThatThrownBy(() -> schema.addFields(batch)).isInstanceOf(IllegalArgumentException.class);
        assertThat(schema.containsField("a")).isFalse();
    }

    @Test
    void constructor_duplicateNames_throwsException() {
        assertThatThrownBy(() -> new Schema(
            Field.builder("x", "X", String.class).build(),
            Field.builder("x", "X", String.class).build()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeField_andLookups() {
        assertThat(schema.fieldCount()).isEqualTo(5);
        assertThat(schema.fieldNames()).containsExactly("name", "port", "timeout", "tags", "database");

        schema.removeField("tags");

        assertThat(schema.fieldCount()).isEqualTo(4);
        assertThat(schema.containsField("tags")).isFalse();
        assertThat(schema.getField("tags")).isEmpty();
        assertThat(schema.getField("name")).hasValueSatisfying(field -> assertThat(field.getHelpText())
            .isEqualTo("Service name"));
    }

    @Test
    void removeFields_unknownName_removesNothing() {
        assertThatThrownBy(() -> schema.removeFields("name", "missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing");
        assertThat(schema.containsField("name")).isTrue();
    }

    @Test
    void copy_isIndependent() {
        Schema copy = schema.copy();

        copy.removeField("name");

        assertThat(schema.containsField("name")).isTrue();
        assertThat(copy.fieldCount()).isEqualTo(4);
        assertThat(copy.getField("port")).containsSame(schema.getField("port").orElseThrow());
    }

    // ==================== Validation ====================

    @Test
    void validate_validInput_hasNoErrors() throws Exception {
        ObjectNode input = json("""
            {"name": "orders", "port": 8080, "tags": ["a"], "database": {"host": "db"}}
            """);

        ValidationResult result = schema.validate(input, translator);

        assertThat(result.errors()).isEmpty();
        assertThat(result.isValid()).isTrue();
    }

    @Test
    void validate_missingRequiredField_reportsExactlyOneFatal() throws Exception {
        ValidationResult result = schema.validate(json("{\"name\": \"orders\"}"), translator);

        assertThat(result.errors()).singleElement()
            .satisfies(error -> {
                assertThat(error.severity()).isEqualTo(Severity.FATAL);
                assertThat(error.message()).contains("port", "Listening port");
            });
    }

    @Test
    void validate_optionalFieldWithDefault_insertsDefault() throws Exception {
        ObjectNode input = json("{\"name\": \"orders\", \"port\": 8080}");

        ValidationResult result = schema.validate(input, translator);

        assertThat(result.errors()).isEmpty();
        assertThat(input.get("timeout").intValue()).isEqualTo(30);
        assertThat(input.has("tags")).isFalse();
    }

    @Test
    void validate_twice_returnsIndependentResults() throws Exception {
        ObjectNode valid = json("{\"name\": \"orders\", \"port\": 8080}");
        ObjectNode invalid = json("{\"name\": \"x\"}");

        ValidationResult first = schema.validate(valid, translator);
        ValidationResult broken = schema.validate(invalid, translator);
        ValidationResult second = schema.validate(valid, translator);

        assertThat(first.errors()).isEmpty();
        assertThat(broken.isValid()).isFalse();
        assertThat(second.errors()).isEmpty();
    }

    @Test
    void validate_reportsEveryFailingField() throws Exception {
        ObjectNode input = json("""
            {"name": "x", "port": "I'm still a string!", "tags": [1]}
            """);

        ValidationResult result = schema.validate(input, translator);

        assertThat(result.fatalErrors()).extracting(ValidationError::message)
            .anySatisfy(message -> assertThat(message).contains("Field name with value x"))
            .anySatisfy(message -> assertThat(message)
                .isEqualTo("Field port with value I'm still a string! is an incorrect type. Expected: Json Number"))
            .hasSize(2);
    }

    @Test
    void validate_numericString_isCast() throws Exception {
        ValidationResult result = schema.validate(json("{\"name\": \"orders\", \"port\": \"57\"}"), translator);

        assertThat(result.fatalErrors()).singleElement()
            .extracting(ValidationError::message)
            .asString()
            .contains("Field port with value 57 is invalid");
    }

    @Test
    void validate_nestedSchemaFailure_namesOuterAndInnerField() throws Exception {
        ObjectNode input = json("""
            {"name": "orders", "port": 8080, "database": {"port": 5433}}
            """);

        ValidationResult result = schema.validate(input, translator);

        assertThat(result.isValid()).isFalse();
        assertThat(messages(result)).contains(
            "Input database is missing required field host: Database host",
            "Validation for database failed.",
            "database: Database connection");
    }

    @Test
    void validate_unrecognizedKey_isFatalByDefault() throws Exception {
        ObjectNode input = json("{\"name\": \"orders\", \"port\": 8080, \"prot\": 1}");

        ValidationResult result = schema.validate(input, translator);

        assertThat(result.fatalErrors()).extracting(ValidationError::message)
            .containsExactly("Input collection contains unrecognized field: prot");
    }

    @Test
    void validate_unrecognizedKey_honoursPolicy() throws Exception {
        ObjectNode input = json("{\"name\": \"orders\", \"port\": 8080, \"prot\": 1}");

        ValidationResult reported = schema.validate(input, translator,
            ValidationOptions.defaults().withUnrecognizedFields(UnrecognizedFieldPolicy.REPORT));
        ValidationResult ignored = schema.validate(input, translator,
            ValidationOptions.defaults().withUnrecognizedFields(UnrecognizedFieldPolicy.IGNORE));

        assertThat(reported.isValid()).isTrue();
        assertThat(reported.errors()).singleElement()
            .extracting(ValidationError::severity)
            .isEqualTo(Severity.INFO);
        assertThat(ignored.errors()).isEmpty();
    }

    @Test
    void validate_named_addsSummaryOnFailure() throws Exception {
        ValidationResult result = schema.validate(json("{}"), translator, ValidationOptions.named("service.yaml"));

        assertThat(messages(result)).contains(
            "Input service.yaml is missing required field name: Service name",
            "Validation for service.yaml failed.");
        assertThat(result.errors()).last().extracting(ValidationError::severity).isEqualTo(Severity.INFO);
    }

    @Test
    void validate_nonObjectInput_reportsFatal() {
        JsonNode array = MAPPER.createArrayNode();

        ValidationResult result = new Schema().validate(array, translator);

        assertThat(result.fatalErrors()).singleElement()
            .extracting(ValidationError::message)
            .asString()
            .contains("is not a collection of named values");
    }

    @Test
    void validate_map_usesSameRules() {
        Map<String, Object> input = new HashMap<>();
        input.put("name", "orders");
        input.put("port", 80);

        ValidationResult result = schema.copy().removeField("database").validate(input, new MapTranslator());

        assertThat(result.fatalErrors()).singleElement()
            .extracting(ValidationError::message)
            .asString()
            .contains("Field port with value 80 is invalid");
        assertThat(input).containsEntry("timeout", 30);
    }

    // ==================== Template ====================

    @Test
    void generateTemplate_listsHelpTexts() {
        ObjectNode template = schema.generateTemplate();

        assertThat(template.get("name").textValue()).isEqualTo("Service name");
        assertThat(template.get("timeout").textValue()).isEqualTo("Optional - Request timeout in seconds");
        assertThat(template.size()).isEqualTo(5);
    }
}
