package com.configsentinel.core.constraint;

import com.configsentinel.core.conversion.Conversions;
import com.configsentinel.core.conversion.DateTimeFormats;
import com.configsentinel.core.model.ValidationError;
import com.configsentinel.core.model.ValidationResult;
import com.configsentinel.core.schema.Schema;
import com.configsentinel.core.schema.ValidationOptions;
import com.configsentinel.core.translator.Translator;
import com.configsentinel.core.translator.impl.JsonNodeTranslator;
import com.configsentinel.core.translator.impl.MapTranslator;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Factory for reusable constraints.
 *
 * <p>Every constraint returned here is stateless and never throws while evaluating; problems
 * are reported as {@link ValidationError}s. Invalid factory arguments (reversed bounds, empty
 * pattern lists) are definition errors and fail immediately with {@link IllegalArgumentException}.
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * Field<Integer> port = Field.builder("port", "TCP port to listen on", Integer.class)
 *     .constraint(Constraints.constrainValue(Range.of(1024, 49151), Range.of(60000, 65535)))
 *     .build();
 *
 * Field<String> env = Field.builder("environment", "Deployment environment", String.class)
 *     .constraint(Constraints.allowValues("dev", "staging", "prod"))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Constraints {

    private Constraints() {
        // Utility class - prevent instantiation
    }

    // ===== Comparable Values =====

    /**
     * Constrains comparable values with a lower bound, inclusive.
     *
     * @param lowerBound smallest allowed value
     * @param <T> comparable type
     * @return lower-bound constraint
     */
    public static <T extends Comparable<? super T>> Constraint<T> constrainValueLowerBound(T lowerBound) {
        Objects.requireNonNull(lowerBound, "lowerBound must not be null");
        return Constraint.of("ConstrainValueLowerBound", (value, field) -> value.compareTo(lowerBound) < 0
            ? fatal("Field " + field + " with value " + value + " is less than enforced lower bound " + lowerBound)
            : List.of());
    }

    /**
     * Constrains comparable values with an upper bound, inclusive.
     *
     * @param upperBound largest allowed value
     * @param <T> comparable type
     * @return upper-bound constraint
     */
    public static <T extends Comparable<? super T>> Constraint<T> constrainValueUpperBound(T upperBound) {
        Objects.requireNonNull(upperBound, "upperBound must not be null");
        return Constraint.of("ConstrainValueUpperBound", (value, field) -> value.compareTo(upperBound) > 0
            ? fatal("Field " + field + " with value " + value + " is greater than enforced upper bound " + upperBound)
            : List.of());
    }

    /**
     * Constrains comparable values to a closed range.
     *
     * @param lowerBound smallest allowed value
     * @param upperBound largest allowed value
     * @param <T> comparable type
     * @return range constraint
     * @throws IllegalArgumentException if {@code lowerBound > upperBound}
     */
    public static <T extends Comparable<? super T>> Constraint<T> constrainValue(T lowerBound, T upperBound) {
        Range<T> range = Range.of(lowerBound, upperBound);
        return Constraint.of("ConstrainValue", (value, field) -> range.contains(value)
            ? List.of()
            : fatal("Field " + field + " with value " + value + " is invalid. Value must be greater than or equal to "
                + lowerBound + " and less than or equal to " + upperBound));
    }

    /**
     * Constrains comparable values to a union of closed ranges. A value passes if it falls in
     * at least one range.
     *
     * @param domains allowed ranges
     * @param <T> comparable type
     * @return range-union constraint
     * @throws IllegalArgumentException if no range is given
     */
    @SafeVarargs
    public static <T extends Comparable<? super T>> Constraint<T> constrainValue(Range<T>... domains) {
        requireArguments(domains, "constrainValue requires at least one range");
        List<Range<T>> ranges = List.of(domains);
        String rendered = ranges.stream().map(Range::toString).collect(Collectors.joining(" "));
        return Constraint.of("ConstrainValue", (value, field) -> ranges.stream().anyMatch(range -> range.contains(value))
            ? List.of()
            : fatal("Field " + field + " with value " + value
                + " is invalid. Value must fall within one of the following domains, inclusive: " + rendered));
    }

    /**
     * Constrains the number of significant digits after the decimal point.
     *
     * @param maxDigits largest allowed number of fractional digits
     * @return digit constraint
     * @throws IllegalArgumentException if {@code maxDigits} is negative
     */
    public static Constraint<Number> constrainDigits(int maxDigits) {
        if (maxDigits < 0) {
            throw new IllegalArgumentException("constrainDigits maxDigits must not be negative: " + maxDigits);
        }
        return Constraint.of("ConstrainDigits", (value, field) -> {
            int digits;
            try {
                digits = Math.max(0, new BigDecimal(value.toString()).stripTrailingZeros().scale());
            } catch (NumberFormatException e) {
                return fatal("Field " + field + " with value " + value + " is not a finite number");
            }
            return digits > maxDigits
                ? fatal("Field " + field + " with value " + value + " is invalid. Value can have no more than "
                    + maxDigits + " digits after the decimal.")
                : List.of();
        });
    }

    // ===== Allowed Values and Strings =====

    /**
     * Restricts values to a fixed allow-list, compared with {@link Object#equals}. Strings are
     * compared case-sensitively.
     *
     * @param acceptableValues allowed values
     * @param <T> value type
     * @return allow-list constraint
     * @throws IllegalArgumentException if no value is given
     */
    @SafeVarargs
    public static <T> Constraint<T> allowValues(T... acceptableValues) {
        requireArguments(acceptableValues, "allowValues requires at least one value");
        List<T> allowed = List.of(acceptableValues);
        String rendered = allowed.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return Constraint.of("AllowValues", (value, field) -> allowed.contains(value)
            ? List.of()
            : fatal("Field " + field + " with value " + value + " is not valid. Valid values: " + rendered));
    }

    /**
     * Forbids substrings. Every forbidden substring found yields its own fatal error.
     *
     * @param forbiddenSubstrings substrings that must not occur
     * @return forbidden-substring constraint
     * @throws IllegalArgumentException if no substring is given or one is empty
     */
    public static Constraint<String> forbidSubstrings(String... forbiddenSubstrings) {
        requireArguments(forbiddenSubstrings, "forbidSubstrings requires at least one substring");
        List<String> forbidden = List.of(forbiddenSubstrings);
        if (forbidden.stream().anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("forbidSubstrings does not accept empty substrings");
        }
        return Constraint.of("ForbidSubstrings", (value, field) -> forbidden.stream()
            .filter(value::contains)
            .map(substring -> ValidationError.fatal(
                "Field " + field + " with value " + value + " contains forbidden substring: " + substring))
            .toList());
    }

    /**
     * Requires a minimum string length.
     *
     * @param lowerBound smallest allowed length
     * @return length constraint
     */
    public static Constraint<String> constrainStringLengthLowerBound(int lowerBound) {
        return Constraint.of("ConstrainStringLengthLowerBound", (value, field) -> value.length() < lowerBound
            ? fatal("Field " + field + " with value " + value + " must have a length of at least " + lowerBound
                + ". Actual length: " + value.length())
            : List.of());
    }

    /**
     * Requires a maximum string length.
     *
     * @param upperBound largest allowed length
     * @return length constraint
     */
    public static Constraint<String> constrainStringLengthUpperBound(int upperBound) {
        return Constraint.of("ConstrainStringLengthUpperBound", (value, field) -> value.length() > upperBound
            ? fatal("Field " + field + " with value " + value + " must have a length of at most " + upperBound
                + ". Actual length: " + value.length())
            : List.of());
    }

    /**
     * Requires a string length within {@code [lowerBound, upperBound]}.
     *
     * @param lowerBound smallest allowed length
     * @param upperBound largest allowed length
     * @return length constraint
     * @throws IllegalArgumentException if {@code lowerBound > upperBound}
     */
    public static Constraint<String> constrainStringLength(int lowerBound, int upperBound) {
        requireOrdered(lowerBound, upperBound, "constrainStringLength");
        return Constraint.of("ConstrainStringLength", (value, field) ->
            value.length() < lowerBound || value.length() > upperBound
                ? fatal("Field " + field + " with value " + value + " must have a length of at least " + lowerBound
                    + " and at most " + upperBound + ". Actual length: " + value.length())
                : List.of());
    }

    /**
     * Requires the whole string to match at least one of the given patterns.
     *
     * @param patterns allowed patterns
     * @return regex constraint
     * @throws IllegalArgumentException if no pattern is given
     */
    public static Constraint<String> constrainStringWithRegexExact(Pattern... patterns) {
        requireArguments(patterns, "constrainStringWithRegexExact requires at least one pattern");
        List<Pattern> allowed = List.of(patterns);
        return Constraint.of("ConstrainStringWithRegexExact", (value, field) -> {
            if (allowed.stream().anyMatch(pattern -> pattern.matcher(value).matches())) {
                return List.of();
            }
            if (allowed.size() == 1) {
                return fatal("Field " + field + " with value " + value + " is not an exact match to pattern "
                    + allowed.get(0));
            }
            return fatal("Field " + field + " with value " + value + " is not an exact match to any pattern: "
                + allowed.stream().map(Pattern::pattern).collect(Collectors.joining(" ")));
        });
    }

    /**
     * Requires the whole string to match at least one of the given regular expressions.
     *
     * @param regexes allowed regular expressions
     * @return regex constraint
     * @throws java.util.regex.PatternSyntaxException if an expression is invalid
     */
    public static Constraint<String> constrainStringWithRegexExact(String... regexes) {
        requireArguments(regexes, "constrainStringWithRegexExact requires at least one pattern");
        return constrainStringWithRegexExact(Arrays.stream(regexes).map(Pattern::compile).toArray(Pattern[]::new));
    }

    // ===== Date/Time =====

    /**
     * Requires the raw text of a value to parse under at least one of the given
     * {@link java.time.format.DateTimeFormatter} patterns.
     *
     * <p>This is a format constraint: it checks the text as written, not the parsed temporal,
     * so it can tell {@code 2024-01-05} apart from {@code 2024-1-5}. Dates that do not exist,
     * such as {@code 2023-02-30}, fail.
     *
     * @param patterns allowed patterns
     * @param <T> field type the constraint is attached to
     * @return format constraint
     * @throws IllegalArgumentException if no pattern is given or a pattern is invalid
     */
    public static <T> Constraint<T> constrainDateTimeFormat(String... patterns) {
        requireArguments(patterns, "constrainDateTimeFormat requires at least one pattern");
        List<String> formats = List.of(patterns);
        formats.forEach(DateTimeFormats::requireValidPattern);
        return Constraint.format("ConstrainDateTimeFormat", (text, field) ->
            formats.stream().anyMatch(pattern -> DateTimeFormats.matches(text, pattern))
                ? List.of()
                : fatal("Field " + field + " with value " + text + " is not in a valid date/time format. Valid formats: "
                    + String.join(", ", formats)));
    }

    // ===== Collections =====

    /**
     * Requires an array-like or object-like value to have at least {@code lowerBound}
     * elements or properties.
     *
     * @param lowerBound smallest allowed count
     * @param <T> collection type
     * @return count constraint
     */
    public static <T> Constraint<T> constrainCollectionCountLowerBound(int lowerBound) {
        return Constraint.of("ConstrainCollectionCountLowerBound", (value, field) -> countCheck(value, field,
            count -> count < lowerBound,
            "must contain at least " + lowerBound + " values"));
    }

    /**
     * Requires an array-like or object-like value to have at most {@code upperBound}
     * elements or properties.
     *
     * @param upperBound largest allowed count
     * @param <T> collection type
     * @return count constraint
     */
    public static <T> Constraint<T> constrainCollectionCountUpperBound(int upperBound) {
        return Constraint.of("ConstrainCollectionCountUpperBound", (value, field) -> countCheck(value, field,
            count -> count > upperBound,
            "must contain at most " + upperBound + " values"));
    }

    /**
     * Requires an array-like or object-like value to have between {@code lowerBound} and
     * {@code upperBound} elements or properties, inclusive.
     *
     * @param lowerBound smallest allowed count
     * @param upperBound largest allowed count
     * @param <T> collection type
     * @return count constraint
     * @throws IllegalArgumentException if {@code lowerBound > upperBound}
     */
    public static <T> Constraint<T> constrainCollectionCount(int lowerBound, int upperBound) {
        requireOrdered(lowerBound, upperBound, "constrainCollectionCount");
        return Constraint.of("ConstrainCollectionCount", (value, field) -> countCheck(value, field,
            count -> count < lowerBound || count > upperBound,
            "must contain between " + lowerBound + " and " + upperBound + " values"));
    }

    /**
     * Applies constraints to every element of a sequence. Errors of all elements are collected;
     * each element is reported as {@code field[index]}.
     *
     * @param constraints constraints to run on each element
     * @param <E> element type
     * @return element-wise constraint
     * @throws IllegalArgumentException if no constraint is given
     */
    @SafeVarargs
    public static <E> Constraint<Iterable<E>> applyConstraintsToCollection(Constraint<? super E>... constraints) {
        requireArguments(constraints, "applyConstraintsToCollection requires at least one constraint");
        List<Constraint<? super E>> elementConstraints = List.of(constraints);
        return Constraint.of("ApplyConstraintsToCollection", (values, field) -> {
            List<ValidationError> errors = new ArrayList<>();
            int index = 0;
            for (E element : values) {
                String elementName = field + "[" + index++ + "]";
                if (element == null) {
                    errors.add(ValidationError.fatal("Value of " + elementName + " is null"));
                    continue;
                }
                for (Constraint<? super E> constraint : elementConstraints) {
                    errors.addAll(constraint.evaluate(element, elementName));
                }
            }
            return errors;
        });
    }

    /**
     * Applies type-dependent constraints to every element of a mixed sequence.
     *
     * <p>Each element is cast against the rules in order; the constraints of the first rule whose
     * type fits are run and the remaining rules are skipped. An element that fits no rule yields
     * one fatal error listing the expected types. Elements are cast with the ISO date/time patterns.
     *
     * <p><b>Example:</b>
     * <pre>{@code
     * Constraint<Iterable<?>> ports = Constraints.applyConstraintsToCollection(
     *     ElementRule.of(Integer.class, Constraints.constrainValue(1, 65535)),
     *     ElementRule.of(String.class, Constraints.allowValues("http", "https")));
     * }</pre>
     *
     * @param rules element types with their constraints, tried in order
     * @return element-wise constraint
     * @throws IllegalArgumentException if no rule is given
     */
    public static Constraint<Iterable<?>> applyConstraintsToCollection(ElementRule<?>... rules) {
        return applyConstraintsToCollection(DateTimeFormats.withDefaults(), rules);
    }

    /**
     * Applies type-dependent constraints to every element of a mixed sequence, casting date/time
     * elements with the given registry.
     *
     * @param dateTimeFormats patterns used for date/time element types
     * @param rules element types with their constraints, tried in order
     * @return element-wise constraint
     * @throws IllegalArgumentException if no rule is given
     * @see #applyConstraintsToCollection(ElementRule...)
     */
    public static Constraint<Iterable<?>> applyConstraintsToCollection(DateTimeFormats dateTimeFormats,
                                                                       ElementRule<?>... rules) {
        requireArguments(rules, "applyConstraintsToCollection requires at least one element rule");
        List<ElementRule<?>> elementRules = List.of(rules);
        MapTranslator caster = new MapTranslator(dateTimeFormats);
        String expected = elementRules.stream()
            .map(rule -> rule.type().simpleName())
            .collect(Collectors.joining(", "));
        return Constraint.of("ApplyConstraintsToCollection", (values, field) -> {
            List<ValidationError> errors = new ArrayList<>();
            int index = 0;
            for (Object element : values) {
                String elementName = field + "[" + index++ + "]";
                Optional<List<ValidationError>> matched = Optional.empty();
                for (ElementRule<?> rule : elementRules) {
                    matched = rule.apply(element, elementName, caster);
                    if (matched.isPresent()) {
                        break;
                    }
                }
                if (matched.isPresent()) {
                    errors.addAll(matched.get());
                } else {
                    errors.add(ValidationError.fatal("Element " + elementName + " with value "
                        + Conversions.stringify(element) + " is an incorrect type. Expected one of: " + expected));
                }
            }
            return errors;
        });
    }

    // ===== Nested Schemas =====

    /**
     * Validates a nested JSON object with another schema.
     *
     * @param schema schema for the nested object
     * @return nested-schema constraint
     */
    public static Constraint<ObjectNode> applySchema(Schema schema) {
        return applySchema(schema, new JsonNodeTranslator());
    }

    /**
     * Validates a nested map with another schema.
     *
     * @param schema schema for the nested map
     * @return nested-schema constraint
     */
    public static Constraint<Map<String, Object>> applySchemaToMap(Schema schema) {
        return applySchema(schema, new MapTranslator());
    }

    /**
     * Validates a nested collection with another schema through the given translator.
     * The nested pass is named after the parent field, so its messages identify both the
     * parent field and the inner field.
     *
     * <p>Schemas must not apply themselves, directly or transitively.
     *
     * @param schema schema for the nested collection
     * @param translator translator for the nested collection
     * @param <C> nested collection type
     * @return nested-schema constraint
     */
    public static <C> Constraint<C> applySchema(Schema schema, Translator<? super C> translator) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(translator, "translator must not be null");
        return Constraint.of("ApplySchema", (value, field) -> {
            ValidationResult nested = schema.validate(value, translator, ValidationOptions.named(field));
            return nested.errors();
        });
    }

    // ===== Combinators =====

    /**
     * Passes if at least one alternative passes, i.e. produces no fatal error. Non-fatal
     * diagnostics of the first passing alternative are forwarded. If every alternative fails,
     * a single fatal error summarizes the failure.
     *
     * @param constraints alternatives, at least two
     * @param <T> value type
     * @return match-any constraint
     * @throws IllegalArgumentException if fewer than two alternatives are given
     */
    @SafeVarargs
    public static <T> Constraint<T> matchAny(Constraint<? super T>... constraints) {
        if (constraints == null || constraints.length < 2) {
            throw new IllegalArgumentException("matchAny requires at least 2 constraints");
        }
        List<Constraint<? super T>> alternatives = List.of(constraints);
        String names = alternatives.stream().map(Constraint::getName).collect(Collectors.joining(", "));
        return Constraint.of("MatchAny", (value, field) -> {
            for (Constraint<? super T> alternative : alternatives) {
                List<ValidationError> errors = alternative.evaluate(value, field);
                if (!ValidationResult.anyFatal(errors)) {
                    return errors;
                }
            }
            return fatal("Field " + field + " with value " + value + " did not match any of "
                + alternatives.size() + " alternatives: " + names);
        });
    }

    // ===== Helpers =====

    private static List<ValidationError> countCheck(Object value, String field,
                                                    IntPredicate violates, String requirement) {
        OptionalInt count = Conversions.sizeOf(value);
        if (count.isEmpty()) {
            return fatal("Field " + field + " with value " + Conversions.stringify(value)
                + " is not a collection and cannot be counted");
        }
        if (violates.test(count.getAsInt())) {
            return fatal("Collection " + field + " contains " + count.getAsInt() + " values, but " + requirement + ".");
        }
        return List.of();
    }

    private static List<ValidationError> fatal(String message) {
        return List.of(ValidationError.fatal(message));
    }

    private static void requireArguments(Object[] arguments, String message) {
        if (arguments == null || arguments.length == 0) {
            throw new IllegalArgumentException(message);
        }
    }

    private static void requireOrdered(int lowerBound, int upperBound, String factory) {
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException(factory + " lowerBound must be less than or equal to upperBound. "
                + "Passed lowerBound: " + lowerBound + " Passed upperBound: " + upperBound);
        }
    }
}
