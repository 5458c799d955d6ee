package com.configsentinel.core.constraint;

import com.configsentinel.core.conversion.ValueType;
import com.configsentinel.core.model.ValidationError;
import com.configsentinel.core.translator.base.AbstractTranslator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One element type of a mixed sequence and the constraints applied to elements of that type.
 *
 * <p>Used with {@link Constraints#applyConstraintsToCollection(ElementRule...)}. Rules are tried
 * in order, so a rule for {@code String} placed first claims every element.
 *
 * @param type element type
 * @param constraints constraints run on elements that cast to {@code type}, may be empty
 * @param <T> element type
 */
public record ElementRule<T>(ValueType<T> type, List<Constraint<? super T>> constraints) {

    public ElementRule {
        Objects.requireNonNull(type, "type must not be null");
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    @SafeVarargs
    public static <T> ElementRule<T> of(Class<T> type, Constraint<? super T>... constraints) {
        return new ElementRule<>(ValueType.of(type), List.of(constraints));
    }

    @SafeVarargs
    public static <T> ElementRule<T> of(ValueType<T> type, Constraint<? super T>... constraints) {
        return new ElementRule<>(type, List.of(constraints));
    }

    /**
     * Casts an element and runs this rule's constraints on it.
     *
     * @return diagnostics, or empty if the element is not of this rule's type
     */
    Optional<List<ValidationError>> apply(Object element, String elementName, AbstractTranslator<?> caster) {
        Optional<T> cast = caster.tryCast(element, elementName, type);
        if (cast.isEmpty()) {
            return Optional.empty();
        }
        List<ValidationError> errors = new ArrayList<>();
        for (Constraint<? super T> constraint : constraints) {
            errors.addAll(constraint.evaluate(cast.get(), elementName));
        }
        return Optional.of(errors);
    }
}
