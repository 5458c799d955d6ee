package com.configsentinel.core.constraint;

/**
 * When a {@link Constraint} is applied relative to the field's cast.
 */
public enum ConstraintType {
    /** Applied to the value after it has been cast to the field's type */
    STANDARD,
    /** Applied to the raw text of the value, before any lossy cast */
    FORMAT
}
