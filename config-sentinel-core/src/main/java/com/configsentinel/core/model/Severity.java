package com.configsentinel.core.model;

/**
 * Severity level attached to every {@link ValidationError}.
 *
 * <p>Only {@link #FATAL} marks the validated collection as unusable.</p>
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Informational - not a problem, shown for the reader's benefit.
     */
    INFO,

    /**
     * Warning - something odd that does not invalidate the collection.
     */
    WARNING,

    /**
     * Fatal - the collection must not be used as configured.
     */
    FATAL
}
