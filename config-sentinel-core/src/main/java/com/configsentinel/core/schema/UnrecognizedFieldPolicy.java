package com.configsentinel.core.schema;

/**
 * How a {@link Schema} treats keys in the input that no field claims.
 */
public enum UnrecognizedFieldPolicy {
    /**
     * Each unrecognized key is a fatal error. Default.
     */
    REJECT,

    /**
     * Each unrecognized key is reported as information and the input stays valid.
     */
    REPORT,

    /**
     * Unrecognized keys are not reported.
     */
    IGNORE
}
