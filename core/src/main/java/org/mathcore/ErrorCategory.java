package org.mathcore;

/**
 * Coarse classification of conversion failures.
 *
 * <p>{@link #INVALID_MACRO_DEFINITION} and {@link #INVALID_CONFIGURATION_VALUE} only
 * arise while building a configuration or a converter. The other two are raised per
 * conversion and may be absorbed into inline markers, depending on configuration.
 */
public enum ErrorCategory {
    UNKNOWN_COMMAND,
    INVALID_MACRO_DEFINITION,
    MALFORMED_STRUCTURE,
    INVALID_CONFIGURATION_VALUE
}
