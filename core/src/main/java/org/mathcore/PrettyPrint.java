package org.mathcore;

import java.util.Locale;

/** Whitespace policy of the rendered markup. */
public enum PrettyPrint {
    /** Compact output, no inserted whitespace. */
    NEVER,
    /** Line breaks and indentation per nesting level. */
    ALWAYS,
    /** Like {@link #ALWAYS} for block equations, like {@link #NEVER} for inline ones. */
    AUTO;

    boolean appliesTo(MathDisplay display) {
        return switch (this) {
            case NEVER -> false;
            case ALWAYS -> true;
            case AUTO -> display == MathDisplay.BLOCK;
        };
    }

    /**
     * Parses {@code never}, {@code always} or {@code auto}, ignoring case.
     *
     * @throws LatexError with category {@link ErrorCategory#INVALID_CONFIGURATION_VALUE}
     */
    public static PrettyPrint parse(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "never" -> NEVER;
            case "always" -> ALWAYS;
            case "auto" -> AUTO;
            default -> throw LatexError.of(
                ErrorKind.INVALID_CONFIG_VALUE,
                Span.at(0),
                "pretty-print",
                "expected never, always or auto, got \"" + value + "\""
            );
        };
    }
}
