package org.mathcore;

import java.text.MessageFormat;

// Patterns go through MessageFormat, literal braces are quoted
public enum ErrorKind {
    UNCLOSED_GROUP("Expected token \"{0}\", but not found."),
    UNMATCHED_CLOSE("Unmatched closing token: \"{0}\"."),
    EXPECTED_ARGUMENT_GOT_CLOSE("Expected argument but got closing token (\"'}'\", \"\\end\", \"\\right\")."),
    EXPECTED_ARGUMENT_GOT_EOF("Expected argument but reached end of input."),
    EXPECTED_DELIMITER("There must be a parenthesis after \"{0}\", but not found."),
    UNKNOWN_ENVIRONMENT("Unknown environment \"{0}\"."),
    UNKNOWN_COMMAND("Unknown command \"\\{0}\".", ErrorCategory.UNKNOWN_COMMAND),
    MISMATCHED_ENVIRONMENT("Expected \"\\end'{'{0}'}'\", but got \"\\end'{'{1}'}'\"."),
    MALFORMED_ENVIRONMENT("Expected an environment name in braces after \"\\{0}\"."),
    CANNOT_BE_USED_HERE("Got \"{0}\", which may only appear {1}."),
    BOUND_FOLLOWED_BY_BOUND("A script marker is directly followed by another script marker or a prime."),
    DUPLICATE_SUB_OR_SUP("Duplicate subscript or superscript."),
    DISALLOWED_CHAR("Disallowed character \"{0}\"."),
    EXPECTED_TEXT("Expected text in {0}."),
    EXPECTED_LENGTH("Expected length with units, got \"{0}\"."),
    EXPECTED_COL_SPEC("Expected column specification, got \"{0}\"."),
    EXPECTED_MATH_STYLE("Expected a math style from 0 to 3, got \"{0}\"."),
    UNKNOWN_COLOR("Unknown color \"{0}\"."),
    INVALID_MACRO_NAME("Invalid macro name: \"\\{0}\".", ErrorCategory.INVALID_MACRO_DEFINITION),
    INVALID_PARAMETER_NUMBER("Invalid parameter number. Must be 1-9.", ErrorCategory.INVALID_MACRO_DEFINITION),
    EXPECTED_PARAM_NUMBER_GOT_EOF("Expected parameter number after \"#\", but got end of input.",
        ErrorCategory.INVALID_MACRO_DEFINITION),
    MACRO_PARAMETER_OUTSIDE_CUSTOM_COMMAND("Macro parameter found outside of custom command definition."),
    HARD_LIMIT_EXCEEDED("Hard limit exceeded. Please simplify your equation."),
    INVALID_CONFIG_VALUE("Invalid value for option \"{0}\": {1}.", ErrorCategory.INVALID_CONFIGURATION_VALUE);

    final String pattern;
    final ErrorCategory category;

    ErrorKind(String pattern) {
        this(pattern, ErrorCategory.MALFORMED_STRUCTURE);
    }

    ErrorKind(String pattern, ErrorCategory category) {
        this.pattern = pattern;
        this.category = category;
    }

    String format(Object... args) {
        return MessageFormat.format(this.pattern, args);
    }
}
