package org.mathcore;

import java.util.*;
import java.util.function.IntSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decides, for one conversion, whether an error aborts it or is absorbed into the output.
 *
 * <p>Absorbed errors are kept in order of appearance and logged, nothing is dropped.
 */
final class ErrorReporter {
    private static final Logger log = LogManager.getLogger("parser");

    // Result of parsing one element: a node, or the error that replaced it
    sealed interface Outcome {
        record Parsed(int node) implements Outcome {}

        record Absorbed(LatexError error) implements Outcome {}
    }

    private final boolean continueOnError;
    private final boolean ignoreUnknownCommands;
    private final List<LatexError> absorbed = new ArrayList<>();

    private ErrorReporter(boolean continueOnError, boolean ignoreUnknownCommands) {
        this.continueOnError = continueOnError;
        this.ignoreUnknownCommands = ignoreUnknownCommands;
    }

    // The first error ends the conversion
    static ErrorReporter abort() {
        return new ErrorReporter(false, false);
    }

    static ErrorReporter forConfig(ConversionConfig config) {
        return new ErrorReporter(config.continueOnError(), config.ignoreUnknownCommands());
    }

    boolean absorbs(LatexError error) {
        if (this.continueOnError) {
            return true;
        }
        return this.ignoreUnknownCommands && error.category() == ErrorCategory.UNKNOWN_COMMAND;
    }

    Outcome attempt(IntSupplier element) {
        try {
            return new Outcome.Parsed(element.getAsInt());
        } catch (LatexError e) {
            if (!absorbs(e)) {
                throw e;
            }
            remember(e);
            return new Outcome.Absorbed(e);
        }
    }

    // Turns the error into a marker over `source`, or rethrows it
    Node.ErrorMarker absorb(LatexError error, String source) {
        if (!absorbs(error)) {
            throw error;
        }
        remember(error);
        return marker(error, source);
    }

    Node.ErrorMarker marker(LatexError error, String source) {
        return new Node.ErrorMarker(source, error.getMessage(), error.offset());
    }

    private void remember(LatexError error) {
        log.info("absorbed at {}: {}", error.offset(), error.getMessage());
        this.absorbed.add(error);
    }

    List<LatexError> absorbed() {
        return Collections.unmodifiableList(this.absorbed);
    }
}
