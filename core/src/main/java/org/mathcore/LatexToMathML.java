package org.mathcore;

import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Converts LaTeX math to MathML Core.
 *
 * <p>A converter is built once from a {@link ConversionConfig}; the user macros are
 * checked right away. Conversions with a local counter share no state and may run
 * concurrently. Conversions with the global counter number their equations across
 * calls and are serialized on the converter.
 *
 * <pre>{@code
 * var converter = new LatexToMathML(ConversionConfig.defaults());
 * converter.convertWithLocalCounter("x^2", false); // <math><msup><mi>x</mi><mn>2</mn></msup></math>
 * }</pre>
 */
public final class LatexToMathML {
    private static final Logger log = LogManager.getLogger("converter");

    private final ConversionConfig config;
    private final MacroExpander macros;
    private final GlobalCounter globalCounter = new GlobalCounter();

    /**
     * @throws LatexError with category {@link ErrorCategory#INVALID_MACRO_DEFINITION} if a
     *     macro is invalid; its offset and context refer to the macro body
     */
    public LatexToMathML(ConversionConfig config) {
        this.config = config;
        this.macros = config.macros().isEmpty()
            ? MacroExpander.empty()
            : MacroExpander.compile(config.macros());
        log.debug("converter ready with {} macro(s), {} built-in commands", this.macros.size(), CommandTable.size());
    }

    public ConversionConfig config() {
        return this.config;
    }

    /**
     * Converts with numbering starting from 1 for this call only.
     *
     * @throws LatexError unless the configuration absorbs the error into the output
     */
    public String convertWithLocalCounter(String latex, MathDisplay display) {
        return convert(latex, display, new EquationCounter());
    }

    public String convertWithLocalCounter(String latex, boolean displaystyle) {
        return convertWithLocalCounter(latex, MathDisplay.of(displaystyle));
    }

    /**
     * Converts with numbering that continues from the previous global conversion.
     * A failed conversion leaves the counter where it was.
     *
     * @throws LatexError unless the configuration absorbs the error into the output
     */
    public String convertWithGlobalCounter(String latex, MathDisplay display) {
        return this.globalCounter.withCounter(counter -> convert(latex, display, counter));
    }

    public String convertWithGlobalCounter(String latex, boolean displaystyle) {
        return convertWithGlobalCounter(latex, MathDisplay.of(displaystyle));
    }

    public void resetGlobalCounter() {
        this.globalCounter.reset();
    }

    private String convert(String latex, MathDisplay display, EquationCounter counter) {
        log.debug("convert {} \"{}\"", display, latex);
        var reporter = ErrorReporter.forConfig(this.config);
        var parser = new Parser(TokenStream.of(latex, this.macros), latex, reporter, counter);
        var roots = parser.parse();

        if (!reporter.absorbed().isEmpty()) {
            log.info("{} error(s) absorbed in \"{}\"", reporter.absorbed().size(), latex);
        }

        var renderer = new MathMLRenderer(parser.arena, this.config.prettyPrint().appliesTo(display));
        return renderer.render(
            roots,
            display,
            this.config.xmlNamespace(),
            this.config.annotation() ? Optional.of(latex) : Optional.empty()
        );
    }
}
