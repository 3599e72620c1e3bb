package org.mathcore;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

class MacroExpanderTest {
    private static LatexToMathML withMacros(Map<String, String> macros) {
        return new LatexToMathML(ConversionConfig.defaults().withMacros(macros));
    }

    private static LatexError rejected(Map<String, String> macros) {
        return assertThrows(LatexError.class, () -> withMacros(macros));
    }

    @Test void macroMatchesDirectUse() {
        var converter = withMacros(Map.of("RR", "\\mathbb{R}"));
        assertEquals("<math><mi>ℝ</mi></math>", converter.convertWithLocalCounter("\\RR", false));
        assertEquals(
            converter.convertWithLocalCounter("\\mathbb{R}", false),
            converter.convertWithLocalCounter("\\RR", false)
        );
    }

    @Test void argumentsBracedOrSingle() {
        var converter = withMacros(Map.of("pair", "(#1, #2)"));
        var expected = "<math><mo stretchy=\"false\">(</mo><mi>a</mi><mo>,</mo><mi>b</mi>"
            + "<mo stretchy=\"false\">)</mo></math>";
        assertEquals(expected, converter.convertWithLocalCounter("\\pair{a}{b}", false));
        assertEquals(expected, converter.convertWithLocalCounter("\\pair ab", false));
    }

    @Test void groupArgumentKeepsItsTokens() {
        var converter = withMacros(Map.of("sq", "#1^2"));
        assertEquals(
            "<math><msup><mrow><mi>x</mi><mo>+</mo><mn>1</mn></mrow><mn>2</mn></msup></math>",
            converter.convertWithLocalCounter("\\sq{{x+1}}", false)
        );
    }

    @Test void macrosUseEachOther() {
        var macros = new LinkedHashMap<String, String>();
        macros.put("Rn", "\\RR^n");
        macros.put("RR", "\\mathbb{R}");
        assertEquals(
            "<math><msup><mi>ℝ</mi><mi>n</mi></msup></math>",
            withMacros(macros).convertWithLocalCounter("\\Rn", false)
        );
    }

    @Test void placeholderInsideText() {
        var converter = withMacros(Map.of("e", "\\text{#1}", "note", "\\text{see #1!}"));
        assertEquals("<math><mtext>x</mtext></math>", converter.convertWithLocalCounter("\\e{x}", false));
        assertEquals(
            "<math><mtext>see a b!</mtext></math>",
            converter.convertWithLocalCounter("\\note{a b}", false)
        );
        assertEquals(1, MacroExpander.compile(Map.of("e", "\\text{#1}")).lookup("e").orElseThrow().arity());
    }

    @Test void missingArgument() {
        var converter = withMacros(Map.of("pair", "(#1, #2)"));
        var error = assertThrows(LatexError.class, () -> converter.convertWithLocalCounter("\\pair{a}", false));
        assertEquals(ErrorKind.EXPECTED_ARGUMENT_GOT_EOF, error.kind());
    }

    @Test void invalidBodyIsRejectedUpFront() {
        var error = rejected(Map.of("RR", "\\mathbb{R}\\foo"));
        assertEquals(ErrorCategory.INVALID_MACRO_DEFINITION, error.category());
        assertEquals(ErrorKind.UNKNOWN_COMMAND, error.kind());
        assertEquals(10, error.offset());
        assertEquals(Optional.of("\\mathbb{R}\\foo"), error.context());
    }

    @Test void selfReferenceHitsTheLimit() {
        var error = rejected(Map.of("loop", "\\loop"));
        assertEquals(ErrorKind.HARD_LIMIT_EXCEEDED, error.kind());
        assertEquals(ErrorCategory.INVALID_MACRO_DEFINITION, error.category());
    }

    @Test void invalidNames() {
        assertEquals(ErrorKind.INVALID_MACRO_NAME, rejected(Map.of("a1", "x")).kind());
        assertEquals(ErrorKind.INVALID_MACRO_NAME, rejected(Map.of("", "x")).kind());

        assertTrue(MacroExpander.isValidName("RR"));
        assertTrue(MacroExpander.isValidName("!"));
        assertFalse(MacroExpander.isValidName("{"));
        assertFalse(MacroExpander.isValidName(" "));
        assertFalse(MacroExpander.isValidName("ab!"));
    }

    @Test void invalidParameter() {
        var error = rejected(Map.of("bad", "#0"));
        assertEquals(ErrorKind.INVALID_PARAMETER_NUMBER, error.kind());
        assertEquals(ErrorCategory.INVALID_MACRO_DEFINITION, error.category());
    }

    @Test void arityIsHighestPlaceholder() {
        var macros = MacroExpander.compile(Map.of("third", "#3", "none", "x"));
        assertEquals(3, macros.lookup("third").orElseThrow().arity());
        assertEquals(0, macros.lookup("none").orElseThrow().arity());
        assertTrue(macros.lookup("missing").isEmpty());
    }

    @Test void expandedTokensTakeTheInvocationSpan() {
        var macros = MacroExpander.compile(Map.of("ab", "a + b"));
        var stream = TokenStream.of("x\\ab", macros);
        stream.next();
        for (int i = 0; i < 3; i++) {
            assertEquals(new Span(1, 4), stream.next().span());
        }
        assertInstanceOf(Token.EndOfInput.class, stream.next().token());
    }

    @Test void runawayExpansionStopsAtInvocation() {
        // three expansions per invocation, each definition alone is fine
        var macros = new LinkedHashMap<String, String>();
        macros.put("a", "xx");
        macros.put("b", "\\a\\a");
        var converter = withMacros(macros);
        var latex = "\\b".repeat(MacroExpander.MAX_EXPANSIONS);
        var error = assertThrows(LatexError.class, () -> converter.convertWithLocalCounter(latex, false));
        assertEquals(ErrorKind.HARD_LIMIT_EXCEEDED, error.kind());
        assertEquals(ErrorCategory.MALFORMED_STRUCTURE, error.category());
    }
}
