package org.mathcore;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

class LatexErrorTest {
    private static final LatexToMathML converter = new LatexToMathML(ConversionConfig.defaults());

    private static LatexError failure(String latex) {
        return assertThrows(LatexError.class, () -> converter.convertWithLocalCounter(latex, false));
    }

    @Test void report() {
        var latex = "a + \\foo";
        var expected = """
            Error: Unknown command "\\foo".
             --> 1:5
              | a + \\foo
              |     ^^^^
            """;
        assertEquals(expected, failure(latex).report(latex));
    }

    @Test void reportOnSecondLine() {
        var latex = "a\n{b";
        var expected = """
            Error: Expected token "}", but not found.
             --> 2:3
              | {b
              |   ^
            """;
        assertEquals(expected, failure(latex).report(latex));
    }

    @Test void reportCountsGraphemes() {
        var latex = "e\u0301 + \\foo";
        var error = failure(latex);
        assertEquals(5, error.offset());
        var lines = error.report(latex).split("\n");
        assertEquals(" --> 1:5", lines[1]);
        assertEquals("  | " + " ".repeat(4) + "^^^^", lines[3]);
    }

    @Test void reportUsesMacroBody() {
        var error = assertThrows(LatexError.class,
            () -> new LatexToMathML(ConversionConfig.defaults().withMacros(Map.of("RR", "\\mathbb{R}\\foo"))));
        var lines = error.report("\\RR").split("\n");
        assertEquals("  | \\mathbb{R}\\foo", lines[2]);
        assertEquals("  | " + " ".repeat(10) + "^^^^", lines[3]);
    }

    @Test void html() {
        var latex = "a + \\foo";
        var error = failure(latex);
        assertEquals(
            "<span class=\"math-core-error\" title=\"4: Unknown command &quot;\\foo&quot;.\"><code>a + \\foo</code></span>",
            error.toHtml(latex, MathDisplay.INLINE, null)
        );
        assertEquals(
            "<p class=\"broken\" title=\"4: Unknown command &quot;\\foo&quot;.\"><code>a + \\foo</code></p>",
            error.toHtml(latex, MathDisplay.BLOCK, "broken")
        );
    }

    @Test void htmlEscapesSource() {
        var latex = "a < \\foo";
        assertTrue(failure(latex).toHtml(latex, MathDisplay.INLINE, null).contains("<code>a &lt; \\foo</code>"));
    }

    @Test void messages() {
        assertEquals("Unknown command \"\\foo\".", failure("\\foo").getMessage());
        assertEquals("Unmatched closing token: \"}\".", failure("}").getMessage());
        assertEquals(
            "Got \"&\", which may only appear between the columns of a table.",
            failure("a & b").getMessage()
        );
    }

    @Test void everyKindFormats() {
        for (var kind : ErrorKind.values()) {
            var message = LatexError.of(kind, Span.at(0), "x", "y").getMessage();
            assertFalse(message.isBlank(), kind.name());
            assertFalse(message.contains("{0}"), kind.name());
        }
    }

    @Test void locate() {
        var lineIndex = SpanUtils.lineIndex("ab\ncd\n");
        assertEquals(List.of(0, 3, 6), lineIndex);
        assertEquals(new SpanUtils.Location(1, 0), SpanUtils.locate(0, lineIndex));
        assertEquals(new SpanUtils.Location(2, 1), SpanUtils.locate(4, lineIndex));
        assertEquals(new SpanUtils.Location(3, 0), SpanUtils.locate(6, lineIndex));
    }
}
