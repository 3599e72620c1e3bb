package org.mathcore;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

class ErrorRecoveryTest {
    private static final LatexToMathML lenient =
        new LatexToMathML(ConversionConfig.defaults().withContinueOnError(true));

    private static String convert(String latex) {
        return lenient.convertWithLocalCounter(latex, false);
    }

    @Test void unknownCommandBecomesMarker() {
        assertEquals(
            "<math><mi>a</mi><mo>+</mo>"
                + "<mtext class=\"mathcore-error\" title=\"4: Unknown command &quot;\\foo&quot;.\">\\foo</mtext>"
                + "<mo>+</mo><mi>b</mi></math>",
            convert("a + \\foo + b")
        );
    }

    @Test void unclosedGroupCoversTheGroup() {
        assertEquals(
            "<math><mtext class=\"mathcore-error\" title=\"2: Expected token &quot;}&quot;, but not found.\">{a</mtext></math>",
            convert("{a")
        );
    }

    @Test void strayCloseIsDropped() {
        assertEquals(
            "<math><mi>a</mi>"
                + "<mtext class=\"mathcore-error\" title=\"1: Unmatched closing token: &quot;}&quot;.\">}</mtext>"
                + "<mi>b</mi></math>",
            convert("a}b")
        );
    }

    @Test void parsingResumesAfterTheError() {
        var math = convert("x^^2 + 1");
        assertTrue(math.startsWith("<math><mtext class=\"mathcore-error\" title=\"2: "), math);
        assertTrue(math.contains("\">x^^</mtext>"), math);
        assertTrue(math.endsWith("<mn>2</mn><mo>+</mo><mn>1</mn></math>"), math);
    }

    @Test void errorInsideGroupStaysInside() {
        var math = convert("\\frac{\\foo}{2}");
        assertTrue(math.startsWith("<math><mfrac><mtext class=\"mathcore-error\""), math);
        assertTrue(math.endsWith("<mn>2</mn></mfrac></math>"), math);
    }

    @Test void everyErrorGetsItsOwnMarker() {
        var math = convert("\\foo x \\baz");
        assertEquals(2, math.split("class=\"mathcore-error\"", -1).length - 1, math);
        assertTrue(math.contains("title=\"0: "), math);
        assertTrue(math.contains("title=\"7: "), math);
    }

    @Test void markerAfterMacroExpansionPointsIntoSource() {
        var converter = new LatexToMathML(ConversionConfig.defaults()
            .withContinueOnError(true)
            .withMacros(Map.of("half", "\\frac{1}{2}")));
        var math = converter.convertWithLocalCounter("\\half + \\foo", false);
        assertTrue(math.startsWith("<math><mfrac><mn>1</mn><mn>2</mn></mfrac><mo>+</mo>"), math);
        assertTrue(math.contains("title=\"8: "), math);
    }

    @Test void markerInsideTableCell() {
        var math = convert("\\begin{matrix} \\foo & b \\end{matrix}");
        assertTrue(math.contains("<mtd><mtext class=\"mathcore-error\""), math);
        assertTrue(math.contains("<mtd><mi>b</mi></mtd>"), math);
    }

    @Test void badColumnSpecGetsOneMarker() {
        var math = convert("\\begin{array}{q} a \\end{array}");
        assertEquals(1, math.split("class=\"mathcore-error\"", -1).length - 1, math);
        assertTrue(math.contains(
            "title=\"13: Expected column specification, got &quot;q&quot;.\">\\begin{array}{q}</mtext>"), math);
        assertTrue(math.contains("<mtable><mtr><mtd><mi>a</mi></mtd></mtr></mtable>"), math);
    }

    @Test void unknownColorBecomesMarker() {
        assertEquals(
            "<math><mtext class=\"mathcore-error\" title=\"6: Unknown color &quot;nope&quot;.\">\\color{nope}</mtext>"
                + "<mi>x</mi></math>",
            convert("\\color{nope} x")
        );
    }

    @Test void ignoreUnknownCommandsOnly() {
        var converter = new LatexToMathML(ConversionConfig.defaults().withIgnoreUnknownCommands(true));
        var math = converter.convertWithLocalCounter("a\\foo", false);
        assertTrue(math.contains(">\\foo</mtext>"), math);

        var error = assertThrows(LatexError.class, () -> converter.convertWithLocalCounter("{a", false));
        assertEquals(ErrorKind.UNCLOSED_GROUP, error.kind());
    }

    @Test void recoveryAlwaysTerminates() {
        var inputs = List.of("}}}", "\\left(", "\\begin{matrix}", "&&\\\\", "^_'", "\\frac", "\\end{align}", "x^");
        for (var latex : inputs) {
            var math = assertDoesNotThrow(() -> convert(latex), latex);
            assertTrue(math.startsWith("<math>") && math.endsWith("</math>"), math);
        }
    }

    @Test void absorbedErrorsAreKept() {
        var reporter = ErrorReporter.forConfig(ConversionConfig.defaults().withContinueOnError(true));
        var latex = "a}\\foo";
        var parser = new Parser(TokenStream.of(latex, MacroExpander.empty()), latex, reporter, new EquationCounter());
        parser.parse();

        var kinds = reporter.absorbed().stream().map(LatexError::kind).toList();
        assertEquals(List.of(ErrorKind.UNMATCHED_CLOSE, ErrorKind.UNKNOWN_COMMAND), kinds);
    }
}
