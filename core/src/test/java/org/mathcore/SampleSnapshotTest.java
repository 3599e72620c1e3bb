package org.mathcore;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import au.com.origin.snapshots.Expect;
import au.com.origin.snapshots.junit5.SnapshotExtension;

import org.junit.jupiter.api.extension.ExtendWith;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import java.util.*;
import java.util.stream.Collectors;

@ExtendWith({SnapshotExtension.class})
class SampleSnapshotTest {
    private Expect expect;

    private static List<String> samples() {
        var stream = SampleSnapshotTest.class.getResourceAsStream("/samples/formulas.tex");
        assertNotNull(stream, "samples/formulas.tex couldn't be found");
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines()
                .filter(line -> !line.isBlank() && !line.startsWith("%"))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RuntimeException("samples couldn't be read", e);
        }
    }

    @Test void prettyBlockOutput() {
        var converter = new LatexToMathML(ConversionConfig.defaults().withPrettyPrint(PrettyPrint.ALWAYS));

        var rendered = new LinkedHashMap<String, String>();
        for (var latex : samples()) {
            rendered.put(latex, converter.convertWithLocalCounter(latex, true));
        }

        expect.toMatchSnapshot(rendered);
    }

    @Test void samplesParse() {
        var converter = new LatexToMathML(ConversionConfig.defaults());
        for (var latex : samples()) {
            var math = assertDoesNotThrow(() -> converter.convertWithLocalCounter(latex, false), latex);
            assertFalse(math.contains("mathcore-error"), latex);
        }
    }

    @Test void parserOutlines() {
        var outlines = new LinkedHashMap<String, String>();
        for (var latex : samples()) {
            var parser = new Parser(
                TokenStream.of(latex, MacroExpander.empty()), latex, ErrorReporter.abort(), new EquationCounter()
            );
            var roots = parser.parse();
            outlines.put(latex, new AstPrinter(parser.arena).print(roots));
        }

        expect.toMatchSnapshot(outlines);
    }
}
