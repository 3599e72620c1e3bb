package org.mathcore;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

class ConversionConfigTest {

    @Test void defaults() {
        var config = ConversionConfig.defaults();
        assertEquals(PrettyPrint.NEVER, config.prettyPrint());
        assertTrue(config.macros().isEmpty());
        assertFalse(config.xmlNamespace());
        assertFalse(config.continueOnError());
        assertFalse(config.ignoreUnknownCommands());
        assertFalse(config.annotation());
    }

    @Test void withersCopy() {
        var base = ConversionConfig.defaults();
        var changed = base.withPrettyPrint(PrettyPrint.AUTO).withContinueOnError(true);
        assertEquals(PrettyPrint.NEVER, base.prettyPrint());
        assertEquals(PrettyPrint.AUTO, changed.prettyPrint());
        assertTrue(changed.continueOnError());
    }

    @Test void macrosAreFrozen() {
        var macros = new HashMap<String, String>();
        macros.put("RR", "\\mathbb{R}");
        var config = ConversionConfig.defaults().withMacros(macros);
        macros.put("NN", "\\mathbb{N}");

        assertEquals(Set.of("RR"), config.macros().keySet());
        assertThrows(UnsupportedOperationException.class, () -> config.macros().put("ZZ", "\\mathbb{Z}"));
    }

    @Test void nullMacrosAreRejected() {
        var error = assertThrows(NullPointerException.class, () -> ConversionConfig.defaults().withMacros(null));
        assertEquals("macros", error.getMessage());
    }

    @Test void fromJson() {
        var config = ConversionConfig.fromJson("""
            {
              "pretty-print": "Always",
              "macros": {"RR": "\\\\mathbb{R}"},
              "xml-namespace": true,
              "continue-on-error": true,
              "ignore-unknown-commands": true,
              "annotation": true
            }
            """);
        assertEquals(PrettyPrint.ALWAYS, config.prettyPrint());
        assertEquals(Map.of("RR", "\\mathbb{R}"), config.macros());
        assertTrue(config.xmlNamespace());
        assertTrue(config.continueOnError());
        assertTrue(config.ignoreUnknownCommands());
        assertTrue(config.annotation());
    }

    @Test void fromJsonKeepsDefaults() {
        assertEquals(ConversionConfig.defaults(), ConversionConfig.fromJson("{}"));
    }

    @Test void fromJsonRejectsBadValues() {
        var inputs = List.of(
            "{\"pretty-print\": \"sometimes\"}",
            "{\"pretty-print\": 1}",
            "{\"xml-namespace\": \"yes\"}",
            "{\"macros\": [\"RR\"]}",
            "{\"macros\": {\"RR\": 1}}",
            "{\"colour\": true}",
            "[]",
            "{"
        );
        for (var json : inputs) {
            var error = assertThrows(LatexError.class, () -> ConversionConfig.fromJson(json), json);
            assertEquals(ErrorKind.INVALID_CONFIG_VALUE, error.kind(), json);
            assertEquals(ErrorCategory.INVALID_CONFIGURATION_VALUE, error.category(), json);
        }
    }

    @Test void unknownOptionIsNamed() {
        var error = assertThrows(LatexError.class, () -> ConversionConfig.fromJson("{\"colour\": true}"));
        assertEquals("Invalid value for option \"colour\": unknown option.", error.getMessage());
    }

    @Test void prettyPrintPolicy() {
        assertFalse(PrettyPrint.NEVER.appliesTo(MathDisplay.BLOCK));
        assertTrue(PrettyPrint.ALWAYS.appliesTo(MathDisplay.INLINE));
        assertTrue(PrettyPrint.AUTO.appliesTo(MathDisplay.BLOCK));
        assertFalse(PrettyPrint.AUTO.appliesTo(MathDisplay.INLINE));
        assertEquals(PrettyPrint.AUTO, PrettyPrint.parse("auto"));
    }
}
