package org.mathcore;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;
import java.util.stream.Collectors;

import com.google.gson.GsonBuilder;

class LexerTest {
    private static String json(Map<String, String> tokens) {
        var gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        return gson.toJson(tokens);
    }

    private static String lexed(Lexer lexer) {
        var table = lexer.lex().stream().collect(Collectors.toMap(
            lexeme -> lexeme.span().toString(),
            lexeme -> lexeme.token().toString(),
            (a, b) -> a,
            LinkedHashMap::new
        ));
        return json(table);
    }

    @Test void simple() {
        var lexer = new Lexer("x^2 + \\alpha");

        Map<String, String> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put("[0, 1)", "Char: \"x\"");
        expectedTokens.put("[1, 2)", "Superscript");
        expectedTokens.put("[2, 3)", "Char: \"2\"");
        expectedTokens.put("[4, 5)", "Char: \"+\"");
        expectedTokens.put("[6, 12)", "Command: \"\\alpha\"");
        expectedTokens.put("[12, 12)", "EndOfInput");

        assertEquals(json(expectedTokens), lexed(lexer));
    }

    @Test void environmentTest() {
        var lexer = new Lexer("\\begin{align} a & b \\\\ c \\end{align}");

        Map<String, String> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put("[0, 13)", "EnvBegin: \"align\"");
        expectedTokens.put("[14, 15)", "Char: \"a\"");
        expectedTokens.put("[16, 17)", "ColumnSeparator");
        expectedTokens.put("[18, 20)", "RowSeparator");
        expectedTokens.put("[21, 22)", "Char: \"c\"");
        expectedTokens.put("[23, 34)", "EnvEnd: \"align\"");
        expectedTokens.put("[34, 34)", "EndOfInput");

        assertEquals(json(expectedTokens), lexed(lexer));
    }

    @Test void textRunTest() {
        var lexer = new Lexer("\\text{a\\{b}  c");

        Map<String, String> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put("[0, 5)", "Command: \"\\text\"");
        expectedTokens.put("[5, 6)", "GroupOpen");
        expectedTokens.put("[6, 10)", "TextRun: \"a{b\"");
        expectedTokens.put("[10, 11)", "GroupClose");
        expectedTokens.put("[13, 14)", "Char: \"c\"");
        expectedTokens.put("[14, 14)", "EndOfInput");

        assertEquals(json(expectedTokens), lexed(lexer));
    }

    @Test void textRunCollapsesWhitespace() {
        var tokens = new Lexer("\\text{if   x~y}").lex();
        assertEquals(new Token.TextRun("if x y"), tokens.get(2).token());
    }

    @Test void malformedBeginStaysCommand() {
        var lexer = new Lexer("\\begin x");

        Map<String, String> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put("[0, 6)", "Command: \"\\begin\"");
        expectedTokens.put("[7, 8)", "Char: \"x\"");
        expectedTokens.put("[8, 8)", "EndOfInput");

        assertEquals(json(expectedTokens), lexed(lexer));
    }

    @Test void commentRunsToEndOfLine() {
        var lexer = new Lexer("a % comment\nb");

        Map<String, String> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put("[0, 1)", "Char: \"a\"");
        expectedTokens.put("[12, 13)", "Char: \"b\"");
        expectedTokens.put("[13, 13)", "EndOfInput");

        assertEquals(json(expectedTokens), lexed(lexer));
    }

    @Test void symbolCommands() {
        var lexer = new Lexer("\\,\\\\'~");

        Map<String, String> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put("[0, 2)", "Command: \"\\,\"");
        expectedTokens.put("[2, 4)", "RowSeparator");
        expectedTokens.put("[4, 5)", "Prime");
        expectedTokens.put("[5, 6)", "Tilde");
        expectedTokens.put("[6, 6)", "EndOfInput");

        assertEquals(json(expectedTokens), lexed(lexer));
    }

    @Test void surrogatePairIsOneChar() {
        var tokens = new Lexer("\uD835\uDC65").lex();
        assertEquals(new Span(0, 2), tokens.get(0).span());
        assertEquals(new Token.Char(0x1D465), tokens.get(0).token());
    }

    @Test void loneBackslash() {
        var tokens = new Lexer("a\\").lex();
        assertEquals(new Token.Command(""), tokens.get(1).token());
        assertEquals(new Span(1, 2), tokens.get(1).span());
    }

    @Test void hashOutsideMacroIsChar() {
        var tokens = new Lexer("#1").lex();
        assertEquals(new Token.Char('#'), tokens.get(0).token());
    }

    @Test void macroBodyParams() {
        var lexer = new Lexer("#1 + #2", true);

        Map<String, String> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put("[0, 2)", "Param: #1");
        expectedTokens.put("[3, 4)", "Char: \"+\"");
        expectedTokens.put("[5, 7)", "Param: #2");
        expectedTokens.put("[7, 7)", "EndOfInput");

        assertEquals(json(expectedTokens), lexed(lexer));
    }

    @Test void macroBodyParamsInText() {
        var lexer = new Lexer("\\text{a #1 b}", true);

        Map<String, String> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put("[0, 5)", "Command: \"\\text\"");
        expectedTokens.put("[5, 6)", "GroupOpen");
        expectedTokens.put("[6, 8)", "TextRun: \"a \"");
        expectedTokens.put("[8, 10)", "TextParam: #1");
        expectedTokens.put("[10, 12)", "TextRun: \" b\"");
        expectedTokens.put("[12, 13)", "GroupClose");
        expectedTokens.put("[13, 13)", "EndOfInput");

        assertEquals(json(expectedTokens), lexed(lexer));
    }

    @Test void hashInDocumentTextStaysLiteral() {
        var tokens = new Lexer("\\text{#1}").lex();
        assertEquals(new Token.TextRun("#1"), tokens.get(2).token());
    }

    @Test void textAccentsBecomeCombiningMarks() {
        var tokens = new Lexer("\\text{\\'e\\`{a}\\~n\\\\x}").lex();
        assertEquals(new Token.TextRun("e\u0301a\u0300n\u0303 x"), tokens.get(2).token());
    }

    @Test
    void paramNumberMissingErrorTest() {
        var lexer = new Lexer("x#", true);

        LatexError exception = assertThrows(LatexError.class, () -> {
            lexer.lex();
        });

        assertEquals(ErrorKind.EXPECTED_PARAM_NUMBER_GOT_EOF, exception.kind());
        assertEquals(1, exception.offset());
    }

    @Test
    void paramNumberInvalidErrorTest() {
        var lexer = new Lexer("#0", true);

        LatexError exception = assertThrows(LatexError.class, () -> {
            lexer.lex();
        });

        assertEquals(ErrorKind.INVALID_PARAMETER_NUMBER, exception.kind());
        assertEquals(new Span(0, 2), exception.span());
        assertEquals(ErrorCategory.INVALID_MACRO_DEFINITION, exception.category());
    }
}
