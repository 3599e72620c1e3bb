package org.mathcore;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

enum CharClass {
    // basic
    LETTER, DIGIT,
    // commands and macro parameters
    BACKSLASH, HASH,
    // grouping
    LBRACE, RBRACE,
    // scripts
    CARET, UNDERSCORE, PRIME,
    // alignment
    AMPERSAND,
    // whitespaces
    NL, WS,
    // special
    PERCENT, TILDE,
    // everything else is a symbol of its own
    OTHER;

    static CharClass classOfCodePoint(int cp) {
        // LaTeX command names are made of ASCII letters only
        if ((cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z')) return LETTER;
        if (cp >= '0' && cp <= '9') return DIGIT;

        return switch (cp) {
            case '\\' -> BACKSLASH;
            case '#' -> HASH;
            case '{' -> LBRACE;
            case '}' -> RBRACE;
            case '^' -> CARET;
            case '_' -> UNDERSCORE;
            case '\'' -> PRIME;
            case '&' -> AMPERSAND;
            case '\n', '\r' -> NL;
            case '%' -> PERCENT;
            case '~' -> TILDE;
            default -> Character.isWhitespace(cp) ? WS : OTHER;
        };
    }
}

// A token along with where it came from
record Lexeme(Span span, Token token) {
    @Override
    public String toString() {
        return String.format("%s at %s", token, span);
    }
}

public class Lexer {
    /*
     * Globals
     */
    private static final Logger log = LogManager.getLogger("lexer");

    // Accents in text runs, as combining marks
    static final Map<Integer, Character> TEXT_ACCENTS = Map.of(
        (int) '\'', '\u0301',
        (int) '`', '\u0300',
        (int) '^', '\u0302',
        (int) '"', '\u0308',
        (int) '~', '\u0303',
        (int) '=', '\u0304',
        (int) '.', '\u0307'
    );

    /*
     * Lexer state
     */
    int numChar = 0;
    int lexemeStartChar = 0;

    /*
     * Output
     */
    public ArrayList<Lexeme> tokens = new ArrayList<>();

    /*
     * Lexer data
     */
    // Preferably access this thing via nextChar() only, or things may break
    final String _sourceCode;
    // Set when lexing a macro body, enables `#1`..`#9`
    final boolean macroBody;

    public Lexer(String sourceCode) {
        this(sourceCode, false);
    }

    Lexer(String sourceCode, boolean macroBody) {
        this._sourceCode = sourceCode;
        this.macroBody = macroBody;
    }

    // Get the next code point and move past it
    //
    // Returns -1 if the source code ends
    int nextChar() {
        if (this.numChar >= this._sourceCode.length()) {
            return -1;
        }
        var cp = this._sourceCode.codePointAt(this.numChar);
        this.numChar += Character.charCount(cp);
        return cp;
    }

    // Look at the next code point without moving
    int peekChar() {
        if (this.numChar >= this._sourceCode.length()) {
            return -1;
        }
        return this._sourceCode.codePointAt(this.numChar);
    }

    void rewind(int toChar) {
        this.numChar = toChar;
    }

    void skipWhitespace() {
        while (true) {
            var cp = peekChar();
            if (cp == -1) return;
            var cls = CharClass.classOfCodePoint(cp);
            if (cls != CharClass.WS && cls != CharClass.NL) return;
            nextChar();
        }
    }

    void emit(Token token) {
        var span = new Span(this.lexemeStartChar, this.numChar);
        var lexeme = new Lexeme(span, token);
        log.debug(lexeme);
        this.tokens.add(lexeme);
    }

    // Does the thing
    //
    // Populates `tokens`, always ending with EndOfInput. Never fails on
    // document input; in a macro body a malformed `#` is reported.
    public List<Lexeme> lex() {
        while (true) {
            this.lexemeStartChar = this.numChar;
            var cp = nextChar();
            if (cp == -1) {
                emit(Token.END_OF_INPUT);
                log.debug("the end");
                return this.tokens;
            }

            switch (CharClass.classOfCodePoint(cp)) {
                case WS, NL -> {
                    // insignificant in math mode
                }
                case PERCENT -> {
                    // comment until the end of line
                    while (peekChar() != -1 && peekChar() != '\n') {
                        nextChar();
                    }
                }
                case BACKSLASH -> lexCommand();
                case HASH -> lexHash();
                case LBRACE -> emit(Token.GROUP_OPEN);
                case RBRACE -> emit(Token.GROUP_CLOSE);
                case CARET -> emit(Token.SUPERSCRIPT);
                case UNDERSCORE -> emit(Token.SUBSCRIPT);
                case PRIME -> emit(Token.PRIME);
                case AMPERSAND -> emit(Token.COLUMN_SEPARATOR);
                case TILDE -> emit(Token.TILDE);
                case LETTER, DIGIT, OTHER -> emit(new Token.Char(cp));
            }
        }
    }

    void lexCommand() {
        var cp = peekChar();
        if (cp == -1) {
            // a lone backslash at the very end
            emit(new Token.Command(""));
            return;
        }

        if (CharClass.classOfCodePoint(cp) != CharClass.LETTER) {
            nextChar();
            if (cp == '\\') {
                emit(Token.ROW_SEPARATOR);
            } else {
                emit(new Token.Command(new String(Character.toChars(cp))));
            }
            return;
        }

        var name = new StringBuilder();
        while (peekChar() != -1 && CharClass.classOfCodePoint(peekChar()) == CharClass.LETTER) {
            name.appendCodePoint(nextChar());
        }

        var command = name.toString();
        switch (command) {
            case "begin", "end" -> lexEnvironment(command);
            default -> {
                emit(new Token.Command(command));
                if (CommandTable.isTextCommand(command)) {
                    lexTextArgument();
                }
            }
        }
    }

    // `\begin{name}` or `\end{name}`, name made of letters and `*`
    //
    // Anything else stays a plain command for the parser to reject
    void lexEnvironment(String command) {
        var afterCommand = this.numChar;

        skipWhitespace();
        if (peekChar() == '{') {
            nextChar();
            var name = new StringBuilder();
            while (peekChar() != -1
                && (CharClass.classOfCodePoint(peekChar()) == CharClass.LETTER || peekChar() == '*')) {
                name.appendCodePoint(nextChar());
            }
            if (peekChar() == '}' && name.length() > 0) {
                nextChar();
                if (command.equals("begin")) {
                    emit(new Token.EnvBegin(name.toString()));
                } else {
                    emit(new Token.EnvEnd(name.toString()));
                }
                return;
            }
        }

        // There and Back Again
        rewind(afterCommand);
        emit(new Token.Command(command));
    }

    // The braced argument of `\text` and friends is a literal run
    void lexTextArgument() {
        var afterCommand = this.numChar;
        skipWhitespace();
        if (peekChar() != '{') {
            // `\text x` takes a single math token, leave it alone
            rewind(afterCommand);
            return;
        }

        this.lexemeStartChar = this.numChar;
        nextChar();
        emit(Token.GROUP_OPEN);

        this.lexemeStartChar = this.numChar;
        var text = new StringBuilder();
        int depth = 0;
        while (true) {
            var cp = peekChar();
            if (cp == -1) {
                // unclosed, the parser will complain about the missing `}`
                emit(new Token.TextRun(text.toString()));
                return;
            }
            if (cp == '}' && depth == 0) {
                emit(new Token.TextRun(text.toString()));
                this.lexemeStartChar = this.numChar;
                nextChar();
                emit(Token.GROUP_CLOSE);
                return;
            }
            if (cp == '#' && this.macroBody) {
                // the run so far, then the placeholder
                if (text.length() > 0) {
                    emit(new Token.TextRun(text.toString()));
                    text.setLength(0);
                }
                this.lexemeStartChar = this.numChar;
                nextChar();
                emit(new Token.TextParam(parameterNumber()));
                this.lexemeStartChar = this.numChar;
                continue;
            }

            nextChar();
            switch (cp) {
                case '{' -> depth++;
                case '}' -> depth--;
                case '~' -> text.append(' ');
                case '\\' -> {
                    var escaped = peekChar();
                    if (escaped != -1 && "{}$%&_#".indexOf(escaped) >= 0) {
                        text.appendCodePoint(nextChar());
                    } else if (escaped == '\\' || escaped == ' ') {
                        nextChar();
                        text.append(' ');
                    } else if (TEXT_ACCENTS.containsKey(escaped)) {
                        nextChar();
                        lexTextAccent(text, TEXT_ACCENTS.get(escaped));
                    } else {
                        text.append('\\');
                    }
                }
                default -> {
                    if (Character.isWhitespace(cp)) {
                        // runs of whitespace collapse into one space
                        if (text.length() == 0 || text.charAt(text.length() - 1) != ' ') {
                            text.append(' ');
                        }
                    } else {
                        text.appendCodePoint(cp);
                    }
                }
            }
        }
    }

    // `\'e` or `\'{e}`: the letter, then the combining mark
    void lexTextAccent(StringBuilder text, char mark) {
        var braced = peekChar() == '{';
        if (braced) {
            nextChar();
        }
        var base = peekChar();
        if (base != -1 && !(braced && base == '}')) {
            text.appendCodePoint(nextChar());
            text.append(mark);
        }
        if (braced && peekChar() == '}') {
            nextChar();
        }
    }

    void lexHash() {
        if (!this.macroBody) {
            // an ordinary character here, rejected by the parser
            emit(new Token.Char('#'));
            return;
        }
        emit(new Token.Param(parameterNumber()));
    }

    // The digit after a `#` in a macro body
    int parameterNumber() {
        var cp = peekChar();
        if (cp == -1) {
            throw LatexError.of(
                ErrorKind.EXPECTED_PARAM_NUMBER_GOT_EOF,
                new Span(this.lexemeStartChar, this.numChar)
            );
        }
        nextChar();
        if (cp < '1' || cp > '9') {
            throw LatexError.of(
                ErrorKind.INVALID_PARAMETER_NUMBER,
                new Span(this.lexemeStartChar, this.numChar)
            );
        }
        return cp - '0';
    }
}
