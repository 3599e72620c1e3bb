package org.mathcore;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

// The parser's view of the tokens, with user macros expanded as they come up
final class TokenStream {
    private static final Logger log = LogManager.getLogger("parser");

    /*
     * Stream state
     */
    int numToken = 0;
    int expansions = 0;

    /*
     * Stream data
     */
    private final ArrayList<Lexeme> _tokenList;
    private final MacroExpander macros;

    // The list must end with EndOfInput
    TokenStream(ArrayList<Lexeme> tokens, MacroExpander macros) {
        this._tokenList = tokens;
        this.macros = macros;
    }

    static TokenStream of(String source, MacroExpander macros) {
        return new TokenStream(new ArrayList<>(new Lexer(source).lex()), macros);
    }

    // The current token, after expanding any macro invocations standing there
    Lexeme peek() {
        while (true) {
            var lexeme = this._tokenList.get(this.numToken);
            if (!(lexeme.token() instanceof Token.Command command)) {
                return lexeme;
            }
            var macro = this.macros.lookup(command.name());
            if (macro.isEmpty()) {
                return lexeme;
            }

            this.expansions += 1;
            if (this.expansions > MacroExpander.MAX_EXPANSIONS) {
                throw LatexError.of(ErrorKind.HARD_LIMIT_EXCEEDED, lexeme.span());
            }
            this.macros.expandAt(this._tokenList, this.numToken, macro.get());
            if (this._tokenList.size() > MacroExpander.MAX_TOKENS) {
                throw LatexError.of(ErrorKind.HARD_LIMIT_EXCEEDED, lexeme.span());
            }
        }
    }

    // EndOfInput is never consumed, so reading past the end keeps returning it
    Lexeme next() {
        var lexeme = peek();
        if (!(lexeme.token() instanceof Token.EndOfInput)) {
            this.numToken += 1;
        }
        log.debug("[{}] {}", this.numToken, lexeme);
        return lexeme;
    }

    void back() {
        log.debug("[back again]");
        this.numToken -= 1;
    }

    int position() {
        return this.numToken;
    }

    void seek(int position) {
        this.numToken = position;
    }

    // Where the next token starts, without expanding it
    Span rawSpan() {
        return this._tokenList.get(this.numToken).span();
    }

    Token rawToken() {
        return this._tokenList.get(this.numToken).token();
    }
}
