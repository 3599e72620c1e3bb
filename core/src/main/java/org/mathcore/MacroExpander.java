package org.mathcore;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * User macros, checked once when a converter is built and expanded while parsing.
 *
 * <p>A body is a token template where {@code #1}..{@code #9} mark the arguments; the
 * arity of a macro is the highest placeholder its body uses.
 */
final class MacroExpander {
    // Bounds on runaway expansion, per conversion
    static final int MAX_EXPANSIONS = 1_000;
    static final int MAX_TOKENS = 100_000;

    private static final Logger log = LogManager.getLogger("macros");

    record Macro(String name, int arity, List<Lexeme> template, String body) {}

    private final Map<String, Macro> macros;

    private MacroExpander(Map<String, Macro> macros) {
        this.macros = macros;
    }

    static MacroExpander empty() {
        return new MacroExpander(Map.of());
    }

    /**
     * Lexes and validates every definition.
     *
     * <p>Each body is parsed once with its placeholders standing in for the arguments,
     * against the full set of definitions, so macros may use each other.
     *
     * @throws LatexError in category {@link ErrorCategory#INVALID_MACRO_DEFINITION},
     *     positioned within the offending body and carrying it as context
     */
    static MacroExpander compile(Map<String, String> definitions) {
        var compiled = new LinkedHashMap<String, Macro>();
        for (var entry : definitions.entrySet()) {
            var name = entry.getKey();
            var body = entry.getValue();
            if (!isValidName(name)) {
                throw LatexError.of(ErrorKind.INVALID_MACRO_NAME, Span.at(0), name).inMacroBody(name);
            }

            List<Lexeme> template;
            try {
                template = new Lexer(body, true).lex();
            } catch (LatexError e) {
                throw e.inMacroBody(body);
            }
            // drop EndOfInput, a template is spliced into another stream
            template = List.copyOf(template.subList(0, template.size() - 1));

            var arity = template.stream()
                .map(Lexeme::token)
                .mapToInt(MacroExpander::parameterIndex)
                .max()
                .orElse(0);

            compiled.put(name, new Macro(name, arity, template, body));
            log.debug("macro \\{} with {} argument(s): {}", name, arity, template);
        }

        var expander = new MacroExpander(Collections.unmodifiableMap(compiled));
        for (var macro : compiled.values()) {
            expander.validate(macro);
        }
        return expander;
    }

    private static int parameterIndex(Token token) {
        if (token instanceof Token.Param param) {
            return param.index();
        }
        if (token instanceof Token.TextParam param) {
            return param.index();
        }
        return 0;
    }

    // Letters only, or a single character that is neither a letter nor a space
    static boolean isValidName(String name) {
        if (name.isEmpty()) {
            return false;
        }
        var first = name.codePointAt(0);
        if (name.codePointCount(0, name.length()) == 1
            && CharClass.classOfCodePoint(first) != CharClass.LETTER) {
            return !Character.isWhitespace(first) && "{}\\#%".indexOf(first) < 0;
        }
        return name.chars().allMatch(c -> CharClass.classOfCodePoint(c) == CharClass.LETTER);
    }

    private void validate(Macro macro) {
        var tokens = new ArrayList<>(macro.template());
        tokens.add(new Lexeme(Span.at(macro.body().length()), Token.END_OF_INPUT));

        var stream = new TokenStream(tokens, this);
        var parser = new Parser(stream, macro.body(), ErrorReporter.abort(), new EquationCounter());
        try {
            parser.parse();
        } catch (LatexError e) {
            log.debug("macro \\{} rejected: {}", macro.name(), e.getMessage());
            throw e.inMacroBody(macro.body());
        }
    }

    Optional<Macro> lookup(String name) {
        return Optional.ofNullable(this.macros.get(name));
    }

    int size() {
        return this.macros.size();
    }

    /**
     * Replaces the invocation starting at {@code pos} with the macro body.
     *
     * <p>Arguments are a braced group (without its braces) or a single token. Tokens
     * from the body take the span of the whole invocation; argument tokens keep theirs.
     * A placeholder inside a text run takes the argument as text, joined into the run.
     */
    void expandAt(ArrayList<Lexeme> tokens, int pos, Macro macro) {
        var invocation = tokens.get(pos);
        var cursor = pos + 1;
        var arguments = new ArrayList<List<Lexeme>>();
        for (int i = 0; i < macro.arity(); i++) {
            var start = tokens.get(cursor);
            var token = start.token();
            if (token instanceof Token.EndOfInput) {
                throw LatexError.of(ErrorKind.EXPECTED_ARGUMENT_GOT_EOF, start.span());
            }
            if (token.isCloser()) {
                throw LatexError.of(ErrorKind.EXPECTED_ARGUMENT_GOT_CLOSE, start.span());
            }
            if (token instanceof Token.GroupOpen) {
                var end = matchingClose(tokens, cursor);
                arguments.add(new ArrayList<>(tokens.subList(cursor + 1, end)));
                cursor = end + 1;
            } else {
                arguments.add(List.of(start));
                cursor += 1;
            }
        }

        var span = invocation.span().join(tokens.get(cursor - 1).span());
        var expansion = new ArrayList<Lexeme>();
        for (var lexeme : macro.template()) {
            var token = lexeme.token();
            if (token instanceof Token.Param param) {
                expansion.addAll(arguments.get(param.index() - 1));
            } else if (token instanceof Token.TextParam param) {
                appendText(expansion, span, asText(arguments.get(param.index() - 1)));
            } else if (token instanceof Token.TextRun run) {
                appendText(expansion, span, run.text());
            } else {
                expansion.add(new Lexeme(span, token));
            }
        }

        log.debug("expand \\{} at {} into {} token(s)", macro.name(), span, expansion.size());
        tokens.subList(pos, cursor).clear();
        tokens.addAll(pos, expansion);
    }

    // Adjacent pieces of a text run become one run
    private static void appendText(List<Lexeme> expansion, Span span, String text) {
        var last = expansion.isEmpty() ? null : expansion.get(expansion.size() - 1);
        if (last != null && last.token() instanceof Token.TextRun run) {
            expansion.set(expansion.size() - 1, new Lexeme(span, new Token.TextRun(run.text() + text)));
        } else {
            expansion.add(new Lexeme(span, new Token.TextRun(text)));
        }
    }

    // The source an argument was written as, a gap between tokens read as one space
    static String asText(List<Lexeme> argument) {
        var text = new StringBuilder();
        Lexeme previous = null;
        for (var lexeme : argument) {
            if (previous != null && lexeme.span().start() > previous.span().end()) {
                text.append(' ');
            }
            text.append(sourceOf(lexeme.token()));
            previous = lexeme;
        }
        return text.toString();
    }

    private static String sourceOf(Token token) {
        if (token instanceof Token.Char ch) {
            return ch.text();
        }
        if (token instanceof Token.TextRun run) {
            return run.text();
        }
        if (token instanceof Token.Command command) {
            return "\\" + command.name();
        }
        if (token instanceof Token.EnvBegin begin) {
            return "\\begin{" + begin.name() + "}";
        }
        if (token instanceof Token.EnvEnd end) {
            return "\\end{" + end.name() + "}";
        }
        if (token instanceof Token.Param param) {
            return "#" + param.index();
        }
        if (token instanceof Token.TextParam param) {
            return "#" + param.index();
        }
        if (token instanceof Token.GroupOpen) {
            return "{";
        }
        if (token instanceof Token.GroupClose) {
            return "}";
        }
        if (token instanceof Token.Superscript) {
            return "^";
        }
        if (token instanceof Token.Subscript) {
            return "_";
        }
        if (token instanceof Token.Prime) {
            return "'";
        }
        if (token instanceof Token.ColumnSeparator) {
            return "&";
        }
        if (token instanceof Token.RowSeparator) {
            return "\\\\";
        }
        if (token instanceof Token.Tilde) {
            return " ";
        }
        return "";
    }

    // Index of the `}` closing the `{` at `open`
    private static int matchingClose(List<Lexeme> tokens, int open) {
        var depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            var token = tokens.get(i).token();
            if (token instanceof Token.GroupOpen) {
                depth++;
            } else if (token instanceof Token.GroupClose) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            } else if (token instanceof Token.EndOfInput) {
                break;
            }
        }
        throw LatexError.of(ErrorKind.UNCLOSED_GROUP, tokens.get(open).span(), "}");
    }
}
