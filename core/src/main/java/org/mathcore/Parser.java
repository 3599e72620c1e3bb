package org.mathcore;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;
import java.util.function.IntSupplier;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

// What may end the sequence being parsed, besides the end of input
enum Scope { TOP, GROUP, ENVIRONMENT, LEFT_RIGHT }

// An atom and how scripts attach to it
record Atom(int node, boolean limits, boolean operator) {
    static Atom plain(int node) {
        return new Atom(node, false, false);
    }
}

// A braced argument read as raw characters
record RawArgument(String text, Span span, boolean placeholder) {}

public class Parser {
    /*
     * Globals
     */
    private static final Logger log = LogManager.getLogger("parser");

    // Returned by elements that only change the current row
    static final int NO_NODE = -1;

    private static final Pattern LENGTH =
        Pattern.compile("(-?(?:\\d+\\.?\\d*|\\.\\d+))(em|ex|pt|px|mm|cm|in|mu)");

    // What the current row of a table said about its number
    static final class RowMarks {
        final EnvKind kind;
        boolean notag = false;
        Optional<String> tag = Optional.empty();

        RowMarks(EnvKind kind) {
            this.kind = kind;
        }
    }

    // A row whose number waits until we know whether it is the last one
    record PendingRow(List<List<Integer>> cells, RowMarks marks) {}

    /*
     * Parser state
     */
    Scope scope = Scope.TOP;
    EnvKind environment = null;
    RowMarks marks = null;
    Optional<MathVariant> variant = Optional.empty();
    // set by the last `\color{...}` read
    String switchedColor = null;

    /*
     * Output
     */
    final Arena arena = new Arena();

    /*
     * Parser data
     */
    final TokenStream stream;
    final String source;
    final ErrorReporter reporter;
    final EquationCounter counter;

    Parser(TokenStream stream, String source, ErrorReporter reporter, EquationCounter counter) {
        this.stream = stream;
        this.source = source;
        this.reporter = reporter;
        this.counter = counter;
    }

    // Does the thing
    //
    // Returns the top-level nodes, in order
    public List<Integer> parse() {
        log.debug("parse math");
        var nodes = parseSequence();
        if (log.isDebugEnabled()) {
            log.debug("parsed:\n{}", new AstPrinter(this.arena).print(nodes));
        }
        log.trace("arena: {}", this.arena);
        return nodes;
    }

    /*
     * Sequences and elements
     */

    List<Integer> parseSequence() {
        var nodes = new ArrayList<Integer>();
        while (true) {
            Token token;
            try {
                token = this.stream.peek().token();
            } catch (LatexError e) {
                // a macro invocation that cannot expand
                nodes.add(recovering(() -> {
                    throw e;
                }));
                continue;
            }
            if (closes(token)) {
                return nodes;
            }

            if (token instanceof Token.Command command) {
                var spec = CommandTable.lookup(command.name());
                if (spec.isPresent() && spec.get().kind() == CommandKind.STYLE) {
                    // a style switch holds until the end of the sequence
                    log.debug("parse style {}", command.name());
                    this.stream.next();
                    var style = Node.Style.valueOf(spec.get().symbol());
                    var rest = parseSequence();
                    nodes.add(push(new Node.Row(rest, style)));
                    return nodes;
                }
                if (spec.isPresent() && spec.get().kind() == CommandKind.COLOR) {
                    var marker = recovering(this::parseColorSwitch);
                    if (marker != NO_NODE) {
                        nodes.add(marker);
                        continue;
                    }
                    // like a style, the color holds until the end of the sequence
                    var hex = this.switchedColor;
                    var rest = parseSequence();
                    nodes.add(push(new Node.Colored(rest, hex)));
                    return nodes;
                }
                if (spec.isPresent()
                    && (spec.get().kind() == CommandKind.TAG || spec.get().kind() == CommandKind.NOTAG)) {
                    var node = recovering(this::parseRowMark);
                    if (node != NO_NODE) {
                        nodes.add(node);
                    }
                    continue;
                }
            }

            nodes.add(recovering(this::parseElement));
        }
    }

    boolean closes(Token token) {
        if (token instanceof Token.EndOfInput) {
            return true;
        }
        return switch (this.scope) {
            case TOP -> false;
            case GROUP -> token instanceof Token.GroupClose;
            case LEFT_RIGHT -> token instanceof Token.Command command
                && (command.is("right") || command.is("middle"));
            case ENVIRONMENT -> token instanceof Token.EnvEnd
                || (token instanceof Token.ColumnSeparator && this.environment.allowsColumns())
                || (token instanceof Token.RowSeparator && this.environment.allowsRows());
        };
    }

    // Parses one element, standing in a marker when the reporter absorbs its error
    int recovering(IntSupplier element) {
        var start = this.stream.position();
        var outcome = this.reporter.attempt(element);
        if (outcome instanceof ErrorReporter.Outcome.Parsed parsed) {
            return parsed.node();
        }
        var error = ((ErrorReporter.Outcome.Absorbed) outcome).error();
        return recover(start, error);
    }

    // Skips the tokens covered by the error and leaves a marker for them
    //
    // Parsing resumes at the offending token when it closes an enclosing
    // construct, after it otherwise.
    int recover(int start, LatexError error) {
        this.stream.seek(start);
        var from = this.stream.rawSpan().start();
        var until = error.span().end();
        var markerEnd = until;

        while (true) {
            var token = this.stream.rawToken();
            var span = this.stream.rawSpan();
            if (token instanceof Token.EndOfInput) {
                markerEnd = Math.min(markerEnd, span.start());
                break;
            }
            if (span.end() > until) {
                break;
            }
            if (token.isCloser() && span.start() == error.span().start()) {
                markerEnd = span.start();
                break;
            }
            this.stream.seek(this.stream.position() + 1);
        }

        // always move on, a closer nobody accepts is dropped with the marker
        if (this.stream.position() == start && !(this.stream.rawToken() instanceof Token.EndOfInput)) {
            markerEnd = Math.max(markerEnd, this.stream.rawSpan().end());
            this.stream.seek(start + 1);
        }

        markerEnd = Math.max(markerEnd, from);
        log.debug("recovered {} at [{}]", error.kind(), this.stream.position());
        return push(this.reporter.marker(error, slice(from, markerEnd)));
    }

    int parseElement() {
        var token = this.stream.peek().token();
        Atom atom;
        if (token instanceof Token.Superscript
            || token instanceof Token.Subscript
            || token instanceof Token.Prime) {
            // scripts with nothing before them attach to an empty base
            atom = Atom.plain(push(new Node.Row(List.of(), Node.Style.NONE)));
        } else {
            atom = parseAtom();
        }
        return parseScripts(atom);
    }

    int parseScripts(Atom atom) {
        var base = atom.node();
        var limits = atom.limits();

        var lexeme = this.stream.peek();
        if (lexeme.token() instanceof Token.Command command
            && (command.is("limits") || command.is("nolimits"))) {
            if (!atom.operator()) {
                throw cannotBeUsedHere(lexeme, command, "after a large operator or function");
            }
            this.stream.next();
            limits = command.is("limits");
            if (limits && this.arena.get(base) instanceof Node.Leaf leaf) {
                base = push(new Node.Leaf(leaf.leafClass(), leaf.text(), Node.LeafAttr.NO_MOVABLE_LIMITS));
            }
        }

        Optional<Integer> sub = Optional.empty();
        Optional<Integer> sup = Optional.empty();
        // set while the superscript holds only primes, which `^` may extend
        var primed = false;
        while (true) {
            lexeme = this.stream.peek();
            var token = lexeme.token();
            if (token instanceof Token.Prime) {
                if (sup.isPresent()) {
                    throw LatexError.of(ErrorKind.DUPLICATE_SUB_OR_SUP, lexeme.span());
                }
                sup = Optional.of(parsePrimes());
                primed = true;
            } else if (token instanceof Token.Superscript) {
                this.stream.next();
                if (sup.isPresent() && !primed) {
                    throw LatexError.of(ErrorKind.DUPLICATE_SUB_OR_SUP, lexeme.span());
                }
                var script = parseScriptArgument();
                if (primed) {
                    script = push(new Node.Row(List.of(sup.get(), script), Node.Style.NONE));
                    primed = false;
                }
                sup = Optional.of(script);
            } else if (token instanceof Token.Subscript) {
                this.stream.next();
                if (sub.isPresent()) {
                    throw LatexError.of(ErrorKind.DUPLICATE_SUB_OR_SUP, lexeme.span());
                }
                sub = Optional.of(parseScriptArgument());
            } else {
                break;
            }
        }

        if (sub.isEmpty() && sup.isEmpty()) {
            return base;
        }
        log.debug("parse scripts, limits: {}", limits);
        return push(new Node.Scripted(base, sub, sup, limits));
    }

    int parsePrimes() {
        var count = 0;
        while (this.stream.peek().token() instanceof Token.Prime) {
            this.stream.next();
            count += 1;
        }
        var symbol = switch (count) {
            case 1 -> "′";
            case 2 -> "″";
            case 3 -> "‴";
            case 4 -> "⁗";
            default -> "′".repeat(count);
        };
        return push(Node.Leaf.operator(symbol));
    }

    int parseScriptArgument() {
        var lexeme = this.stream.peek();
        var token = lexeme.token();
        if (token instanceof Token.Superscript
            || token instanceof Token.Subscript
            || token instanceof Token.Prime) {
            throw LatexError.of(ErrorKind.BOUND_FOLLOWED_BY_BOUND, lexeme.span());
        }
        return parseArgument();
    }

    // A mandatory argument: a group, or a single token
    int parseArgument() {
        var lexeme = this.stream.peek();
        var token = lexeme.token();
        if (token instanceof Token.EndOfInput) {
            throw LatexError.of(ErrorKind.EXPECTED_ARGUMENT_GOT_EOF, lexeme.span());
        }
        if (token.isCloser()) {
            throw LatexError.of(ErrorKind.EXPECTED_ARGUMENT_GOT_CLOSE, lexeme.span());
        }
        if (token instanceof Token.GroupOpen) {
            return parseGroup();
        }
        if (token instanceof Token.Char ch) {
            // `x^23` takes only the 2
            if (CharClass.classOfCodePoint(ch.codePoint()) == CharClass.DIGIT) {
                this.stream.next();
                return push(Node.Leaf.number(transform(ch.text())));
            }
            if (CharClass.classOfCodePoint(ch.codePoint()) == CharClass.LETTER) {
                this.stream.next();
                return push(letters(ch.text()));
            }
        }
        return parseAtom().node();
    }

    int parseGroup() {
        log.debug("parse group");
        this.stream.next();

        var savedScope = this.scope;
        this.scope = Scope.GROUP;
        List<Integer> nodes;
        try {
            nodes = parseSequence();
        } finally {
            this.scope = savedScope;
        }

        var close = this.stream.peek();
        if (!(close.token() instanceof Token.GroupClose)) {
            throw LatexError.of(ErrorKind.UNCLOSED_GROUP, close.span(), "}");
        }
        this.stream.next();
        return group(nodes);
    }

    // One node stands for itself, anything else becomes a row
    int group(List<Integer> nodes) {
        if (nodes.size() == 1) {
            return nodes.get(0);
        }
        return push(new Node.Row(nodes, Node.Style.NONE));
    }

    /*
     * Atoms
     */

    Atom parseAtom() {
        var lexeme = this.stream.next();
        var token = lexeme.token();

        if (token instanceof Token.Char ch) {
            return Atom.plain(parseChar(lexeme, ch));
        }
        if (token instanceof Token.Command command) {
            return parseCommand(lexeme, command);
        }
        if (token instanceof Token.GroupOpen) {
            // There and Back Again
            this.stream.back();
            return Atom.plain(parseGroup());
        }
        if (token instanceof Token.EnvBegin begin) {
            return Atom.plain(parseEnvironment(lexeme, begin.name()));
        }
        if (token instanceof Token.Tilde) {
            return Atom.plain(push(new Node.Text(" ")));
        }
        if (token instanceof Token.TextRun run) {
            return Atom.plain(push(new Node.Text(run.text())));
        }
        if (token instanceof Token.Param) {
            // only seen while checking a macro body, stands for an argument
            return Atom.plain(push(new Node.Row(List.of(), Node.Style.NONE)));
        }
        if (token instanceof Token.GroupClose) {
            throw LatexError.of(ErrorKind.UNMATCHED_CLOSE, lexeme.span(), "}");
        }
        if (token instanceof Token.EnvEnd end) {
            throw LatexError.of(ErrorKind.UNMATCHED_CLOSE, lexeme.span(), "\\end{" + end.name() + "}");
        }
        if (token instanceof Token.ColumnSeparator) {
            throw LatexError.of(ErrorKind.CANNOT_BE_USED_HERE, lexeme.span(), "&",
                "between the columns of a table");
        }
        if (token instanceof Token.RowSeparator) {
            throw LatexError.of(ErrorKind.CANNOT_BE_USED_HERE, lexeme.span(), "\\\\",
                "between the rows of a table");
        }
        if (token instanceof Token.EndOfInput) {
            throw LatexError.of(ErrorKind.EXPECTED_ARGUMENT_GOT_EOF, lexeme.span());
        }
        // a script marker where an argument should be
        throw LatexError.of(ErrorKind.BOUND_FOLLOWED_BY_BOUND, lexeme.span());
    }

    int parseChar(Lexeme lexeme, Token.Char ch) {
        var cp = ch.codePoint();
        switch (CharClass.classOfCodePoint(cp)) {
            case DIGIT -> {
                return parseNumber(ch);
            }
            case LETTER -> {
                if (this.variant.isEmpty()) {
                    return push(Node.Leaf.identifier(ch.text()));
                }
                // inside a math alphabet, a run of letters is one identifier
                var text = new StringBuilder(ch.text());
                while (this.stream.peek().token() instanceof Token.Char next
                    && CharClass.classOfCodePoint(next.codePoint()) == CharClass.LETTER) {
                    this.stream.next();
                    text.append(next.text());
                }
                return push(letters(text.toString()));
            }
            default -> {
            }
        }

        return switch (cp) {
            case '#' -> throw LatexError.of(ErrorKind.MACRO_PARAMETER_OUTSIDE_CUSTOM_COMMAND, lexeme.span());
            case '$' -> throw LatexError.of(ErrorKind.DISALLOWED_CHAR, lexeme.span(), "$");
            case '-' -> push(Node.Leaf.operator("−"));
            case '*' -> push(Node.Leaf.operator("∗"));
            case '(', ')', '[', ']', '|' ->
                push(new Node.Leaf(Node.LeafClass.OPERATOR, ch.text(), Node.LeafAttr.NO_STRETCH));
            default -> {
                if (Character.isLetter(cp)) {
                    yield push(Node.Leaf.identifier(ch.text()));
                }
                if (Character.isDigit(cp)) {
                    yield push(Node.Leaf.number(ch.text()));
                }
                yield push(Node.Leaf.operator(ch.text()));
            }
        };
    }

    // Digits with at most one inner point, like 3.14
    int parseNumber(Token.Char first) {
        var text = new StringBuilder(first.text());
        var seenPoint = false;
        while (true) {
            var token = this.stream.peek().token();
            if (!(token instanceof Token.Char ch)) {
                break;
            }
            if (CharClass.classOfCodePoint(ch.codePoint()) == CharClass.DIGIT) {
                this.stream.next();
                text.append(ch.text());
                continue;
            }
            if (!ch.is('.') || seenPoint) {
                break;
            }
            this.stream.next();
            if (this.stream.peek().token() instanceof Token.Char after
                && CharClass.classOfCodePoint(after.codePoint()) == CharClass.DIGIT) {
                text.append('.');
                seenPoint = true;
                continue;
            }
            this.stream.back();
            break;
        }
        return push(Node.Leaf.number(transform(text.toString())));
    }

    // Letters in the current math alphabet
    Node.Leaf letters(String text) {
        if (this.variant.isEmpty()) {
            return Node.Leaf.identifier(text);
        }
        var mathVariant = this.variant.get();
        if (mathVariant == MathVariant.NORMAL && text.codePointCount(0, text.length()) == 1) {
            // a single letter is italic by default
            return new Node.Leaf(Node.LeafClass.IDENTIFIER, text, Node.LeafAttr.UPRIGHT);
        }
        return Node.Leaf.identifier(mathVariant.transform(text));
    }

    String transform(String text) {
        return this.variant.map(v -> v.transform(text)).orElse(text);
    }

    /*
     * Commands
     */

    Atom parseCommand(Lexeme lexeme, Token.Command command) {
        var name = command.name();
        if (name.equals("begin") || name.equals("end")) {
            throw LatexError.of(ErrorKind.MALFORMED_ENVIRONMENT, lexeme.span(), name);
        }

        var found = CommandTable.lookup(name);
        if (found.isEmpty()) {
            var error = LatexError.of(ErrorKind.UNKNOWN_COMMAND, lexeme.span(), name);
            return Atom.plain(push(this.reporter.absorb(error, slice(lexeme.span()))));
        }

        var spec = found.get();
        var symbol = spec.symbol();
        log.debug("parse \\{} as {}, {} argument(s)", name, spec.kind(), spec.arity());
        switch (spec.kind()) {
            case IDENTIFIER -> {
                return Atom.plain(push(Node.Leaf.identifier(symbol)));
            }
            case UPRIGHT_IDENTIFIER -> {
                return Atom.plain(push(new Node.Leaf(Node.LeafClass.IDENTIFIER, symbol, Node.LeafAttr.UPRIGHT)));
            }
            case OPERATOR -> {
                return Atom.plain(push(Node.Leaf.operator(symbol)));
            }
            case FENCE -> {
                return Atom.plain(push(new Node.Leaf(Node.LeafClass.OPERATOR, symbol, Node.LeafAttr.NO_STRETCH)));
            }
            case BIG_OPERATOR -> {
                return new Atom(push(Node.Leaf.operator(symbol)), spec.limits(), true);
            }
            case FUNCTION -> {
                return new Atom(push(functionName(symbol, spec.limits())), spec.limits(), true);
            }
            case FRACTION -> {
                var numerator = parseArgument();
                var denominator = parseArgument();
                return Atom.plain(push(new Node.Fraction(numerator, denominator, styleOf(symbol), "")));
            }
            case BINOMIAL -> {
                var top = parseArgument();
                var bottom = parseArgument();
                var fraction = push(new Node.Fraction(top, bottom, styleOf(symbol), "0"));
                return Atom.plain(push(new Node.Delimited("(", fraction, ")", Node.DelimiterSize.AUTO)));
            }
            case GENFRAC -> {
                return Atom.plain(parseGenfrac());
            }
            case SQRT -> {
                return Atom.plain(parseSqrt());
            }
            case ACCENT -> {
                var base = parseArgument();
                return Atom.plain(push(new Node.Accent(base, symbol, false, false)));
            }
            case WIDE_ACCENT, UNDER_ACCENT -> {
                var base = parseArgument();
                var under = spec.kind() == CommandKind.UNDER_ACCENT;
                return new Atom(push(new Node.Accent(base, symbol, under, true)), spec.limits(), false);
            }
            case OVERSET, UNDERSET -> {
                var script = parseArgument();
                var base = parseArgument();
                var under = spec.kind() == CommandKind.UNDERSET;
                return Atom.plain(push(new Node.Stacked(base, script, under)));
            }
            case NOT -> {
                return Atom.plain(parseNot(lexeme, command));
            }
            case SLASHED -> {
                var base = parseArgument();
                if (this.arena.get(base) instanceof Node.Leaf leaf && leaf.leafClass() != Node.LeafClass.NUMBER) {
                    return Atom.plain(push(new Node.Leaf(leaf.leafClass(), leaf.text() + "\u0338", leaf.attr())));
                }
                return Atom.plain(base);
            }
            case FONT -> {
                var saved = this.variant;
                this.variant = Optional.of(MathVariant.valueOf(symbol));
                try {
                    return Atom.plain(parseArgument());
                } finally {
                    this.variant = saved;
                }
            }
            case TEXT -> {
                return Atom.plain(parseText(name, MathVariant.valueOf(symbol)));
            }
            case OPERATORNAME -> {
                return parseOperatorName();
            }
            case SPACE -> {
                return Atom.plain(push(new Node.Space(symbol)));
            }
            case HSPACE -> {
                return Atom.plain(push(new Node.Space(parseLength(parseRawArgument("\\hspace")))));
            }
            case LEFT -> {
                return Atom.plain(parseLeftRight(lexeme));
            }
            case MIDDLE -> throw cannotBeUsedHere(lexeme, command, "between \\left and \\right");
            case RIGHT -> throw LatexError.of(ErrorKind.UNMATCHED_CLOSE, lexeme.span(), "\\right");
            case BIG -> {
                var delimiter = parseDelimiter(name);
                var size = Node.DelimiterSize.valueOf(symbol);
                return Atom.plain(push(new Node.SizedDelimiter(delimiter, size)));
            }
            case LIMITS, NOLIMITS -> throw cannotBeUsedHere(lexeme, command, "after a large operator or function");
            case TAG, NOTAG -> throw cannotBeUsedHere(lexeme, command, "in a row of a numbered environment");
            case STYLE -> {
                // in argument position there is nothing left to style
                return Atom.plain(push(new Node.Row(List.of(), Node.Style.valueOf(symbol))));
            }
            case COLOR -> {
                return Atom.plain(push(new Node.Colored(List.of(), parseColor())));
            }
        }
        throw new IllegalStateException("unhandled command kind " + spec.kind());
    }

    Node.Leaf functionName(String name, boolean limits) {
        if (limits) {
            // an operator, so scripts move beside it in inline math
            return new Node.Leaf(Node.LeafClass.OPERATOR, name, Node.LeafAttr.MOVABLE_LIMITS);
        }
        return Node.Leaf.identifier(name);
    }

    static Node.Style styleOf(String name) {
        return switch (name) {
            case "display" -> Node.Style.DISPLAY;
            case "text" -> Node.Style.TEXT;
            default -> Node.Style.NONE;
        };
    }

    int parseSqrt() {
        Optional<Integer> index = Optional.empty();
        var lexeme = this.stream.peek();
        if (lexeme.token() instanceof Token.Char ch && ch.is('[')) {
            log.debug("parse root index");
            this.stream.next();
            var nodes = new ArrayList<Integer>();
            while (true) {
                var next = this.stream.peek();
                if (next.token() instanceof Token.Char close && close.is(']')) {
                    this.stream.next();
                    break;
                }
                if (closes(next.token())) {
                    throw LatexError.of(ErrorKind.UNCLOSED_GROUP, next.span(), "]");
                }
                nodes.add(recovering(this::parseElement));
            }
            index = Optional.of(group(nodes));
        }
        var radicand = parseArgument();
        return push(new Node.Radical(index, radicand));
    }

    // \genfrac{open}{close}{thickness}{style}{numerator}{denominator}
    int parseGenfrac() {
        log.debug("parse genfrac");
        var open = parseGenfracDelimiter();
        var close = parseGenfracDelimiter();
        var thickness = parseRawArgument("\\genfrac");
        var lineThickness = thickness.text().isEmpty() ? "" : parseLength(thickness);
        var styleArgument = parseRawArgument("\\genfrac");
        var style = switch (styleArgument.placeholder() ? "" : styleArgument.text()) {
            case "" -> Node.Style.NONE;
            case "0" -> Node.Style.DISPLAY;
            case "1" -> Node.Style.TEXT;
            case "2" -> Node.Style.SCRIPT;
            case "3" -> Node.Style.SCRIPT_SCRIPT;
            default -> throw LatexError.of(ErrorKind.EXPECTED_MATH_STYLE, styleArgument.span(), styleArgument.text());
        };
        var numerator = parseArgument();
        var denominator = parseArgument();
        var fraction = push(new Node.Fraction(numerator, denominator, style, lineThickness));
        if (open.isEmpty() && close.isEmpty()) {
            return fraction;
        }
        return push(new Node.Delimited(open, fraction, close, Node.DelimiterSize.AUTO));
    }

    // A delimiter, braced or not; `{}` is none
    String parseGenfracDelimiter() {
        if (!(this.stream.peek().token() instanceof Token.GroupOpen)) {
            return parseDelimiter("genfrac");
        }
        this.stream.next();
        if (this.stream.peek().token() instanceof Token.GroupClose) {
            this.stream.next();
            return "";
        }
        var delimiter = parseDelimiter("genfrac");
        var close = this.stream.peek();
        if (!(close.token() instanceof Token.GroupClose)) {
            throw LatexError.of(ErrorKind.UNCLOSED_GROUP, close.span(), "}");
        }
        this.stream.next();
        return delimiter;
    }

    // `\not` crosses out the relation or letter after it
    int parseNot(Lexeme lexeme, Token.Command command) {
        var next = this.stream.next();
        var token = next.token();
        if (token instanceof Token.Char ch) {
            if (CharClass.classOfCodePoint(ch.codePoint()) == CharClass.LETTER) {
                return push(Node.Leaf.identifier(ch.text() + "\u0338"));
            }
            if (ch.is('=') || ch.is('<') || ch.is('>')) {
                return push(Node.Leaf.operator(CommandTable.negate(ch.text())));
            }
        }
        if (token instanceof Token.Command relation) {
            var spec = CommandTable.lookup(relation.name());
            if (spec.isPresent() && spec.get().kind() == CommandKind.OPERATOR) {
                return push(Node.Leaf.operator(CommandTable.negate(spec.get().symbol())));
            }
        }
        if (token instanceof Token.Param) {
            // only seen while checking a macro body
            return push(new Node.Row(List.of(), Node.Style.NONE));
        }
        throw cannotBeUsedHere(lexeme, command, "before a relation or a letter");
    }

    // Reads `\color{name}` ahead of the nodes it colors
    int parseColorSwitch() {
        this.stream.next();
        this.switchedColor = parseColor();
        return NO_NODE;
    }

    String parseColor() {
        var argument = parseRawArgument("\\color");
        if (argument.placeholder()) {
            return "000000";
        }
        return CommandTable.color(argument.text())
            .orElseThrow(() -> LatexError.of(ErrorKind.UNKNOWN_COLOR, argument.span(), argument.text()));
    }

    int parseText(String command, MathVariant textVariant) {
        log.debug("parse text");
        var lexeme = this.stream.next();
        var token = lexeme.token();
        String text;
        if (token instanceof Token.GroupOpen) {
            // one run, or in a macro body, pieces of it around placeholders
            var run = new StringBuilder();
            while (true) {
                var next = this.stream.next();
                var inner = next.token();
                if (inner instanceof Token.GroupClose) {
                    break;
                }
                if (inner instanceof Token.TextRun textRun) {
                    run.append(textRun.text());
                } else if (inner instanceof Token.EndOfInput) {
                    throw LatexError.of(ErrorKind.UNCLOSED_GROUP, next.span(), "}");
                } else if (!(inner instanceof Token.TextParam)) {
                    throw LatexError.of(ErrorKind.EXPECTED_TEXT, next.span(), "\\" + command);
                }
            }
            text = run.toString();
        } else if (token instanceof Token.Char ch) {
            text = ch.text();
        } else if (token instanceof Token.EndOfInput) {
            throw LatexError.of(ErrorKind.EXPECTED_ARGUMENT_GOT_EOF, lexeme.span());
        } else {
            throw LatexError.of(ErrorKind.EXPECTED_TEXT, lexeme.span(), "\\" + command);
        }
        return push(new Node.Text(textVariant.transform(text)));
    }

    Atom parseOperatorName() {
        var limits = false;
        if (this.stream.peek().token() instanceof Token.Char star && star.is('*')) {
            this.stream.next();
            limits = true;
        }
        var argument = parseRawArgument("\\operatorname");
        var name = argument.text();
        if (name.codePointCount(0, name.length()) == 1 && !limits) {
            return new Atom(push(new Node.Leaf(Node.LeafClass.IDENTIFIER, name, Node.LeafAttr.UPRIGHT)), false, true);
        }
        return new Atom(push(functionName(name, limits)), limits, true);
    }

    // A braced run of plain characters, or a single one
    RawArgument parseRawArgument(String command) {
        var lexeme = this.stream.next();
        var token = lexeme.token();
        if (token instanceof Token.EndOfInput) {
            throw LatexError.of(ErrorKind.EXPECTED_ARGUMENT_GOT_EOF, lexeme.span());
        }
        if (token instanceof Token.Char ch) {
            return new RawArgument(ch.text(), lexeme.span(), false);
        }
        if (token instanceof Token.Param param) {
            return new RawArgument("#" + param.index(), lexeme.span(), true);
        }
        if (token.isCloser()) {
            throw LatexError.of(ErrorKind.EXPECTED_ARGUMENT_GOT_CLOSE, lexeme.span());
        }
        if (!(token instanceof Token.GroupOpen)) {
            throw LatexError.of(ErrorKind.EXPECTED_TEXT, lexeme.span(), command);
        }

        var text = new StringBuilder();
        var placeholder = false;
        while (true) {
            var next = this.stream.next();
            var inner = next.token();
            if (inner instanceof Token.GroupClose) {
                return new RawArgument(text.toString(), lexeme.span().join(next.span()), placeholder);
            }
            if (inner instanceof Token.EndOfInput) {
                throw LatexError.of(ErrorKind.UNCLOSED_GROUP, next.span(), "}");
            }
            if (inner instanceof Token.Char ch) {
                text.append(ch.text());
            } else if (inner instanceof Token.Param param) {
                text.append('#').append(param.index());
                placeholder = true;
            } else if (inner instanceof Token.Tilde) {
                text.append(' ');
            } else {
                throw LatexError.of(ErrorKind.EXPECTED_TEXT, next.span(), command);
            }
        }
    }

    String parseLength(RawArgument argument) {
        if (argument.placeholder()) {
            return "0em";
        }
        var matcher = LENGTH.matcher(argument.text());
        if (!matcher.matches()) {
            throw LatexError.of(ErrorKind.EXPECTED_LENGTH, argument.span(), argument.text());
        }
        var value = matcher.group(1);
        var unit = matcher.group(2);
        if (unit.equals("mu")) {
            // 18mu to the em
            var em = new BigDecimal(value).divide(BigDecimal.valueOf(18), 4, RoundingMode.HALF_UP);
            return em.stripTrailingZeros().toPlainString() + "em";
        }
        return value + unit;
    }

    /*
     * Delimiters
     */

    int parseLeftRight(Lexeme left) {
        log.debug("parse left/right");
        var open = parseDelimiter("left");

        var savedScope = this.scope;
        this.scope = Scope.LEFT_RIGHT;
        try {
            var nodes = new ArrayList<Integer>();
            while (true) {
                nodes.addAll(parseSequence());
                var lexeme = this.stream.next();
                if (lexeme.token() instanceof Token.Command command && command.is("middle")) {
                    var middle = parseDelimiter("middle");
                    nodes.add(push(new Node.Leaf(Node.LeafClass.OPERATOR, middle, Node.LeafAttr.STRETCHY)));
                    continue;
                }
                if (lexeme.token() instanceof Token.Command command && command.is("right")) {
                    var close = parseDelimiter("right");
                    var content = push(new Node.Row(nodes, Node.Style.NONE));
                    return push(new Node.Delimited(open, content, close, Node.DelimiterSize.AUTO));
                }
                throw LatexError.of(ErrorKind.UNCLOSED_GROUP, lexeme.span(), "\\right");
            }
        } finally {
            this.scope = savedScope;
        }
    }

    // The delimiter after \left, \right, \big and friends; `.` is none
    String parseDelimiter(String command) {
        var lexeme = this.stream.next();
        var token = lexeme.token();
        if (token instanceof Token.Char ch) {
            switch (ch.codePoint()) {
                case '.' -> {
                    return "";
                }
                case '(', ')', '[', ']', '|', '/' -> {
                    return ch.text();
                }
                case '<' -> {
                    return "⟨";
                }
                case '>' -> {
                    return "⟩";
                }
                default -> {
                }
            }
        }
        if (token instanceof Token.Param) {
            // only seen while checking a macro body
            return "";
        }
        if (token instanceof Token.Command delimiter) {
            var spec = CommandTable.lookup(delimiter.name());
            if (spec.isPresent() && spec.get().kind() == CommandKind.FENCE) {
                return spec.get().symbol();
            }
            if (delimiter.is("uparrow") || delimiter.is("downarrow")) {
                return spec.get().symbol();
            }
        }
        throw LatexError.of(ErrorKind.EXPECTED_DELIMITER, lexeme.span(), "\\" + command);
    }

    /*
     * Environments
     */

    int parseEnvironment(Lexeme begin, String name) {
        log.debug("parse environment {}", name);
        var kind = EnvKind.byName(name)
            .orElseThrow(() -> LatexError.of(ErrorKind.UNKNOWN_ENVIRONMENT, begin.span(), name));
        var columns = List.<Node.ColumnSpec>of();
        var specMarker = NO_NODE;
        if (kind.takesColumnSpec()) {
            try {
                columns = parseColumnSpec(name);
            } catch (LatexError e) {
                if (e.kind() != ErrorKind.EXPECTED_COL_SPEC) {
                    throw e;
                }
                // the body is still read, with centered columns
                specMarker = push(this.reporter.absorb(e, slice(begin.span().join(e.span()))));
            }
        }

        var savedScope = this.scope;
        var savedEnvironment = this.environment;
        var savedMarks = this.marks;
        this.scope = Scope.ENVIRONMENT;
        this.environment = kind;
        var rows = new ArrayList<Node.EnvRow>();
        try {
            var cells = new ArrayList<List<Integer>>();
            this.marks = new RowMarks(kind);
            PendingRow pending = null;
            while (true) {
                cells.add(parseSequence());
                var lexeme = this.stream.next();
                var token = lexeme.token();
                if (token instanceof Token.ColumnSeparator) {
                    continue;
                }
                if (token instanceof Token.RowSeparator) {
                    if (pending != null) {
                        rows.add(finishRow(pending, false));
                    }
                    pending = new PendingRow(cells, this.marks);
                    cells = new ArrayList<>();
                    this.marks = new RowMarks(kind);
                    continue;
                }
                if (token instanceof Token.EnvEnd end) {
                    if (!end.name().equals(name)) {
                        throw LatexError.of(ErrorKind.MISMATCHED_ENVIRONMENT, lexeme.span(), name, end.name());
                    }
                    // a trailing `\\` does not open another row, the one before it is the last
                    var trailing = pending != null
                        && cells.size() == 1 && cells.get(0).isEmpty() && this.marks.tag.isEmpty();
                    if (pending != null) {
                        rows.add(finishRow(pending, trailing));
                    }
                    if (!trailing) {
                        rows.add(finishRow(new PendingRow(cells, this.marks), true));
                    }
                    break;
                }
                throw LatexError.of(ErrorKind.UNCLOSED_GROUP, lexeme.span(), "\\end{" + name + "}");
            }
        } finally {
            this.scope = savedScope;
            this.environment = savedEnvironment;
            this.marks = savedMarks;
        }

        var table = push(new Node.Environment(kind, rows, columns));
        if (kind.delimited()) {
            table = push(new Node.Delimited(kind.open, table, kind.close, Node.DelimiterSize.AUTO));
        }
        if (specMarker != NO_NODE) {
            return push(new Node.Row(List.of(specMarker, table), Node.Style.NONE));
        }
        return table;
    }

    Node.EnvRow finishRow(PendingRow row, boolean last) {
        var rowMarks = row.marks();
        Optional<String> label = Optional.empty();
        if (rowMarks.tag.isPresent()) {
            label = rowMarks.tag;
        } else if (!rowMarks.notag) {
            var numbered = switch (rowMarks.kind.numbering) {
                case EVERY_ROW -> true;
                case LAST_ROW -> last;
                case NONE, TAG_ONLY -> false;
            };
            if (numbered) {
                label = Optional.of(String.valueOf(this.counter.advance()));
            }
        }
        return new Node.EnvRow(row.cells(), label);
    }

    int parseRowMark() {
        var lexeme = this.stream.next();
        var command = (Token.Command) lexeme.token();
        if (this.marks == null || !this.marks.kind.allowsTags()) {
            throw cannotBeUsedHere(lexeme, command, "in a row of a numbered environment");
        }
        if (command.is("tag")) {
            if (this.marks.tag.isPresent()) {
                throw cannotBeUsedHere(lexeme, command, "once per row");
            }
            this.marks.tag = Optional.of(parseRawArgument("\\tag").text());
        } else {
            this.marks.notag = true;
        }
        return NO_NODE;
    }

    // `l`, `c`, `r`, with `|` for rules between columns
    List<Node.ColumnSpec> parseColumnSpec(String environment) {
        var argument = parseRawArgument("\\begin{" + environment + "}");
        if (argument.placeholder()) {
            return List.of();
        }
        var columns = new ArrayList<Node.ColumnSpec>();
        var ruleBefore = false;
        for (var c : argument.text().toCharArray()) {
            switch (c) {
                case 'l', 'c', 'r' -> {
                    var align = c == 'l' ? Node.ColumnAlign.LEFT
                        : c == 'r' ? Node.ColumnAlign.RIGHT : Node.ColumnAlign.CENTER;
                    columns.add(new Node.ColumnSpec(align, ruleBefore && columns.isEmpty(), false));
                    ruleBefore = false;
                }
                case '|' -> {
                    if (columns.isEmpty()) {
                        ruleBefore = true;
                    } else {
                        var lastIndex = columns.size() - 1;
                        var previous = columns.get(lastIndex);
                        columns.set(lastIndex, new Node.ColumnSpec(previous.align(), previous.lineBefore(), true));
                    }
                }
                default -> throw LatexError.of(ErrorKind.EXPECTED_COL_SPEC, argument.span(), argument.text());
            }
        }
        if (columns.isEmpty()) {
            throw LatexError.of(ErrorKind.EXPECTED_COL_SPEC, argument.span(), argument.text());
        }
        return columns;
    }

    /*
     * Helpers
     */

    int push(Node node) {
        return this.arena.push(node);
    }

    String slice(Span span) {
        return slice(span.start(), span.end());
    }

    String slice(int start, int end) {
        var from = Math.min(start, this.source.length());
        var to = Math.min(Math.max(end, from), this.source.length());
        return this.source.substring(from, to);
    }

    LatexError cannotBeUsedHere(Lexeme lexeme, Token.Command command, String where) {
        return LatexError.of(ErrorKind.CANNOT_BE_USED_HERE, lexeme.span(), "\\" + command.name(), where);
    }
}
