package org.mathcore;

import java.util.Optional;

/**
 * A conversion failure tied to a position in the original input.
 *
 * <p>The span is measured in UTF-16 code units of the source {@link String}, the same
 * unit {@link String#charAt(int)} uses. Errors raised while validating a macro body carry
 * offsets into that body and the body itself as {@link #context()}.
 */
public class LatexError extends RuntimeException {
    private final ErrorKind kind;
    private final ErrorCategory category;
    private final Span span;
    private final Optional<String> context;

    LatexError(ErrorKind kind, ErrorCategory category, Span span, String message, Optional<String> context) {
        super(message);
        this.kind = kind;
        this.category = category;
        this.span = span;
        this.context = context;
    }

    static LatexError of(ErrorKind kind, Span span, Object... args) {
        return new LatexError(kind, kind.category, span, kind.format(args), Optional.empty());
    }

    // The same failure, found while validating a macro body
    LatexError inMacroBody(String body) {
        return new LatexError(
            this.kind, ErrorCategory.INVALID_MACRO_DEFINITION, this.span, getMessage(), Optional.of(body)
        );
    }

    public ErrorKind kind() {
        return kind;
    }

    public ErrorCategory category() {
        return category;
    }

    public Span span() {
        return span;
    }

    public int offset() {
        return span.start();
    }

    public Optional<String> context() {
        return context;
    }

    /**
     * Renders a caret diagnostic pointing at the error.
     *
     * @param source the string the offsets refer to; ignored when the error has a context
     */
    public String report(String source) {
        var text = context.orElse(source);
        var lineIndex = SpanUtils.lineIndex(text);
        var location = SpanUtils.locate(Math.min(offset(), text.length()), lineIndex);

        var lineStart = lineIndex.get(location.line() - 1);
        var lineEnd = text.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = text.length();
        }
        var line = text.substring(lineStart, lineEnd);

        var caretStart = Math.min(offset(), lineEnd);
        var caretEnd = Math.max(caretStart, Math.min(span.end(), lineEnd));
        var pad = SpanUtils.graphemeWidth(text, lineStart, caretStart);
        var width = Math.max(1, SpanUtils.graphemeWidth(text, caretStart, caretEnd));

        var sb = new StringBuilder();
        sb.append("Error: ").append(getMessage()).append('\n');
        // columns count graphemes, like the caret below
        sb.append(" --> ").append(location.line()).append(':').append(pad + 1).append('\n');
        sb.append("  | ").append(line).append('\n');
        sb.append("  | ").append(" ".repeat(pad)).append("^".repeat(width)).append('\n');
        return sb.toString();
    }

    /**
     * Formats a failed equation as an HTML fragment showing the raw source.
     *
     * @param cssClass class attribute of the wrapper, {@code math-core-error} when null
     */
    public String toHtml(String latex, MathDisplay display, String cssClass) {
        var tag = display == MathDisplay.BLOCK ? "p" : "span";
        var sb = new StringBuilder();
        sb.append('<').append(tag).append(" class=\"")
            .append(cssClass != null ? cssClass : "math-core-error")
            .append("\" title=\"").append(offset()).append(": ");
        Escaper.escapeAttribute(sb, getMessage());
        sb.append("\"><code>");
        Escaper.escapeContent(sb, latex);
        sb.append("</code></").append(tag).append('>');
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("LatexError[%s at %s%s]: %s",
            kind, span, context.map(c -> " in \"" + c + "\"").orElse(""), getMessage());
    }
}
