package org.mathcore;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Serializes a parsed formula to MathML Core.
 *
 * <p>In pretty mode every element starts on a new line, indented four spaces per
 * nesting level, and structural elements close on a line of their own. Compact mode
 * inserts no whitespace at all.
 */
final class MathMLRenderer {
    private static final Logger log = LogManager.getLogger("renderer");

    static final String NAMESPACE = "http://www.w3.org/1998/Math/MathML";
    static final String ERROR_CLASS = "mathcore-error";
    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private final Arena arena;
    private final boolean pretty;

    MathMLRenderer(Arena arena, boolean pretty) {
        this.arena = arena;
        this.pretty = pretty;
    }

    /**
     * @param annotation the LaTeX source to attach in a {@code <semantics>} wrapper, if any
     */
    String render(List<Integer> roots, MathDisplay display, boolean xmlNamespace, Optional<String> annotation) {
        sb.setLength(0);
        sb.append("<math");
        if (xmlNamespace) {
            sb.append(" xmlns=\"").append(NAMESPACE).append('"');
        }
        if (display == MathDisplay.BLOCK) {
            sb.append(" display=\"block\"");
        }
        sb.append('>');
        var afterRoot = sb.length();

        if (annotation.isPresent()) {
            open(1, "semantics", "");
            open(2, "mrow", "");
            for (var root : roots) {
                render(root, 3);
            }
            close(2, "mrow");
            newline(2);
            sb.append("<annotation encoding=\"application/x-tex\">");
            Escaper.escapeContent(sb, annotation.get());
            sb.append("</annotation>");
            close(1, "semantics");
        } else {
            for (var root : roots) {
                render(root, 1);
            }
        }

        if (this.pretty && sb.length() > afterRoot) {
            sb.append('\n');
        }
        sb.append("</math>");
        log.debug("rendered {} node(s) into {} chars", this.arena.size(), sb.length());
        return sb.toString();
    }

    // --- Output helpers ---

    private void newline(int indent) {
        if (this.pretty) {
            sb.append('\n').append(INDENT.repeat(indent));
        }
    }

    private void open(int indent, String tag, String attrs) {
        newline(indent);
        sb.append('<').append(tag).append(attrs).append('>');
    }

    private void close(int indent, String tag) {
        newline(indent);
        sb.append("</").append(tag).append('>');
    }

    private void leaf(int indent, String tag, String attrs, String text) {
        newline(indent);
        sb.append('<').append(tag).append(attrs).append('>');
        Escaper.escapeContent(sb, text);
        sb.append("</").append(tag).append('>');
    }

    // An element with the given children, kept on one line when there are none
    private void element(int indent, String tag, String attrs, List<Integer> children) {
        if (children.isEmpty()) {
            newline(indent);
            sb.append('<').append(tag).append(attrs).append("></").append(tag).append('>');
            return;
        }
        open(indent, tag, attrs);
        for (var child : children) {
            render(child, indent + 1);
        }
        close(indent, tag);
    }

    // --- Dispatcher ---

    private void render(int index, int indent) {
        var node = this.arena.get(index);
        if (node instanceof Node.Leaf n) {
            leaf(indent, n.leafClass().tag, n.attr().markup, n.text());
        } else if (node instanceof Node.Fraction n) {
            var thickness = n.lineThickness().isEmpty() ? "" : " linethickness=\"" + n.lineThickness() + "\"";
            element(indent, "mfrac", thickness + n.style().markup, n.children());
        } else if (node instanceof Node.Radical n) {
            if (n.index().isPresent()) {
                element(indent, "mroot", "", List.of(n.radicand(), n.index().get()));
            } else {
                element(indent, "msqrt", "", List.of(n.radicand()));
            }
        } else if (node instanceof Node.Scripted n) {
            element(indent, scriptTag(n), "", n.children());
        } else if (node instanceof Node.Accent n) {
            render(n, indent);
        } else if (node instanceof Node.Stacked n) {
            element(indent, n.under() ? "munder" : "mover", "", n.children());
        } else if (node instanceof Node.Delimited n) {
            render(n, indent);
        } else if (node instanceof Node.SizedDelimiter n) {
            leaf(indent, "mo", sizeAttrs(n.size()), n.symbol());
        } else if (node instanceof Node.Row n) {
            element(indent, "mrow", n.style().rowMarkup, n.nodes());
        } else if (node instanceof Node.Colored n) {
            element(indent, "mrow", " style=\"color:#" + n.hex() + ";\"", n.nodes());
        } else if (node instanceof Node.Environment n) {
            render(n, indent);
        } else if (node instanceof Node.Space n) {
            newline(indent);
            sb.append("<mspace width=\"");
            Escaper.escapeAttribute(sb, n.width());
            sb.append("\"/>");
        } else if (node instanceof Node.Text n) {
            leaf(indent, "mtext", "", n.text());
        } else if (node instanceof Node.ErrorMarker n) {
            newline(indent);
            sb.append("<mtext class=\"").append(ERROR_CLASS).append("\" title=\"").append(n.offset()).append(": ");
            Escaper.escapeAttribute(sb, n.message());
            sb.append("\">");
            Escaper.escapeContent(sb, n.source());
            sb.append("</mtext>");
        }
    }

    static String scriptTag(Node.Scripted scripted) {
        var sub = scripted.sub().isPresent();
        var sup = scripted.sup().isPresent();
        if (scripted.limits()) {
            return sub && sup ? "munderover" : sub ? "munder" : "mover";
        }
        return sub && sup ? "msubsup" : sub ? "msub" : "msup";
    }

    private static String sizeAttrs(Node.DelimiterSize size) {
        if (size == Node.DelimiterSize.AUTO) {
            return "";
        }
        return " maxsize=\"" + size.em + "\" minsize=\"" + size.em + "\"";
    }

    // --- Node renderers ---

    private void render(Node.Accent accent, int indent) {
        var tag = accent.under() ? "munder" : "mover";
        open(indent, tag, accent.under() ? " accentunder=\"true\"" : " accent=\"true\"");
        render(accent.base(), indent + 1);
        leaf(indent + 1, "mo", accent.stretchy() ? "" : Node.LeafAttr.NO_STRETCH.markup, accent.mark());
        close(indent, tag);
    }

    private void render(Node.Delimited delimited, int indent) {
        open(indent, "mrow", "");
        var attrs = sizeAttrs(delimited.size());
        if (!delimited.open().isEmpty()) {
            leaf(indent + 1, "mo", attrs, delimited.open());
        }
        // a plain row between the fences adds nothing
        if (this.arena.get(delimited.content()) instanceof Node.Row row && row.style() == Node.Style.NONE) {
            for (var child : row.nodes()) {
                render(child, indent + 1);
            }
        } else {
            render(delimited.content(), indent + 1);
        }
        if (!delimited.close().isEmpty()) {
            leaf(indent + 1, "mo", attrs, delimited.close());
        }
        close(indent, "mrow");
    }

    private void render(Node.Environment environment, int indent) {
        var kind = environment.kind();
        var labelled = environment.labelled();
        var attrs = new StringBuilder();
        if (kind.display) {
            attrs.append(" displaystyle=\"true\"");
        }
        if (kind == EnvKind.SMALLMATRIX || kind == EnvKind.SUBARRAY) {
            attrs.append(" scriptlevel=\"1\"");
        }
        if (labelled) {
            attrs.append(" style=\"width: 100%\"");
        }
        open(indent, "mtable", attrs.toString());

        var rows = environment.rows();
        for (int r = 0; r < rows.size(); r++) {
            var row = rows.get(r);
            open(indent + 1, "mtr", "");
            if (labelled) {
                // balances the label cell so the equation stays centered
                element(indent + 2, "mtd", " style=\"width: 50%\"", List.of());
            }
            var cells = row.cells();
            for (int c = 0; c < cells.size(); c++) {
                var style = kind.cellStyle(r, rows.size(), c, environment.columns());
                element(indent + 2, "mtd", style.isEmpty() ? "" : " style=\"" + style + "\"", cells.get(c));
            }
            if (labelled) {
                var labelAttrs = " style=\"width: 50%;text-align: -webkit-right;text-align: -moz-right\"";
                if (row.label().isPresent()) {
                    open(indent + 2, "mtd", labelAttrs);
                    leaf(indent + 3, "mtext", "", "(" + row.label().get() + ")");
                    close(indent + 2, "mtd");
                } else {
                    element(indent + 2, "mtd", labelAttrs, List.of());
                }
            }
            close(indent + 1, "mtr");
        }
        close(indent, "mtable");
    }
}
