package org.mathcore;

import java.util.*;

/**
 * Prints the structure of a parsed formula as an indented outline.
 * Used by tests and by the parser's debug output.
 */
final class AstPrinter {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;
    private static final String INDENT_CHAR = "  "; // 2 spaces per indent level

    private final Arena arena;

    AstPrinter(Arena arena) {
        this.arena = arena;
    }

    String print(List<Integer> roots) {
        sb.setLength(0);
        indentLevel = 0;

        printNode("Math");
        increaseIndent();
        for (var root : roots) {
            print(root);
        }
        decreaseIndent();
        return sb.toString();
    }

    // --- Indentation & Node Helpers ---

    private void increaseIndent() { indentLevel++; }
    private void decreaseIndent() { indentLevel--; }

    private void printLine(String line) {
        sb.append(INDENT_CHAR.repeat(indentLevel)).append(line).append("\n");
    }

    private void printNode(String nodeName, String... fields) {
        var fieldsStr = new StringBuilder();
        if (fields.length > 0) {
            fieldsStr.append(" (");
            fieldsStr.append(String.join(", ", fields));
            fieldsStr.append(")");
        }
        printLine(nodeName + fieldsStr);
    }

    private void printChildren(List<Integer> children) {
        increaseIndent();
        for (var child : children) {
            print(child);
        }
        decreaseIndent();
    }

    // A child under a heading, for the optional ones
    private void printLabeled(String label, int child) {
        increaseIndent();
        printNode(label);
        increaseIndent();
        print(child);
        decreaseIndent();
        decreaseIndent();
    }

    private static String quote(String text) {
        return '"' + text + '"';
    }

    // --- Dispatcher ---

    private void print(int index) {
        var node = arena.get(index);
        if (node instanceof Node.Leaf n) {
            print(n);
        } else if (node instanceof Node.Fraction n) {
            print(n);
        } else if (node instanceof Node.Radical n) {
            print(n);
        } else if (node instanceof Node.Scripted n) {
            print(n);
        } else if (node instanceof Node.Accent n) {
            printNode("Accent", "mark=" + quote(n.mark()), "under=" + n.under(), "stretchy=" + n.stretchy());
            printChildren(n.children());
        } else if (node instanceof Node.Stacked n) {
            printNode("Stacked", "under=" + n.under());
            printChildren(n.children());
        } else if (node instanceof Node.Delimited n) {
            printNode("Delimited", "open=" + quote(n.open()), "close=" + quote(n.close()), "size=" + n.size());
            printChildren(n.children());
        } else if (node instanceof Node.SizedDelimiter n) {
            printNode("SizedDelimiter", "symbol=" + quote(n.symbol()), "size=" + n.size());
        } else if (node instanceof Node.Row n) {
            if (n.style() == Node.Style.NONE) {
                printNode("Row");
            } else {
                printNode("Row", "style=" + n.style());
            }
            printChildren(n.nodes());
        } else if (node instanceof Node.Colored n) {
            printNode("Colored", "#" + n.hex());
            printChildren(n.nodes());
        } else if (node instanceof Node.Environment n) {
            print(n);
        } else if (node instanceof Node.Space n) {
            printNode("Space", "width=" + n.width());
        } else if (node instanceof Node.Text n) {
            printNode("Text", quote(n.text()));
        } else if (node instanceof Node.ErrorMarker n) {
            printNode("ErrorMarker", quote(n.source()), "offset=" + n.offset());
        }
    }

    // --- Node Printers ---

    private void print(Node.Leaf leaf) {
        if (leaf.attr() == Node.LeafAttr.NONE) {
            printNode("Leaf", leaf.leafClass().tag, quote(leaf.text()));
        } else {
            printNode("Leaf", leaf.leafClass().tag, quote(leaf.text()), "attr=" + leaf.attr());
        }
    }

    private void print(Node.Fraction fraction) {
        var fields = new ArrayList<String>();
        if (fraction.style() != Node.Style.NONE) {
            fields.add("style=" + fraction.style());
        }
        if (!fraction.lineThickness().isEmpty()) {
            fields.add("lineThickness=" + fraction.lineThickness());
        }
        printNode("Fraction", fields.toArray(new String[0]));
        printChildren(fraction.children());
    }

    private void print(Node.Radical radical) {
        printNode("Radical");
        radical.index().ifPresent(index -> printLabeled("index", index));
        printChildren(List.of(radical.radicand()));
    }

    private void print(Node.Scripted scripted) {
        if (scripted.limits()) {
            printNode("Scripted", "limits");
        } else {
            printNode("Scripted");
        }
        printChildren(List.of(scripted.base()));
        scripted.sub().ifPresent(sub -> printLabeled("sub", sub));
        scripted.sup().ifPresent(sup -> printLabeled("sup", sup));
    }

    private void print(Node.Environment environment) {
        printNode("Environment", environment.kind().envName);
        increaseIndent();
        if (!environment.columns().isEmpty()) {
            var columns = new StringBuilder();
            for (var column : environment.columns()) {
                if (column.lineBefore()) {
                    columns.append('|');
                }
                columns.append(Character.toLowerCase(column.align().name().charAt(0)));
                if (column.lineAfter()) {
                    columns.append('|');
                }
            }
            printNode("Columns", quote(columns.toString()));
        }
        for (var row : environment.rows()) {
            if (row.label().isPresent()) {
                printNode("EnvRow", "label=" + quote(row.label().get()));
            } else {
                printNode("EnvRow");
            }
            increaseIndent();
            for (var cell : row.cells()) {
                printNode("Cell");
                printChildren(cell);
            }
            decreaseIndent();
        }
        decreaseIndent();
    }
}
