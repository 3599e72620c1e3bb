package org.mathcore;

import java.util.*;

// Node = Leaf | Fraction | Radical | Scripted | Accent | Stacked
//      | Delimited | SizedDelimiter | Row | Colored | Environment | Space | Text | ErrorMarker
//
// Children are arena indices, always lower than the index of their parent
public sealed interface Node {

    // Indices this node refers to
    List<Integer> children();

    enum LeafClass {
        IDENTIFIER("mi"),
        NUMBER("mn"),
        OPERATOR("mo"),
        TEXT("mtext");

        final String tag;

        LeafClass(String tag) {
            this.tag = tag;
        }
    }

    enum LeafAttr {
        NONE(""),
        UPRIGHT(" mathvariant=\"normal\""),
        NO_STRETCH(" stretchy=\"false\""),
        STRETCHY(" stretchy=\"true\""),
        MOVABLE_LIMITS(" movablelimits=\"true\""),
        NO_MOVABLE_LIMITS(" movablelimits=\"false\"");

        final String markup;

        LeafAttr(String markup) {
            this.markup = markup;
        }
    }

    enum Style {
        NONE("", ""),
        DISPLAY(" displaystyle=\"true\"", " displaystyle=\"true\" scriptlevel=\"0\""),
        TEXT(" displaystyle=\"false\"", " displaystyle=\"false\" scriptlevel=\"0\""),
        SCRIPT(" displaystyle=\"false\" scriptlevel=\"1\"", " displaystyle=\"false\" scriptlevel=\"1\""),
        SCRIPT_SCRIPT(" displaystyle=\"false\" scriptlevel=\"2\"", " displaystyle=\"false\" scriptlevel=\"2\"");

        // on a single element, and on a row that switches the whole context
        final String markup;
        final String rowMarkup;

        Style(String markup, String rowMarkup) {
            this.markup = markup;
            this.rowMarkup = rowMarkup;
        }
    }

    enum DelimiterSize {
        AUTO(""),
        BIG("1.2em"),
        BIG2("1.623em"),
        BIGG("2.047em"),
        BIGG2("2.470em");

        final String em;

        DelimiterSize(String em) {
            this.em = em;
        }
    }

    enum ColumnAlign { LEFT, CENTER, RIGHT }

    // lineBefore is only ever set on the first column
    record ColumnSpec(ColumnAlign align, boolean lineBefore, boolean lineAfter) {}

    record EnvRow(List<List<Integer>> cells, Optional<String> label) {
        public EnvRow {
            cells = List.copyOf(cells.stream().map(List::copyOf).toList());
        }
    }

    record Leaf(LeafClass leafClass, String text, LeafAttr attr) implements Node {
        static Leaf identifier(String text) {
            return new Leaf(LeafClass.IDENTIFIER, text, LeafAttr.NONE);
        }

        static Leaf number(String text) {
            return new Leaf(LeafClass.NUMBER, text, LeafAttr.NONE);
        }

        static Leaf operator(String text) {
            return new Leaf(LeafClass.OPERATOR, text, LeafAttr.NONE);
        }

        @Override
        public List<Integer> children() {
            return List.of();
        }
    }

    // An empty thickness is the default rule
    record Fraction(int numerator, int denominator, Style style, String lineThickness) implements Node {
        @Override
        public List<Integer> children() {
            return List.of(numerator, denominator);
        }
    }

    record Radical(Optional<Integer> index, int radicand) implements Node {
        @Override
        public List<Integer> children() {
            var result = new ArrayList<Integer>();
            index.ifPresent(result::add);
            result.add(radicand);
            return result;
        }
    }

    record Scripted(int base, Optional<Integer> sub, Optional<Integer> sup, boolean limits) implements Node {
        @Override
        public List<Integer> children() {
            var result = new ArrayList<Integer>();
            result.add(base);
            sub.ifPresent(result::add);
            sup.ifPresent(result::add);
            return result;
        }
    }

    // A mark above or below, like hat or underbrace
    record Accent(int base, String mark, boolean under, boolean stretchy) implements Node {
        @Override
        public List<Integer> children() {
            return List.of(base);
        }
    }

    // overset and underset
    record Stacked(int base, int script, boolean under) implements Node {
        @Override
        public List<Integer> children() {
            return List.of(base, script);
        }
    }

    // Empty delimiter strings stand for `.`
    record Delimited(String open, int content, String close, DelimiterSize size) implements Node {
        @Override
        public List<Integer> children() {
            return List.of(content);
        }
    }

    record SizedDelimiter(String symbol, DelimiterSize size) implements Node {
        @Override
        public List<Integer> children() {
            return List.of();
        }
    }

    record Row(List<Integer> nodes, Style style) implements Node {
        public Row {
            nodes = List.copyOf(nodes);
        }

        @Override
        public List<Integer> children() {
            return nodes;
        }
    }

    // Color switch, `hex` is six lowercase hex digits
    record Colored(List<Integer> nodes, String hex) implements Node {
        public Colored {
            nodes = List.copyOf(nodes);
        }

        @Override
        public List<Integer> children() {
            return nodes;
        }
    }

    // Explicit columns are only given for `array` and `subarray`
    record Environment(EnvKind kind, List<EnvRow> rows, List<ColumnSpec> columns) implements Node {
        public Environment {
            rows = List.copyOf(rows);
            columns = List.copyOf(columns);
        }

        @Override
        public List<Integer> children() {
            var result = new ArrayList<Integer>();
            for (var row : rows) {
                for (var cell : row.cells()) {
                    result.addAll(cell);
                }
            }
            return result;
        }

        boolean labelled() {
            return rows.stream().anyMatch(row -> row.label().isPresent());
        }
    }

    record Space(String width) implements Node {
        @Override
        public List<Integer> children() {
            return List.of();
        }
    }

    record Text(String text) implements Node {
        @Override
        public List<Integer> children() {
            return List.of();
        }
    }

    // The source slice that failed, kept so the output still shows it
    record ErrorMarker(String source, String message, int offset) implements Node {
        @Override
        public List<Integer> children() {
            return List.of();
        }
    }
}
