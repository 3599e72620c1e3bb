package org.mathcore;

import java.util.*;

// Environments we know, and how their tables are laid out
enum EnvKind {
    ALIGN("align", Numbering.EVERY_ROW, Layout.ALTERNATING, true, "", ""),
    ALIGN_STAR("align*", Numbering.TAG_ONLY, Layout.ALTERNATING, true, "", ""),
    ALIGNED("aligned", Numbering.NONE, Layout.ALTERNATING, true, "", ""),
    EQUATION("equation", Numbering.EVERY_ROW, Layout.SINGLE, true, "", ""),
    EQUATION_STAR("equation*", Numbering.TAG_ONLY, Layout.SINGLE, true, "", ""),
    GATHER("gather", Numbering.EVERY_ROW, Layout.CENTERED, true, "", ""),
    GATHER_STAR("gather*", Numbering.TAG_ONLY, Layout.CENTERED, true, "", ""),
    GATHERED("gathered", Numbering.NONE, Layout.CENTERED, true, "", ""),
    MULTLINE("multline", Numbering.LAST_ROW, Layout.MULTLINE, true, "", ""),
    MULTLINE_STAR("multline*", Numbering.TAG_ONLY, Layout.MULTLINE, true, "", ""),
    MATRIX("matrix", Numbering.NONE, Layout.CENTERED, false, "", ""),
    PMATRIX("pmatrix", Numbering.NONE, Layout.CENTERED, false, "(", ")"),
    BMATRIX("bmatrix", Numbering.NONE, Layout.CENTERED, false, "[", "]"),
    BRACE_MATRIX("Bmatrix", Numbering.NONE, Layout.CENTERED, false, "{", "}"),
    VMATRIX("vmatrix", Numbering.NONE, Layout.CENTERED, false, "|", "|"),
    DOUBLE_VMATRIX("Vmatrix", Numbering.NONE, Layout.CENTERED, false, "‖", "‖"),
    SMALLMATRIX("smallmatrix", Numbering.NONE, Layout.CENTERED, false, "", ""),
    CASES("cases", Numbering.NONE, Layout.CASES, false, "{", ""),
    ARRAY("array", Numbering.NONE, Layout.CUSTOM, false, "", ""),
    // script-sized array, for stacked limits
    SUBARRAY("subarray", Numbering.NONE, Layout.CUSTOM, false, "", "");

    enum Numbering {
        // no labels at all
        NONE,
        // only \tag labels
        TAG_ONLY,
        // the counter labels each row
        EVERY_ROW,
        // the counter labels the last row
        LAST_ROW
    }

    enum Layout { ALTERNATING, SINGLE, CENTERED, MULTLINE, CASES, CUSTOM }

    private static final Map<String, EnvKind> BY_NAME = new HashMap<>();

    static {
        for (var kind : values()) {
            BY_NAME.put(kind.envName, kind);
        }
    }

    final String envName;
    final Numbering numbering;
    final Layout layout;
    final boolean display;
    final String open;
    final String close;

    EnvKind(String envName, Numbering numbering, Layout layout, boolean display, String open, String close) {
        this.envName = envName;
        this.numbering = numbering;
        this.layout = layout;
        this.display = display;
        this.open = open;
        this.close = close;
    }

    static Optional<EnvKind> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    boolean allowsColumns() {
        return switch (layout) {
            case SINGLE, MULTLINE -> false;
            case CENTERED -> !envName.startsWith("gather");
            default -> true;
        };
    }

    boolean allowsRows() {
        return layout != Layout.SINGLE;
    }

    boolean allowsTags() {
        return numbering != Numbering.NONE;
    }

    boolean takesColumnSpec() {
        return layout == Layout.CUSTOM;
    }

    boolean delimited() {
        return !open.isEmpty() || !close.isEmpty();
    }

    // Style attribute for a cell, empty when the default centering is right
    String cellStyle(int row, int rowCount, int column, List<Node.ColumnSpec> columns) {
        return switch (layout) {
            case ALTERNATING -> column % 2 == 0
                ? "text-align: -webkit-right;text-align: -moz-right;padding-right: 0"
                : "text-align: -webkit-left;text-align: -moz-left;padding-left: 0";
            case CASES -> column == 0
                ? "text-align: -webkit-left;text-align: -moz-left;padding-left: 0"
                : "text-align: -webkit-left;text-align: -moz-left;padding-left: 1em";
            case MULTLINE -> {
                if (rowCount < 2) {
                    yield "";
                } else if (row == 0) {
                    yield "text-align: -webkit-left;text-align: -moz-left";
                } else if (row == rowCount - 1) {
                    yield "text-align: -webkit-right;text-align: -moz-right";
                }
                yield "";
            }
            case CUSTOM -> {
                if (column >= columns.size()) {
                    yield "";
                }
                var spec = columns.get(column);
                var parts = new ArrayList<String>();
                switch (spec.align()) {
                    case LEFT -> parts.add("text-align: -webkit-left;text-align: -moz-left");
                    case RIGHT -> parts.add("text-align: -webkit-right;text-align: -moz-right");
                    case CENTER -> {
                    }
                }
                if (spec.lineBefore()) {
                    parts.add("border-left: 0.05em solid currentcolor");
                }
                if (spec.lineAfter()) {
                    parts.add("border-right: 0.05em solid currentcolor");
                }
                if (this == SUBARRAY) {
                    parts.add("padding-top: 0;padding-bottom: 0");
                }
                yield String.join(";", parts);
            }
            case SINGLE, CENTERED -> "";
        };
    }
}
