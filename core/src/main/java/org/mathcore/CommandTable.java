package org.mathcore;

import java.util.*;

// What a command turns into
enum CommandKind {
    // leaves
    IDENTIFIER(0), UPRIGHT_IDENTIFIER(0), OPERATOR(0), FENCE(0),
    // operators whose scripts may go above and below
    BIG_OPERATOR(0), FUNCTION(0),
    // structures, with the number of mandatory arguments
    FRACTION(2), BINOMIAL(2), GENFRAC(6), SQRT(1), ACCENT(1), WIDE_ACCENT(1), UNDER_ACCENT(1),
    OVERSET(2), UNDERSET(2), NOT(1), SLASHED(1),
    FONT(1), TEXT(1), OPERATORNAME(1),
    // spacing
    SPACE(0), HSPACE(1),
    // delimiters, the one after the command not counted
    LEFT(0), MIDDLE(0), RIGHT(0), BIG(0),
    // modifiers
    LIMITS(0), NOLIMITS(0), TAG(1), NOTAG(0), STYLE(0), COLOR(1);

    final int arity;

    CommandKind(int arity) {
        this.arity = arity;
    }
}

/**
 * Descriptor of a built-in command.
 *
 * @param symbol the character(s) emitted, or the name of a variant, size or style
 * @param limits scripts go under and over rather than beside
 */
record CommandSpec(CommandKind kind, String symbol, boolean limits) {
    // Mandatory arguments; `\sqrt` also takes an optional `[index]`
    int arity() {
        return kind.arity;
    }
}

final class CommandTable {
    private static final Map<String, CommandSpec> TABLE = new HashMap<>();
    private static final Set<String> TEXT_COMMANDS = new HashSet<>();
    private static final Map<String, String> NEGATIONS = new HashMap<>();
    private static final Map<String, String> COLORS = new HashMap<>();

    private CommandTable() {}

    static Optional<CommandSpec> lookup(String name) {
        return Optional.ofNullable(TABLE.get(name));
    }

    // Commands whose braced argument is lexed as a literal text run
    static boolean isTextCommand(String name) {
        return TEXT_COMMANDS.contains(name);
    }

    static int size() {
        return TABLE.size();
    }

    // The crossed-out form of a relation, or the relation with a slash over it
    static String negate(String symbol) {
        var negated = NEGATIONS.get(symbol);
        return negated != null ? negated : symbol + "\u0338";
    }

    // Six lowercase hex digits for an xcolor base color
    static Optional<String> color(String name) {
        return Optional.ofNullable(COLORS.get(name));
    }

    private static void put(String name, CommandKind kind, String symbol) {
        put(name, kind, symbol, false);
    }

    private static void put(String name, CommandKind kind, String symbol, boolean limits) {
        var previous = TABLE.put(name, new CommandSpec(kind, symbol, limits));
        assert previous == null : "duplicate command " + name;
    }

    private static void all(CommandKind kind, String... nameSymbolPairs) {
        for (int i = 0; i < nameSymbolPairs.length; i += 2) {
            put(nameSymbolPairs[i], kind, nameSymbolPairs[i + 1]);
        }
    }

    static {
        // Greek, lowercase
        all(CommandKind.IDENTIFIER,
            "alpha", "α", "beta", "β", "gamma", "γ", "delta", "δ",
            "epsilon", "ϵ", "varepsilon", "ε", "zeta", "ζ", "eta", "η",
            "theta", "θ", "vartheta", "ϑ", "iota", "ι", "kappa", "κ",
            "lambda", "λ", "mu", "μ", "nu", "ν", "xi", "ξ",
            "pi", "π", "varpi", "ϖ", "rho", "ρ", "varrho", "ϱ",
            "sigma", "σ", "varsigma", "ς", "tau", "τ", "upsilon", "υ",
            "phi", "ϕ", "varphi", "φ", "chi", "χ", "psi", "ψ", "omega", "ω"
        );
        // Greek, uppercase, upright like in LaTeX
        all(CommandKind.UPRIGHT_IDENTIFIER,
            "Gamma", "Γ", "Delta", "Δ", "Theta", "Θ", "Lambda", "Λ",
            "Xi", "Ξ", "Pi", "Π", "Sigma", "Σ", "Upsilon", "Υ",
            "Phi", "Φ", "Psi", "Ψ", "Omega", "Ω"
        );
        // Other letter-like symbols
        all(CommandKind.IDENTIFIER,
            "infty", "∞", "partial", "∂", "nabla", "∇", "ell", "ℓ",
            "hbar", "ℏ", "aleph", "ℵ", "emptyset", "∅", "varnothing", "⌀",
            "Re", "ℜ", "Im", "ℑ", "wp", "℘", "imath", "ı", "jmath", "ȷ"
        );

        // Binary operators
        all(CommandKind.OPERATOR,
            "pm", "±", "mp", "∓", "times", "×", "div", "÷",
            "cdot", "⋅", "ast", "∗", "star", "⋆", "circ", "∘",
            "bullet", "∙", "oplus", "⊕", "ominus", "⊖", "otimes", "⊗",
            "odot", "⊙", "cap", "∩", "cup", "∪", "wedge", "∧", "land", "∧",
            "vee", "∨", "lor", "∨", "setminus", "∖", "sqcup", "⊔", "uplus", "⊎",
            "dagger", "†", "amalg", "⨿"
        );
        // Relations
        all(CommandKind.OPERATOR,
            "leq", "≤", "le", "≤", "geq", "≥", "ge", "≥", "neq", "≠", "ne", "≠",
            "approx", "≈", "equiv", "≡", "sim", "∼", "simeq", "≃", "cong", "≅",
            "propto", "∝", "ll", "≪", "gg", "≫", "prec", "≺", "succ", "≻",
            "preceq", "⪯", "succeq", "⪰", "subset", "⊂", "supset", "⊃",
            "subseteq", "⊆", "supseteq", "⊇", "in", "∈", "notin", "∉", "ni", "∋",
            "perp", "⊥", "mid", "∣", "parallel", "∥", "models", "⊨", "vdash", "⊢",
            "dashv", "⊣", "coloneqq", "≔", "doteq", "≐", "asymp", "≍"
        );
        // Arrows
        all(CommandKind.OPERATOR,
            "to", "→", "rightarrow", "→", "leftarrow", "←", "gets", "←",
            "leftrightarrow", "↔", "Rightarrow", "⇒", "Leftarrow", "⇐",
            "Leftrightarrow", "⇔", "longrightarrow", "⟶", "longleftarrow", "⟵",
            "Longrightarrow", "⟹", "Longleftarrow", "⟸", "implies", "⟹", "impliedby", "⟸",
            "iff", "⟺", "mapsto", "↦", "longmapsto", "⟼", "uparrow", "↑", "downarrow", "↓",
            "hookrightarrow", "↪", "hookleftarrow", "↩", "nearrow", "↗", "searrow", "↘"
        );
        // Dots, logic and miscellany
        all(CommandKind.OPERATOR,
            "ldots", "…", "dots", "…", "cdots", "⋯", "vdots", "⋮", "ddots", "⋱",
            "forall", "∀", "exists", "∃", "nexists", "∄", "neg", "¬", "lnot", "¬",
            "angle", "∠", "triangle", "△", "top", "⊤", "bot", "⊥", "colon", ":",
            "therefore", "∴", "because", "∵"
        );
        // Escaped characters
        all(CommandKind.OPERATOR,
            "&", "&", "%", "%", "$", "$", "#", "#", "_", "_"
        );

        // Large operators, limits above and below in display style
        for (var pair : List.of(
            List.of("sum", "∑"), List.of("prod", "∏"), List.of("coprod", "∐"),
            List.of("bigcup", "⋃"), List.of("bigcap", "⋂"), List.of("bigsqcup", "⨆"),
            List.of("bigoplus", "⨁"), List.of("bigotimes", "⨂"), List.of("bigodot", "⨀"),
            List.of("biguplus", "⨄"), List.of("bigvee", "⋁"), List.of("bigwedge", "⋀")
        )) {
            put(pair.get(0), CommandKind.BIG_OPERATOR, pair.get(1), true);
        }
        // Integrals keep their scripts beside
        all(CommandKind.BIG_OPERATOR,
            "int", "∫", "iint", "∬", "iiint", "∭", "oint", "∮"
        );

        // Named functions
        for (var name : List.of(
            "sin", "cos", "tan", "cot", "sec", "csc", "arcsin", "arccos", "arctan",
            "sinh", "cosh", "tanh", "coth", "log", "ln", "lg", "exp", "ker", "dim",
            "deg", "arg", "hom"
        )) {
            put(name, CommandKind.FUNCTION, name);
        }
        // Functions taking limits
        for (var name : List.of("lim", "max", "min", "sup", "inf", "det", "gcd", "Pr")) {
            put(name, CommandKind.FUNCTION, name, true);
        }
        put("limsup", CommandKind.FUNCTION, "lim sup", true);
        put("liminf", CommandKind.FUNCTION, "lim inf", true);
        put("argmax", CommandKind.FUNCTION, "arg max", true);
        put("argmin", CommandKind.FUNCTION, "arg min", true);
        put("bmod", CommandKind.OPERATOR, "mod");

        // Fractions, the symbol is the style
        put("frac", CommandKind.FRACTION, "");
        put("cfrac", CommandKind.FRACTION, "display");
        put("dfrac", CommandKind.FRACTION, "display");
        put("tfrac", CommandKind.FRACTION, "text");
        put("genfrac", CommandKind.GENFRAC, "");
        put("binom", CommandKind.BINOMIAL, "");
        put("dbinom", CommandKind.BINOMIAL, "display");
        put("tbinom", CommandKind.BINOMIAL, "text");
        put("sqrt", CommandKind.SQRT, "");

        // Accents, the symbol is the mark
        all(CommandKind.ACCENT,
            "hat", "^", "check", "ˇ", "tilde", "~", "acute", "´", "grave", "`",
            "dot", "˙", "ddot", "¨", "breve", "˘", "bar", "¯",
            "vec", "→", "mathring", "˚"
        );
        all(CommandKind.WIDE_ACCENT,
            "widehat", "^", "widetilde", "~", "overline", "‾",
            "overrightarrow", "→", "overleftarrow", "←"
        );
        put("overbrace", CommandKind.WIDE_ACCENT, "⏞", true);
        put("underline", CommandKind.UNDER_ACCENT, "_");
        put("underbrace", CommandKind.UNDER_ACCENT, "⏟", true);
        put("overset", CommandKind.OVERSET, "");
        put("stackrel", CommandKind.OVERSET, "");
        put("underset", CommandKind.UNDERSET, "");
        put("not", CommandKind.NOT, "");
        put("slashed", CommandKind.SLASHED, "");

        // Math alphabets
        all(CommandKind.FONT,
            "mathbb", "DOUBLE_STRUCK", "mathbf", "BOLD", "mathit", "ITALIC",
            "mathrm", "NORMAL", "mathcal", "SCRIPT", "mathscr", "SCRIPT",
            "mathfrak", "FRAKTUR", "mathsf", "SANS_SERIF", "mathtt", "MONOSPACE",
            "boldsymbol", "BOLD_ITALIC", "bm", "BOLD_ITALIC"
        );
        // Text, the symbol is the alphabet
        all(CommandKind.TEXT,
            "text", "NORMAL", "textrm", "NORMAL", "textnormal", "NORMAL",
            "textup", "NORMAL", "mbox", "NORMAL", "textit", "ITALIC",
            "textbf", "BOLD", "textsf", "SANS_SERIF", "texttt", "MONOSPACE"
        );
        for (var entry : TABLE.entrySet()) {
            if (entry.getValue().kind() == CommandKind.TEXT) {
                TEXT_COMMANDS.add(entry.getKey());
            }
        }
        put("operatorname", CommandKind.OPERATORNAME, "");

        // Spaces, the symbol is the width
        all(CommandKind.SPACE,
            ",", "0.1667em", "thinspace", "0.1667em", ":", "0.2222em", ">", "0.2222em",
            "medspace", "0.2222em", ";", "0.2778em", "thickspace", "0.2778em",
            "!", "-0.1667em", "negthinspace", "-0.1667em", " ", "0.3333em",
            "quad", "1em", "qquad", "2em"
        );
        put("hspace", CommandKind.HSPACE, "");

        // Delimiters
        all(CommandKind.FENCE,
            "{", "{", "}", "}", "lbrace", "{", "rbrace", "}", "lbrack", "[", "rbrack", "]",
            "langle", "⟨", "rangle", "⟩", "lfloor", "⌊", "rfloor", "⌋",
            "lceil", "⌈", "rceil", "⌉", "vert", "|", "lvert", "|", "rvert", "|",
            "Vert", "‖", "lVert", "‖", "rVert", "‖", "|", "‖", "backslash", "\\"
        );
        put("left", CommandKind.LEFT, "");
        put("middle", CommandKind.MIDDLE, "");
        put("right", CommandKind.RIGHT, "");
        // The symbol is the size name
        all(CommandKind.BIG,
            "big", "BIG", "bigl", "BIG", "bigr", "BIG", "bigm", "BIG",
            "Big", "BIG2", "Bigl", "BIG2", "Bigr", "BIG2", "Bigm", "BIG2",
            "bigg", "BIGG", "biggl", "BIGG", "biggr", "BIGG", "biggm", "BIGG",
            "Bigg", "BIGG2", "Biggl", "BIGG2", "Biggr", "BIGG2", "Biggm", "BIGG2"
        );

        // Modifiers
        put("limits", CommandKind.LIMITS, "");
        put("nolimits", CommandKind.NOLIMITS, "");
        put("tag", CommandKind.TAG, "");
        put("notag", CommandKind.NOTAG, "");
        put("nonumber", CommandKind.NOTAG, "");
        all(CommandKind.STYLE,
            "displaystyle", "DISPLAY", "textstyle", "TEXT", "scriptstyle", "SCRIPT",
            "scriptscriptstyle", "SCRIPT_SCRIPT"
        );
        put("color", CommandKind.COLOR, "");

        // \not in front of these gives a single character
        String[] negations = {
            "=", "≠", "<", "≮", ">", "≯", "∈", "∉", "∋", "∌", "≤", "≰", "≥", "≱",
            "≡", "≢", "∼", "≁", "≃", "≄", "≈", "≉", "≅", "≇", "⊂", "⊄", "⊃", "⊅",
            "⊆", "⊈", "⊇", "⊉", "∣", "∤", "∥", "∦", "⊢", "⊬", "⊨", "⊭", "≺", "⊀",
            "≻", "⊁", "∃", "∄", "→", "↛", "←", "↚", "↔", "↮", "⇒", "⇏", "⇐", "⇍", "⇔", "⇎"
        };
        for (int i = 0; i < negations.length; i += 2) {
            NEGATIONS.put(negations[i], negations[i + 1]);
        }

        // xcolor base colors
        String[] colors = {
            "black", "000000", "blue", "0000ff", "brown", "bf8040", "cyan", "00ffff",
            "darkgray", "404040", "gray", "808080", "green", "00ff00", "lightgray", "bfbfbf",
            "lime", "bfff00", "magenta", "ff00ff", "olive", "808000", "orange", "ff8000",
            "pink", "ffbfbf", "purple", "bf0040", "red", "ff0000", "teal", "008080",
            "violet", "800080", "white", "ffffff", "yellow", "ffff00"
        };
        for (int i = 0; i < colors.length; i += 2) {
            COLORS.put(colors[i], colors[i + 1]);
        }
    }
}
