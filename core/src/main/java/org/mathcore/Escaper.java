package org.mathcore;

// Escaping for text that ends up inside markup
final class Escaper {
    private Escaper() {}

    // `&`, `<` and `>` in element content
    static void escapeContent(StringBuilder out, String input) {
        for (int i = 0; i < input.length(); i++) {
            var ch = input.charAt(i);
            switch (ch) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                default -> out.append(ch);
            }
        }
    }

    // `&`, `<` and `"` in a double-quoted attribute value
    static void escapeAttribute(StringBuilder out, String input) {
        for (int i = 0; i < input.length(); i++) {
            var ch = input.charAt(i);
            switch (ch) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '"' -> out.append("&quot;");
                default -> out.append(ch);
            }
        }
    }
}
