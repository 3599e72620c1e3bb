package org.mathcore;

import java.util.Map;

// Math alphabets, mapped onto the Mathematical Alphanumeric Symbols block
enum MathVariant {
    NORMAL(-1, -1, -1, Map.of()),
    BOLD(0x1D400, 0x1D41A, 0x1D7CE, Map.of()),
    ITALIC(0x1D434, 0x1D44E, -1, Map.of('h', 0x210E)),
    BOLD_ITALIC(0x1D468, 0x1D482, 0x1D7CE, Map.of()),
    SCRIPT(0x1D49C, 0x1D4B6, -1, Map.ofEntries(
        Map.entry('B', 0x212C), Map.entry('E', 0x2130), Map.entry('F', 0x2131),
        Map.entry('H', 0x210B), Map.entry('I', 0x2110), Map.entry('L', 0x2112),
        Map.entry('M', 0x2133), Map.entry('R', 0x211B), Map.entry('e', 0x212F),
        Map.entry('g', 0x210A), Map.entry('o', 0x2134)
    )),
    FRAKTUR(0x1D504, 0x1D51E, -1, Map.of(
        'C', 0x212D, 'H', 0x210C, 'I', 0x2111, 'R', 0x211C, 'Z', 0x2128
    )),
    DOUBLE_STRUCK(0x1D538, 0x1D552, 0x1D7D8, Map.of(
        'C', 0x2102, 'H', 0x210D, 'N', 0x2115, 'P', 0x2119,
        'Q', 0x211A, 'R', 0x211D, 'Z', 0x2124
    )),
    SANS_SERIF(0x1D5A0, 0x1D5BA, 0x1D7E2, Map.of()),
    MONOSPACE(0x1D670, 0x1D68A, 0x1D7F6, Map.of());

    // -1 leaves that range untouched
    final int upperBase;
    final int lowerBase;
    final int digitBase;
    // letters that live in Letterlike Symbols instead of the main block
    final Map<Character, Integer> exceptions;

    MathVariant(int upperBase, int lowerBase, int digitBase, Map<Character, Integer> exceptions) {
        this.upperBase = upperBase;
        this.lowerBase = lowerBase;
        this.digitBase = digitBase;
        this.exceptions = exceptions;
    }

    int transform(int cp) {
        if (cp < 0x80 && this.exceptions.containsKey((char) cp)) {
            return this.exceptions.get((char) cp);
        }
        if (cp >= 'A' && cp <= 'Z' && this.upperBase >= 0) {
            return this.upperBase + (cp - 'A');
        }
        if (cp >= 'a' && cp <= 'z' && this.lowerBase >= 0) {
            return this.lowerBase + (cp - 'a');
        }
        if (cp >= '0' && cp <= '9' && this.digitBase >= 0) {
            return this.digitBase + (cp - '0');
        }
        return cp;
    }

    String transform(String text) {
        var sb = new StringBuilder(text.length() * 2);
        text.codePoints().forEach(cp -> sb.appendCodePoint(transform(cp)));
        return sb.toString();
    }
}
