package org.mathcore;

import java.text.BreakIterator;
import java.util.*;

public class SpanUtils {
    // 1-based line, 0-based column in UTF-16 units
    public record Location(int line, int column) {}

    // Offsets where each line starts, the first one is always 0
    public static ArrayList<Integer> lineIndex(String source) {
        var index = new ArrayList<Integer>();
        index.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                index.add(i + 1);
            }
        }
        return index;
    }

    public static Location locate(int numChar, List<Integer> lineIndex) {
        var lineFind = Collections.binarySearch(lineIndex, numChar);

        int lineIdx;
        if (lineFind >= 0) {
            lineIdx = lineFind;
        } else {
            // binarySearch returns (-(insertion_point) - 1) so we reverse that
            lineIdx = -(lineFind + 1) - 1;
        }

        return new Location(lineIdx + 1, numChar - lineIndex.get(lineIdx));
    }

    // Number of user-perceived characters in text[from, to)
    //
    // Combining marks and surrogate pairs count once, which is what a caret
    // under the source line has to skip over.
    public static int graphemeWidth(String text, int from, int to) {
        var it = BreakIterator.getCharacterInstance(Locale.ROOT);
        it.setText(text);

        int count = 0;
        int boundary = it.following(from);
        while (boundary != BreakIterator.DONE && boundary <= to) {
            count++;
            boundary = it.next();
        }
        return count;
    }
}
