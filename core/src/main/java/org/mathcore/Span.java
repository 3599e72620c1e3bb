package org.mathcore;

import java.text.MessageFormat;

// Half-open range [start, end) of UTF-16 indices into the source string
public record Span(int start, int end) {
    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                MessageFormat.format("invalid span [{0}, {1})", start, end)
            );
        }
    }

    static Span at(int offset) {
        return new Span(offset, offset);
    }

    // Smallest span covering both
    Span join(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return String.format("[%d, %d)", start, end);
    }
}
