package org.mathcore;

public sealed interface Token {
    // Shared instances for the tokens without payload
    Token GROUP_OPEN = new GroupOpen();
    Token GROUP_CLOSE = new GroupClose();
    Token SUPERSCRIPT = new Superscript();
    Token SUBSCRIPT = new Subscript();
    Token COLUMN_SEPARATOR = new ColumnSeparator();
    Token ROW_SEPARATOR = new RowSeparator();
    Token PRIME = new Prime();
    Token TILDE = new Tilde();
    Token END_OF_INPUT = new EndOfInput();

    // Closing tokens end a sequence; they are never consumed by error recovery
    default boolean isCloser() {
        return false;
    }

    record Command(String name) implements Token {
        boolean is(String other) {
            return name.equals(other);
        }

        @Override
        public boolean isCloser() {
            return name.equals("right") || name.equals("middle");
        }

        @Override
        public String toString() {
            return "Command: " + '"' + "\\" + name + '"';
        }
    }

    // One code point, possibly outside the BMP
    record Char(int codePoint) implements Token {
        boolean is(char c) {
            return codePoint == c;
        }

        String text() {
            return new String(Character.toChars(codePoint));
        }

        @Override
        public String toString() {
            return "Char: " + '"' + text() + '"';
        }
    }

    record TextRun(String text) implements Token {
        @Override
        public String toString() {
            return "TextRun: " + '"' + text + '"';
        }
    }

    // Placeholder `#n`, only produced inside macro bodies
    record Param(int index) implements Token {
        @Override
        public String toString() {
            return "Param: #" + index;
        }
    }

    // Placeholder `#n` inside the text run of a macro body
    record TextParam(int index) implements Token {
        @Override
        public String toString() {
            return "TextParam: #" + index;
        }
    }

    record EnvBegin(String name) implements Token {
        @Override
        public String toString() {
            return "EnvBegin: " + '"' + name + '"';
        }
    }

    record EnvEnd(String name) implements Token {
        @Override
        public boolean isCloser() {
            return true;
        }

        @Override
        public String toString() {
            return "EnvEnd: " + '"' + name + '"';
        }
    }

    record GroupOpen() implements Token {
        @Override
        public String toString() {
            return "GroupOpen";
        }
    }

    record GroupClose() implements Token {
        @Override
        public boolean isCloser() {
            return true;
        }

        @Override
        public String toString() {
            return "GroupClose";
        }
    }

    record Superscript() implements Token {
        @Override
        public String toString() {
            return "Superscript";
        }
    }

    record Subscript() implements Token {
        @Override
        public String toString() {
            return "Subscript";
        }
    }

    record ColumnSeparator() implements Token {
        @Override
        public boolean isCloser() {
            return true;
        }

        @Override
        public String toString() {
            return "ColumnSeparator";
        }
    }

    record RowSeparator() implements Token {
        @Override
        public boolean isCloser() {
            return true;
        }

        @Override
        public String toString() {
            return "RowSeparator";
        }
    }

    record Prime() implements Token {
        @Override
        public String toString() {
            return "Prime";
        }
    }

    record Tilde() implements Token {
        @Override
        public String toString() {
            return "Tilde";
        }
    }

    record EndOfInput() implements Token {
        @Override
        public boolean isCloser() {
            return true;
        }

        @Override
        public String toString() {
            return "EndOfInput";
        }
    }
}
