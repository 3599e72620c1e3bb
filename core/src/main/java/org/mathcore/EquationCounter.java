package org.mathcore;

// Numbering state of one conversion
class EquationCounter {
    private int value;

    EquationCounter() {
        this(0);
    }

    EquationCounter(int start) {
        this.value = start;
    }

    // Label of the next numbered row
    int advance() {
        this.value += 1;
        return this.value;
    }

    int value() {
        return this.value;
    }
}
