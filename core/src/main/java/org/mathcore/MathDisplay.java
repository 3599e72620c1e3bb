package org.mathcore;

/** Whether an equation is rendered inline or as a block of its own. */
public enum MathDisplay {
    INLINE,
    BLOCK;

    public static MathDisplay of(boolean displaystyle) {
        return displaystyle ? BLOCK : INLINE;
    }
}
