package org.mathcore;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class MathVariantTest {

    @Test void alphabets() {
        assertEquals("𝐀𝐳𝟗", MathVariant.BOLD.transform("Az9"));
        assertEquals("𝔸ℝ𝟙", MathVariant.DOUBLE_STRUCK.transform("AR1"));
        assertEquals("ℒ𝒶", MathVariant.SCRIPT.transform("La"));
        assertEquals("ℎ", MathVariant.ITALIC.transform("h"));
    }

    @Test void othersUntouched() {
        assertEquals("x+1α", MathVariant.NORMAL.transform("x+1α"));
        assertEquals("𝐱+α", MathVariant.BOLD.transform("x+α"));
        assertEquals("2", MathVariant.FRAKTUR.transform("2"));
    }
}
