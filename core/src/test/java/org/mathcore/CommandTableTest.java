package org.mathcore;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class CommandTableTest {

    @Test void lookups() {
        assertEquals(new CommandSpec(CommandKind.IDENTIFIER, "α", false), CommandTable.lookup("alpha").orElseThrow());
        assertEquals(new CommandSpec(CommandKind.BIG_OPERATOR, "∑", true), CommandTable.lookup("sum").orElseThrow());
        assertFalse(CommandTable.lookup("int").orElseThrow().limits());
        assertTrue(CommandTable.lookup("lim").orElseThrow().limits());
        assertFalse(CommandTable.lookup("sin").orElseThrow().limits());
        assertTrue(CommandTable.lookup("foo").isEmpty());
    }

    @Test void arities() {
        assertEquals(0, CommandTable.lookup("alpha").orElseThrow().arity());
        assertEquals(1, CommandTable.lookup("sqrt").orElseThrow().arity());
        assertEquals(2, CommandTable.lookup("frac").orElseThrow().arity());
        assertEquals(2, CommandTable.lookup("overset").orElseThrow().arity());
        assertEquals(1, CommandTable.lookup("tag").orElseThrow().arity());
    }

    @Test void symbolsNameTheirEnums() {
        for (var name : new String[] {"mathbb", "mathbf", "textbf", "text"}) {
            var spec = CommandTable.lookup(name).orElseThrow();
            assertDoesNotThrow(() -> MathVariant.valueOf(spec.symbol()), name);
        }
        assertEquals(Node.DelimiterSize.BIG, Node.DelimiterSize.valueOf(CommandTable.lookup("big").orElseThrow().symbol()));
        assertEquals(Node.Style.DISPLAY, Node.Style.valueOf(CommandTable.lookup("displaystyle").orElseThrow().symbol()));
    }

    @Test void negationsAndColors() {
        assertEquals("≠", CommandTable.negate("="));
        assertEquals("⇏", CommandTable.negate("⇒"));
        assertEquals("≪\u0338", CommandTable.negate("≪"));
        assertEquals("ff0000", CommandTable.color("red").orElseThrow());
        assertEquals("808000", CommandTable.color("olive").orElseThrow());
        assertTrue(CommandTable.color("Red").isEmpty());
        assertEquals(6, CommandTable.lookup("genfrac").orElseThrow().arity());
    }

    @Test void textCommands() {
        assertTrue(CommandTable.isTextCommand("text"));
        assertTrue(CommandTable.isTextCommand("textbf"));
        assertFalse(CommandTable.isTextCommand("mathbf"));
        assertFalse(CommandTable.isTextCommand("operatorname"));
        assertTrue(CommandTable.size() > 100);
    }
}
