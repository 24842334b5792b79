package org.dxworks.marklex.lexer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CodePointsTest {

    @Test
    void surrogatePairsCountAsOne() {
        CodePoints text = new CodePoints("a😀b\n");
        assertEquals(4, text.length());
        assertEquals("😀", text.slice(1, 2));
        assertEquals('b', text.at(2));
    }

    @Test
    void sliceIsClamped() {
        CodePoints text = new CodePoints("abc");
        assertEquals("abc", text.slice(-3, 10));
        assertEquals("", text.slice(2, 1));
        assertEquals("bc", text.from(1));
    }

    @Test
    void peekPastTheEnd() {
        CodePoints text = new CodePoints("a");
        assertEquals('a', text.peek(0));
        assertEquals(CodePoints.NONE, text.peek(1));
        assertEquals(CodePoints.NONE, text.peek(-1));
    }

    @Test
    void contentEndStopsBeforeTheNewline() {
        assertEquals(3, new CodePoints("abc\n").contentEnd());
        assertEquals(3, new CodePoints("abc").contentEnd());
        assertEquals(0, new CodePoints("").contentEnd());
    }
}
