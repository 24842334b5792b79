package org.dxworks.marklex.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BlockMarkClassifierTest {

    private static BlockMarkClassifier.Result classify(String line) {
        return BlockMarkClassifier.classify(new CodePoints(line));
    }

    @Test
    void titleMarkStartsInlineAfterTheSeparator() {
        BlockMarkClassifier.Result result = classify("## header\n");
        assertEquals(List.of(new Token("##", TokenKind.TITLE_MARK)), result.tokens);
        assertEquals(3, result.inlineStart);
    }

    @Test
    void plainLineStartsInlineAtTheFirstWord() {
        BlockMarkClassifier.Result result = classify("  plain words\n");
        assertEquals(List.of(new Token("  ", TokenKind.WHITE_SPACE)), result.tokens);
        assertEquals(2, result.inlineStart);
    }

    @Test
    void codeFenceKeepsTheInfoStringInline() {
        BlockMarkClassifier.Result result = classify("```java\n");
        assertEquals(List.of(new Token("```", TokenKind.CODE_BLOCK_MARK)), result.tokens);
        assertEquals(3, result.inlineStart);
    }

    @Test
    void dividingLineHasNoInlinePart() {
        BlockMarkClassifier.Result result = classify("* * *\n");
        assertEquals(List.of(new Token("* * *", TokenKind.DIVIDING_MARK)), result.tokens);
        assertFalse(result.hasInline());
    }

    @Test
    void indentedDividingLineIsOneToken() {
        BlockMarkClassifier.Result result = classify("   _ _ _\n");
        assertEquals(List.of(new Token("   _ _ _", TokenKind.DIVIDING_MARK)), result.tokens);
        assertFalse(result.hasInline());
    }

    @Test
    void blankLineHasNoInlinePart() {
        BlockMarkClassifier.Result result = classify(" \t\n");
        assertEquals(List.of(new Token(" \t", TokenKind.BLANK_LINE)), result.tokens);
        assertFalse(result.hasInline());
    }

    @Test
    void offsetsCountCodePoints() {
        BlockMarkClassifier.Result result = classify("> 😀 smile\n");
        assertEquals(List.of(new Token(">", TokenKind.QUOTE_MARK)), result.tokens);
        assertEquals(2, result.inlineStart);
    }

    @Test
    void extractMark() {
        CodePoints line = new CodePoints("x\n");
        assertEquals(new Token("####", TokenKind.TITLE_MARK), BlockMarkClassifier.extractMark("####", line));
        assertEquals(new Token("+", TokenKind.UNORDERED_MARK), BlockMarkClassifier.extractMark("+", line));
        assertEquals(new Token("42.", TokenKind.ORDERED_MARK), BlockMarkClassifier.extractMark("42.", line));
        assertNull(BlockMarkClassifier.extractMark("#####", line));
        assertNull(BlockMarkClassifier.extractMark("0.", line));
        assertNull(BlockMarkClassifier.extractMark("1)", line));
        assertNull(BlockMarkClassifier.extractMark("**", line));
    }

    @Test
    void isDividing() {
        assertTrue(BlockMarkClassifier.isDividing(new CodePoints("---\n")));
        assertTrue(BlockMarkClassifier.isDividing(new CodePoints("_ _ _ _\n")));
        assertFalse(BlockMarkClassifier.isDividing(new CodePoints("--\n")));
        assertFalse(BlockMarkClassifier.isDividing(new CodePoints("-*-\n")));
        assertFalse(BlockMarkClassifier.isDividing(new CodePoints("===\n")));
        assertFalse(BlockMarkClassifier.isDividing(new CodePoints("--- x\n")));
    }
}
