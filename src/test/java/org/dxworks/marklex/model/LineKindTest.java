package org.dxworks.marklex.model;

import org.dxworks.marklex.lexer.Lexer;
import org.dxworks.marklex.lexer.Token;
import org.dxworks.marklex.lexer.TokenKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class LineKindTest {

    private final Lexer lexer = new Lexer();

    private LineKind kindOf(String line) {
        return LineKind.of(lexer.split(line));
    }

    @Test
    void leadingTokenDecidesTheKind() {
        assertEquals(LineKind.BLANK, kindOf("   "));
        assertEquals(LineKind.TITLE, kindOf("## title"));
        assertEquals(LineKind.LIST_ITEM, kindOf("- item"));
        assertEquals(LineKind.LIST_ITEM, kindOf("12. item"));
        assertEquals(LineKind.QUOTE, kindOf("> quote"));
        assertEquals(LineKind.DIVIDING, kindOf("***"));
        assertEquals(LineKind.CODE_FENCE, kindOf("```"));
        assertEquals(LineKind.REFERENCE, kindOf("[a]: https://example.com"));
        assertEquals(LineKind.PLAIN, kindOf("**plain** text"));
        assertEquals(LineKind.PLAIN, kindOf("[a](b)"));
    }

    @Test
    void indentationIsSkipped() {
        assertEquals(LineKind.LIST_ITEM, kindOf("    * nested"));
        assertEquals(LineKind.PLAIN, kindOf("    indented"));
        assertEquals(LineKind.DIVIDING, kindOf("  ---"));
        assertEquals(LineKind.UNKNOWN, LineKind.of(List.of(new Token("  ", TokenKind.WHITE_SPACE))));
    }

    @Test
    void noTokensIsUnknown() {
        assertEquals(LineKind.UNKNOWN, LineKind.of(List.of()));
    }
}
