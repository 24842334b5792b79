package org.dxworks.marklex.analyzer.markdown;

import org.dxworks.marklex.lexer.Lexer;
import org.dxworks.marklex.model.LineKind;
import org.dxworks.marklex.model.MarkdownFileAnalysis;
import org.dxworks.marklex.model.MarkdownLine;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MarkdownAnalyzerTest {

    @Test
    void numbersLinesFromOne() {
        MarkdownFileAnalysis analysis = new MarkdownAnalyzer().analyze("a.md", "# t\n\n- item\n");
        assertEquals("file", analysis.kind);
        assertEquals("a.md", analysis.filePath);
        assertEquals(3, analysis.lines.size());
        assertEquals(1, analysis.lines.get(0).line);
        assertEquals(LineKind.TITLE, analysis.lines.get(0).kind);
        assertEquals(LineKind.BLANK, analysis.lines.get(1).kind);
        assertEquals(LineKind.LIST_ITEM, analysis.lines.get(2).kind);
    }

    @Test
    void blankLinesCanBeLeftOut() {
        MarkdownFileAnalysis analysis = new MarkdownAnalyzer(new Lexer(), false).analyze("a.md", "one\n\n   \nfour");
        assertEquals(2, analysis.lines.size());
        assertEquals(1, analysis.lines.get(0).line);
        assertEquals(4, analysis.lines.get(1).line);
    }

    @Test
    void acceptsEveryLineSeparator() {
        MarkdownFileAnalysis analysis = new MarkdownAnalyzer().analyze("a.md", "one\r\ntwo\rthree\nfour");
        assertEquals(4, analysis.lines.size());
        for (MarkdownLine line : analysis.lines) {
            assertEquals(1, line.tokens.size());
            assertEquals(LineKind.PLAIN, line.kind);
        }
        assertEquals("three", analysis.lines.get(2).tokens.get(0).getValue());
    }

    @Test
    void emptySourceHasNoLines() {
        assertTrue(new MarkdownAnalyzer().analyze("empty.md", "").lines.isEmpty());
    }

    @Test
    void trailingSpacesBecomeLineBreak() {
        MarkdownLine line = new MarkdownAnalyzer().analyze("a.md", "end  \r\n").lines.get(0);
        assertEquals(2, line.tokens.size());
        assertEquals("<br>", line.tokens.get(1).getValue());
    }
}
