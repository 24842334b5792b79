package org.dxworks.marklex.lexer;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LinkDetailExtractorTest {

    @Test
    void linkWithLocationAndTitle() {
        Token token = LinkDetailExtractor.extract("[a](/b  \"c d\")", "a", "/b  \"c d\"", TokenKind.LINK);
        assertEquals(TokenKind.LINK, token.getKind());
        assertEquals(Map.of("name", "a", "location", "/b", "title", "c d"), token.getDetails());
    }

    @Test
    void tabSeparatesLocationFromTitle() {
        Token token = LinkDetailExtractor.extract("![a](/b\t'c')", "a", "/b\t'c'", TokenKind.IMAGE);
        assertEquals(Map.of("name", "a", "location", "/b", "title", "c"), token.getDetails());
    }

    @Test
    void onlyTheEnclosingQuotesAreRemoved() {
        Token token = LinkDetailExtractor.extract("[a](/b 'it\\'s')", "a", "/b 'it\\'s'", TokenKind.LINK);
        assertEquals("it\\'s", token.getDetails().get("title"));
    }

    @Test
    void clauseIsTrimmed() {
        Token token = LinkDetailExtractor.extract("[a](  /b  )", "a", "  /b  ", TokenKind.LINK);
        assertEquals(Map.of("name", "a", "location", "/b"), token.getDetails());
    }

    @Test
    void unquotedTitleDemotesToText() {
        Token token = LinkDetailExtractor.extract("[a](/b c)", "a", "/b c", TokenKind.LINK);
        assertEquals(new Token("[a](/b c)", TokenKind.TEXT), token);
        assertNull(token.getDetails());
    }

    @Test
    void referenceDefinitionStoresTagAsPtr() {
        Token token = LinkDetailExtractor.extract("[t]: /x \"y\"", "t", " /x \"y\"", TokenKind.REF_LINK_DEF);
        assertEquals(Map.of("ptr", "t", "location", "/x", "title", "y"), token.getDetails());
    }

    @Test
    void referenceLink() {
        Token token = LinkDetailExtractor.extract("[a][ t ]", "a", " t ", TokenKind.REF_LINK);
        assertEquals(Map.of("name", "a", "ptr", "t"), token.getDetails());
    }

    @Test
    void quickLink() {
        Token token = LinkDetailExtractor.extract("<a@b.org>", "a@b.org", "a@b.org", TokenKind.QUICK_LINK);
        assertEquals(Map.of("name", "a@b.org", "location", "a@b.org"), token.getDetails());
    }

    @Test
    void nonLinkKindIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> LinkDetailExtractor.extract("x", "x", "x", TokenKind.TEXT));
    }

    @Test
    void isQuotedString() {
        assertTrue(LinkDetailExtractor.isQuotedString("\"a\""));
        assertTrue(LinkDetailExtractor.isQuotedString("''"));
        assertTrue(LinkDetailExtractor.isQuotedString("\"a \\\" b\""));
        assertFalse(LinkDetailExtractor.isQuotedString("\"a"));
        assertFalse(LinkDetailExtractor.isQuotedString("'a\""));
        assertFalse(LinkDetailExtractor.isQuotedString("\"a\" b"));
        assertFalse(LinkDetailExtractor.isQuotedString("a"));
    }
}
