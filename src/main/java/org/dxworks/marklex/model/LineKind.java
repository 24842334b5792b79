package org.dxworks.marklex.model;

import org.dxworks.marklex.lexer.Token;
import org.dxworks.marklex.lexer.TokenKind;

import java.util.List;

/**
 * Coarse classification of a lexed line, decided by its first meaningful token.
 */
public enum LineKind {
    BLANK,
    TITLE,
    LIST_ITEM,
    QUOTE,
    DIVIDING,
    CODE_FENCE,
    REFERENCE,
    PLAIN,
    UNKNOWN;

    public static LineKind of(List<Token> tokens) {
        for (Token token : tokens) {
            // indentation says nothing about the line itself
            if (token.getKind() == TokenKind.WHITE_SPACE) {
                continue;
            }
            return ofLeading(token.getKind());
        }
        return UNKNOWN;
    }

    private static LineKind ofLeading(TokenKind kind) {
        return switch (kind) {
            case BLANK_LINE -> BLANK;
            case TITLE_MARK -> TITLE;
            case UNORDERED_MARK, ORDERED_MARK -> LIST_ITEM;
            case QUOTE_MARK -> QUOTE;
            case DIVIDING_MARK -> DIVIDING;
            case CODE_BLOCK_MARK -> CODE_FENCE;
            case REF_LINK_DEF -> REFERENCE;
            default -> PLAIN;
        };
    }
}
