package org.dxworks.marklex.lexer;

import java.util.regex.Pattern;

/**
 * Builds link-family tokens from the spans matched by the inline automaton.
 * The trailing clause is {@code location "title"} for images, links and reference
 * definitions, or the reference tag for reference links.
 */
final class LinkDetailExtractor {

    private static final Pattern DOUBLE_QUOTED = Pattern.compile("\"(?:[^\"\\\\]|\\\\.)*\"");
    private static final Pattern SINGLE_QUOTED = Pattern.compile("'(?:[^'\\\\]|\\\\.)*'");

    private LinkDetailExtractor() {}

    /**
     * @param value  the whole matched span, kept as the token value
     * @param name   text between the name brackets (the tag for a reference definition)
     * @param clause text between the parentheses, after the colon, or inside the tag brackets
     * @param kind   the link-family kind to produce
     * @return a token of {@code kind}, or a {@link TokenKind#TEXT} token when the title is not a quoted string
     */
    static Token extract(String value, String name, String clause, TokenKind kind) {
        String trimmed = clause.strip();
        Token token;
        switch (kind) {
            case IMAGE:
            case LINK:
            case REF_LINK_DEF: {
                String location = trimmed;
                String title = "";
                int split = indexOfBlank(trimmed);
                if (split >= 0) {
                    location = trimmed.substring(0, split);
                    String rest = stripLeadingBlanks(trimmed.substring(split));
                    if (!isQuotedString(rest)) {
                        return new Token(value, TokenKind.TEXT);
                    }
                    title = rest.substring(1, rest.length() - 1);
                }
                token = new Token(value, kind);
                if (kind == TokenKind.REF_LINK_DEF) {
                    token.putDetail(Token.PTR, name);
                } else {
                    token.putDetail(Token.NAME, name);
                }
                token.putDetail(Token.LOCATION, location);
                token.putDetail(Token.TITLE, title);
                return token;
            }
            case REF_LINK:
                token = new Token(value, kind);
                token.putDetail(Token.NAME, name);
                token.putDetail(Token.PTR, trimmed);
                return token;
            case QUICK_LINK:
                token = new Token(value, kind);
                token.putDetail(Token.NAME, name);
                token.putDetail(Token.LOCATION, trimmed);
                return token;
            default:
                throw new IllegalArgumentException("Not a link kind: " + kind);
        }
    }

    static boolean isQuotedString(String s) {
        return DOUBLE_QUOTED.matcher(s).matches() || SINGLE_QUOTED.matcher(s).matches();
    }

    private static int indexOfBlank(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == ' ' || c == '\t') return i;
        }
        return -1;
    }

    private static String stripLeadingBlanks(String s) {
        int i = 0;
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) i++;
        return s.substring(i);
    }
}
