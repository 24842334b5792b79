package org.dxworks.marklex.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decides the leading block mark of a line from its first whitespace-delimited word,
 * and where inline tokenizing has to start.
 */
final class BlockMarkClassifier {

    private static final Pattern ORDERED_MARK = Pattern.compile("[1-9][0-9]{0,2}\\.");
    private static final String CODE_FENCE = "```";

    enum Phase { BEGIN, MARK, INLINE, FINISHED }

    /** Outcome of classifying one line. */
    static final class Result {
        final List<Token> tokens;
        final int inlineStart; // code point offset, or -1 when no inline phase runs

        Result(List<Token> tokens, int inlineStart) {
            this.tokens = Collections.unmodifiableList(tokens);
            this.inlineStart = inlineStart;
        }

        boolean hasInline() {
            return inlineStart >= 0;
        }
    }

    private BlockMarkClassifier() {}

    /**
     * @param line the whole line, terminated by a newline
     */
    static Result classify(CodePoints line) {
        List<Token> tokens = new ArrayList<>();
        Phase phase = Phase.BEGIN;
        int begin = 0;
        int inlineStart = -1;

        for (int ix = 0; ix < line.length() && (phase == Phase.BEGIN || phase == Phase.MARK); ix++) {
            int ch = line.at(ix);
            boolean blank = Character.isWhitespace(ch);

            if (phase == Phase.BEGIN) {
                if (!blank) {
                    String indent = line.slice(0, ix);
                    if (!indent.isEmpty()) {
                        tokens.add(new Token(indent, TokenKind.WHITE_SPACE));
                    }
                    begin = ix;
                    phase = Phase.MARK;
                } else if (ch == '\n') {
                    tokens.add(new Token(line.slice(0, ix), TokenKind.BLANK_LINE));
                    phase = Phase.FINISHED;
                }
            } else if (blank) {
                Token mark = extractMark(line.slice(begin, ix), line);
                if (mark == null) {
                    inlineStart = begin;
                    phase = Phase.INLINE;
                } else {
                    if (mark.getKind() == TokenKind.DIVIDING_MARK) {
                        // the dividing mark already spans the indentation
                        tokens.clear();
                        tokens.add(mark);
                        phase = Phase.FINISHED;
                    } else {
                        tokens.add(mark);
                        inlineStart = mark.getKind() == TokenKind.CODE_BLOCK_MARK ? begin + CODE_FENCE.length() : ix + 1;
                        phase = Phase.INLINE;
                    }
                }
            }
        }
        return new Result(tokens, inlineStart);
    }

    /**
     * @return the mark token for {@code word}, or null when the word is ordinary text
     */
    static Token extractMark(String word, CodePoints line) {
        switch (word) {
            case "#":
            case "##":
            case "###":
            case "####":
                return new Token(word, TokenKind.TITLE_MARK);
            case ">":
                return new Token(word, TokenKind.QUOTE_MARK);
            case "+":
                return new Token(word, TokenKind.UNORDERED_MARK);
            case "*":
            case "-":
                return isDividing(line) ? dividingMark(line) : new Token(word, TokenKind.UNORDERED_MARK);
            default:
                break;
        }
        if (ORDERED_MARK.matcher(word).matches()) {
            return new Token(word, TokenKind.ORDERED_MARK);
        }
        if (word.startsWith(CODE_FENCE)) {
            return new Token(CODE_FENCE, TokenKind.CODE_BLOCK_MARK);
        }
        if (word.startsWith("*") || word.startsWith("-") || word.startsWith("_")) {
            return isDividing(line) ? dividingMark(line) : null;
        }
        return null;
    }

    /**
     * A dividing line holds three or more of one of {@code * - _} and nothing else but whitespace.
     */
    static boolean isDividing(CodePoints line) {
        Map<Integer, Integer> counts = new HashMap<>();
        for (int ix = 0; ix < line.length(); ix++) {
            int ch = line.at(ix);
            if (!Character.isWhitespace(ch)) {
                counts.merge(ch, 1, Integer::sum);
            }
        }
        if (counts.size() != 1) {
            return false;
        }
        Map.Entry<Integer, Integer> only = counts.entrySet().iterator().next();
        int ch = only.getKey();
        return (ch == '*' || ch == '-' || ch == '_') && only.getValue() >= 3;
    }

    private static Token dividingMark(CodePoints line) {
        return new Token(line.slice(0, line.contentEnd()), TokenKind.DIVIDING_MARK);
    }
}
