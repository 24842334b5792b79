package org.dxworks.marklex.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Tidy pass over the flat inline token list: pairs raw {@code *}, {@code _} and
 * {@code `} runs into emphasis and code marks and turns everything left unpaired into text.
 * The pending stack holds indices into the token list, never the tokens themselves.
 */
final class DelimiterResolver {

    /** Runs this long never open an emphasis or code span. */
    static final int MAX_OPENING_RUN = 3;

    private DelimiterResolver() {}

    static void resolve(List<Token> tokens) {
        normalizeRuns(TokenKind.STAR, tokens);
        normalizeRuns(TokenKind.UNDER_LINE, tokens);

        List<Integer> pending = new ArrayList<>();
        for (int ix = 0; ix < tokens.size(); ix++) {
            Token current = tokens.get(ix);
            if (!current.getKind().isDelimiter()) {
                continue;
            }

            int found = -1;
            for (int s = pending.size() - 1; s >= 0; s--) {
                Token candidate = tokens.get(pending.get(s));
                if (candidate.getKind() == current.getKind() && candidate.getValue().equals(current.getValue())) {
                    found = s;
                    break;
                }
            }

            if (found >= 0) {
                TokenKind resolved = resolvedKind(current);
                tokens.get(pending.get(found)).updateKind(resolved);
                current.updateKind(resolved);
                // everything opened after the match stays unpaired
                for (int s = found + 1; s < pending.size(); s++) {
                    tokens.get(pending.get(s)).updateKind(TokenKind.TEXT);
                }
                pending.subList(found, pending.size()).clear();
            } else if (current.length() <= MAX_OPENING_RUN) {
                pending.add(ix);
            } else {
                current.updateKind(TokenKind.TEXT);
            }
        }

        for (int ix : pending) {
            tokens.get(ix).updateKind(TokenKind.TEXT);
        }
    }

    /**
     * Splits a run that is longer than the previous run of the same kind so that its
     * prefix can pair with it, e.g. {@code **} followed by {@code ***} becomes
     * {@code **} followed by {@code **}, {@code *}.
     */
    static void normalizeRuns(TokenKind kind, List<Token> tokens) {
        List<int[]> splits = new ArrayList<>();
        int previous = 0;

        for (int ix = 0; ix < tokens.size(); ix++) {
            Token t = tokens.get(ix);
            if (t.getKind() != kind) {
                continue;
            }
            int length = t.length();
            if (previous == 0 || length < previous) {
                previous = length;
                continue;
            }
            int rest = length - previous;
            if (rest > 0) {
                splits.add(new int[]{ix, previous});
                previous = rest;
            } else {
                previous = 0;
            }
        }

        // descending, so earlier indices stay valid while inserting
        for (int i = splits.size() - 1; i >= 0; i--) {
            int ix = splits.get(i)[0];
            int at = splits.get(i)[1];
            Token tail = tokens.get(ix).splitOff(at);
            tokens.add(ix + 1, tail);
        }
    }

    private static TokenKind resolvedKind(Token delimiter) {
        if (delimiter.getKind() == TokenKind.BACK_TICK) {
            return TokenKind.CODE_MARK;
        }
        switch (delimiter.length()) {
            case 1:
                return TokenKind.ITALIC_MARK;
            case 2:
                return TokenKind.BOLD_MARK;
            case 3:
                return TokenKind.ITALIC_BOLD_MARK;
            default:
                throw new IllegalStateException("Unpairable run: " + delimiter.getValue());
        }
    }
}
