package org.dxworks.marklex.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass automaton over the inline part of a line. Produces text spans, raw
 * delimiter runs, images, links, reference links, reference definitions, autolinks
 * and a trailing line break, then hands the list to {@link DelimiterResolver}.
 * <p>
 * Text is never flushed eagerly: {@code last} marks the start of the pending span, so a
 * construct that fails to close falls back to text simply by not having been emitted.
 */
final class InlineLexer {

    static final String ESCAPE_CHARS = ":*_`#+-.![]()<>\\";
    static final String LINE_BREAK = "<br>";

    private final LinkValidator validator;

    InlineLexer(LinkValidator validator) {
        this.validator = validator;
    }

    List<Token> split(String content) {
        List<Token> tokens = new Pass(content).run();
        if (hasLineBreak(content)) {
            tokens.add(new Token(LINE_BREAK, TokenKind.LINE_BREAK));
        }
        tokens.removeIf(t -> t.getValue().isEmpty());
        DelimiterResolver.resolve(tokens);
        return tokens;
    }

    /**
     * A line break is two trailing spaces before the newline, or a trailing {@code <br>}.
     */
    static boolean hasLineBreak(String content) {
        return content.endsWith("  \n") || content.stripTrailing().endsWith(LINE_BREAK);
    }

    private static boolean isDelimiter(int ch) {
        return ch == '*' || ch == '_' || ch == '`';
    }

    private static TokenKind delimiterKind(int ch) {
        switch (ch) {
            case '*':
                return TokenKind.STAR;
            case '_':
                return TokenKind.UNDER_LINE;
            case '`':
                return TokenKind.BACK_TICK;
            default:
                throw new IllegalArgumentException("Not a delimiter: " + Character.toString(ch));
        }
    }

    private static String trimLineEnd(String s) {
        String trimmed = s.stripTrailing();
        while (trimmed.endsWith(LINE_BREAK)) {
            trimmed = trimmed.substring(0, trimmed.length() - LINE_BREAK.length());
        }
        return trimmed;
    }

    /** State of one walk over one line. */
    private final class Pass {
        private final CodePoints text;
        private final List<Token> buff = new ArrayList<>();
        private InlineState state = InlineState.NORMAL;
        private int last = 0;

        Pass(String content) {
            this.text = new CodePoints(content);
        }

        List<Token> run() {
            int ix = 0;
            while (ix < text.length() && state.phase != InlineState.Phase.TERMINAL) {
                int ch = text.at(ix);

                if (ch == '\n') {
                    addText(trimLineEnd(text.slice(last, ix)));
                    last = ix;
                    break;
                }

                if (state.phase == InlineState.Phase.SKIP) {
                    // the escaped char stays in the pending text
                    state = InlineState.NORMAL;
                } else if (state.phase == InlineState.Phase.REF_LINK_DEF_OPEN) {
                    closeRefLinkDef(ix);
                } else if (ch == '\\' && isEscapable(text.peek(ix + 1))) {
                    flushText(ix);
                    last = ix + 1; // drop the backslash
                    state = InlineState.SKIP;
                } else if (!step(ix, ch, text.peek(ix + 1))) {
                    // the construct in progress was abandoned; read this char again as plain text
                    state = InlineState.NORMAL;
                    continue;
                }
                ix++;
            }
            return buff;
        }

        /**
         * Advances the automaton by one char.
         *
         * @return false when the construct in progress is abandoned and {@code ch} has to be
         *         reconsidered in {@link InlineState.Phase#NORMAL}
         */
        private boolean step(int ix, int ch, int next) {
            switch (state.phase) {
                case NORMAL:
                    if (isDelimiter(ch)) {
                        flushText(ix);
                        if (next == ch) {
                            last = ix;
                            state = InlineState.continuous(ix);
                        } else {
                            emit(new Token(text.slice(ix, ix + 1), delimiterKind(ch)), ix);
                        }
                    } else if (ch == '!') {
                        state = InlineState.imageOpen(ix);
                    } else if (ch == '[') {
                        state = InlineState.linkNameOpen(ix);
                    } else if (ch == '<') {
                        state = InlineState.autolinkOpen(ix);
                    }
                    return true;

                case CONTINUOUS:
                    if (next != ch) {
                        emit(new Token(text.slice(state.start, ix + 1), delimiterKind(ch)), ix);
                    }
                    return true;

                case IMAGE_OPEN:
                    if (ch == '[') {
                        state = InlineState.imageNameOpen(state.bang, ix);
                    } else if (ch == '!') {
                        state = InlineState.imageOpen(ix);
                    } else {
                        return false;
                    }
                    return true;

                case IMAGE_NAME_OPEN:
                    if (ch == ']') {
                        state = InlineState.nameClosed(state.bang, state.open, ix);
                    }
                    return true;

                case LINK_NAME_OPEN:
                    if (ch == ']') {
                        state = InlineState.nameClosed(InlineState.ABSENT, state.open, ix);
                    } else if (ch == '[') {
                        // innermost bracket wins
                        state = InlineState.linkNameOpen(ix);
                    }
                    return true;

                case NAME_CLOSED:
                    switch (ch) {
                        case '(':
                            state = InlineState.locationOpen(state.bang, state.open, state.close, ix);
                            return true;
                        case ']':
                            state = InlineState.nameClosed(state.bang, state.open, ix);
                            return true;
                        case '[':
                            state = InlineState.refLinkOpen(state.open, state.close, ix);
                            return true;
                        case ':':
                            state = InlineState.refLinkDefOpen(state.open, state.close, ix);
                            return true;
                        default:
                            return false;
                    }

                case REF_LINK_OPEN:
                    if (ch == ']') {
                        flushText(state.open);
                        emit(LinkDetailExtractor.extract(
                                text.slice(state.open, ix + 1),
                                text.slice(state.open + 1, state.close),
                                text.slice(state.clause + 1, ix),
                                TokenKind.REF_LINK), ix);
                    }
                    return true;

                case LOCATION_OPEN:
                    if (ch == ')') {
                        int begin = state.isImage() ? state.bang : state.open;
                        flushText(begin);
                        emit(LinkDetailExtractor.extract(
                                text.slice(begin, ix + 1),
                                text.slice(state.open + 1, state.close),
                                text.slice(state.clause + 1, ix),
                                state.isImage() ? TokenKind.IMAGE : TokenKind.LINK), ix);
                    }
                    return true;

                case AUTOLINK_OPEN:
                    stepAutolink(ix, ch);
                    return true;

                default:
                    throw new IllegalStateException("Unexpected inline state: " + state);
            }
        }

        private void stepAutolink(int ix, int ch) {
            if (Character.isWhitespace(ch)) {
                String candidate = text.slice(state.start + 1, ix).strip();
                if (!candidate.isEmpty() && !validator.isAutolink(candidate)) {
                    state = InlineState.NORMAL;
                }
            } else if (ch == '>') {
                String link = text.slice(state.start + 1, ix).strip();
                if (validator.isAutolink(link)) {
                    flushText(state.start);
                    emit(LinkDetailExtractor.extract(
                            text.slice(state.start, ix + 1), link, link, TokenKind.QUICK_LINK), ix);
                } else {
                    state = InlineState.NORMAL;
                }
            }
        }

        // A reference definition takes the rest of the line, whatever it contains
        private void closeRefLinkDef(int ix) {
            int end = text.contentEnd();
            flushText(state.open);
            buff.add(LinkDetailExtractor.extract(
                    text.slice(state.open, end),
                    text.slice(state.open + 1, state.close),
                    text.slice(ix, end),
                    TokenKind.REF_LINK_DEF));
            last = end;
            state = InlineState.TERMINAL;
        }

        /** Adds a token that ends at {@code ix} and resumes plain text after it. */
        private void emit(Token token, int ix) {
            buff.add(token);
            last = ix + 1;
            state = InlineState.NORMAL;
        }

        private void flushText(int end) {
            addText(text.slice(last, end));
        }

        private void addText(String s) {
            if (!s.isEmpty()) {
                buff.add(new Token(s, TokenKind.TEXT));
            }
        }

        private boolean isEscapable(int cp) {
            return cp != CodePoints.NONE && ESCAPE_CHARS.indexOf(cp) >= 0;
        }
    }
}
