package org.dxworks.marklex.lexer;

/**
 * One state of the inline automaton together with the offsets it needs for its
 * transitions. Offsets are code point positions in the inline content; unused ones
 * are {@link #ABSENT}.
 */
final class InlineState {

    enum Phase {
        NORMAL,
        SKIP,
        CONTINUOUS,        // start
        IMAGE_OPEN,        // !
        IMAGE_NAME_OPEN,   // ! [
        LINK_NAME_OPEN,    // [
        NAME_CLOSED,       // (!) [ ]
        REF_LINK_OPEN,     // [ ] [
        REF_LINK_DEF_OPEN, // [ ] :
        LOCATION_OPEN,     // (!) [ ] (
        AUTOLINK_OPEN,     // <
        TERMINAL
    }

    static final int ABSENT = -1;

    static final InlineState NORMAL = new InlineState(Phase.NORMAL, ABSENT, ABSENT, ABSENT, ABSENT, ABSENT);
    static final InlineState SKIP = new InlineState(Phase.SKIP, ABSENT, ABSENT, ABSENT, ABSENT, ABSENT);
    static final InlineState TERMINAL = new InlineState(Phase.TERMINAL, ABSENT, ABSENT, ABSENT, ABSENT, ABSENT);

    final Phase phase;
    final int start;  // first char of a delimiter run, or the '<' of an autolink
    final int bang;   // '!' of an image
    final int open;   // '[' opening the name
    final int close;  // ']' closing the name
    final int clause; // '(', second '[' or ':'

    private InlineState(Phase phase, int start, int bang, int open, int close, int clause) {
        this.phase = phase;
        this.start = start;
        this.bang = bang;
        this.open = open;
        this.close = close;
        this.clause = clause;
    }

    static InlineState continuous(int start) {
        return new InlineState(Phase.CONTINUOUS, start, ABSENT, ABSENT, ABSENT, ABSENT);
    }

    static InlineState imageOpen(int bang) {
        return new InlineState(Phase.IMAGE_OPEN, ABSENT, bang, ABSENT, ABSENT, ABSENT);
    }

    static InlineState imageNameOpen(int bang, int open) {
        return new InlineState(Phase.IMAGE_NAME_OPEN, ABSENT, bang, open, ABSENT, ABSENT);
    }

    static InlineState linkNameOpen(int open) {
        return new InlineState(Phase.LINK_NAME_OPEN, ABSENT, ABSENT, open, ABSENT, ABSENT);
    }

    static InlineState nameClosed(int bang, int open, int close) {
        return new InlineState(Phase.NAME_CLOSED, ABSENT, bang, open, close, ABSENT);
    }

    static InlineState refLinkOpen(int open, int close, int tagOpen) {
        return new InlineState(Phase.REF_LINK_OPEN, ABSENT, ABSENT, open, close, tagOpen);
    }

    static InlineState refLinkDefOpen(int open, int close, int colon) {
        return new InlineState(Phase.REF_LINK_DEF_OPEN, ABSENT, ABSENT, open, close, colon);
    }

    static InlineState locationOpen(int bang, int open, int close, int paren) {
        return new InlineState(Phase.LOCATION_OPEN, ABSENT, bang, open, close, paren);
    }

    static InlineState autolinkOpen(int lt) {
        return new InlineState(Phase.AUTOLINK_OPEN, lt, ABSENT, ABSENT, ABSENT, ABSENT);
    }

    boolean isImage() {
        return bang != ABSENT;
    }

    @Override
    public String toString() {
        return phase + "(" + start + ", " + bang + ", " + open + ", " + close + ", " + clause + ")";
    }
}
