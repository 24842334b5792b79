package org.dxworks.marklex.lexer;

public enum TokenKind {
    // block marks
    TITLE_MARK,       // #, ##, ###, ####
    UNORDERED_MARK,   // *, -, +
    ORDERED_MARK,     // 1.
    DIVIDING_MARK,    // ---, ***, ___
    QUOTE_MARK,       // >
    CODE_BLOCK_MARK,  // ```

    // resolved inline marks
    BOLD_MARK,        // ** **
    ITALIC_MARK,      // * *
    ITALIC_BOLD_MARK, // *** ***
    CODE_MARK,        // ` `

    // link family
    IMAGE,            // ![name](location "title")
    LINK,             // [name](location "title")
    QUICK_LINK,       // <url or email>
    REF_LINK,         // [name][tag]
    REF_LINK_DEF,     // [tag]: location "title"

    // structural
    TEXT,
    BLANK_LINE,
    LINE_BREAK,       // <br> or two trailing spaces
    WHITE_SPACE,      // leading indentation

    // raw delimiter runs, only present before resolution
    STAR,
    UNDER_LINE,
    BACK_TICK;

    public boolean isLinkFamily() {
        return this == IMAGE || this == LINK || this == QUICK_LINK
                || this == REF_LINK || this == REF_LINK_DEF;
    }

    public boolean isDelimiter() {
        return this == STAR || this == UNDER_LINE || this == BACK_TICK;
    }
}
