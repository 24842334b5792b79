package org.dxworks.marklex.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lexical front end for one Markdown line: classifies the leading block mark, walks the
 * rest of the line with the inline automaton, and resolves emphasis and code delimiters.
 * <p>
 * Instances hold no per-call state and can be shared between threads; lines are
 * independent of each other.
 */
public class Lexer {

    private final InlineLexer inlineLexer;

    public Lexer() {
        this(new StandardLinkValidator());
    }

    public Lexer(LinkValidator validator) {
        this.inlineLexer = new InlineLexer(Objects.requireNonNull(validator, "validator"));
    }

    /**
     * Splits one line into tokens.
     *
     * @param line a single line, optionally ending in {@code \n}
     * @return the ordered token sequence; never null
     * @throws IllegalArgumentException if the line contains a newline before its end
     */
    public List<Token> split(String line) {
        Objects.requireNonNull(line, "line");
        int newline = line.indexOf('\n');
        if (newline >= 0 && newline != line.length() - 1) {
            throw new IllegalArgumentException("Expected a single line, found a newline at offset " + newline);
        }
        CodePoints text = new CodePoints(newline < 0 ? line + "\n" : line);

        BlockMarkClassifier.Result block = BlockMarkClassifier.classify(text);
        List<Token> tokens = new ArrayList<>(block.tokens);
        if (block.hasInline()) {
            tokens.addAll(inlineLexer.split(text.from(block.inlineStart)));
        }
        return tokens;
    }
}
