package org.dxworks.marklex.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.marklex.lexer.Token;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"line", "kind", "tokens"})
public class MarkdownLine {
    public int line; // 1-based line number in the source file
    public LineKind kind;
    public List<Token> tokens = new ArrayList<>();
}
