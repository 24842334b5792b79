package org.dxworks.marklex.analyzer.markdown;

import org.dxworks.marklex.lexer.Lexer;
import org.dxworks.marklex.lexer.Token;
import org.dxworks.marklex.model.LineKind;
import org.dxworks.marklex.model.MarkdownFileAnalysis;
import org.dxworks.marklex.model.MarkdownLine;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Lexes a whole Markdown file line by line. Lines are independent: no state is carried
 * from one line to the next.
 */
public class MarkdownAnalyzer {

    private static final Pattern LINE_SEPARATOR = Pattern.compile("\r\n|\r|\n");

    private final Lexer lexer;
    private final boolean includeBlankLines;

    public MarkdownAnalyzer() {
        this(new Lexer(), true);
    }

    public MarkdownAnalyzer(Lexer lexer, boolean includeBlankLines) {
        this.lexer = lexer;
        this.includeBlankLines = includeBlankLines;
    }

    public MarkdownFileAnalysis analyze(String filePath, String sourceCode) {
        MarkdownFileAnalysis analysis = new MarkdownFileAnalysis();
        analysis.filePath = filePath;

        String[] lines = LINE_SEPARATOR.split(sourceCode, -1);
        // a trailing separator does not start another line
        int count = lines[lines.length - 1].isEmpty() ? lines.length - 1 : lines.length;

        for (int i = 0; i < count; i++) {
            List<Token> tokens = lexer.split(lines[i] + "\n");
            LineKind kind = LineKind.of(tokens);
            if (kind == LineKind.BLANK && !includeBlankLines) {
                continue;
            }
            MarkdownLine line = new MarkdownLine();
            line.line = i + 1;
            line.kind = kind;
            line.tokens = tokens;
            analysis.lines.add(line);
        }
        return analysis;
    }
}
