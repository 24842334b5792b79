package org.dxworks.marklex;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public final class MarkdownFiles {

    private static final List<String> EXTENSIONS = List.of(".md", ".markdown", ".mdown", ".mkd");

    private MarkdownFiles() {}

    public static boolean isMarkdown(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) return false;
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        for (String extension : EXTENSIONS) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
