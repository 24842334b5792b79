package org.dxworks.marklex;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.marklex.analyzer.markdown.MarkdownAnalyzer;
import org.dxworks.marklex.lexer.Lexer;
import org.dxworks.marklex.model.MarkdownFileAnalysis;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    // The lexer is stateless, so one instance serves every worker thread
    private static final Lexer LEXER = new Lexer();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar marklex.jar <input> <output-file>");
            System.err.println("  <input>:       Markdown file or directory to scan");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting markdown lexing...");
        System.out.println("Input: " + input.toAbsolutePath());

        MarklexConfig config = MarklexConfig.load();
        List<Path> files = collectMarkdownFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " markdown files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Lexing: " + file.getFileName());
                }

                try {
                    MarkdownFileAnalysis analysis = analyzeFile(file, config);
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(analysis));
                        writer.newLine();
                        writer.flush();
                    }
                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", String.valueOf(e.getMessage()));

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error lexing " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Lexing complete!");
        System.out.println("Successfully lexed: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectMarkdownFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(MarkdownFiles::isMarkdown)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (MarkdownFiles.isMarkdown(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (Exception e) {
            // let the analysis itself report unreadable files
            return true;
        }
    }

    public static MarkdownFileAnalysis analyzeFile(Path filePath) throws IOException {
        return analyzeFile(filePath, MarklexConfig.defaults());
    }

    public static MarkdownFileAnalysis analyzeFile(Path filePath, MarklexConfig config) throws IOException {
        String source = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }

        MarkdownAnalyzer analyzer = new MarkdownAnalyzer(LEXER, config.isIncludeBlankLines());
        return analyzer.analyze(filePath.toString(), source);
    }
}
