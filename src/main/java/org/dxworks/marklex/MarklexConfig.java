package org.dxworks.marklex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class MarklexConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "marklex-config.yml";
    private static final boolean DEFAULT_INCLUDE_BLANK_LINES = true;

    private final int maxFileLines;
    private final boolean includeBlankLines;

    private MarklexConfig(int maxFileLines, boolean includeBlankLines) {
        this.maxFileLines = maxFileLines;
        this.includeBlankLines = includeBlankLines;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public boolean isIncludeBlankLines() {
        return includeBlankLines;
    }

    public static MarklexConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MarklexConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                Integer maxFileLines = yamlConfig.maxFileLines;
                Boolean includeBlankLines = yamlConfig.includeBlankLines;

                int effectiveMaxFileLines = (maxFileLines != null && maxFileLines > 0)
                        ? maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                boolean effectiveIncludeBlankLines = (includeBlankLines != null)
                        ? includeBlankLines
                        : DEFAULT_INCLUDE_BLANK_LINES;

                return new MarklexConfig(effectiveMaxFileLines, effectiveIncludeBlankLines);
            }
        } catch (IOException e) {
            System.err.println("Warning: ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static MarklexConfig defaults() {
        return new MarklexConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_INCLUDE_BLANK_LINES);
    }

    public static MarklexConfig with(int maxFileLines, boolean includeBlankLines) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new MarklexConfig(effectiveMaxFileLines, includeBlankLines);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Boolean includeBlankLines;
    }
}
