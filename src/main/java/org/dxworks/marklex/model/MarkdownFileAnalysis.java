package org.dxworks.marklex.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"kind", "filePath", "lines"})
public class MarkdownFileAnalysis {
    public String kind = "file";
    public String filePath;
    public List<MarkdownLine> lines = new ArrayList<>();
}
