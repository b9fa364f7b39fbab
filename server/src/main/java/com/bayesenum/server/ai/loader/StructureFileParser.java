package com.bayesenum.server.ai.loader;

import com.bayesenum.server.ai.NetworkFormatException;
import com.bayesenum.server.ai.network.NetworkBuilder;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the structure file: one {@code Parent -> Child} edge per line.
 * Blank lines and lines starting with {@code #} are skipped.
 */
public final class StructureFileParser {

    private static final String ARROW = "->";
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private StructureFileParser() {
    }

    /**
     * Adds every edge to {@code builder}.
     *
     * @return number of edge lines read
     * @throws NetworkFormatException on the first malformed line
     */
    public static int parse(List<String> lines, NetworkBuilder builder) {
        int edges = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int lineNumber = i + 1;

            if (!line.contains(ARROW)) {
                throw new NetworkFormatException("Expected 'Parent -> Child'", lineNumber, line);
            }
            String[] parts = line.split(ARROW, -1);
            if (parts.length != 2) {
                throw new NetworkFormatException("Exactly one '->' allowed per line", lineNumber, line);
            }
            String parent = parts[0].trim();
            String child = parts[1].trim();
            if (parent.isEmpty() || child.isEmpty()) {
                throw new NetworkFormatException("Edge needs both a parent and a child name", lineNumber, line);
            }
            // CPT blocks name nodes with a single token, so names here must be one too.
            if (WHITESPACE.matcher(parent).find() || WHITESPACE.matcher(child).find()) {
                throw new NetworkFormatException("Node names must not contain whitespace", lineNumber, line);
            }

            builder.addEdge(parent, child);
            edges++;
        }
        return edges;
    }
}
