package com.bayesenum.server.ai.loader;

import com.bayesenum.server.ai.NetworkFormatException;
import com.bayesenum.server.ai.network.NetworkBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses the CPT file, a sequence of blocks:
 *
 * <pre>
 * NODE &lt;name&gt;
 * VALUES &lt;v1&gt; &lt;v2&gt; ...
 * [PARENTS &lt;p1&gt; &lt;p2&gt; ...]
 * TABLE
 * &lt;parentVal1&gt; ... &lt;parentValK&gt; &lt;prob1&gt; ... &lt;probM&gt;
 * ENDNODE
 * </pre>
 *
 * A {@code PARENTS} line adds the listed edges. Table rows give parent values
 * in {@code PARENTS} order; they are re-keyed to the node's own parent order
 * when the structure file declared the parents differently.
 */
public final class CptFileParser {

    private static final Logger logger = LoggerFactory.getLogger(CptFileParser.class);

    private static final class Line {
        final int number;
        final String text;
        final String[] tokens;

        Line(int number, String text) {
            this.number = number;
            this.text = text;
            this.tokens = text.split("\\s+");
        }

        String keyword() {
            return tokens[0];
        }
    }

    private final List<Line> lines = new ArrayList<>();
    private final NetworkBuilder builder;
    private int index = 0;

    private CptFileParser(List<String> raw, NetworkBuilder builder) {
        this.builder = builder;
        for (int i = 0; i < raw.size(); i++) {
            String text = raw.get(i).trim();
            if (!text.isEmpty() && !text.startsWith("#")) {
                lines.add(new Line(i + 1, text));
            }
        }
    }

    /**
     * Applies every block to {@code builder}.
     *
     * @return number of node blocks read
     * @throws NetworkFormatException on a missing keyword, bad row width or unparsable number
     * @throws com.bayesenum.server.ai.ProbabilityException if a row does not sum to 1
     */
    public static int parse(List<String> lines, NetworkBuilder builder) {
        return new CptFileParser(lines, builder).parseBlocks();
    }

    private int parseBlocks() {
        int blocks = 0;
        while (index < lines.size()) {
            parseBlock();
            blocks++;
        }
        return blocks;
    }

    private void parseBlock() {
        Line header = lines.get(index++);
        if (!"NODE".equals(header.keyword())) {
            throw new NetworkFormatException("Expected 'NODE <name>'", header.number, header.text);
        }
        if (header.tokens.length != 2) {
            throw new NetworkFormatException("NODE takes exactly one name", header.number, header.text);
        }
        String name = header.tokens[1];

        Line valuesLine = expectNext("VALUES", name, header);
        List<String> values = tail(valuesLine);
        if (values.isEmpty()) {
            throw new NetworkFormatException("VALUES for " + name + " lists no values", valuesLine.number,
                    valuesLine.text);
        }
        if (new LinkedHashSet<>(values).size() != values.size()) {
            throw new NetworkFormatException("VALUES for " + name + " repeats a value", valuesLine.number,
                    valuesLine.text);
        }
        builder.setDomain(name, values);

        List<String> declaredParents = List.of();
        if (index < lines.size() && "PARENTS".equals(lines.get(index).keyword())) {
            Line parentsLine = lines.get(index++);
            declaredParents = tail(parentsLine);
            for (String parent : declaredParents) {
                builder.addEdge(parent, name);
            }
            checkParentsComplete(name, declaredParents, parentsLine);
        }

        Line tableLine = index < lines.size() ? lines.get(index) : null;
        if (tableLine == null || !"TABLE".equals(tableLine.text)) {
            throw missing("TABLE", name, tableLine, valuesLine);
        }
        index++;

        int[] keyLayout = keyLayout(name, declaredParents);
        int rows = 0;
        while (index < lines.size() && !"ENDNODE".equals(lines.get(index).text)) {
            parseRow(lines.get(index++), name, values, declaredParents.size(), keyLayout);
            rows++;
        }
        if (index >= lines.size()) {
            throw missing("ENDNODE", name, null, tableLine);
        }
        index++;
        logger.trace("Read {} CPT rows for node {}", rows, name);
    }

    private void parseRow(Line row, String name, List<String> values, int parentCount, int[] keyLayout) {
        int expected = parentCount + values.size();
        if (row.tokens.length != expected) {
            throw new NetworkFormatException("Table row for " + name + " needs " + expected + " tokens ("
                    + parentCount + " parent values, " + values.size() + " probabilities), found "
                    + row.tokens.length, row.number, row.text);
        }

        List<String> parentValues = new ArrayList<>(parentCount);
        for (int i = 0; i < parentCount; i++) {
            parentValues.add(row.tokens[keyLayout[i]]);
        }

        Map<String, Double> probs = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            String token = row.tokens[parentCount + i];
            try {
                probs.put(values.get(i), Double.parseDouble(token));
            } catch (NumberFormatException e) {
                throw new NetworkFormatException("'" + token + "' is not a probability", row.number, row.text);
            }
        }
        builder.setCptRow(name, parentValues, probs);
    }

    // PARENTS must name every parent the node has, including ones from the structure file.
    private void checkParentsComplete(String name, List<String> declaredParents, Line parentsLine) {
        Set<String> declared = new LinkedHashSet<>(declaredParents);
        if (declared.size() != declaredParents.size()) {
            throw new NetworkFormatException("PARENTS for " + name + " repeats a parent", parentsLine.number,
                    parentsLine.text);
        }
        if (!declared.equals(new LinkedHashSet<>(builder.parentsOf(name)))) {
            throw new NetworkFormatException("PARENTS for " + name + " must list all of its parents "
                    + builder.parentsOf(name), parentsLine.number, parentsLine.text);
        }
    }

    // For each position of the node's parent list, the row token index holding that parent's value.
    private int[] keyLayout(String name, List<String> declaredParents) {
        if (declaredParents.isEmpty()) {
            return new int[0];
        }
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < declaredParents.size(); i++) {
            position.put(declaredParents.get(i), i);
        }
        List<String> actual = builder.parentsOf(name);
        int[] layout = new int[actual.size()];
        for (int i = 0; i < actual.size(); i++) {
            layout[i] = position.get(actual.get(i));
        }
        return layout;
    }

    private Line expectNext(String keyword, String name, Line previous) {
        Line next = index < lines.size() ? lines.get(index) : null;
        if (next == null || !keyword.equals(next.keyword())) {
            throw missing(keyword, name, next, previous);
        }
        index++;
        return next;
    }

    private static NetworkFormatException missing(String keyword, String name, Line found, Line previous) {
        if (found == null) {
            return new NetworkFormatException("Expected '" + keyword + "' for NODE " + name + ", found end of file",
                    previous.number, previous.text);
        }
        return new NetworkFormatException("Expected '" + keyword + "' for NODE " + name, found.number, found.text);
    }

    private static List<String> tail(Line line) {
        return Arrays.asList(line.tokens).subList(1, line.tokens.length);
    }
}
