package com.bayesenum.server.tools;

import com.bayesenum.server.ai.BayesNetworkException;
import com.bayesenum.server.ai.format.NetworkFormatter;
import com.bayesenum.server.ai.inference.EnumerationInferenceEngine;
import com.bayesenum.server.ai.inference.InferenceResult;
import com.bayesenum.server.ai.inference.trace.EnumerationTraceEvent;
import com.bayesenum.server.ai.inference.trace.EnumerationTraceListener;
import com.bayesenum.server.ai.loader.NetworkLoader;
import com.bayesenum.server.ai.network.BayesianNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line front end: loads a network and answers one query.
 * Usage: EnumerationQueryTool &lt;structureFile&gt; &lt;cptFile&gt; [&lt;queryVar&gt; [Var=value ...]]
 * [--verbose] [--show-network]
 * <p>
 * Without a query variable the structure and tables are printed.
 */
public class EnumerationQueryTool {

    private static final Logger logger = LoggerFactory.getLogger(EnumerationQueryTool.class);

    static final String USAGE = "Usage: EnumerationQueryTool <structureFile> <cptFile> [<queryVar> [Var=value ...]]"
            + " [--verbose] [--show-network]";

    static final class Arguments {
        String structureFile;
        String cptFile;
        String queryVariable;
        final Map<String, String> evidence = new LinkedHashMap<>();
        boolean verbose;
        boolean showNetwork;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Arguments parsed;
        try {
            parsed = parseArguments(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 2;
        }

        try {
            BayesianNetwork network = NetworkLoader.load(Paths.get(parsed.structureFile), Paths.get(parsed.cptFile));

            if (parsed.showNetwork || parsed.queryVariable == null) {
                out.print(NetworkFormatter.structure(network));
                out.print(NetworkFormatter.cpts(network));
            }
            if (parsed.queryVariable == null) {
                return 0;
            }

            EnumerationTraceListener trace = parsed.verbose
                    ? (EnumerationTraceEvent event) -> out.println(event.indented())
                    : EnumerationTraceListener.NONE;

            out.println("Computing P(" + parsed.queryVariable + " | " + NetworkFormatter.evidence(parsed.evidence)
                    + ")");
            InferenceResult result = new EnumerationInferenceEngine(network)
                    .infer(parsed.queryVariable, parsed.evidence, trace);
            out.print(NetworkFormatter.result(result));
            return 0;
        } catch (BayesNetworkException | UncheckedIOException e) {
            logger.debug("Query failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static Arguments parseArguments(String[] args) {
        Arguments parsed = new Arguments();
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            if ("--verbose".equals(arg) || "-v".equals(arg)) {
                parsed.verbose = true;
            } else if ("--show-network".equals(arg)) {
                parsed.showNetwork = true;
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option " + arg);
            } else {
                positional.add(arg);
            }
        }

        if (positional.size() < 2) {
            throw new IllegalArgumentException("Structure and CPT files are required");
        }
        parsed.structureFile = positional.get(0);
        parsed.cptFile = positional.get(1);
        if (positional.size() > 2) {
            parsed.queryVariable = positional.get(2);
        }
        for (String pair : positional.subList(Math.min(3, positional.size()), positional.size())) {
            int eq = pair.indexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) {
                throw new IllegalArgumentException("Evidence must be Var=value, got '" + pair + "'");
            }
            parsed.evidence.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return parsed;
    }
}
