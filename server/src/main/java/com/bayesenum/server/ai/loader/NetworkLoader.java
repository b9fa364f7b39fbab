package com.bayesenum.server.ai.loader;

import com.bayesenum.server.ai.network.BayesianNetwork;
import com.bayesenum.server.ai.network.NetworkBuilder;
import com.bayesenum.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads a network from a structure file and a CPT file, then validates it.
 * Any failure aborts the whole load.
 */
public class NetworkLoader {

    private static final Logger logger = LoggerFactory.getLogger(NetworkLoader.class);

    public static BayesianNetwork load(Path structureFile, Path cptFile) {
        logger.info("Loading structure from {}", structureFile);
        List<String> structure = readLines(structureFile);
        logger.info("Loading CPTs from {}", cptFile);
        List<String> cpts = readLines(cptFile);
        return load(structure, cpts);
    }

    /**
     * Loads from locations that are either {@code classpath:} resources or file
     * paths (relative ones resolved against the data directory).
     */
    public static BayesianNetwork load(String structureLocation, String cptLocation) {
        logger.info("Loading network from {} and {}", structureLocation, cptLocation);
        return load(readLines(structureLocation), readLines(cptLocation));
    }

    public static BayesianNetwork load(List<String> structureLines, List<String> cptLines) {
        NetworkBuilder builder = new NetworkBuilder();
        int edges = StructureFileParser.parse(structureLines, builder);
        int blocks = CptFileParser.parse(cptLines, builder);
        logger.info("Read {} edges and {} CPT blocks; validating structure and probabilities", edges, blocks);

        BayesianNetwork network = builder.validate();
        logger.info("Network loaded and validated: {} nodes, roots {}", network.size(), network.roots());
        return network;
    }

    static List<String> readLines(String location) {
        if (DataPathResolver.isClasspathLocation(location)) {
            String resource = location.substring(DataPathResolver.CLASSPATH_PREFIX.length());
            if (!resource.startsWith("/")) {
                resource = "/" + resource;
            }
            try (InputStream is = NetworkLoader.class.getResourceAsStream(resource)) {
                if (is == null) {
                    throw new UncheckedIOException(new NoSuchFileException(location));
                }
                BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
                return reader.lines().collect(Collectors.toList());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + location, e);
            }
        }
        return readLines(DataPathResolver.resolveFile(location));
    }

    static List<String> readLines(Path path) {
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }
}
