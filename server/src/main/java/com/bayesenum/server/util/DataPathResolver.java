package com.bayesenum.server.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

public class DataPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(DataPathResolver.class);

    public static final String DATA_DIR_PROPERTY = "bayes.data.dir";
    public static final String CONFIG_RESOURCE = "/bayes_config.json";
    public static final String CLASSPATH_PREFIX = "classpath:";

    public static String resolveDataDirectory() {
        // 1. Check System Property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config File
        try {
            ObjectMapper mapper = new ObjectMapper();
            try (InputStream is = DataPathResolver.class.getResourceAsStream(CONFIG_RESOURCE)) {
                if (is != null) {
                    JsonNode root = mapper.readTree(is);
                    if (root.has("data_directory")) {
                        String configDir = root.get("data_directory").asText();
                        if (configDir != null && !configDir.isEmpty()) {
                            return configDir;
                        }
                    }
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to read data_directory from {}: {}", CONFIG_RESOURCE, e.getMessage());
        }

        // 3. Default
        return ".";
    }

    public static boolean isClasspathLocation(String location) {
        return location.startsWith(CLASSPATH_PREFIX);
    }

    /**
     * Resolves a network file location. Absolute paths are kept; relative ones
     * are taken from the data directory. Not for {@code classpath:} locations.
     */
    public static Path resolveFile(String location) {
        Path path = Paths.get(location);
        if (path.isAbsolute()) {
            return path;
        }
        return Paths.get(resolveDataDirectory()).resolve(path);
    }

    /**
     * True for {@code classpath:} locations and for files that stay inside the
     * data directory once {@code ..} segments are resolved.
     */
    public static boolean isInsideDataDirectory(String location) {
        if (isClasspathLocation(location)) {
            return true;
        }
        try {
            Path root = Paths.get(resolveDataDirectory()).toAbsolutePath().normalize();
            Path file = resolveFile(location).toAbsolutePath().normalize();
            return file.startsWith(root);
        } catch (InvalidPathException e) {
            logger.debug("Not a valid path: {}", location);
            return false;
        }
    }
}
