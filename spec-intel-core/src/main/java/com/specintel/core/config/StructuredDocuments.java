package com.specintel.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads and writes the structured documents configuration lives in.
 *
 * <p>Files ending in {@code .json} use a JSON mapper; everything else is read as YAML.
 * Both mappers are thread-safe and shared.
 */
public final class StructuredDocuments {

    private static final Logger log = LoggerFactory.getLogger(StructuredDocuments.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);
    // Strings stay quoted so values such as 0x10, 1e3 or .inf read back as text.
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    private StructuredDocuments() {
        // Utility class
    }

    /**
     * @return shared JSON mapper, also used to build trees in memory
     */
    public static ObjectMapper json() {
        return JSON_MAPPER;
    }

    /**
     * @return shared YAML mapper
     */
    public static ObjectMapper yaml() {
        return YAML_MAPPER;
    }

    /**
     * Picks the mapper for a file by extension.
     *
     * @param path document path
     * @return JSON mapper for {@code .json} files, YAML mapper otherwise
     */
    public static ObjectMapper mapperFor(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
        return fileName.toLowerCase(Locale.ROOT).endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
    }

    /**
     * Reads a document into a tree.
     *
     * @param path document path
     * @return root node, never null or missing
     * @throws MalformedConfigException if the file is missing, unreadable, unparseable or empty
     */
    public static JsonNode read(Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new MalformedConfigException("Configuration document not found or not readable", path);
        }
        try {
            log.debug("Reading configuration document: {}", path);
            return requireContent(mapperFor(path).readTree(path.toFile()), path);
        } catch (IOException e) {
            log.error("Failed to parse configuration document: {}. Error: {}", path, e.getMessage());
            throw new MalformedConfigException("Failed to parse configuration document", path, e);
        }
    }

    /**
     * Reads a document from a stream, e.g. a classpath resource.
     *
     * @param in stream positioned at the document start; not closed by this method
     * @param name resource name, used for mapper selection and error messages
     * @return root node, never null or missing
     * @throws MalformedConfigException if the stream cannot be parsed or is empty
     */
    public static JsonNode read(InputStream in, String name) {
        Path pseudoPath = Path.of(name);
        try {
            return requireContent(mapperFor(pseudoPath).readTree(in), pseudoPath);
        } catch (IOException e) {
            log.error("Failed to parse configuration resource: {}. Error: {}", name, e.getMessage());
            throw new MalformedConfigException("Failed to parse configuration resource", pseudoPath, e);
        }
    }

    /**
     * Writes a tree to a file, creating parent directories.
     *
     * @param node tree to write
     * @param path target file; the extension selects the format
     * @throws ConfigException if the file cannot be written
     */
    public static void write(JsonNode node, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapperFor(path).writeValue(path.toFile(), node);
            log.debug("Wrote configuration document: {}", path);
        } catch (IOException e) {
            throw new MalformedConfigException("Failed to write configuration document", path, e);
        }
    }

    private static JsonNode requireContent(JsonNode node, Path source) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw new MalformedConfigException("Configuration document is empty", source);
        }
        return node;
    }
}
