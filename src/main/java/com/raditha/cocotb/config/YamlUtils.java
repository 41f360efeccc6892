package com.raditha.cocotb.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared YAML utilities for the migrator configuration.
 */
public final class YamlUtils {
    private static final Logger logger = LoggerFactory.getLogger(YamlUtils.class);

    private YamlUtils() {
        // Utility class
    }

    /**
     * Create a Yaml instance with proper block-style configuration.
     *
     * @return configured Yaml instance
     */
    public static Yaml createYaml() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        options.setIndent(2);
        return new Yaml(options);
    }

    /**
     * Read a YAML file into a Map structure.
     *
     * @param file path to YAML file
     * @return Map representation of YAML content, empty for an empty file
     * @throws IOException              if file cannot be read
     * @throws IllegalArgumentException if the content is not a YAML mapping
     */
    public static Map<String, Object> readYaml(Path file) throws IOException {
        logger.debug("Reading YAML file: {}", file);
        try (InputStream input = Files.newInputStream(file)) {
            return readYaml(input, file.toString());
        }
    }

    public static Map<String, Object> readYaml(InputStream input, String origin) {
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            Object data = createYaml().load(reader);
            if (data == null) {
                return new LinkedHashMap<>();
            }
            if (!(data instanceof Map)) {
                throw new IllegalArgumentException(origin + ": expected a mapping at the top level");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) data;
            return map;
        } catch (YAMLException e) {
            throw new IllegalArgumentException(origin + ": malformed YAML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException(origin + ": cannot be read: " + e.getMessage(), e);
        }
    }

    public static String dump(Map<String, Object> data) {
        return createYaml().dump(data);
    }
}
