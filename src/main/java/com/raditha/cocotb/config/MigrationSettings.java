package com.raditha.cocotb.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule tables and pipeline settings, loaded from {@code cocotb-migrator.yml}.
 *
 * <p>
 * The defaults ship on the classpath. A user file only needs the keys it changes; every key it
 * contains replaces the default value as a whole. Instances are immutable and safe to share.
 */
public final class MigrationSettings {
    private static final Logger logger = LoggerFactory.getLogger(MigrationSettings.class);

    public static final String DEFAULT_RESOURCE = "/cocotb-migrator.yml";

    static final String PASSES = "passes";
    static final String MAX_ITERATIONS = "max_iterations";
    static final String COROUTINE_MARKERS = "coroutine_markers";
    static final String TEST_MARKERS = "test_markers";
    static final String RETURN_VALUE_NAMES = "return_value_names";
    static final String CALL_RENAMES = "call_renames";
    static final String START_SOON = "start_soon";
    static final String KEYWORD_RENAMES = "keyword_renames";
    static final String KEYWORD_REMOVALS = "keyword_removals";
    static final String KEYWORD_REMOVAL_ADVISORIES = "keyword_removal_advisories";
    static final String REMOVED_ATTRIBUTES = "removed_attributes";
    static final String QUALIFIED_NAMES = "qualified_names";
    static final String EXCLUDE_DIRECTORIES = "exclude_directories";

    private static final Set<String> KNOWN_KEYS = Set.of(PASSES, MAX_ITERATIONS, COROUTINE_MARKERS,
            TEST_MARKERS, RETURN_VALUE_NAMES, CALL_RENAMES, START_SOON, KEYWORD_RENAMES, KEYWORD_REMOVALS,
            KEYWORD_REMOVAL_ADVISORIES, REMOVED_ATTRIBUTES, QUALIFIED_NAMES, EXCLUDE_DIRECTORIES);

    private final List<String> passes;
    private final int maxIterations;
    private final List<String> coroutineMarkers;
    private final List<String> testMarkers;
    private final List<String> returnValueNames;
    private final Map<String, String> callRenames;
    private final List<String> startSoonSchedulers;
    private final String startMethod;
    private final Map<String, Map<String, String>> keywordRenames;
    private final Map<String, List<String>> keywordRemovals;
    private final Map<String, String> keywordRemovalAdvisories;
    private final Map<String, String> removedAttributes;
    private final List<String> qualifiedNames;
    private final List<String> excludeDirectories;

    private MigrationSettings(Map<String, Object> data) {
        passes = stringList(data, PASSES);
        maxIterations = positiveInt(data, MAX_ITERATIONS);
        coroutineMarkers = stringList(data, COROUTINE_MARKERS);
        testMarkers = stringList(data, TEST_MARKERS);
        returnValueNames = stringList(data, RETURN_VALUE_NAMES);
        callRenames = stringMap(data.get(CALL_RENAMES), CALL_RENAMES);

        Map<String, Object> startSoon = mapping(data.get(START_SOON), START_SOON);
        startSoonSchedulers = stringList(startSoon, "schedulers");
        Object method = startSoon.get("method");
        if (!(method instanceof String)) {
            throw new IllegalArgumentException(START_SOON + ".method must be a string");
        }
        startMethod = (String) method;

        Map<String, Map<String, String>> renames = new LinkedHashMap<>();
        mapping(data.get(KEYWORD_RENAMES), KEYWORD_RENAMES).forEach((callee, table) ->
                renames.put(callee, stringMap(table, KEYWORD_RENAMES + "." + callee)));
        keywordRenames = Collections.unmodifiableMap(renames);

        Map<String, List<String>> removals = new LinkedHashMap<>();
        Map<String, Object> removalData = mapping(data.get(KEYWORD_REMOVALS), KEYWORD_REMOVALS);
        for (String methodName : removalData.keySet()) {
            removals.put(methodName, stringList(removalData, methodName));
        }
        keywordRemovals = Collections.unmodifiableMap(removals);
        keywordRemovalAdvisories = stringMap(data.get(KEYWORD_REMOVAL_ADVISORIES), KEYWORD_REMOVAL_ADVISORIES);

        removedAttributes = stringMap(data.get(REMOVED_ATTRIBUTES), REMOVED_ATTRIBUTES);
        qualifiedNames = stringList(data, QUALIFIED_NAMES);
        excludeDirectories = stringList(data, EXCLUDE_DIRECTORIES);
    }

    /**
     * The settings shipped with the tool.
     */
    public static MigrationSettings loadDefault() {
        return new MigrationSettings(defaultData());
    }

    /**
     * Defaults overlaid with the top-level keys of a user file.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the YAML is malformed, a key is unknown or a value
     *                                  has the wrong shape
     */
    public static MigrationSettings load(Path file) throws IOException {
        logger.info("Loading configuration from {}", file);
        return fromMap(YamlUtils.readYaml(file));
    }

    /**
     * Defaults overlaid with {@code overrides}.
     */
    public static MigrationSettings fromMap(Map<String, Object> overrides) {
        Set<String> unknown = new LinkedHashSet<>(overrides.keySet());
        unknown.removeAll(KNOWN_KEYS);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown configuration keys: " + unknown);
        }
        Map<String, Object> data = defaultData();
        data.putAll(overrides);
        return new MigrationSettings(data);
    }

    /**
     * The same settings with a different iteration bound.
     */
    public MigrationSettings withMaxIterations(int iterations) {
        Map<String, Object> data = toMap();
        data.put(MAX_ITERATIONS, iterations);
        return new MigrationSettings(data);
    }

    private static Map<String, Object> defaultData() {
        try (InputStream input = MigrationSettings.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            return YamlUtils.readYaml(input, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    public List<String> getPasses() {
        return passes;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public List<String> getCoroutineMarkers() {
        return coroutineMarkers;
    }

    public List<String> getTestMarkers() {
        return testMarkers;
    }

    public List<String> getReturnValueNames() {
        return returnValueNames;
    }

    public Map<String, String> getCallRenames() {
        return callRenames;
    }

    public List<String> getStartSoonSchedulers() {
        return startSoonSchedulers;
    }

    public String getStartMethod() {
        return startMethod;
    }

    public Map<String, Map<String, String>> getKeywordRenames() {
        return keywordRenames;
    }

    public Map<String, List<String>> getKeywordRemovals() {
        return keywordRemovals;
    }

    public Map<String, String> getKeywordRemovalAdvisories() {
        return keywordRemovalAdvisories;
    }

    public Map<String, String> getRemovedAttributes() {
        return removedAttributes;
    }

    public List<String> getQualifiedNames() {
        return qualifiedNames;
    }

    public List<String> getExcludeDirectories() {
        return excludeDirectories;
    }

    /**
     * The effective settings as the YAML structure they were read from.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(PASSES, new ArrayList<>(passes));
        data.put(MAX_ITERATIONS, maxIterations);
        data.put(COROUTINE_MARKERS, new ArrayList<>(coroutineMarkers));
        data.put(TEST_MARKERS, new ArrayList<>(testMarkers));
        data.put(RETURN_VALUE_NAMES, new ArrayList<>(returnValueNames));
        data.put(CALL_RENAMES, new LinkedHashMap<>(callRenames));
        Map<String, Object> startSoon = new LinkedHashMap<>();
        startSoon.put("schedulers", new ArrayList<>(startSoonSchedulers));
        startSoon.put("method", startMethod);
        data.put(START_SOON, startSoon);
        Map<String, Object> renames = new LinkedHashMap<>();
        keywordRenames.forEach((callee, table) -> renames.put(callee, new LinkedHashMap<>(table)));
        data.put(KEYWORD_RENAMES, renames);
        Map<String, Object> removals = new LinkedHashMap<>();
        keywordRemovals.forEach((method, keywords) -> removals.put(method, new ArrayList<>(keywords)));
        data.put(KEYWORD_REMOVALS, removals);
        data.put(KEYWORD_REMOVAL_ADVISORIES, new LinkedHashMap<>(keywordRemovalAdvisories));
        data.put(REMOVED_ATTRIBUTES, new LinkedHashMap<>(removedAttributes));
        data.put(QUALIFIED_NAMES, new ArrayList<>(qualifiedNames));
        data.put(EXCLUDE_DIRECTORIES, new ArrayList<>(excludeDirectories));
        return data;
    }

    public String toYaml() {
        return YamlUtils.dump(toMap());
    }

    private static List<String> stringList(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(key + " must be a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof String)) {
                throw new IllegalArgumentException(key + " must contain only strings, found " + item);
            }
            result.add((String) item);
        }
        return List.copyOf(result);
    }

    private static int positiveInt(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (!(value instanceof Integer) || (Integer) value < 1) {
            throw new IllegalArgumentException(key + " must be a positive integer, found " + value);
        }
        return (Integer) value;
    }

    private static Map<String, Object> mapping(Object value, String key) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(key + " must be a mapping");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static Map<String, String> stringMap(Object value, String key) {
        Map<String, String> result = new LinkedHashMap<>();
        mapping(value, key).forEach((k, v) -> {
            if (!(v instanceof String)) {
                throw new IllegalArgumentException(key + "." + k + " must be a string");
            }
            result.put(k, (String) v);
        });
        return Collections.unmodifiableMap(result);
    }
}
