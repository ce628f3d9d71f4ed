package com.github.rewrite.template.config;

import com.github.rewrite.template.comments.DuplicateCommentPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads TemplateConfiguration from lst-templates.yaml or returns defaults.
 * <p>
 * The loader uses a static cache to avoid repeated file reads.
 * This is safe because lst-templates.yaml doesn't change during a recipe run.
 * <p>
 * Usage in a Recipe:
 * <pre>
 * TemplateConfiguration config = TemplateConfigurationLoader.load(projectRoot);
 * Statement s = LstTemplates.statement("log.info({msg});", config.getParser(), Map.of("msg", msg))
 *         .orElseThrow();
 * </pre>
 */
public class TemplateConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateConfigurationLoader.class);

    static final String CONFIG_YAML = "lst-templates.yaml";

    // Static cache - safe because lst-templates.yaml doesn't change during recipe execution
    private static final Map<Path, TemplateConfiguration> CACHE = new ConcurrentHashMap<>();

    // Test injection map - allows unit tests to inject configurations without filesystem access
    private static final Map<Path, TemplateConfiguration> TEST_INJECTIONS = new ConcurrentHashMap<>();

    private TemplateConfigurationLoader() {
    }

    /**
     * Loads the TemplateConfiguration for the given project root.
     * <p>
     * If lst-templates.yaml exists, it is parsed. Otherwise, defaults are returned.
     * Results are cached.
     *
     * @param projectRoot the project root directory
     * @return the TemplateConfiguration
     * @throws ConfigurationException if the file cannot be read or holds invalid values
     */
    public static TemplateConfiguration load(Path projectRoot) {
        if (projectRoot == null) {
            return TemplateConfiguration.defaults();
        }

        Path normalizedRoot = projectRoot.toAbsolutePath().normalize();

        TemplateConfiguration testConfig = TEST_INJECTIONS.get(normalizedRoot);
        if (testConfig != null) {
            return testConfig;
        }

        return CACHE.computeIfAbsent(normalizedRoot, TemplateConfigurationLoader::loadFromDisk);
    }

    /**
     * Clears the cache. Call this between test runs if needed.
     */
    public static void clearCache() {
        CACHE.clear();
    }

    /**
     * Injects a configuration for testing purposes.
     *
     * @param projectRoot the project root path
     * @param config the configuration to inject
     */
    public static void injectForTest(Path projectRoot, TemplateConfiguration config) {
        TEST_INJECTIONS.put(projectRoot.toAbsolutePath().normalize(), config);
    }

    /**
     * Clears all test injections. Call this in @AfterEach to clean up test state.
     */
    public static void clearTestInjections() {
        TEST_INJECTIONS.clear();
    }

    private static TemplateConfiguration loadFromDisk(Path projectRoot) {
        Path yamlPath = projectRoot.resolve(CONFIG_YAML);
        if (!Files.exists(yamlPath)) {
            log.debug("No {} found in {}, using defaults", CONFIG_YAML, projectRoot);
            return TemplateConfiguration.defaults();
        }
        try {
            return parseYaml(Files.readString(yamlPath), yamlPath.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + yamlPath, e);
        }
    }

    /**
     * Parses lst-templates.yaml content using SnakeYAML.
     */
    @SuppressWarnings("unchecked")
    static TemplateConfiguration parseYaml(String content, String origin) {
        Object rootObj;
        try {
            rootObj = new Yaml().load(content);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + origin + ": " + e.getMessage(), e);
        }
        if (rootObj == null) {
            return TemplateConfiguration.defaults();
        }
        if (!(rootObj instanceof Map)) {
            throw new ConfigurationException("Expected a mapping at the top of " + origin);
        }
        Map<String, Object> root = (Map<String, Object>) rootObj;

        TemplateConfiguration config = TemplateConfiguration.defaults();

        Object parserObj = root.get("parser");
        if (parserObj instanceof Map) {
            Map<String, Object> parser = (Map<String, Object>) parserObj;
            TemplateParserConfig parserConfig = config.getParser();

            List<String> classpath = extractStringList(parser.get("classpath"), "parser.classpath", origin);
            if (classpath != null) {
                parserConfig = parserConfig.withClasspath(classpath);
            }
            List<String> dependsOn = extractStringList(parser.get("dependsOn"), "parser.dependsOn", origin);
            if (dependsOn != null) {
                parserConfig = parserConfig.withDependsOn(dependsOn);
            }
            Object logObj = parser.get("logCompilationWarningsAndErrors");
            if (logObj != null) {
                parserConfig = parserConfig.withLogCompilationWarningsAndErrors(
                        Boolean.parseBoolean(logObj.toString().trim()));
            }
            config = config.withParser(parserConfig);
        }

        Object commentsObj = root.get("comments");
        if (commentsObj instanceof Map) {
            Map<String, Object> comments = (Map<String, Object>) commentsObj;
            Object duplicatesObj = comments.get("duplicates");
            if (duplicatesObj != null) {
                DuplicateCommentPolicy policy = DuplicateCommentPolicy.fromString(duplicatesObj.toString());
                if (policy == null) {
                    throw new ConfigurationException("Unknown comments.duplicates value '" + duplicatesObj +
                            "' in " + origin + ". Expected first-wins or last-wins.");
                }
                config = config.withDuplicateCommentPolicy(policy);
            }
        }

        return config;
    }

    private static List<String> extractStringList(Object obj, String key, String origin) {
        if (obj == null) {
            return null;
        }
        if (!(obj instanceof List)) {
            throw new ConfigurationException(key + " in " + origin + " must be a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) obj) {
            if (item != null) {
                result.add(item.toString().trim());
            }
        }
        return List.copyOf(result);
    }
}
