package com.formula.config;

import com.formula.ast.NodeLimits;
import com.formula.exception.ConfigurationException;
import com.formula.lr.TableOptions;
import com.formula.parser.ParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads calculator configuration from YAML files.
 * Keys live under a {@code formula:} root; any key left out keeps its default.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static CalculatorConfig load(String path) {
        log.info("Loading formula configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Parse configuration from YAML text.
     */
    public static CalculatorConfig parse(String yamlText) {
        Map<String, Object> root = loadYaml(yamlText);
        return fromMap(root);
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    private static CalculatorConfig parseYaml(InputStream inputStream) {
        try {
            return fromMap(root(new Yaml().load(inputStream)));
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML configuration: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> loadYaml(String yamlText) {
        try {
            return root(new Yaml().load(yamlText));
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML configuration: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> root(Object loaded) {
        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        return asMap("root", loaded);
    }

    private static CalculatorConfig fromMap(Map<String, Object> root) {
        // The formula section could be at root or under 'formula' key
        Map<String, Object> formula = root.containsKey("formula") ? asMap("formula", root.get("formula")) : root;
        CalculatorConfig defaults = CalculatorConfig.defaults();

        Map<String, Object> cache = section(formula, "cache");
        Map<String, Object> table = section(formula, "table");
        Map<String, Object> parser = section(formula, "parser");
        Map<String, Object> limits = section(formula, "limits");

        TableOptions tableOptions = new TableOptions(
                getBoolean(table, "lalr", defaults.table().lalr()),
                getBoolean(table, "strict-conflicts", defaults.table().strictConflicts()),
                getInt(table, "max-states", defaults.table().maxStates()));

        ParserConfig parserConfig = new ParserConfig(
                getInt(parser, "max-steps", defaults.parser().maxSteps()),
                getInt(parser, "max-stack-depth", defaults.parser().maxStackDepth()),
                getBoolean(parser, "error-recovery", defaults.parser().errorRecovery()),
                getInt(parser, "max-recovery-attempts", defaults.parser().maxRecoveryAttempts()));

        NodeLimits nodeLimits = new NodeLimits(
                getDouble(limits, "max-number-magnitude", defaults.limits().maxNumberMagnitude()),
                getInt(limits, "max-depth", defaults.limits().maxDepth()),
                getInt(limits, "max-nodes", defaults.limits().maxNodes()),
                getInt(limits, "max-arguments", defaults.limits().maxArguments()),
                getInt(limits, "max-variables", defaults.limits().maxVariables()));

        CalculatorConfig config = new CalculatorConfig(
                getInt(formula, "max-formula-length", defaults.maxFormulaLength()),
                getInt(formula, "max-variables", defaults.maxVariables()),
                getInt(formula, "max-multi-steps", defaults.maxMultiSteps()),
                getBoolean(formula, "optimization", defaults.optimization()),
                getBoolean(formula, "validation", defaults.validation()),
                getInt(formula, "optimizer-passes", defaults.optimizerPasses()),
                getBoolean(cache, "enabled", defaults.cacheEnabled()),
                getInt(cache, "capacity", defaults.cacheCapacity()),
                tableOptions,
                parserConfig,
                nodeLimits);

        log.info("Loaded formula configuration: max length {}, cache {} ({}), {} table, error recovery {}",
                config.maxFormulaLength(), config.cacheEnabled() ? "on" : "off", config.cacheCapacity(),
                tableOptions.lalr() ? "LALR(1)" : "LR(1)", parserConfig.errorRecovery() ? "on" : "off");
        return config;
    }

    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? Map.of() : asMap(key, value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(String key, Object value) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'" + key + "' must be a mapping but was: " + value);
        }
        return (Map<String, Object>) value;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer but was: " + value, e);
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number but was: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
