package com.firewall.config;

import com.firewall.exception.ConfigurationException;
import com.firewall.path.PathPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads firewall rules from YAML files.
 * <p>
 * Recognized keys (kebab-case aliases in parentheses):
 * <pre>
 * bashToolPatterns (generic-rules):  - { pattern: "\\bsudo\\b", reason: "...", ask: true }
 * zeroAccessPaths  (zero-access-paths): [ "~/.ssh/*" ]
 * readOnlyPaths    (read-only-paths):   [ "/etc/*" ]
 * noDeletePaths    (no-delete-paths):   [ "~/.claude/" ]
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Load rules from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the rule file
     * @return Loaded configuration, empty if the document is empty
     * @throws ConfigurationException if the file cannot be read or parsed
     */
    public static FirewallConfig load(String path) {
        log.info("Loading firewall rules from: {}", path);
        return load(getResource(path));
    }

    /**
     * Load rules from a Spring resource.
     */
    public static FirewallConfig load(Resource resource) {
        try (InputStream inputStream = resource.getInputStream()) {
            FirewallConfig config = parse(new Yaml().load(inputStream), resource.getDescription());
            log.info("Loaded {} rules from {}: {} generic, {} zero-access, {} read-only, {} no-delete",
                    config.size(), resource.getDescription(), config.genericRules().size(),
                    config.zeroAccessPaths().size(), config.readOnlyPaths().size(), config.noDeletePaths().size());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load rules from: " + resource.getDescription(), e);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + resource.getDescription() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse rules from YAML text.
     */
    public static FirewallConfig parse(String yaml) {
        try {
            return parse(new Yaml().load(new StringReader(yaml)), "inline YAML");
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML: " + e.getMessage(), e);
        }
    }

    static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            String resourcePath = path.substring(CLASSPATH_PREFIX.length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static FirewallConfig parse(Object document, String source) {
        if (document == null) {
            log.warn("Rule file {} is empty", source);
            return FirewallConfig.empty();
        }
        if (!(document instanceof Map<?, ?>)) {
            throw new ConfigurationException("Rule file " + source + " must contain a mapping at the top level");
        }
        Map<String, Object> root = (Map<String, Object>) document;

        List<GenericRule> genericRules = parseGenericRules(
                getList(root, source, "bashToolPatterns", "generic-rules"), source);
        List<PathPattern> zeroAccess = parsePaths(
                getList(root, source, "zeroAccessPaths", "zero-access-paths"), source, "zeroAccessPaths");
        List<PathPattern> readOnly = parsePaths(
                getList(root, source, "readOnlyPaths", "read-only-paths"), source, "readOnlyPaths");
        List<PathPattern> noDelete = parsePaths(
                getList(root, source, "noDeletePaths", "no-delete-paths"), source, "noDeletePaths");

        return new FirewallConfig(genericRules, zeroAccess, readOnly, noDelete);
    }

    @SuppressWarnings("unchecked")
    private static List<GenericRule> parseGenericRules(List<Object> list, String source) {
        List<GenericRule> rules = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            Object item = list.get(i);
            String pattern;
            String reason = null;
            boolean ask = false;
            if (item instanceof Map<?, ?> map) {
                Map<String, Object> ruleMap = (Map<String, Object>) map;
                pattern = getString(ruleMap, "pattern", null);
                reason = getString(ruleMap, "reason", null);
                ask = getBoolean(ruleMap, "ask", false);
            } else if (item != null) {
                pattern = item.toString();
            } else {
                pattern = null;
            }

            if (pattern == null || pattern.isBlank()) {
                log.warn("Skipping generic rule {} in {}: no pattern", i, source);
                continue;
            }
            rules.add(new GenericRule(pattern, reason, ask));
            log.debug("Parsed generic rule: pattern={}, ask={}", pattern, ask);
        }
        return rules;
    }

    private static List<PathPattern> parsePaths(List<Object> list, String source, String field) {
        List<PathPattern> patterns = new ArrayList<>();
        for (Object item : list) {
            if (item == null || item.toString().isBlank()) {
                log.warn("Skipping blank entry in {} of {}", field, source);
                continue;
            }
            patterns.add(PathPattern.of(item.toString().trim()));
        }
        return patterns;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> getList(Map<String, Object> root, String source, String key, String alias) {
        Object value = root.containsKey(key) ? root.get(key) : root.get(alias);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?>)) {
            throw new ConfigurationException("'" + key + "' in " + source + " must be a list");
        }
        return (List<Object>) value;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
