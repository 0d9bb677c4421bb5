package com.firewall.path;

import com.firewall.core.Platform;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands home-directory shorthand and environment-variable references in paths.
 * <p>
 * Supported forms: a leading {@code ~}, {@code $VAR} and {@code ${VAR}} on every platform,
 * and {@code %VAR%} on Windows. References to undefined variables are left verbatim.
 * The environment is captured at construction, so expansion is deterministic.
 */
public final class PathExpander {

    private static final Pattern POSIX_VARIABLE =
            Pattern.compile("\\$(?:\\{([A-Za-z_][A-Za-z0-9_]*)}|([A-Za-z_][A-Za-z0-9_]*))");
    private static final Pattern WINDOWS_VARIABLE =
            Pattern.compile("%([A-Za-z_][A-Za-z0-9_()]*)%");

    private final Map<String, String> environment;
    private final String home;
    private final Platform platform;

    public PathExpander(Map<String, String> environment, String home, Platform platform) {
        this.platform = platform;
        this.home = home;
        this.environment = new HashMap<>();
        if (environment != null) {
            environment.forEach((key, value) -> this.environment.put(keyFor(key), value));
        }
    }

    /**
     * Expander backed by the process environment and the {@code user.home} property.
     */
    public static PathExpander system(Platform platform) {
        return new PathExpander(System.getenv(), System.getProperty("user.home"), platform);
    }

    public Platform platform() {
        return platform;
    }

    /**
     * Expand a path.
     *
     * @param path Path as typed by a user or written in a rule file, may be null
     * @return Expanded path, or the input unchanged if there is nothing to expand
     */
    public String expand(String path) {
        if (path == null || path.isEmpty()) {
            return path;
        }
        String result = expandHome(path);
        result = replaceVariables(result, POSIX_VARIABLE);
        if (platform == Platform.WINDOWS) {
            result = replaceVariables(result, WINDOWS_VARIABLE);
        }
        return result;
    }

    private String expandHome(String path) {
        if (home == null || !path.startsWith("~")) {
            return path;
        }
        if (path.length() == 1) {
            return home;
        }
        if (platform.isSeparator(path.charAt(1))) {
            return home + path.substring(1);
        }
        return path;
    }

    private String replaceVariables(String input, Pattern pattern) {
        Matcher m = pattern.matcher(input);
        if (!m.find()) {
            return input;
        }
        StringBuilder sb = new StringBuilder();
        do {
            String name = m.group(1) != null ? m.group(1) : m.group(m.groupCount());
            String value = environment.get(keyFor(name));
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group()));
        } while (m.find());
        m.appendTail(sb);
        return sb.toString();
    }

    private String keyFor(String name) {
        return platform.isCaseInsensitive() ? name.toUpperCase(Locale.ROOT) : name;
    }
}
