package com.firewall.config;

import com.firewall.core.Platform;
import com.firewall.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the base rule file and its platform overlay, and merges them.
 * <p>
 * Base file candidates, first existing wins:
 * <ol>
 *   <li>an explicitly configured path</li>
 *   <li>{@code $CLAUDE_PROJECT_DIR/.claude/hooks/damage-control/patterns.yaml}</li>
 *   <li>{@code ~/.claude/hooks/damage-control/patterns.yaml}</li>
 *   <li>{@code ~/.claude/patterns.yaml} (legacy location)</li>
 *   <li>the bundled {@code classpath:patterns.yaml}</li>
 * </ol>
 * The overlay sits next to the base file and carries the platform in its name,
 * e.g. {@code patterns.windows.yaml}.
 */
public class ConfigLocator {

    private static final Logger log = LoggerFactory.getLogger(ConfigLocator.class);

    public static final String PROJECT_DIR_VARIABLE = "CLAUDE_PROJECT_DIR";
    public static final String DEFAULT_FILE_NAME = "patterns.yaml";
    static final String HOOK_DIRECTORY = ".claude/hooks/damage-control";
    static final String LEGACY_DIRECTORY = ".claude";

    private final String explicitPath;
    private final Map<String, String> environment;
    private final String home;
    private final Platform platform;
    private final boolean includeBundled;

    public ConfigLocator(String explicitPath, Map<String, String> environment, String home,
                         Platform platform, boolean includeBundled) {
        this.explicitPath = explicitPath;
        this.environment = environment != null ? environment : Map.of();
        this.home = home;
        this.platform = platform;
        this.includeBundled = includeBundled;
    }

    /**
     * Locator over the process environment, falling back to the bundled rules.
     */
    public static ConfigLocator system(String explicitPath, Platform platform) {
        return new ConfigLocator(explicitPath, System.getenv(), System.getProperty("user.home"), platform, true);
    }

    /**
     * Locate, load and merge the base rules with the platform overlay.
     * If no rule file exists the empty configuration is returned and everything will be allowed.
     *
     * @throws ConfigurationException if a located file cannot be parsed
     */
    public FirewallConfig locate() {
        Optional<Resource> base = resolveBase();
        if (base.isEmpty()) {
            log.warn("No firewall rule file found; all commands and edits will be allowed");
            return FirewallConfig.empty();
        }
        FirewallConfig baseConfig = ConfigLoader.load(base.get());
        FirewallConfig overlayConfig = resolveOverlay(base.get())
                .map(ConfigLoader::load)
                .orElse(FirewallConfig.empty());
        return ConfigMerge.merge(baseConfig, overlayConfig);
    }

    /**
     * Candidate base files in priority order, whether or not they exist.
     */
    public List<Resource> candidates() {
        List<Resource> candidates = new ArrayList<>();
        if (explicitPath != null && !explicitPath.isBlank()) {
            candidates.add(ConfigLoader.getResource(explicitPath));
        }
        String projectDir = environment.get(PROJECT_DIR_VARIABLE);
        if (projectDir != null && !projectDir.isBlank()) {
            candidates.add(fileResource(Path.of(projectDir, HOOK_DIRECTORY, DEFAULT_FILE_NAME)));
        }
        if (home != null && !home.isBlank()) {
            candidates.add(fileResource(Path.of(home, HOOK_DIRECTORY, DEFAULT_FILE_NAME)));
            candidates.add(fileResource(Path.of(home, LEGACY_DIRECTORY, DEFAULT_FILE_NAME)));
        }
        if (includeBundled) {
            candidates.add(new ClassPathResource(DEFAULT_FILE_NAME));
        }
        return candidates;
    }

    public Optional<Resource> resolveBase() {
        for (Resource candidate : candidates()) {
            if (candidate.exists()) {
                log.debug("Using base rule file {}", candidate.getDescription());
                return Optional.of(candidate);
            }
            log.debug("Rule file candidate not found: {}", candidate.getDescription());
        }
        return Optional.empty();
    }

    /**
     * The overlay for a base file, if it exists.
     */
    public Optional<Resource> resolveOverlay(Resource base) {
        String overlayName = overlayFileName(base.getFilename());
        if (overlayName == null) {
            return Optional.empty();
        }
        try {
            Resource overlay = base.createRelative(overlayName);
            if (overlay.exists()) {
                log.debug("Using {} overlay {}", platform, overlay.getDescription());
                return Optional.of(overlay);
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new ConfigurationException("Cannot resolve overlay next to " + base.getDescription(), e);
        }
    }

    /**
     * Overlay file name for a base file name: {@code patterns.yaml} becomes {@code patterns.posix.yaml}.
     */
    String overlayFileName(String baseFileName) {
        if (baseFileName == null || baseFileName.isBlank()) {
            return null;
        }
        int dot = baseFileName.lastIndexOf('.');
        String stem = dot > 0 ? baseFileName.substring(0, dot) : baseFileName;
        String extension = dot > 0 ? baseFileName.substring(dot) : "";
        return stem + "." + platform.fileSuffix() + extension;
    }

    private static Resource fileResource(Path path) {
        return new FileSystemResource(path);
    }
}
