package com.firewall.config;

import com.firewall.core.Platform;
import com.firewall.path.PathPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLocator.
 */
class ConfigLocatorTest {

    @TempDir
    Path home;

    @TempDir
    Path project;

    @Test
    @DisplayName("No rule file anywhere yields the empty configuration")
    void nothingFound() {
        ConfigLocator locator = new ConfigLocator(null, Map.of(), home.toString(), Platform.POSIX, false);

        assertTrue(locator.resolveBase().isEmpty());
        assertTrue(locator.locate().isEmpty());
    }

    @Test
    @DisplayName("Project directory is preferred over the home directory")
    void projectBeforeHome() throws IOException {
        write(home.resolve(ConfigLocator.HOOK_DIRECTORY), "readOnlyPaths: [ /from/home ]\n");
        write(project.resolve(ConfigLocator.HOOK_DIRECTORY), "readOnlyPaths: [ /from/project ]\n");

        ConfigLocator locator = new ConfigLocator(null,
                Map.of(ConfigLocator.PROJECT_DIR_VARIABLE, project.toString()), home.toString(), Platform.POSIX, false);

        assertEquals(List.of(PathPattern.of("/from/project")), locator.locate().readOnlyPaths());
    }

    @Test
    @DisplayName("Home directory is used when the project has no rules")
    void homeFallback() throws IOException {
        write(home.resolve(ConfigLocator.HOOK_DIRECTORY), "readOnlyPaths: [ /from/home ]\n");

        ConfigLocator locator = new ConfigLocator(null,
                Map.of(ConfigLocator.PROJECT_DIR_VARIABLE, project.toString()), home.toString(), Platform.POSIX, false);

        assertEquals(List.of(PathPattern.of("/from/home")), locator.locate().readOnlyPaths());
    }

    @Test
    @DisplayName("Legacy location is the last file-system candidate")
    void legacyFallback() throws IOException {
        write(home.resolve(ConfigLocator.LEGACY_DIRECTORY), "noDeletePaths: [ /legacy ]\n");

        ConfigLocator locator = new ConfigLocator(null, Map.of(), home.toString(), Platform.POSIX, false);

        assertEquals(List.of(PathPattern.of("/legacy")), locator.locate().noDeletePaths());
    }

    @Test
    @DisplayName("Explicit path wins over every other location")
    void explicitPathWins() throws IOException {
        write(project.resolve(ConfigLocator.HOOK_DIRECTORY), "readOnlyPaths: [ /from/project ]\n");
        Path explicit = project.resolve("custom.yaml");
        Files.writeString(explicit, "readOnlyPaths: [ /explicit ]\n");

        ConfigLocator locator = new ConfigLocator(explicit.toString(),
                Map.of(ConfigLocator.PROJECT_DIR_VARIABLE, project.toString()), home.toString(), Platform.POSIX, false);

        assertEquals(List.of(PathPattern.of("/explicit")), locator.locate().readOnlyPaths());
    }

    @Test
    @DisplayName("Platform overlay is merged after the base file")
    void overlayMergedAfterBase() throws IOException {
        Path dir = project.resolve(ConfigLocator.HOOK_DIRECTORY);
        write(dir, "readOnlyPaths: [ /base ]\n");
        Files.writeString(dir.resolve("patterns.posix.yaml"), "readOnlyPaths: [ /posix ]\n");
        Files.writeString(dir.resolve("patterns.windows.yaml"), "readOnlyPaths: [ /windows ]\n");

        ConfigLocator locator = new ConfigLocator(null,
                Map.of(ConfigLocator.PROJECT_DIR_VARIABLE, project.toString()), home.toString(), Platform.POSIX, false);

        assertEquals(List.of(PathPattern.of("/base"), PathPattern.of("/posix")), locator.locate().readOnlyPaths());
    }

    @Test
    @DisplayName("Classpath base resolves its overlay on the classpath")
    void classpathOverlay() {
        ConfigLocator locator = new ConfigLocator("classpath:rules/base.yaml", Map.of(), null, Platform.POSIX, false);

        FirewallConfig config = locator.locate();

        assertEquals(2, config.genericRules().size());
        assertEquals("terraform destroy", config.genericRules().get(0).reason());
        assertEquals("elevated privileges", config.genericRules().get(1).reason());
        assertEquals(List.of(PathPattern.of("/var/log/")), config.noDeletePaths());
    }

    @Test
    @DisplayName("Overlay is chosen by platform")
    void overlayByPlatform() {
        ConfigLocator locator = new ConfigLocator("classpath:rules/base.yaml", Map.of(), null, Platform.WINDOWS, false);

        FirewallConfig config = locator.locate();

        assertEquals(List.of(PathPattern.of("/etc/hosts"), PathPattern.of("C:\\Windows\\")), config.readOnlyPaths());
        assertTrue(config.noDeletePaths().isEmpty());
    }

    @Test
    @DisplayName("Bundled rules are the final fallback")
    void bundledFallback() {
        ConfigLocator locator = new ConfigLocator(null, Map.of(), home.toString(), Platform.POSIX, true);

        Optional<Resource> base = locator.resolveBase();

        assertTrue(base.isPresent());
        assertEquals(ConfigLocator.DEFAULT_FILE_NAME, base.get().getFilename());
        assertFalse(locator.locate().isEmpty());
    }

    @Test
    @DisplayName("Overlay name inserts the platform before the extension")
    void overlayFileName() {
        ConfigLocator posix = new ConfigLocator(null, Map.of(), null, Platform.POSIX, false);
        ConfigLocator windows = new ConfigLocator(null, Map.of(), null, Platform.WINDOWS, false);

        assertEquals("patterns.posix.yaml", posix.overlayFileName("patterns.yaml"));
        assertEquals("rules.windows.yml", windows.overlayFileName("rules.yml"));
        assertEquals("rules.posix", posix.overlayFileName("rules"));
        assertNull(posix.overlayFileName(null));
    }

    private static void write(Path dir, String yaml) throws IOException {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(ConfigLocator.DEFAULT_FILE_NAME), yaml);
    }
}
