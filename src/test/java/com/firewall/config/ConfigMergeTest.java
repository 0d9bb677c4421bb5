package com.firewall.config;

import com.firewall.path.PathPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigMerge.
 */
class ConfigMergeTest {

    private final FirewallConfig base = FirewallConfig.builder()
            .genericRule(GenericRule.block("\\brm\\s+-rf\\b", "rm -rf"))
            .genericRule(GenericRule.ask("\\bgit\\s+reset\\b", "git reset"))
            .zeroAccess("~/.ssh/")
            .readOnly("/etc/hosts", "*.lock")
            .noDelete("README.md")
            .build();

    private final FirewallConfig overlay = FirewallConfig.builder()
            .genericRule(GenericRule.ask("\\bsudo\\b", "elevated privileges"))
            .zeroAccess("~/.aws/credentials")
            .noDelete("/var/log/", "LICENSE")
            .build();

    @Test
    @DisplayName("Each field is the base list followed by the overlay list")
    void shouldConcatenateFieldWise() {
        FirewallConfig merged = ConfigMerge.merge(base, overlay);

        assertEquals(List.of(
                GenericRule.block("\\brm\\s+-rf\\b", "rm -rf"),
                GenericRule.ask("\\bgit\\s+reset\\b", "git reset"),
                GenericRule.ask("\\bsudo\\b", "elevated privileges")), merged.genericRules());
        assertEquals(List.of(PathPattern.of("~/.ssh/"), PathPattern.of("~/.aws/credentials")),
                merged.zeroAccessPaths());
        assertEquals(List.of(PathPattern.of("/etc/hosts"), PathPattern.of("*.lock")),
                merged.readOnlyPaths());
        assertEquals(List.of(PathPattern.of("README.md"), PathPattern.of("/var/log/"), PathPattern.of("LICENSE")),
                merged.noDeletePaths());
    }

    @Test
    @DisplayName("Empty is the identity on both sides")
    void emptyIsIdentity() {
        assertEquals(base, ConfigMerge.merge(base, FirewallConfig.empty()));
        assertEquals(base, ConfigMerge.merge(FirewallConfig.empty(), base));
        assertEquals(base, ConfigMerge.merge(base, null));
        assertTrue(ConfigMerge.merge(null, null).isEmpty());
    }

    @Test
    @DisplayName("Merge does not modify its inputs")
    void inputsUnchanged() {
        ConfigMerge.merge(base, overlay);

        assertEquals(2, base.genericRules().size());
        assertEquals(1, overlay.genericRules().size());
    }

    @Test
    @DisplayName("Merged configuration is read-only")
    void mergedIsImmutable() {
        FirewallConfig merged = ConfigMerge.merge(base, overlay);

        assertThrows(UnsupportedOperationException.class,
                () -> merged.readOnlyPaths().add(PathPattern.of("/tmp")));
        assertEquals(10, merged.size());
    }
}
