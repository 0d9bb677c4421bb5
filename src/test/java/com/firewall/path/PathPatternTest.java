package com.firewall.path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PathPattern classification.
 */
class PathPatternTest {

    @Test
    @DisplayName("Plain paths become literal patterns")
    void literal() {
        PathPattern pattern = PathPattern.of("/etc/hosts");

        assertInstanceOf(LiteralPathPattern.class, pattern);
        assertEquals(PathPatternType.LITERAL, pattern.getType());
        assertFalse(pattern.isGlob());
        assertEquals("/etc/hosts", pattern.raw());
    }

    @Test
    @DisplayName("Wildcards make a glob pattern")
    void glob() {
        PathPattern pattern = PathPattern.of("~/.ssh/*");

        assertInstanceOf(GlobPathPattern.class, pattern);
        assertEquals(PathPatternType.GLOB, pattern.getType());
        assertTrue(pattern.isGlob());
    }

    @Test
    @DisplayName("Blank patterns are rejected")
    void blankRejected() {
        assertThrows(IllegalArgumentException.class, () -> PathPattern.of(" "));
        assertThrows(IllegalArgumentException.class, () -> PathPattern.of(null));
    }

    @Test
    @DisplayName("Patterns compare by value")
    void valueEquality() {
        assertEquals(PathPattern.of("*.pem"), PathPattern.of("*.pem"));
        assertNotEquals(PathPattern.of("/etc"), PathPattern.of("/etc/"));
        assertEquals("*.pem", PathPattern.of("*.pem").toString());
    }
}
