package com.firewall.path;

/**
 * A protected path as written in a rule file, tagged as literal or glob.
 */
public interface PathPattern {

    /**
     * The pattern exactly as written, before any expansion.
     */
    String raw();

    /**
     * Get the pattern type.
     */
    PathPatternType getType();

    default boolean isGlob() {
        return getType() == PathPatternType.GLOB;
    }

    /**
     * Classify a raw pattern string.
     *
     * @param raw Pattern text, must not be blank
     * @return a {@link GlobPathPattern} if the text contains a wildcard, otherwise a {@link LiteralPathPattern}
     */
    static PathPattern of(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Path pattern must not be blank");
        }
        return PathMatcher.isGlob(raw) ? new GlobPathPattern(raw) : new LiteralPathPattern(raw);
    }
}
