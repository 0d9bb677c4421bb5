package com.firewall.path;

/**
 * A path pattern containing {@code *}, {@code ?} or {@code [...]} wildcards.
 */
public record GlobPathPattern(String raw) implements PathPattern {

    @Override
    public PathPatternType getType() {
        return PathPatternType.GLOB;
    }

    @Override
    public String toString() {
        return raw;
    }
}
