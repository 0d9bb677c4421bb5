package com.firewall.path;

/**
 * A path matched by equality or as a directory prefix.
 */
public record LiteralPathPattern(String raw) implements PathPattern {

    @Override
    public PathPatternType getType() {
        return PathPatternType.LITERAL;
    }

    @Override
    public String toString() {
        return raw;
    }
}
