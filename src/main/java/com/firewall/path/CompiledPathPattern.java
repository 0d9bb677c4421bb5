package com.firewall.path;

import java.util.regex.Pattern;

/**
 * A {@link PathPattern} prepared for repeated matching against edit paths.
 * Literal patterns keep their normalized text; glob patterns keep their compiled regexes.
 * Created by {@link PathMatcher#compile(PathPattern)}.
 */
public final class CompiledPathPattern {

    private final PathPattern pattern;
    private final PathMatcher matcher;
    private final String normalizedLiteral;
    private final Pattern fileNameRegex;
    private final Pattern fullPathRegex;

    CompiledPathPattern(PathPattern pattern, PathMatcher matcher, String normalizedLiteral,
                        Pattern fileNameRegex, Pattern fullPathRegex) {
        this.pattern = pattern;
        this.matcher = matcher;
        this.normalizedLiteral = normalizedLiteral;
        this.fileNameRegex = fileNameRegex;
        this.fullPathRegex = fullPathRegex;
    }

    public PathPattern pattern() {
        return pattern;
    }

    public boolean matches(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        String normalized = matcher.normalize(candidate);
        if (normalizedLiteral != null) {
            return matcher.isSameOrBeneath(normalized, normalizedLiteral);
        }
        if (fileNameRegex.matcher(matcher.fileName(normalized)).matches()) {
            return true;
        }
        return fullPathRegex != null && fullPathRegex.matcher(normalized).matches();
    }

    @Override
    public String toString() {
        return pattern.raw();
    }
}
