package com.firewall.path;

import com.firewall.core.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Expands, normalizes and matches filesystem paths against literal and glob patterns.
 * Instances are immutable and safe to share between threads.
 */
public class PathMatcher {

    private static final Logger log = LoggerFactory.getLogger(PathMatcher.class);

    private final PathExpander expander;
    private final Platform platform;

    public PathMatcher(PathExpander expander) {
        this.expander = expander;
        this.platform = expander.platform();
    }

    /**
     * Check if a pattern contains glob wildcards.
     */
    public static boolean isGlob(String pattern) {
        return pattern != null
                && (pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0 || pattern.indexOf('[') >= 0);
    }

    public Platform platform() {
        return platform;
    }

    public String expand(String path) {
        return expander.expand(path);
    }

    /**
     * Expand, then lexically collapse repeated separators and {@code .}/{@code ..} segments.
     * The result is lower-cased on case-insensitive platforms.
     */
    public String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return path;
        }
        String expanded = expand(path);

        String prefix = "";
        String rest = expanded;
        if (platform == Platform.WINDOWS && rest.length() >= 2
                && Character.isLetter(rest.charAt(0)) && rest.charAt(1) == ':') {
            prefix = rest.substring(0, 2);
            rest = rest.substring(2);
        }
        boolean absolute = !rest.isEmpty() && platform.isSeparator(rest.charAt(0));

        Deque<String> segments = new ArrayDeque<>();
        int start = 0;
        for (int i = 0; i <= rest.length(); i++) {
            if (i == rest.length() || platform.isSeparator(rest.charAt(i))) {
                String segment = rest.substring(start, i);
                start = i + 1;
                if (segment.isEmpty() || segment.equals(".")) {
                    continue;
                }
                if (segment.equals("..")) {
                    if (!segments.isEmpty() && !segments.peekLast().equals("..")) {
                        segments.removeLast();
                    } else if (!absolute) {
                        segments.addLast(segment);
                    }
                    continue;
                }
                segments.addLast(segment);
            }
        }

        String separator = String.valueOf(platform.separator());
        StringBuilder sb = new StringBuilder(prefix);
        if (absolute) {
            sb.append(separator);
        }
        sb.append(String.join(separator, segments));
        String normalized = sb.length() == 0 ? "." : sb.toString();
        return platform.isCaseInsensitive() ? normalized.toLowerCase(Locale.ROOT) : normalized;
    }

    /**
     * Check a candidate against a pattern, choosing literal or glob semantics by the pattern type.
     * A glob that cannot be compiled never matches.
     */
    public boolean matches(String candidate, PathPattern pattern) {
        return pattern.isGlob()
                ? matchGlob(candidate, pattern.raw())
                : matchLiteral(candidate, pattern.raw());
    }

    /**
     * True if the normalized candidate equals the normalized pattern or lies beneath it.
     * The prefix must end on a separator boundary, so {@code /etc} does not match {@code /etcetera}.
     */
    public boolean matchLiteral(String candidate, String pattern) {
        if (isBlank(candidate) || isBlank(pattern)) {
            return false;
        }
        return isSameOrBeneath(normalize(candidate), normalize(pattern));
    }

    /**
     * Match the candidate's file name against the glob, and the full normalized path as well
     * when the glob contains separators. Matching is case-insensitive. A glob that cannot be
     * compiled never matches.
     */
    public boolean matchGlob(String candidate, String pattern) {
        if (isBlank(candidate) || isBlank(pattern)) {
            return false;
        }
        try {
            return compile(new GlobPathPattern(pattern)).matches(candidate);
        } catch (PatternSyntaxException e) {
            log.debug("Glob pattern '{}' cannot be compiled, treating as no match: {}", pattern, e.getDescription());
            return false;
        }
    }

    /**
     * Prepare a pattern for repeated matching. Expansion and glob translation happen here,
     * once, instead of on every candidate.
     *
     * @throws PatternSyntaxException if a glob cannot be translated
     */
    public CompiledPathPattern compile(PathPattern pattern) {
        String raw = pattern.raw();
        if (!pattern.isGlob()) {
            return new CompiledPathPattern(pattern, this, normalize(raw), null, null);
        }
        Pattern fileNameRegex = compileGlob(expand(raw));
        Pattern fullPathRegex = containsSeparator(raw) ? compileGlob(normalize(raw)) : null;
        return new CompiledPathPattern(pattern, this, null, fileNameRegex, fullPathRegex);
    }

    boolean isSameOrBeneath(String normalizedCandidate, String normalizedPattern) {
        if (normalizedCandidate.equals(normalizedPattern)) {
            return true;
        }
        if (platform.isSeparator(normalizedPattern.charAt(normalizedPattern.length() - 1))) {
            return normalizedCandidate.startsWith(normalizedPattern);
        }
        return normalizedCandidate.startsWith(normalizedPattern)
                && normalizedCandidate.length() > normalizedPattern.length()
                && platform.isSeparator(normalizedCandidate.charAt(normalizedPattern.length()));
    }

    String fileName(String path) {
        for (int i = path.length() - 1; i >= 0; i--) {
            if (platform.isSeparator(path.charAt(i))) {
                return path.substring(i + 1);
            }
        }
        return path;
    }

    private Pattern compileGlob(String glob) {
        return Pattern.compile(GlobTranslator.toRegex(glob, platform),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private boolean containsSeparator(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            if (platform.isSeparator(pattern.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
