package com.firewall.path;

import com.firewall.core.Platform;

import java.util.regex.PatternSyntaxException;

/**
 * Translates glob patterns into regular-expression fragments.
 * <p>
 * {@code *} becomes a run of characters that are neither whitespace nor a path separator,
 * {@code ?} a single such character, and {@code [...]} a character class ({@code [!...]} negated).
 * Every other character is matched literally.
 */
public final class GlobTranslator {

    private static final String REGEX_META = "\\.^$|?*+()[]{}";

    private GlobTranslator() {
    }

    /**
     * Translate a glob into an unanchored regex fragment.
     *
     * @throws PatternSyntaxException if a character class is not terminated
     */
    public static String toRegex(String glob, Platform platform) {
        String segmentChar = "[^\\s" + platform.separatorClass() + "]";
        StringBuilder sb = new StringBuilder(glob.length() * 2);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> sb.append(segmentChar).append('*');
                case '?' -> sb.append(segmentChar);
                case '[' -> i = appendCharClass(glob, i, sb);
                default -> appendLiteral(c, sb);
            }
            i++;
        }
        return sb.toString();
    }

    /**
     * Escape text so that it matches literally inside a regex.
     */
    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() * 2);
        for (int i = 0; i < text.length(); i++) {
            appendLiteral(text.charAt(i), sb);
        }
        return sb.toString();
    }

    private static int appendCharClass(String glob, int start, StringBuilder sb) {
        int i = start + 1;
        boolean negated = i < glob.length() && (glob.charAt(i) == '!' || glob.charAt(i) == '^');
        if (negated) {
            i++;
        }
        int bodyStart = i;
        // A ']' directly after the opening bracket is a literal member.
        if (i < glob.length() && glob.charAt(i) == ']') {
            i++;
        }
        while (i < glob.length() && glob.charAt(i) != ']') {
            i++;
        }
        if (i >= glob.length()) {
            throw new PatternSyntaxException("Unterminated character class", glob, start);
        }
        sb.append('[');
        if (negated) {
            sb.append('^');
        }
        for (int j = bodyStart; j < i; j++) {
            char c = glob.charAt(j);
            if (c == '-' || Character.isLetterOrDigit(c)) {
                sb.append(c);
            } else {
                sb.append('\\').append(c);
            }
        }
        sb.append(']');
        return i;
    }

    private static void appendLiteral(char c, StringBuilder sb) {
        if (REGEX_META.indexOf(c) >= 0) {
            sb.append('\\');
        }
        sb.append(c);
    }
}
