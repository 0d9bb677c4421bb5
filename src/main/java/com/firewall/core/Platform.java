package com.firewall.core;

import java.util.Locale;

/**
 * Command-line platform whose syntax and path conventions the rules are evaluated against.
 */
public enum Platform {

    POSIX('/', "/", false),
    WINDOWS('\\', "/\\", true);

    private final char separator;
    private final String separators;
    private final boolean caseInsensitive;

    Platform(char separator, String separators, boolean caseInsensitive) {
        this.separator = separator;
        this.separators = separators;
        this.caseInsensitive = caseInsensitive;
    }

    /**
     * Preferred path separator used when normalizing.
     */
    public char separator() {
        return separator;
    }

    /**
     * Check if the character separates path segments on this platform.
     */
    public boolean isSeparator(char c) {
        return separators.indexOf(c) >= 0;
    }

    /**
     * Whether paths compare case-insensitively.
     */
    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    /**
     * Regex character-class body (without brackets) matching any path separator.
     */
    public String separatorClass() {
        return this == WINDOWS ? "/\\\\" : "/";
    }

    /**
     * Detect the platform of the running JVM.
     */
    public static Platform current() {
        return fromOsName(System.getProperty("os.name", ""));
    }

    static Platform fromOsName(String osName) {
        return osName.toLowerCase(Locale.ROOT).startsWith("windows") ? WINDOWS : POSIX;
    }

    /**
     * Parse a platform name as used in properties and overlay file names.
     * Accepts "posix", "windows" and the aliases "linux", "macos", "darwin", "win".
     * "auto" or a blank value detects the running platform.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static Platform parse(String name) {
        if (name == null || name.isBlank()) {
            return current();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> current();
            case "posix", "linux", "macos", "darwin", "unix" -> POSIX;
            case "windows", "win", "win32" -> WINDOWS;
            default -> throw new IllegalArgumentException("Unknown platform: " + name);
        };
    }

    /**
     * Lower-case name used for overlay files, e.g. {@code patterns.windows.yaml}.
     */
    public String fileSuffix() {
        return name().toLowerCase(Locale.ROOT);
    }
}
