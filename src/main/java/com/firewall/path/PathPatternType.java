package com.firewall.path;

/**
 * Kind of path pattern, decided once when the pattern is loaded.
 */
public enum PathPatternType {
    LITERAL,
    GLOB
}
