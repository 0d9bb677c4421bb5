package com.firewall.operation;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Classes of file-modifying operations recognized in command text.
 */
public enum OperationType {
    WRITE,
    APPEND,
    EDIT,
    MOVE_COPY,
    DELETE,
    PERMISSION,
    TRUNCATE;

    private static final Set<OperationType> MODIFYING =
            Collections.unmodifiableSet(EnumSet.allOf(OperationType.class));
    private static final Set<OperationType> DELETION =
            Collections.unmodifiableSet(EnumSet.of(DELETE));

    /**
     * Every operation that changes a file; blocked on read-only paths.
     */
    public static Set<OperationType> modifying() {
        return MODIFYING;
    }

    /**
     * Deletion only; blocked on no-delete paths.
     */
    public static Set<OperationType> deletion() {
        return DELETION;
    }
}
