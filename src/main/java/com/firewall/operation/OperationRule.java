package com.firewall.operation;

import com.firewall.core.Platform;

import java.util.regex.Pattern;

/**
 * A command-syntax template recognizing one operation applied to a path.
 *
 * @param type      Operation class the template belongs to
 * @param operation Name reported when the template matches (e.g. "delete", "chmod")
 * @param template  Regex containing a {@value #PATH_PLACEHOLDER} placeholder for the path fragment
 * @param platform  Platform whose command syntax the template describes
 */
public record OperationRule(
        OperationType type,
        String operation,
        String template,
        Platform platform
) {
    public static final String PATH_PLACEHOLDER = "{path}";

    public OperationRule {
        if (!template.contains(PATH_PLACEHOLDER)) {
            throw new IllegalArgumentException("Template for '" + operation + "' has no " + PATH_PLACEHOLDER);
        }
    }

    /**
     * Substitute a path regex fragment into the template and compile it case-insensitively.
     *
     * @throws java.util.regex.PatternSyntaxException if the resulting regex is invalid
     */
    public CompiledOperationRule compile(String pathRegex) {
        Pattern pattern = Pattern.compile(template.replace(PATH_PLACEHOLDER, pathRegex),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return new CompiledOperationRule(operation, pattern);
    }
}
