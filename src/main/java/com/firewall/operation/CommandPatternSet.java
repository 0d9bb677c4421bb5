package com.firewall.operation;

import com.firewall.core.Platform;
import com.firewall.path.GlobTranslator;
import com.firewall.path.PathMatcher;
import com.firewall.path.PathPattern;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static com.firewall.operation.OperationType.APPEND;
import static com.firewall.operation.OperationType.DELETE;
import static com.firewall.operation.OperationType.EDIT;
import static com.firewall.operation.OperationType.MOVE_COPY;
import static com.firewall.operation.OperationType.PERMISSION;
import static com.firewall.operation.OperationType.TRUNCATE;
import static com.firewall.operation.OperationType.WRITE;

/**
 * Per-platform table of operation templates, and the compilation of those templates
 * against protected path patterns.
 * <p>
 * Matching is a text heuristic over the whole command line. Quoting, variable indirection
 * and command substitution can hide a path from it; it is not a shell parser.
 */
public final class CommandPatternSet {

    private static final CommandPatternSet DEFAULTS = new CommandPatternSet(defaultTable());

    private final Map<Platform, List<OperationRule>> table;

    public CommandPatternSet(Map<Platform, List<OperationRule>> table) {
        this.table = new EnumMap<>(Platform.class);
        table.forEach((platform, rules) -> this.table.put(platform, List.copyOf(rules)));
    }

    /**
     * The built-in POSIX shell and Windows cmd/PowerShell templates.
     */
    public static CommandPatternSet defaults() {
        return DEFAULTS;
    }

    /**
     * Templates for a platform restricted to the given operation classes, in declared order.
     */
    public List<OperationRule> rules(Platform platform, Set<OperationType> types) {
        List<OperationRule> result = new ArrayList<>();
        for (OperationRule rule : table.getOrDefault(platform, List.of())) {
            if (types.contains(rule.type())) {
                result.add(rule);
            }
        }
        return result;
    }

    /**
     * Regex fragments recognizing a protected path inside command text: the pattern as written
     * and, when expansion changes it, the expanded form. Literal text is escaped; glob wildcards
     * are translated.
     *
     * @throws java.util.regex.PatternSyntaxException if a glob cannot be translated
     */
    public List<String> pathFragments(PathPattern pattern, PathMatcher matcher) {
        Set<String> forms = new LinkedHashSet<>();
        forms.add(matcher.expand(pattern.raw()));
        forms.add(pattern.raw());

        List<String> fragments = new ArrayList<>(forms.size());
        for (String form : forms) {
            fragments.add(pattern.isGlob()
                    ? GlobTranslator.toRegex(form, matcher.platform())
                    : GlobTranslator.escape(form));
        }
        return fragments;
    }

    /**
     * Compile a matcher that fires whenever the path is mentioned anywhere in a command.
     */
    public List<Pattern> compileReference(PathPattern pattern, PathMatcher matcher) {
        List<Pattern> compiled = new ArrayList<>();
        for (String fragment : pathFragments(pattern, matcher)) {
            compiled.add(Pattern.compile(fragment, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        return compiled;
    }

    /**
     * Compile the templates of the given operation classes against a protected path.
     * Order follows the table; for each template the expanded form precedes the raw form.
     *
     * @throws java.util.regex.PatternSyntaxException if the path cannot be turned into a regex
     */
    public List<CompiledOperationRule> compile(PathPattern pattern, Set<OperationType> types, PathMatcher matcher) {
        List<String> fragments = pathFragments(pattern, matcher);
        List<CompiledOperationRule> compiled = new ArrayList<>();
        for (OperationRule rule : rules(matcher.platform(), types)) {
            for (String fragment : fragments) {
                compiled.add(rule.compile(fragment));
            }
        }
        return compiled;
    }

    /**
     * Scan a command against compiled rules; the first rule that matches wins.
     *
     * @return Name of the matched operation, or empty if none matched
     */
    public static Optional<String> matchAny(String command, List<CompiledOperationRule> rules) {
        for (CompiledOperationRule rule : rules) {
            if (rule.matches(command)) {
                return Optional.of(rule.operation());
            }
        }
        return Optional.empty();
    }

    private static Map<Platform, List<OperationRule>> defaultTable() {
        Map<Platform, List<OperationRule>> table = new EnumMap<>(Platform.class);
        table.put(Platform.POSIX, List.of(
                // ahead of the bare redirect, which would claim ": > file" as a write
                posix(TRUNCATE, "truncate", ":\\s*>\\s*{path}"),
                posix(WRITE, "write", "(?<!>)>\\s*[\"']?{path}"),
                posix(WRITE, "write", "\\btee\\b(?!.*\\s-a\\b).*{path}"),
                posix(APPEND, "append", ">>\\s*[\"']?{path}"),
                posix(APPEND, "append", "\\btee\\s+.*-a\\b.*{path}"),
                posix(EDIT, "edit", "\\bsed\\s+(?:.*\\s)?-(?:[a-z]*i|-in-place).*{path}"),
                posix(EDIT, "edit", "\\bperl\\s+-[^\\s]*i.*{path}"),
                posix(EDIT, "edit", "\\bawk\\s+-i\\s+inplace.*{path}"),
                posix(MOVE_COPY, "move", "\\bmv\\s+(?:.*\\s)?[\"']?{path}"),
                posix(MOVE_COPY, "copy", "\\bcp\\s+.*\\s[\"']?{path}"),
                posix(DELETE, "delete", "\\brm\\s+.*{path}"),
                posix(DELETE, "delete", "\\bunlink\\s+.*{path}"),
                posix(DELETE, "delete", "\\brmdir\\s+.*{path}"),
                posix(DELETE, "delete", "\\bshred\\s+.*{path}"),
                posix(PERMISSION, "chmod", "\\bchmod\\s+.*{path}"),
                posix(PERMISSION, "chown", "\\bchown\\s+.*{path}"),
                posix(PERMISSION, "chgrp", "\\bchgrp\\s+.*{path}"),
                posix(TRUNCATE, "truncate", "\\btruncate\\s+.*{path}")
        ));
        table.put(Platform.WINDOWS, List.of(
                windows(WRITE, "write", "(?<!>)>\\s*[\"']?{path}"),
                windows(WRITE, "write", "\\bSet-Content\\b.*{path}"),
                windows(WRITE, "write", "\\bOut-File\\b.*{path}"),
                windows(WRITE, "write", "\\bNew-Item\\b.*{path}"),
                windows(APPEND, "append", ">>\\s*[\"']?{path}"),
                windows(APPEND, "append", "\\bAdd-Content\\b.*{path}"),
                windows(EDIT, "edit", "\\bGet-Content\\b.*{path}.*-replace\\b"),
                windows(MOVE_COPY, "move", "\\bmove\\s+(?:.*\\s)?[\"']?{path}"),
                windows(MOVE_COPY, "move", "\\bMove-Item\\b.*{path}"),
                windows(MOVE_COPY, "rename", "\\bren(?:ame)?\\s+.*{path}"),
                windows(MOVE_COPY, "rename", "\\bRename-Item\\b.*{path}"),
                windows(MOVE_COPY, "copy", "\\bcopy\\s+.*\\s[\"']?{path}"),
                windows(MOVE_COPY, "copy", "\\bxcopy\\s+.*{path}"),
                windows(MOVE_COPY, "copy", "\\brobocopy\\s+.*{path}"),
                windows(MOVE_COPY, "copy", "\\bCopy-Item\\b.*{path}"),
                windows(DELETE, "delete", "\\bdel\\s+.*{path}"),
                windows(DELETE, "delete", "\\berase\\s+.*{path}"),
                windows(DELETE, "delete", "\\brd\\s+.*{path}"),
                windows(DELETE, "delete", "\\brmdir\\s+.*{path}"),
                windows(DELETE, "delete", "\\bRemove-Item\\b.*{path}"),
                windows(PERMISSION, "icacls", "\\bicacls\\s+.*{path}"),
                windows(PERMISSION, "takeown", "\\btakeown\\s+.*{path}"),
                windows(PERMISSION, "attrib", "\\battrib\\s+.*{path}"),
                windows(PERMISSION, "Set-Acl", "\\bSet-Acl\\b.*{path}"),
                windows(TRUNCATE, "truncate", "\\bClear-Content\\b.*{path}"),
                windows(TRUNCATE, "truncate", "\\bfsutil\\s+file\\s+setzerodata\\b.*{path}")
        ));
        return table;
    }

    private static OperationRule posix(OperationType type, String operation, String template) {
        return new OperationRule(type, operation, template, Platform.POSIX);
    }

    private static OperationRule windows(OperationType type, String operation, String template) {
        return new OperationRule(type, operation, template, Platform.WINDOWS);
    }
}
