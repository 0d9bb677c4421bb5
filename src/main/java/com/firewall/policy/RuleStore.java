package com.firewall.policy;

import com.firewall.config.FirewallConfig;
import com.firewall.config.GenericRule;
import com.firewall.core.Platform;
import com.firewall.operation.CommandPatternSet;
import com.firewall.operation.CompiledOperationRule;
import com.firewall.operation.OperationType;
import com.firewall.path.CompiledPathPattern;
import com.firewall.path.PathMatcher;
import com.firewall.path.PathPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A {@link FirewallConfig} compiled for one platform.
 * Rules whose regex cannot be compiled are left out; the rest keep their configured order.
 */
public final class RuleStore {

    private static final Logger log = LoggerFactory.getLogger(RuleStore.class);

    private final FirewallConfig config;
    private final Platform platform;
    private final List<CompiledGenericRule> genericRules;
    private final List<ReferenceMatcher> zeroAccess;
    private final List<OperationMatcher> readOnly;
    private final List<OperationMatcher> noDelete;

    private RuleStore(FirewallConfig config, Platform platform,
                      List<CompiledGenericRule> genericRules,
                      List<ReferenceMatcher> zeroAccess,
                      List<OperationMatcher> readOnly,
                      List<OperationMatcher> noDelete) {
        this.config = config;
        this.platform = platform;
        this.genericRules = List.copyOf(genericRules);
        this.zeroAccess = List.copyOf(zeroAccess);
        this.readOnly = List.copyOf(readOnly);
        this.noDelete = List.copyOf(noDelete);
    }

    /**
     * Compile every tier of the configuration for the matcher's platform.
     */
    public static RuleStore compile(FirewallConfig config, PathMatcher matcher, CommandPatternSet patternSet) {
        List<CompiledGenericRule> generic = new ArrayList<>();
        for (GenericRule rule : config.genericRules()) {
            if (rule.pattern() == null || rule.pattern().isBlank()) {
                log.warn("Skipping generic rule without a pattern");
                continue;
            }
            try {
                Pattern regex = Pattern.compile(rule.pattern(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                generic.add(new CompiledGenericRule(rule, regex));
            } catch (PatternSyntaxException e) {
                log.warn("Skipping generic rule with invalid regex '{}': {}", rule.pattern(), e.getDescription());
            }
        }

        List<ReferenceMatcher> zeroAccess = new ArrayList<>();
        for (PathPattern pattern : config.zeroAccessPaths()) {
            try {
                zeroAccess.add(new ReferenceMatcher(pattern, matcher.compile(pattern),
                        patternSet.compileReference(pattern, matcher)));
            } catch (PatternSyntaxException e) {
                skip("zero-access", pattern, e);
            }
        }

        List<OperationMatcher> readOnly = compileOperations(
                config.readOnlyPaths(), OperationType.modifying(), "read-only", matcher, patternSet);
        List<OperationMatcher> noDelete = compileOperations(
                config.noDeletePaths(), OperationType.deletion(), "no-delete", matcher, patternSet);

        log.debug("Compiled rules for {}: {} generic, {} zero-access, {} read-only, {} no-delete",
                matcher.platform(), generic.size(), zeroAccess.size(), readOnly.size(), noDelete.size());
        return new RuleStore(config, matcher.platform(), generic, zeroAccess, readOnly, noDelete);
    }

    private static List<OperationMatcher> compileOperations(List<PathPattern> patterns,
                                                            Set<OperationType> types,
                                                            String tier,
                                                            PathMatcher matcher,
                                                            CommandPatternSet patternSet) {
        List<OperationMatcher> result = new ArrayList<>();
        for (PathPattern pattern : patterns) {
            try {
                result.add(new OperationMatcher(pattern, matcher.compile(pattern),
                        patternSet.compile(pattern, types, matcher)));
            } catch (PatternSyntaxException e) {
                skip(tier, pattern, e);
            }
        }
        return result;
    }

    private static void skip(String tier, PathPattern pattern, PatternSyntaxException e) {
        log.warn("Skipping {} path '{}': cannot compile ({})", tier, pattern.raw(), e.getDescription());
    }

    public FirewallConfig getConfig() {
        return config;
    }

    public Platform getPlatform() {
        return platform;
    }

    public List<CompiledGenericRule> getGenericRules() {
        return genericRules;
    }

    public List<ReferenceMatcher> getZeroAccess() {
        return zeroAccess;
    }

    public List<OperationMatcher> getReadOnly() {
        return readOnly;
    }

    public List<OperationMatcher> getNoDelete() {
        return noDelete;
    }

    /**
     * A generic rule with its compiled regex.
     */
    public record CompiledGenericRule(GenericRule rule, Pattern regex) {

        public boolean matches(String command) {
            return regex.matcher(command).find();
        }
    }

    /**
     * Fires when a protected path is mentioned anywhere in a command.
     * {@code path} matches edit paths against the same pattern.
     */
    public record ReferenceMatcher(PathPattern pattern, CompiledPathPattern path, List<Pattern> references) {

        public boolean matches(String command) {
            for (Pattern reference : references) {
                if (reference.matcher(command).find()) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Operation templates compiled against one protected path.
     */
    public record OperationMatcher(PathPattern pattern, CompiledPathPattern path, List<CompiledOperationRule> rules) {
    }
}
