package com.firewall.policy;

import com.firewall.config.FirewallConfig;
import com.firewall.core.Platform;
import com.firewall.operation.CommandPatternSet;
import com.firewall.path.PathExpander;
import com.firewall.path.PathMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Default implementation of PolicyEngine.
 * Rules are compiled once at construction; evaluation only reads the compiled {@link RuleStore}.
 */
public class DefaultPolicyEngine implements PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultPolicyEngine.class);

    private final RuleStore rules;

    public DefaultPolicyEngine(FirewallConfig config, Platform platform) {
        this(config, new PathMatcher(PathExpander.system(platform)), CommandPatternSet.defaults());
    }

    public DefaultPolicyEngine(FirewallConfig config, PathMatcher pathMatcher, CommandPatternSet patternSet) {
        this.rules = RuleStore.compile(config, pathMatcher, patternSet);

        log.debug("PolicyEngine initialized for {} with {} rules", pathMatcher.platform(), config.size());
    }

    @Override
    public Decision evaluateCommand(String command) {
        if (command == null || command.isBlank()) {
            return Decision.allow();
        }

        // Generic rules run first so path-independent policy overrides the path tiers
        for (RuleStore.CompiledGenericRule generic : rules.getGenericRules()) {
            if (generic.matches(command)) {
                Decision decision = generic.rule().ask()
                        ? Decision.ask(generic.rule().reason())
                        : Decision.block(generic.rule().reason());
                return logged(command, decision);
            }
        }

        for (RuleStore.ReferenceMatcher zeroAccess : rules.getZeroAccess()) {
            if (zeroAccess.matches(command)) {
                String raw = zeroAccess.pattern().raw();
                return logged(command, Decision.block(zeroAccessReason(raw), null, raw));
            }
        }

        for (RuleStore.OperationMatcher readOnly : rules.getReadOnly()) {
            Optional<String> operation = CommandPatternSet.matchAny(command, readOnly.rules());
            if (operation.isPresent()) {
                String raw = readOnly.pattern().raw();
                return logged(command, Decision.block(
                        operation.get() + " operation on read-only path " + raw, operation.get(), raw));
            }
        }

        for (RuleStore.OperationMatcher noDelete : rules.getNoDelete()) {
            Optional<String> operation = CommandPatternSet.matchAny(command, noDelete.rules());
            if (operation.isPresent()) {
                String raw = noDelete.pattern().raw();
                return logged(command, Decision.block(
                        operation.get() + " operation on no-delete path " + raw, operation.get(), raw));
            }
        }

        log.debug("Command allowed: {}", command);
        return Decision.allow();
    }

    @Override
    public Decision evaluatePathEdit(String path) {
        if (path == null || path.isBlank()) {
            return Decision.allow();
        }

        for (RuleStore.ReferenceMatcher zeroAccess : rules.getZeroAccess()) {
            if (zeroAccess.path().matches(path)) {
                String raw = zeroAccess.pattern().raw();
                return logged(path, Decision.block(zeroAccessReason(raw), null, raw));
            }
        }
        for (RuleStore.OperationMatcher readOnly : rules.getReadOnly()) {
            if (readOnly.path().matches(path)) {
                String raw = readOnly.pattern().raw();
                return logged(path, Decision.block("read-only path " + raw, null, raw));
            }
        }

        log.debug("Edit allowed: {}", path);
        return Decision.allow();
    }

    @Override
    public Platform getPlatform() {
        return rules.getPlatform();
    }

    @Override
    public FirewallConfig getConfig() {
        return rules.getConfig();
    }

    private static String zeroAccessReason(String pattern) {
        return "zero-access path " + pattern + " (no operations allowed)";
    }

    private static Decision logged(String input, Decision decision) {
        log.info("{} '{}': {}", decision.getType(), input, decision.getReason());
        return decision;
    }
}
