package com.firewall.hook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firewall.exception.HookInputException;
import com.firewall.policy.Decision;
import com.firewall.policy.PolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Translates pre-tool-use hook requests into policy evaluations and maps the
 * decision to the hook protocol:
 * <ul>
 *   <li>allow: exit 0, no output</li>
 *   <li>ask: exit 0, permission-decision JSON on stdout</li>
 *   <li>block: exit 2, reason on stderr</li>
 * </ul>
 */
public class HookAdapter {

    private static final Logger log = LoggerFactory.getLogger(HookAdapter.class);

    static final String BASH_TOOL = "Bash";
    static final Set<String> EDIT_TOOLS = Set.of("Edit", "MultiEdit", "Write", "NotebookEdit");

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final PolicyEngine policyEngine;

    public HookAdapter(PolicyEngine policyEngine) {
        this.policyEngine = policyEngine;
    }

    /**
     * Handle one raw JSON request.
     */
    public HookResponse handle(String json) {
        HookRequest request;
        try {
            request = parse(json);
        } catch (HookInputException e) {
            log.warn("Rejected hook input: {}", e.getMessage());
            return HookResponse.error("Error: " + e.getMessage());
        }
        return toResponse(evaluate(request));
    }

    /**
     * Route a request to the engine by tool name. Tools that neither run commands nor
     * edit files are allowed.
     */
    public Decision evaluate(HookRequest request) {
        String toolName = request.toolName();
        if (BASH_TOOL.equals(toolName)) {
            return policyEngine.evaluateCommand(request.input("command"));
        }
        if (toolName != null && EDIT_TOOLS.contains(toolName)) {
            String path = request.input("file_path");
            if (path == null) {
                path = request.input("notebook_path");
            }
            return policyEngine.evaluatePathEdit(path);
        }
        log.debug("Tool {} is not checked", toolName);
        return Decision.allow();
    }

    public HookResponse toResponse(Decision decision) {
        return switch (decision.getType()) {
            case ALLOW -> HookResponse.allow();
            case ASK -> HookResponse.ask(askPayload(decision.getReason()));
            case BLOCK -> HookResponse.block("SECURITY: Blocked: " + decision.getReason());
        };
    }

    static HookRequest parse(String json) {
        if (json == null || json.isBlank()) {
            throw new HookInputException("invalid JSON input: empty request");
        }
        HookRequest request;
        try {
            request = objectMapper.readValue(json, HookRequest.class);
        } catch (JsonProcessingException e) {
            throw new HookInputException("invalid JSON input: " + e.getOriginalMessage(), e);
        }
        if (request == null) {
            throw new HookInputException("invalid JSON input: expected an object");
        }
        return request;
    }

    private static String askPayload(String reason) {
        Map<String, Object> specific = new LinkedHashMap<>();
        specific.put("hookEventName", "PreToolUse");
        specific.put("permissionDecision", "ask");
        specific.put("permissionDecisionReason", reason);
        try {
            return objectMapper.writeValueAsString(Map.of("hookSpecificOutput", specific));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize permission decision", e);
        }
    }
}
