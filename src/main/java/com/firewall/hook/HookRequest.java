package com.firewall.hook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Pre-tool-use request sent by the assistant on standard input.
 * Only the fields the firewall needs are bound; everything else is ignored.
 *
 * @param toolName  Name of the tool about to run, e.g. "Bash" or "Edit"
 * @param toolInput Tool arguments
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HookRequest(
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("tool_input") Map<String, Object> toolInput
) {
    public HookRequest {
        toolInput = toolInput == null ? Map.of() : toolInput;
    }

    /**
     * String value of a tool argument, or null if absent.
     */
    public String input(String key) {
        Object value = toolInput.get(key);
        return value != null ? value.toString() : null;
    }
}
