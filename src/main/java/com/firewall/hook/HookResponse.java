package com.firewall.hook;

/**
 * What the hook process reports back to the assistant.
 *
 * @param exitCode 0 to proceed (allow or ask), 2 to block, 1 for a non-blocking error
 * @param stdout   Text for standard output, empty if none
 * @param stderr   Text for standard error, empty if none
 */
public record HookResponse(
        int exitCode,
        String stdout,
        String stderr
) {
    public static final int EXIT_ALLOW = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_BLOCK = 2;

    public static HookResponse allow() {
        return new HookResponse(EXIT_ALLOW, "", "");
    }

    public static HookResponse ask(String payload) {
        return new HookResponse(EXIT_ALLOW, payload, "");
    }

    public static HookResponse block(String message) {
        return new HookResponse(EXIT_BLOCK, "", message);
    }

    public static HookResponse error(String message) {
        return new HookResponse(EXIT_ERROR, "", message);
    }
}
