package me.golemcore.bridge.domain.model;

/**
 * Machine-readable classification of tool call failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The tool host reported an error: invalid arguments, an unknown tool, a
     * backend fault inside the tool, or a result flagged {@code isError}.
     */
    TOOL_ERROR,

    /**
     * The tool host did not answer within the per-call timeout.
     */
    TIMEOUT,

    /**
     * The call failed on the client side for a reason other than a broken
     * channel (unexpected exception, interrupted wait).
     */
    EXECUTION_FAILED
}
