package me.golemcore.bridge.domain.model;

/**
 * States of the orchestration loop for a single {@code chat()} call.
 */
public enum LoopState {

    IDLE,
    CONNECTING,
    GENERATING,
    DISPATCHING,

    /**
     * Final answer produced, including the fixed no-response message.
     */
    DONE,

    /**
     * The tool session could not be established or broke mid-round, or the
     * model backend timed out or failed. Backend failures still carry their
     * fixed error message as the answer.
     */
    FAILED,

    /**
     * Round budget used up without a final answer.
     */
    EXHAUSTED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == EXHAUSTED;
    }
}
