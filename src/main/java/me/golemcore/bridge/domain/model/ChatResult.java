package me.golemcore.bridge.domain.model;

/**
 * Detailed outcome of one {@code chat()} call.
 *
 * @param answer
 *            the string returned to the caller, authoritative even on failure
 * @param state
 *            terminal loop state
 * @param rounds
 *            number of generate calls made
 * @param toolCalls
 *            number of tool calls dispatched
 * @param usage
 *            token usage summed over all rounds, may be {@code null}
 */
public record ChatResult(String answer, LoopState state, int rounds, int toolCalls, LlmUsage usage) {
}
