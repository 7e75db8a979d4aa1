package me.golemcore.bridge.domain.system.toolloop;

import me.golemcore.bridge.domain.model.ChatResult;

import java.util.concurrent.CompletableFuture;

/**
 * Drives one prompt through generate, dispatch and feed-back rounds until the
 * model settles on an answer.
 *
 * <p>
 * Recoverable conditions (backend timeout, backend error, exhausted budget)
 * come back as descriptive answers rather than exceptions. Only failures of the
 * tool host channel are raised.
 */
public interface OrchestrationLoop extends AutoCloseable {

    /**
     * Runs a prompt to completion and returns the final answer.
     */
    String chat(String prompt);

    /**
     * Runs a prompt to completion and returns the answer together with the
     * terminal state and counters.
     */
    ChatResult run(String prompt);

    /**
     * Runs {@link #chat(String)} on the orchestration worker pool.
     */
    CompletableFuture<String> chatAsync(String prompt);

    /**
     * Runs {@link #run(String)} on the orchestration worker pool.
     */
    CompletableFuture<ChatResult> runAsync(String prompt);

    /**
     * Connects the tool session ahead of the first prompt.
     */
    void connect();

    /**
     * Releases the tool session. Safe to call repeatedly.
     */
    @Override
    void close();
}
