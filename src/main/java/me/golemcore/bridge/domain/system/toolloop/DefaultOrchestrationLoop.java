package me.golemcore.bridge.domain.system.toolloop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.bridge.domain.exception.NotConnectedException;
import me.golemcore.bridge.domain.exception.SessionBrokenException;
import me.golemcore.bridge.domain.exception.ToolHostConnectionException;
import me.golemcore.bridge.domain.model.ChatResult;
import me.golemcore.bridge.domain.model.ConversationState;
import me.golemcore.bridge.domain.model.FunctionCallPart;
import me.golemcore.bridge.domain.model.FunctionResultPart;
import me.golemcore.bridge.domain.model.LlmUsage;
import me.golemcore.bridge.domain.model.LoopState;
import me.golemcore.bridge.domain.model.ModelTurn;
import me.golemcore.bridge.domain.model.ToolFailureKind;
import me.golemcore.bridge.domain.model.ToolResult;
import me.golemcore.bridge.domain.model.TranslatedToolSet;
import me.golemcore.bridge.domain.service.ResultAggregator;
import me.golemcore.bridge.domain.service.ToolSession;
import me.golemcore.bridge.port.outbound.ModelBackendPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tool-calling orchestration loop.
 *
 * <p>
 * Each round generates one model turn under a fixed timeout. Function calls
 * are dispatched sequentially in model order, each outcome wrapped as a
 * function result positionally matched to its call, and the exchange is
 * appended to the conversation before the next round. A turn without calls
 * ends the loop with its text.
 *
 * <p>
 * Every {@link #run} owns its conversation and round counter, so concurrent
 * prompts only share the tool session.
 */
public class DefaultOrchestrationLoop implements OrchestrationLoop {

    private static final Logger log = LoggerFactory.getLogger(DefaultOrchestrationLoop.class);

    static final String MSG_TIMEOUT = "Error: model backend call timed out";
    static final String MSG_BACKEND_ERROR_PREFIX = "Error calling model backend: ";
    static final String MSG_NO_RESPONSE = "No response from model backend";
    static final String MSG_MAX_ITERATIONS = "Maximum iterations reached";

    private final ModelBackendPort modelBackend;
    private final ToolSession toolSession;
    private final ResultAggregator resultAggregator;
    private final int maxRounds;
    private final Duration generateTimeout;
    private final Executor orchestrationExecutor;

    public DefaultOrchestrationLoop(ModelBackendPort modelBackend, ToolSession toolSession,
            ResultAggregator resultAggregator, int maxRounds, Duration generateTimeout,
            Executor orchestrationExecutor) {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be positive: " + maxRounds);
        }
        this.modelBackend = modelBackend;
        this.toolSession = toolSession;
        this.resultAggregator = resultAggregator;
        this.maxRounds = maxRounds;
        this.generateTimeout = generateTimeout;
        this.orchestrationExecutor = orchestrationExecutor;
    }

    @Override
    public String chat(String prompt) {
        return run(prompt).answer();
    }

    @Override
    public CompletableFuture<String> chatAsync(String prompt) {
        return runAsync(prompt).thenApply(ChatResult::answer);
    }

    @Override
    public CompletableFuture<ChatResult> runAsync(String prompt) {
        return CompletableFuture.supplyAsync(() -> run(prompt), orchestrationExecutor);
    }

    @Override
    public void connect() {
        toolSession.connect();
    }

    @Override
    public void close() {
        toolSession.close();
    }

    @Override
    public ChatResult run(String prompt) {
        ensureConnected();

        TranslatedToolSet tools = toolSession.getTranslatedTools();
        ConversationState conversation = new ConversationState(prompt);

        int rounds = 0;
        int toolCalls = 0;
        LlmUsage usage = LlmUsage.of(0, 0);

        while (rounds < maxRounds) {
            rounds++;
            log.debug("[ToolLoop] Round {}/{}: {}", rounds, maxRounds, LoopState.GENERATING);

            ModelTurn turn;
            try {
                turn = generate(conversation, tools);
            } catch (TimeoutException e) {
                log.warn("[ToolLoop] Model backend timed out after {}s in round {}",
                        generateTimeout.toSeconds(), rounds);
                return finish(MSG_TIMEOUT, LoopState.FAILED, rounds, toolCalls, usage);
            } catch (BackendFailure e) {
                log.warn("[ToolLoop] Model backend failed in round {}: {}", rounds, e.getMessage());
                return finish(MSG_BACKEND_ERROR_PREFIX + e.getMessage(), LoopState.FAILED, rounds, toolCalls,
                        usage);
            }

            if (turn == null) {
                return finish(MSG_NO_RESPONSE, LoopState.DONE, rounds, toolCalls, usage);
            }
            usage = usage.plus(turn.getUsage());

            if (resultAggregator.hasFunctionCalls(turn)) {
                List<FunctionCallPart> calls = resultAggregator.functionCalls(turn);
                log.debug("[ToolLoop] Round {}: {} {} call(s)", rounds, LoopState.DISPATCHING, calls.size());

                List<FunctionResultPart> results = dispatch(calls);
                toolCalls += results.size();
                conversation.appendToolExchange(turn.toTurn(), results);
                continue;
            }

            String answer = resultAggregator.mergeText(turn);
            if (answer.isEmpty()) {
                return finish(MSG_NO_RESPONSE, LoopState.DONE, rounds, toolCalls, usage);
            }
            return finish(answer, LoopState.DONE, rounds, toolCalls, usage);
        }

        log.warn("[ToolLoop] No final answer after {} rounds", maxRounds);
        return finish(MSG_MAX_ITERATIONS, LoopState.EXHAUSTED, rounds, toolCalls, usage);
    }

    private void ensureConnected() {
        if (toolSession.isConnected()) {
            return;
        }
        log.debug("[ToolLoop] {}", LoopState.CONNECTING);
        try {
            toolSession.connect();
        } catch (ToolHostConnectionException e) {
            log.error("[ToolLoop] {}: could not connect to tool host: {}", LoopState.FAILED, e.getMessage());
            throw e;
        }
    }

    private ModelTurn generate(ConversationState conversation, TranslatedToolSet tools)
            throws TimeoutException, BackendFailure {
        CompletableFuture<ModelTurn> future;
        try {
            future = modelBackend.generate(conversation, tools);
        } catch (RuntimeException e) {
            throw new BackendFailure(e);
        }

        try {
            return future.get(generateTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new BackendFailure(e);
        } catch (ExecutionException e) {
            throw new BackendFailure(e.getCause() != null ? e.getCause() : e);
        } catch (RuntimeException e) {
            throw new BackendFailure(e);
        }
    }

    private List<FunctionResultPart> dispatch(List<FunctionCallPart> calls) {
        List<FunctionResultPart> results = new ArrayList<>(calls.size());
        for (FunctionCallPart call : calls) {
            Map<String, Object> arguments = resultAggregator.parseArguments(call);
            ToolResult result;
            try {
                result = toolSession.callTool(call.name(), arguments);
            } catch (SessionBrokenException | NotConnectedException e) {
                log.error("[ToolLoop] {}: tool session lost while calling '{}': {}", LoopState.FAILED,
                        call.name(), e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                result = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "Tool execution failed: " + e.getMessage());
            }
            if (!result.isSuccess()) {
                log.debug("[ToolLoop] Tool '{}' failed ({}): {}", call.name(), result.getFailureKind(),
                        result.getError());
            }
            results.add(resultAggregator.toFunctionResult(call, result));
        }
        return results;
    }

    private ChatResult finish(String answer, LoopState state, int rounds, int toolCalls, LlmUsage usage) {
        log.info("[ToolLoop] {} after {} round(s), {} tool call(s), {} tokens", state, rounds, toolCalls,
                usage.getTotalTokens());
        return new ChatResult(answer, state, rounds, toolCalls, usage);
    }

    /**
     * Any model backend fault other than a timeout, carrying the message shown
     * to the caller.
     */
    private static final class BackendFailure extends Exception {

        private static final long serialVersionUID = 1L;

        BackendFailure(Throwable cause) {
            super(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
        }
    }
}
