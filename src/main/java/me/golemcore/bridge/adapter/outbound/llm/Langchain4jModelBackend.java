package me.golemcore.bridge.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bridge.domain.model.ConversationState;
import me.golemcore.bridge.domain.model.FunctionCallPart;
import me.golemcore.bridge.domain.model.FunctionResultPart;
import me.golemcore.bridge.domain.model.LlmUsage;
import me.golemcore.bridge.domain.model.ModelTurn;
import me.golemcore.bridge.domain.model.Part;
import me.golemcore.bridge.domain.model.TextPart;
import me.golemcore.bridge.domain.model.TranslatedToolSet;
import me.golemcore.bridge.domain.model.Turn;
import me.golemcore.bridge.port.outbound.ModelBackendPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Model backend over a langchain4j {@link ChatModel}.
 *
 * <p>
 * Each generate call runs on the backend's own worker pool. Cancelling the
 * returned future interrupts the worker, which abandons the HTTP request on a
 * best-effort basis.
 *
 * <p>
 * Conversation mapping:
 * <ul>
 * <li>the prompt becomes the first {@link UserMessage}
 * <li>a model turn becomes an {@link AiMessage} with its text and tool
 * execution requests
 * <li>each function result becomes a {@link ToolExecutionResultMessage} whose
 * text is the JSON of the response mapping
 * </ul>
 * Calls without an id get a positional one, reused by the matching result.
 */
@Slf4j
public class Langchain4jModelBackend implements ModelBackendPort {

    private final Supplier<ChatModel> chatModelSupplier;
    private final String modelName;
    private final Supplier<Boolean> availability;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    private volatile ChatModel chatModel;

    public Langchain4jModelBackend(ChatModelFactory chatModelFactory, ObjectMapper objectMapper,
            ExecutorService executor) {
        this(chatModelFactory::create, chatModelFactory.getModelName(), chatModelFactory::isConfigured,
                objectMapper, executor);
    }

    // Visible for testing
    Langchain4jModelBackend(Supplier<ChatModel> chatModelSupplier, String modelName, Supplier<Boolean> availability,
            ObjectMapper objectMapper, ExecutorService executor) {
        this.chatModelSupplier = chatModelSupplier;
        this.modelName = modelName;
        this.availability = availability;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<ModelTurn> generate(ConversationState conversation, TranslatedToolSet tools) {
        CompletableFuture<ModelTurn> result = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                result.complete(doGenerate(conversation, tools));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((turn, ex) -> {
            if (result.isCancelled()) {
                log.debug("[LLM] Generate cancelled, interrupting worker");
                task.cancel(true);
            }
        });
        return result;
    }

    @Override
    public String getModel() {
        return modelName;
    }

    @Override
    public boolean isAvailable() {
        return Boolean.TRUE.equals(availability.get());
    }

    private ModelTurn doGenerate(ConversationState conversation, TranslatedToolSet tools) {
        ChatModel model = getChatModel();
        List<ChatMessage> messages = convertConversation(conversation);

        ChatRequest.Builder request = ChatRequest.builder().messages(messages);
        if (tools != null && !tools.isEmpty()) {
            log.trace("[LLM] Calling model with {} tools", tools.size());
            request.toolSpecifications(tools.specifications());
        }

        ChatResponse response = model.chat(request.build());
        return convertResponse(response);
    }

    private ChatModel getChatModel() {
        ChatModel current = chatModel;
        if (current == null) {
            synchronized (this) {
                current = chatModel;
                if (current == null) {
                    current = chatModelSupplier.get();
                    chatModel = current;
                    log.info("[LLM] Model backend initialized with model: {}", modelName);
                }
            }
        }
        return current;
    }

    List<ChatMessage> convertConversation(ConversationState conversation) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(UserMessage.from(conversation.getPrompt()));

        List<Turn> turns = conversation.getTurns();
        for (int turnIndex = 0; turnIndex < turns.size(); turnIndex++) {
            Turn turn = turns.get(turnIndex);
            if (turn.role() == Turn.Role.MODEL) {
                messages.add(convertModelTurn(turn, turnIndex));
            } else {
                // A user turn always answers the model turn right before it
                messages.addAll(convertResults(turn, turnIndex - 1));
            }
        }
        return messages;
    }

    private AiMessage convertModelTurn(Turn turn, int turnIndex) {
        StringBuilder text = new StringBuilder();
        List<ToolExecutionRequest> requests = new ArrayList<>();
        int callIndex = 0;
        for (Part part : turn.parts()) {
            if (part instanceof TextPart textPart && textPart.text() != null) {
                text.append(textPart.text());
            } else if (part instanceof FunctionCallPart call) {
                requests.add(ToolExecutionRequest.builder()
                        .id(callId(call.id(), turnIndex, callIndex))
                        .name(call.name())
                        .arguments(argumentsJson(call))
                        .build());
                callIndex++;
            }
        }

        if (requests.isEmpty()) {
            return AiMessage.from(text.toString());
        }
        return text.isEmpty() ? AiMessage.from(requests) : AiMessage.from(text.toString(), requests);
    }

    private List<ChatMessage> convertResults(Turn turn, int callTurnIndex) {
        List<ChatMessage> messages = new ArrayList<>();
        List<FunctionResultPart> results = turn.functionResults();
        for (int i = 0; i < results.size(); i++) {
            FunctionResultPart result = results.get(i);
            messages.add(ToolExecutionResultMessage.from(
                    callId(result.id(), callTurnIndex, i),
                    result.name(),
                    toJson(result.response())));
        }
        return messages;
    }

    ModelTurn convertResponse(ChatResponse response) {
        if (response == null || response.aiMessage() == null) {
            return ModelTurn.builder().model(modelName).build();
        }
        AiMessage aiMessage = response.aiMessage();

        List<Part> parts = new ArrayList<>();
        if (aiMessage.text() != null && !aiMessage.text().isEmpty()) {
            parts.add(new TextPart(aiMessage.text()));
        }
        if (aiMessage.hasToolExecutionRequests()) {
            for (ToolExecutionRequest request : aiMessage.toolExecutionRequests()) {
                // Raw JSON is kept; the loop decides how to parse it
                parts.add(FunctionCallPart.ofJson(request.id(), request.name(), request.arguments()));
            }
            log.trace("[LLM] Parsed {} function calls from response", aiMessage.toolExecutionRequests().size());
        }

        return ModelTurn.builder()
                .parts(parts)
                .usage(convertUsage(response.tokenUsage()))
                .model(modelName)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private LlmUsage convertUsage(TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return null;
        }
        int input = tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0;
        int output = tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0;
        return LlmUsage.of(input, output);
    }

    private String argumentsJson(FunctionCallPart call) {
        if (call.argumentsJson() != null) {
            return replayableJson(call);
        }
        return toJson(call.arguments() != null ? call.arguments() : Map.of());
    }

    // Providers re-parse replayed arguments, so only a JSON object goes back
    private String replayableJson(FunctionCallPart call) {
        try {
            JsonNode node = objectMapper.readTree(call.argumentsJson());
            if (node != null && node.isObject()) {
                return objectMapper.writeValueAsString(node);
            }
        } catch (JsonProcessingException e) {
            log.debug("[LLM] Replaying malformed arguments of '{}' as an empty object: {}", call.name(),
                    e.getOriginalMessage());
        }
        return "{}";
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize value: {}", e.getMessage());
            return "{}";
        }
    }

    private static String callId(String id, int turnIndex, int callIndex) {
        return id != null && !id.isBlank() ? id : "call_" + turnIndex + "_" + callIndex;
    }
}
