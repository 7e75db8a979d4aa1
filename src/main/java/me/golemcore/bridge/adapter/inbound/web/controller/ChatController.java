package me.golemcore.bridge.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bridge.adapter.inbound.web.dto.ChatAnswerResponse;
import me.golemcore.bridge.adapter.inbound.web.dto.ChatPromptRequest;
import me.golemcore.bridge.domain.model.ChatResult;
import me.golemcore.bridge.domain.system.toolloop.OrchestrationLoop;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Runs prompts through the orchestration loop.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final OrchestrationLoop orchestrationLoop;

    @PostMapping
    public Mono<ResponseEntity<ChatAnswerResponse>> chat(@RequestBody ChatPromptRequest request) {
        if (request == null || request.getPrompt() == null || request.getPrompt().isBlank()) {
            return Mono.error(new IllegalArgumentException("prompt is required"));
        }
        log.debug("[API] Chat prompt received ({} chars)", request.getPrompt().length());
        return Mono.fromFuture(() -> orchestrationLoop.runAsync(request.getPrompt()))
                .map(result -> ResponseEntity.ok(toResponse(result)));
    }

    private ChatAnswerResponse toResponse(ChatResult result) {
        return ChatAnswerResponse.builder()
                .answer(result.answer())
                .state(result.state().name())
                .rounds(result.rounds())
                .toolCalls(result.toolCalls())
                .totalTokens(result.usage() != null ? result.usage().getTotalTokens() : 0)
                .build();
    }
}
