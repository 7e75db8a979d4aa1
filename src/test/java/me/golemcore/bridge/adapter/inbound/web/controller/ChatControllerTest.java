package me.golemcore.bridge.adapter.inbound.web.controller;

import me.golemcore.bridge.adapter.inbound.web.dto.ChatPromptRequest;
import me.golemcore.bridge.domain.exception.HostUnavailableException;
import me.golemcore.bridge.domain.model.ChatResult;
import me.golemcore.bridge.domain.model.LlmUsage;
import me.golemcore.bridge.domain.model.LoopState;
import me.golemcore.bridge.domain.system.toolloop.OrchestrationLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatControllerTest {

    private static final String PROMPT = "What time is it in Tokyo?";

    private OrchestrationLoop orchestrationLoop;
    private ChatController controller;

    @BeforeEach
    void setUp() {
        orchestrationLoop = mock(OrchestrationLoop.class);
        controller = new ChatController(orchestrationLoop);
    }

    @Test
    void shouldReturnAnswerWithLoopStats() {
        when(orchestrationLoop.runAsync(PROMPT)).thenReturn(CompletableFuture.completedFuture(
                new ChatResult("It is 19:30", LoopState.DONE, 2, 1, LlmUsage.of(100, 20))));

        StepVerifier.create(controller.chat(new ChatPromptRequest(PROMPT)))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("It is 19:30", response.getBody().getAnswer());
                    assertEquals("DONE", response.getBody().getState());
                    assertEquals(2, response.getBody().getRounds());
                    assertEquals(1, response.getBody().getToolCalls());
                    assertEquals(120, response.getBody().getTotalTokens());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectBlankPrompt() {
        StepVerifier.create(controller.chat(new ChatPromptRequest("  ")))
                .expectError(IllegalArgumentException.class)
                .verify();

        verify(orchestrationLoop, never()).runAsync(anyString());
    }

    @Test
    void shouldPropagateLoopFailure() {
        when(orchestrationLoop.runAsync(PROMPT))
                .thenReturn(CompletableFuture.failedFuture(new HostUnavailableException("spawn failed", null)));

        StepVerifier.create(controller.chat(new ChatPromptRequest(PROMPT)))
                .expectError(HostUnavailableException.class)
                .verify();
    }
}
