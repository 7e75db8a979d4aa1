package me.golemcore.bridge.adapter.inbound.web.controller;

import me.golemcore.bridge.domain.exception.NotConnectedException;
import me.golemcore.bridge.domain.model.SchemaNode;
import me.golemcore.bridge.domain.model.SchemaType;
import me.golemcore.bridge.domain.model.ToolHostInfo;
import me.golemcore.bridge.domain.model.ToolSpec;
import me.golemcore.bridge.domain.model.TranslatedToolSet;
import me.golemcore.bridge.domain.service.ToolSession;
import me.golemcore.bridge.port.outbound.ModelBackendPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolSessionControllerTest {

    private static final String MODEL = "gemini-2.0-flash";

    @Mock
    private ToolSession toolSession;

    @Mock
    private ModelBackendPort modelBackend;

    private ToolSessionController controller;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(modelBackend.getModel()).thenReturn(MODEL);
        when(modelBackend.isAvailable()).thenReturn(true);
        controller = new ToolSessionController(toolSession, modelBackend);
    }

    private void stubConnected() {
        when(toolSession.isConnected()).thenReturn(true);
        when(toolSession.getHostInfo()).thenReturn(new ToolHostInfo("everything", "0.6.2", "2024-11-05"));
        when(toolSession.listCachedTools()).thenReturn(List.of(
                ToolSpec.builder()
                        .name("echo")
                        .description("Echo text")
                        .parameterSchema(SchemaNode.object(
                                Map.of("text", SchemaNode.of(SchemaType.STRING, null)), List.of("text")))
                        .build(),
                ToolSpec.simple("", "broken")));
        when(toolSession.getTranslatedTools())
                .thenReturn(new TranslatedToolSet(List.of(), List.of("tool '' dropped: tool name is missing")));
    }

    @Test
    void shouldListCachedTools() {
        stubConnected();

        StepVerifier.create(controller.listTools())
                .assertNext(response -> {
                    assertEquals(2, response.getBody().size());
                    assertEquals("echo", response.getBody().get(0).getName());
                    assertEquals(List.of("text"), response.getBody().get(0).getParameters());
                    assertEquals(List.of("text"), response.getBody().get(0).getRequired());
                })
                .verifyComplete();
    }

    @Test
    void shouldFailListingWhenNotConnected() {
        when(toolSession.listCachedTools()).thenThrow(new NotConnectedException("Tool session is not connected"));

        NotConnectedException ex = assertThrows(NotConnectedException.class, () -> controller.listTools());

        assertEquals("Tool session is not connected", ex.getMessage());
    }

    @Test
    void shouldReportConnectedStatus() {
        stubConnected();

        StepVerifier.create(controller.status())
                .assertNext(response -> {
                    assertTrue(response.getBody().isConnected());
                    assertEquals("everything", response.getBody().getHostName());
                    assertEquals("2024-11-05", response.getBody().getProtocolVersion());
                    assertEquals(2, response.getBody().getToolCount());
                    assertEquals(0, response.getBody().getTranslatedToolCount());
                    assertEquals(1, response.getBody().getDiagnostics().size());
                    assertEquals(MODEL, response.getBody().getModel());
                    assertTrue(response.getBody().isModelAvailable());
                })
                .verifyComplete();
    }

    @Test
    void shouldReportDisconnectedStatus() {
        StepVerifier.create(controller.status())
                .assertNext(response -> {
                    assertFalse(response.getBody().isConnected());
                    assertNull(response.getBody().getHostName());
                    assertTrue(response.getBody().getDiagnostics().isEmpty());
                })
                .verifyComplete();
    }

    @Test
    void shouldConnectAndClose() {
        stubConnected();

        StepVerifier.create(controller.connect())
                .assertNext(response -> assertTrue(response.getBody().isConnected()))
                .verifyComplete();
        verify(toolSession).connect();

        when(toolSession.isConnected()).thenReturn(false);
        when(toolSession.getHostInfo()).thenReturn(null);
        StepVerifier.create(controller.close())
                .assertNext(response -> assertFalse(response.getBody().isConnected()))
                .verifyComplete();
        verify(toolSession).close();
    }
}
