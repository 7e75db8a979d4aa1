package me.golemcore.bridge.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.bridge.adapter.inbound.web.dto.SessionStatusResponse;
import me.golemcore.bridge.adapter.inbound.web.dto.ToolDto;
import me.golemcore.bridge.domain.model.SchemaNode;
import me.golemcore.bridge.domain.model.ToolHostInfo;
import me.golemcore.bridge.domain.model.ToolSpec;
import me.golemcore.bridge.domain.model.TranslatedToolSet;
import me.golemcore.bridge.domain.service.ToolSession;
import me.golemcore.bridge.port.outbound.ModelBackendPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Tool session lifecycle and cached tool listing.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ToolSessionController {

    private final ToolSession toolSession;
    private final ModelBackendPort modelBackend;

    @GetMapping("/tools")
    public Mono<ResponseEntity<List<ToolDto>>> listTools() {
        List<ToolDto> tools = toolSession.listCachedTools().stream()
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(tools));
    }

    @GetMapping("/session")
    public Mono<ResponseEntity<SessionStatusResponse>> status() {
        return Mono.just(ResponseEntity.ok(buildStatus()));
    }

    @PostMapping("/session/connect")
    public Mono<ResponseEntity<SessionStatusResponse>> connect() {
        // Spawning and handshaking blocks
        return Mono.fromCallable(() -> {
            toolSession.connect();
            return ResponseEntity.ok(buildStatus());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/session/close")
    public Mono<ResponseEntity<SessionStatusResponse>> close() {
        return Mono.fromCallable(() -> {
            toolSession.close();
            return ResponseEntity.ok(buildStatus());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private SessionStatusResponse buildStatus() {
        SessionStatusResponse.SessionStatusResponseBuilder builder = SessionStatusResponse.builder()
                .connected(toolSession.isConnected())
                .model(modelBackend.getModel())
                .modelAvailable(modelBackend.isAvailable())
                .diagnostics(List.of());

        ToolHostInfo info = toolSession.getHostInfo();
        if (info != null) {
            builder.hostName(info.name())
                    .hostVersion(info.version())
                    .protocolVersion(info.protocolVersion());
        }
        if (toolSession.isConnected()) {
            TranslatedToolSet translated = toolSession.getTranslatedTools();
            builder.toolCount(toolSession.listCachedTools().size())
                    .translatedToolCount(translated.size())
                    .diagnostics(translated.diagnostics());
        }
        return builder.build();
    }

    private ToolDto toDto(ToolSpec spec) {
        SchemaNode schema = spec.getParameterSchema();
        List<String> parameters = schema != null && schema.getProperties() != null
                ? new ArrayList<>(schema.getProperties().keySet())
                : List.of();
        List<String> required = schema != null && schema.getRequired() != null ? schema.getRequired() : List.of();
        return ToolDto.builder()
                .name(spec.getName())
                .description(spec.getDescription())
                .parameters(parameters)
                .required(required)
                .build();
    }
}
