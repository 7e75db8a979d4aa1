package me.golemcore.bridge.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionStatusResponse {
    private boolean connected;
    private String hostName;
    private String hostVersion;
    private String protocolVersion;
    private int toolCount;
    private int translatedToolCount;
    private List<String> diagnostics;
    private String model;
    private boolean modelAvailable;
}
