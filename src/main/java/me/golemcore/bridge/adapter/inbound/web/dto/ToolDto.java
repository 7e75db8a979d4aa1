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
public class ToolDto {
    private String name;
    private String description;
    private List<String> parameters;
    private List<String> required;
}
