package me.golemcore.bridge.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatAnswerResponse {
    private String answer;
    private String state;
    private int rounds;
    private int toolCalls;
    private int totalTokens;
}
