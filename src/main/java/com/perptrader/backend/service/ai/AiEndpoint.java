package com.perptrader.backend.service.ai;

import lombok.Value;

/**
 * Resolved connection settings of one agent's model endpoint.
 */
@Value
public class AiEndpoint {
    String providerName;
    String baseUrl;
    String apiKey;
    String model;

    public String chatCompletionsUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/chat/completions";
    }
}
