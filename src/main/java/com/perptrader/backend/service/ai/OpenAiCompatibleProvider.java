package com.perptrader.backend.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.HttpClientErrorException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Any endpoint speaking the OpenAI chat-completions dialect (DeepSeek, Qwen compatible mode,
 * self-hosted gateways).
 */
public class OpenAiCompatibleProvider implements AIProvider {

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final AiEndpoint endpoint;
    private final Duration requestTimeout;

    public OpenAiCompatibleProvider(ObjectMapper objectMapper, AiEndpoint endpoint, Duration requestTimeout) {
        this(objectMapper, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                endpoint, requestTimeout);
    }

    OpenAiCompatibleProvider(ObjectMapper objectMapper, HttpClient httpClient, AiEndpoint endpoint, Duration requestTimeout) {
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String getProviderName() {
        return endpoint.getProviderName();
    }

    @Override
    public String executeChatCompletion(String systemPrompt, String userPrompt, int maxTokens, double temperature)
            throws IOException, InterruptedException, HttpClientErrorException {

        ObjectNode requestBody = objectMapper.createObjectNode();
        requestBody.put("model", endpoint.getModel());
        ArrayNode messages = requestBody.putArray("messages");
        ObjectNode systemMessage = messages.addObject();
        systemMessage.put("role", "system");
        systemMessage.put("content", systemPrompt);
        ObjectNode userMessage = messages.addObject();
        userMessage.put("role", "user");
        userMessage.put("content", userPrompt);
        requestBody.put("temperature", temperature);
        requestBody.put("max_tokens", maxTokens);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint.chatCompletionsUrl()))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + endpoint.getApiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(requestBody)))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        HttpStatusCode statusCode = HttpStatusCode.valueOf(response.statusCode());
        if (statusCode.isError()) {
            throw new HttpClientErrorException(statusCode, response.body());
        }

        JsonNode choices = objectMapper.readTree(response.body()).path("choices");
        if (choices.isArray() && !choices.isEmpty()) {
            return choices.get(0).path("message").path("content").asText();
        }
        throw new IOException("API returned an empty choices list: " + response.body());
    }
}
