package com.perptrader.backend.service.ai;

import org.springframework.web.client.HttpClientErrorException;

import java.io.IOException;

/**
 * A chat-completion endpoint. One call is one HTTP round trip; retries belong to the caller.
 */
public interface AIProvider {

    /**
     * @return the provider name shown in status output, e.g. "deepseek".
     */
    String getProviderName();

    /**
     * Sends a system and a user message and returns the first choice's content.
     *
     * @throws IOException on transport failures or an unusable response body
     * @throws InterruptedException if the calling thread is interrupted
     * @throws HttpClientErrorException if the endpoint answers with an HTTP error
     */
    String executeChatCompletion(String systemPrompt, String userPrompt, int maxTokens, double temperature)
            throws IOException, InterruptedException, HttpClientErrorException;
}
