package com.perptrader.backend.service.ai;

import com.perptrader.backend.config.AgentConfig;
import com.perptrader.backend.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class AiProviderPresetTest {

    @Test
    void resolve_shouldUseDeepseekPreset() {
        AgentConfig agent = new AgentConfig();
        agent.setAiModel("deepseek");
        agent.setDeepseekKey("sk-test");

        AiEndpoint endpoint = AiProviderPreset.resolve(agent);

        assertEquals("deepseek", endpoint.getProviderName());
        assertEquals("https://api.deepseek.com/v1/chat/completions", endpoint.chatCompletionsUrl());
        assertEquals("deepseek-chat", endpoint.getModel());
        assertEquals("sk-test", endpoint.getApiKey());
    }

    @Test
    void resolve_shouldUseQwenKeyForQwen() {
        AgentConfig agent = new AgentConfig();
        agent.setAiModel("QWEN");
        agent.setQwenKey("qk");

        AiEndpoint endpoint = AiProviderPreset.resolve(agent);

        assertEquals("qwen-plus", endpoint.getModel());
        assertEquals("qk", endpoint.getApiKey());
    }

    @Test
    void resolve_shouldTakeCustomSettingsVerbatim() {
        AgentConfig agent = new AgentConfig();
        agent.setAiModel("custom");
        agent.setCustomApiUrl("http://localhost:8000/v1/");
        agent.setCustomApiKey("local");
        agent.setCustomModelName("llama-3-70b");

        AiEndpoint endpoint = AiProviderPreset.resolve(agent);

        assertEquals("http://localhost:8000/v1/chat/completions", endpoint.chatCompletionsUrl());
        assertEquals("llama-3-70b", endpoint.getModel());
    }

    @Test
    void resolve_shouldRejectMissingKeyAndUnknownModel() {
        AgentConfig noKey = new AgentConfig();
        noKey.setAiModel("deepseek");
        assertThrows(ConfigurationException.class, () -> AiProviderPreset.resolve(noKey));

        assertThrows(ConfigurationException.class, () -> AiProviderPreset.fromValue("gpt-4"));
        assertThrows(ConfigurationException.class, () -> AiProviderPreset.fromValue(null));
    }
}
