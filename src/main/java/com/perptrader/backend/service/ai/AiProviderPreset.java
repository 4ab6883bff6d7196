package com.perptrader.backend.service.ai;

import com.perptrader.backend.config.AgentConfig;
import com.perptrader.backend.exception.ConfigurationException;

import java.util.Locale;

public enum AiProviderPreset {
    DEEPSEEK("deepseek", "https://api.deepseek.com/v1", "deepseek-chat"),
    QWEN("qwen", "https://dashscope.aliyuncs.com/compatible-mode/v1", "qwen-plus"),
    CUSTOM("custom", null, null);

    private final String value;
    private final String baseUrl;
    private final String model;

    AiProviderPreset(String value, String baseUrl, String model) {
        this.value = value;
        this.baseUrl = baseUrl;
        this.model = model;
    }

    public String getValue() {
        return value;
    }

    public static AiProviderPreset fromValue(String value) {
        if (value != null) {
            for (AiProviderPreset preset : values()) {
                if (preset.value.equals(value.toLowerCase(Locale.ROOT))) {
                    return preset;
                }
            }
        }
        throw new ConfigurationException("Unsupported ai_model: " + value);
    }

    /**
     * Endpoint for an agent, taking URL and model from the preset unless it is {@link #CUSTOM}.
     */
    public static AiEndpoint resolve(AgentConfig agent) {
        AiProviderPreset preset = fromValue(agent.getAiModel());
        switch (preset) {
            case DEEPSEEK:
                return new AiEndpoint(preset.value, preset.baseUrl, requireKey(agent.getDeepseekKey(), preset), preset.model);
            case QWEN:
                return new AiEndpoint(preset.value, preset.baseUrl, requireKey(agent.getQwenKey(), preset), preset.model);
            default:
                if (isBlank(agent.getCustomApiUrl()) || isBlank(agent.getCustomModelName())) {
                    throw new ConfigurationException("Custom AI provider needs custom_api_url and custom_model_name");
                }
                return new AiEndpoint(preset.value, agent.getCustomApiUrl(),
                        requireKey(agent.getCustomApiKey(), preset), agent.getCustomModelName());
        }
    }

    private static String requireKey(String key, AiProviderPreset preset) {
        if (isBlank(key)) {
            throw new ConfigurationException("AI API key is not set for provider " + preset.value);
        }
        return key;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
