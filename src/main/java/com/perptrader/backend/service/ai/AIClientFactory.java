package com.perptrader.backend.service.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.perptrader.backend.config.AgentConfig;
import com.perptrader.backend.config.TraderProperties;
import com.perptrader.backend.service.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds one {@link AIDecisionClient} per agent; clients are never shared.
 */
@Component
public class AIClientFactory {

    private static final Logger logger = LoggerFactory.getLogger(AIClientFactory.class);

    private final ObjectMapper objectMapper;
    private final TraderProperties.Ai settings;

    public AIClientFactory(ObjectMapper objectMapper, TraderProperties properties) {
        this.objectMapper = objectMapper;
        this.settings = properties.getAi();
    }

    public AIDecisionClient create(AgentConfig agent) {
        AiEndpoint endpoint = AiProviderPreset.resolve(agent);
        logger.info("Trader {} uses AI provider {} (model {})", agent.getId(), endpoint.getProviderName(), endpoint.getModel());
        AIProvider provider = new OpenAiCompatibleProvider(objectMapper, endpoint,
                Duration.ofSeconds(Math.max(60, settings.getTimeoutSeconds())));
        return new AIDecisionClient(provider, settings.getMaxAttempts(), settings.getBackoffStepMs(),
                settings.getMaxTokens(), settings.getTemperature(), Sleeper.THREAD);
    }
}
