package com.perptrader.backend.config;

import com.perptrader.backend.exception.ConfigurationException;
import com.perptrader.backend.model.ExchangeType;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Startup checks for agent configuration. Any violation stops the application.
 */
@Component
public class AgentConfigValidator {

    private static final Set<String> AI_MODELS = Set.of("deepseek", "qwen", "custom");

    public void validate(List<AgentConfig> agents) {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < agents.size(); i++) {
            AgentConfig agent = agents.get(i);
            if (isBlank(agent.getId())) {
                throw new ConfigurationException("trader.agents[" + i + "].id must not be empty");
            }
            if (!ids.add(agent.getId())) {
                throw new ConfigurationException("Duplicate trader id: " + agent.getId());
            }
            // disabled agents may omit credentials
            if (agent.isEnabled()) {
                validate(agent);
            }
        }
    }

    public void validate(AgentConfig agent) {
        String id = agent.getId();
        String aiModel = agent.getAiModel();
        if (aiModel == null || !AI_MODELS.contains(aiModel)) {
            throw new ConfigurationException("Trader " + id + ": ai_model must be one of " + AI_MODELS + ", got " + aiModel);
        }
        if ("deepseek".equals(aiModel) && isBlank(agent.getDeepseekKey())) {
            throw new ConfigurationException("Trader " + id + ": deepseek_key is required for the deepseek model");
        }
        if ("qwen".equals(aiModel) && isBlank(agent.getQwenKey())) {
            throw new ConfigurationException("Trader " + id + ": qwen_key is required for the qwen model");
        }
        if ("custom".equals(aiModel)
                && (isBlank(agent.getCustomApiUrl()) || isBlank(agent.getCustomApiKey()) || isBlank(agent.getCustomModelName()))) {
            throw new ConfigurationException("Trader " + id + ": custom model needs custom_api_url, custom_api_key and custom_model_name");
        }

        ExchangeType exchange = agent.exchangeType();
        if (exchange == ExchangeType.BINANCE
                && (isBlank(agent.getBinanceApiKey()) || isBlank(agent.getBinanceSecretKey()))) {
            throw new ConfigurationException("Trader " + id + ": binance exchange needs binance_api_key and binance_secret_key");
        }
        if (exchange == ExchangeType.HYPERLIQUID && isBlank(agent.getHyperliquidPrivateKey())) {
            throw new ConfigurationException("Trader " + id + ": hyperliquid exchange needs hyperliquid_private_key");
        }
        if (exchange == ExchangeType.ASTER
                && (isBlank(agent.getAsterUser()) || isBlank(agent.getAsterSigner()) || isBlank(agent.getAsterPrivateKey()))) {
            throw new ConfigurationException("Trader " + id + ": aster exchange needs aster_user, aster_signer and aster_private_key");
        }

        if (agent.getInitialBalance() <= 0) {
            throw new ConfigurationException("Trader " + id + ": initial_balance must be greater than 0");
        }
        if (agent.getScanIntervalMinutes() <= 0) {
            throw new ConfigurationException("Trader " + id + ": scan_interval_minutes must be greater than 0");
        }
        if (agent.getBtcEthLeverage() <= 0 || agent.getAltcoinLeverage() <= 0) {
            throw new ConfigurationException("Trader " + id + ": leverage caps must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
