package com.perptrader.backend.config;

import com.perptrader.backend.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AgentConfigValidatorTest {

    private final AgentConfigValidator validator = new AgentConfigValidator();

    private static AgentConfig binanceAgent(String id) {
        AgentConfig agent = new AgentConfig();
        agent.setId(id);
        agent.setAiModel("deepseek");
        agent.setDeepseekKey("sk");
        agent.setExchange("binance");
        agent.setBinanceApiKey("key");
        agent.setBinanceSecretKey("secret");
        agent.setInitialBalance(1000);
        return agent;
    }

    @Test
    void validate_shouldAcceptCompleteAgents() {
        AgentConfig hyperliquid = binanceAgent("hl");
        hyperliquid.setExchange("hyperliquid");
        hyperliquid.setHyperliquidPrivateKey("0xabc");

        assertDoesNotThrow(() -> validator.validate(List.of(binanceAgent("a"), hyperliquid)));
    }

    @Test
    void validate_shouldRejectDuplicateIds() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> validator.validate(List.of(binanceAgent("a"), binanceAgent("a"))));

        assertTrue(ex.getMessage().contains("Duplicate trader id: a"));
    }

    @Test
    void validate_shouldRejectMissingExchangeCredentials() {
        AgentConfig agent = binanceAgent("a");
        agent.setBinanceSecretKey("");

        assertThrows(ConfigurationException.class, () -> validator.validate(agent));

        AgentConfig aster = binanceAgent("b");
        aster.setExchange("aster");
        aster.setAsterUser("0xuser");
        assertThrows(ConfigurationException.class, () -> validator.validate(aster));
    }

    @Test
    void validate_shouldRejectBadNumbersAndUnknownValues() {
        AgentConfig zeroBalance = binanceAgent("a");
        zeroBalance.setInitialBalance(0);
        assertThrows(ConfigurationException.class, () -> validator.validate(zeroBalance));

        AgentConfig badModel = binanceAgent("b");
        badModel.setAiModel("gpt");
        assertThrows(ConfigurationException.class, () -> validator.validate(badModel));

        AgentConfig badExchange = binanceAgent("c");
        badExchange.setExchange("okx");
        assertThrows(ConfigurationException.class, () -> validator.validate(badExchange));

        AgentConfig badLeverage = binanceAgent("d");
        badLeverage.setAltcoinLeverage(0);
        assertThrows(ConfigurationException.class, () -> validator.validate(badLeverage));
    }

    @Test
    void validate_shouldSkipCredentialChecksForDisabledAgents() {
        AgentConfig disabled = new AgentConfig();
        disabled.setId("off");
        disabled.setEnabled(false);

        assertDoesNotThrow(() -> validator.validate(List.of(disabled)));

        AgentConfig blankId = binanceAgent(" ");
        assertThrows(ConfigurationException.class, () -> validator.validate(List.of(blankId)));
    }
}
