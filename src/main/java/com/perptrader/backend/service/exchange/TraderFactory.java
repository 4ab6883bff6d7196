package com.perptrader.backend.service.exchange;

import com.perptrader.backend.config.AgentConfig;
import com.perptrader.backend.config.TraderProperties;
import com.perptrader.backend.model.ExchangeType;
import com.perptrader.backend.service.client.HttpClientService;
import com.perptrader.backend.service.util.Sleeper;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds the exchange adapter an agent is configured for.
 */
@Component
public class TraderFactory {

    private final HttpClientService httpClientService;
    private final TraderProperties properties;
    private final Clock clock;

    public TraderFactory(HttpClientService httpClientService, TraderProperties properties, Clock clock) {
        this.httpClientService = httpClientService;
        this.properties = properties;
        this.clock = clock;
    }

    public Trader create(AgentConfig config) {
        ExchangeType type = config.exchangeType();
        switch (type) {
            case BINANCE:
                return new BinanceFuturesTrader(httpClientService, config.getBinanceApiKey(),
                        config.getBinanceSecretKey(), properties.getBinance(), clock, Sleeper.THREAD);
            case HYPERLIQUID:
                HyperliquidSigner signer = new HyperliquidSigner(config.getHyperliquidPrivateKey(),
                        !config.isHyperliquidTestnet());
                return new HyperliquidTrader(httpClientService, signer, properties.getHyperliquid(),
                        config.isHyperliquidTestnet(), clock);
            case ASTER:
                return new DummyTrader(type.getValue());
            default:
                throw new IllegalStateException("Unhandled exchange type " + type);
        }
    }
}
