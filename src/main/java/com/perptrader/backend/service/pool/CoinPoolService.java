package com.perptrader.backend.service.pool;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.perptrader.backend.config.TraderProperties;
import com.perptrader.backend.exception.TradingException;
import com.perptrader.backend.model.CandidateCoin;
import com.perptrader.backend.model.CoinInfo;
import com.perptrader.backend.model.MergedCoinPool;
import com.perptrader.backend.model.OpenInterestTopEntry;
import com.perptrader.backend.service.client.HttpClientService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Candidate pool backed by two remote rankings, with a file cache as fallback and a fixed list
 * of mainstream coins as the last resort. Shared by all agents.
 */
@Service
public class CoinPoolService implements CoinPoolProvider {

    private static final Logger logger = LoggerFactory.getLogger(CoinPoolService.class);

    public static final List<String> DEFAULT_MAINSTREAM_COINS = List.of(
            "BTCUSDT", "ETHUSDT", "SOLUSDT", "BNBUSDT", "XRPUSDT", "DOGEUSDT", "ADAUSDT", "HYPEUSDT");

    static final String COIN_CACHE_FILE = "latest.json";
    static final String OI_TOP_CACHE_FILE = "oi_top_latest.json";

    private final HttpClientService httpClientService;
    private final ObjectMapper objectMapper;
    private final TraderProperties.CoinPool config;
    private final Clock clock;
    private final Cache<Integer, MergedCoinPool> mergedPoolCache;

    public CoinPoolService(HttpClientService httpClientService, ObjectMapper objectMapper,
                           TraderProperties properties, Clock clock) {
        this.httpClientService = httpClientService;
        this.objectMapper = objectMapper;
        this.config = properties.getCoinPool();
        this.clock = clock;
        this.mergedPoolCache = Caffeine.newBuilder()
                .maximumSize(16)
                .expireAfterWrite(Math.max(0, config.getMemoryCacheMinutes()), TimeUnit.MINUTES)
                .build();
    }

    @Override
    public MergedCoinPool getMergedPool(int limit) {
        if (config.getMemoryCacheMinutes() <= 0) {
            return buildMergedPool(limit);
        }
        return mergedPoolCache.get(limit, this::buildMergedPool);
    }

    MergedCoinPool buildMergedPool(int limit) {
        List<String> ai500Symbols;
        try {
            ai500Symbols = getTopRatedCoins(limit);
        } catch (TradingException e) {
            logger.warn("AI500 list unavailable: {}", e.getMessage());
            ai500Symbols = List.of();
        }
        List<OpenInterestTopEntry> oiTop = getOpenInterestTop();

        Map<String, Set<String>> sources = new LinkedHashMap<>();
        for (String symbol : ai500Symbols) {
            sources.computeIfAbsent(symbol, s -> new LinkedHashSet<>()).add(CandidateCoin.SOURCE_AI500);
        }
        for (OpenInterestTopEntry entry : oiTop) {
            entry.setSymbol(normalizeSymbol(entry.getSymbol()));
            sources.computeIfAbsent(entry.getSymbol(), s -> new LinkedHashSet<>())
                    .add(CandidateCoin.SOURCE_OI_TOP);
        }

        logger.info("Coin pool merged: AI500={}, OI_Top={}, total(unique)={}",
                ai500Symbols.size(), oiTop.size(), sources.size());
        return MergedCoinPool.builder()
                .allSymbols(new ArrayList<>(sources.keySet()))
                .symbolSources(sources)
                .oiTopEntries(oiTop)
                .build();
    }

    /**
     * The {@code limit} highest-scored available coins, best first.
     */
    public List<String> getTopRatedCoins(int limit) {
        List<CoinInfo> available = getCoinPool().stream()
                .filter(CoinInfo::isAvailable)
                .sorted(Comparator.comparingDouble(CoinInfo::getScore).reversed())
                .collect(Collectors.toList());
        if (available.isEmpty()) {
            throw new TradingException("No available coins in the pool");
        }
        return available.stream()
                .limit(limit)
                .map(coin -> normalizeSymbol(coin.getPair()))
                .collect(Collectors.toList());
    }

    public List<CoinInfo> getCoinPool() {
        if (!config.getCustomCoins().isEmpty()) {
            logger.info("Using custom coin list: {}", config.getCustomCoins());
            return toCoins(config.getCustomCoins());
        }
        if (config.isUseDefaultCoins()) {
            logger.info("Default mainstream coin list enabled");
            return toCoins(DEFAULT_MAINSTREAM_COINS);
        }
        if (isBlank(config.getAi500Url())) {
            logger.info("No coin pool URL configured, using default mainstream coins");
            return toCoins(DEFAULT_MAINSTREAM_COINS);
        }

        List<CoinInfo> coins = fetchWithRetry("AI500", this::fetchCoinPool);
        if (coins != null) {
            saveCache(COIN_CACHE_FILE, "coins", coins);
            return coins;
        }

        List<CoinInfo> cached = loadCache(COIN_CACHE_FILE, "coins", new TypeReference<List<CoinInfo>>() { });
        if (cached != null) {
            logger.info("Using cached coin pool ({} coins)", cached.size());
            return cached;
        }
        logger.info("Coin pool cache unavailable, using default mainstream coins");
        return toCoins(DEFAULT_MAINSTREAM_COINS);
    }

    /**
     * Open-interest ranking; empty when not configured or unavailable.
     */
    public List<OpenInterestTopEntry> getOpenInterestTop() {
        if (isBlank(config.getOiTopUrl())) {
            return List.of();
        }
        List<OpenInterestTopEntry> entries = fetchWithRetry("OI Top", this::fetchOpenInterestTop);
        if (entries != null) {
            saveCache(OI_TOP_CACHE_FILE, "positions", entries);
            return entries;
        }
        List<OpenInterestTopEntry> cached = loadCache(OI_TOP_CACHE_FILE, "positions",
                new TypeReference<List<OpenInterestTopEntry>>() { });
        if (cached != null) {
            logger.info("Using cached OI Top data ({} symbols)", cached.size());
            return cached;
        }
        logger.info("OI Top cache unavailable, skipping OI Top data");
        return List.of();
    }

    private <T> T fetchWithRetry(String name, Supplier<T> fetcher) {
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                logger.info("Retrying {} request ({}/{})", name, attempt, maxAttempts);
                pause();
            }
            try {
                return fetcher.get();
            } catch (TradingException | RestClientException e) {
                logger.error("{} request attempt {} failed: {}", name, attempt, e.getMessage());
            }
        }
        return null;
    }

    private List<CoinInfo> fetchCoinPool() {
        JsonNode data = fetchData(config.getAi500Url(), "coins");
        List<CoinInfo> coins = objectMapper.convertValue(data.get("coins"), new TypeReference<List<CoinInfo>>() { });
        coins.forEach(coin -> coin.setAvailable(true));
        logger.info("Fetched {} coins from AI500", coins.size());
        return coins;
    }

    private List<OpenInterestTopEntry> fetchOpenInterestTop() {
        JsonNode data = fetchData(config.getOiTopUrl(), "positions");
        List<OpenInterestTopEntry> entries = objectMapper.convertValue(data.get("positions"),
                new TypeReference<List<OpenInterestTopEntry>>() { });
        logger.info("Fetched {} OI Top symbols (time range: {})", entries.size(),
                data.path("time_range").asText("unknown"));
        return entries;
    }

    private JsonNode fetchData(String url, String listField) {
        ResponseEntity<String> response = httpClientService.get(url, null, String.class, null);
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new TradingException("Coin pool request returned " + response.getStatusCode());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response.getBody());
        } catch (IOException e) {
            throw new TradingException("Coin pool response is not valid JSON", e);
        }
        if (!root.path("success").asBoolean(false)) {
            throw new TradingException("Coin pool API reported failure");
        }
        JsonNode data = root.path("data");
        JsonNode list = data.path(listField);
        if (!list.isArray() || list.size() == 0) {
            throw new TradingException("Coin pool API returned an empty " + listField + " list");
        }
        return data;
    }

    private void saveCache(String fileName, String field, List<?> items) {
        Map<String, Object> cache = new LinkedHashMap<>();
        cache.put(field, items);
        cache.put("fetched_at", clock.millis() / 1000.0);
        cache.put("source_type", "api");
        try {
            Path dir = Paths.get(config.getCacheDir());
            Files.createDirectories(dir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(dir.resolve(fileName).toFile(), cache);
        } catch (IOException e) {
            logger.warn("Failed to save {} cache: {}", fileName, e.getMessage());
        }
    }

    private <T> List<T> loadCache(String fileName, String field, TypeReference<List<T>> type) {
        Path path = Paths.get(config.getCacheDir()).resolve(fileName);
        if (!Files.exists(path)) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            double fetchedAt = root.path("fetched_at").asDouble();
            Duration age = Duration.ofSeconds((long) (clock.millis() / 1000.0 - fetchedAt));
            if (age.toHours() >= 24) {
                logger.info("Cache {} is {} hours old but still usable", fileName, age.toHours());
            }
            return objectMapper.convertValue(root.get(field), type);
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Failed to read {} cache: {}", fileName, e.getMessage());
            return null;
        }
    }

    private void pause() {
        try {
            Thread.sleep(config.getRetryPauseMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TradingException("Interrupted while waiting to retry coin pool request", e);
        }
    }

    static String normalizeSymbol(String symbol) {
        String upper = symbol.replace(" ", "").toUpperCase(Locale.ROOT);
        return upper.endsWith("USDT") ? upper : upper + "USDT";
    }

    private static List<CoinInfo> toCoins(List<String> symbols) {
        return symbols.stream()
                .map(symbol -> CoinInfo.builder().pair(symbol).available(true).build())
                .collect(Collectors.toList());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
