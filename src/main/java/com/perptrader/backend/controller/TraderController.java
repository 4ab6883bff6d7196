package com.perptrader.backend.controller;

import com.perptrader.backend.model.CompetitionEntry;
import com.perptrader.backend.model.DecisionRecord;
import com.perptrader.backend.service.cycle.AutoTrader;
import com.perptrader.backend.service.manager.TraderManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Read-only status surface for the running agents, plus a stop switch.
 * Agent-scoped endpoints take {@code trader_id} and default to the first configured agent.
 */
@RestController
@RequestMapping("/api")
public class TraderController {

    private static final Logger logger = LoggerFactory.getLogger(TraderController.class);

    static final int LATEST_DECISIONS = 5;
    static final int RECENT_DECISIONS = 100;

    private final TraderManager traderManager;
    private final Clock clock;

    public TraderController(TraderManager traderManager, Clock clock) {
        this.traderManager = traderManager;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "ok");
        response.put("time", clock.instant().toString());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/traders")
    public ResponseEntity<Map<String, Object>> getTraders() {
        List<Map<String, Object>> traders = new ArrayList<>();
        for (AutoTrader trader : traderManager.getTraders()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("trader_id", trader.getId());
            entry.put("trader_name", trader.getName());
            entry.put("ai_model", trader.getAiModel());
            entry.put("is_running", trader.isRunning());
            traders.add(entry);
        }
        return success(traders);
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus(@RequestParam(name = "trader_id", required = false) String traderId) {
        return withTrader(traderId, "status", AutoTrader::getStatus);
    }

    @GetMapping("/account")
    public ResponseEntity<Map<String, Object>> getAccount(@RequestParam(name = "trader_id", required = false) String traderId) {
        return withTrader(traderId, "account", AutoTrader::getAccountOverview);
    }

    @GetMapping("/positions")
    public ResponseEntity<Map<String, Object>> getPositions(@RequestParam(name = "trader_id", required = false) String traderId) {
        return withTrader(traderId, "positions", AutoTrader::getPositions);
    }

    @GetMapping("/decisions")
    public ResponseEntity<Map<String, Object>> getDecisions(@RequestParam(name = "trader_id", required = false) String traderId) {
        return withTrader(traderId, "decisions",
                trader -> trader.getDecisionLogger().getLatestRecords(RECENT_DECISIONS));
    }

    /** Most recent records, newest first. */
    @GetMapping("/decisions/latest")
    public ResponseEntity<Map<String, Object>> getLatestDecisions(@RequestParam(name = "trader_id", required = false) String traderId) {
        return withTrader(traderId, "latest decisions", trader -> {
            List<DecisionRecord> records = new ArrayList<>(trader.getDecisionLogger().getLatestRecords(LATEST_DECISIONS));
            Collections.reverse(records);
            return records;
        });
    }

    @GetMapping("/statistics")
    public ResponseEntity<Map<String, Object>> getStatistics(@RequestParam(name = "trader_id", required = false) String traderId) {
        return withTrader(traderId, "statistics", trader -> trader.getDecisionLogger().getStatistics());
    }

    @GetMapping("/performance")
    public ResponseEntity<Map<String, Object>> getPerformance(@RequestParam(name = "trader_id", required = false) String traderId) {
        return withTrader(traderId, "performance",
                trader -> trader.getDecisionLogger().analyzePerformance(RECENT_DECISIONS));
    }

    @GetMapping("/competition")
    public ResponseEntity<Map<String, Object>> getCompetition() {
        try {
            List<CompetitionEntry> entries = traderManager.getCompetitionData();
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("traders", entries);
            response.put("count", entries.size());
            return ResponseEntity.ok(response);
        } catch (RuntimeException e) {
            logger.error("Error building competition data", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to build competition data: " + e.getMessage());
        }
    }

    @PostMapping("/traders/{id}/stop")
    public ResponseEntity<Map<String, Object>> stopTrader(@PathVariable String id) {
        if (!traderManager.stopTrader(id)) {
            return error(HttpStatus.NOT_FOUND, "Trader not found: " + id);
        }
        logger.info("Stop requested for trader {} via API", id);
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Trader " + id + " is stopping");
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> withTrader(String traderId, String what, Function<AutoTrader, Object> query) {
        Optional<AutoTrader> trader = traderManager.resolveTrader(traderId);
        if (trader.isEmpty()) {
            return error(HttpStatus.NOT_FOUND, traderId == null ? "No traders configured" : "Trader not found: " + traderId);
        }
        try {
            return success(query.apply(trader.get()));
        } catch (RuntimeException e) {
            logger.error("Error fetching {} for trader {}", what, trader.get().getId(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to fetch " + what + ": " + e.getMessage());
        }
    }

    private static ResponseEntity<Map<String, Object>> success(Object data) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", data);
        return ResponseEntity.ok(response);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
