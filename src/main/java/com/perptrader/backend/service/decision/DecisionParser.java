package com.perptrader.backend.service.decision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perptrader.backend.exception.MalformedResponseException;
import com.perptrader.backend.model.Decision;
import com.perptrader.backend.model.FullDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits raw model output into the free-text reasoning and the JSON decision array.
 *
 * <p>Every {@code [} is tried in order; the first bracket-balanced span that parses as a JSON
 * array of objects wins, so bracketed notes inside the reasoning do not derail parsing.
 */
@Component
public class DecisionParser {

    private static final Logger logger = LoggerFactory.getLogger(DecisionParser.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DecisionParser(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public FullDecision parse(String rawResponse) {
        String response = rawResponse == null ? "" : rawResponse;
        String reasoningTrace = extractReasoningTrace(response);

        List<Decision> decisions = extractDecisions(response, reasoningTrace);
        return FullDecision.builder()
                .reasoningTrace(reasoningTrace)
                .decisions(decisions)
                .timestamp(clock.instant())
                .build();
    }

    /**
     * Text before the first {@code [}, trimmed; the whole text when there is none.
     */
    static String extractReasoningTrace(String response) {
        int start = response.indexOf('[');
        return start >= 0 ? response.substring(0, start).trim() : response.trim();
    }

    private List<Decision> extractDecisions(String response, String reasoningTrace) {
        int start = response.indexOf('[');
        if (start < 0) {
            throw new MalformedResponseException("No JSON array start found in AI response", reasoningTrace);
        }

        String lastError = "no matching closing bracket";
        while (start >= 0) {
            int end = findMatchingBracket(response, start);
            if (end < 0) {
                break;
            }
            String candidate = normalizeQuotes(response.substring(start, end + 1).trim());
            try {
                JsonNode node = objectMapper.readTree(candidate);
                if (isArrayOfObjects(node)) {
                    return toDecisions(node, reasoningTrace);
                }
                lastError = "array at offset " + start + " does not hold decision objects";
            } catch (JsonProcessingException e) {
                lastError = e.getOriginalMessage();
                logger.debug("Bracketed text at offset {} is not a JSON array: {}", start, lastError);
            }
            start = response.indexOf('[', start + 1);
        }
        throw new MalformedResponseException("Failed to extract decisions: " + lastError, reasoningTrace);
    }

    private List<Decision> toDecisions(JsonNode array, String reasoningTrace) {
        List<Decision> decisions = new ArrayList<>();
        for (JsonNode item : array) {
            Decision decision;
            try {
                decision = objectMapper.treeToValue(item, Decision.class);
            } catch (JsonProcessingException e) {
                throw new MalformedResponseException("Decision has an invalid field: " + e.getOriginalMessage(),
                        reasoningTrace, e);
            }
            decisions.add(decision.toBuilder()
                    .symbol(emptyIfNull(decision.getSymbol()))
                    .action(emptyIfNull(decision.getAction()))
                    .reasoning(emptyIfNull(decision.getReasoning()))
                    .build());
        }
        return decisions;
    }

    /**
     * Index of the {@code ]} closing the {@code [} at {@code start}, by depth counting; -1 when unbalanced.
     */
    static int findMatchingBracket(String s, int start) {
        if (start >= s.length() || s.charAt(start) != '[') {
            return -1;
        }
        int depth = 0;
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /** Replaces typographic quotes that input methods substitute for ASCII ones. */
    static String normalizeQuotes(String json) {
        return json.replace('“', '"')
                .replace('”', '"')
                .replace('‘', '\'')
                .replace('’', '\'');
    }

    private static boolean isArrayOfObjects(JsonNode node) {
        if (node == null || !node.isArray()) {
            return false;
        }
        for (JsonNode item : node) {
            if (!item.isObject()) {
                return false;
            }
        }
        return true;
    }

    private static String emptyIfNull(String value) {
        return value == null ? "" : value;
    }
}
