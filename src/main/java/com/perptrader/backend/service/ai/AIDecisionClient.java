package com.perptrader.backend.service.ai;

import com.perptrader.backend.exception.AIUnavailableException;
import com.perptrader.backend.service.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpClientErrorException;

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;

/**
 * Calls the model with linear backoff, retrying only failures that look transient.
 */
public class AIDecisionClient {

    private static final Logger logger = LoggerFactory.getLogger(AIDecisionClient.class);

    private static final List<String> TRANSIENT_MESSAGES = List.of(
            "eof", "timeout", "timed out", "connection reset", "connection refused",
            "temporary failure", "no such host");

    private final AIProvider provider;
    private final int maxAttempts;
    private final long backoffStepMs;
    private final int maxTokens;
    private final double temperature;
    private final Sleeper sleeper;

    public AIDecisionClient(AIProvider provider, int maxAttempts, long backoffStepMs,
                            int maxTokens, double temperature, Sleeper sleeper) {
        this.provider = provider;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffStepMs = backoffStepMs;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.sleeper = sleeper;
    }

    public String getProviderName() {
        return provider.getProviderName();
    }

    /**
     * @return the raw model text
     * @throws AIUnavailableException when retries are exhausted or the failure is not retryable
     */
    public String call(String systemPrompt, String userPrompt) {
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                logger.info("Retrying AI call ({}/{})", attempt, maxAttempts);
            }
            try {
                String content = provider.executeChatCompletion(systemPrompt, userPrompt, maxTokens, temperature);
                if (attempt > 1) {
                    logger.info("AI call succeeded on attempt {}", attempt);
                }
                return content;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AIUnavailableException("AI call interrupted", attempt, e);
            } catch (IOException | HttpClientErrorException e) {
                lastError = e;
                if (!isRetryable(e)) {
                    throw new AIUnavailableException("AI call failed: " + e.getMessage(), attempt, e);
                }
                logger.warn("AI call failed with a transient error, attempt {}/{}: {}", attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    backoff(attempt, e);
                }
            }
        }
        throw new AIUnavailableException("AI call failed after " + maxAttempts + " attempts: "
                + lastError.getMessage(), maxAttempts, lastError);
    }

    private void backoff(int attempt, Exception cause) {
        long waitMs = attempt * backoffStepMs;
        logger.info("Waiting {} ms before retrying", waitMs);
        try {
            sleeper.sleep(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AIUnavailableException("AI retry interrupted", attempt, cause);
        }
    }

    static boolean isRetryable(Exception e) {
        if (e instanceof HttpClientErrorException) {
            return false;
        }
        if (e instanceof HttpTimeoutException || e instanceof SocketTimeoutException
                || e instanceof ConnectException || e instanceof UnknownHostException
                || e instanceof EOFException) {
            return true;
        }
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return TRANSIENT_MESSAGES.stream().anyMatch(lower::contains);
    }
}
