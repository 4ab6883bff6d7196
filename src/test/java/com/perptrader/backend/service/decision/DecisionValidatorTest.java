package com.perptrader.backend.service.decision;

import com.perptrader.backend.exception.ValidationRejectedException;
import com.perptrader.backend.model.Decision;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DecisionValidatorTest {

    private static final double EQUITY = 1000.0;

    private final DecisionValidator validator = new DecisionValidator(0.2);

    private static Decision.DecisionBuilder ethLong() {
        return Decision.builder()
                .symbol("ETHUSDT")
                .action("open_long")
                .leverage(10)
                .positionSizeUsd(1400)
                .stopLoss(3000)
                .takeProfit(3300)
                .confidence(80)
                .reasoning("trend");
    }

    private static Decision.DecisionBuilder altShort() {
        return Decision.builder()
                .symbol("SOLUSDT")
                .action("open_short")
                .leverage(5)
                .positionSizeUsd(1200)
                .stopLoss(105)
                .takeProfit(80);
    }

    @Test
    void validate_shouldAcceptEthLongWithGoodRewardRisk() {
        // assumed entry 3060: risk 1.96%, reward 7.84%
        assertDoesNotThrow(() -> validator.validate(List.of(ethLong().build()), EQUITY, 10, 10));
        assertEquals(3060.0, validator.assumedEntry(ethLong().build(), true), 1e-9);
    }

    @Test
    void validate_shouldMeasureRewardRiskFromAssumedEntryNotMarketPrice() {
        Decision tightTarget = ethLong().takeProfit(3150).build();

        assertDoesNotThrow(() -> validator.validate(List.of(tightTarget), EQUITY, 10, 10));
        assertEquals(3030.0, validator.assumedEntry(tightTarget, true), 1e-9);
    }

    @Test
    void validate_shouldRejectLowRewardRiskWhenEntryFractionIsWide() {
        DecisionValidator wideEntry = new DecisionValidator(0.26);
        Decision decision = ethLong().build();

        ValidationRejectedException e = assertThrows(ValidationRejectedException.class,
                () -> wideEntry.validate(List.of(decision), EQUITY, 10, 10));

        assertTrue(e.getMessage().contains("reward:risk ratio too low (2.85:1)"), e.getMessage());
        assertTrue(e.getMessage().contains("[entry: 3078.00"), e.getMessage());
        assertSame(decision, e.getDecision());
    }

    @Test
    void validate_shouldInterpolateShortEntryFromStopSide() {
        DecisionValidator wideEntry = new DecisionValidator(0.26);

        assertEquals(100.0, validator.assumedEntry(altShort().build(), false), 1e-9);
        assertDoesNotThrow(() -> validator.validate(List.of(altShort().build()), EQUITY, 10, 5));
        assertThrows(ValidationRejectedException.class,
                () -> wideEntry.validate(List.of(altShort().build()), EQUITY, 10, 5));
    }

    @Test
    void validate_shouldRejectLeverageAboveCap() {
        ValidationRejectedException e = assertThrows(ValidationRejectedException.class,
                () -> validator.validate(List.of(ethLong().leverage(11).build()), EQUITY, 10, 10));

        assertTrue(e.getMessage().startsWith("Decision #1 rejected: leverage must be between 1 and 10"), e.getMessage());
    }

    @Test
    void validate_shouldApplyAltcoinCapsToOtherSymbols() {
        assertThrows(ValidationRejectedException.class,
                () -> validator.validate(List.of(altShort().leverage(6).build()), EQUITY, 10, 5));
        assertDoesNotThrow(() -> validator.validate(List.of(altShort().build()), EQUITY, 10, 5));
    }

    @Test
    void validate_shouldAllowOnePercentSizeTolerance() {
        assertDoesNotThrow(() -> validator.validate(List.of(altShort().positionSizeUsd(1515).build()), EQUITY, 10, 5));

        ValidationRejectedException e = assertThrows(ValidationRejectedException.class,
                () -> validator.validate(List.of(altShort().positionSizeUsd(1516).build()), EQUITY, 10, 5));
        assertTrue(e.getMessage().contains("altcoin position value cannot exceed 1500 USDT"), e.getMessage());
    }

    @Test
    void validate_shouldCapMajorsAtTenTimesEquity() {
        assertDoesNotThrow(() -> validator.validate(List.of(ethLong().positionSizeUsd(10_000).build()), EQUITY, 10, 5));
        assertThrows(ValidationRejectedException.class,
                () -> validator.validate(List.of(ethLong().positionSizeUsd(10_200).build()), EQUITY, 10, 5));
    }

    @Test
    void validate_shouldRejectNonPositiveSize() {
        assertThrows(ValidationRejectedException.class,
                () -> validator.validate(List.of(ethLong().positionSizeUsd(0).build()), EQUITY, 10, 10));
    }

    @Test
    void validate_shouldRejectMissingStops() {
        assertThrows(ValidationRejectedException.class,
                () -> validator.validate(List.of(ethLong().stopLoss(0).build()), EQUITY, 10, 10));
    }

    @Test
    void validate_shouldRejectStopsOnWrongSide() {
        ValidationRejectedException longError = assertThrows(ValidationRejectedException.class,
                () -> validator.validate(List.of(ethLong().stopLoss(3400).build()), EQUITY, 10, 10));
        assertTrue(longError.getMessage().contains("stop loss must be below take profit"));

        ValidationRejectedException shortError = assertThrows(ValidationRejectedException.class,
                () -> validator.validate(List.of(altShort().stopLoss(70).build()), EQUITY, 10, 5));
        assertTrue(shortError.getMessage().contains("stop loss must be above take profit"));
    }

    @Test
    void validate_shouldRejectUnknownAction() {
        Decision flip = Decision.builder().symbol("BTCUSDT").action("flip").build();

        ValidationRejectedException e = assertThrows(ValidationRejectedException.class,
                () -> validator.validate(List.of(flip), EQUITY, 10, 10));

        assertEquals("Decision #1 rejected: invalid action: flip", e.getMessage());
    }

    @Test
    void validate_shouldIgnoreSizingOnNonOpenActions() {
        List<Decision> decisions = List.of(
                Decision.builder().symbol("BTCUSDT").action("close_long").build(),
                Decision.builder().symbol("ETHUSDT").action("hold").build(),
                Decision.builder().symbol("SOLUSDT").action("wait").build());

        assertDoesNotThrow(() -> validator.validate(decisions, EQUITY, 10, 5));
    }

    @Test
    void validate_shouldStopAtFirstViolationAndReportItsIndex() {
        List<Decision> decisions = List.of(
                Decision.builder().symbol("BTCUSDT").action("hold").build(),
                ethLong().leverage(20).build(),
                Decision.builder().symbol("X").action("flip").build());

        ValidationRejectedException e = assertThrows(ValidationRejectedException.class,
                () -> validator.validate(decisions, EQUITY, 10, 5));

        assertTrue(e.getMessage().startsWith("Decision #2 rejected"), e.getMessage());
    }
}
