package com.perptrader.backend.model;

/**
 * Where an agent's trading cycle currently is.
 */
public enum CycleState {
    IDLE,
    RISK_PAUSED,
    BUILDING_CONTEXT,
    AWAITING_AI,
    VALIDATING,
    EXECUTING,
    RECORDING
}
