package com.tradingcore.event;

public enum RiskEventType {
    CIRCUIT_BREAKER_OPENED,
    CIRCUIT_BREAKER_CLOSED,
    DRAWDOWN_BREACH,
    DAILY_LOSS_BREACH,
    STOP_LOSS_BREACH,
    STALE_HEARTBEAT,
    LIMITS_UPDATED,
    EMERGENCY_HALT,
    HALT_RESET
}
