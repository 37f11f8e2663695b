package com.tradingcore.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    NOT_FOUND("NOT_FOUND"),
    INVALID_ORDER_STATE("INVALID_ORDER_STATE"),
    BROKER_ERROR("BROKER_ERROR"),
    JOURNAL_ERROR("JOURNAL_ERROR"),
    INTERNAL_ERROR("INTERNAL_ERROR");

    private final String code;
}
