package com.tradeagent.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    NOT_FOUND("NOT_FOUND"),
    INVALID_STATE("INVALID_STATE"),
    APPROVAL_REJECTED("APPROVAL_REJECTED"),
    INTEGRITY_VIOLATION("INTEGRITY_VIOLATION"),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR"),
    MARKET_ERROR("MARKET_ERROR"),
    INTERNAL_ERROR("INTERNAL_ERROR");

    private final String code;
}
