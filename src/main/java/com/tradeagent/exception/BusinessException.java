package com.tradeagent.exception;

import java.util.Map;

/**
 * A rule violation surfaced to a human-facing caller (wrong approval phrase, intent already
 * terminal, tampered intent). Always safe to retry once the condition is corrected.
 */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
