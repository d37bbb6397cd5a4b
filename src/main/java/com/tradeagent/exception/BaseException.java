package com.tradeagent.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the trade-agent exception hierarchy.
 *
 * <p>Carries an {@link ErrorCode} so adapters can map failures without string matching,
 * plus an optional details map (intent id, symbol, offending value) for logging.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of());
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }
}
