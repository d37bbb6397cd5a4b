package com.tradeagent.exception;

/**
 * Failure talking to the market: fetching data, placing, polling or cancelling an order.
 */
public class MarketException extends BaseException {

    public MarketException(String message) {
        super(ErrorCode.MARKET_ERROR, message);
    }

    public MarketException(String message, Throwable cause) {
        super(ErrorCode.MARKET_ERROR, message, cause);
    }
}
