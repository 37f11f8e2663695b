package com.tradingcore.exception;

/**
 * The broker refused or failed a request. The message carries the broker's reason and becomes
 * the order's rejection reason.
 */
public class BrokerException extends BaseException {

    public BrokerException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }
}
