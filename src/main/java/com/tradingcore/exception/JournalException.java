package com.tradingcore.exception;

public class JournalException extends BaseException {

    public JournalException(String message, Throwable cause) {
        super(ErrorCode.JOURNAL_ERROR, message, cause);
    }
}
