package com.company.powersense.exception;

public class HistoryArchiveException extends RuntimeException {
    public HistoryArchiveException(String message) {
        super(message);
    }

    public HistoryArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
