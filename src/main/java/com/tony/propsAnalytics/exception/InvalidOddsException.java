package com.tony.propsAnalytics.exception;

public class InvalidOddsException extends RuntimeException {
    public InvalidOddsException(String message) {
        super(message);
    }

    public InvalidOddsException(String message, Throwable e) {
        super(message, e);
    }
}
