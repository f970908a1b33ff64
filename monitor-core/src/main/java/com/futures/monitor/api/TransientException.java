package com.futures.monitor.api;

public class TransientException extends ExchangeException {

    public TransientException(String endpoint, String message, Throwable cause) {
        super(endpoint, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT;
    }
}
