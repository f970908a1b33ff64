package com.futures.monitor.api;

/**
 * Credentials were rejected. Further calls are pointless until credentials are reconfigured.
 */
public class AuthException extends ExchangeException {
    private final int exchangeCode;

    public AuthException(String endpoint, int exchangeCode, String message) {
        super(endpoint, message, null);
        this.exchangeCode = exchangeCode;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.AUTH;
    }

    public int exchangeCode() {
        return exchangeCode;
    }
}
