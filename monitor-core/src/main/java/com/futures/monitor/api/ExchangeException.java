package com.futures.monitor.api;

/**
 * Base of all typed exchange failures.
 */
public abstract class ExchangeException extends RuntimeException {
    private final String endpoint;

    protected ExchangeException(String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    public abstract ErrorKind kind();

    public String endpoint() {
        return endpoint;
    }

    /**
     * Convert any failure into a typed one. Already-typed failures are returned as is;
     * anything else means the response did not match what the mapping code expected.
     */
    public static ExchangeException wrap(String endpoint, Throwable failure) {
        if (failure instanceof ExchangeException typed) {
            return typed;
        }
        return new ProtocolException(endpoint, "Unexpected failure: " + failure.getMessage(), failure);
    }
}
