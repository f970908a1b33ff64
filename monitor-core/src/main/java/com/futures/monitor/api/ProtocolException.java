package com.futures.monitor.api;

/**
 * The response did not match the API contract. Retrying cannot fix this.
 */
public class ProtocolException extends ExchangeException {

    public ProtocolException(String endpoint, String message) {
        super(endpoint, message, null);
    }

    public ProtocolException(String endpoint, String message, Throwable cause) {
        super(endpoint, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROTOCOL;
    }
}
