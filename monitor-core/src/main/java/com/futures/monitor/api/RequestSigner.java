package com.futures.monitor.api;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Signs futures API requests with HMAC-SHA256.
 *
 * Each signed query carries a {@code timestamp} that is strictly increasing per signer,
 * so two requests can never share a signature even when issued in the same millisecond.
 */
public final class RequestSigner {
    private static final String HMAC_SHA256 = "HmacSHA256";
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final SecretKeySpec keySpec;
    private final Clock clock;
    private final long recvWindowMs;

    private final Object timestampLock = new Object();
    private long lastTimestamp = 0;

    public RequestSigner(String apiSecret, Clock clock, long recvWindowMs) {
        this.keySpec = new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256);
        this.clock = clock;
        this.recvWindowMs = recvWindowMs;
    }

    /**
     * Build the full signed query string for the given parameters.
     */
    public String signedQuery(Map<String, String> params) {
        var withAuth = new LinkedHashMap<>(params);
        withAuth.put("recvWindow", Long.toString(recvWindowMs));
        withAuth.put("timestamp", Long.toString(nextTimestamp()));
        String query = encode(withAuth);
        return query + "&signature=" + sign(query);
    }

    /**
     * Hex encoded HMAC-SHA256 of the payload.
     */
    public String sign(String payload) {
        try {
            Mac hmac = Mac.getInstance(HMAC_SHA256);
            hmac.init(keySpec);
            byte[] digest = hmac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return toHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    long nextTimestamp() {
        synchronized (timestampLock) {
            long now = clock.millis();
            long timestamp = Math.max(now, lastTimestamp + 1);
            lastTimestamp = timestamp;
            return timestamp;
        }
    }

    static String encode(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    private static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }
}
