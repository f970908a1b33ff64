package com.futures.monitor.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Parsed response body of a successful exchange call.
 */
public record RawPayload(Endpoint endpoint, JsonNode body, Instant receivedAt) {}
