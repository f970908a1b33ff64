package com.futures.monitor.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One element of {@code GET /fapi/v1/userTrades}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserTradeResponse(
    @JsonProperty("id") long id,
    @JsonProperty("orderId") long orderId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("side") String side,
    @JsonProperty("price") double price,
    @JsonProperty("qty") double qty,
    @JsonProperty("quoteQty") double quoteQty,
    @JsonProperty("commission") double commission,
    @JsonProperty("commissionAsset") String commissionAsset,
    @JsonProperty("realizedPnl") double realizedPnl,
    @JsonProperty("maker") boolean maker,
    @JsonProperty("time") long time
) {}
