package com.futures.monitor.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wire shape of {@code GET /fapi/v2/account}. Numeric fields arrive as strings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountResponse(
    @JsonProperty("totalWalletBalance") double totalWalletBalance,
    @JsonProperty("totalUnrealizedProfit") double totalUnrealizedProfit,
    @JsonProperty("totalMarginBalance") double totalMarginBalance,
    @JsonProperty("totalMaintMargin") double totalMaintMargin,
    @JsonProperty("totalInitialMargin") double totalInitialMargin,
    @JsonProperty("availableBalance") double availableBalance,
    @JsonProperty("updateTime") long updateTime,
    @JsonProperty("assets") List<AssetResponse> assets
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AssetResponse(
        @JsonProperty("asset") String asset,
        @JsonProperty("walletBalance") double walletBalance,
        @JsonProperty("unrealizedProfit") double unrealizedProfit,
        @JsonProperty("marginBalance") double marginBalance,
        @JsonProperty("availableBalance") double availableBalance
    ) {}
}
