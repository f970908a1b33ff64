package com.futures.monitor.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One element of {@code GET /fapi/v2/positionRisk}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PositionRiskResponse(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("positionSide") String positionSide,
    @JsonProperty("positionAmt") double positionAmt,
    @JsonProperty("entryPrice") double entryPrice,
    @JsonProperty("markPrice") double markPrice,
    @JsonProperty("unRealizedProfit") double unRealizedProfit,
    @JsonProperty("liquidationPrice") double liquidationPrice,
    @JsonProperty("leverage") int leverage,
    @JsonProperty("marginType") String marginType,
    @JsonProperty("notional") double notional,
    @JsonProperty("updateTime") long updateTime
) {}
