package com.futures.monitor.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One element of {@code GET /fapi/v1/income}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomeResponse(
    @JsonProperty("tranId") long tranId,
    @JsonProperty("incomeType") String incomeType,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("asset") String asset,
    @JsonProperty("income") double income,
    @JsonProperty("time") long time
) {}
