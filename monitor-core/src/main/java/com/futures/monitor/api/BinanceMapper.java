package com.futures.monitor.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.futures.monitor.api.model.AccountResponse;
import com.futures.monitor.api.model.IncomeResponse;
import com.futures.monitor.api.model.PositionRiskResponse;
import com.futures.monitor.api.model.UserTradeResponse;
import com.futures.monitor.model.AccountSnapshot;
import com.futures.monitor.model.AssetBalance;
import com.futures.monitor.model.IncomeRecord;
import com.futures.monitor.model.IncomeType;
import com.futures.monitor.model.MarginMode;
import com.futures.monitor.model.Position;
import com.futures.monitor.model.PositionSide;
import com.futures.monitor.model.Trade;
import com.futures.monitor.model.TradeSide;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps raw futures API payloads to the domain model.
 * Shape mismatches surface as {@link ProtocolException}.
 */
public final class BinanceMapper {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public AccountSnapshot toAccountSnapshot(RawPayload payload) {
        JsonNode body = requireObject(payload, "totalWalletBalance");
        AccountResponse account = read(payload, body, AccountResponse.class);

        var assets = new ArrayList<AssetBalance>();
        if (account.assets() != null) {
            for (var asset : account.assets()) {
                // Only keep assets that actually hold a balance
                if (asset.walletBalance() > 0) {
                    assets.add(new AssetBalance(asset.asset(), asset.walletBalance(),
                        asset.unrealizedProfit(), asset.marginBalance(), asset.availableBalance()));
                }
            }
        }

        Instant asOf = account.updateTime() > 0 ? Instant.ofEpochMilli(account.updateTime()) : payload.receivedAt();
        return new AccountSnapshot(
            account.totalWalletBalance(),
            account.availableBalance(),
            account.totalUnrealizedProfit(),
            account.totalMarginBalance(),
            account.totalMaintMargin(),
            account.totalInitialMargin(),
            assets,
            asOf
        );
    }

    /**
     * Open positions; zero-size rows are pruned.
     */
    public List<Position> toPositions(RawPayload payload) {
        var positions = new ArrayList<Position>();
        for (JsonNode node : requireArray(payload)) {
            PositionRiskResponse raw = read(payload, node, PositionRiskResponse.class);
            if (raw.symbol() == null || raw.symbol().isEmpty()) {
                throw new ProtocolException(payload.endpoint().name(), "Position without symbol");
            }
            if (raw.positionAmt() == 0.0) {
                continue;
            }
            Instant updatedAt = raw.updateTime() > 0 ? Instant.ofEpochMilli(raw.updateTime()) : payload.receivedAt();
            positions.add(new Position(
                raw.symbol(),
                PositionSide.resolve(raw.positionSide(), raw.positionAmt()),
                raw.entryPrice(),
                raw.markPrice(),
                raw.positionAmt(),
                Math.max(1, raw.leverage()),
                raw.liquidationPrice(),
                raw.unRealizedProfit(),
                MarginMode.fromWire(raw.marginType()),
                raw.notional(),
                updatedAt
            ));
        }
        return List.copyOf(positions);
    }

    /**
     * Trades ordered by (time, id).
     */
    public List<Trade> toTrades(RawPayload payload) {
        var trades = new ArrayList<Trade>();
        for (JsonNode node : requireArray(payload)) {
            UserTradeResponse raw = read(payload, node, UserTradeResponse.class);
            trades.add(new Trade(
                raw.id(),
                raw.orderId(),
                raw.symbol(),
                parseSide(payload, raw.side()),
                raw.price(),
                raw.qty(),
                raw.quoteQty() != 0.0 ? raw.quoteQty() : raw.price() * raw.qty(),
                raw.commission(),
                raw.commissionAsset(),
                raw.realizedPnl(),
                raw.maker(),
                Instant.ofEpochMilli(raw.time())
            ));
        }
        trades.sort(Comparator.comparing(Trade::time).thenComparingLong(Trade::id));
        return List.copyOf(trades);
    }

    public List<IncomeRecord> toIncome(RawPayload payload) {
        var records = new ArrayList<IncomeRecord>();
        for (JsonNode node : requireArray(payload)) {
            IncomeResponse raw = read(payload, node, IncomeResponse.class);
            records.add(new IncomeRecord(
                raw.tranId(),
                IncomeType.fromWire(raw.incomeType()),
                raw.symbol() != null ? raw.symbol() : "",
                raw.asset(),
                raw.income(),
                Instant.ofEpochMilli(raw.time())
            ));
        }
        records.sort(Comparator.comparing(IncomeRecord::time).thenComparingLong(IncomeRecord::transactionId));
        return List.copyOf(records);
    }

    private static TradeSide parseSide(RawPayload payload, String side) {
        if ("BUY".equalsIgnoreCase(side)) {
            return TradeSide.BUY;
        }
        if ("SELL".equalsIgnoreCase(side)) {
            return TradeSide.SELL;
        }
        throw new ProtocolException(payload.endpoint().name(), "Unknown trade side: " + side);
    }

    private static JsonNode requireArray(RawPayload payload) {
        JsonNode body = payload.body();
        if (body == null || !body.isArray()) {
            throw new ProtocolException(payload.endpoint().name(), "Expected JSON array");
        }
        return body;
    }

    private static JsonNode requireObject(RawPayload payload, String requiredField) {
        JsonNode body = payload.body();
        if (body == null || !body.isObject() || !body.has(requiredField)) {
            throw new ProtocolException(payload.endpoint().name(),
                "Expected JSON object with field '" + requiredField + "'");
        }
        return body;
    }

    private <T> T read(RawPayload payload, JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException(payload.endpoint().name(),
                "Cannot map " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
