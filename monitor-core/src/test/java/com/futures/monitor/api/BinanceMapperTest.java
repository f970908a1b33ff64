package com.futures.monitor.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.futures.monitor.model.AccountSnapshot;
import com.futures.monitor.model.IncomeRecord;
import com.futures.monitor.model.IncomeType;
import com.futures.monitor.model.MarginMode;
import com.futures.monitor.model.Position;
import com.futures.monitor.model.PositionSide;
import com.futures.monitor.model.Trade;
import com.futures.monitor.model.TradeSide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BinanceMapper Tests")
class BinanceMapperTest {

    private static final Instant RECEIVED = Instant.parse("2024-03-01T12:00:00Z");

    private final ObjectMapper json = new ObjectMapper();
    private final BinanceMapper mapper = new BinanceMapper();

    private RawPayload payload(Endpoint endpoint, String body) throws Exception {
        return new RawPayload(endpoint, json.readTree(body), RECEIVED);
    }

    @Nested
    @DisplayName("Account")
    class Account {

        @Test
        @DisplayName("Should map balances and keep only funded assets")
        void mapsAccount() throws Exception {
            AccountSnapshot snapshot = mapper.toAccountSnapshot(payload(Endpoint.ACCOUNT, """
                {"totalWalletBalance":"1000.5","availableBalance":"700.25","totalUnrealizedProfit":"-12.5",
                 "totalMarginBalance":"988.0","totalMaintMargin":"9.88","totalInitialMargin":"250.0",
                 "updateTime":0,"feeTier":0,
                 "assets":[
                   {"asset":"USDT","walletBalance":"1000.5","unrealizedProfit":"-12.5","marginBalance":"988.0","availableBalance":"700.25"},
                   {"asset":"BNB","walletBalance":"0.00000000","unrealizedProfit":"0","marginBalance":"0","availableBalance":"0"}
                 ]}
                """));

            assertThat(snapshot.walletBalance()).isEqualTo(1000.5);
            assertThat(snapshot.availableBalance()).isEqualTo(700.25);
            assertThat(snapshot.unrealizedPnl()).isEqualTo(-12.5);
            assertThat(snapshot.marginRatio()).isCloseTo(0.01, within(1e-9));
            assertThat(snapshot.assets()).extracting("asset").containsExactly("USDT");
            assertThat(snapshot.asOf()).isEqualTo(RECEIVED);
        }

        @Test
        @DisplayName("Should reject a payload without wallet balance")
        void missingField() throws Exception {
            var payload = payload(Endpoint.ACCOUNT, "{\"code\":0}");

            assertThatThrownBy(() -> mapper.toAccountSnapshot(payload))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("totalWalletBalance");
        }
    }

    @Nested
    @DisplayName("Positions")
    class Positions {

        @Test
        @DisplayName("Should prune empty rows and resolve one-way sides from the amount")
        void mapsPositions() throws Exception {
            List<Position> positions = mapper.toPositions(payload(Endpoint.POSITION_RISK, """
                [
                  {"symbol":"BTCUSDT","positionSide":"BOTH","positionAmt":"-0.5","entryPrice":"60000","markPrice":"59000",
                   "unRealizedProfit":"500","liquidationPrice":"75000","leverage":"20","marginType":"isolated",
                   "notional":"-29500","updateTime":1709294400000},
                  {"symbol":"ETHUSDT","positionSide":"BOTH","positionAmt":"0.000","entryPrice":"0","markPrice":"3000",
                   "unRealizedProfit":"0","liquidationPrice":"0","leverage":"10","marginType":"cross","notional":"0"},
                  {"symbol":"SOLUSDT","positionSide":"LONG","positionAmt":"10","entryPrice":"100","markPrice":"98",
                   "unRealizedProfit":"-20","liquidationPrice":"0","leverage":"5","marginType":"cross","notional":"980"}
                ]
                """));

            assertThat(positions).hasSize(2);
            Position btc = positions.get(0);
            assertThat(btc.side()).isEqualTo(PositionSide.SHORT);
            assertThat(btc.size()).isEqualTo(0.5);
            assertThat(btc.leverage()).isEqualTo(20);
            assertThat(btc.marginMode()).isEqualTo(MarginMode.ISOLATED);
            assertThat(btc.absoluteNotional()).isEqualTo(29500.0);
            assertThat(btc.updatedAt()).isEqualTo(Instant.ofEpochMilli(1709294400000L));

            Position sol = positions.get(1);
            assertThat(sol.key()).isEqualTo(new Position.Key("SOLUSDT", PositionSide.LONG));
            assertThat(sol.updatedAt()).isEqualTo(RECEIVED);
        }

        @Test
        @DisplayName("Should reject a non-array payload")
        void notArray() throws Exception {
            var payload = payload(Endpoint.POSITION_RISK, "{\"code\":-1000,\"msg\":\"oops\"}");

            assertThatThrownBy(() -> mapper.toPositions(payload)).isInstanceOf(ProtocolException.class);
        }
    }

    @Nested
    @DisplayName("Trades and income")
    class History {

        @Test
        @DisplayName("Should order trades by time then id")
        void ordersTrades() throws Exception {
            List<Trade> trades = mapper.toTrades(payload(Endpoint.USER_TRADES, """
                [
                  {"id":3,"orderId":30,"symbol":"BTCUSDT","side":"SELL","price":"60100","qty":"0.1","quoteQty":"6010",
                   "commission":"2.404","commissionAsset":"USDT","realizedPnl":"10","maker":true,"time":2000},
                  {"id":2,"orderId":20,"symbol":"BTCUSDT","side":"BUY","price":"60000","qty":"0.1",
                   "commission":"2.4","commissionAsset":"USDT","realizedPnl":"0","maker":false,"time":1000},
                  {"id":1,"orderId":10,"symbol":"BTCUSDT","side":"BUY","price":"60000","qty":"0.1","quoteQty":"6000",
                   "commission":"2.4","commissionAsset":"USDT","realizedPnl":"0","maker":false,"time":1000}
                ]
                """));

            assertThat(trades).extracting(Trade::id).containsExactly(1L, 2L, 3L);
            assertThat(trades.get(1).quoteQuantity()).isCloseTo(6000.0, within(1e-6));
            assertThat(trades.get(2).side()).isEqualTo(TradeSide.SELL);
            assertThat(trades.get(2).maker()).isTrue();
        }

        @Test
        @DisplayName("Should reject an unknown trade side")
        void unknownSide() throws Exception {
            var payload = payload(Endpoint.USER_TRADES, """
                [{"id":1,"orderId":1,"symbol":"BTCUSDT","side":"HOLD","price":"1","qty":"1","time":1}]
                """);

            assertThatThrownBy(() -> mapper.toTrades(payload))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("HOLD");
        }

        @Test
        @DisplayName("Should map unrecognised income types to UNKNOWN")
        void mapsIncome() throws Exception {
            List<IncomeRecord> income = mapper.toIncome(payload(Endpoint.INCOME, """
                [
                  {"symbol":"BTCUSDT","incomeType":"FUNDING_FEE","income":"-0.37","asset":"USDT","time":2000,"tranId":9},
                  {"symbol":"","incomeType":"STRATEGY_UMFUTURES_TRANSFER","income":"100","asset":"USDT","time":1000,"tranId":8}
                ]
                """));

            assertThat(income).extracting(IncomeRecord::type)
                .containsExactly(IncomeType.UNKNOWN, IncomeType.FUNDING_FEE);
            assertThat(income.get(1).amount()).isEqualTo(-0.37);
        }
    }
}
