package com.trade.agent.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.agent.core.Balance;
import com.trade.agent.core.ExchangeEntry;
import com.trade.agent.core.ExchangeTrade;
import com.trade.agent.core.OrderResult;
import com.trade.agent.core.OrderStatus;
import com.trade.agent.core.Position;
import com.trade.agent.core.PositionSide;
import com.trade.agent.core.Side;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OkxSwapTraderTest {

    private static final String INSTRUMENT = """
            {"code":"0","msg":"","data":[{"instId":"BTC-USDT-SWAP","tickSz":"0.1","lotSz":"0.01",
              "minSz":"0.01","ctVal":"0.01"}]}
            """;
    private static final String EMPTY_OK = "{\"code\":\"0\",\"msg\":\"\",\"data\":[]}";

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private OkxSwapTrader trader;
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, MockResponse> routes = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                requests.add(request);
                HttpUrl url = request.getRequestUrl();
                String path = url == null ? "" : url.encodedPath();
                MockResponse response = routes.get(request.getMethod() + " " + path);
                return response != null ? response : new MockResponse().setResponseCode(404).setBody("{}");
            }
        });
        server.start();
        routes.put("GET /api/v5/public/instruments", json(INSTRUMENT));
        routes.put("GET /api/v5/account/config", json("""
                {"code":"0","msg":"","data":[{"posMode":"long_short_mode"}]}
                """));
        routes.put("POST /api/v5/account/set-leverage", json(EMPTY_OK));
        routes.put("GET /api/v5/trade/orders-pending", json(EMPTY_OK));
        routes.put("GET /api/v5/trade/orders-algo-pending", json(EMPTY_OK));

        ExchangeEntry entry = new ExchangeEntry("okx", "key", "secret", "phrase", true,
                server.url("/").toString(), 5, "cross", true);
        trader = new OkxSwapTrader(entry, new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        trader.close();
        server.shutdown();
    }

    @Test
    void positionsConvertContractsToBaseQuantity() throws ExchangeException {
        routes.put("GET /api/v5/account/positions", json("""
                {"code":"0","msg":"","data":[
                  {"instId":"BTC-USDT-SWAP","posSide":"long","pos":"50","avgPx":"60000","markPx":"61000",
                   "upl":"500","lever":"10","margin":"305","uTime":"1717200000000"},
                  {"instId":"BTC-USDT-SWAP","posSide":"net","pos":"-20","avgPx":"62000","markPx":"61000",
                   "upl":"20","imr":"61","notionalUsd":"122"},
                  {"instId":"BTC-USDT-SWAP","posSide":"short","pos":"0","lever":"3"}
                ]}
                """));

        List<Position> positions = trader.getPositions();

        assertEquals(2, positions.size());
        Position longPosition = positions.get(0);
        assertEquals(PositionSide.LONG, longPosition.getSide());
        assertEquals(0, new BigDecimal("0.5").compareTo(longPosition.getSize()), "50 张 * 0.01 = 0.5 BTC");
        assertEquals(0, BigDecimal.TEN.compareTo(longPosition.getLeverage()));
        assertEquals(0, new BigDecimal("305").compareTo(longPosition.getMargin()));
        Position netShort = positions.get(1);
        assertEquals(PositionSide.SHORT, netShort.getSide());
        assertEquals(0, new BigDecimal("0.2").compareTo(netShort.getSize()));
        assertEquals(0, new BigDecimal("2").compareTo(netShort.getLeverage()), "杠杆由 notionalUsd / imr 推算");
        assertEquals(0, new BigDecimal("61").compareTo(netShort.getMargin()));
    }

    @Test
    void privateRequestsAreSignedAndMarkedAsDemo() throws ExchangeException {
        routes.put("GET /api/v5/account/balance", json("""
                {"code":"0","msg":"","data":[{"totalEq":"1000.5","details":[
                  {"ccy":"USDT","availEq":"","availBal":"800","eq":"1000.5","upl":"12.3"}]}]}
                """));

        Balance balance = trader.getBalance();

        assertEquals(0, new BigDecimal("1000.5").compareTo(balance.getTotalBalance()));
        assertEquals(0, new BigDecimal("800").compareTo(balance.getAvailableBalance()), "availEq 为空时取 availBal");
        assertEquals(0, new BigDecimal("12.3").compareTo(balance.getUnrealizedPnl()));

        RecordedRequest request = requests.get(0);
        assertEquals("USDT", request.getRequestUrl().queryParameter("ccy"));
        assertEquals("key", request.getHeader("OK-ACCESS-KEY"));
        assertEquals("phrase", request.getHeader("OK-ACCESS-PASSPHRASE"));
        assertNotNull(request.getHeader("OK-ACCESS-SIGN"));
        assertNotNull(request.getHeader("OK-ACCESS-TIMESTAMP"));
        assertEquals("1", request.getHeader("x-simulated-trading"));
    }

    @Test
    void closeWithZeroQuantityClosesWholePositionAfterCancellingOrders() throws Exception {
        routes.put("GET /api/v5/account/positions", json("""
                {"code":"0","msg":"","data":[{"instId":"BTC-USDT-SWAP","posSide":"long","pos":"50",
                  "avgPx":"60000","markPx":"61000","lever":"10","margin":"305"}]}
                """));
        routes.put("GET /api/v5/trade/orders-algo-pending", json("""
                {"code":"0","msg":"","data":[{"algoId":"a1","instId":"BTC-USDT-SWAP"}]}
                """));
        routes.put("POST /api/v5/trade/cancel-algos", json("""
                {"code":"0","msg":"","data":[{"algoId":"a1","sCode":"0","sMsg":""}]}
                """));
        routes.put("POST /api/v5/trade/order", json("""
                {"code":"0","msg":"","data":[{"ordId":"9001","clOrdId":"","sCode":"0","sMsg":""}]}
                """));
        routes.put("GET /api/v5/trade/order", json("""
                {"code":"0","msg":"","data":[{"ordId":"9001","instId":"BTC-USDT-SWAP","accFillSz":"50",
                  "avgPx":"61010","state":"filled","fee":"-1.5"}]}
                """));

        OrderResult result = trader.closeLong("BTC/USDT:USDT", BigDecimal.ZERO);

        assertEquals("9001", result.getOrderId());
        assertEquals(OrderStatus.FILLED, result.getStatus());
        assertEquals(0, new BigDecimal("0.5").compareTo(result.getExecutedQuantity()));
        assertEquals(0, new BigDecimal("61010").compareTo(result.getExecutedPrice()));
        assertEquals(0, new BigDecimal("1.5").compareTo(result.getFees()));

        JsonNode body = bodyOf(single("POST", "/api/v5/trade/order"));
        assertEquals("BTC-USDT-SWAP", body.path("instId").asText());
        assertEquals("sell", body.path("side").asText());
        assertEquals("long", body.path("posSide").asText());
        assertEquals("cross", body.path("tdMode").asText());
        assertEquals("50", body.path("sz").asText(), "数量按张数提交");
        assertTrue(indexOf("POST", "/api/v5/trade/cancel-algos") < indexOf("POST", "/api/v5/trade/order"),
                "先撤条件单再平仓");
    }

    @Test
    void closeMoreThanHeldFailsWithoutPlacingOrder() {
        routes.put("GET /api/v5/account/positions", json("""
                {"code":"0","msg":"","data":[{"instId":"BTC-USDT-SWAP","posSide":"short","pos":"20",
                  "markPx":"61000","lever":"5"}]}
                """));

        ExchangeException e = assertThrows(ExchangeException.class,
                () -> trader.closeShort("BTCUSDT", new BigDecimal("0.3")));

        assertEquals(ExchangeException.ErrorCode.INVALID_QUANTITY, e.getErrorCode());
        assertEquals(-1, indexOf("POST", "/api/v5/trade/order"));
        assertEquals(-1, indexOf("GET", "/api/v5/trade/orders-pending"));
    }

    @Test
    void invalidCloseQuantityKeepsProtectiveOrders() {
        routes.put("GET /api/v5/account/positions", json("""
                {"code":"0","msg":"","data":[{"instId":"BTC-USDT-SWAP","posSide":"long","pos":"50",
                  "markPx":"61000","lever":"10"}]}
                """));

        ExchangeException negative = assertThrows(ExchangeException.class,
                () -> trader.closeLong("BTCUSDT", new BigDecimal("-0.1")));
        ExchangeException belowLot = assertThrows(ExchangeException.class,
                () -> trader.closeLong("BTCUSDT", new BigDecimal("0.00001")));

        assertEquals(ExchangeException.ErrorCode.INVALID_QUANTITY, negative.getErrorCode());
        assertEquals(ExchangeException.ErrorCode.INVALID_QUANTITY, belowLot.getErrorCode());
        assertEquals(-1, indexOf("GET", "/api/v5/trade/orders-pending"), "数量无效时不得撤单");
        assertEquals(-1, indexOf("GET", "/api/v5/trade/orders-algo-pending"));
        assertEquals(-1, indexOf("POST", "/api/v5/trade/order"));
    }

    @Test
    void closeWithoutPositionIsPositionNotFound() {
        routes.put("GET /api/v5/account/positions", json(EMPTY_OK));

        ExchangeException e = assertThrows(ExchangeException.class,
                () -> trader.closeLong("BTCUSDT", BigDecimal.ZERO));

        assertEquals(ExchangeException.ErrorCode.POSITION_NOT_FOUND, e.getErrorCode());
    }

    @Test
    void openBelowOneLotIsRejectedBeforeOrdering() {
        ExchangeException e = assertThrows(ExchangeException.class,
                () -> trader.openLong("BTCUSDT", new BigDecimal("0.00001"), 5, null, null));

        assertEquals(ExchangeException.ErrorCode.INVALID_QUANTITY, e.getErrorCode());
        assertEquals(-1, indexOf("POST", "/api/v5/trade/order"));
    }

    @Test
    void perRowRejectionIsMappedFromSCode() {
        routes.put("POST /api/v5/trade/order", json("""
                {"code":"1","msg":"All operations failed","data":[{"ordId":"","sCode":"51008",
                  "sMsg":"Order failed. Insufficient USDT margin in account"}]}
                """));

        ExchangeException e = assertThrows(ExchangeException.class,
                () -> trader.openShort("BTCUSDT", new BigDecimal("0.002"), 5, null, null));

        assertEquals(ExchangeException.ErrorCode.INSUFFICIENT_FUNDS, e.getErrorCode());
        assertTrue(indexOf("POST", "/api/v5/account/set-leverage") < indexOf("POST", "/api/v5/trade/order"),
                "开仓前先设置杠杆");
    }

    @Test
    void protectiveOrdersUseMarkPriceTriggersAndNeverFailTheOpen() throws Exception {
        routes.put("POST /api/v5/trade/order", json("""
                {"code":"0","msg":"","data":[{"ordId":"9002","sCode":"0","sMsg":""}]}
                """));
        routes.put("GET /api/v5/trade/order", new MockResponse().setResponseCode(500).setBody("oops"));
        routes.put("POST /api/v5/trade/order-algo", json("""
                {"code":"1","msg":"","data":[{"algoId":"","sCode":"51277","sMsg":"TP trigger price invalid"}]}
                """));

        OrderResult result = trader.openLong("BTCUSDT", new BigDecimal("0.002"), 5,
                new BigDecimal("48000.04"), new BigDecimal("55000.06"));

        assertEquals("9002", result.getOrderId());
        assertEquals(0, new BigDecimal("0.002").compareTo(result.getQuantity()));

        List<JsonNode> protective = new ArrayList<>();
        for (RecordedRequest request : requests) {
            if ("POST".equals(request.getMethod())
                    && "/api/v5/trade/order-algo".equals(request.getRequestUrl().encodedPath())) {
                protective.add(bodyOf(request));
            }
        }
        assertEquals(2, protective.size());
        JsonNode stopLoss = protective.get(0);
        assertEquals("sell", stopLoss.path("side").asText());
        assertEquals("0.2", stopLoss.path("sz").asText());
        assertEquals("48000.1", stopLoss.path("slTriggerPx").asText(), "多单止损向上取整到 tick");
        assertEquals("mark", stopLoss.path("slTriggerPxType").asText());
        JsonNode takeProfit = protective.get(1);
        assertEquals("55000", takeProfit.path("tpTriggerPx").asText(), "多单止盈向下取整到 tick");
    }

    @Test
    void apiErrorsAreMappedToErrorCodes() {
        routes.put("GET /api/v5/account/balance", new MockResponse().setResponseCode(401)
                .setBody("{\"code\":\"50111\",\"msg\":\"Invalid OK-ACCESS-KEY\",\"data\":[]}"));

        ExchangeException e = assertThrows(ExchangeException.class, () -> trader.getBalance());

        assertEquals(ExchangeException.ErrorCode.AUTHENTICATION, e.getErrorCode());
        assertEquals(ExchangeException.ErrorCode.RATE_LIMIT, OkxSwapTrader.mapErrorCode(429, ""));
        assertEquals(ExchangeException.ErrorCode.CONNECTION, OkxSwapTrader.mapErrorCode(200, "50001"));
        assertEquals(ExchangeException.ErrorCode.SYMBOL_NOT_FOUND, OkxSwapTrader.mapErrorCode(200, "51001"));
        assertEquals(ExchangeException.ErrorCode.TRADING_ERROR, OkxSwapTrader.mapErrorCode(200, "59000"));
    }

    @Test
    void marketPriceErrorsReturnZero() {
        routes.put("GET /api/v5/market/ticker", new MockResponse().setResponseCode(500).setBody("oops"));
        assertEquals(0, BigDecimal.ZERO.compareTo(trader.getMarketPrice("BTCUSDT")));

        routes.put("GET /api/v5/market/ticker", json("""
                {"code":"0","msg":"","data":[{"instId":"BTC-USDT-SWAP","last":"61234.5"}]}
                """));
        assertEquals(0, new BigDecimal("61234.5").compareTo(trader.getMarketPrice("BTCUSDT")));
    }

    @Test
    void fetchTradesConvertsFillsToBaseQuantity() throws ExchangeException {
        long since = System.currentTimeMillis() - 3_600_000L;
        routes.put("GET /api/v5/trade/fills-history", json("""
                {"code":"0","msg":"","data":[
                  {"instId":"BTC-USDT-SWAP","tradeId":"t1","ordId":"o1","billId":"b1","side":"buy",
                   "fillSz":"10","fillPx":"60000","fee":"-0.3","feeCcy":"USDT","ts":"%d"}
                ]}
                """.formatted(since + 1000)));

        List<ExchangeTrade> trades = trader.fetchTrades("BTCUSDT", Instant.ofEpochMilli(since));

        assertEquals(1, trades.size());
        ExchangeTrade trade = trades.get(0);
        assertEquals("t1", trade.getTradeId());
        assertEquals("o1", trade.getOrderId());
        assertEquals(Side.BUY, trade.getSide());
        assertEquals(0, new BigDecimal("0.1").compareTo(trade.getAmount()));
        assertEquals(0, new BigDecimal("6000").compareTo(trade.getCost()));
        assertEquals(0, new BigDecimal("0.3").compareTo(trade.getFeeCost()));
        assertEquals(Instant.ofEpochMilli(since + 1000), trade.getTradeTime());

        HttpUrl url = single("GET", "/api/v5/trade/fills-history").getRequestUrl();
        assertEquals(String.valueOf(since), url.queryParameter("begin"));
        assertEquals("BTC-USDT-SWAP", url.queryParameter("instId"));
    }

    @Test
    void symbolFormatsMapToSwapInstrumentIds() {
        assertEquals("BTC-USDT-SWAP", OkxSwapTrader.toInstId("BTCUSDT"));
        assertEquals("ETH-USDT-SWAP", OkxSwapTrader.toInstId("ETH/USDT:USDT"));
        assertEquals("SOL-USDT-SWAP", OkxSwapTrader.toInstId("SOL-USDT-SWAP"));
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    private JsonNode bodyOf(RecordedRequest request) throws IOException {
        return mapper.readTree(request.getBody().clone().readUtf8());
    }

    private RecordedRequest single(String method, String path) {
        List<RecordedRequest> matching = new ArrayList<>();
        for (RecordedRequest request : requests) {
            if (method.equals(request.getMethod()) && request.getRequestUrl() != null
                    && path.equals(request.getRequestUrl().encodedPath())) {
                matching.add(request);
            }
        }
        assertEquals(1, matching.size(), "期望恰好一次请求: " + method + " " + path);
        return matching.get(0);
    }

    private int indexOf(String method, String path) {
        for (int i = 0; i < requests.size(); i++) {
            RecordedRequest request = requests.get(i);
            HttpUrl url = request.getRequestUrl();
            if (method.equals(request.getMethod()) && url != null && path.equals(url.encodedPath())) {
                return i;
            }
        }
        return -1;
    }
}
