package com.trade.agent.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.agent.core.Balance;
import com.trade.agent.core.Decimal;
import com.trade.agent.core.ExchangeEntry;
import com.trade.agent.core.ExchangeOrder;
import com.trade.agent.core.ExchangeTrade;
import com.trade.agent.core.OrderResult;
import com.trade.agent.core.OrderStatus;
import com.trade.agent.core.Position;
import com.trade.agent.core.PositionSide;
import com.trade.agent.core.Side;
import com.trade.agent.core.Symbols;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Binance 合约交易所实现
 * USDT 本位合约（/fapi），支持双向持仓模式
 */
public class BinanceFuturesTrader implements ExchangeTrader {

    private static final Logger logger = LoggerFactory.getLogger(BinanceFuturesTrader.class);

    public static final String EXCHANGE_NAME = "binance_futures";

    private static final String PROD_BASE_URL = "https://fapi.binance.com";
    private static final String TESTNET_BASE_URL = "https://testnet.binancefuture.com";
    private static final String RECV_WINDOW = "5000";
    private static final Duration HISTORY_WINDOW = Duration.ofDays(7);
    private static final int HISTORY_PAGE_LIMIT = 1000;
    private static final int MARGIN_TYPE_UNCHANGED = -4046;

    private final String apiKey;
    private final String secretKey;
    private final String baseUrl;
    private final boolean hedgeMode;
    private final String marginMode;
    private final Set<String> marginModeApplied = ConcurrentHashMap.newKeySet();
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, Integer> quantityPrecision;
    private volatile boolean exchangeInfoLoaded;

    public BinanceFuturesTrader(ExchangeEntry entry) {
        this(entry, new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build());
    }

    public BinanceFuturesTrader(ExchangeEntry entry, OkHttpClient httpClient) {
        this.apiKey = entry.getApiKey();
        this.secretKey = entry.getApiSecret();
        this.hedgeMode = entry.isHedgeMode();
        this.marginMode = entry.getMarginMode();
        String configured = entry.getRestUrl();
        if (configured == null || configured.isBlank()) {
            configured = entry.isTestnet() ? TESTNET_BASE_URL : PROD_BASE_URL;
        }
        this.baseUrl = configured.endsWith("/") ? configured.substring(0, configured.length() - 1) : configured;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.quantityPrecision = new ConcurrentHashMap<>();
    }

    @Override
    public String getExchangeName() {
        return EXCHANGE_NAME;
    }

    @Override
    public Balance getBalance() throws ExchangeException {
        JsonNode json = signedRequest("GET", "/fapi/v2/account", new LinkedHashMap<>());
        return new Balance(
                Decimal.parse(json.path("totalWalletBalance").asText(), BigDecimal.ZERO),
                Decimal.parse(json.path("availableBalance").asText(), BigDecimal.ZERO),
                Decimal.parse(json.path("totalMarginBalance").asText(), BigDecimal.ZERO),
                Decimal.parse(json.path("totalUnrealizedProfit").asText(), BigDecimal.ZERO),
                "USDT",
                Instant.now()
        );
    }

    @Override
    public List<Position> getPositions() throws ExchangeException {
        JsonNode jsonArray = signedRequest("GET", "/fapi/v2/positionRisk", new LinkedHashMap<>());
        List<Position> positions = new ArrayList<>();
        for (JsonNode node : jsonArray) {
            BigDecimal positionAmt = Decimal.parse(node.path("positionAmt").asText(), BigDecimal.ZERO);
            if (positionAmt.signum() == 0) {
                continue;
            }
            PositionSide side = parsePositionSide(node.path("positionSide").asText(""), positionAmt);
            BigDecimal leverage = resolveLeverage(node);
            BigDecimal size = positionAmt.abs();
            BigDecimal markPrice = Decimal.parse(node.path("markPrice").asText(), BigDecimal.ZERO);
            BigDecimal margin = Decimal.parse(node.path("isolatedMargin").asText(), BigDecimal.ZERO);
            if (margin.signum() <= 0) {
                BigDecimal notional = Decimal.parse(node.path("notional").asText(), size.multiply(markPrice)).abs();
                margin = Decimal.divide(notional, leverage);
            }
            long updateTime = node.path("updateTime").asLong(0);
            positions.add(new Position(
                    node.path("symbol").asText(),
                    side,
                    size,
                    Decimal.parse(node.path("entryPrice").asText(), BigDecimal.ZERO),
                    markPrice,
                    Decimal.parse(node.path("unRealizedProfit").asText(), BigDecimal.ZERO),
                    leverage,
                    margin,
                    updateTime > 0 ? Instant.ofEpochMilli(updateTime) : Instant.now(),
                    EXCHANGE_NAME
            ));
        }
        return positions;
    }

    @Override
    public OrderResult openLong(String symbol, BigDecimal quantity, int leverage,
                                BigDecimal stopLoss, BigDecimal takeProfit) throws ExchangeException {
        return openPosition(symbol, PositionSide.LONG, quantity, leverage, stopLoss, takeProfit);
    }

    @Override
    public OrderResult openShort(String symbol, BigDecimal quantity, int leverage,
                                 BigDecimal stopLoss, BigDecimal takeProfit) throws ExchangeException {
        return openPosition(symbol, PositionSide.SHORT, quantity, leverage, stopLoss, takeProfit);
    }

    @Override
    public OrderResult closeLong(String symbol, BigDecimal quantity) throws ExchangeException {
        return closePosition(symbol, PositionSide.LONG, quantity);
    }

    @Override
    public OrderResult closeShort(String symbol, BigDecimal quantity) throws ExchangeException {
        return closePosition(symbol, PositionSide.SHORT, quantity);
    }

    @Override
    public boolean setLeverage(String symbol, int leverage) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toBinanceSymbol(symbol));
        params.put("leverage", String.valueOf(leverage));
        try {
            signedRequest("POST", "/fapi/v1/leverage", params);
            logger.info("{} 杠杆设置为 {}x", symbol, leverage);
            return true;
        } catch (ExchangeException e) {
            logger.error("设置杠杆失败: {} {}x, {}", symbol, leverage, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean setMarginMode(String symbol, String marginMode) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toBinanceSymbol(symbol));
        params.put("marginType", "isolated".equalsIgnoreCase(marginMode) ? "ISOLATED" : "CROSSED");
        try {
            signedRequest("POST", "/fapi/v1/marginType", params);
            return true;
        } catch (BinanceApiException e) {
            if (e.getApiCode() == MARGIN_TYPE_UNCHANGED) {
                return true;
            }
            logger.error("设置保证金模式失败: {} {}, {}", symbol, marginMode, e.getMessage());
            return false;
        } catch (ExchangeException e) {
            logger.error("设置保证金模式失败: {} {}, {}", symbol, marginMode, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean cancelAllOrders(String symbol) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toBinanceSymbol(symbol));
        try {
            signedRequest("DELETE", "/fapi/v1/allOpenOrders", params);
            return true;
        } catch (ExchangeException e) {
            logger.error("撤销挂单失败: {}, {}", symbol, e.getMessage());
            return false;
        }
    }

    @Override
    public BigDecimal getMarketPrice(String symbol) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toBinanceSymbol(symbol));
        try {
            JsonNode json = publicRequest("/fapi/v1/ticker/price", params);
            BigDecimal price = Decimal.parse(json.path("price").asText(), BigDecimal.ZERO);
            if (price.signum() <= 0) {
                logger.warn("{} 无有效报价: {}", symbol, json);
                return BigDecimal.ZERO;
            }
            return price;
        } catch (ExchangeException e) {
            logger.error("获取 {} 价格失败: {}", symbol, e.getMessage());
            return BigDecimal.ZERO;
        }
    }

    @Override
    public String formatQuantity(String symbol, BigDecimal quantity) {
        Integer precision = lookupQuantityPrecision(toBinanceSymbol(symbol));
        if (precision == null) {
            return quantity.stripTrailingZeros().toPlainString();
        }
        return quantity.setScale(precision, RoundingMode.DOWN).toPlainString();
    }

    @Override
    public List<ExchangeOrder> fetchOrders(String symbol, Instant since) throws ExchangeException {
        String binanceSymbol = toBinanceSymbol(symbol);
        Map<String, ExchangeOrder> orders = new LinkedHashMap<>();
        for (JsonNode node : fetchWindowed("/fapi/v1/allOrders", binanceSymbol, since, "time")) {
            ExchangeOrder order = parseOrder(node);
            orders.put(order.getOrderId(), order);
        }
        return new ArrayList<>(orders.values());
    }

    @Override
    public List<ExchangeTrade> fetchTrades(String symbol, Instant since) throws ExchangeException {
        String binanceSymbol = toBinanceSymbol(symbol);
        Map<String, ExchangeTrade> trades = new LinkedHashMap<>();
        for (JsonNode node : fetchWindowed("/fapi/v1/userTrades", binanceSymbol, since, "time")) {
            BigDecimal qty = Decimal.parse(node.path("qty").asText(), BigDecimal.ZERO);
            BigDecimal price = Decimal.parse(node.path("price").asText(), BigDecimal.ZERO);
            ExchangeTrade trade = new ExchangeTrade(
                    node.path("id").asText(),
                    node.path("orderId").asText(),
                    node.path("symbol").asText(binanceSymbol),
                    Side.parse(node.path("side").asText()),
                    qty,
                    price,
                    Decimal.parse(node.path("quoteQty").asText(), qty.multiply(price)),
                    Decimal.parse(node.path("commission").asText(), BigDecimal.ZERO),
                    node.path("commissionAsset").asText(null),
                    Instant.ofEpochMilli(node.path("time").asLong()),
                    node
            );
            trades.put(trade.getTradeId(), trade);
        }
        return new ArrayList<>(trades.values());
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    // ==================== 开平仓 ====================

    private OrderResult openPosition(String symbol, PositionSide positionSide, BigDecimal quantity, int leverage,
                                     BigDecimal stopLoss, BigDecimal takeProfit) throws ExchangeException {
        if (!Decimal.isPositive(quantity)) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_QUANTITY,
                    "开仓数量必须为正数: " + quantity);
        }
        applyConfiguredMarginMode(symbol);
        if (!setLeverage(symbol, leverage)) {
            logger.warn("{} 杠杆设置失败，沿用账户当前杠杆", symbol);
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toBinanceSymbol(symbol));
        params.put("side", positionSide.openSide().name());
        params.put("type", "MARKET");
        params.put("quantity", formatQuantity(symbol, quantity));
        params.put("newOrderRespType", "RESULT");
        if (hedgeMode) {
            params.put("positionSide", positionSide.name());
        }
        JsonNode json = signedRequest("POST", "/fapi/v1/order", params);
        OrderResult result = toOrderResult(json, positionSide.openSide());
        logger.info("开{}成功: {} 数量={} 杠杆={}x 订单={}", positionSide.lowerName(), symbol,
                result.getQuantity(), leverage, result.getOrderId());

        if (stopLoss != null && stopLoss.signum() > 0) {
            placeProtectiveOrder(symbol, positionSide, "STOP_MARKET", stopLoss);
        }
        if (takeProfit != null && takeProfit.signum() > 0) {
            placeProtectiveOrder(symbol, positionSide, "TAKE_PROFIT_MARKET", takeProfit);
        }
        return result;
    }

    /**
     * 配置的保证金模式每个标的只设置一次，失败时下次开仓重试
     */
    private void applyConfiguredMarginMode(String symbol) {
        String binanceSymbol = toBinanceSymbol(symbol);
        if (marginMode == null || marginMode.isBlank() || marginModeApplied.contains(binanceSymbol)) {
            return;
        }
        if (setMarginMode(symbol, marginMode)) {
            marginModeApplied.add(binanceSymbol);
        } else {
            logger.warn("{} 保证金模式 {} 设置失败，沿用账户当前模式", symbol, marginMode);
        }
    }

    /**
     * 止损止盈为尽力而为：失败只记录日志，不影响已成交的开仓单
     */
    private void placeProtectiveOrder(String symbol, PositionSide positionSide, String type, BigDecimal triggerPrice) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toBinanceSymbol(symbol));
        params.put("side", positionSide.closeSide().name());
        params.put("type", type);
        params.put("stopPrice", triggerPrice.stripTrailingZeros().toPlainString());
        params.put("closePosition", "true");
        params.put("workingType", "MARK_PRICE");
        if (hedgeMode) {
            params.put("positionSide", positionSide.name());
        }
        try {
            JsonNode json = signedRequest("POST", "/fapi/v1/order", params);
            logger.info("{} {} 已挂单: 触发价={} 订单={}", symbol, type, triggerPrice, json.path("orderId").asText());
        } catch (ExchangeException e) {
            logger.error("{} {} 挂单失败（开仓已成交）: {}", symbol, type, e.getMessage(), e);
        }
    }

    private OrderResult closePosition(String symbol, PositionSide positionSide, BigDecimal quantity)
            throws ExchangeException {
        Optional<Position> held = Symbols.findPosition(getPositions(), symbol, positionSide);
        if (held.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.POSITION_NOT_FOUND,
                    symbol + " 没有" + positionSide.lowerName() + "持仓可平");
        }
        if (quantity != null && quantity.signum() < 0) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_QUANTITY,
                    "平仓数量不能为负: " + quantity);
        }
        BigDecimal size = held.get().getSize();
        BigDecimal closeQuantity = quantity == null || quantity.signum() == 0 ? size : quantity;
        if (closeQuantity.compareTo(size) > 0) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_QUANTITY,
                    "平仓数量 " + closeQuantity + " 大于持仓 " + size);
        }
        // 撤单前先确认数量按精度截断后仍为正，失败时保留止损止盈单
        String formatted = formatQuantity(symbol, closeQuantity);
        if (!Decimal.isPositive(Decimal.parse(formatted, BigDecimal.ZERO))) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_QUANTITY,
                    "平仓数量 " + closeQuantity + " 按交易所精度截断后为 0");
        }

        cancelAllOrders(symbol);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toBinanceSymbol(symbol));
        params.put("side", positionSide.closeSide().name());
        params.put("type", "MARKET");
        params.put("quantity", formatted);
        params.put("newOrderRespType", "RESULT");
        if (hedgeMode) {
            params.put("positionSide", positionSide.name());
        } else {
            params.put("reduceOnly", "true");
        }
        JsonNode json = signedRequest("POST", "/fapi/v1/order", params);
        OrderResult result = toOrderResult(json, positionSide.closeSide());
        logger.info("平{}成功: {} 数量={} 订单={}", positionSide.lowerName(), symbol,
                closeQuantity, result.getOrderId());
        return result;
    }

    // ==================== 解析 ====================

    private BigDecimal resolveLeverage(JsonNode node) {
        BigDecimal direct = Decimal.parse(node.path("leverage").asText(), BigDecimal.ZERO);
        if (direct.signum() > 0) {
            return direct;
        }
        BigDecimal fraction = Decimal.parse(node.path("initialMarginPercentage").asText(), BigDecimal.ZERO);
        if (fraction.signum() > 0) {
            BigDecimal computed = BigDecimal.ONE.divide(fraction, 0, RoundingMode.HALF_UP);
            if (computed.signum() > 0) {
                return computed;
            }
        }
        logger.warn("{} 无法确定杠杆，按 1x 处理", node.path("symbol").asText());
        return BigDecimal.ONE;
    }

    private PositionSide parsePositionSide(String positionSide, BigDecimal positionAmt) {
        if ("LONG".equalsIgnoreCase(positionSide)) {
            return PositionSide.LONG;
        }
        if ("SHORT".equalsIgnoreCase(positionSide)) {
            return PositionSide.SHORT;
        }
        return positionAmt.signum() > 0 ? PositionSide.LONG : PositionSide.SHORT;
    }

    /**
     * 下单响应，方向取自请求本身
     */
    private OrderResult toOrderResult(JsonNode json, Side side) {
        BigDecimal origQty = Decimal.parse(json.path("origQty").asText(), BigDecimal.ZERO);
        BigDecimal executedQty = Decimal.parse(json.path("executedQty").asText(), BigDecimal.ZERO);
        BigDecimal avgPrice = Decimal.parse(json.path("avgPrice").asText(), BigDecimal.ZERO);
        BigDecimal price = Decimal.parse(json.path("price").asText(), BigDecimal.ZERO);
        long updateTime = json.path("updateTime").asLong(0);
        return OrderResult.builder()
                .symbol(json.path("symbol").asText())
                .orderId(json.path("orderId").asText())
                .clientOrderId(json.path("clientOrderId").asText(null))
                .side(side)
                .type(json.path("type").asText("MARKET"))
                .quantity(origQty)
                .price(price.signum() > 0 ? price : null)
                .executedQuantity(executedQty)
                .executedPrice(avgPrice.signum() > 0 ? avgPrice : null)
                .status(mapOrderStatus(json.path("status").asText()))
                .timestamp(updateTime > 0 ? Instant.ofEpochMilli(updateTime) : Instant.now())
                .exchange(EXCHANGE_NAME)
                .rawData(json)
                .build();
    }

    private ExchangeOrder parseOrder(JsonNode node) {
        BigDecimal amount = Decimal.parse(node.path("origQty").asText(), BigDecimal.ZERO);
        BigDecimal filled = Decimal.parse(node.path("executedQty").asText(), BigDecimal.ZERO);
        BigDecimal price = Decimal.parse(node.path("price").asText(), BigDecimal.ZERO);
        BigDecimal avgPrice = Decimal.parse(node.path("avgPrice").asText(), BigDecimal.ZERO);
        long updateTime = node.path("updateTime").asLong(0);
        return ExchangeOrder.builder()
                .orderId(node.path("orderId").asText())
                .symbol(node.path("symbol").asText())
                .side(Side.parse(node.path("side").asText()))
                .type(node.path("type").asText("MARKET").toLowerCase(Locale.ROOT))
                .amount(amount)
                .price(price.signum() > 0 ? price : null)
                .filled(filled)
                .averagePrice(avgPrice.signum() > 0 ? avgPrice : null)
                .cost(Decimal.parse(node.path("cumQuote").asText(), BigDecimal.ZERO))
                .status(mapOrderStatus(node.path("status").asText()))
                .createdTime(Instant.ofEpochMilli(node.path("time").asLong()))
                .updatedTime(updateTime > 0 ? Instant.ofEpochMilli(updateTime) : null)
                .rawData(node)
                .build();
    }

    static OrderStatus mapOrderStatus(String status) {
        switch (status == null ? "" : status.toUpperCase(Locale.ROOT)) {
            case "FILLED":
                return OrderStatus.FILLED;
            case "PARTIALLY_FILLED":
                return OrderStatus.PARTIALLY_FILLED;
            case "CANCELED":
            case "EXPIRED":
                return OrderStatus.CANCELLED;
            case "REJECTED":
                return OrderStatus.FAILED;
            default:
                return OrderStatus.PENDING;
        }
    }

    /**
     * allOrders / userTrades 单次查询跨度不超过 7 天，按窗口分页拉取
     */
    private List<JsonNode> fetchWindowed(String path, String binanceSymbol, Instant since, String timeField)
            throws ExchangeException {
        List<JsonNode> rows = new ArrayList<>();
        long end = System.currentTimeMillis();
        long windowStart = since.toEpochMilli();
        while (windowStart < end) {
            long windowEnd = Math.min(windowStart + HISTORY_WINDOW.toMillis(), end);
            Map<String, String> params = new LinkedHashMap<>();
            params.put("symbol", binanceSymbol);
            params.put("startTime", String.valueOf(windowStart));
            params.put("endTime", String.valueOf(windowEnd));
            params.put("limit", String.valueOf(HISTORY_PAGE_LIMIT));
            JsonNode page = signedRequest("GET", path, params);
            long lastTime = windowStart;
            int count = 0;
            for (JsonNode row : page) {
                rows.add(row);
                lastTime = Math.max(lastTime, row.path(timeField).asLong(windowStart));
                count++;
            }
            windowStart = count >= HISTORY_PAGE_LIMIT ? lastTime + 1 : windowEnd + 1;
        }
        return rows;
    }

    private Integer lookupQuantityPrecision(String binanceSymbol) {
        if (!exchangeInfoLoaded) {
            synchronized (quantityPrecision) {
                if (!exchangeInfoLoaded) {
                    try {
                        JsonNode json = publicRequest("/fapi/v1/exchangeInfo", new LinkedHashMap<>());
                        for (JsonNode node : json.path("symbols")) {
                            quantityPrecision.put(node.path("symbol").asText(), node.path("quantityPrecision").asInt(3));
                        }
                        exchangeInfoLoaded = true;
                    } catch (ExchangeException e) {
                        logger.warn("加载 exchangeInfo 失败，数量按原值提交: {}", e.getMessage());
                        return null;
                    }
                }
            }
        }
        return quantityPrecision.get(binanceSymbol);
    }

    private String toBinanceSymbol(String symbol) {
        return Symbols.normalize(symbol);
    }

    // ==================== HTTP ====================

    private JsonNode publicRequest(String path, Map<String, String> params) throws ExchangeException {
        HttpUrl.Builder url = HttpUrl.get(baseUrl + path).newBuilder();
        params.forEach(url::addQueryParameter);
        return execute(new Request.Builder().url(url.build()).get().build());
    }

    private JsonNode signedRequest(String method, String path, Map<String, String> params) throws ExchangeException {
        params.put("recvWindow", RECV_WINDOW);
        params.put("timestamp", String.valueOf(System.currentTimeMillis()));
        StringBuilder query = new StringBuilder();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (query.length() > 0) {
                query.append('&');
            }
            query.append(entry.getKey()).append('=').append(entry.getValue());
        }
        String signature = hmacSha256(query.toString(), secretKey);
        String url = baseUrl + path + "?" + query + "&signature=" + signature;

        Request.Builder builder = new Request.Builder()
                .url(url)
                .addHeader("X-MBX-APIKEY", apiKey);
        if ("POST".equals(method)) {
            builder.post(RequestBody.create(new byte[0], null));
        } else if ("DELETE".equals(method)) {
            builder.delete();
        } else {
            builder.get();
        }
        return execute(builder.build());
    }

    private JsonNode execute(Request request) throws ExchangeException {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw toApiException(response.code(), body);
            }
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.CONNECTION,
                    "Binance 请求失败: " + request.url().encodedPath() + ", " + e.getMessage(), e);
        }
    }

    private BinanceApiException toApiException(int httpCode, String body) {
        int apiCode = 0;
        String msg = body;
        try {
            JsonNode json = objectMapper.readTree(body);
            apiCode = json.path("code").asInt(0);
            msg = json.path("msg").asText(body);
        } catch (IOException e) {
            logger.debug("Binance 错误响应不是JSON: {}", body);
        }
        return new BinanceApiException(mapErrorCode(httpCode, apiCode), apiCode,
                "Binance API error: HTTP " + httpCode + ", code=" + apiCode + ", msg=" + msg);
    }

    static ExchangeException.ErrorCode mapErrorCode(int httpCode, int apiCode) {
        if (httpCode == 401 || apiCode == -2014 || apiCode == -2015 || apiCode == -1022) {
            return ExchangeException.ErrorCode.AUTHENTICATION;
        }
        if (httpCode == 429 || httpCode == 418 || apiCode == -1003) {
            return ExchangeException.ErrorCode.RATE_LIMIT;
        }
        switch (apiCode) {
            case -2019:
                return ExchangeException.ErrorCode.INSUFFICIENT_FUNDS;
            case -1121:
                return ExchangeException.ErrorCode.SYMBOL_NOT_FOUND;
            case -2011:
            case -2013:
                return ExchangeException.ErrorCode.ORDER_NOT_FOUND;
            default:
                return ExchangeException.ErrorCode.TRADING_ERROR;
        }
    }

    private String hmacSha256(String data, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return bytesToHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("签名失败", e);
        }
    }

    private String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder();
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) hexString.append('0');
            hexString.append(hex);
        }
        return hexString.toString();
    }

    /**
     * 携带 Binance 原始错误码，供个别接口识别"无需变更"类响应
     */
    static class BinanceApiException extends ExchangeException {
        private final int apiCode;

        BinanceApiException(ErrorCode errorCode, int apiCode, String message) {
            super(errorCode, message);
            this.apiCode = apiCode;
        }

        int getApiCode() {
            return apiCode;
        }
    }
}
