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
import okhttp3.MediaType;
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
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * OKX v5 永续合约（SWAP）实现.
 * Quantities at the interface are base-asset amounts; the wire uses contracts (sz = qty / ctVal).
 */
public class OkxSwapTrader implements ExchangeTrader {

    private static final Logger logger = LoggerFactory.getLogger(OkxSwapTrader.class);

    public static final String EXCHANGE_NAME = "okx";

    private static final String PROD_BASE_URL = "https://www.okx.com";
    private static final long SYMBOL_RULE_CACHE_TTL_MS = TimeUnit.MINUTES.toMillis(30);
    private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json");
    private static final int CANCEL_BATCH_SIZE = 20;
    private static final int HISTORY_PAGE_LIMIT = 100;

    private final String apiKey;
    private final String secretKey;
    private final String passphrase;
    private final String restBaseUrl;
    private final boolean demoTradingEnabled;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, SymbolRules> symbolRulesCache;
    private volatile String tdMode;
    private volatile Boolean longShortMode;

    private static final class SymbolRules {
        private final String instId;
        private final BigDecimal tickSize;
        private final BigDecimal lotStepSize;
        private final BigDecimal minContracts;
        private final BigDecimal contractValue;
        private final long loadedAtMillis;

        private SymbolRules(String instId, BigDecimal tickSize, BigDecimal lotStepSize,
                            BigDecimal minContracts, BigDecimal contractValue, long loadedAtMillis) {
            this.instId = instId;
            this.tickSize = tickSize;
            this.lotStepSize = lotStepSize;
            this.minContracts = minContracts;
            this.contractValue = contractValue;
            this.loadedAtMillis = loadedAtMillis;
        }
    }

    public OkxSwapTrader(ExchangeEntry entry) {
        this(entry, new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build());
    }

    public OkxSwapTrader(ExchangeEntry entry, OkHttpClient httpClient) {
        this.apiKey = entry.getApiKey();
        this.secretKey = entry.getApiSecret();
        this.passphrase = entry.getPassphrase();
        this.demoTradingEnabled = entry.isTestnet();
        this.restBaseUrl = normalizeBaseUrl(entry.getRestUrl());
        this.tdMode = entry.isCrossMargin() ? "cross" : "isolated";
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.symbolRulesCache = new ConcurrentHashMap<>();
    }

    @Override
    public String getExchangeName() {
        return EXCHANGE_NAME;
    }

    @Override
    public Balance getBalance() throws ExchangeException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("ccy", "USDT");
        JsonNode data = privateRequestWithRetry("/api/v5/account/balance", query).path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.TRADING_ERROR, "Get balance returned empty data");
        }
        JsonNode account = data.get(0);
        BigDecimal totalEq = Decimal.parse(account.path("totalEq").asText(), BigDecimal.ZERO);
        BigDecimal available = BigDecimal.ZERO;
        BigDecimal equity = totalEq;
        BigDecimal unrealized = BigDecimal.ZERO;
        for (JsonNode detail : account.path("details")) {
            if (!"USDT".equalsIgnoreCase(detail.path("ccy").asText(""))) {
                continue;
            }
            available = pickFirstPositive(
                    Decimal.parse(detail.path("availEq").asText(), BigDecimal.ZERO),
                    Decimal.parse(detail.path("availBal").asText(), BigDecimal.ZERO),
                    Decimal.parse(detail.path("cashBal").asText(), BigDecimal.ZERO));
            equity = Decimal.parse(detail.path("eq").asText(), totalEq);
            unrealized = Decimal.parse(detail.path("upl").asText(), BigDecimal.ZERO);
            break;
        }
        return new Balance(totalEq, available, equity, unrealized, "USDT", Instant.now());
    }

    @Override
    public List<Position> getPositions() throws ExchangeException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instType", "SWAP");
        JsonNode data = privateRequestWithRetry("/api/v5/account/positions", query).path("data");
        List<Position> positions = new ArrayList<>();
        for (JsonNode node : data) {
            BigDecimal posContracts = Decimal.parse(node.path("pos").asText(), BigDecimal.ZERO);
            if (posContracts.signum() == 0) {
                continue;
            }
            String instId = node.path("instId").asText();
            SymbolRules rules = getSymbolRules(instId);
            BigDecimal size = contractsToBaseQuantity(posContracts.abs(), rules);
            if (size.signum() <= 0) {
                continue;
            }
            long uTime = node.path("uTime").asLong(0);
            positions.add(new Position(
                    instId,
                    parsePositionSide(node.path("posSide").asText(""), posContracts),
                    size,
                    Decimal.parse(node.path("avgPx").asText(), BigDecimal.ZERO),
                    Decimal.parse(node.path("markPx").asText(), BigDecimal.ZERO),
                    Decimal.parse(node.path("upl").asText(), BigDecimal.ZERO),
                    resolveLeverage(node),
                    pickFirstPositive(
                            Decimal.parse(node.path("margin").asText(), BigDecimal.ZERO),
                            Decimal.parse(node.path("imr").asText(), BigDecimal.ZERO)),
                    uTime > 0 ? Instant.ofEpochMilli(uTime) : Instant.now(),
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
        if (leverage <= 0) {
            return false;
        }
        try {
            SymbolRules rules = rulesFor(symbol);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("instId", rules.instId);
            body.put("lever", String.valueOf(leverage));
            body.put("mgnMode", tdMode);
            privateRequest("/api/v5/account/set-leverage", "POST", null, body, false);
            logger.info("{} leverage set to {}x ({})", rules.instId, leverage, tdMode);
            return true;
        } catch (ExchangeException e) {
            logger.error("Set leverage failed: {} {}x, {}", symbol, leverage, e.getMessage());
            return false;
        }
    }

    /**
     * OKX 的保证金模式随订单的 tdMode 提交，这里只记录后续下单使用的模式
     */
    @Override
    public boolean setMarginMode(String symbol, String marginMode) {
        String mode = marginMode == null ? "" : marginMode.trim().toLowerCase(Locale.ROOT);
        if (!"cross".equals(mode) && !"isolated".equals(mode)) {
            logger.error("Unsupported margin mode for {}: {}", symbol, marginMode);
            return false;
        }
        this.tdMode = mode;
        return true;
    }

    @Override
    public boolean cancelAllOrders(String symbol) {
        try {
            String instId = rulesFor(symbol).instId;
            boolean regular = cancelPendingOrders(instId);
            boolean algo = cancelPendingAlgoOrders(instId);
            return regular && algo;
        } catch (ExchangeException e) {
            logger.error("Cancel all orders failed: {}, {}", symbol, e.getMessage());
            return false;
        }
    }

    @Override
    public BigDecimal getMarketPrice(String symbol) {
        try {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("instId", rulesFor(symbol).instId);
            JsonNode data = publicRequest("/api/v5/market/ticker", query).path("data");
            if (!data.isArray() || data.isEmpty()) {
                logger.warn("No ticker for {}", symbol);
                return BigDecimal.ZERO;
            }
            BigDecimal last = Decimal.parse(data.get(0).path("last").asText(), BigDecimal.ZERO);
            return last.signum() > 0 ? last : BigDecimal.ZERO;
        } catch (ExchangeException e) {
            logger.error("Get market price failed: {}, {}", symbol, e.getMessage());
            return BigDecimal.ZERO;
        }
    }

    @Override
    public String formatQuantity(String symbol, BigDecimal quantity) {
        try {
            SymbolRules rules = rulesFor(symbol);
            BigDecimal contracts = normalizeContracts(quantity, rules);
            return contractsToBaseQuantity(contracts, rules).stripTrailingZeros().toPlainString();
        } catch (ExchangeException e) {
            logger.debug("Quantity not normalized for {}: {}", symbol, e.getMessage());
            return quantity.stripTrailingZeros().toPlainString();
        }
    }

    @Override
    public List<ExchangeOrder> fetchOrders(String symbol, Instant since) throws ExchangeException {
        SymbolRules rules = rulesFor(symbol);
        Map<String, ExchangeOrder> orders = new LinkedHashMap<>();
        for (JsonNode node : fetchPaged("/api/v5/trade/orders-history-archive", rules.instId, since, "ordId")) {
            ExchangeOrder order = parseOrder(node, rules);
            orders.put(order.getOrderId(), order);
        }
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instType", "SWAP");
        query.put("instId", rules.instId);
        for (JsonNode node : privateRequestWithRetry("/api/v5/trade/orders-pending", query).path("data")) {
            ExchangeOrder order = parseOrder(node, rules);
            if (!order.getCreatedTime().isBefore(since)) {
                orders.put(order.getOrderId(), order);
            }
        }
        return new ArrayList<>(orders.values());
    }

    @Override
    public List<ExchangeTrade> fetchTrades(String symbol, Instant since) throws ExchangeException {
        SymbolRules rules = rulesFor(symbol);
        Map<String, ExchangeTrade> trades = new LinkedHashMap<>();
        for (JsonNode node : fetchPaged("/api/v5/trade/fills-history", rules.instId, since, "billId")) {
            BigDecimal qty = contractsToBaseQuantity(
                    Decimal.parse(node.path("fillSz").asText(), BigDecimal.ZERO), rules);
            BigDecimal price = Decimal.parse(node.path("fillPx").asText(), BigDecimal.ZERO);
            ExchangeTrade trade = new ExchangeTrade(
                    node.path("tradeId").asText(),
                    node.path("ordId").asText(),
                    rules.instId,
                    Side.parse(node.path("side").asText()),
                    qty,
                    price,
                    qty.multiply(price),
                    Decimal.parse(node.path("fee").asText(), BigDecimal.ZERO).abs(),
                    node.path("feeCcy").asText(null),
                    Instant.ofEpochMilli(node.path("ts").asLong()),
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

    // ==================== Orders ====================

    private OrderResult openPosition(String symbol, PositionSide positionSide, BigDecimal quantity, int leverage,
                                     BigDecimal stopLoss, BigDecimal takeProfit) throws ExchangeException {
        if (!Decimal.isPositive(quantity)) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_QUANTITY,
                    "Open quantity must be positive: " + quantity);
        }
        SymbolRules rules = rulesFor(symbol);
        if (!setLeverage(symbol, leverage)) {
            logger.warn("{} keeps current account leverage", rules.instId);
        }
        BigDecimal contracts = normalizeContracts(quantity, rules);
        OrderResult result = placeMarketOrder(rules, positionSide.openSide(), positionSide, contracts, false);
        logger.info("Opened {} {}: qty={} leverage={}x order={}", positionSide.lowerName(), rules.instId,
                result.getQuantity(), leverage, result.getOrderId());

        BigDecimal orderQty = contractsToBaseQuantity(contracts, rules);
        if (stopLoss != null && stopLoss.signum() > 0) {
            placeProtectiveOrder(rules, positionSide, orderQty, "sl", stopLoss);
        }
        if (takeProfit != null && takeProfit.signum() > 0) {
            placeProtectiveOrder(rules, positionSide, orderQty, "tp", takeProfit);
        }
        return result;
    }

    private OrderResult closePosition(String symbol, PositionSide positionSide, BigDecimal quantity)
            throws ExchangeException {
        Optional<Position> held = Symbols.findPosition(getPositions(), symbol, positionSide);
        if (held.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.POSITION_NOT_FOUND,
                    symbol + " has no " + positionSide.lowerName() + " position to close");
        }
        if (quantity != null && quantity.signum() < 0) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_QUANTITY,
                    "Close quantity must not be negative: " + quantity);
        }
        BigDecimal size = held.get().getSize();
        BigDecimal closeQuantity = quantity == null || quantity.signum() == 0 ? size : quantity;
        if (closeQuantity.compareTo(size) > 0) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_QUANTITY,
                    "Close quantity " + closeQuantity + " exceeds position size " + size);
        }
        SymbolRules rules = rulesFor(symbol);
        // Normalized before cancelling so a rejected quantity leaves protective orders in place.
        BigDecimal contracts = normalizeContracts(closeQuantity, rules);
        cancelAllOrders(symbol);
        OrderResult result = placeMarketOrder(rules, positionSide.closeSide(), positionSide, contracts, true);
        logger.info("Closed {} {}: qty={} order={}", positionSide.lowerName(), rules.instId,
                closeQuantity, result.getOrderId());
        return result;
    }

    private OrderResult placeMarketOrder(SymbolRules rules, Side side, PositionSide positionSide,
                                         BigDecimal contracts, boolean reduceOnly) throws ExchangeException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("instId", rules.instId);
        body.put("tdMode", tdMode);
        body.put("side", side == Side.BUY ? "buy" : "sell");
        body.put("ordType", "market");
        body.put("sz", contracts.toPlainString());
        if (isLongShortMode()) {
            body.put("posSide", positionSide.lowerName());
        } else if (reduceOnly) {
            body.put("reduceOnly", true);
        }

        // OKX trade APIs may return top-level code=1 with per-row sCode/sMsg details.
        JsonNode data = privateRequest("/api/v5/trade/order", "POST", null, body, true).path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.TRADING_ERROR, "Place order returned empty data");
        }
        JsonNode row = data.get(0);
        String sCode = row.path("sCode").asText("0");
        if (!"0".equals(sCode)) {
            throw new ExchangeException(mapErrorCode(0, sCode),
                    "Place order rejected: sCode=" + sCode + ", sMsg=" + row.path("sMsg").asText("unknown"));
        }
        String orderId = row.path("ordId").asText("");
        if (orderId.isBlank()) {
            throw new ExchangeException(ExchangeException.ErrorCode.TRADING_ERROR, "Place order returned empty ordId");
        }

        BigDecimal quantity = contractsToBaseQuantity(contracts, rules);
        JsonNode detail = queryOrderNode(rules.instId, orderId);
        if (detail == null) {
            return OrderResult.builder()
                    .symbol(rules.instId)
                    .orderId(orderId)
                    .clientOrderId(row.path("clOrdId").asText(null))
                    .side(side)
                    .quantity(quantity)
                    .exchange(EXCHANGE_NAME)
                    .rawData(row)
                    .build();
        }
        BigDecimal filled = contractsToBaseQuantity(
                Decimal.parse(detail.path("accFillSz").asText(), BigDecimal.ZERO), rules);
        BigDecimal avgPx = Decimal.parse(detail.path("avgPx").asText(), BigDecimal.ZERO);
        return OrderResult.builder()
                .symbol(rules.instId)
                .orderId(orderId)
                .clientOrderId(detail.path("clOrdId").asText(null))
                .side(side)
                .quantity(quantity)
                .executedQuantity(filled.min(quantity))
                .executedPrice(avgPx.signum() > 0 ? avgPx : null)
                .status(mapOrderStatus(detail.path("state").asText()))
                .fees(Decimal.parse(detail.path("fee").asText(), BigDecimal.ZERO).abs())
                .exchange(EXCHANGE_NAME)
                .rawData(detail)
                .build();
    }

    /**
     * Best effort: a rejected protective order is logged and never fails the entry.
     */
    private void placeProtectiveOrder(SymbolRules rules, PositionSide positionSide, BigDecimal quantity,
                                      String kind, BigDecimal triggerPrice) {
        Side closeSide = positionSide.closeSide();
        try {
            RoundingMode mode = "sl".equals(kind) == (closeSide == Side.SELL) ? RoundingMode.UP : RoundingMode.DOWN;
            BigDecimal trigger = normalizePrice(triggerPrice, rules.tickSize, mode);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("instId", rules.instId);
            body.put("tdMode", tdMode);
            body.put("side", closeSide == Side.BUY ? "buy" : "sell");
            body.put("ordType", "conditional");
            body.put("sz", normalizeContracts(quantity, rules).toPlainString());
            if (isLongShortMode()) {
                body.put("posSide", positionSide.lowerName());
            } else {
                body.put("reduceOnly", "true");
            }
            body.put(kind + "TriggerPx", trigger.toPlainString());
            body.put(kind + "OrdPx", "-1");
            body.put(kind + "TriggerPxType", "mark");

            JsonNode data = privateRequest("/api/v5/trade/order-algo", "POST", null, body, true).path("data");
            JsonNode row = data.isArray() && !data.isEmpty() ? data.get(0) : null;
            if (row == null || !"0".equals(row.path("sCode").asText("0"))) {
                logger.error("Protective {} rejected for {}: {}", kind, rules.instId, row);
                return;
            }
            logger.info("Protective {} placed for {}: trigger={} algoId={}", kind, rules.instId,
                    trigger, row.path("algoId").asText());
        } catch (ExchangeException e) {
            logger.error("Protective {} failed for {} (entry already filled): {}", kind, rules.instId,
                    e.getMessage(), e);
        }
    }

    private boolean cancelPendingOrders(String instId) throws ExchangeException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instType", "SWAP");
        query.put("instId", instId);
        JsonNode data = privateRequestWithRetry("/api/v5/trade/orders-pending", query).path("data");
        List<Map<String, Object>> toCancel = new ArrayList<>();
        for (JsonNode row : data) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("instId", instId);
            item.put("ordId", row.path("ordId").asText());
            toCancel.add(item);
        }
        return cancelInBatches("/api/v5/trade/cancel-batch-orders", toCancel);
    }

    private boolean cancelPendingAlgoOrders(String instId) throws ExchangeException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instType", "SWAP");
        query.put("instId", instId);
        query.put("ordType", "conditional");
        JsonNode data = privateRequestWithRetry("/api/v5/trade/orders-algo-pending", query).path("data");
        List<Map<String, Object>> toCancel = new ArrayList<>();
        for (JsonNode row : data) {
            String algoId = row.path("algoId").asText("");
            if (algoId.isBlank()) {
                continue;
            }
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("algoId", algoId);
            item.put("instId", instId);
            toCancel.add(item);
        }
        return cancelInBatches("/api/v5/trade/cancel-algos", toCancel);
    }

    private boolean cancelInBatches(String path, List<Map<String, Object>> toCancel) throws ExchangeException {
        boolean allCancelled = true;
        for (int i = 0; i < toCancel.size(); i += CANCEL_BATCH_SIZE) {
            List<Map<String, Object>> batch = new ArrayList<>(
                    toCancel.subList(i, Math.min(i + CANCEL_BATCH_SIZE, toCancel.size())));
            JsonNode data = privateRequest(path, "POST", null, batch, true).path("data");
            for (JsonNode item : data) {
                if (!"0".equals(item.path("sCode").asText("0"))) {
                    logger.warn("Cancel rejected: {}", item);
                    allCancelled = false;
                }
            }
        }
        return allCancelled;
    }

    /**
     * Memoized: the account position mode rarely changes and every order depends on it.
     */
    private boolean isLongShortMode() throws ExchangeException {
        Boolean cached = longShortMode;
        if (cached != null) {
            return cached;
        }
        JsonNode data = privateRequestWithRetry("/api/v5/account/config", null).path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.TRADING_ERROR,
                    "Get account config returned empty data");
        }
        boolean hedge = "long_short_mode".equalsIgnoreCase(data.get(0).path("posMode").asText(""));
        longShortMode = hedge;
        return hedge;
    }

    private JsonNode queryOrderNode(String instId, String orderId) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instId", instId);
        query.put("ordId", orderId);
        try {
            JsonNode data = privateRequest("/api/v5/trade/order", "GET", query, null, false).path("data");
            return data.isArray() && !data.isEmpty() ? data.get(0) : null;
        } catch (ExchangeException e) {
            logger.warn("Order {} placed but detail query failed: {}", orderId, e.getMessage());
            return null;
        }
    }

    // ==================== History ====================

    /**
     * OKX history endpoints page backwards from newest using the "after" cursor.
     */
    private List<JsonNode> fetchPaged(String path, String instId, Instant since, String cursorField)
            throws ExchangeException {
        List<JsonNode> rows = new ArrayList<>();
        String after = null;
        while (true) {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("instType", "SWAP");
            query.put("instId", instId);
            query.put("begin", String.valueOf(since.toEpochMilli()));
            query.put("limit", String.valueOf(HISTORY_PAGE_LIMIT));
            if (after != null) {
                query.put("after", after);
            }
            JsonNode data = privateRequestWithRetry(path, query).path("data");
            if (!data.isArray() || data.isEmpty()) {
                break;
            }
            for (JsonNode row : data) {
                rows.add(row);
            }
            if (data.size() < HISTORY_PAGE_LIMIT) {
                break;
            }
            after = data.get(data.size() - 1).path(cursorField).asText(null);
            if (after == null || after.isBlank()) {
                break;
            }
        }
        return rows;
    }

    private ExchangeOrder parseOrder(JsonNode node, SymbolRules rules) {
        BigDecimal amount = contractsToBaseQuantity(Decimal.parse(node.path("sz").asText(), BigDecimal.ZERO), rules);
        BigDecimal filled = contractsToBaseQuantity(
                Decimal.parse(node.path("accFillSz").asText(), BigDecimal.ZERO), rules);
        BigDecimal price = Decimal.parse(node.path("px").asText(), BigDecimal.ZERO);
        BigDecimal avgPx = Decimal.parse(node.path("avgPx").asText(), BigDecimal.ZERO);
        long uTime = node.path("uTime").asLong(0);
        String feeCcy = node.path("feeCcy").asText("");
        return ExchangeOrder.builder()
                .orderId(node.path("ordId").asText())
                .symbol(node.path("instId").asText(rules.instId))
                .side(Side.parse(node.path("side").asText()))
                .type(node.path("ordType").asText("market"))
                .amount(amount)
                .price(price.signum() > 0 ? price : null)
                .filled(filled)
                .averagePrice(avgPx.signum() > 0 ? avgPx : null)
                .cost(filled.multiply(avgPx))
                .fee(Decimal.parse(node.path("fee").asText(), BigDecimal.ZERO).abs())
                .feeCurrency(feeCcy.isBlank() ? null : feeCcy)
                .status(mapOrderStatus(node.path("state").asText()))
                .createdTime(Instant.ofEpochMilli(node.path("cTime").asLong()))
                .updatedTime(uTime > 0 ? Instant.ofEpochMilli(uTime) : null)
                .rawData(node)
                .build();
    }

    static OrderStatus mapOrderStatus(String state) {
        switch (state == null ? "" : state.toLowerCase(Locale.ROOT)) {
            case "filled":
                return OrderStatus.FILLED;
            case "partially_filled":
                return OrderStatus.PARTIALLY_FILLED;
            case "canceled":
            case "mmp_canceled":
                return OrderStatus.CANCELLED;
            default:
                return OrderStatus.PENDING;
        }
    }

    // ==================== Instruments ====================

    private SymbolRules rulesFor(String symbol) throws ExchangeException {
        String instId;
        try {
            instId = toInstId(symbol);
        } catch (IllegalArgumentException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.SYMBOL_NOT_FOUND, e.getMessage(), e);
        }
        return getSymbolRules(instId);
    }

    private SymbolRules getSymbolRules(String instId) throws ExchangeException {
        SymbolRules cached = symbolRulesCache.get(instId);
        long now = System.currentTimeMillis();
        if (cached != null && now - cached.loadedAtMillis <= SYMBOL_RULE_CACHE_TTL_MS) {
            return cached;
        }
        synchronized (symbolRulesCache) {
            cached = symbolRulesCache.get(instId);
            if (cached != null && now - cached.loadedAtMillis <= SYMBOL_RULE_CACHE_TTL_MS) {
                return cached;
            }
            SymbolRules fresh = fetchSymbolRules(instId);
            symbolRulesCache.put(instId, fresh);
            return fresh;
        }
    }

    private SymbolRules fetchSymbolRules(String instId) throws ExchangeException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instType", "SWAP");
        query.put("instId", instId);
        JsonNode data = publicRequest("/api/v5/public/instruments", query).path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.SYMBOL_NOT_FOUND,
                    "Instrument not found: " + instId);
        }
        JsonNode node = data.get(0);
        BigDecimal lotStep = parsePositiveDecimal(node.path("lotSz").asText(), BigDecimal.ONE);
        return new SymbolRules(
                instId,
                parsePositiveDecimal(node.path("tickSz").asText(), new BigDecimal("0.1")),
                lotStep,
                parsePositiveDecimal(node.path("minSz").asText(), lotStep),
                parsePositiveDecimal(node.path("ctVal").asText(), BigDecimal.ONE),
                System.currentTimeMillis()
        );
    }

    private BigDecimal normalizeContracts(BigDecimal baseQuantity, SymbolRules rules) throws ExchangeException {
        if (baseQuantity == null || baseQuantity.signum() <= 0) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_QUANTITY, "Invalid quantity: " + baseQuantity);
        }
        BigDecimal rawContracts = baseQuantity.divide(rules.contractValue, 16, RoundingMode.DOWN);
        BigDecimal normalized = applyStep(rawContracts, rules.lotStepSize);
        if (normalized.signum() <= 0) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_QUANTITY,
                    "Quantity rounded to zero contracts: raw=" + baseQuantity);
        }
        if (normalized.compareTo(rules.minContracts) < 0) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_QUANTITY,
                    "Quantity below min contracts: qty=" + normalized + ", min=" + rules.minContracts);
        }
        return normalized.stripTrailingZeros();
    }

    private BigDecimal contractsToBaseQuantity(BigDecimal contracts, SymbolRules rules) {
        return Decimal.scale(contracts.multiply(rules.contractValue));
    }

    private BigDecimal applyStep(BigDecimal value, BigDecimal step) {
        if (step == null || step.signum() <= 0) {
            return value;
        }
        return value.divide(step, 0, RoundingMode.DOWN).multiply(step);
    }

    private BigDecimal normalizePrice(BigDecimal rawPrice, BigDecimal tickSize, RoundingMode mode) {
        if (tickSize == null || tickSize.signum() <= 0) {
            return Decimal.scale(rawPrice);
        }
        return rawPrice.divide(tickSize, 0, mode).multiply(tickSize).stripTrailingZeros();
    }

    /**
     * BTCUSDT / BTC/USDT:USDT / BTC-USDT-SWAP -> BTC-USDT-SWAP
     */
    static String toInstId(String symbol) {
        String[] parts = Symbols.split(symbol);
        return parts[0] + "-" + parts[1] + "-SWAP";
    }

    private BigDecimal resolveLeverage(JsonNode node) {
        BigDecimal lever = Decimal.parse(node.path("lever").asText(), BigDecimal.ZERO);
        if (lever.signum() > 0) {
            return lever;
        }
        BigDecimal imr = Decimal.parse(node.path("imr").asText(), BigDecimal.ZERO);
        BigDecimal notional = Decimal.parse(node.path("notionalUsd").asText(), BigDecimal.ZERO);
        if (imr.signum() > 0 && notional.signum() > 0) {
            BigDecimal computed = notional.divide(imr, 0, RoundingMode.HALF_UP);
            if (computed.signum() > 0) {
                return computed;
            }
        }
        logger.warn("Leverage unknown for {}, assuming 1x", node.path("instId").asText());
        return BigDecimal.ONE;
    }

    private PositionSide parsePositionSide(String posSide, BigDecimal posContracts) {
        if ("long".equalsIgnoreCase(posSide)) {
            return PositionSide.LONG;
        }
        if ("short".equalsIgnoreCase(posSide)) {
            return PositionSide.SHORT;
        }
        return posContracts.signum() >= 0 ? PositionSide.LONG : PositionSide.SHORT;
    }

    private BigDecimal parsePositiveDecimal(String raw, BigDecimal fallback) {
        BigDecimal value = Decimal.parse(raw, fallback);
        return value.signum() > 0 ? value : fallback;
    }

    private BigDecimal pickFirstPositive(BigDecimal... values) {
        for (BigDecimal v : values) {
            if (v != null && v.signum() > 0) {
                return v;
            }
        }
        return BigDecimal.ZERO;
    }

    private String normalizeBaseUrl(String baseUrl) {
        String value = baseUrl == null || baseUrl.isBlank() ? PROD_BASE_URL : baseUrl.trim();
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    // ==================== HTTP ====================

    private JsonNode publicRequest(String path, Map<String, String> queryParams) throws ExchangeException {
        String query = buildQueryString(queryParams);
        Request.Builder builder = new Request.Builder()
                .url(restBaseUrl + (query.isEmpty() ? path : path + "?" + query))
                .get();
        if (demoTradingEnabled) {
            builder.addHeader("x-simulated-trading", "1");
        }
        return execute(builder.build(), false);
    }

    private JsonNode privateRequestWithRetry(String path, Map<String, String> query) throws ExchangeException {
        ExchangeException last = null;
        for (int attempt = 1; attempt <= 3; attempt++) {
            try {
                return privateRequest(path, "GET", query, null, false);
            } catch (ExchangeException e) {
                last = e;
                if (!isRetryableServiceUnavailable(e) || attempt >= 3) {
                    throw e;
                }
                try {
                    Thread.sleep(200L * attempt);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
        throw last;
    }

    private JsonNode privateRequest(String path,
                                    String method,
                                    Map<String, String> queryParams,
                                    Object bodyParams,
                                    boolean allowCodeOneWithPerRowStatus) throws ExchangeException {
        String query = buildQueryString(queryParams);
        String requestPath = query.isEmpty() ? path : path + "?" + query;
        String upperMethod = method.toUpperCase(Locale.ROOT);
        String bodyJson = toRequestBodyJson(bodyParams);

        String timestamp = Instant.now().truncatedTo(ChronoUnit.MILLIS).toString();
        String signature = sign(timestamp + upperMethod + requestPath + bodyJson, secretKey);

        Request.Builder builder = new Request.Builder()
                .url(restBaseUrl + requestPath)
                .addHeader("OK-ACCESS-KEY", apiKey)
                .addHeader("OK-ACCESS-SIGN", signature)
                .addHeader("OK-ACCESS-TIMESTAMP", timestamp)
                .addHeader("OK-ACCESS-PASSPHRASE", passphrase)
                .addHeader("Content-Type", "application/json");
        if (demoTradingEnabled) {
            builder.addHeader("x-simulated-trading", "1");
        }
        if ("POST".equals(upperMethod)) {
            builder.post(RequestBody.create(bodyJson, JSON_MEDIA_TYPE));
        } else {
            builder.get();
        }
        return execute(builder.build(), allowCodeOneWithPerRowStatus);
    }

    private JsonNode execute(Request request, boolean allowCodeOneWithPerRowStatus) throws ExchangeException {
        String body;
        int httpCode;
        try (Response response = httpClient.newCall(request).execute()) {
            body = response.body() == null ? "" : response.body().string();
            httpCode = response.code();
        } catch (IOException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.CONNECTION,
                    "OKX request failed: " + request.url().encodedPath() + ", " + e.getMessage(), e);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ExchangeException(httpCode >= 300 ? mapErrorCode(httpCode, "") : ExchangeException.ErrorCode.TRADING_ERROR,
                    "OKX returned non-JSON response: HTTP " + httpCode + ": " + body, e);
        }
        String code = root.path("code").asText("");
        if (httpCode < 300 && "0".equals(code)) {
            return root;
        }
        JsonNode data = root.path("data");
        if (httpCode < 300 && allowCodeOneWithPerRowStatus && "1".equals(code) && hasPerRowStatus(data)) {
            return root;
        }
        String message = "OKX API error: HTTP " + httpCode + ", code=" + code
                + ", msg=" + root.path("msg").asText("unknown");
        String detail = buildPerRowStatusDetail(data);
        throw new ExchangeException(mapErrorCode(httpCode, code), detail.isBlank() ? message : message + ", detail=" + detail);
    }

    static ExchangeException.ErrorCode mapErrorCode(int httpCode, String code) {
        if (httpCode == 401 || "50111".equals(code) || "50113".equals(code)
                || "50114".equals(code) || "50105".equals(code)) {
            return ExchangeException.ErrorCode.AUTHENTICATION;
        }
        if (httpCode == 429 || "50011".equals(code)) {
            return ExchangeException.ErrorCode.RATE_LIMIT;
        }
        if (httpCode == 503 || "50001".equals(code)) {
            return ExchangeException.ErrorCode.CONNECTION;
        }
        switch (code == null ? "" : code) {
            case "51008":
                return ExchangeException.ErrorCode.INSUFFICIENT_FUNDS;
            case "51001":
                return ExchangeException.ErrorCode.SYMBOL_NOT_FOUND;
            case "51603":
                return ExchangeException.ErrorCode.ORDER_NOT_FOUND;
            default:
                return ExchangeException.ErrorCode.TRADING_ERROR;
        }
    }

    private boolean isRetryableServiceUnavailable(ExchangeException e) {
        return e.getErrorCode() == ExchangeException.ErrorCode.CONNECTION
                && e.getMessage() != null
                && (e.getMessage().contains("HTTP 503") || e.getMessage().contains("code=50001"));
    }

    private String toRequestBodyJson(Object bodyParams) throws ExchangeException {
        if (bodyParams == null) {
            return "";
        }
        if (bodyParams instanceof Map<?, ?> map && map.isEmpty()) {
            return "";
        }
        if (bodyParams instanceof List<?> list && list.isEmpty()) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(bodyParams);
        } catch (IOException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.TRADING_ERROR, "Serialize request body failed", e);
        }
    }

    private boolean hasPerRowStatus(JsonNode data) {
        if (!data.isArray() || data.isEmpty()) {
            return false;
        }
        JsonNode first = data.get(0);
        return first.has("sCode") || first.has("sMsg");
    }

    private String buildPerRowStatusDetail(JsonNode data) {
        if (!data.isArray() || data.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("; ");
        int count = Math.min(data.size(), 3);
        for (int i = 0; i < count; i++) {
            JsonNode row = data.get(i);
            String sCode = row.path("sCode").asText("");
            String sMsg = row.path("sMsg").asText("");
            if (!sCode.isBlank() || !sMsg.isBlank()) {
                joiner.add("sCode=" + sCode + ", sMsg=" + sMsg);
            }
        }
        return joiner.toString();
    }

    private String buildQueryString(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        // Keep deterministic order for signing.
        Map<String, String> sorted = new TreeMap<>(params);
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("&");
            }
            sb.append(urlEncode(entry.getKey())).append("=").append(urlEncode(entry.getValue()));
        }
        return sb.toString();
    }

    private String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private String sign(String data, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return Base64.getEncoder().encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("Sign failed", e);
        }
    }
}
