package com.trade.scalp.execution.notifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.scalp.core.Symbol;
import com.trade.scalp.position.ClosedTrade;
import com.trade.scalp.position.Position;
import com.trade.scalp.risk.RejectReason;
import com.trade.scalp.strategy.Signal;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Webhook implementation posting one JSON object per event.
 * Sending happens on a single daemon thread and never blocks the caller.
 */
public class WebhookTradeEventNotifier implements TradeEventNotifier {

    private static final Logger logger = LoggerFactory.getLogger(WebhookTradeEventNotifier.class);
    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final long DEDUPE_TTL_MILLIS = TimeUnit.HOURS.toMillis(24);

    private final String source;
    private final String webhookUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final ConcurrentMap<String, Long> sentEventIds;

    public WebhookTradeEventNotifier(String source,
                                     String webhookUrl,
                                     int connectTimeoutMs,
                                     int readTimeoutMs) {
        this.source = source == null ? "unknown" : source;
        this.webhookUrl = webhookUrl;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(Math.max(1000, connectTimeoutMs), TimeUnit.MILLISECONDS)
                .readTimeout(Math.max(1000, readTimeoutMs), TimeUnit.MILLISECONDS)
                .writeTimeout(Math.max(1000, readTimeoutMs), TimeUnit.MILLISECONDS)
                .build();
        this.objectMapper = new ObjectMapper();
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "trade-event-notifier");
            t.setDaemon(true);
            return t;
        });
        this.sentEventIds = new ConcurrentHashMap<>();
    }

    @Override
    public void signalGenerated(Signal signal) {
        sendAsync(signalPayload(signal));
    }

    @Override
    public void tradeOpened(Position position) {
        if (!markEvent("open", position.getOrderId())) {
            return;
        }
        sendAsync(openedPayload(position));
    }

    @Override
    public void tradeClosed(ClosedTrade trade) {
        if (!markEvent("close", trade.getTradeId())) {
            return;
        }
        sendAsync(closedPayload(trade));
    }

    @Override
    public void riskRejected(Signal signal, RejectReason reason, String detail) {
        Map<String, Object> payload = basePayload("risk_rejected", signal.getSymbol());
        payload.put("side", signal.getSide().name());
        payload.put("reason", reason.name());
        payload.put("detail", detail == null ? "" : detail);
        sendAsync(payload);
    }

    @Override
    public void error(String context, Symbol symbol, Throwable cause) {
        Map<String, Object> payload = basePayload("error", symbol);
        payload.put("context", context == null ? "" : context);
        payload.put("errorType", cause == null ? "" : cause.getClass().getSimpleName());
        payload.put("message", cause == null || cause.getMessage() == null ? "" : cause.getMessage());
        sendAsync(payload);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    Map<String, Object> signalPayload(Signal signal) {
        Map<String, Object> payload = basePayload("signal_generated", signal.getSymbol());
        payload.put("side", signal.getSide().name());
        payload.put("price", signal.getPrice());
        payload.put("strength", signal.getStrength());
        payload.put("stopLoss", signal.getStopLoss());
        payload.put("takeProfit", signal.getTakeProfit());
        payload.put("generatedAt", signal.getGeneratedAt().toString());
        return payload;
    }

    Map<String, Object> openedPayload(Position position) {
        Map<String, Object> payload = basePayload("trade_opened", position.getSymbol());
        payload.put("orderId", position.getOrderId() == null ? "" : position.getOrderId());
        payload.put("side", position.getSide().name());
        payload.put("entryPrice", position.getEntryPrice());
        payload.put("quantity", position.getQuantity());
        payload.put("stopLoss", position.getStopLoss());
        payload.put("takeProfit", position.getTakeProfit());
        payload.put("signalStrength", position.getSignalStrength());
        payload.put("openedAt", position.getOpenedAt().toString());
        return payload;
    }

    Map<String, Object> closedPayload(ClosedTrade trade) {
        Map<String, Object> payload = basePayload("trade_closed", trade.getSymbol());
        payload.put("tradeId", trade.getTradeId());
        payload.put("side", trade.getSide().name());
        payload.put("entryPrice", trade.getEntryPrice());
        payload.put("exitPrice", trade.getExitPrice());
        payload.put("quantity", trade.getQuantity());
        payload.put("pnl", trade.getPnl());
        payload.put("reason", trade.getReason().name());
        payload.put("durationSeconds", trade.getHoldingDuration().getSeconds());
        return payload;
    }

    /**
     * Events without an id cannot be deduplicated and are always sent.
     */
    boolean markEvent(String kind, String id) {
        if (id == null || id.isBlank()) {
            return true;
        }
        long now = System.currentTimeMillis();
        Long previous = sentEventIds.putIfAbsent(kind + ":" + id, now);
        cleanupDedupeCache(now);
        return previous == null;
    }

    private void cleanupDedupeCache(long now) {
        if (sentEventIds.size() < 2048) {
            return;
        }
        for (Map.Entry<String, Long> entry : sentEventIds.entrySet()) {
            Long sentAt = entry.getValue();
            if (sentAt == null || now - sentAt > DEDUPE_TTL_MILLIS) {
                sentEventIds.remove(entry.getKey(), sentAt);
            }
        }
    }

    private Map<String, Object> basePayload(String event, Symbol symbol) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", event);
        payload.put("source", source);
        payload.put("symbol", symbol == null ? "" : symbol.toPairString());
        payload.put("timestamp", Instant.now().toString());
        return payload;
    }

    private void sendAsync(Map<String, Object> payload) {
        try {
            executor.execute(() -> send(payload));
        } catch (RejectedExecutionException e) {
            logger.warn("Trade event webhook enqueue failed: {}", e.getMessage());
        }
    }

    private void send(Map<String, Object> payload) {
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(payload);
            Request request = new Request.Builder()
                    .url(webhookUrl)
                    .post(RequestBody.create(bytes, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    logger.warn("Trade event webhook returned non-2xx: event={}, code={}",
                            payload.get("event"), response.code());
                }
            }
        } catch (Exception e) {
            logger.warn("Trade event webhook send failed: event={}, {}", payload.get("event"), e.getMessage());
        }
    }
}
