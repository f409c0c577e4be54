package com.trade.scalp.exchange;

import com.trade.scalp.core.Candle;
import com.trade.scalp.core.Decimal;
import com.trade.scalp.core.Side;
import com.trade.scalp.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 模拟交易所
 *
 * 按最近一次行情价成交，不收手续费。每个交易对记录一笔净持仓，
 * 反向成交时结算盈亏并计入余额。用于回放和测试。
 */
public class PaperExchange implements OrderExecutor, AccountProvider, PriceFeed {

    private static final Logger logger = LoggerFactory.getLogger(PaperExchange.class);

    private final AtomicLong orderSequence = new AtomicLong();

    // 以下字段由 this 保护
    private BigDecimal balance;
    private final Map<Symbol, BigDecimal> prices = new HashMap<>();
    private final Map<Symbol, Fill> openFills = new HashMap<>();

    public PaperExchange(BigDecimal initialBalance) {
        if (!Decimal.isPositive(initialBalance)) {
            throw new IllegalArgumentException("初始余额必须大于0");
        }
        this.balance = initialBalance;
    }

    /**
     * 用收盘价更新行情
     */
    public void onCandle(Candle candle) {
        updatePrice(candle.getSymbol(), candle.getClose());
    }

    public synchronized void updatePrice(Symbol symbol, BigDecimal price) {
        prices.put(symbol, price);
    }

    @Override
    public synchronized String placeOrder(Symbol symbol, Side side, BigDecimal quantity) throws ExchangeException {
        if (!Decimal.isPositive(quantity)) {
            throw new ExchangeException(ExchangeException.ErrorCode.ORDER_REJECTED, "下单数量必须大于0: " + quantity);
        }
        BigDecimal price = priceOf(symbol);
        String orderId = "PAPER-" + orderSequence.incrementAndGet();

        Fill open = openFills.get(symbol);
        if (open == null) {
            openFills.put(symbol, new Fill(side, price, quantity));
            logger.info("[模拟] 开仓成交 {} {} {} @ {} 订单={}", symbol, side, quantity, price, orderId);
            return orderId;
        }

        if (open.side == side) {
            throw new ExchangeException(ExchangeException.ErrorCode.ORDER_REJECTED,
                    "模拟账户不支持加仓: " + symbol + " " + side);
        }
        if (quantity.compareTo(open.quantity) != 0) {
            throw new ExchangeException(ExchangeException.ErrorCode.ORDER_REJECTED,
                    String.format("平仓数量 %s 与持仓 %s 不一致", quantity, open.quantity));
        }

        BigDecimal diff = open.side.isLong() ? price.subtract(open.price) : open.price.subtract(price);
        BigDecimal pnl = Decimal.scalePrice(diff.multiply(quantity));
        balance = balance.add(pnl);
        openFills.remove(symbol);
        logger.info("[模拟] 平仓成交 {} {} {} @ {} 盈亏={} 余额={}", symbol, side, quantity, price, pnl, balance);
        return orderId;
    }

    @Override
    public synchronized BigDecimal getBalance() {
        return balance;
    }

    @Override
    public synchronized BigDecimal getCurrentPrice(Symbol symbol) throws ExchangeException {
        return priceOf(symbol);
    }

    private BigDecimal priceOf(Symbol symbol) throws ExchangeException {
        BigDecimal price = prices.get(symbol);
        if (price == null) {
            throw new ExchangeException(ExchangeException.ErrorCode.NO_PRICE, "无行情: " + symbol);
        }
        return price;
    }

    private static final class Fill {
        private final Side side;
        private final BigDecimal price;
        private final BigDecimal quantity;

        private Fill(Side side, BigDecimal price, BigDecimal quantity) {
            this.side = side;
            this.price = price;
            this.quantity = quantity;
        }
    }
}
