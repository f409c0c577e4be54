package com.trade.scalp.execution.notifier;

import com.trade.scalp.core.Symbol;
import com.trade.scalp.position.ClosedTrade;
import com.trade.scalp.position.Position;
import com.trade.scalp.risk.RejectReason;
import com.trade.scalp.strategy.Signal;

/**
 * No-op implementation.
 */
public final class NoopTradeEventNotifier implements TradeEventNotifier {

    public static final NoopTradeEventNotifier INSTANCE = new NoopTradeEventNotifier();

    private NoopTradeEventNotifier() {
    }

    @Override
    public void signalGenerated(Signal signal) {
        // no-op
    }

    @Override
    public void tradeOpened(Position position) {
        // no-op
    }

    @Override
    public void tradeClosed(ClosedTrade trade) {
        // no-op
    }

    @Override
    public void riskRejected(Signal signal, RejectReason reason, String detail) {
        // no-op
    }

    @Override
    public void error(String context, Symbol symbol, Throwable cause) {
        // no-op
    }
}
