package com.trade.scalp.execution.notifier;

import com.trade.scalp.core.Symbol;
import com.trade.scalp.position.ClosedTrade;
import com.trade.scalp.position.Position;
import com.trade.scalp.risk.RejectReason;
import com.trade.scalp.strategy.Signal;

/**
 * Structured trading events for external notification channels.
 * Formatting is left to the implementation.
 */
public interface TradeEventNotifier {

    void signalGenerated(Signal signal);

    void tradeOpened(Position position);

    /**
     * Closed trade carries exit reason and realized PnL.
     */
    void tradeClosed(ClosedTrade trade);

    void riskRejected(Signal signal, RejectReason reason, String detail);

    /**
     * External or internal failure.
     * @param symbol affected symbol, null for global failures
     */
    void error(String context, Symbol symbol, Throwable cause);

    /**
     * Release resources.
     */
    default void close() {
    }
}
