package com.trade.scalp.execution;

import com.trade.scalp.core.Symbol;
import com.trade.scalp.indicator.IndicatorSnapshot;
import com.trade.scalp.market.PriceWindow;
import com.trade.scalp.position.PositionLifecycle;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个交易对的全部可变状态：价格窗口、持仓状态机、最新指标快照
 *
 * 所有读写必须持有 {@link #lock()}；锁内不做任何外部调用。
 */
public class SymbolContext {

    private final Symbol symbol;
    private final ReentrantLock lock = new ReentrantLock();
    private final PriceWindow window;
    private final PositionLifecycle lifecycle;
    private IndicatorSnapshot snapshot;

    public SymbolContext(Symbol symbol, PriceWindow window, PositionLifecycle lifecycle) {
        this.symbol = symbol;
        this.window = window;
        this.lifecycle = lifecycle;
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public PriceWindow window() {
        checkLocked();
        return window;
    }

    public PositionLifecycle lifecycle() {
        checkLocked();
        return lifecycle;
    }

    public IndicatorSnapshot snapshot() {
        checkLocked();
        return snapshot;
    }

    public void updateSnapshot(IndicatorSnapshot snapshot) {
        checkLocked();
        this.snapshot = snapshot;
    }

    /**
     * 无锁读取是否有敞口，仅用于持仓计数
     */
    boolean hasExposure() {
        return lifecycle.hasExposure();
    }

    private void checkLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException(symbol + " 交易对状态必须在锁内访问");
        }
    }
}
