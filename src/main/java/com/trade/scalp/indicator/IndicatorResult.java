package com.trade.scalp.indicator;

import java.util.Optional;

/**
 * 指标计算结果：完整快照，或数据不足
 * 数据不足时不做任何回填
 */
public final class IndicatorResult {

    private final IndicatorSnapshot snapshot;
    private final int available;
    private final int required;

    private IndicatorResult(IndicatorSnapshot snapshot, int available, int required) {
        this.snapshot = snapshot;
        this.available = available;
        this.required = required;
    }

    public static IndicatorResult sufficient(IndicatorSnapshot snapshot, int available, int required) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot 不能为空");
        }
        return new IndicatorResult(snapshot, available, required);
    }

    public static IndicatorResult insufficient(int available, int required) {
        return new IndicatorResult(null, available, required);
    }

    public boolean isSufficient() {
        return snapshot != null;
    }

    public Optional<IndicatorSnapshot> getSnapshot() {
        return Optional.ofNullable(snapshot);
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }

    @Override
    public String toString() {
        return isSufficient()
                ? "IndicatorResult{" + snapshot + "}"
                : String.format("IndicatorResult{insufficient, available=%d, required=%d}", available, required);
    }
}
