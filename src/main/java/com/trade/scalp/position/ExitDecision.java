package com.trade.scalp.position;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * 平仓决定：原因、触发价格、触发时间
 */
public final class ExitDecision {

    private final ExitReason reason;
    private final BigDecimal triggerPrice;
    private final Instant decidedAt;

    public ExitDecision(ExitReason reason, BigDecimal triggerPrice, Instant decidedAt) {
        this.reason = Objects.requireNonNull(reason, "reason");
        this.triggerPrice = Objects.requireNonNull(triggerPrice, "triggerPrice");
        this.decidedAt = Objects.requireNonNull(decidedAt, "decidedAt");
    }

    public ExitReason getReason() { return reason; }
    public BigDecimal getTriggerPrice() { return triggerPrice; }
    public Instant getDecidedAt() { return decidedAt; }

    @Override
    public String toString() {
        return "ExitDecision{" + reason + " @ " + triggerPrice + ", " + decidedAt + "}";
    }
}
