package com.trade.scalp.risk;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 风控结果：通过（附仓位数量）或拒绝（附原因）
 * 拒绝是正常返回值，不是异常
 */
public final class RiskDecision {

    private final boolean accepted;
    private final BigDecimal quantity;
    private final RejectReason reason;
    private final String detail;

    private RiskDecision(boolean accepted, BigDecimal quantity, RejectReason reason, String detail) {
        this.accepted = accepted;
        this.quantity = quantity;
        this.reason = reason;
        this.detail = detail;
    }

    public static RiskDecision accepted(BigDecimal quantity) {
        return new RiskDecision(true, Objects.requireNonNull(quantity, "quantity"), null, null);
    }

    public static RiskDecision rejected(RejectReason reason, String detail) {
        return new RiskDecision(false, BigDecimal.ZERO, Objects.requireNonNull(reason, "reason"), detail);
    }

    public boolean isAccepted() { return accepted; }
    public BigDecimal getQuantity() { return quantity; }
    public RejectReason getReason() { return reason; }
    public String getDetail() { return detail; }

    @Override
    public String toString() {
        return accepted
                ? "RiskDecision{accepted, quantity=" + quantity + "}"
                : "RiskDecision{rejected, reason=" + reason + ", detail=" + detail + "}";
    }
}
