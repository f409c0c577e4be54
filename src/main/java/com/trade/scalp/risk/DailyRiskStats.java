package com.trade.scalp.risk;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * 当日风控统计快照（不可变）
 * 实时计数只由 {@link RiskManager} 持有和更新
 */
public final class DailyRiskStats {

    private final LocalDate date;
    private final int tradeCount;
    private final BigDecimal realizedPnl;
    private final int wins;
    private final int losses;

    public DailyRiskStats(LocalDate date, int tradeCount, BigDecimal realizedPnl, int wins, int losses) {
        this.date = Objects.requireNonNull(date, "date");
        this.tradeCount = tradeCount;
        this.realizedPnl = Objects.requireNonNull(realizedPnl, "realizedPnl");
        this.wins = wins;
        this.losses = losses;
    }

    public static DailyRiskStats empty(LocalDate date) {
        return new DailyRiskStats(date, 0, BigDecimal.ZERO, 0, 0);
    }

    DailyRiskStats record(BigDecimal pnl, TradeOutcome outcome) {
        return new DailyRiskStats(date, tradeCount + 1, realizedPnl.add(pnl),
                outcome == TradeOutcome.WIN ? wins + 1 : wins,
                outcome == TradeOutcome.LOSS ? losses + 1 : losses);
    }

    public LocalDate getDate() { return date; }
    public int getTradeCount() { return tradeCount; }
    public BigDecimal getRealizedPnl() { return realizedPnl; }
    public int getWins() { return wins; }
    public int getLosses() { return losses; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DailyRiskStats)) return false;
        DailyRiskStats that = (DailyRiskStats) o;
        return tradeCount == that.tradeCount && wins == that.wins && losses == that.losses
                && date.equals(that.date) && realizedPnl.compareTo(that.realizedPnl) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, tradeCount, realizedPnl.stripTrailingZeros(), wins, losses);
    }

    @Override
    public String toString() {
        return String.format("DailyRiskStats{date=%s, trades=%d, pnl=%s, wins=%d, losses=%d}",
                date, tradeCount, realizedPnl, wins, losses);
    }
}
