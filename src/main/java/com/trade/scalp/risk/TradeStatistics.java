package com.trade.scalp.risk;

import com.trade.scalp.core.Decimal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 交易统计
 */
public class TradeStatistics {

    private final int totalTrades;
    private final int winningTrades;
    private final int losingTrades;
    private final BigDecimal winRate;
    private final BigDecimal totalPnL;
    private final BigDecimal avgPnL;
    private final BigDecimal avgWin;
    private final BigDecimal avgLoss;
    private final BigDecimal largestWin;
    private final BigDecimal largestLoss;

    public TradeStatistics(int totalTrades, int winningTrades, int losingTrades,
                           BigDecimal winRate, BigDecimal totalPnL, BigDecimal avgPnL,
                           BigDecimal avgWin, BigDecimal avgLoss,
                           BigDecimal largestWin, BigDecimal largestLoss) {
        this.totalTrades = totalTrades;
        this.winningTrades = winningTrades;
        this.losingTrades = losingTrades;
        this.winRate = winRate;
        this.totalPnL = totalPnL;
        this.avgPnL = avgPnL;
        this.avgWin = avgWin;
        this.avgLoss = avgLoss;
        this.largestWin = largestWin;
        this.largestLoss = largestLoss;
    }

    /**
     * 由逐笔盈亏计算统计，盈亏为0的交易计入亏损
     */
    public static TradeStatistics fromPnls(List<BigDecimal> pnls) {
        int wins = 0;
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal winSum = BigDecimal.ZERO;
        BigDecimal lossSum = BigDecimal.ZERO;
        BigDecimal largestWin = BigDecimal.ZERO;
        BigDecimal largestLoss = BigDecimal.ZERO;

        for (BigDecimal pnl : pnls) {
            total = total.add(pnl);
            if (pnl.signum() > 0) {
                wins++;
                winSum = winSum.add(pnl);
                largestWin = Decimal.max(largestWin, pnl);
            } else {
                lossSum = lossSum.add(pnl);
                largestLoss = Decimal.min(largestLoss, pnl);
            }
        }

        int count = pnls.size();
        int losses = count - wins;
        BigDecimal winRate = count == 0 ? BigDecimal.ZERO
                : BigDecimal.valueOf(wins).multiply(Decimal.HUNDRED)
                        .divide(BigDecimal.valueOf(count), Decimal.PERCENT_SCALE, RoundingMode.HALF_UP);

        return new TradeStatistics(count, wins, losses, winRate, total,
                average(total, count), average(winSum, wins), average(lossSum, losses),
                largestWin, largestLoss);
    }

    private static BigDecimal average(BigDecimal sum, int count) {
        return count == 0 ? BigDecimal.ZERO : Decimal.divide(sum, BigDecimal.valueOf(count));
    }

    public int getTotalTrades() { return totalTrades; }
    public int getWinningTrades() { return winningTrades; }
    public int getLosingTrades() { return losingTrades; }
    public BigDecimal getWinRate() { return winRate; }
    public BigDecimal getTotalPnL() { return totalPnL; }
    public BigDecimal getAvgPnL() { return avgPnL; }
    public BigDecimal getAvgWin() { return avgWin; }
    public BigDecimal getAvgLoss() { return avgLoss; }
    public BigDecimal getLargestWin() { return largestWin; }
    public BigDecimal getLargestLoss() { return largestLoss; }

    @Override
    public String toString() {
        return String.format(
                """
                ==================== 交易统计 ====================
                总交易次数:        %d
                盈利次数:          %d
                亏损次数:          %d
                胜率:              %.2f%%
                总盈亏:            %.2f USDT
                平均盈亏:          %.2f USDT
                平均盈利:          %.2f USDT
                平均亏损:          %.2f USDT
                最大盈利:          %.2f USDT
                最大亏损:          %.2f USDT
                ================================================
                """,
                totalTrades, winningTrades, losingTrades, winRate,
                totalPnL, avgPnL, avgWin, avgLoss, largestWin, largestLoss
        );
    }
}
