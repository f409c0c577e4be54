package com.trade.scalp.indicator;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * 指标快照
 * 绑定窗口中最新一根K线，只读
 */
public final class IndicatorSnapshot {
    private final BigDecimal emaShort;
    private final BigDecimal emaLong;
    private final BigDecimal rsi;
    private final BigDecimal macd;
    private final BigDecimal macdSignal;
    private final BigDecimal bbUpper;
    private final BigDecimal bbMiddle;
    private final BigDecimal bbLower;
    private final BigDecimal momentum;
    private final BigDecimal close;          // 最新收盘价
    private final BigDecimal volume;         // 最新成交量
    private final BigDecimal volumeAverage;  // 成交量均值
    private final Instant candleTime;        // 最新K线收盘时间

    private IndicatorSnapshot(Builder builder) {
        this.emaShort = Objects.requireNonNull(builder.emaShort, "emaShort");
        this.emaLong = Objects.requireNonNull(builder.emaLong, "emaLong");
        this.rsi = Objects.requireNonNull(builder.rsi, "rsi");
        this.macd = Objects.requireNonNull(builder.macd, "macd");
        this.macdSignal = Objects.requireNonNull(builder.macdSignal, "macdSignal");
        this.bbUpper = Objects.requireNonNull(builder.bbUpper, "bbUpper");
        this.bbMiddle = Objects.requireNonNull(builder.bbMiddle, "bbMiddle");
        this.bbLower = Objects.requireNonNull(builder.bbLower, "bbLower");
        this.momentum = Objects.requireNonNull(builder.momentum, "momentum");
        this.close = Objects.requireNonNull(builder.close, "close");
        this.volume = builder.volume == null ? BigDecimal.ZERO : builder.volume;
        this.volumeAverage = builder.volumeAverage == null ? BigDecimal.ZERO : builder.volumeAverage;
        this.candleTime = Objects.requireNonNull(builder.candleTime, "candleTime");
    }

    public BigDecimal getEmaShort() { return emaShort; }
    public BigDecimal getEmaLong() { return emaLong; }
    public BigDecimal getRsi() { return rsi; }
    public BigDecimal getMacd() { return macd; }
    public BigDecimal getMacdSignal() { return macdSignal; }
    public BigDecimal getBbUpper() { return bbUpper; }
    public BigDecimal getBbMiddle() { return bbMiddle; }
    public BigDecimal getBbLower() { return bbLower; }
    public BigDecimal getMomentum() { return momentum; }
    public BigDecimal getClose() { return close; }
    public BigDecimal getVolume() { return volume; }
    public BigDecimal getVolumeAverage() { return volumeAverage; }
    public Instant getCandleTime() { return candleTime; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private BigDecimal emaShort;
        private BigDecimal emaLong;
        private BigDecimal rsi;
        private BigDecimal macd;
        private BigDecimal macdSignal;
        private BigDecimal bbUpper;
        private BigDecimal bbMiddle;
        private BigDecimal bbLower;
        private BigDecimal momentum;
        private BigDecimal close;
        private BigDecimal volume;
        private BigDecimal volumeAverage;
        private Instant candleTime;

        public Builder ema(BigDecimal shortValue, BigDecimal longValue) {
            this.emaShort = shortValue;
            this.emaLong = longValue;
            return this;
        }

        public Builder rsi(BigDecimal value) {
            this.rsi = value;
            return this;
        }

        public Builder macd(BigDecimal macdValue, BigDecimal signalValue) {
            this.macd = macdValue;
            this.macdSignal = signalValue;
            return this;
        }

        public Builder bollinger(BigDecimal upper, BigDecimal middle, BigDecimal lower) {
            this.bbUpper = upper;
            this.bbMiddle = middle;
            this.bbLower = lower;
            return this;
        }

        public Builder momentum(BigDecimal value) {
            this.momentum = value;
            return this;
        }

        public Builder close(BigDecimal value) {
            this.close = value;
            return this;
        }

        public Builder volume(BigDecimal value, BigDecimal average) {
            this.volume = value;
            this.volumeAverage = average;
            return this;
        }

        public Builder candleTime(Instant value) {
            this.candleTime = value;
            return this;
        }

        public IndicatorSnapshot build() {
            return new IndicatorSnapshot(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndicatorSnapshot)) return false;
        IndicatorSnapshot that = (IndicatorSnapshot) o;
        return emaShort.equals(that.emaShort) && emaLong.equals(that.emaLong)
                && rsi.equals(that.rsi) && macd.equals(that.macd) && macdSignal.equals(that.macdSignal)
                && bbUpper.equals(that.bbUpper) && bbMiddle.equals(that.bbMiddle) && bbLower.equals(that.bbLower)
                && momentum.equals(that.momentum) && close.equals(that.close)
                && volume.equals(that.volume) && volumeAverage.equals(that.volumeAverage)
                && candleTime.equals(that.candleTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(emaShort, emaLong, rsi, macd, macdSignal, bbUpper, bbMiddle, bbLower,
                momentum, close, volume, volumeAverage, candleTime);
    }

    @Override
    public String toString() {
        return String.format("IndicatorSnapshot{time=%s, close=%s, ema=%s/%s, rsi=%s, macd=%s/%s, bb=[%s,%s,%s], momentum=%s}",
                candleTime, close, emaShort, emaLong, rsi, macd, macdSignal, bbLower, bbMiddle, bbUpper, momentum);
    }
}
