package com.trade.scalp.strategy;

import com.trade.scalp.core.Side;
import com.trade.scalp.core.Symbol;
import com.trade.scalp.indicator.IndicatorSnapshot;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 信号生成器单元测试
 */
class SignalGeneratorTest {

    private static final Symbol BTC = Symbol.of("BTCUSDT");
    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    private static BigDecimal d(String value) {
        return new BigDecimal(value);
    }

    private static IndicatorSnapshot.Builder bullish() {
        return IndicatorSnapshot.builder()
                .close(d("101"))
                .ema(d("100.5"), d("100"))
                .rsi(d("55"))
                .macd(d("0.5"), d("0.2"))
                .bollinger(d("102"), d("100.2"), d("98.4"))
                .momentum(d("1"))
                .volume(d("10"), d("10"))
                .candleTime(NOW);
    }

    private static IndicatorSnapshot.Builder bearish() {
        return IndicatorSnapshot.builder()
                .close(d("99"))
                .ema(d("99.5"), d("100"))
                .rsi(d("40"))
                .macd(d("-0.5"), d("-0.2"))
                .bollinger(d("101.6"), d("99.8"), d("98"))
                .momentum(d("-1"))
                .volume(d("10"), d("10"))
                .candleTime(NOW);
    }

    @Test
    void evaluate_allLongConditionsProduceBuySignal() {
        SignalGenerator generator = new SignalGenerator(new TradingConfig());

        Optional<Signal> signal = generator.evaluate(BTC, bullish().build(), d("101"), false, NOW);

        assertTrue(signal.isPresent());
        Signal s = signal.get();
        assertEquals(Side.BUY, s.getSide());
        assertEquals(0, d("100").compareTo(s.getStrength()));
        // 止损 -0.7%，止盈 +1.8%
        assertEquals(0, d("100.293").compareTo(s.getStopLoss()));
        assertEquals(0, d("102.818").compareTo(s.getTakeProfit()));
        assertEquals(0, d("0.707").compareTo(s.stopDistance()));
        assertEquals(NOW, s.getGeneratedAt());
    }

    @Test
    void evaluate_allShortConditionsProduceSellSignal() {
        SignalGenerator generator = new SignalGenerator(new TradingConfig());

        Signal s = generator.evaluate(BTC, bearish().build(), d("99"), false, NOW).orElseThrow();

        assertEquals(Side.SELL, s.getSide());
        assertEquals(0, d("100").compareTo(s.getStrength()));
        assertEquals(0, d("99.693").compareTo(s.getStopLoss()));
        assertEquals(0, d("97.218").compareTo(s.getTakeProfit()));
    }

    @Test
    void evaluate_longAcceptsLowerRsiBandThanStrength() {
        SignalGenerator generator = new SignalGenerator(new TradingConfig());
        IndicatorSnapshot snapshot = bullish().rsi(d("32")).build();

        Signal s = generator.evaluate(BTC, snapshot, d("101"), false, NOW).orElseThrow();

        // RSI 不在强度中间带 (35,65)，少 1.0 权重：5.5 / 6.5
        assertEquals(0, d("84.62").compareTo(s.getStrength()));
    }

    @Test
    void evaluate_shortRejectsRsiBelowThirtyFive() {
        SignalGenerator generator = new SignalGenerator(new TradingConfig());
        IndicatorSnapshot snapshot = bearish().rsi(d("32")).build();

        assertTrue(generator.evaluate(BTC, snapshot, d("99"), false, NOW).isEmpty());
    }

    @Test
    void evaluate_overboughtRsiBlocksLong() {
        SignalGenerator generator = new SignalGenerator(new TradingConfig());
        IndicatorSnapshot snapshot = bullish().rsi(d("65")).build();

        assertTrue(generator.evaluate(BTC, snapshot, d("101"), false, NOW).isEmpty());
    }

    @Test
    void evaluate_strengthBelowMinimumIsDropped() {
        // 收盘价低于短期EMA，少 1.2 权重：5.3 / 6.5 = 81.54
        IndicatorSnapshot snapshot = bullish().close(d("100.4")).build();
        assertEquals(0, d("81.54").compareTo(SignalGenerator.strength(snapshot, Side.BUY)));

        SignalGenerator strict = new SignalGenerator(
                TradingConfig.builder().minSignalStrength(BigDecimal.valueOf(90)).build());
        SignalGenerator lenient = new SignalGenerator(new TradingConfig());

        assertTrue(strict.evaluate(BTC, snapshot, d("100.4"), false, NOW).isEmpty());
        assertTrue(lenient.evaluate(BTC, snapshot, d("100.4"), false, NOW).isPresent());
    }

    @Test
    void evaluate_noSignalWhilePositionOpen() {
        SignalGenerator generator = new SignalGenerator(new TradingConfig());

        assertTrue(generator.evaluate(BTC, bullish().build(), d("101"), true, NOW).isEmpty());
    }

    @Test
    void evaluate_invalidPriceIsIgnored() {
        SignalGenerator generator = new SignalGenerator(new TradingConfig());

        assertTrue(generator.evaluate(BTC, bullish().build(), BigDecimal.ZERO, false, NOW).isEmpty());
    }

    @Test
    void evaluate_volumeConfirmation() {
        SignalGenerator generator = new SignalGenerator(
                TradingConfig.builder().volumeConfirmation(true, d("1.2")).build());

        assertTrue(generator.evaluate(BTC, bullish().build(), d("101"), false, NOW).isEmpty());
        assertTrue(generator.evaluate(BTC, bullish().volume(d("12"), d("10")).build(), d("101"), false, NOW).isPresent());
    }

    @Test
    void strength_isDirectional() {
        IndicatorSnapshot snapshot = bullish().build();

        assertEquals(0, d("100").compareTo(SignalGenerator.strength(snapshot, Side.BUY)));
        // 做空方向只有 RSI 中间带成立：1.0 / 6.5
        assertEquals(0, d("15.38").compareTo(SignalGenerator.strength(snapshot, Side.SELL)));
    }

    @Test
    void config_stopLossMustNotExceedRiskCap() {
        assertThrows(IllegalArgumentException.class,
                () -> TradingConfig.builder().stopLossPercent(d("6")).build());
        assertThrows(IllegalArgumentException.class,
                () -> TradingConfig.builder().minSignalStrength(d("101")).build());
    }
}
