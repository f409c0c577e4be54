package com.trade.scalp.market;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * 可手动推进的时钟
 * 回放历史K线时跟随K线收盘时间，测试中用于精确控制冷却与跨日
 */
public class ReplayClock extends Clock {

    private final ZoneId zone;
    private volatile Instant now;

    public ReplayClock(Instant start, ZoneId zone) {
        this.now = start;
        this.zone = zone;
    }

    public void setInstant(Instant instant) {
        this.now = instant;
    }

    public void advance(Duration duration) {
        this.now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new ReplayClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now;
    }
}
