package com.trade.scalp.execution.notifier;

import com.trade.scalp.core.ConfigManager;

/**
 * Factory for trade event notifier.
 */
public final class TradeEventNotifierFactory {

    private TradeEventNotifierFactory() {
    }

    public static TradeEventNotifier fromConfig(ConfigManager cfg, String source) {
        boolean enabled = cfg.getBooleanProperty("notify.webhook.enabled", false);
        String webhookUrl = cfg.getProperty("notify.webhook.url", "").trim();
        if (!enabled || webhookUrl.isEmpty()) {
            return NoopTradeEventNotifier.INSTANCE;
        }
        int connectTimeoutMs = cfg.getIntProperty("notify.webhook.connect.timeout.ms", 3000);
        int readTimeoutMs = cfg.getIntProperty("notify.webhook.read.timeout.ms", 3000);
        return new WebhookTradeEventNotifier(source, webhookUrl, connectTimeoutMs, readTimeoutMs);
    }
}
