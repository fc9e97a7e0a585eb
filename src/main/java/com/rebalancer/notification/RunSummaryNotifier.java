package com.rebalancer.notification;

/**
 * A channel that receives the rendered summary of a rebalance run.
 */
public interface RunSummaryNotifier {

    /** Channel name used in logs. */
    String channel();

    boolean isEnabled();

    /**
     * Delivers one message. Delivery failures are thrown; the caller logs them.
     *
     * @param body Telegram-style HTML ({@code <b>}, {@code <i>} and newlines only)
     */
    void send(String subject, String body);
}
