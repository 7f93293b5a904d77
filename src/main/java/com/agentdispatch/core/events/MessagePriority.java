package com.agentdispatch.core.events;

/**
 * Delivery hint carried by every message. Subscribers may filter on it; the bus keeps FIFO
 * order per subscriber regardless of priority.
 */
public enum MessagePriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
