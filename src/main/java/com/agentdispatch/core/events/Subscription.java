package com.agentdispatch.core.events;

/**
 * Handle returned by {@link MessageBus#subscribe}. Exposes per-subscriber delivery counters.
 */
public interface Subscription {

    String pattern();

    /** Messages handed to the handler successfully. */
    long delivered();

    /** Messages rejected because the subscriber's queue was full. */
    long dropped();

    /** Messages whose ttl elapsed before delivery. */
    long expired();

    /** Messages whose handler kept throwing after every delivery attempt. */
    long failed();

    /** Messages currently queued for this subscriber. */
    int pending();

    boolean isActive();

    void unsubscribe();
}
