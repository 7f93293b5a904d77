package com.agentdispatch.core.events;

/**
 * Bus-wide counters.
 */
public record BusStatistics(long published, long delivered, long dropped, long expired, int subscribers) {}
