package com.agentdispatch.core.events;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * A message published on the {@link MessageBus}.
 *
 * @param topic     dot-separated topic (e.g. "task.TASK-001")
 * @param payload   arbitrary key-value data; {@code "type"} names the event
 * @param priority  delivery hint
 * @param timestamp when the message was published
 * @param ttl       time to live; null never expires
 * @param sequence  bus-wide monotonically increasing number
 */
public record Message(
    String topic,
    Map<String, Object> payload,
    MessagePriority priority,
    Instant timestamp,
    Duration ttl,
    long sequence
) implements Serializable {

    public Message {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        priority = priority == null ? MessagePriority.NORMAL : priority;
    }

    public boolean isExpired(Instant now) {
        return ttl != null && timestamp.plus(ttl).isBefore(now);
    }

    /** Event type carried in the payload, or null. */
    public String type() {
        Object type = payload.get("type");
        return type == null ? null : type.toString();
    }
}
