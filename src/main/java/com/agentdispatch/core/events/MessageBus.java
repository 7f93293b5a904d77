package com.agentdispatch.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for dispatch events.
 * <p>
 * {@link #publish} never blocks: each subscriber owns a bounded queue, and a message that
 * does not fit is dropped for that subscriber only (its drop counter increments). Queues are
 * drained serially on the delivery executor, so ordering holds per (topic, subscriber).
 * A handler that throws is retried up to {@code maxDeliveryAttempts} times before the
 * failure is logged. A bounded history serves {@link #recent} queries for late subscribers.
 */
public class MessageBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private final int defaultQueueBound;
    private final int historySize;
    private final int maxDeliveryAttempts;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private final Deque<Message> history = new ArrayDeque<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong totalDelivered = new AtomicLong();
    private final AtomicLong totalDropped = new AtomicLong();
    private final AtomicLong totalExpired = new AtomicLong();
    private final List<Consumer<String>> dropListeners = new CopyOnWriteArrayList<>();

    /**
     * Bus with its own daemon delivery threads.
     */
    public MessageBus(int defaultQueueBound, int historySize, int maxDeliveryAttempts) {
        this(defaultQueueBound, historySize, maxDeliveryAttempts, null);
    }

    /**
     * @param executor runs subscriber drain loops; null creates an owned cached pool
     */
    public MessageBus(int defaultQueueBound, int historySize, int maxDeliveryAttempts, Executor executor) {
        if (defaultQueueBound < 1 || maxDeliveryAttempts < 1 || historySize < 0) {
            throw new IllegalArgumentException("queueBound and maxDeliveryAttempts must be >= 1, historySize >= 0");
        }
        this.defaultQueueBound = defaultQueueBound;
        this.historySize = historySize;
        this.maxDeliveryAttempts = maxDeliveryAttempts;
        if (executor == null) {
            this.ownedExecutor = Executors.newCachedThreadPool(daemonThreads());
            this.executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.executor = executor;
        }
    }

    // ── Publishing ───────────────────────────────────────────────────────

    public Message publish(String topic, Map<String, Object> payload) {
        return publish(topic, payload, MessagePriority.NORMAL, null);
    }

    /**
     * Publishes a message to every active subscriber whose pattern matches {@code topic}.
     * Fire-and-forget: returns immediately, whatever the subscribers' state.
     *
     * @param ttl null for no expiry
     */
    public Message publish(String topic, Map<String, Object> payload, MessagePriority priority, Duration ttl) {
        var message = new Message(topic, payload, priority, Instant.now(), ttl, sequence.incrementAndGet());
        published.incrementAndGet();
        remember(message);
        log.debug("Publishing {} on {} (#{})", message.type(), topic, message.sequence());

        for (Subscriber subscriber : subscribers) {
            if (!subscriber.active.get() || !TopicMatcher.matches(subscriber.pattern, topic)) {
                continue;
            }
            if (subscriber.queue.offer(message)) {
                schedule(subscriber);
            } else {
                subscriber.dropped.incrementAndGet();
                totalDropped.incrementAndGet();
                log.debug("Subscriber {} queue full, dropped #{} on {}",
                        subscriber.pattern, message.sequence(), topic);
                dropListeners.forEach(l -> l.accept(topic));
            }
        }
        return message;
    }

    // ── Subscribing ──────────────────────────────────────────────────────

    public Subscription subscribe(String topicPattern, Consumer<Message> handler) {
        return subscribe(topicPattern, handler, defaultQueueBound);
    }

    /**
     * @param topicPattern exact topic or a {@code *} wildcard pattern
     * @param queueBound   capacity of this subscriber's queue
     */
    public Subscription subscribe(String topicPattern, Consumer<Message> handler, int queueBound) {
        var subscriber = new Subscriber(topicPattern, handler, queueBound);
        subscribers.add(subscriber);
        log.debug("Subscribed to {} (queue bound {})", topicPattern, queueBound);
        return subscriber;
    }

    /** Notified with the topic each time a message is dropped for some subscriber. */
    public void onDrop(Consumer<String> listener) {
        dropListeners.add(listener);
    }

    // ── Queries ──────────────────────────────────────────────────────────

    /**
     * Up to {@code limit} most recent messages matching {@code topicPattern}, oldest first.
     * Limited by the history bound; not a replay guarantee.
     */
    public List<Message> recent(String topicPattern, int limit) {
        var matched = new ArrayList<Message>();
        synchronized (history) {
            var it = history.descendingIterator();
            while (it.hasNext() && matched.size() < limit) {
                Message m = it.next();
                if (TopicMatcher.matches(topicPattern, m.topic())) {
                    matched.add(m);
                }
            }
        }
        Collections.reverse(matched);
        return matched;
    }

    public BusStatistics statistics() {
        int active = (int) subscribers.stream().filter(s -> s.active.get()).count();
        return new BusStatistics(published.get(), totalDelivered.get(), totalDropped.get(),
                totalExpired.get(), active);
    }

    @Override
    public void close() {
        subscribers.forEach(Subscriber::unsubscribe);
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    // ── Delivery ─────────────────────────────────────────────────────────

    private void remember(Message message) {
        if (historySize == 0) {
            return;
        }
        synchronized (history) {
            history.addLast(message);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }
    }

    private void schedule(Subscriber subscriber) {
        if (!subscriber.draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(() -> drain(subscriber));
        } catch (RejectedExecutionException e) {
            subscriber.draining.set(false);
            log.warn("Delivery executor rejected drain for {}: {}", subscriber.pattern, e.getMessage());
        }
    }

    private void drain(Subscriber subscriber) {
        try {
            Message message;
            while (subscriber.active.get() && (message = subscriber.queue.poll()) != null) {
                deliver(subscriber, message);
            }
        } finally {
            subscriber.draining.set(false);
        }
        // a publish may have slipped in between the last poll and the flag reset
        if (subscriber.active.get() && !subscriber.queue.isEmpty()) {
            schedule(subscriber);
        }
    }

    private void deliver(Subscriber subscriber, Message message) {
        if (message.isExpired(Instant.now())) {
            subscriber.expired.incrementAndGet();
            totalExpired.incrementAndGet();
            return;
        }
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxDeliveryAttempts; attempt++) {
            try {
                subscriber.handler.accept(message);
                subscriber.delivered.incrementAndGet();
                totalDelivered.incrementAndGet();
                return;
            } catch (RuntimeException e) {
                last = e;
                log.debug("Subscriber {} failed on #{} (attempt {}/{}): {}",
                        subscriber.pattern, message.sequence(), attempt, maxDeliveryAttempts, e.getMessage());
            }
        }
        subscriber.failed.incrementAndGet();
        log.warn("Subscriber {} gave up on {} #{} after {} attempts: {}",
                subscriber.pattern, message.topic(), message.sequence(), maxDeliveryAttempts,
                last.getMessage(), last);
    }

    private static ThreadFactory daemonThreads() {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "bus-delivery-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private final class Subscriber implements Subscription {
        final String pattern;
        final Consumer<Message> handler;
        final BlockingQueue<Message> queue;
        final AtomicBoolean active = new AtomicBoolean(true);
        final AtomicBoolean draining = new AtomicBoolean();
        final AtomicLong delivered = new AtomicLong();
        final AtomicLong dropped = new AtomicLong();
        final AtomicLong expired = new AtomicLong();
        final AtomicLong failed = new AtomicLong();

        Subscriber(String pattern, Consumer<Message> handler, int queueBound) {
            this.pattern = pattern;
            this.handler = handler;
            this.queue = new ArrayBlockingQueue<>(queueBound);
        }

        @Override
        public String pattern() {
            return pattern;
        }

        @Override
        public long delivered() {
            return delivered.get();
        }

        @Override
        public long dropped() {
            return dropped.get();
        }

        @Override
        public long expired() {
            return expired.get();
        }

        @Override
        public long failed() {
            return failed.get();
        }

        @Override
        public int pending() {
            return queue.size();
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                subscribers.remove(this);
                queue.clear();
            }
        }
    }
}
