package org.pragmatica.pulse.alert;

import org.pragmatica.pulse.config.AlertConfig;
import org.pragmatica.pulse.model.Anomaly;
import org.pragmatica.pulse.observability.PulseMetrics;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes severity transitions to pull and push consumers.
 * <p>
 * {@link #notify(Anomaly)} appends the transition to a bounded feed and offers it to every subscription's bounded
 * queue. It never blocks and never fails: a full subscriber queue drops its oldest unread alert and counts the
 * drop. A full feed overwrites its oldest transition and counts that as a drop of the {@value #FEED} consumer.
 * Delivery to subscribers happens on their own threads. Transitions of one series reach every consumer in the
 * order they were produced.
 */
public final class AlertDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    /**
     * Drop meter tag of the pull feed.
     */
    public static final String FEED = "feed";

    private final AlertFeed feed;
    private final int queueCapacity;
    private final PulseMetrics metrics;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    // Drops of subscriptions that are already closed
    private final AtomicLong closedDrops = new AtomicLong();

    private AlertDispatcher(AlertConfig config, PulseMetrics metrics) {
        this.feed = new AlertFeed(config.historyCapacity(), () -> metrics.recordDropped(FEED));
        this.queueCapacity = config.queueCapacity();
        this.metrics = metrics;
    }

    public static AlertDispatcher alertDispatcher(AlertConfig config, PulseMetrics metrics) {
        return new AlertDispatcher(config, metrics);
    }

    /**
     * Publish an evaluation. Evaluations that did not change severity are ignored.
     */
    public void notify(Anomaly anomaly) {
        if (!anomaly.isTransition()) {
            return;
        }
        var event = feed.append(anomaly);
        metrics.recordTransition(anomaly.severity()
                                        .name());
        for (var subscription : subscriptions) {
            subscription.enqueue(event);
        }
    }

    /**
     * Subscribe to transitions published from now on.
     *
     * @param name       Subscriber name, used for the delivery thread and drop metrics
     * @param subscriber Callback invoked on the subscription's delivery thread
     */
    public Subscription subscribe(String name, AlertSubscriber subscriber) {
        var subscription = Subscription.subscription(name, subscriber, queueCapacity, metrics, this::closed);
        subscriptions.add(subscription);
        log.info("Subscriber {} registered (queue capacity {})", name, queueCapacity);
        return subscription;
    }

    /**
     * Retained transitions with a sequence number greater than the given one, oldest first.
     * Pass 0 to read the whole retained history.
     */
    public List<AlertEvent> since(long sequence) {
        return feed.since(sequence);
    }

    /**
     * The most recent N transitions, oldest first.
     */
    public List<AlertEvent> recent(int count) {
        return feed.recent(count);
    }

    /**
     * Sequence number of the oldest transition still in the feed, 0 when none. A reader whose last seen sequence
     * is below {@code oldestSequence() - 1} has missed transitions.
     */
    public long oldestSequence() {
        return feed.oldestSequence();
    }

    /**
     * Sequence number of the latest published transition, 0 when none.
     */
    public long latestSequence() {
        return feed.latestSequence();
    }

    /**
     * Total alerts dropped since start: subscriber queue overflows, including those of closed subscriptions, and
     * transitions overwritten in the feed.
     */
    public long droppedCount() {
        return closedDrops.get() + feed.overwritten() + subscriptions.stream()
                                                                     .mapToLong(Subscription::dropped)
                                                                     .sum();
    }

    public List<Subscription> subscriptions() {
        return List.copyOf(subscriptions);
    }

    private void closed(Subscription subscription) {
        // Counted before removal so the total never goes down
        closedDrops.addAndGet(subscription.dropped());
        subscriptions.remove(subscription);
    }

    @Override
    public void close() {
        for (var subscription : List.copyOf(subscriptions)) {
            subscription.close();
        }
    }
}
