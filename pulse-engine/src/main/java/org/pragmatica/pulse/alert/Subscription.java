package org.pragmatica.pulse.alert;

import org.pragmatica.pulse.observability.PulseMetrics;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Push subscription: a bounded queue drained by a dedicated daemon thread that hands alerts to the subscriber.
 * <p>
 * Closing stops delivery; alerts still queued at that point are discarded. A subscriber that throws an
 * {@link Error} ends its own subscription.
 */
public final class Subscription implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Subscription.class);
    private static final long POLL_INTERVAL_MS = 100;
    private static final long DROP_LOG_INTERVAL = 1000;

    private final String name;
    private final AlertSubscriber subscriber;
    private final AlertQueue queue;
    private final PulseMetrics metrics;
    private final Consumer<Subscription> onClose;
    private final ExecutorService worker;
    private final AtomicBoolean running = new AtomicBoolean(true);

    private Subscription(String name,
                         AlertSubscriber subscriber,
                         int queueCapacity,
                         PulseMetrics metrics,
                         Consumer<Subscription> onClose) {
        this.name = name;
        this.subscriber = subscriber;
        this.queue = new AlertQueue(queueCapacity);
        this.metrics = metrics;
        this.onClose = onClose;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            var thread = new Thread(runnable, "pulse-alerts-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    static Subscription subscription(String name,
                                     AlertSubscriber subscriber,
                                     int queueCapacity,
                                     PulseMetrics metrics,
                                     Consumer<Subscription> onClose) {
        var subscription = new Subscription(name, subscriber, queueCapacity, metrics, onClose);
        subscription.worker.submit(subscription::deliveryLoop);
        return subscription;
    }

    public String name() {
        return name;
    }

    /**
     * Alerts dropped so far because the queue was full.
     */
    public long dropped() {
        return queue.dropped();
    }

    /**
     * Alerts waiting for delivery.
     */
    public int pending() {
        return queue.size();
    }

    public boolean isActive() {
        return running.get();
    }

    /**
     * Hand an alert to the queue. Never blocks.
     */
    void enqueue(AlertEvent event) {
        if (!running.get()) {
            return;
        }
        if (queue.offer(event)) {
            metrics.recordDropped(name);
            var dropped = queue.dropped();
            if (dropped == 1 || dropped % DROP_LOG_INTERVAL == 0) {
                log.warn("Subscriber {} queue full (capacity {}), {} alerts dropped so far",
                         name,
                         queue.capacity(),
                         dropped);
            }
        }
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        queue.close();
        worker.shutdown();
        try{
            if (!worker.awaitTermination(1, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread()
                  .interrupt();
        }
        onClose.accept(this);
        log.debug("Subscription {} closed", name);
    }

    private void deliveryLoop() {
        try{
            while (running.get() && !Thread.currentThread()
                                           .isInterrupted()) {
                try{
                    queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)
                         .ifPresent(this::deliver);
                } catch (InterruptedException e) {
                    Thread.currentThread()
                          .interrupt();
                }
            }
        } catch (Error e) {
            log.error("Subscriber {} delivery stopped: {}", name, e.toString(), e);
            throw e;
        } finally{
            // Loop ended without close(): release the subscription here
            if (running.compareAndSet(true, false)) {
                queue.close();
                worker.shutdown();
                onClose.accept(this);
                log.warn("Subscription {} terminated", name);
            }
        }
    }

    private void deliver(AlertEvent event) {
        try{
            subscriber.onAlert(event);
        } catch (RuntimeException e) {
            log.error("Subscriber {} failed to handle alert {}: {}", name, event.sequence(), e.getMessage(), e);
        }
    }
}
