package org.pragmatica.pulse.window;

import org.pragmatica.pulse.model.ApiEvent;
import org.pragmatica.pulse.model.MetricName;
import org.pragmatica.pulse.model.SeriesKey;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-series sliding time windows.
 * <p>
 * Every (key, metric) series has its own ring buffer and its own lock, so operations on different series never
 * contend. Eviction is lazy: events older than {@code now - W} are dropped on admission and on read, never by a
 * background sweep. Series are created on first admission.
 * <p>
 * A series found empty by a read is reclaimed: the idle listener is notified and the series is removed from the
 * store while its lock is still held. A later admission for the same key starts a fresh series.
 * <p>
 * Within one series, receipt timestamps are kept non-decreasing: an event stamped earlier than the newest
 * retained event (e.g. after a wall clock step backwards) is re-stamped with the newest timestamp, so the window
 * is never reordered.
 */
public final class WindowStore {
    private static final Logger log = LoggerFactory.getLogger(WindowStore.class);

    private final Duration window;
    private final Clock clock;
    private final Consumer<SeriesKey> onIdle;
    private final Map<SeriesKey, Series> series = new ConcurrentHashMap<>();

    private WindowStore(Duration window, Clock clock, Consumer<SeriesKey> onIdle) {
        this.window = window;
        this.clock = clock;
        this.onIdle = onIdle;
    }

    public static WindowStore windowStore(Duration window, Clock clock) {
        return new WindowStore(window, clock, key -> {});
    }

    /**
     * @param onIdle Called under the series lock when a read finds the series empty and reclaims it
     */
    public static WindowStore windowStore(Duration window, Clock clock, Consumer<SeriesKey> onIdle) {
        return new WindowStore(window, clock, onIdle);
    }

    /**
     * Append an event to its series and evict stale events.
     *
     * @return the window after admission
     */
    public WindowView admit(String key, MetricName metric, ApiEvent event) {
        if (!event.seriesKey()
                  .equals(SeriesKey.seriesKey(key, metric))) {
            throw new IllegalArgumentException("Event " + event.seriesKey() + " does not belong to series " + key + "/"
                                               + metric.wireName());
        }
        return update(event, Function.identity());
    }

    /**
     * Currently retained events of a series, oldest first. Empty for an unknown series.
     */
    public List<ApiEvent> snapshot(String key, MetricName metric) {
        return read(SeriesKey.seriesKey(key, metric), WindowView::events).orElse(List.of());
    }

    /**
     * Admit an event and run {@code step} on the resulting window while still holding the series lock.
     * Steps for the same series are linearizable with respect to each other and to admissions.
     */
    public <R> R update(ApiEvent event, Function<WindowView, R> step) {
        while (true) {
            var target = series.computeIfAbsent(event.seriesKey(), Series::new);
            target.lock.lock();
            try{
                if (target.reclaimed) {
                    // lost the race with a reclaiming read, retry with a fresh series
                    continue;
                }
                return admit(target, event, step);
            } finally{
                target.lock.unlock();
            }
        }
    }

    // Called with lock held
    private <R> R admit(Series target, ApiEvent event, Function<WindowView, R> step) {
        var admitted = target.window.newest()
                                    .filter(newest -> event.timestamp()
                                                           .isBefore(newest.timestamp()))
                                    .map(newest -> event.withTimestamp(newest.timestamp()))
                                    .orElse(event);
        target.window.append(admitted);
        return step.apply(target.view());
    }

    /**
     * Evict stale events of a series and run {@code step} on the result while holding the series lock.
     * A series left empty is reclaimed before {@code step} runs.
     *
     * @return empty for an unknown series
     */
    public <R> Optional<R> read(SeriesKey key, Function<WindowView, R> step) {
        var target = series.get(key);
        if (target == null) {
            return Optional.empty();
        }
        target.lock.lock();
        try{
            if (target.reclaimed) {
                return Optional.empty();
            }
            var view = target.view();
            if (view.isEmpty()) {
                reclaim(target);
            }
            return Optional.ofNullable(step.apply(view));
        } finally{
            target.lock.unlock();
        }
    }

    // Called with lock held
    private void reclaim(Series target) {
        target.reclaimed = true;
        onIdle.accept(target.key);
        series.remove(target.key, target);
        log.debug("Reclaimed idle series {}", target.key);
    }

    public Set<SeriesKey> seriesKeys() {
        return Set.copyOf(series.keySet());
    }

    public int seriesCount() {
        return series.size();
    }

    public Duration window() {
        return window;
    }

    private final class Series {
        private final SeriesKey key;
        private final ReentrantLock lock = new ReentrantLock();
        private final EventWindow window = new EventWindow();
        private boolean reclaimed = false;

        private Series(SeriesKey key) {
            this.key = key;
        }

        // Called with lock held
        private WindowView view() {
            var now = clock.instant();
            var cutoff = now.minus(WindowStore.this.window);
            var evicted = window.evictBefore(cutoff);
            if (evicted > 0) {
                log.trace("Evicted {} events from {} (retained {})", evicted, key, window.size());
            }
            return WindowView.windowView(key, window.toList(), cutoff, now);
        }
    }
}
