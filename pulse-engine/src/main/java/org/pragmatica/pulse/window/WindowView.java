package org.pragmatica.pulse.window;

import org.pragmatica.pulse.model.ApiEvent;
import org.pragmatica.pulse.model.SeriesKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable copy of a series window taken after an eviction pass.
 *
 * @param series      Series the events belong to
 * @param events      Retained events, oldest first
 * @param windowStart Eviction cutoff (now - W)
 * @param windowEnd   Time of the eviction pass (now)
 */
public record WindowView(SeriesKey series, List<ApiEvent> events, Instant windowStart, Instant windowEnd) {
    public WindowView {
        events = List.copyOf(events);
    }

    public static WindowView windowView(SeriesKey series, List<ApiEvent> events, Instant windowStart, Instant windowEnd) {
        return new WindowView(series, events, windowStart, windowEnd);
    }

    public int count() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * Most recently admitted event.
     */
    public Optional<ApiEvent> latest() {
        return events.isEmpty()
               ? Optional.empty()
               : Optional.of(events.get(events.size() - 1));
    }

    /**
     * The same window without its most recent event.
     */
    public WindowView withoutLatest() {
        return events.isEmpty()
               ? this
               : new WindowView(series, events.subList(0, events.size() - 1), windowStart, windowEnd);
    }
}
