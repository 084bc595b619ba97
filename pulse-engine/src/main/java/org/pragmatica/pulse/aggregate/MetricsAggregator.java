package org.pragmatica.pulse.aggregate;

import org.pragmatica.pulse.model.ApiEvent;
import org.pragmatica.pulse.model.MetricsSnapshot;
import org.pragmatica.pulse.window.WindowView;

import java.util.Arrays;

/**
 * Computes {@link MetricsSnapshot}s from window contents.
 * <p>
 * Statistics are recomputed over the retained window with {@link WelfordAccumulator} on every call; the
 * aggregator keeps no state and has no side effects, so computing twice from the same window yields identical
 * snapshots.
 */
public final class MetricsAggregator {
    private MetricsAggregator() {}

    public static MetricsAggregator metricsAggregator() {
        return new MetricsAggregator();
    }

    /**
     * Statistics over all events in the window.
     */
    public MetricsSnapshot compute(WindowView view) {
        if (view.isEmpty()) {
            return MetricsSnapshot.empty(view.series(), view.windowStart(), view.windowEnd());
        }
        var accumulator = new WelfordAccumulator();
        var values = new double[view.count()];
        int i = 0;
        for (ApiEvent event : view.events()) {
            accumulator.add(event.value());
            values[i++] = event.value();
        }
        Arrays.sort(values);
        var variance = accumulator.variance();
        return new MetricsSnapshot(view.series()
                                       .key(),
                                   view.series()
                                       .metric(),
                                   accumulator.count(),
                                   accumulator.mean(),
                                   variance,
                                   Math.sqrt(variance),
                                   Percentiles.percentile(values, 50),
                                   Percentiles.percentile(values, 95),
                                   Percentiles.percentile(values, 99),
                                   view.windowStart(),
                                   view.windowEnd());
    }

    /**
     * Statistics over the window excluding its most recent event, i.e. the baseline that event is judged against.
     */
    public MetricsSnapshot baseline(WindowView view) {
        return compute(view.withoutLatest());
    }
}
