package org.pragmatica.pulse.window;

import org.pragmatica.pulse.model.ApiEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ring buffer of events for one series, oldest first.
 * <p>
 * The buffer grows by doubling when full and shrinks by half when less than a quarter is used, so retained
 * memory follows the arrival rate over the window rather than a fixed capacity. Not thread-safe: callers hold
 * the owning series lock.
 */
final class EventWindow {
    static final int INITIAL_CAPACITY = 16;

    private ApiEvent[] buffer = new ApiEvent[INITIAL_CAPACITY];

    // Index of the oldest retained event (eviction cursor)
    private int head = 0;
    private int size = 0;

    void append(ApiEvent event) {
        if (size == buffer.length) {
            resize(buffer.length * 2);
        }
        buffer[(head + size) % buffer.length] = event;
        size++;
    }

    /**
     * Evict all events with timestamp strictly before the cutoff.
     *
     * @return number of evicted events
     */
    int evictBefore(Instant cutoff) {
        int evicted = 0;
        while (size > 0 && buffer[head].timestamp()
                                       .isBefore(cutoff)) {
            buffer[head] = null;
            head = (head + 1) % buffer.length;
            size--;
            evicted++;
        }
        if (buffer.length > INITIAL_CAPACITY && size < buffer.length / 4) {
            resize(Math.max(INITIAL_CAPACITY, buffer.length / 2));
        }
        return evicted;
    }

    Optional<ApiEvent> newest() {
        if (size == 0) {
            return Optional.empty();
        }
        return Optional.of(buffer[(head + size - 1) % buffer.length]);
    }

    List<ApiEvent> toList() {
        var result = new ArrayList<ApiEvent>(size);
        for (int i = 0; i < size; i++) {
            result.add(buffer[(head + i) % buffer.length]);
        }
        return result;
    }

    int size() {
        return size;
    }

    int capacity() {
        return buffer.length;
    }

    private void resize(int newCapacity) {
        var resized = new ApiEvent[newCapacity];
        for (int i = 0; i < size; i++) {
            resized[i] = buffer[(head + i) % buffer.length];
        }
        buffer = resized;
        head = 0;
    }
}
