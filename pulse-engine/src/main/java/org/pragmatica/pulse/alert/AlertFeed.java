package org.pragmatica.pulse.alert;

import org.pragmatica.pulse.model.Anomaly;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded history of transitions for pull consumers.
 * <p>
 * Each appended transition gets the next sequence number. When the history is full the oldest entry is
 * overwritten and counted. A consumer compares the sequence it last read with {@link #oldestSequence()} to detect
 * that it missed overwritten transitions.
 */
final class AlertFeed {
    private final AlertEvent[] buffer;
    private final int capacity;
    private final Runnable onOverwrite;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private int head = 0;
    private int size = 0;
    private long sequence = 0;
    private long overwritten = 0;

    AlertFeed(int capacity, Runnable onOverwrite) {
        this.capacity = capacity;
        this.onOverwrite = onOverwrite;
        this.buffer = new AlertEvent[capacity];
    }

    AlertEvent append(Anomaly anomaly) {
        lock.writeLock()
            .lock();
        try{
            var event = new AlertEvent(++sequence, anomaly);
            buffer[head] = event;
            head = (head + 1) % capacity;
            if (size < capacity) {
                size++;
            } else {
                overwritten++;
                onOverwrite.run();
            }
            return event;
        } finally{
            lock.writeLock()
                .unlock();
        }
    }

    /**
     * All retained transitions with a sequence number greater than the given one, oldest first.
     */
    List<AlertEvent> since(long afterSequence) {
        lock.readLock()
            .lock();
        try{
            var result = new ArrayList<AlertEvent>();
            for (int i = 0; i < size; i++) {
                var event = buffer[(head - size + i + capacity) % capacity];
                if (event.sequence() > afterSequence) {
                    result.add(event);
                }
            }
            return result;
        } finally{
            lock.readLock()
                .unlock();
        }
    }

    /**
     * The most recent N transitions, oldest first.
     */
    List<AlertEvent> recent(int count) {
        lock.readLock()
            .lock();
        try{
            int actualCount = Math.min(count, size);
            var result = new ArrayList<AlertEvent>(actualCount);
            for (int i = size - actualCount; i < size; i++) {
                result.add(buffer[(head - size + i + capacity) % capacity]);
            }
            return result;
        } finally{
            lock.readLock()
                .unlock();
        }
    }

    long latestSequence() {
        lock.readLock()
            .lock();
        try{
            return sequence;
        } finally{
            lock.readLock()
                .unlock();
        }
    }

    /**
     * Sequence number of the oldest retained transition, 0 when the feed is empty.
     */
    long oldestSequence() {
        lock.readLock()
            .lock();
        try{
            return size == 0
                   ? 0
                   : sequence - size + 1;
        } finally{
            lock.readLock()
                .unlock();
        }
    }

    /**
     * Transitions lost because the history was full.
     */
    long overwritten() {
        lock.readLock()
            .lock();
        try{
            return overwritten;
        } finally{
            lock.readLock()
                .unlock();
        }
    }

    int size() {
        lock.readLock()
            .lock();
        try{
            return size;
        } finally{
            lock.readLock()
                .unlock();
        }
    }
}
