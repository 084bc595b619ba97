package org.pragmatica.pulse.alert;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded outbound queue of one subscriber.
 * <p>
 * {@link #offer} never blocks: when the queue is full the oldest unread alert is overwritten and the drop counter
 * is incremented.
 */
final class AlertQueue {
    private final AlertEvent[] buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    private int head = 0;
    private int size = 0;
    private long dropped = 0;
    private boolean closed = false;

    AlertQueue(int capacity) {
        this.buffer = new AlertEvent[capacity];
    }

    /**
     * Enqueue an alert, dropping the oldest unread one when full.
     *
     * @return true if an alert was dropped to make room
     */
    boolean offer(AlertEvent event) {
        lock.lock();
        try{
            if (closed) {
                return false;
            }
            boolean overflow = size == buffer.length;
            if (overflow) {
                buffer[head] = null;
                head = (head + 1) % buffer.length;
                size--;
                dropped++;
            }
            buffer[(head + size) % buffer.length] = event;
            size++;
            notEmpty.signal();
            return overflow;
        } finally{
            lock.unlock();
        }
    }

    /**
     * Take the oldest alert, waiting up to the given time.
     *
     * @return empty on timeout or when the queue is closed and drained
     */
    Optional<AlertEvent> poll(long timeout, TimeUnit unit) throws InterruptedException {
        lock.lock();
        try{
            long remaining = unit.toNanos(timeout);
            while (size == 0) {
                if (closed || remaining <= 0) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            var event = buffer[head];
            buffer[head] = null;
            head = (head + 1) % buffer.length;
            size--;
            return Optional.of(event);
        } finally{
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try{
            return size;
        } finally{
            lock.unlock();
        }
    }

    long dropped() {
        lock.lock();
        try{
            return dropped;
        } finally{
            lock.unlock();
        }
    }

    int capacity() {
        return buffer.length;
    }

    void close() {
        lock.lock();
        try{
            closed = true;
            notEmpty.signalAll();
        } finally{
            lock.unlock();
        }
    }
}
