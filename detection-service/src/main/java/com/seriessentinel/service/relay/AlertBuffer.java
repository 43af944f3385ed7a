package com.seriessentinel.service.relay;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity store of the most recent alerts, oldest evicted first.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Every read and every write takes the same {@link ReentrantLock}. Readers
 * receive a copy, so they never observe a buffer that is being mutated.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertBuffer {

    /** Number of alerts kept when no capacity is given. */
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<ReceivedAlert> alerts = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public AlertBuffer() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity maximum number of alerts retained; must be &gt;= 1
     * @throws IllegalArgumentException if {@code capacity} is below 1
     */
    public AlertBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Store an alert, evicting the oldest one when the buffer is full.
     *
     * @param alert the alert to store; must not be {@code null}
     */
    public void add(ReceivedAlert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        lock.lock();
        try {
            alerts.addLast(alert);
            while (alerts.size() > capacity) {
                alerts.pollFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return a copy of the stored alerts, oldest first
     */
    public List<ReceivedAlert> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(alerts);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return alerts.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
