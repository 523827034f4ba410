package com.pennywise.common.retry;

import com.pennywise.common.model.FailureRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** In-memory ring buffer; the oldest record is dropped once capacity is reached. */
public class CappedLogSink implements LogSink {

    private final int capacity;
    private final Deque<FailureRecord> records = new ArrayDeque<>();

    public CappedLogSink() {
        this(DEFAULT_CAPACITY);
    }

    public CappedLogSink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void append(FailureRecord record) {
        records.addLast(record);
        while (records.size() > capacity) {
            records.removeFirst();
        }
    }

    @Override
    public synchronized List<FailureRecord> readAll() {
        return List.copyOf(records);
    }

    @Override
    public synchronized void clear() {
        records.clear();
    }
}
