package com.pennywise.common.retry;

import com.pennywise.common.model.FailureRecord;

import java.util.List;

/**
 * Destination for final-failure records of the retry executor. Implementations keep a
 * bounded number of the most recent records.
 */
public interface LogSink {

    int DEFAULT_CAPACITY = 50;

    void append(FailureRecord record);

    /** Oldest first. */
    List<FailureRecord> readAll();

    void clear();
}
