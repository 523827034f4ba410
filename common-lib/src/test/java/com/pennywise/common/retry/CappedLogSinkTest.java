package com.pennywise.common.retry;

import com.pennywise.common.model.FailureRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class CappedLogSinkTest {

    private static FailureRecord record(int i) {
        return new FailureRecord("op" + i, "error " + i, 4, "2024-03-01T12:00:00Z");
    }

    @Test
    @DisplayName("keeps only the newest records, oldest first")
    void capsToNewest() {
        CappedLogSink sink = new CappedLogSink(3);
        IntStream.rangeClosed(1, 5).forEach(i -> sink.append(record(i)));

        List<FailureRecord> records = sink.readAll();
        assertEquals(List.of("op3", "op4", "op5"), records.stream().map(FailureRecord::operation).toList());
    }

    @Test
    @DisplayName("default capacity is 50")
    void defaultCapacity() {
        CappedLogSink sink = new CappedLogSink();
        IntStream.rangeClosed(1, 60).forEach(i -> sink.append(record(i)));

        assertEquals(50, sink.readAll().size());
        assertEquals("op11", sink.readAll().get(0).operation());
    }

    @Test
    @DisplayName("clear empties the log")
    void clear() {
        CappedLogSink sink = new CappedLogSink();
        sink.append(record(1));
        sink.clear();
        assertTrue(sink.readAll().isEmpty());
    }

    @Test
    @DisplayName("capacity must be positive")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new CappedLogSink(0));
    }
}
