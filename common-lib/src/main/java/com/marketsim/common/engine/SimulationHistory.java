package com.marketsim.common.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of simulated periods, bounded by the run's horizon.
 */
public class SimulationHistory {

    private final int capacity;
    private final List<PeriodRecord> records;

    public SimulationHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.records  = new ArrayList<>(capacity);
    }

    /**
     * @throws IllegalStateException when the history already holds {@code capacity} periods
     */
    public void append(PeriodRecord record) {
        if (records.size() >= capacity) {
            throw new IllegalStateException("History is full at " + capacity + " periods");
        }
        records.add(record);
    }

    public List<PeriodRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int size()     { return records.size(); }
    public int capacity() { return capacity; }
}
