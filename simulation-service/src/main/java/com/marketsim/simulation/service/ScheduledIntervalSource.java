package com.marketsim.simulation.service;

import com.marketsim.common.engine.IntervalSizeSource;

import java.util.List;

/**
 * Walks a configured step schedule. Once the schedule is used up its last entry
 * repeats; an empty schedule runs the remaining horizon in one interval.
 */
public class ScheduledIntervalSource implements IntervalSizeSource {

    private final List<Integer> schedule;
    private int next;

    public ScheduledIntervalSource(List<Integer> schedule) {
        this.schedule = List.copyOf(schedule);
    }

    @Override
    public int nextInterval(int elapsedPeriods, int remainingPeriods) {
        if (schedule.isEmpty()) {
            return remainingPeriods;
        }
        int idx = Math.min(next, schedule.size() - 1);
        next++;
        return schedule.get(idx);
    }
}
