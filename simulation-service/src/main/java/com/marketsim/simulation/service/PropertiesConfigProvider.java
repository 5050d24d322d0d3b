package com.marketsim.simulation.service;

import com.marketsim.common.engine.IntervalSizeSource;

import java.util.Objects;

/**
 * Non-interactive provider: parameters and step schedule come from configuration
 * or a REST request.
 */
public class PropertiesConfigProvider implements ConfigProvider {

    private final RunParameters parameters;

    public PropertiesConfigProvider(RunParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
    }

    @Override
    public RunParameters parameters() {
        return parameters;
    }

    @Override
    public IntervalSizeSource intervals(RunParameters parameters) {
        return new ScheduledIntervalSource(parameters.stepSchedule());
    }
}
