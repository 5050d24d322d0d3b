package com.marketsim.common.exception;

/**
 * Raised when a simulation component is handed data it cannot work with,
 * such as a transition row that does not sum to one.
 *
 * <p>The component name is prefixed to the message so that log lines point
 * straight at the offending table or engine.
 */
public class SimulationException extends RuntimeException {
    private final String component;

    public SimulationException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
