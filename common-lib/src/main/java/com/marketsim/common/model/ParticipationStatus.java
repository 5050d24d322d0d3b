package com.marketsim.common.model;

/** Whether an agent is currently invested in the market. */
public enum ParticipationStatus {
    ACTIVE,
    INACTIVE
}
