package com.agentid.api.store;

/**
 * Sum of score deltas (hundredths) and number of events for one agent.
 */
public record EventTotals(long total, long count) {

    public static final EventTotals EMPTY = new EventTotals(0, 0);
}
