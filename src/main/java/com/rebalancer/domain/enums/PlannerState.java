package com.rebalancer.domain.enums;

/**
 * States visited by the rebalance planner for one portfolio:
 * IDLE -> DETECTING_CHANGES -> SELLING -> BUYING -> DONE, or straight to DONE when nothing changed.
 */
public enum PlannerState {
    IDLE,
    DETECTING_CHANGES,
    SELLING,
    BUYING,
    DONE
}
