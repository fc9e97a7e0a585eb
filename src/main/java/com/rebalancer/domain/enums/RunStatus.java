package com.rebalancer.domain.enums;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    PARTIAL,
    NO_OP,
    FAILED
}
