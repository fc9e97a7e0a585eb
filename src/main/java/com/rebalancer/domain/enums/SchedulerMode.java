package com.rebalancer.domain.enums;

/** INTERNAL runs the cron timer in-process; EXTERNAL relies on the webhook only. */
public enum SchedulerMode {
    INTERNAL,
    EXTERNAL
}
