package com.rebalancer.domain.enums;

public enum BuyReason {
    /** First run for the portfolio: every current symbol is bought. */
    INITIAL_ALLOCATION,
    /** Symbol joined the leaderboard since the previous snapshot. */
    ENTRANT,
    /** Symbol stayed on the leaderboard but the portfolio does not own it (manually held or never filled). */
    NOT_OWNED,
    /** Symbol stayed on the leaderboard after shares of it were sold outside the engine. */
    BUYBACK
}
