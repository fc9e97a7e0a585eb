package com.rebalancer.exception;

/**
 * Thrown when an external collaborator (leaderboard, broker, ledger store) cannot be
 * reached, answers with an error, or exceeds its call timeout.
 *
 * <p>Scoped to a single portfolio: the engine marks that portfolio FAILED and moves on
 * to the next one.
 */
public class SourceUnavailableException extends BaseException {

    public SourceUnavailableException(String message) {
        super(ErrorCode.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(ErrorCode.SOURCE_UNAVAILABLE, message, cause);
    }
}
