package com.rebalancer.exception;

public class RebalanceInProgressException extends BaseException {

    public RebalanceInProgressException(String activeRunId) {
        super(ErrorCode.REBALANCE_IN_PROGRESS, "A rebalance run is already in progress: " + activeRunId);
    }
}
