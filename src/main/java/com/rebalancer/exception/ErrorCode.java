package com.rebalancer.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", 400),
    UNAUTHORIZED("UNAUTHORIZED", 401),
    NOT_FOUND("NOT_FOUND", 404),
    REBALANCE_IN_PROGRESS("REBALANCE_IN_PROGRESS", 409),
    ORDER_REJECTED("ORDER_REJECTED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 500),
    SOURCE_UNAVAILABLE("SOURCE_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
