package com.rebalancer.exception;

import java.util.List;
import java.util.Map;

/**
 * Invalid portfolio or persistence configuration. Fatal at startup, and re-checked
 * before a run touches the broker.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(List<String> problems) {
        super(
                ErrorCode.CONFIGURATION_ERROR,
                "Invalid rebalancer configuration: " + String.join("; ", problems),
                Map.of("problems", problems));
    }
}
