package com.tradeagent.exception;

import java.util.List;
import java.util.Map;

/**
 * Fatal misconfiguration detected at startup. Never raised from inside a runner cycle.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(List<String> problems) {
        super(
                ErrorCode.CONFIGURATION_ERROR,
                "Invalid configuration: " + String.join("; ", problems),
                Map.of("problems", List.copyOf(problems)));
    }
}
