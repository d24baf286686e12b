package com.purchasingpower.newsgraph.exception;

import lombok.Getter;

/**
 * A required credential or parameter is missing or malformed. Always fatal.
 */
@Getter
public class ConfigurationException extends NewsGraphException {

    private final String property;

    public ConfigurationException(String property, String message) {
        super(message);
        this.property = property;
    }
}
