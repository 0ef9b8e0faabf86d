/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.config;

import io.lbcontroller.operator.common.InvalidConfigurationException;
import io.lbcontroller.operator.common.model.LabelPredicate;

/**
 * Abstraction for things which convert a single configuration parameter value from a String to some specific type.
 */
public interface ConfigParameterParser<T> {
    /**
     * Parses the string based on its type
     *
     * @param configValue config value in String format
     * @throws InvalidConfigurationException if the given configuration value is not supported
     * @return the value based on its type
     */
    T parse(String configValue) throws InvalidConfigurationException;

    /**
     * A java string
     */
    ConfigParameterParser<String> STRING = configValue -> configValue;

    /**
     * A non empty java string
     */
    ConfigParameterParser<String> NON_EMPTY_STRING = configValue -> {
        if (configValue == null || configValue.isBlank()) {
            throw new InvalidConfigurationException("Failed to parse. Value cannot be empty or null");
        } else {
            return configValue.trim();
        }
    };

    /**
     * A Java Long
     */
    ConfigParameterParser<Long> LONG = configValue -> {
        try {
            return Long.parseLong(configValue.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not valid", e);
        }
    };

    /**
     * A Java Integer
     */
    ConfigParameterParser<Integer> INTEGER = configValue -> {
        try {
            return Integer.parseInt(configValue.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not valid", e);
        }
    };

    /**
     * Strictly Positive Number
     *
     * @param parser ConfigParameterParser object
     * @param <T>    Type of parameter
     * @return Positive number
     */
    static <T extends Number> ConfigParameterParser<T> strictlyPositive(ConfigParameterParser<T> parser) {
        return configValue -> {
            var value = parser.parse(configValue);
            if (value.longValue() <= 0) {
                throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " has to be a positive number");
            }
            return value;
        };
    }

    /**
     * A Java Boolean
     */
    ConfigParameterParser<Boolean> BOOLEAN = configValue -> {
        if (configValue.equalsIgnoreCase("true") || configValue.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(configValue);
        } else {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not valid");
        }
    };

    /**
     * A Kubernetes label selector
     */
    ConfigParameterParser<LabelPredicate> LABEL_PREDICATE = selector -> {
        try {
            return LabelPredicate.fromString(selector);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Failed to parse. Value " + selector + " is not a valid label selector", e);
        }
    };
}
