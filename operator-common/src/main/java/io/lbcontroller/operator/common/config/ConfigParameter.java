/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.config;

import io.lbcontroller.operator.common.InvalidConfigurationException;

import java.util.HashMap;
import java.util.Map;

/**
 * A configuration parameter identified by a unique key. The key is also the name of the environment variable from
 * which the value is read. Parameters are either required or optional. Optional parameters without a default value
 * resolve to null.
 *
 * @param key           Configuration parameter name/key
 * @param <T>           Type of the parsed value
 * @param type          Parser used to convert the string value
 * @param defaultValue  Default value of the configuration parameter
 * @param required      If the value is required or not
 * @param map           Map that will contain all the configuration parameters
 */
public record ConfigParameter<T>(String key, ConfigParameterParser<T> type, String defaultValue, boolean required, Map<String, ConfigParameter<?>> map) {
    /**
     * Constructor for a required parameter
     *
     * @param key           Configuration parameter name/key
     * @param type          Parser of the value
     * @param map           Configuration map
     */
    public ConfigParameter(String key, ConfigParameterParser<T> type, Map<String, ConfigParameter<?>> map) {
        this(key, type, null, true, map);
        map.put(key(), this);
    }

    /**
     * Constructor for an optional parameter
     *
     * @param key           Configuration parameter name/key
     * @param type          Parser of the value
     * @param defaultValue  Default value of the configuration parameter
     * @param map           Configuration map
     */
    public ConfigParameter(String key, ConfigParameterParser<T> type, String defaultValue, Map<String, ConfigParameter<?>> map) {
        this(key, type, defaultValue, false, map);
        map.put(key(), this);
    }

    /**
     * Parses all known parameters from the given map. Keys which are not known are ignored. Empty values are handled
     * as missing and replaced by the default value.
     *
     * @param envVarMap          Map containing the values set by the user (typically the environment variables)
     * @param configParameterMap Map containing all the known configuration parameters
     *
     * @return  Map with the parsed configuration values
     */
    public static Map<String, Object> define(Map<String, String> envVarMap, Map<String, ConfigParameter<?>> configParameterMap) {
        Map<String, Object> generatedMap = new HashMap<>(configParameterMap.size());

        for (ConfigParameter<?> parameter : configParameterMap.values()) {
            generatedMap.put(parameter.key(), get(envVarMap, parameter));
        }

        return generatedMap;
    }

    private static <T> T get(Map<String, String> map, ConfigParameter<T> parameter) {
        String value = map.get(parameter.key());

        if (value == null || value.isEmpty()) {
            value = parameter.defaultValue();
        }

        if (value != null) {
            return parameter.type().parse(value);
        } else if (parameter.required()) {
            throw new InvalidConfigurationException("Config value: " + parameter.key() + " is mandatory");
        } else {
            return null;
        }
    }
}
