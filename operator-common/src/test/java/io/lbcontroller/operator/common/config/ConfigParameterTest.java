/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.config;

import io.lbcontroller.operator.common.InvalidConfigurationException;
import io.lbcontroller.operator.common.model.LabelPredicate;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static io.lbcontroller.operator.common.config.ConfigParameterParser.BOOLEAN;
import static io.lbcontroller.operator.common.config.ConfigParameterParser.INTEGER;
import static io.lbcontroller.operator.common.config.ConfigParameterParser.LABEL_PREDICATE;
import static io.lbcontroller.operator.common.config.ConfigParameterParser.LONG;
import static io.lbcontroller.operator.common.config.ConfigParameterParser.NON_EMPTY_STRING;
import static io.lbcontroller.operator.common.config.ConfigParameterParser.strictlyPositive;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConfigParameterTest {
    private static final Map<String, ConfigParameter<?>> PARAMS = new HashMap<>();

    private static final ConfigParameter<String> NAME = new ConfigParameter<>("NAME", NON_EMPTY_STRING, PARAMS);
    private static final ConfigParameter<Integer> THREADS = new ConfigParameter<>("THREADS", strictlyPositive(INTEGER), "3", PARAMS);
    private static final ConfigParameter<Long> INTERVAL = new ConfigParameter<>("INTERVAL", LONG, "1000", PARAMS);
    private static final ConfigParameter<Boolean> ENABLED = new ConfigParameter<>("ENABLED", BOOLEAN, null, PARAMS);
    private static final ConfigParameter<LabelPredicate> SELECTOR = new ConfigParameter<>("SELECTOR", LABEL_PREDICATE, "", PARAMS);

    @Test
    public void testDefaults() {
        Map<String, Object> config = ConfigParameter.define(Map.of("NAME", " my-name "), PARAMS);

        assertThat(config.get(NAME.key()), is("my-name"));
        assertThat(config.get(THREADS.key()), is(3));
        assertThat(config.get(INTERVAL.key()), is(1000L));
        assertThat(config.get(ENABLED.key()), is(nullValue()));
        assertThat(config.get(SELECTOR.key()), is(LabelPredicate.EVERYTHING));
    }

    @Test
    public void testValues() {
        Map<String, Object> config = ConfigParameter.define(Map.of(
                "NAME", "my-name",
                "THREADS", "7",
                "INTERVAL", "5000",
                "ENABLED", "TRUE",
                "SELECTOR", "owner=lbc",
                "UNKNOWN", "ignored"), PARAMS);

        assertThat(config.get(THREADS.key()), is(7));
        assertThat(config.get(INTERVAL.key()), is(5000L));
        assertThat(config.get(ENABLED.key()), is(true));
        assertThat(config.get(SELECTOR.key()), is(LabelPredicate.fromString("owner=lbc")));
        assertThat(config.containsKey("UNKNOWN"), is(false));
    }

    @Test
    public void testEmptyValueUsesDefault() {
        Map<String, Object> config = ConfigParameter.define(Map.of("NAME", "my-name", "THREADS", ""), PARAMS);

        assertThat(config.get(THREADS.key()), is(3));
    }

    @Test
    public void testMissingMandatoryValue() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of(), PARAMS));

        assertThat(e.getMessage(), is("Config value: NAME is mandatory"));
    }

    @Test
    public void testInvalidValues() {
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of("NAME", "n", "THREADS", "0"), PARAMS));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of("NAME", "n", "THREADS", "many"), PARAMS));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of("NAME", "n", "ENABLED", "yes"), PARAMS));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of("NAME", "n", "SELECTOR", "a in (b"), PARAMS));
    }
}
