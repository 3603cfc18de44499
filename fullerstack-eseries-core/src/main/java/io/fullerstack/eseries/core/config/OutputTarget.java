package io.fullerstack.eseries.core.config;

import java.util.Locale;

/**
 * Destinations a collected batch is written to.
 */
public enum OutputTarget {
    INFLUX,
    JSON,
    LOG,
    PROMETHEUS;

    public static OutputTarget parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown output target: " + value, e);
        }
    }
}
