package com.bizgraph.rge.api;

import java.util.Locale;

/** How often two businesses transact. Informational, does not affect weight. */
public enum Frequency {
    DAILY, WEEKLY, MONTHLY, QUARTERLY, YEARLY, AD_HOC;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Frequency fromWire(String value) {
        if (value == null || value.isBlank())
            return AD_HOC;
        try {
            return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown frequency: " + value, e);
        }
    }
}
