package com.lolanalyzer.riot.model;

import java.util.Locale;

/**
 * Continental routing values used by the match endpoints.
 */
public enum RegionalRoute {
    AMERICAS,
    ASIA,
    EUROPE,
    SEA;

    public String host() {
        return name().toLowerCase(Locale.ROOT);
    }
}
