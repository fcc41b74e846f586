package com.lolanalyzer.riot.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Platform routing values and the regional route that serves their matches.
 */
public enum Platform {
    BR1(RegionalRoute.AMERICAS),
    LA1(RegionalRoute.AMERICAS),
    LA2(RegionalRoute.AMERICAS),
    NA1(RegionalRoute.AMERICAS),
    JP1(RegionalRoute.ASIA),
    KR(RegionalRoute.ASIA),
    EUN1(RegionalRoute.EUROPE),
    EUW1(RegionalRoute.EUROPE),
    TR1(RegionalRoute.EUROPE),
    RU(RegionalRoute.EUROPE),
    ME1(RegionalRoute.EUROPE),
    OC1(RegionalRoute.SEA),
    PH2(RegionalRoute.SEA),
    SG2(RegionalRoute.SEA),
    TH2(RegionalRoute.SEA),
    TW2(RegionalRoute.SEA),
    VN2(RegionalRoute.SEA);

    private static final Map<String, Platform> BY_CODE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));

    private final RegionalRoute regionalRoute;

    Platform(RegionalRoute regionalRoute) {
        this.regionalRoute = regionalRoute;
    }

    public RegionalRoute regionalRoute() {
        return regionalRoute;
    }

    public String host() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Platform fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Platform code cannot be empty");
        }
        Platform platform = BY_CODE.get(code.trim().toUpperCase(Locale.ROOT));
        if (platform == null) {
            throw new IllegalArgumentException("Unknown platform: " + code);
        }
        return platform;
    }
}
