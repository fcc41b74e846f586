package com.lolanalyzer.riot.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlatformTest {

    @ParameterizedTest
    @CsvSource({
        "BR1, AMERICAS",
        "NA1, AMERICAS",
        "KR, ASIA",
        "JP1, ASIA",
        "EUW1, EUROPE",
        "TR1, EUROPE",
        "OC1, SEA",
        "VN2, SEA"
    })
    void shouldMapToRegionalRoute(Platform platform, RegionalRoute route) {
        assertThat(platform.regionalRoute()).isEqualTo(route);
    }

    @Test
    void shouldExposeLowercaseHosts() {
        assertThat(Platform.EUW1.host()).isEqualTo("euw1");
        assertThat(Platform.EUW1.regionalRoute().host()).isEqualTo("europe");
    }

    @ParameterizedTest
    @ValueSource(strings = {"euw1", "EUW1", " Euw1 "})
    void shouldParseCodesIgnoringCase(String code) {
        assertThat(Platform.fromCode(code)).isEqualTo(Platform.EUW1);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"EUW", "europe", "   "})
    void shouldRejectUnknownCodes(String code) {
        assertThatThrownBy(() -> Platform.fromCode(code))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
