package com.lolanalyzer.riot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Data Dragon {@code champion.json}, keyed by champion id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChampionListDto(String type, String version, Map<String, Champion> data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Champion(
        String id,
        String key,
        String name,
        String title,
        Image image,
        List<String> tags,
        Stats stats
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Image(String full, String sprite, String group, int x, int y, int w, int h) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Stats(
        double hp,
        @JsonProperty("hpperlevel") double hpPerLevel,
        double mp,
        @JsonProperty("mpperlevel") double mpPerLevel,
        double armor,
        @JsonProperty("armorperlevel") double armorPerLevel,
        @JsonProperty("spellblock") double spellBlock,
        @JsonProperty("spellblockperlevel") double spellBlockPerLevel,
        @JsonProperty("attackdamage") double attackDamage,
        @JsonProperty("attackdamageperlevel") double attackDamagePerLevel,
        @JsonProperty("attackspeed") double attackSpeed,
        @JsonProperty("attackspeedperlevel") double attackSpeedPerLevel
    ) {}
}
