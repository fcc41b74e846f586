package com.lolanalyzer.riot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChampionMasteryDto(
    String puuid,
    long championId,
    int championLevel,
    int championPoints,
    long lastPlayTime,
    long championPointsSinceLastLevel,
    long championPointsUntilNextLevel,
    boolean chestGranted,
    int tokensEarned
) {}
