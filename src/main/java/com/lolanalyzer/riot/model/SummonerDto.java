package com.lolanalyzer.riot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SummonerDto(
    String id,
    String accountId,
    String puuid,
    String name,
    int profileIconId,
    long revisionDate,
    long summonerLevel
) {}
