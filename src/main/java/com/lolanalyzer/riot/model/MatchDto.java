package com.lolanalyzer.riot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MatchDto(Metadata metadata, Info info) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(String dataVersion, String matchId, List<String> participants) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Info(
        long gameCreation,
        long gameDuration,
        long gameEndTimestamp,
        long gameId,
        String gameMode,
        String gameName,
        long gameStartTimestamp,
        String gameType,
        String gameVersion,
        int mapId,
        List<Participant> participants,
        String platformId,
        int queueId,
        List<Team> teams
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Participant(
        String puuid,
        String summonerName,
        int participantId,
        int teamId,
        String teamPosition,
        int championId,
        String championName,
        int champLevel,
        int kills,
        int deaths,
        int assists,
        int totalMinionsKilled,
        int goldEarned,
        int visionScore,
        int totalDamageDealtToChampions,
        int totalDamageTaken,
        boolean win
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Team(int teamId, boolean win, List<Ban> bans, Objectives objectives) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Ban(int championId, int pickTurn) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Objectives(
        Objective baron,
        Objective champion,
        Objective dragon,
        Objective inhibitor,
        Objective riftHerald,
        Objective tower
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Objective(boolean first, int kills) {}
}
