package com.lolanalyzer.riot.service;

import com.lolanalyzer.riot.model.ChampionListDto;
import com.lolanalyzer.riot.model.ChampionMasteryDto;
import com.lolanalyzer.riot.model.LeagueEntryDto;
import com.lolanalyzer.riot.model.MatchDto;
import com.lolanalyzer.riot.model.Platform;
import com.lolanalyzer.riot.model.SummonerDto;

import java.util.List;

public interface RiotApiService {

    SummonerDto getSummonerByName(Platform platform, String summonerName);

    List<LeagueEntryDto> getLeagueEntries(Platform platform, String summonerId);

    List<ChampionMasteryDto> getChampionMasteries(Platform platform, String summonerId);

    List<String> getMatchIds(Platform platform, String puuid, int start, int count, Integer queue);

    MatchDto getMatch(Platform platform, String matchId);

    List<String> getVersions();

    ChampionListDto getChampions(String version);
}
