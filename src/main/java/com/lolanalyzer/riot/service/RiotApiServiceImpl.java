package com.lolanalyzer.riot.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lolanalyzer.riot.client.ApiRequest;
import com.lolanalyzer.riot.client.RequestDispatcher;
import com.lolanalyzer.riot.config.RiotApiProperties;
import com.lolanalyzer.riot.model.ChampionListDto;
import com.lolanalyzer.riot.model.ChampionMasteryDto;
import com.lolanalyzer.riot.model.LeagueEntryDto;
import com.lolanalyzer.riot.model.MatchDto;
import com.lolanalyzer.riot.model.Platform;
import com.lolanalyzer.riot.model.SummonerDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class RiotApiServiceImpl implements RiotApiService {

    public static final String LATEST_VERSION = "latest";

    private static final Duration SUMMONER_TTL = Duration.ofHours(1);
    private static final Duration LEAGUE_ENTRIES_TTL = Duration.ofMinutes(30);
    private static final Duration MASTERY_TTL = Duration.ofHours(1);
    private static final Duration MATCH_IDS_TTL = Duration.ofMinutes(5);
    private static final Duration MATCH_TTL = Duration.ofDays(1);
    private static final Duration VERSIONS_TTL = Duration.ofHours(1);
    private static final Duration CHAMPIONS_TTL = Duration.ofDays(1);

    private static final int MAX_MATCH_IDS = 100;

    private final RequestDispatcher riotDispatcher;
    private final RequestDispatcher dataDragonDispatcher;
    private final RiotApiProperties properties;

    public RiotApiServiceImpl(
        @Qualifier("riotDispatcher") RequestDispatcher riotDispatcher,
        @Qualifier("dataDragonDispatcher") RequestDispatcher dataDragonDispatcher,
        RiotApiProperties properties
    ) {
        this.riotDispatcher = riotDispatcher;
        this.dataDragonDispatcher = dataDragonDispatcher;
        this.properties = properties;
    }

    @Override
    public SummonerDto getSummonerByName(Platform platform, String summonerName) {
        String name = requireText(summonerName, "Summoner name");
        log.debug("Fetching summoner {} on {}", name, platform);

        URI uri = riotUri(platform.host(), "/lol/summoner/v4/summoners/by-name/{name}", Map.of("name", name));
        return riotDispatcher.call("summoner:" + platform + ":" + name, ApiRequest.get(uri), SummonerDto.class, SUMMONER_TTL);
    }

    @Override
    public List<LeagueEntryDto> getLeagueEntries(Platform platform, String summonerId) {
        String id = requireText(summonerId, "Summoner id");
        URI uri = riotUri(platform.host(), "/lol/league/v4/entries/by-summoner/{id}", Map.of("id", id));
        return riotDispatcher.call("league-entries:" + platform + ":" + id, ApiRequest.get(uri),
            new TypeReference<List<LeagueEntryDto>>() {}, LEAGUE_ENTRIES_TTL);
    }

    @Override
    public List<ChampionMasteryDto> getChampionMasteries(Platform platform, String summonerId) {
        String id = requireText(summonerId, "Summoner id");
        URI uri = riotUri(platform.host(), "/lol/champion-mastery/v4/champion-masteries/by-summoner/{id}", Map.of("id", id));
        return riotDispatcher.call("masteries:" + platform + ":" + id, ApiRequest.get(uri),
            new TypeReference<List<ChampionMasteryDto>>() {}, MASTERY_TTL);
    }

    @Override
    public List<String> getMatchIds(Platform platform, String puuid, int start, int count, Integer queue) {
        String id = requireText(puuid, "PUUID");
        if (start < 0) {
            throw new IllegalArgumentException("start must not be negative");
        }
        if (count < 0 || count > MAX_MATCH_IDS) {
            throw new IllegalArgumentException("count must be between 0 and " + MAX_MATCH_IDS);
        }

        String region = platform.regionalRoute().host();
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.baseUrl())
            .path("/lol/match/v5/matches/by-puuid/{puuid}/ids")
            .queryParam("start", start)
            .queryParam("count", count);
        if (queue != null) {
            builder.queryParam("queue", queue);
        }
        URI uri = builder.encode().buildAndExpand(Map.of("host", region, "puuid", id)).toUri();

        String cacheKey = "match-ids:" + platform.regionalRoute() + ":" + id + ":" + start + ":" + count + ":" + queue;
        return riotDispatcher.call(cacheKey, ApiRequest.get(uri), new TypeReference<List<String>>() {}, MATCH_IDS_TTL);
    }

    @Override
    public MatchDto getMatch(Platform platform, String matchId) {
        String id = requireText(matchId, "Match id");
        URI uri = riotUri(platform.regionalRoute().host(), "/lol/match/v5/matches/{id}", Map.of("id", id));
        return riotDispatcher.call("match:" + platform.regionalRoute() + ":" + id, ApiRequest.get(uri), MatchDto.class, MATCH_TTL);
    }

    @Override
    public List<String> getVersions() {
        URI uri = UriComponentsBuilder.fromUriString(properties.dataDragonUrl())
            .path("/api/versions.json")
            .build()
            .toUri();
        return dataDragonDispatcher.call("versions", ApiRequest.get(uri), new TypeReference<List<String>>() {}, VERSIONS_TTL);
    }

    @Override
    public ChampionListDto getChampions(String version) {
        String resolved = resolveVersion(version);
        String locale = properties.dataDragonLocale();
        URI uri = UriComponentsBuilder.fromUriString(properties.dataDragonUrl())
            .path("/cdn/{version}/data/{locale}/champion.json")
            .encode()
            .buildAndExpand(resolved, locale)
            .toUri();
        return dataDragonDispatcher.call("champions:" + resolved + ":" + locale, ApiRequest.get(uri),
            ChampionListDto.class, CHAMPIONS_TTL);
    }

    private String resolveVersion(String version) {
        if (version != null && !version.isBlank() && !LATEST_VERSION.equalsIgnoreCase(version.trim())) {
            return version.trim();
        }
        List<String> versions = getVersions();
        if (versions == null || versions.isEmpty()) {
            throw new IllegalStateException("Data Dragon returned no versions");
        }
        log.debug("Resolved latest Data Dragon version to {}", versions.get(0));
        return versions.get(0);
    }

    private URI riotUri(String host, String path, Map<String, String> variables) {
        Map<String, String> uriVariables = new HashMap<>(variables);
        uriVariables.put("host", host);
        return UriComponentsBuilder.fromUriString(properties.baseUrl())
            .path(path)
            .encode()
            .buildAndExpand(uriVariables)
            .toUri();
    }

    private static String requireText(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + " cannot be empty");
        }
        return value.trim();
    }
}
