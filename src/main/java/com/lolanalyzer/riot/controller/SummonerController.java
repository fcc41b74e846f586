package com.lolanalyzer.riot.controller;

import com.lolanalyzer.riot.model.ChampionMasteryDto;
import com.lolanalyzer.riot.model.LeagueEntryDto;
import com.lolanalyzer.riot.model.Platform;
import com.lolanalyzer.riot.model.SummonerDto;
import com.lolanalyzer.riot.service.RiotApiService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/summoners/{platform}")
@RequiredArgsConstructor
public class SummonerController {

    private final RiotApiService riotApiService;

    @GetMapping("/by-name/{summonerName}")
    public ResponseEntity<SummonerDto> getByName(
        @PathVariable String platform,
        @PathVariable String summonerName) {

        return ResponseEntity.ok(riotApiService.getSummonerByName(Platform.fromCode(platform), summonerName));
    }

    @GetMapping("/{summonerId}/entries")
    public ResponseEntity<List<LeagueEntryDto>> getLeagueEntries(
        @PathVariable String platform,
        @PathVariable String summonerId) {

        return ResponseEntity.ok(riotApiService.getLeagueEntries(Platform.fromCode(platform), summonerId));
    }

    @GetMapping("/{summonerId}/masteries")
    public ResponseEntity<List<ChampionMasteryDto>> getMasteries(
        @PathVariable String platform,
        @PathVariable String summonerId) {

        return ResponseEntity.ok(riotApiService.getChampionMasteries(Platform.fromCode(platform), summonerId));
    }
}
