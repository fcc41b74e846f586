package com.lolanalyzer.riot.controller;

import com.lolanalyzer.riot.model.MatchDto;
import com.lolanalyzer.riot.model.Platform;
import com.lolanalyzer.riot.service.RiotApiService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/matches/{platform}")
@RequiredArgsConstructor
public class MatchController {

    private final RiotApiService riotApiService;

    @GetMapping("/by-puuid/{puuid}")
    public ResponseEntity<List<String>> getMatchIds(
        @PathVariable String platform,
        @PathVariable String puuid,
        @RequestParam(name = "start", defaultValue = "0") int start,
        @RequestParam(name = "count", defaultValue = "20") int count,
        @RequestParam(name = "queue", required = false) Integer queue) {

        return ResponseEntity.ok(riotApiService.getMatchIds(Platform.fromCode(platform), puuid, start, count, queue));
    }

    @GetMapping("/{matchId}")
    public ResponseEntity<MatchDto> getMatch(
        @PathVariable String platform,
        @PathVariable String matchId) {

        return ResponseEntity.ok(riotApiService.getMatch(Platform.fromCode(platform), matchId));
    }
}
