package com.lolanalyzer.riot.controller;

import com.lolanalyzer.riot.model.ChampionListDto;
import com.lolanalyzer.riot.service.RiotApiService;
import com.lolanalyzer.riot.service.RiotApiServiceImpl;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/static")
@RequiredArgsConstructor
public class StaticDataController {

    private final RiotApiService riotApiService;

    @GetMapping("/versions")
    public ResponseEntity<List<String>> getVersions() {
        return ResponseEntity.ok(riotApiService.getVersions());
    }

    @GetMapping("/champions")
    public ResponseEntity<ChampionListDto> getChampions(
        @RequestParam(name = "version", defaultValue = RiotApiServiceImpl.LATEST_VERSION) String version) {

        return ResponseEntity.ok(riotApiService.getChampions(version));
    }
}
