package com.socialpulse.api.controller;

import com.socialpulse.api.dto.ScrapeRunDto;
import com.socialpulse.api.dto.SourceStatsDto;
import com.socialpulse.api.service.ScrapeRunService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/sources")
@RequiredArgsConstructor
public class SourceController {

    private final ScrapeRunService scrapeRunService;

    @GetMapping("/stats")
    public List<SourceStatsDto> stats() {
        return scrapeRunService.sourceStats();
    }

    @GetMapping("/runs")
    public List<ScrapeRunDto> runs(@RequestParam(defaultValue = "20") int limit) {
        return scrapeRunService.recent(limit);
    }
}
