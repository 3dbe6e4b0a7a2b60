package com.socialpulse.api.controller;

import com.socialpulse.api.dto.TrendDto;
import com.socialpulse.api.service.TrendService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/trends")
@RequiredArgsConstructor
public class TrendController {

    private final TrendService trendService;

    @GetMapping
    public List<TrendDto> trends(
            @RequestParam(required = false) String source,
            @RequestParam(defaultValue = "30") int limit
    ) {
        return trendService.activeTrends(source, limit);
    }

    @GetMapping("/timeline")
    public List<TrendDto> timeline(@RequestParam(defaultValue = "24") int hours) {
        return trendService.timeline(hours);
    }
}
