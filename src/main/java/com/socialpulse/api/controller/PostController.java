package com.socialpulse.api.controller;

import com.socialpulse.api.dto.PostPageDto;
import com.socialpulse.api.dto.PostStatsDto;
import com.socialpulse.api.service.PostQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/posts")
@RequiredArgsConstructor
public class PostController {

    private final PostQueryService postQueryService;

    @GetMapping
    public PostPageDto list(
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String subreddit,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime since,
            @RequestParam(defaultValue = "published_at") String sort,
            @RequestParam(defaultValue = "desc") String order,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int size
    ) {
        return postQueryService.list(source, search, subreddit, since, sort, order, page, size);
    }

    @GetMapping("/stats")
    public PostStatsDto stats() {
        return postQueryService.stats();
    }
}
