package com.socialpulse.api.service;

import com.socialpulse.api.dto.PostDto;
import com.socialpulse.api.dto.PostPageDto;
import com.socialpulse.api.dto.PostStatsDto;
import com.socialpulse.api.entity.Post;
import com.socialpulse.api.entity.Source;
import com.socialpulse.api.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PostQueryService {

    static final int MAX_PAGE_SIZE = 200;

    // 요청 파라미터명 -> 엔티티 필드
    private static final Map<String, String> SORT_FIELDS = Map.of(
            "published_at", "publishedAt",
            "score", "score",
            "engagement_score", "engagementScore"
    );

    private final PostRepository postRepository;
    private final Clock clock;

    public PostPageDto list(String source, String search, String subreddit, LocalDateTime since,
                            String sort, String order, int page, int size) {
        int safePage = Math.max(page, 1);
        int safeSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));

        Specification<Post> spec = Specification.where(null);
        Source src = source == null ? null : Source.fromKey(source).orElse(null);
        if (src != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("source"), src));
        }
        if (search != null && !search.isBlank()) {
            String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
            spec = spec.and((root, q, cb) -> cb.or(
                    cb.like(cb.lower(root.<String>get("title")), pattern),
                    cb.like(cb.lower(root.<String>get("body")), pattern)));
        }
        if (subreddit != null && !subreddit.isBlank()) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("subreddit"), subreddit));
        }
        if (since != null) {
            spec = spec.and((root, q, cb) -> cb.greaterThanOrEqualTo(root.<LocalDateTime>get("publishedAt"), since));
        }

        String field = SORT_FIELDS.getOrDefault(sort == null ? "" : sort, "publishedAt");
        Sort.Direction direction = "asc".equalsIgnoreCase(order) ? Sort.Direction.ASC : Sort.Direction.DESC;
        PageRequest pageable = PageRequest.of(safePage - 1, safeSize,
                Sort.by(direction, field).and(Sort.by(direction, "id")));

        Page<Post> result = postRepository.findAll(spec, pageable);
        return PostPageDto.of(result.map(PostDto::from).getContent(), result.getTotalElements(), safePage, safeSize);
    }

    public PostStatsDto stats() {
        LocalDateTime todayStart = LocalDate.now(clock).atStartOfDay();

        Map<String, PostStatsDto.SourceBreakdown> perSource = new LinkedHashMap<>();
        for (PostRepository.SourcePostStats row : postRepository.aggregateBySource()) {
            double avg = row.getAvgEngagement() == null ? 0.0 : row.getAvgEngagement();
            perSource.put(row.getSource().getKey(),
                    new PostStatsDto.SourceBreakdown(row.getPostCount(), TrendService.round1(avg)));
        }

        Double avg = postRepository.averageEngagement();
        return PostStatsDto.builder()
                .totalPosts(postRepository.count())
                .postsToday(postRepository.countByScrapedAtGreaterThanEqual(todayStart))
                .avgEngagement(TrendService.round1(avg == null ? 0.0 : avg))
                .perSource(perSource)
                .build();
    }
}
