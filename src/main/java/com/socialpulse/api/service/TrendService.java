package com.socialpulse.api.service;

import com.socialpulse.api.dto.TrendDto;
import com.socialpulse.api.entity.Post;
import com.socialpulse.api.entity.Source;
import com.socialpulse.api.entity.TrendingTopic;
import com.socialpulse.api.extractor.KeywordExtractor;
import com.socialpulse.api.repository.PostRepository;
import com.socialpulse.api.repository.TrendingTopicRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 윈도우 내 게시글 제목의 키워드 빈도로 소스별 트렌드를 다시 계산한다.
 */
@Slf4j
@Service
public class TrendService {

    static final int TOP_N = 20;
    static final int MAX_TRENDS = 100;
    static final int MAX_TIMELINE_HOURS = 168;

    private final PostRepository postRepository;
    private final TrendingTopicRepository topicRepository;
    private final KeywordExtractor extractor;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final Duration window;
    private final int minMentions;

    // 소스별 사이클이 동시에 끝나도 pre-clear/upsert가 섞이지 않도록 커밋까지 잡고 있는다
    private final ReentrantLock recomputeLock = new ReentrantLock();

    public TrendService(PostRepository postRepository,
                        TrendingTopicRepository topicRepository,
                        KeywordExtractor extractor,
                        PlatformTransactionManager transactionManager,
                        Clock clock,
                        @Value("${trend.window:24h}") Duration window,
                        @Value("${trend.min-mentions:2}") int minMentions) {
        this.postRepository = postRepository;
        this.topicRepository = topicRepository;
        this.extractor = extractor;
        this.tx = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.window = window;
        this.minMentions = minMentions;
    }

    public int recompute() {
        return recompute(window);
    }

    /**
     * @return 활성화된 토픽 수
     */
    public int recompute(Duration window) {
        recomputeLock.lock();
        try {
            Integer active = tx.execute(status -> recomputeInTransaction(window));
            return active == null ? 0 : active;
        } finally {
            recomputeLock.unlock();
        }
    }

    private int recomputeInTransaction(Duration window) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Post> posts = postRepository.findByPublishedAtBetweenOrderByIdAsc(now.minus(window), now);

        // 소스 -> 키워드 -> 집계 (모두 처음 등장한 순서 유지)
        Map<Source, Map<String, KeywordTally>> bySource = new LinkedHashMap<>();
        for (Post post : posts) {
            Map<String, KeywordTally> tallies = bySource.computeIfAbsent(post.getSource(), s -> new LinkedHashMap<>());
            for (String keyword : extractor.extract(post.getTitle())) {
                tallies.computeIfAbsent(keyword, KeywordTally::new).add(post.getEngagementScore());
            }
        }

        int deactivated = topicRepository.deactivateAll();

        int activated = 0;
        for (Map.Entry<Source, Map<String, KeywordTally>> entry : bySource.entrySet()) {
            for (KeywordTally tally : topOf(entry.getValue())) {
                if (tally.count < minMentions) continue;
                upsertTopic(entry.getKey(), tally, now);
                activated++;
            }
        }

        log.info("Trends recomputed: posts={}, window={}, deactivated={}, active={}",
                posts.size(), window, deactivated, activated);
        return activated;
    }

    private List<KeywordTally> topOf(Map<String, KeywordTally> tallies) {
        List<KeywordTally> sorted = new ArrayList<>(tallies.values());
        // List.sort는 stable, 동률이면 먼저 등장한 키워드가 앞
        sorted.sort(Comparator.comparingInt((KeywordTally t) -> t.count).reversed());
        return sorted.size() > TOP_N ? sorted.subList(0, TOP_N) : sorted;
    }

    private void upsertTopic(Source source, KeywordTally tally, LocalDateTime now) {
        double avg = round1(tally.engagementSum / tally.count);
        topicRepository.findBySourceAndTopic(source, tally.keyword)
                .ifPresentOrElse(
                        topic -> topic.activate(tally.count, avg, now),
                        () -> topicRepository.save(TrendingTopic.of(source, tally.keyword, tally.count, avg, now))
                );
    }

    @Transactional(readOnly = true)
    public List<TrendDto> activeTrends(String source, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_TRENDS)));
        Source src = source == null ? null : Source.fromKey(source).orElse(null);
        List<TrendingTopic> topics = src == null
                ? topicRepository.findByActiveTrueOrderByMentionCountDesc(page)
                : topicRepository.findBySourceAndActiveTrueOrderByMentionCountDesc(src, page);
        return topics.stream().map(TrendDto::from).toList();
    }

    /** last_seen이 최근 hours 이내인 활성 토픽 상위 20개 */
    @Transactional(readOnly = true)
    public List<TrendDto> timeline(int hours) {
        int h = Math.max(1, Math.min(hours, MAX_TIMELINE_HOURS));
        LocalDateTime since = LocalDateTime.now(clock).minusHours(h);
        return topicRepository.findByActiveTrueAndLastSeenGreaterThanEqualOrderByMentionCountDesc(since, PageRequest.of(0, TOP_N))
                .stream()
                .map(TrendDto::from)
                .toList();
    }

    static double round1(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    private static final class KeywordTally {
        private final String keyword;
        private int count;
        private double engagementSum;

        private KeywordTally(String keyword) {
            this.keyword = keyword;
        }

        private void add(double engagement) {
            count++;
            engagementSum += engagement;
        }
    }
}
