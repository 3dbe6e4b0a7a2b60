package com.socialpulse.api.service;

import com.socialpulse.api.dto.NormalizedItem;
import com.socialpulse.api.entity.Post;
import com.socialpulse.api.entity.Source;
import com.socialpulse.api.entity.TrendingTopic;
import com.socialpulse.api.extractor.KeywordExtractor;
import com.socialpulse.api.repository.PostRepository;
import com.socialpulse.api.repository.TrendingTopicRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

/**
 * 재계산이 실제로 커밋/롤백되는지 보려면 테스트 트랜잭션 밖에서 돌려야 한다.
 */
@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class TrendServiceRollbackTest {

    private static final Instant T0 = Instant.parse("2026-01-15T12:00:00Z");

    @Autowired
    private PostRepository postRepository;

    @Autowired
    private TrendingTopicRepository topicRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private int seq;

    @AfterEach
    void cleanUp() {
        topicRepository.deleteAll();
        postRepository.deleteAll();
    }

    private TrendService serviceWith(TrendingTopicRepository repository) {
        return new TrendService(postRepository, repository, new KeywordExtractor(), transactionManager,
                Clock.fixed(T0, ZoneOffset.UTC), Duration.ofHours(24), 2);
    }

    private void post(String title) {
        LocalDateTime at = LocalDateTime.ofInstant(T0.minus(Duration.ofHours(1)), ZoneOffset.UTC);
        NormalizedItem item = NormalizedItem.builder()
                .source(Source.REDDIT)
                .sourceId("r" + (++seq))
                .title(title)
                .publishedAt(at)
                .build();
        postRepository.save(Post.from(item, at));
    }

    private TrendingTopic topic(String name) {
        return topicRepository.findBySourceAndTopic(Source.REDDIT, name).orElseThrow();
    }

    @Test
    void failedUpsert_rollsBackDeactivation() {
        post("Blockchain adoption grows");
        post("Blockchain regulation debate");
        serviceWith(topicRepository).recompute();
        assertThat(topic("blockchain").isActive()).isTrue();

        post("Quantum chips arrive");
        post("Quantum error correction");

        // 기존 토픽 갱신은 통과, 새 토픽 insert에서 실패
        TrendingTopicRepository failingOnInsert = mock(TrendingTopicRepository.class, delegatesTo(topicRepository));
        doThrow(new IllegalStateException("insert failed")).when(failingOnInsert).save(any(TrendingTopic.class));

        assertThatThrownBy(() -> serviceWith(failingOnInsert).recompute())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("insert failed");

        assertThat(topic("blockchain").isActive()).isTrue();
        assertThat(topic("blockchain").getMentionCount()).isEqualTo(2);
        assertThat(topicRepository.findBySourceAndTopic(Source.REDDIT, "quantum")).isEmpty();
    }

    @Test
    void successfulRecompute_commitsOutsideCallerTransaction() {
        post("Blockchain adoption grows");
        post("Blockchain regulation debate");

        int active = serviceWith(topicRepository).recompute();

        assertThat(active).isEqualTo(1);
        assertThat(topicRepository.findByActiveTrueOrderByMentionCountDesc(PageRequest.of(0, 10)))
                .extracting(TrendingTopic::getTopic)
                .containsExactly("blockchain");
    }
}
