package com.socialpulse.api.service;

import com.socialpulse.api.dto.NormalizedItem;
import com.socialpulse.api.entity.Post;
import com.socialpulse.api.entity.Source;
import com.socialpulse.api.repository.PostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class PostUpsertServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    @Autowired
    private PostRepository postRepository;

    @Autowired
    private TestEntityManager em;

    private PostUpsertService service;

    @BeforeEach
    void setUp() {
        service = new PostUpsertService(postRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static NormalizedItem item(String id, String title, int score, int comments) {
        return NormalizedItem.builder()
                .source(Source.REDDIT)
                .sourceId(id)
                .sourceUrl("https://www.reddit.com/r/technology/comments/" + id)
                .author("alice")
                .title(title)
                .body("body of " + id)
                .score(score)
                .numComments(comments)
                .publishedAt(LocalDateTime.of(2026, 1, 15, 10, 0))
                .subreddit("technology")
                .extra(Map.of("flair", "News"))
                .build();
    }

    @Test
    void sameBatchTwice_insertsOnlyOnce() {
        List<NormalizedItem> batch = List.of(item("a", "First", 1, 0), item("b", "Second", 2, 0), item("c", "Third", 3, 0));

        assertThat(service.upsert(batch)).isEqualTo(3);
        assertThat(service.upsert(batch)).isZero();
        assertThat(postRepository.count()).isEqualTo(3);
    }

    @Test
    void engagementIsScorePlusTwiceComments() {
        service.upsert(List.of(item("a", "Title", 10, 5)));

        Post post = postRepository.findBySourceAndSourceId(Source.REDDIT, "a").orElseThrow();
        assertThat(post.getEngagementScore()).isEqualTo(20.0);
        assertThat(Post.engagement(10, 5)).isEqualTo(20.0);
    }

    @Test
    void resighting_updatesCountersButKeepsWriteOnceFields() {
        service.upsert(List.of(item("a", "Original title", 10, 5)));
        em.flush();
        em.clear();

        NormalizedItem changed = NormalizedItem.builder()
                .source(Source.REDDIT)
                .sourceId("a")
                .sourceUrl("https://elsewhere.example/a")
                .author("mallory")
                .title("Edited title")
                .body("edited body")
                .score(40)
                .numComments(7)
                .publishedAt(LocalDateTime.of(2030, 1, 1, 0, 0))
                .build();
        assertThat(service.upsert(List.of(changed))).isZero();
        em.flush();
        em.clear();

        Post post = postRepository.findBySourceAndSourceId(Source.REDDIT, "a").orElseThrow();
        assertThat(post.getTitle()).isEqualTo("Original title");
        assertThat(post.getBody()).isEqualTo("body of a");
        assertThat(post.getAuthor()).isEqualTo("alice");
        assertThat(post.getPublishedAt()).isEqualTo(LocalDateTime.of(2026, 1, 15, 10, 0));
        assertThat(post.getExtra()).containsEntry("flair", "News");
        assertThat(post.getScore()).isEqualTo(40);
        assertThat(post.getNumComments()).isEqualTo(7);
        assertThat(post.getEngagementScore()).isEqualTo(54.0);
        assertThat(post.getScrapedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void duplicateKeyInOneBatch_countsOneInsertAndLastWriteWins() {
        int inserted = service.upsert(List.of(item("dup", "Dup", 1, 1), item("dup", "Dup again", 9, 0)));
        em.flush();
        em.clear();

        assertThat(inserted).isEqualTo(1);
        Post post = postRepository.findBySourceAndSourceId(Source.REDDIT, "dup").orElseThrow();
        assertThat(post.getScore()).isEqualTo(9);
        assertThat(post.getTitle()).isEqualTo("Dup");
    }

    @Test
    void sameSourceIdInDifferentSources_areDifferentPosts() {
        NormalizedItem news = NormalizedItem.builder()
                .source(Source.NEWS).sourceId("a").title("News headline here").build();

        assertThat(service.upsert(List.of(item("a", "Reddit", 1, 0), news))).isEqualTo(2);
    }

    @Test
    void longBodyIsTruncatedAndMissingPublishedAtDefaultsToNow() {
        NormalizedItem longOne = NormalizedItem.builder()
                .source(Source.NEWS).sourceId("long").title("Long one").body("x".repeat(2500)).build();

        service.upsert(List.of(longOne));

        Post post = postRepository.findBySourceAndSourceId(Source.NEWS, "long").orElseThrow();
        assertThat(post.getBody()).hasSize(Post.MAX_TEXT_LENGTH);
        assertThat(post.getPublishedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void emptyOrNullBatch_returnsZero() {
        assertThat(service.upsert(List.of())).isZero();
        assertThat(service.upsert(null)).isZero();
    }
}
