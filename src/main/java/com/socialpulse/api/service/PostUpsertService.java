package com.socialpulse.api.service;

import com.socialpulse.api.dto.NormalizedItem;
import com.socialpulse.api.entity.Post;
import com.socialpulse.api.entity.Source;
import com.socialpulse.api.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PostUpsertService {

    private final PostRepository postRepository;
    private final Clock clock;

    /**
     * (source, sourceId) 기준으로 병합. 신규 insert 건수를 반환한다.
     * 이미 있는 글은 score/numComments/engagementScore/scrapedAt만 갱신.
     */
    @Transactional
    public int upsert(List<NormalizedItem> items) {
        if (items == null || items.isEmpty()) {
            return 0;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Map<PostKey, Post> batch = new HashMap<>();
        int inserted = 0;

        for (NormalizedItem item : items) {
            if (item.source() == null || item.sourceId() == null || item.sourceId().isBlank()) {
                log.debug("Skipping item without identity: {}", item.title());
                continue;
            }
            PostKey key = new PostKey(item.source(), item.sourceId());
            Post existing = batch.get(key);
            if (existing == null) {
                existing = postRepository.findBySourceAndSourceId(key.source(), key.sourceId()).orElse(null);
            }

            if (existing == null) {
                Post saved = postRepository.save(Post.from(item, now));
                batch.put(key, saved);
                inserted++;
            } else {
                existing.refreshFrom(item, now);
                batch.put(key, existing);
            }
        }

        log.debug("Upserted {} items ({} new)", items.size(), inserted);
        return inserted;
    }

    private record PostKey(Source source, String sourceId) {
    }
}
