package com.socialpulse.api.repository;

import com.socialpulse.api.entity.Source;
import com.socialpulse.api.entity.TrendingTopic;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface TrendingTopicRepository extends JpaRepository<TrendingTopic, Long> {

    Optional<TrendingTopic> findBySourceAndTopic(Source source, String topic);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TrendingTopic t SET t.active = false WHERE t.active = true")
    int deactivateAll();

    List<TrendingTopic> findByActiveTrueOrderByMentionCountDesc(Pageable pageable);

    List<TrendingTopic> findBySourceAndActiveTrueOrderByMentionCountDesc(Source source, Pageable pageable);

    List<TrendingTopic> findByActiveTrueAndLastSeenGreaterThanEqualOrderByMentionCountDesc(LocalDateTime since, Pageable pageable);
}
