package com.socialpulse.api.repository;

import com.socialpulse.api.entity.Post;
import com.socialpulse.api.entity.Source;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface PostRepository extends JpaRepository<Post, Long>, JpaSpecificationExecutor<Post> {

    Optional<Post> findBySourceAndSourceId(Source source, String sourceId);

    /** 트렌드 계산용 윈도우 조회 (id 순으로 고정해 결과를 결정적으로 만든다) */
    List<Post> findByPublishedAtBetweenOrderByIdAsc(LocalDateTime from, LocalDateTime to);

    long countByScrapedAtGreaterThanEqual(LocalDateTime since);

    @Query("SELECT AVG(p.engagementScore) FROM Post p")
    Double averageEngagement();

    @Query("""
        SELECT p.source AS source, COUNT(p) AS postCount, AVG(p.engagementScore) AS avgEngagement
        FROM Post p
        GROUP BY p.source
        """)
    List<SourcePostStats> aggregateBySource();

    interface SourcePostStats {
        Source getSource();
        Long getPostCount();
        Double getAvgEngagement();
    }
}
