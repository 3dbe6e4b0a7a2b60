package com.socialpulse.api.repository;

import com.socialpulse.api.entity.RunStatus;
import com.socialpulse.api.entity.ScrapeRun;
import com.socialpulse.api.entity.Source;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ScrapeRunRepository extends JpaRepository<ScrapeRun, Long> {

    List<ScrapeRun> findAllByOrderByStartedAtDescIdDesc(Pageable pageable);

    @Query("""
        SELECT r.source AS source,
               COUNT(r) AS totalRuns,
               SUM(CASE WHEN r.status = :success THEN 1 ELSE 0 END) AS successRuns,
               MAX(r.startedAt) AS lastRun,
               SUM(r.itemsNew) AS totalItemsNew
        FROM ScrapeRun r
        GROUP BY r.source
        ORDER BY r.source
        """)
    List<SourceRunStats> aggregateBySource(@Param("success") RunStatus success);

    interface SourceRunStats {
        Source getSource();
        Long getTotalRuns();
        Long getSuccessRuns();
        LocalDateTime getLastRun();
        Long getTotalItemsNew();
    }
}
