package com.bybot.backend.repository;

import com.bybot.backend.model.MetricPoint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface MetricPointRepository extends JpaRepository<MetricPoint, Long> {

    List<MetricPoint> findByCategoryAndNameOrderByRecordedAtDesc(String category, String name, Pageable pageable);

    List<MetricPoint> findByCategoryAndNameAndRecordedAtBetweenOrderByRecordedAtAsc(String category, String name,
                                                                                 Instant from, Instant to);

    @Modifying
    @Query("delete from MetricPoint p where p.recordedAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);

    @Query("""
            select min(p.metricValue) as minValue, max(p.metricValue) as maxValue, avg(p.metricValue) as avgValue, count(p) as sampleCount
            from MetricPoint p
            where p.category = :category and p.name = :name and p.recordedAt >= :since
            """)
    MetricAggregate aggregate(@Param("category") String category, @Param("name") String name,
                              @Param("since") Instant since);

    interface MetricAggregate {
        Double getMinValue();

        Double getMaxValue();

        Double getAvgValue();

        Long getSampleCount();
    }
}
