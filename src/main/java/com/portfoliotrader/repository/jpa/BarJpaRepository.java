package com.portfoliotrader.repository.jpa;

import com.portfoliotrader.domain.enums.Interval;
import com.portfoliotrader.entity.BarEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for locally stored bars.
 */
@Repository
public interface BarJpaRepository extends JpaRepository<BarEntity, Long> {

    @Query("SELECT b FROM BarEntity b WHERE b.instrument = :instrument AND b.interval = :interval"
            + " AND b.datetime BETWEEN :start AND :end ORDER BY b.datetime ASC")
    List<BarEntity> findRange(
            @Param("instrument") String instrument,
            @Param("interval") Interval interval,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end);

    boolean existsByInstrumentAndIntervalAndDatetime(String instrument, Interval interval, LocalDateTime datetime);
}
