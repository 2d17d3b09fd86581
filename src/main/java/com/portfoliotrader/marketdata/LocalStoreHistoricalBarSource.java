package com.portfoliotrader.marketdata;

import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.HistoryRequest;
import com.portfoliotrader.entity.BarEntity;
import com.portfoliotrader.repository.jpa.BarJpaRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * History from the local H2 bar store. Last resort in the chain; also where bars are
 * saved for later warm-ups.
 */
@Component
@Order(3)
public class LocalStoreHistoricalBarSource implements HistoricalBarSource {

    private static final Logger log = LoggerFactory.getLogger(LocalStoreHistoricalBarSource.class);

    private final BarJpaRepository barJpaRepository;

    public LocalStoreHistoricalBarSource(BarJpaRepository barJpaRepository) {
        this.barJpaRepository = barJpaRepository;
    }

    @Override
    public String getName() {
        return "local-store";
    }

    @Override
    public List<Bar> query(HistoryRequest request) {
        return barJpaRepository
                .findRange(request.getInstrument(), request.getInterval(), request.getStart(), request.getEnd())
                .stream()
                .map(this::toBar)
                .toList();
    }

    /**
     * Stores bars, skipping any already present for the same instrument, interval and time.
     *
     * @return number of bars inserted
     */
    @Transactional
    public int save(List<Bar> bars) {
        List<BarEntity> fresh = bars.stream()
                .filter(bar -> !barJpaRepository.existsByInstrumentAndIntervalAndDatetime(
                        bar.getInstrument(), bar.getInterval(), bar.getDatetime()))
                .map(this::toEntity)
                .toList();
        barJpaRepository.saveAll(fresh);
        log.info("Stored {} of {} bars in local store", fresh.size(), bars.size());
        return fresh.size();
    }

    private Bar toBar(BarEntity entity) {
        return Bar.builder()
                .instrument(entity.getInstrument())
                .interval(entity.getInterval())
                .datetime(entity.getDatetime())
                .open(entity.getOpen())
                .high(entity.getHigh())
                .low(entity.getLow())
                .close(entity.getClose())
                .volume(entity.getVolume())
                .openInterest(entity.getOpenInterest())
                .build();
    }

    private BarEntity toEntity(Bar bar) {
        return BarEntity.builder()
                .instrument(bar.getInstrument())
                .interval(bar.getInterval())
                .datetime(bar.getDatetime())
                .open(bar.getOpen())
                .high(bar.getHigh())
                .low(bar.getLow())
                .close(bar.getClose())
                .volume(bar.getVolume())
                .openInterest(bar.getOpenInterest())
                .build();
    }
}
