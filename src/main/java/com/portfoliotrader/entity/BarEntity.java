package com.portfoliotrader.entity;

import com.portfoliotrader.domain.enums.Interval;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the bar_data table: the local bar store, last in the history source chain.
 */
@Entity
@Table(
        name = "bar_data",
        uniqueConstraints = @UniqueConstraint(columnNames = {"instrument", "bar_interval", "bar_datetime"}),
        indexes = @Index(name = "idx_bar_lookup", columnList = "instrument, bar_interval, bar_datetime"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BarEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String instrument;

    @Enumerated(EnumType.STRING)
    @Column(name = "bar_interval", nullable = false, columnDefinition = "varchar(16)")
    private Interval interval;

    @Column(name = "bar_datetime", nullable = false)
    private LocalDateTime datetime;

    @Column(name = "open_price", precision = 15, scale = 4)
    private BigDecimal open;

    @Column(name = "high_price", precision = 15, scale = 4)
    private BigDecimal high;

    @Column(name = "low_price", precision = 15, scale = 4)
    private BigDecimal low;

    @Column(name = "close_price", precision = 15, scale = 4)
    private BigDecimal close;

    private long volume;

    @Column(name = "open_interest", precision = 18, scale = 2)
    private BigDecimal openInterest;
}
