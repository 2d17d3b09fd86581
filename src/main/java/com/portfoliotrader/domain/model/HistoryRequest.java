package com.portfoliotrader.domain.model;

import com.portfoliotrader.domain.enums.Interval;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class HistoryRequest {

    private String instrument;
    private Interval interval;
    private LocalDateTime start;
    private LocalDateTime end;
}
