package com.portfoliotrader.domain.model;

import com.portfoliotrader.domain.enums.Direction;
import com.portfoliotrader.domain.enums.Offset;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A single fill. {@code tradeId} is unique per gateway and is the dedup key;
 * {@code orderId} routes the fill back to the owning strategy.
 */
@Data
@Builder
public class Trade {

    private String tradeId;
    private String orderId;
    private String instrument;
    private Direction direction;
    private Offset offset;
    private BigDecimal price;
    private int volume;
    private String gateway;
    private LocalDateTime timestamp;

    /** Volume with the direction's sign applied: positive for buys, negative for sells. */
    public int signedVolume() {
        return direction.sign() * volume;
    }
}
