package com.portfoliotrader.strategy.impl;

import com.portfoliotrader.domain.enums.Direction;
import com.portfoliotrader.domain.enums.Interval;
import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.Tick;
import com.portfoliotrader.strategy.base.StrategyContext;
import com.portfoliotrader.strategy.base.StrategyParameter;
import com.portfoliotrader.strategy.base.StrategyTemplate;
import com.portfoliotrader.strategy.base.StrategyVariable;
import com.portfoliotrader.strategy.support.BarSeriesBuffer;
import com.portfoliotrader.strategy.support.PortfolioBarGenerator;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

/**
 * Mean-reversion on the spread between two instruments.
 *
 * <p>Every five minutes the spread {@code leg1 * leg1Ratio - leg2 * leg2Ratio} is added to a
 * rolling ta4j series of the last 100 spreads, and Bollinger bands are computed over the last
 * {@code bollWindow} of them:
 * <ul>
 *   <li>Flat and spread at or above the upper band: short leg1, long leg2</li>
 *   <li>Flat and spread at or below the lower band: long leg1, short leg2</li>
 *   <li>Holding and spread back through the mid band: flatten both legs</li>
 * </ul>
 *
 * <p>Orders are priced {@code tickAdd} ticks through the bar close.
 */
public class PairTradingStrategy extends StrategyTemplate {

    private static final int SPREAD_BUFFER_SIZE = 100;
    private static final int BAR_CYCLE_MINUTES = 5;

    @StrategyParameter
    private int tickAdd = 1;

    @StrategyParameter
    private int bollWindow = 20;

    @StrategyParameter
    private double bollDev = 2;

    @StrategyParameter
    private int fixedSize = 1;

    @StrategyParameter
    private double leg1Ratio = 1;

    @StrategyParameter
    private double leg2Ratio = 1;

    @StrategyVariable
    private String leg1Symbol = "";

    @StrategyVariable
    private String leg2Symbol = "";

    @StrategyVariable
    private double currentSpread;

    @StrategyVariable
    private double bollMid;

    @StrategyVariable
    private double bollDown;

    @StrategyVariable
    private double bollUp;

    private final BarSeriesBuffer spreadSeries;

    private final PortfolioBarGenerator barGenerator = new PortfolioBarGenerator(this::onBars);

    public PairTradingStrategy(StrategyContext context, String strategyName, List<String> instruments) {
        super(context, strategyName, instruments);
        spreadSeries = new BarSeriesBuffer(
                strategyName + "-spread", Interval.FIVE_MINUTE.getDuration(), SPREAD_BUFFER_SIZE);
        if (instruments.size() >= 2) {
            leg1Symbol = instruments.get(0);
            leg2Symbol = instruments.get(1);
        }
    }

    @Override
    public String getAuthor() {
        return "portfolio-trader";
    }

    @Override
    public void onInit() {
        writeLog("Strategy initialized");
        loadBars(1);
    }

    @Override
    public void onStart() {
        writeLog("Strategy started");
    }

    @Override
    public void onStop() {
        writeLog("Strategy stopped");
    }

    @Override
    public void onTick(Tick tick) {
        barGenerator.updateTick(tick);
    }

    @Override
    public void onBars(Map<String, Bar> bars) {
        Bar leg1Bar = bars.get(leg1Symbol);
        Bar leg2Bar = bars.get(leg2Symbol);
        if (leg1Bar == null || leg2Bar == null) {
            return;
        }

        // act on the last minute of each five-minute block
        if ((leg1Bar.getDatetime().getMinute() + 1) % BAR_CYCLE_MINUTES != 0) {
            return;
        }

        currentSpread = leg1Bar.getClose().doubleValue() * leg1Ratio
                - leg2Bar.getClose().doubleValue() * leg2Ratio;

        if (!spreadSeries.addValue(leg1Bar.getDatetime(), currentSpread)
                || spreadSeries.getBarCount() <= bollWindow) {
            return;
        }

        updateBands();

        int leg1Pos = getPos(leg1Symbol);
        if (leg1Pos == 0) {
            if (currentSpread >= bollUp) {
                setTarget(leg1Symbol, -fixedSize);
                setTarget(leg2Symbol, fixedSize);
            } else if (currentSpread <= bollDown) {
                setTarget(leg1Symbol, fixedSize);
                setTarget(leg2Symbol, -fixedSize);
            }
        } else if (leg1Pos > 0) {
            if (currentSpread >= bollMid) {
                setTarget(leg1Symbol, 0);
                setTarget(leg2Symbol, 0);
            }
        } else {
            if (currentSpread <= bollMid) {
                setTarget(leg1Symbol, 0);
                setTarget(leg2Symbol, 0);
            }
        }

        rebalancePortfolio(bars);

        putEvent();
    }

    @Override
    protected BigDecimal calculatePrice(String instrument, Direction direction, BigDecimal referencePrice) {
        BigDecimal pricetick = getPricetick(instrument);
        if (pricetick == null) {
            return referencePrice;
        }

        BigDecimal offset = pricetick.multiply(BigDecimal.valueOf(tickAdd));
        return direction == Direction.LONG ? referencePrice.add(offset) : referencePrice.subtract(offset);
    }

    private void updateBands() {
        ClosePriceIndicator spread = new ClosePriceIndicator(spreadSeries.getSeries());
        BollingerBandsMiddleIndicator middle = new BollingerBandsMiddleIndicator(new SMAIndicator(spread, bollWindow));
        StandardDeviationIndicator deviation = new StandardDeviationIndicator(spread, bollWindow);
        Num k = spreadSeries.getSeries().numOf(bollDev);

        int index = spreadSeries.getEndIndex();
        bollMid = middle.getValue(index).doubleValue();
        bollUp = new BollingerBandsUpperIndicator(middle, deviation, k).getValue(index).doubleValue();
        bollDown = new BollingerBandsLowerIndicator(middle, deviation, k).getValue(index).doubleValue();
    }
}
