package com.portfoliotrader.strategy.impl;

import com.portfoliotrader.domain.enums.Direction;
import com.portfoliotrader.domain.enums.Interval;
import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.Tick;
import com.portfoliotrader.strategy.base.StrategyContext;
import com.portfoliotrader.strategy.base.StrategyParameter;
import com.portfoliotrader.strategy.base.StrategyTemplate;
import com.portfoliotrader.strategy.support.BarSeriesBuffer;
import com.portfoliotrader.strategy.support.PortfolioBarGenerator;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.CCIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

/**
 * Per-instrument Bollinger channel with a CCI entry filter and an ATR trailing stop, run on
 * {@code windowHours}-hour bars.
 *
 * <p>Each instrument keeps the last 100 window bars. Once every instrument in a window has
 * 100 bars:
 * <ul>
 *   <li>Flat: target {@code +fixedSize} when CCI is positive, {@code -fixedSize} when negative</li>
 *   <li>Long: flatten when the close falls to the highest high since entry less
 *       {@code atr * slMultiplier}</li>
 *   <li>Short: flatten when the close rises to the lowest low since entry plus
 *       {@code atr * slMultiplier}</li>
 * </ul>
 *
 * <p>Entries are sent as limit orders at the band on the entry side (upper band for longs,
 * lower band for shorts). Exits are priced {@code priceAdd} through the close.
 */
public class PortfolioBollChannelStrategy extends StrategyTemplate {

    private static final int SERIES_SIZE = 100;

    @StrategyParameter
    private int bollWindow = 18;

    @StrategyParameter
    private double bollDev = 3.4;

    @StrategyParameter
    private int cciWindow = 10;

    @StrategyParameter
    private int atrWindow = 30;

    @StrategyParameter
    private double slMultiplier = 5.2;

    @StrategyParameter
    private int fixedSize = 1;

    @StrategyParameter
    private double priceAdd = 5;

    @StrategyParameter
    private int windowHours = 2;

    private final Map<String, BarSeriesBuffer> seriesByInstrument = new HashMap<>();
    private final Map<String, Double> bollUp = new HashMap<>();
    private final Map<String, Double> bollDown = new HashMap<>();
    private final Map<String, Double> intraTradeHigh = new HashMap<>();
    private final Map<String, Double> intraTradeLow = new HashMap<>();

    // built on first use so that a windowHours setting applies
    private PortfolioBarGenerator barGenerator;

    public PortfolioBollChannelStrategy(StrategyContext context, String strategyName, List<String> instruments) {
        super(context, strategyName, instruments);
    }

    @Override
    public String getAuthor() {
        return "portfolio-trader";
    }

    @Override
    public void onInit() {
        writeLog("Strategy initialized");
        loadBars(10);
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
        barGenerator().updateTick(tick);
    }

    @Override
    public void onBars(Map<String, Bar> bars) {
        barGenerator().updateBars(bars);
    }

    private PortfolioBarGenerator barGenerator() {
        if (barGenerator == null) {
            barGenerator = new PortfolioBarGenerator(this::onBars, windowHours, this::onWindowBars, Interval.HOUR);
        }
        return barGenerator;
    }

    private void onWindowBars(Map<String, Bar> bars) {
        cancelAll();

        Duration windowDuration = Duration.ofHours(windowHours);
        bars.forEach((instrument, bar) -> seriesByInstrument
                .computeIfAbsent(instrument, i -> new BarSeriesBuffer(strategyName + "-" + i, windowDuration, SERIES_SIZE))
                .add(bar));

        for (String instrument : bars.keySet()) {
            if (seriesByInstrument.get(instrument).getBarCount() < SERIES_SIZE) {
                return;
            }
        }

        bars.forEach(this::updateTarget);
        bars.forEach((instrument, bar) -> rebalance(instrument, bar.getClose()));

        putEvent();
    }

    private void updateTarget(String instrument, Bar bar) {
        BarSeries series = seriesByInstrument.get(instrument).getSeries();
        int index = series.getEndIndex();

        ClosePriceIndicator close = new ClosePriceIndicator(series);
        BollingerBandsMiddleIndicator middle = new BollingerBandsMiddleIndicator(new SMAIndicator(close, bollWindow));
        StandardDeviationIndicator deviation = new StandardDeviationIndicator(close, bollWindow);
        Num k = series.numOf(bollDev);
        bollUp.put(instrument, new BollingerBandsUpperIndicator(middle, deviation, k).getValue(index).doubleValue());
        bollDown.put(instrument, new BollingerBandsLowerIndicator(middle, deviation, k).getValue(index).doubleValue());

        double cci = new CCIIndicator(series, cciWindow).getValue(index).doubleValue();
        double atr = new ATRIndicator(series, atrWindow).getValue(index).doubleValue();

        double high = bar.getHigh().doubleValue();
        double low = bar.getLow().doubleValue();
        double closePrice = bar.getClose().doubleValue();

        int pos = getPos(instrument);
        if (pos == 0) {
            intraTradeHigh.put(instrument, high);
            intraTradeLow.put(instrument, low);

            if (cci > 0) {
                setTarget(instrument, fixedSize);
            } else if (cci < 0) {
                setTarget(instrument, -fixedSize);
            }
        } else if (pos > 0) {
            double tradeHigh = Math.max(intraTradeHigh.getOrDefault(instrument, high), high);
            intraTradeHigh.put(instrument, tradeHigh);
            intraTradeLow.put(instrument, low);

            if (closePrice <= tradeHigh - atr * slMultiplier) {
                setTarget(instrument, 0);
            }
        } else {
            double tradeLow = Math.min(intraTradeLow.getOrDefault(instrument, low), low);
            intraTradeLow.put(instrument, tradeLow);
            intraTradeHigh.put(instrument, high);

            if (closePrice >= tradeLow + atr * slMultiplier) {
                setTarget(instrument, 0);
            }
        }
    }

    @Override
    protected BigDecimal calculatePrice(String instrument, Direction direction, BigDecimal referencePrice) {
        if (getPos(instrument) == 0) {
            Double band = direction == Direction.LONG ? bollUp.get(instrument) : bollDown.get(instrument);
            if (band != null) {
                return BigDecimal.valueOf(band);
            }
        }

        BigDecimal offset = BigDecimal.valueOf(priceAdd);
        return direction == Direction.LONG ? referencePrice.add(offset) : referencePrice.subtract(offset);
    }
}
