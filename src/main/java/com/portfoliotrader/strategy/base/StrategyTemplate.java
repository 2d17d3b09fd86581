package com.portfoliotrader.strategy.base;

import com.portfoliotrader.domain.enums.Direction;
import com.portfoliotrader.domain.enums.EngineType;
import com.portfoliotrader.domain.enums.Interval;
import com.portfoliotrader.domain.enums.Offset;
import com.portfoliotrader.domain.enums.StrategyState;
import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.Order;
import com.portfoliotrader.domain.model.StrategySnapshot;
import com.portfoliotrader.domain.model.Tick;
import com.portfoliotrader.domain.model.Trade;
import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base class for portfolio strategies: one instance trades a fixed list of instruments.
 *
 * <p>Provides the infrastructure every strategy needs:
 * <ul>
 *   <li><b>Position tracking:</b> a {@link PositionLedger} of actual vs target net position,
 *       updated from fills routed by the engine</li>
 *   <li><b>Order tracking:</b> a {@link StrategyOrderBook} with the ids still active</li>
 *   <li><b>Rebalancing:</b> {@link #rebalancePortfolio} turns target minus position into
 *       close/open orders, so a strategy only has to set targets</li>
 *   <li><b>Parameters and variables:</b> fields annotated {@link StrategyParameter} /
 *       {@link StrategyVariable}, read and written by name for persistence and reporting</li>
 * </ul>
 *
 * <p>Subclasses implement {@link #onInit}, {@link #onStart} and {@link #onStop}, and override
 * {@link #onTick} and/or {@link #onBars}. Every hook is called by the engine behind a fault
 * boundary: an exception takes this instance offline but never reaches other strategies.
 *
 * <p>Constructors must accept an empty instrument list; the factory builds prototype
 * instances that way to read default parameter values.
 */
public abstract class StrategyTemplate {

    public static final String VAR_INITIALIZED = "initialized";
    public static final String VAR_TRADING = "trading";
    public static final String VAR_POSITIONS = "positions";
    public static final String VAR_TARGETS = "targets";

    protected final StrategyContext context;
    protected final String strategyName;
    protected final List<String> instruments;

    private final PositionLedger ledger = new PositionLedger();
    private final StrategyOrderBook orderBook = new StrategyOrderBook();

    private volatile StrategyState state = StrategyState.CREATED;
    private volatile boolean inited;
    private volatile boolean trading;

    protected StrategyTemplate(StrategyContext context, String strategyName, List<String> instruments) {
        this.context = context;
        this.strategyName = strategyName;
        this.instruments = List.copyOf(instruments);
    }

    // ========================
    // HOOKS
    // ========================

    public abstract void onInit();

    public abstract void onStart();

    public abstract void onStop();

    public void onTick(Tick tick) {}

    /** One bar per instrument for the same timestamp. */
    public void onBars(Map<String, Bar> bars) {}

    // ========================
    // ENGINE CALLBACKS
    // ========================

    /** Applies a fill to the net position: + volume for LONG, - volume for SHORT, whatever the offset. */
    public void updateTrade(Trade trade) {
        ledger.applyFill(trade.getInstrument(), trade.signedVolume());
    }

    public void updateOrder(Order order) {
        orderBook.update(order);
    }

    // ========================
    // ORDERS
    // ========================

    public List<String> buy(String instrument, BigDecimal price, int volume) {
        return buy(instrument, price, volume, false, false);
    }

    public List<String> buy(String instrument, BigDecimal price, int volume, boolean lock, boolean net) {
        return sendOrder(instrument, Direction.LONG, Offset.OPEN, price, volume, lock, net);
    }

    public List<String> sell(String instrument, BigDecimal price, int volume) {
        return sell(instrument, price, volume, false, false);
    }

    public List<String> sell(String instrument, BigDecimal price, int volume, boolean lock, boolean net) {
        return sendOrder(instrument, Direction.SHORT, Offset.CLOSE, price, volume, lock, net);
    }

    public List<String> shortSell(String instrument, BigDecimal price, int volume) {
        return shortSell(instrument, price, volume, false, false);
    }

    public List<String> shortSell(String instrument, BigDecimal price, int volume, boolean lock, boolean net) {
        return sendOrder(instrument, Direction.SHORT, Offset.OPEN, price, volume, lock, net);
    }

    public List<String> cover(String instrument, BigDecimal price, int volume) {
        return cover(instrument, price, volume, false, false);
    }

    public List<String> cover(String instrument, BigDecimal price, int volume, boolean lock, boolean net) {
        return sendOrder(instrument, Direction.LONG, Offset.CLOSE, price, volume, lock, net);
    }

    /**
     * Sends an order through the engine. Ignored unless trading.
     *
     * @return ids of the submitted orders, all tracked as active
     */
    public List<String> sendOrder(
            String instrument,
            Direction direction,
            Offset offset,
            BigDecimal price,
            int volume,
            boolean lock,
            boolean net) {
        if (!trading) {
            return List.of();
        }
        List<String> orderIds = context.sendOrder(this, instrument, direction, offset, price, volume, lock, net);
        orderIds.forEach(orderBook::addActive);
        return orderIds;
    }

    public void cancelOrder(String orderId) {
        if (trading) {
            context.cancelOrder(this, orderId);
        }
    }

    public void cancelAll() {
        for (String orderId : orderBook.getActiveOrderIds()) {
            cancelOrder(orderId);
        }
    }

    // ========================
    // POSITIONS
    // ========================

    public int getPos(String instrument) {
        return ledger.getPosition(instrument);
    }

    public int getTarget(String instrument) {
        return ledger.getTarget(instrument);
    }

    public void setTarget(String instrument, int target) {
        ledger.setTarget(instrument, target);
    }

    public Map<String, Integer> getPositions() {
        return ledger.getPositions();
    }

    public Map<String, Integer> getTargets() {
        return ledger.getTargets();
    }

    // ========================
    // REBALANCE
    // ========================

    /**
     * Moves every instrument in {@code bars} from its position towards its target, priced
     * off the bar close. Instruments missing from {@code bars} are left alone.
     */
    public void rebalancePortfolio(Map<String, Bar> bars) {
        Map<String, BigDecimal> referencePrices = new LinkedHashMap<>();
        bars.forEach((instrument, bar) -> referencePrices.put(instrument, bar.getClose()));
        rebalanceToPrices(referencePrices);
    }

    /**
     * Cancels all active orders, then for each instrument sends the orders that close out
     * the opposite side first and open the remainder.
     *
     * <p>Buying 5 from -3 sends cover 3 + buy 2; selling 5 from +3 sends sell 3 + short 2.
     * Both legs of one instrument always share a direction, and their volumes sum to
     * {@code target - position}.
     */
    public void rebalanceToPrices(Map<String, BigDecimal> referencePrices) {
        cancelAll();

        referencePrices.forEach(this::rebalance);
    }

    protected void rebalance(String instrument, BigDecimal referencePrice) {
        int target = getTarget(instrument);
        int pos = getPos(instrument);
        int diff = target - pos;

        if (diff > 0) {
            BigDecimal price = calculatePrice(instrument, Direction.LONG, referencePrice);

            int coverVolume = Math.min(diff, Math.max(0, -pos));
            int buyVolume = diff - coverVolume;

            if (coverVolume > 0) {
                cover(instrument, price, coverVolume);
            }
            if (buyVolume > 0) {
                buy(instrument, price, buyVolume);
            }
        } else if (diff < 0) {
            BigDecimal price = calculatePrice(instrument, Direction.SHORT, referencePrice);

            int sellVolume = Math.min(-diff, Math.max(0, pos));
            int shortVolume = -diff - sellVolume;

            if (sellVolume > 0) {
                sell(instrument, price, sellVolume);
            }
            if (shortVolume > 0) {
                shortSell(instrument, price, shortVolume);
            }
        }
    }

    /** Order price for a rebalance leg. Override to pay up, e.g. a few ticks through the reference. */
    protected BigDecimal calculatePrice(String instrument, Direction direction, BigDecimal referencePrice) {
        return referencePrice;
    }

    // ========================
    // PARAMETERS & VARIABLES
    // ========================

    public String getClassName() {
        return getClass().getSimpleName();
    }

    public String getAuthor() {
        return "";
    }

    public List<String> getParameterNames() {
        return new ArrayList<>(StrategyFields.parameters(getClass()).keySet());
    }

    public List<String> getVariableNames() {
        List<String> names = new ArrayList<>(List.of(VAR_INITIALIZED, VAR_TRADING, VAR_POSITIONS, VAR_TARGETS));
        names.addAll(StrategyFields.variables(getClass()).keySet());
        return names;
    }

    public Map<String, Object> getParameters() {
        return StrategyFields.read(StrategyFields.parameters(getClass()), this);
    }

    public Map<String, Object> getVariables() {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put(VAR_INITIALIZED, inited);
        variables.put(VAR_TRADING, trading);
        variables.put(VAR_POSITIONS, ledger.getPositions());
        variables.put(VAR_TARGETS, ledger.getTargets());
        variables.putAll(StrategyFields.read(StrategyFields.variables(getClass()), this));
        return variables;
    }

    /**
     * Sets declared parameters from {@code setting}. Unknown keys are ignored.
     *
     * @throws org.springframework.core.convert.ConversionException if a value does not fit its field
     */
    public void updateSetting(Map<String, Object> setting) {
        Map<String, Field> parameters = StrategyFields.parameters(getClass());
        setting.forEach((name, value) -> {
            Field field = parameters.get(name);
            if (field != null && value != null) {
                StrategyFields.write(field, this, value);
            }
        });
    }

    /**
     * Restores persisted variables. {@code initialized}/{@code trading} and null values are
     * skipped; positions and targets are merged so instruments absent from the data keep 0.
     */
    public void restoreVariables(Map<String, Object> data) {
        Map<String, Field> variables = StrategyFields.variables(getClass());
        data.forEach((name, value) -> {
            if (value == null || VAR_INITIALIZED.equals(name) || VAR_TRADING.equals(name)) {
                return;
            }
            if (VAR_POSITIONS.equals(name)) {
                ledger.restorePositions(toVolumeMap(value));
            } else if (VAR_TARGETS.equals(name)) {
                ledger.restoreTargets(toVolumeMap(value));
            } else {
                Field field = variables.get(name);
                if (field != null) {
                    StrategyFields.write(field, this, value);
                }
            }
        });
    }

    public StrategySnapshot getData() {
        return StrategySnapshot.builder()
                .strategyName(strategyName)
                .className(getClassName())
                .author(getAuthor())
                .instruments(instruments)
                .state(state)
                .parameters(getParameters())
                .variables(getVariables())
                .build();
    }

    private static Map<String, Integer> toVolumeMap(Object value) {
        Map<String, Integer> volumes = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((instrument, volume) -> {
                if (volume != null) {
                    volumes.put(String.valueOf(instrument), StrategyFields.convert(volume, Integer.class));
                }
            });
        }
        return volumes;
    }

    // ========================
    // ENGINE SERVICES
    // ========================

    public BigDecimal getPricetick(String instrument) {
        return context.getPricetick(this, instrument);
    }

    public Integer getSize(String instrument) {
        return context.getSize(this, instrument);
    }

    public void loadBars(int days) {
        loadBars(days, Interval.MINUTE);
    }

    public void loadBars(int days, Interval interval) {
        context.loadBars(this, days, interval);
    }

    public void writeLog(String message) {
        context.writeLog(message, this);
    }

    public EngineType getEngineType() {
        return context.getEngineType();
    }

    /** Publishes a state snapshot. No-op until initialized. */
    public void putEvent() {
        if (inited) {
            context.putStrategyEvent(this);
        }
    }

    /** Persists variables now instead of waiting for stop. No-op unless trading. */
    public void syncData() {
        if (trading) {
            context.syncStrategyData(this);
        }
    }

    // ========================
    // LIFECYCLE (driven by the engine)
    // ========================

    public void markInitializing() {
        state = StrategyState.INITIALIZING;
    }

    public void markInitialized() {
        inited = true;
        state = StrategyState.INITIALIZED;
    }

    public void markTrading() {
        trading = true;
        state = StrategyState.TRADING;
    }

    /** Leaves trading. An instance forced offline during the stop hook stays CREATED. */
    public void markStopped() {
        trading = false;
        state = inited ? StrategyState.STOPPED : StrategyState.CREATED;
    }

    /** Takes the instance offline after a callback fault. */
    public void forceOffline() {
        trading = false;
        inited = false;
        state = StrategyState.CREATED;
    }

    // ========================
    // ACCESSORS
    // ========================

    public String getStrategyName() {
        return strategyName;
    }

    public List<String> getInstruments() {
        return instruments;
    }

    public StrategyState getState() {
        return state;
    }

    public boolean isInited() {
        return inited;
    }

    public boolean isTrading() {
        return trading;
    }

    public List<String> getActiveOrderIds() {
        return orderBook.getActiveOrderIds();
    }

    public Optional<Order> getOrder(String orderId) {
        return orderBook.getOrder(orderId);
    }

    public List<Order> getOrders() {
        return orderBook.getOrders();
    }
}
