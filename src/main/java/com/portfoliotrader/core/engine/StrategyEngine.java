package com.portfoliotrader.core.engine;

import com.portfoliotrader.broker.BrokerGateway;
import com.portfoliotrader.config.EngineProperties;
import com.portfoliotrader.domain.enums.Direction;
import com.portfoliotrader.domain.enums.EngineType;
import com.portfoliotrader.domain.enums.Interval;
import com.portfoliotrader.domain.enums.Offset;
import com.portfoliotrader.domain.enums.OrderType;
import com.portfoliotrader.domain.enums.StrategyState;
import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.Contract;
import com.portfoliotrader.domain.model.Order;
import com.portfoliotrader.domain.model.OrderRequest;
import com.portfoliotrader.domain.model.StrategySetting;
import com.portfoliotrader.domain.model.StrategySnapshot;
import com.portfoliotrader.domain.model.Tick;
import com.portfoliotrader.domain.model.Trade;
import com.portfoliotrader.event.EventPublisherHelper;
import com.portfoliotrader.exception.BaseException;
import com.portfoliotrader.exception.BrokerException;
import com.portfoliotrader.exception.ContractNotFoundException;
import com.portfoliotrader.exception.DuplicateStrategyNameException;
import com.portfoliotrader.exception.InvalidLifecycleTransitionException;
import com.portfoliotrader.exception.ResourceNotFoundException;
import com.portfoliotrader.exception.StrategyCallbackException;
import com.portfoliotrader.marketdata.HistoricalBarLoader;
import com.portfoliotrader.repository.redis.StrategyDataRedisRepository;
import com.portfoliotrader.repository.redis.StrategySettingRedisRepository;
import com.portfoliotrader.strategy.StrategyFactory;
import com.portfoliotrader.strategy.base.StrategyContext;
import com.portfoliotrader.strategy.base.StrategyTemplate;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.convert.ConversionException;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Central coordinator for all running portfolio strategies.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li><b>Routing:</b> ticks go to every initialized strategy trading the instrument; order
 *       updates go to the strategy that placed the order; fills are deduplicated by trade id,
 *       then go to the strategy that placed the order</li>
 *   <li><b>Order placement:</b> rounds price and volume to the contract, tags the request with
 *       the strategy, submits every child request and binds the returned ids to the strategy</li>
 *   <li><b>Lifecycle:</b> add → init → start → stop, plus edit and remove. Init runs on a
 *       single-worker queue; everything else runs on the caller's thread, which is the engine
 *       event thread (see {@link EngineEventDispatcher})</li>
 *   <li><b>Fault isolation:</b> every strategy hook runs inside {@link #callStrategyFunc}; an
 *       exception takes that strategy offline and routing carries on for the rest</li>
 * </ul>
 *
 * <p>No public method throws on a refused or failed operation. Failures are written to the
 * strategy log and reported as {@code false} or an empty result.
 */
@Service
public class StrategyEngine implements StrategyContext {

    private static final Logger log = LoggerFactory.getLogger(StrategyEngine.class);

    private final StrategyRegistry strategyRegistry;
    private final StrategyFactory strategyFactory;
    private final BrokerGateway brokerGateway;
    private final HistoricalBarLoader historicalBarLoader;
    private final StrategySettingRedisRepository strategySettingRepository;
    private final StrategyDataRedisRepository strategyDataRepository;
    private final EventPublisherHelper eventPublisherHelper;
    private final EngineProperties engineProperties;
    private final Executor strategyInitExecutor;

    public StrategyEngine(
            StrategyRegistry strategyRegistry,
            StrategyFactory strategyFactory,
            BrokerGateway brokerGateway,
            HistoricalBarLoader historicalBarLoader,
            StrategySettingRedisRepository strategySettingRepository,
            StrategyDataRedisRepository strategyDataRepository,
            EventPublisherHelper eventPublisherHelper,
            EngineProperties engineProperties,
            @Qualifier("strategyInitExecutor") Executor strategyInitExecutor) {
        this.strategyRegistry = strategyRegistry;
        this.strategyFactory = strategyFactory;
        this.brokerGateway = brokerGateway;
        this.historicalBarLoader = historicalBarLoader;
        this.strategySettingRepository = strategySettingRepository;
        this.strategyDataRepository = strategyDataRepository;
        this.eventPublisherHelper = eventPublisherHelper;
        this.engineProperties = engineProperties;
        this.strategyInitExecutor = strategyInitExecutor;
    }

    // ========================
    // EVENT ROUTING
    // ========================

    /** Delivers the tick to every initialized strategy trading its instrument, in registration order. */
    public void processTick(Tick tick) {
        for (StrategyTemplate strategy : strategyRegistry.getStrategiesForInstrument(tick.getInstrument())) {
            if (strategy.isInited()) {
                callStrategyFunc(strategy, () -> strategy.onTick(tick), "onTick");
            }
        }
    }

    /** Delivers the order update to the strategy that placed it. Orders of no live strategy are ignored. */
    public void processOrder(Order order) {
        strategyRegistry
                .findByOrderId(order.getOrderId())
                .ifPresent(strategy -> callStrategyFunc(strategy, () -> strategy.updateOrder(order), "updateOrder"));
    }

    /**
     * Applies the fill to the strategy that placed the order. A trade id is applied at most
     * once; redeliveries are dropped before routing.
     */
    public void processTrade(Trade trade) {
        if (!strategyRegistry.markTradeSeen(trade.getTradeId())) {
            log.debug("Duplicate trade {} for order {} ignored", trade.getTradeId(), trade.getOrderId());
            return;
        }

        strategyRegistry
                .findByOrderId(trade.getOrderId())
                .ifPresent(strategy -> callStrategyFunc(strategy, () -> strategy.updateTrade(trade), "updateTrade"));
    }

    // ========================
    // ORDERS (StrategyContext)
    // ========================

    @Override
    public List<String> sendOrder(
            StrategyTemplate strategy,
            String instrument,
            Direction direction,
            Offset offset,
            BigDecimal price,
            int volume,
            boolean lock,
            boolean net) {
        Contract contract;
        try {
            contract = getContractOrThrow(instrument);
        } catch (ContractNotFoundException e) {
            writeLog("Order not sent. " + e.getMessage(), strategy);
            return List.of();
        }

        BigDecimal roundedPrice = roundToTick(price, contract.getTickSize());
        int roundedVolume = roundToLot(volume, contract.getLotSize());
        if (roundedVolume <= 0) {
            writeLog(
                    String.format(
                            "Order not sent. Volume %d rounds to zero for lot size %d of %s",
                            volume, contract.getLotSize(), instrument),
                    strategy);
            return List.of();
        }

        OrderRequest request = OrderRequest.builder()
                .instrument(instrument)
                .direction(direction)
                .offset(offset)
                .type(OrderType.LIMIT)
                .price(roundedPrice)
                .volume(roundedVolume)
                .reference(engineProperties.getOrderReferencePrefix() + "_" + strategy.getStrategyName())
                .build();

        List<String> orderIds = new ArrayList<>();
        for (OrderRequest childRequest : brokerGateway.convertOrderRequest(request, lock, net)) {
            String orderId;
            try {
                orderId = brokerGateway.sendOrder(childRequest);
            } catch (BrokerException e) {
                writeLog("Order submission failed: " + e.getMessage(), strategy);
                continue;
            }
            if (orderId == null || orderId.isEmpty()) {
                continue;
            }

            orderIds.add(orderId);
            strategyRegistry.bindOrderId(orderId, strategy);
        }
        return orderIds;
    }

    @Override
    public void cancelOrder(StrategyTemplate strategy, String orderId) {
        Optional<Order> order = brokerGateway.getOrder(orderId);
        if (order.isEmpty()) {
            writeLog("Cancel failed, order not found: " + orderId, strategy);
            return;
        }

        try {
            brokerGateway.cancelOrder(order.get().createCancelRequest());
        } catch (BrokerException e) {
            writeLog("Cancel failed for " + orderId + ": " + e.getMessage(), strategy);
        }
    }

    // ========================
    // ENGINE SERVICES (StrategyContext)
    // ========================

    @Override
    public BigDecimal getPricetick(StrategyTemplate strategy, String instrument) {
        return brokerGateway.getContract(instrument).map(Contract::getTickSize).orElse(null);
    }

    @Override
    public Integer getSize(StrategyTemplate strategy, String instrument) {
        return brokerGateway.getContract(instrument).map(Contract::getLotSize).orElse(null);
    }

    /**
     * Replays history through the strategy's {@code onBars}, one forward-filled slice per
     * bar time. Stops early if the strategy faults.
     */
    @Override
    public void loadBars(StrategyTemplate strategy, int days, Interval interval) {
        LocalDateTime end = LocalDateTime.now();
        LocalDateTime start = end.minusDays(days);

        List<Map<String, Bar>> timeline =
                historicalBarLoader.loadBars(strategy.getInstruments(), interval, start, end);
        log.info("Replaying {} bar slices into {}", timeline.size(), strategy.getStrategyName());

        for (Map<String, Bar> bars : timeline) {
            if (!callStrategyFunc(strategy, () -> strategy.onBars(bars), "onBars")) {
                return;
            }
        }
    }

    @Override
    public void writeLog(String message, StrategyTemplate strategy) {
        String strategyName = strategy != null ? strategy.getStrategyName() : null;
        if (strategyName != null) {
            log.info("[{}] {}", strategyName, message);
        } else {
            log.info(message);
        }
        eventPublisherHelper.publishStrategyLog(this, strategyName, message);
    }

    @Override
    public void putStrategyEvent(StrategyTemplate strategy) {
        eventPublisherHelper.publishStrategyState(this, strategy.getData());
    }

    /** Persists the strategy's variables, minus the initialized/trading flags. */
    @Override
    public void syncStrategyData(StrategyTemplate strategy) {
        Map<String, Object> variables = strategy.getVariables();
        variables.remove(StrategyTemplate.VAR_INITIALIZED);
        variables.remove(StrategyTemplate.VAR_TRADING);

        try {
            strategyDataRepository.save(strategy.getStrategyName(), variables);
        } catch (DataAccessException e) {
            log.error("Failed to persist variables of {}: {}", strategy.getStrategyName(), e.getMessage(), e);
        }
    }

    @Override
    public EngineType getEngineType() {
        return EngineType.LIVE;
    }

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Creates a strategy from a registered class, indexes it, and saves it to the roster.
     *
     * @return false if the instrument list is empty or repeats an instrument, the name is taken,
     *     the class is unknown or fails to construct, or a setting is invalid
     */
    public boolean addStrategy(
            String className, String strategyName, List<String> instruments, Map<String, Object> setting) {
        String invalid = validateInstruments(instruments);
        if (invalid != null) {
            writeLog("Failed to add strategy " + strategyName + ". " + invalid, null);
            return false;
        }

        StrategyTemplate strategy;
        try {
            if (strategyRegistry.contains(strategyName)) {
                throw new DuplicateStrategyNameException(strategyName);
            }
            strategy = strategyFactory.create(className, this, strategyName, instruments, setting);
            strategyRegistry.register(strategy);
        } catch (BaseException | ConversionException e) {
            writeLog("Failed to add strategy. " + e.getMessage(), null);
            return false;
        } catch (RuntimeException e) {
            // plug-in constructors are strategy code
            log.error("Strategy {} of class {} failed to construct", strategyName, className, e);
            writeLog("Failed to add strategy " + strategyName + ". Constructor failed: " + e, null);
            return false;
        }

        saveStrategySetting(strategy);
        writeLog("Strategy added", strategy);
        putStrategyEvent(strategy);
        return true;
    }

    /**
     * Queues initialization on the single init worker. Initializations run one at a time,
     * in submission order, and never on the event thread.
     *
     * @return completes with true once the strategy is initialized, false if it was refused or faulted
     */
    public CompletableFuture<Boolean> initStrategy(String strategyName) {
        try {
            return CompletableFuture.supplyAsync(() -> doInitStrategy(strategyName), strategyInitExecutor);
        } catch (TaskRejectedException e) {
            writeLog("Init queue full, init request for " + strategyName + " dropped", null);
            return CompletableFuture.completedFuture(false);
        }
    }

    boolean doInitStrategy(String strategyName) {
        Optional<StrategyTemplate> found = strategyRegistry.find(strategyName);
        if (found.isEmpty()) {
            writeLog("Init failed, strategy not found: " + strategyName, null);
            return false;
        }
        StrategyTemplate strategy = found.get();

        if (strategy.isInited()) {
            rejectTransition(strategy, "init");
            return false;
        }

        strategy.markInitializing();
        writeLog("Initializing", strategy);

        if (!callStrategyFunc(strategy, strategy::onInit, "onInit")) {
            return false;
        }
        // a fault in onBars during history replay takes the strategy offline without failing onInit
        if (strategy.getState() != StrategyState.INITIALIZING) {
            return false;
        }

        Optional<Map<String, Object>> data = loadStrategyData(strategyName);
        if (data.isPresent()
                && !callStrategyFunc(strategy, () -> strategy.restoreVariables(data.get()), "restoreVariables")) {
            return false;
        }

        for (String instrument : strategy.getInstruments()) {
            try {
                getContractOrThrow(instrument);
                brokerGateway.subscribe(instrument);
            } catch (ContractNotFoundException e) {
                writeLog("Market data subscription failed. " + e.getMessage(), strategy);
            } catch (BrokerException e) {
                writeLog("Market data subscription failed for " + instrument + ": " + e.getMessage(), strategy);
            }
        }

        strategy.markInitialized();
        putStrategyEvent(strategy);
        writeLog("Initialization complete", strategy);
        return true;
    }

    /**
     * Starts trading. Refused unless initialized and not already trading.
     */
    public boolean startStrategy(String strategyName) {
        Optional<StrategyTemplate> found = findOrLog(strategyName, "start");
        if (found.isEmpty()) {
            return false;
        }
        StrategyTemplate strategy = found.get();

        if (!strategy.isInited() || strategy.isTrading()) {
            rejectTransition(strategy, "start");
            return false;
        }

        if (!callStrategyFunc(strategy, strategy::onStart, "onStart")) {
            return false;
        }

        strategy.markTrading();
        putStrategyEvent(strategy);
        writeLog("Trading started", strategy);
        return true;
    }

    /**
     * Stops trading: runs the stop hook, cancels every active order, persists variables.
     * The cancel and persist steps run even if the hook faults. No-op unless trading.
     */
    public boolean stopStrategy(String strategyName) {
        Optional<StrategyTemplate> found = findOrLog(strategyName, "stop");
        if (found.isEmpty()) {
            return false;
        }
        StrategyTemplate strategy = found.get();

        if (!strategy.isTrading()) {
            rejectTransition(strategy, "stop");
            return false;
        }

        callStrategyFunc(strategy, strategy::onStop, "onStop");

        strategy.markStopped();
        for (String orderId : strategy.getActiveOrderIds()) {
            cancelOrder(strategy, orderId);
        }
        syncStrategyData(strategy);
        putStrategyEvent(strategy);
        writeLog("Trading stopped", strategy);
        return true;
    }

    /**
     * Updates parameters and saves them to the roster. Refused while trading.
     */
    public boolean editStrategy(String strategyName, Map<String, Object> setting) {
        Optional<StrategyTemplate> found = findOrLog(strategyName, "edit");
        if (found.isEmpty()) {
            return false;
        }
        StrategyTemplate strategy = found.get();

        if (strategy.isTrading()) {
            rejectTransition(strategy, "edit");
            return false;
        }

        try {
            strategy.updateSetting(setting);
        } catch (ConversionException e) {
            writeLog("Edit failed, invalid setting: " + e.getMessage(), strategy);
            return false;
        }

        saveStrategySetting(strategy);
        putStrategyEvent(strategy);
        writeLog("Parameters updated", strategy);
        return true;
    }

    /**
     * Removes the strategy with its index entries, roster entry and persisted variables.
     * Refused while trading.
     */
    public boolean removeStrategy(String strategyName) {
        Optional<StrategyTemplate> found = findOrLog(strategyName, "remove");
        if (found.isEmpty()) {
            return false;
        }
        StrategyTemplate strategy = found.get();

        if (strategy.isTrading()) {
            rejectTransition(strategy, "remove");
            return false;
        }

        strategyRegistry.unregister(strategyName);
        try {
            strategySettingRepository.delete(strategyName);
            strategyDataRepository.delete(strategyName);
        } catch (DataAccessException e) {
            log.error("Failed to delete persisted state of {}: {}", strategyName, e.getMessage(), e);
        }
        writeLog("Strategy removed", strategy);
        return true;
    }

    public List<CompletableFuture<Boolean>> initAllStrategies() {
        List<CompletableFuture<Boolean>> results = new ArrayList<>();
        for (StrategyTemplate strategy : strategyRegistry.getAll()) {
            results.add(initStrategy(strategy.getStrategyName()));
        }
        return results;
    }

    public void startAllStrategies() {
        for (StrategyTemplate strategy : strategyRegistry.getAll()) {
            startStrategy(strategy.getStrategyName());
        }
    }

    public void stopAllStrategies() {
        for (StrategyTemplate strategy : strategyRegistry.getAll()) {
            if (strategy.isTrading()) {
                stopStrategy(strategy.getStrategyName());
            }
        }
    }

    public void close() {
        stopAllStrategies();
    }

    // ========================
    // QUERIES
    // ========================

    public List<String> getAllStrategyClassNames() {
        return strategyFactory.getClassNames();
    }

    public Map<String, Object> getStrategyClassParameters(String className) {
        return strategyFactory.getClassParameters(className, this);
    }

    public Map<String, Object> getStrategyParameters(String strategyName) {
        return getStrategyOrThrow(strategyName).getParameters();
    }

    public StrategySnapshot getStrategySnapshot(String strategyName) {
        return getStrategyOrThrow(strategyName).getData();
    }

    public List<StrategySnapshot> getAllStrategySnapshots() {
        return strategyRegistry.getAll().stream().map(StrategyTemplate::getData).toList();
    }

    public StrategyTemplate getStrategyOrThrow(String strategyName) {
        return strategyRegistry
                .find(strategyName)
                .orElseThrow(() -> new ResourceNotFoundException("Strategy", strategyName));
    }

    // ========================
    // FAULT ISOLATION
    // ========================

    /**
     * Runs a strategy hook. If it throws, the strategy is taken offline (not initialized,
     * not trading), the fault is logged with its stack trace, and false is returned.
     */
    boolean callStrategyFunc(StrategyTemplate strategy, Runnable func, String hook) {
        try {
            func.run();
            return true;
        } catch (Exception e) {
            strategy.forceOffline();

            StrategyCallbackException fault = new StrategyCallbackException(strategy.getStrategyName(), hook, e);
            log.error(fault.getMessage(), e);

            StringWriter trace = new StringWriter();
            e.printStackTrace(new PrintWriter(trace));
            eventPublisherHelper.publishStrategyLog(
                    this, strategy.getStrategyName(), fault.getMessage() + " - strategy taken offline\n" + trace);
            putStrategyEvent(strategy);
            return false;
        }
    }

    // ========================
    // HELPERS
    // ========================

    private Contract getContractOrThrow(String instrument) {
        return brokerGateway.getContract(instrument).orElseThrow(() -> new ContractNotFoundException(instrument));
    }

    private Optional<StrategyTemplate> findOrLog(String strategyName, String operation) {
        Optional<StrategyTemplate> strategy = strategyRegistry.find(strategyName);
        if (strategy.isEmpty()) {
            writeLog(String.format("Cannot %s, strategy not found: %s", operation, strategyName), null);
        }
        return strategy;
    }

    private void rejectTransition(StrategyTemplate strategy, String operation) {
        InvalidLifecycleTransitionException rejection =
                new InvalidLifecycleTransitionException(strategy.getStrategyName(), operation, strategy.getState());
        log.warn(rejection.getMessage());
        eventPublisherHelper.publishStrategyLog(this, strategy.getStrategyName(), rejection.getMessage());
    }

    private Optional<Map<String, Object>> loadStrategyData(String strategyName) {
        try {
            return strategyDataRepository.findByName(strategyName);
        } catch (DataAccessException e) {
            log.error("Failed to load variables of {}: {}", strategyName, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private void saveStrategySetting(StrategyTemplate strategy) {
        StrategySetting setting = StrategySetting.builder()
                .className(strategy.getClassName())
                .instruments(strategy.getInstruments())
                .setting(strategy.getParameters())
                .build();
        try {
            strategySettingRepository.save(strategy.getStrategyName(), setting);
        } catch (DataAccessException e) {
            log.error("Failed to persist setting of {}: {}", strategy.getStrategyName(), e.getMessage(), e);
        }
    }

    /** @return why the instrument list is unusable, or null if it is fine */
    private static String validateInstruments(List<String> instruments) {
        if (instruments == null || instruments.isEmpty()) {
            return "No instruments given";
        }
        Set<String> seen = new HashSet<>();
        for (String instrument : instruments) {
            if (instrument == null || instrument.isBlank()) {
                return "Blank instrument in " + instruments;
            }
            if (!seen.add(instrument)) {
                return "Instrument listed twice: " + instrument;
            }
        }
        return null;
    }

    static BigDecimal roundToTick(BigDecimal price, BigDecimal tickSize) {
        if (price == null || tickSize == null || tickSize.signum() <= 0) {
            return price;
        }
        return price.divide(tickSize, 0, RoundingMode.HALF_UP).multiply(tickSize);
    }

    static int roundToLot(int volume, int lotSize) {
        if (lotSize <= 1) {
            return volume;
        }
        return BigDecimal.valueOf(volume)
                .divide(BigDecimal.valueOf(lotSize), 0, RoundingMode.HALF_UP)
                .intValueExact() * lotSize;
    }
}
