package com.portfoliotrader.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.portfoliotrader.broker.BrokerGateway;
import com.portfoliotrader.config.EngineProperties;
import com.portfoliotrader.core.engine.StrategyEngine;
import com.portfoliotrader.core.engine.StrategyRegistry;
import com.portfoliotrader.domain.enums.Direction;
import com.portfoliotrader.domain.enums.EngineType;
import com.portfoliotrader.domain.enums.Interval;
import com.portfoliotrader.domain.enums.OrderStatus;
import com.portfoliotrader.domain.enums.OrderType;
import com.portfoliotrader.domain.enums.StrategyState;
import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.CancelRequest;
import com.portfoliotrader.domain.model.Contract;
import com.portfoliotrader.domain.model.Order;
import com.portfoliotrader.domain.model.OrderRequest;
import com.portfoliotrader.domain.model.StrategySetting;
import com.portfoliotrader.domain.model.Tick;
import com.portfoliotrader.domain.model.Trade;
import com.portfoliotrader.event.EventPublisherHelper;
import com.portfoliotrader.exception.BrokerException;
import com.portfoliotrader.exception.ResourceNotFoundException;
import com.portfoliotrader.marketdata.HistoricalBarLoader;
import com.portfoliotrader.repository.redis.StrategyDataRedisRepository;
import com.portfoliotrader.repository.redis.StrategySettingRedisRepository;
import com.portfoliotrader.strategy.StrategyFactory;
import com.portfoliotrader.strategy.base.StrategyContext;
import com.portfoliotrader.strategy.base.StrategyParameter;
import com.portfoliotrader.strategy.base.StrategyTemplate;
import com.portfoliotrader.strategy.base.StrategyVariable;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for {@link StrategyEngine} covering event routing, fill deduplication, fault
 * isolation, the lifecycle commands, order placement, and persistence.
 *
 * <p>Init runs on a direct executor so the init queue completes inline.
 */
class StrategyEngineTest {

    private static final String INFY = "NSE:INFY";
    private static final String TCS = "NSE:TCS";
    private static final BigDecimal PRICE = new BigDecimal("1500.00");

    private StrategyRegistry strategyRegistry;
    private StrategyFactory strategyFactory;
    private BrokerGateway brokerGateway;
    private HistoricalBarLoader historicalBarLoader;
    private StrategySettingRedisRepository strategySettingRepository;
    private StrategyDataRedisRepository strategyDataRepository;
    private EventPublisherHelper eventPublisherHelper;
    private StrategyEngine strategyEngine;

    private int orderSequence;

    @BeforeEach
    void setUp() {
        EngineProperties engineProperties = new EngineProperties();
        strategyRegistry = new StrategyRegistry(engineProperties);
        strategyFactory = new StrategyFactory();
        strategyFactory.register("RecordingStrategy", RecordingStrategy::new);

        brokerGateway = mock(BrokerGateway.class);
        historicalBarLoader = mock(HistoricalBarLoader.class);
        strategySettingRepository = mock(StrategySettingRedisRepository.class);
        strategyDataRepository = mock(StrategyDataRedisRepository.class);
        eventPublisherHelper = mock(EventPublisherHelper.class);

        when(brokerGateway.getContract(INFY)).thenReturn(Optional.of(contract(INFY, "0.05", 1)));
        when(brokerGateway.getContract(TCS)).thenReturn(Optional.of(contract(TCS, "0.05", 1)));
        when(brokerGateway.convertOrderRequest(any(), anyBoolean(), anyBoolean()))
                .thenAnswer(invocation -> List.of(invocation.getArgument(0, OrderRequest.class)));
        when(brokerGateway.sendOrder(any())).thenAnswer(invocation -> "OID" + (++orderSequence));

        strategyEngine = new StrategyEngine(
                strategyRegistry,
                strategyFactory,
                brokerGateway,
                historicalBarLoader,
                strategySettingRepository,
                strategyDataRepository,
                eventPublisherHelper,
                engineProperties,
                Runnable::run);
    }

    private Contract contract(String instrument, String tickSize, int lotSize) {
        return Contract.builder()
                .instrument(instrument)
                .symbol(instrument.substring(4))
                .exchange("NSE")
                .tickSize(new BigDecimal(tickSize))
                .lotSize(lotSize)
                .gateway("KITE")
                .brokerToken(1L)
                .build();
    }

    private RecordingStrategy add(String name, String... instruments) {
        assertThat(strategyEngine.addStrategy("RecordingStrategy", name, List.of(instruments), Map.of())).isTrue();
        return (RecordingStrategy) strategyEngine.getStrategyOrThrow(name);
    }

    private RecordingStrategy addInited(String name, String... instruments) {
        RecordingStrategy strategy = add(name, instruments);
        assertThat(strategyEngine.initStrategy(name).join()).isTrue();
        return strategy;
    }

    private RecordingStrategy addTrading(String name, String... instruments) {
        RecordingStrategy strategy = addInited(name, instruments);
        assertThat(strategyEngine.startStrategy(name)).isTrue();
        return strategy;
    }

    private Tick tick(String instrument) {
        return Tick.builder()
                .instrument(instrument)
                .lastPrice(PRICE)
                .timestamp(LocalDateTime.now())
                .build();
    }

    private Trade trade(String tradeId, String orderId, Direction direction, int volume) {
        return Trade.builder()
                .tradeId(tradeId)
                .orderId(orderId)
                .instrument(INFY)
                .direction(direction)
                .price(PRICE)
                .volume(volume)
                .gateway("KITE")
                .build();
    }

    private Order order(String orderId, OrderStatus status) {
        return Order.builder()
                .orderId(orderId)
                .instrument(INFY)
                .direction(Direction.LONG)
                .status(status)
                .gateway("KITE")
                .build();
    }

    // ========================
    // ROUTING
    // ========================

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("ticks reach initialized strategies on the instrument only")
        void tickRoutedToInitedSubscribers() {
            RecordingStrategy inited = addInited("inited", INFY);
            RecordingStrategy notInited = add("created", INFY);
            RecordingStrategy other = addInited("other", TCS);

            strategyEngine.processTick(tick(INFY));

            assertThat(inited.ticks).hasSize(1);
            assertThat(notInited.ticks).isEmpty();
            assertThat(other.ticks).isEmpty();
        }

        @Test
        @DisplayName("order updates reach only the strategy that placed the order")
        void orderRoutedToOwner() {
            RecordingStrategy owner = addTrading("owner", INFY);
            RecordingStrategy bystander = addTrading("bystander", INFY);
            List<String> ids = owner.buy(INFY, PRICE, 1);

            strategyEngine.processOrder(order(ids.get(0), OrderStatus.COMPLETE));

            assertThat(owner.getActiveOrderIds()).isEmpty();
            assertThat(owner.getOrder(ids.get(0))).isPresent();
            assertThat(bystander.getOrders()).isEmpty();
        }

        @Test
        @DisplayName("updates for unknown orders are ignored")
        void unknownOrderIgnored() {
            RecordingStrategy strategy = addTrading("s", INFY);

            strategyEngine.processOrder(order("FOREIGN", OrderStatus.OPEN));
            strategyEngine.processTrade(trade("T1", "FOREIGN", Direction.LONG, 3));

            assertThat(strategy.getOrders()).isEmpty();
            assertThat(strategy.getPos(INFY)).isZero();
        }

        @Test
        @DisplayName("a redelivered trade id moves the position once")
        void duplicateTradeAppliedOnce() {
            RecordingStrategy strategy = addTrading("s", INFY);
            String orderId = strategy.buy(INFY, PRICE, 5).get(0);

            strategyEngine.processTrade(trade("T1", orderId, Direction.LONG, 5));
            strategyEngine.processTrade(trade("T1", orderId, Direction.LONG, 5));

            assertThat(strategy.getPos(INFY)).isEqualTo(5);
        }

        @Test
        @DisplayName("fills of a stopped strategy still update its position")
        void fillsAfterStopApplied() {
            RecordingStrategy strategy = addTrading("s", INFY);
            String orderId = strategy.buy(INFY, PRICE, 2).get(0);
            when(brokerGateway.getOrder(orderId)).thenReturn(Optional.of(order(orderId, OrderStatus.OPEN)));
            strategyEngine.stopStrategy("s");

            strategyEngine.processTrade(trade("T9", orderId, Direction.LONG, 2));

            assertThat(strategy.getPos(INFY)).isEqualTo(2);
        }
    }

    // ========================
    // FAULT ISOLATION
    // ========================

    @Nested
    @DisplayName("Fault isolation")
    class FaultIsolation {

        @Test
        @DisplayName("a faulting strategy goes offline and the others keep receiving ticks")
        void faultIsolated() {
            RecordingStrategy faulty = addTrading("faulty", INFY);
            RecordingStrategy healthy = addTrading("healthy", INFY);
            faulty.failOnTick = true;

            strategyEngine.processTick(tick(INFY));
            strategyEngine.processTick(tick(INFY));

            assertThat(faulty.isInited()).isFalse();
            assertThat(faulty.isTrading()).isFalse();
            assertThat(faulty.getState()).isEqualTo(StrategyState.CREATED);
            assertThat(faulty.ticks).hasSize(1);
            assertThat(healthy.ticks).hasSize(2);
            verify(eventPublisherHelper)
                    .publishStrategyLog(eq(strategyEngine), eq("faulty"), contains("faulted in onTick"));
        }

        @Test
        @DisplayName("a fault in onInit leaves the strategy uninitialized")
        void initFault() {
            RecordingStrategy strategy = add("s", INFY);
            strategy.failOnInit = true;

            assertThat(strategyEngine.initStrategy("s").join()).isFalse();

            assertThat(strategy.isInited()).isFalse();
            assertThat(strategy.getState()).isEqualTo(StrategyState.CREATED);
            verify(brokerGateway, never()).subscribe(anyString());
        }

        @Test
        @DisplayName("a fault while replaying history fails the init")
        void replayFault() {
            RecordingStrategy strategy = add("s", INFY);
            strategy.loadHistoryOnInit = true;
            strategy.failOnBars = true;
            Bar bar = Bar.flat(INFY, Interval.MINUTE, LocalDateTime.now(), PRICE);
            when(historicalBarLoader.loadBars(eq(List.of(INFY)), eq(Interval.MINUTE), any(), any()))
                    .thenReturn(List.of(Map.of(INFY, bar), Map.of(INFY, bar)));

            assertThat(strategyEngine.initStrategy("s").join()).isFalse();

            assertThat(strategy.bars).hasSize(1);
            assertThat(strategy.getState()).isEqualTo(StrategyState.CREATED);
        }

        @Test
        @DisplayName("a faulted strategy can be initialized again")
        void reinitAfterFault() {
            RecordingStrategy strategy = addTrading("s", INFY);
            strategy.failOnTick = true;
            strategyEngine.processTick(tick(INFY));
            strategy.failOnTick = false;

            assertThat(strategyEngine.initStrategy("s").join()).isTrue();
            assertThat(strategy.getState()).isEqualTo(StrategyState.INITIALIZED);
        }
    }

    // ========================
    // LIFECYCLE
    // ========================

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("add persists the roster entry with the effective parameters")
        void addPersistsSetting() {
            strategyEngine.addStrategy("RecordingStrategy", "s", List.of(INFY), Map.of("size", 4));

            ArgumentCaptor<StrategySetting> captor = ArgumentCaptor.forClass(StrategySetting.class);
            verify(strategySettingRepository).save(eq("s"), captor.capture());
            assertThat(captor.getValue().getClassName()).isEqualTo("RecordingStrategy");
            assertThat(captor.getValue().getInstruments()).containsExactly(INFY);
            assertThat(captor.getValue().getSetting()).containsEntry("size", 4);
        }

        @Test
        @DisplayName("add refuses duplicate names, unknown classes and bad settings")
        void addRefusals() {
            add("s", INFY);

            assertThat(strategyEngine.addStrategy("RecordingStrategy", "s", List.of(TCS), Map.of())).isFalse();
            assertThat(strategyEngine.addStrategy("Missing", "t", List.of(TCS), Map.of())).isFalse();
            assertThat(strategyEngine.addStrategy("RecordingStrategy", "u", List.of(TCS), Map.of("size", "big")))
                    .isFalse();

            assertThat(strategyEngine.getAllStrategySnapshots()).hasSize(1);
            assertThat(strategyEngine.getStrategyOrThrow("s").getInstruments()).containsExactly(INFY);
        }

        @Test
        @DisplayName("an instrument listed twice is refused and never indexed")
        void duplicateInstrumentRefused() {
            assertThat(strategyEngine.addStrategy("RecordingStrategy", "dup", List.of(INFY, INFY), Map.of()))
                    .isFalse();
            RecordingStrategy single = addInited("single", INFY);

            strategyEngine.processTick(tick(INFY));

            assertThat(strategyEngine.getAllStrategySnapshots()).hasSize(1);
            assertThat(single.ticks).hasSize(1);
            verify(strategySettingRepository, never()).save(eq("dup"), any());
        }

        @Test
        @DisplayName("missing or blank instruments are refused without throwing")
        void missingInstrumentsRefused() {
            assertThat(strategyEngine.addStrategy("RecordingStrategy", "none", null, Map.of())).isFalse();
            assertThat(strategyEngine.addStrategy("RecordingStrategy", "empty", List.of(), Map.of())).isFalse();
            assertThat(strategyEngine.addStrategy("RecordingStrategy", "hole", Arrays.asList(INFY, null), Map.of()))
                    .isFalse();
            assertThat(strategyEngine.addStrategy("RecordingStrategy", "blank", List.of(" "), Map.of())).isFalse();

            assertThat(strategyEngine.getAllStrategySnapshots()).isEmpty();
            verify(eventPublisherHelper, times(2))
                    .publishStrategyLog(eq(strategyEngine), isNull(), contains("No instruments given"));
        }

        @Test
        @DisplayName("a strategy constructor that throws is refused and the engine keeps going")
        void throwingConstructorRefused() {
            strategyFactory.register("Exploding", (context, name, instruments) -> {
                throw new IllegalStateException("boom");
            });

            assertThat(strategyEngine.addStrategy("Exploding", "x", List.of(INFY), Map.of())).isFalse();

            assertThat(strategyEngine.getAllStrategySnapshots()).isEmpty();
            assertThat(add("s", INFY)).isNotNull();
        }

        @Test
        @DisplayName("init restores variables, subscribes and reaches INITIALIZED")
        void initRestoresAndSubscribes() {
            RecordingStrategy strategy = add("s", INFY, TCS);
            Map<String, Object> persisted = Map.of("positions", Map.of(INFY, 7), "lastPrice", 99.5);
            when(strategyDataRepository.findByName("s")).thenReturn(Optional.of(persisted));

            assertThat(strategyEngine.initStrategy("s").join()).isTrue();

            assertThat(strategy.getState()).isEqualTo(StrategyState.INITIALIZED);
            assertThat(strategy.getPos(INFY)).isEqualTo(7);
            assertThat(strategy.getVariables()).containsEntry("lastPrice", 99.5);
            verify(brokerGateway).subscribe(INFY);
            verify(brokerGateway).subscribe(TCS);
        }

        @Test
        @DisplayName("init of an unknown contract logs and still initializes")
        void initWithMissingContract() {
            RecordingStrategy strategy = add("s", "NSE:GONE");

            assertThat(strategyEngine.initStrategy("s").join()).isTrue();

            assertThat(strategy.isInited()).isTrue();
            verify(brokerGateway, never()).subscribe("NSE:GONE");
            verify(eventPublisherHelper)
                    .publishStrategyLog(eq(strategyEngine), eq("s"), contains("Contract not found"));
        }

        @Test
        @DisplayName("a second init is refused and onInit runs once")
        void secondInitRefused() {
            RecordingStrategy strategy = addInited("s", INFY);

            assertThat(strategyEngine.initStrategy("s").join()).isFalse();

            assertThat(strategy.initCount).isEqualTo(1);
        }

        @Test
        @DisplayName("start requires an initialized, non-trading strategy")
        void startGuards() {
            add("s", INFY);

            assertThat(strategyEngine.startStrategy("s")).isFalse();
            assertThat(strategyEngine.initStrategy("s").join()).isTrue();
            assertThat(strategyEngine.startStrategy("s")).isTrue();
            assertThat(strategyEngine.startStrategy("s")).isFalse();
            assertThat(strategyEngine.getStrategySnapshot("s").getState()).isEqualTo(StrategyState.TRADING);
        }

        @Test
        @DisplayName("stop cancels every active order and persists variables once")
        void stopCancelsAndPersists() {
            RecordingStrategy strategy = addTrading("s", INFY);
            List<String> ids = new ArrayList<>();
            ids.addAll(strategy.buy(INFY, PRICE, 1));
            ids.addAll(strategy.buy(INFY, PRICE, 1));
            for (String id : ids) {
                when(brokerGateway.getOrder(id)).thenReturn(Optional.of(order(id, OrderStatus.OPEN)));
            }
            doAnswer(invocation -> {
                        String id = invocation.getArgument(0, CancelRequest.class).getOrderId();
                        strategyEngine.processOrder(order(id, OrderStatus.CANCELLED));
                        return null;
                    })
                    .when(brokerGateway)
                    .cancelOrder(any());

            assertThat(strategyEngine.stopStrategy("s")).isTrue();

            assertThat(strategy.stopCount).isEqualTo(1);
            assertThat(strategy.getState()).isEqualTo(StrategyState.STOPPED);
            assertThat(strategy.getActiveOrderIds()).isEmpty();
            verify(brokerGateway, times(2)).cancelOrder(any());

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
            verify(strategyDataRepository, times(1)).save(eq("s"), captor.capture());
            assertThat(captor.getValue()).doesNotContainKeys("initialized", "trading").containsKey("positions");
        }

        @Test
        @DisplayName("stop of a non-trading strategy is a no-op")
        void stopWhenNotTrading() {
            RecordingStrategy strategy = addInited("s", INFY);

            assertThat(strategyEngine.stopStrategy("s")).isFalse();

            assertThat(strategy.stopCount).isZero();
            verify(strategyDataRepository, never()).save(anyString(), any());
        }

        @Test
        @DisplayName("a stopped strategy can be started again")
        void restartAfterStop() {
            addTrading("s", INFY);
            strategyEngine.stopStrategy("s");

            assertThat(strategyEngine.startStrategy("s")).isTrue();
        }

        @Test
        @DisplayName("edit is refused while trading and persisted otherwise")
        void editGuards() {
            addTrading("s", INFY);

            assertThat(strategyEngine.editStrategy("s", Map.of("size", 9))).isFalse();
            assertThat(strategyEngine.getStrategyParameters("s")).containsEntry("size", 1);

            strategyEngine.stopStrategy("s");
            assertThat(strategyEngine.editStrategy("s", Map.of("size", 9))).isTrue();
            assertThat(strategyEngine.getStrategyParameters("s")).containsEntry("size", 9);
            verify(strategySettingRepository, times(2)).save(eq("s"), any());
        }

        @Test
        @DisplayName("remove is refused while trading and purges everything otherwise")
        void removeGuards() {
            RecordingStrategy strategy = addTrading("s", INFY);
            String orderId = strategy.buy(INFY, PRICE, 1).get(0);

            assertThat(strategyEngine.removeStrategy("s")).isFalse();

            when(brokerGateway.getOrder(orderId)).thenReturn(Optional.of(order(orderId, OrderStatus.OPEN)));
            strategyEngine.stopStrategy("s");
            assertThat(strategyEngine.removeStrategy("s")).isTrue();

            assertThat(strategyRegistry.contains("s")).isFalse();
            assertThat(strategyRegistry.getStrategiesForInstrument(INFY)).isEmpty();
            assertThat(strategyRegistry.findByOrderId(orderId)).isEmpty();
            verify(strategySettingRepository).delete("s");
            verify(strategyDataRepository).delete("s");
            assertThatThrownBy(() -> strategyEngine.getStrategySnapshot("s"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("commands for unknown names are refused")
        void unknownName() {
            assertThat(strategyEngine.startStrategy("ghost")).isFalse();
            assertThat(strategyEngine.stopStrategy("ghost")).isFalse();
            assertThat(strategyEngine.removeStrategy("ghost")).isFalse();
            assertThat(strategyEngine.initStrategy("ghost").join()).isFalse();
        }

        @Test
        @DisplayName("bulk commands cover every strategy")
        void bulkCommands() {
            RecordingStrategy first = add("first", INFY);
            RecordingStrategy second = add("second", TCS);

            strategyEngine.initAllStrategies().forEach(future -> assertThat(future.join()).isTrue());
            strategyEngine.startAllStrategies();
            assertThat(first.isTrading()).isTrue();
            assertThat(second.isTrading()).isTrue();

            strategyEngine.close();
            assertThat(first.getState()).isEqualTo(StrategyState.STOPPED);
            assertThat(second.getState()).isEqualTo(StrategyState.STOPPED);
        }
    }

    // ========================
    // ORDER PLACEMENT
    // ========================

    @Nested
    @DisplayName("Order placement")
    class OrderPlacement {

        @Test
        @DisplayName("price and volume are rounded to the contract and the order is tagged")
        void roundsAndTags() {
            when(brokerGateway.getContract(INFY)).thenReturn(Optional.of(contract(INFY, "0.05", 25)));
            RecordingStrategy strategy = addTrading("s", INFY);

            List<String> ids = strategy.buy(INFY, new BigDecimal("100.03"), 30);

            ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
            verify(brokerGateway).sendOrder(captor.capture());
            OrderRequest request = captor.getValue();
            assertThat(request.getPrice()).isEqualByComparingTo("100.05");
            assertThat(request.getVolume()).isEqualTo(25);
            assertThat(request.getType()).isEqualTo(OrderType.LIMIT);
            assertThat(request.getReference()).isEqualTo("PortfolioStrategy_s");
            assertThat(ids).containsExactly("OID1");
            assertThat(strategyRegistry.findByOrderId("OID1")).containsSame(strategy);
        }

        @Test
        @DisplayName("volume that rounds to zero lots is not submitted")
        void zeroLotsSkipped() {
            when(brokerGateway.getContract(INFY)).thenReturn(Optional.of(contract(INFY, "0.05", 25)));
            RecordingStrategy strategy = addTrading("s", INFY);

            assertThat(strategy.buy(INFY, PRICE, 10)).isEmpty();

            verify(brokerGateway, never()).sendOrder(any());
        }

        @Test
        @DisplayName("orders for an unknown contract are logged and dropped")
        void unknownContract() {
            RecordingStrategy strategy = addTrading("s", INFY);

            assertThat(strategy.buy("NSE:GONE", PRICE, 1)).isEmpty();

            verify(brokerGateway, never()).sendOrder(any());
            verify(eventPublisherHelper).publishStrategyLog(eq(strategyEngine), eq("s"), contains("Order not sent"));
        }

        @Test
        @DisplayName("a broker failure returns no ids")
        void brokerFailure() {
            RecordingStrategy strategy = addTrading("s", INFY);
            when(brokerGateway.sendOrder(any())).thenThrow(new BrokerException("rejected"));

            assertThat(strategy.buy(INFY, PRICE, 1)).isEmpty();
            assertThat(strategy.getActiveOrderIds()).isEmpty();
        }

        @Test
        @DisplayName("every child request of a split order is submitted and bound")
        void splitOrders() {
            RecordingStrategy strategy = addTrading("s", INFY);
            doAnswer(invocation -> {
                        OrderRequest request = invocation.getArgument(0);
                        return List.of(
                                request.toBuilder().volume(1).build(),
                                request.toBuilder().volume(2).build());
                    })
                    .when(brokerGateway)
                    .convertOrderRequest(any(), anyBoolean(), anyBoolean());

            List<String> ids = strategy.buy(INFY, PRICE, 3);

            assertThat(ids).containsExactly("OID1", "OID2");
            assertThat(strategy.getActiveOrderIds()).containsExactly("OID1", "OID2");
        }

        @Test
        @DisplayName("volumes too large for float precision keep their exact lot multiple")
        void largeVolumeRoundsExactly() {
            when(brokerGateway.getContract(INFY)).thenReturn(Optional.of(contract(INFY, "0.05", 3)));
            RecordingStrategy strategy = addTrading("s", INFY);

            strategy.buy(INFY, PRICE, 50_331_651);

            ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
            verify(brokerGateway).sendOrder(captor.capture());
            assertThat(captor.getValue().getVolume()).isEqualTo(50_331_651);
        }

        @Test
        @DisplayName("volume is rounded half up to the nearest lot")
        void roundsHalfUpToLot() {
            when(brokerGateway.getContract(INFY)).thenReturn(Optional.of(contract(INFY, "0.05", 50)));
            RecordingStrategy strategy = addTrading("s", INFY);

            strategy.buy(INFY, PRICE, 75);

            ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
            verify(brokerGateway).sendOrder(captor.capture());
            assertThat(captor.getValue().getVolume()).isEqualTo(100);
        }

        @Test
        @DisplayName("cancel of an order the gateway does not know is logged")
        void cancelUnknown() {
            RecordingStrategy strategy = addTrading("s", INFY);

            strategy.cancelOrder("NOPE");

            verify(brokerGateway, never()).cancelOrder(any());
            verify(eventPublisherHelper).publishStrategyLog(eq(strategyEngine), eq("s"), contains("order not found"));
        }
    }

    // ========================
    // ENGINE SERVICES
    // ========================

    @Nested
    @DisplayName("Engine services")
    class EngineServices {

        @Test
        @DisplayName("contract metadata is read through the gateway")
        void contractMetadata() {
            RecordingStrategy strategy = add("s", INFY);

            assertThat(strategy.getPricetick(INFY)).isEqualByComparingTo("0.05");
            assertThat(strategy.getSize(INFY)).isEqualTo(1);
            assertThat(strategy.getPricetick("NSE:GONE")).isNull();
            assertThat(strategy.getEngineType()).isEqualTo(EngineType.LIVE);
        }

        @Test
        @DisplayName("loadBars replays every slice through onBars")
        void loadBarsReplays() {
            RecordingStrategy strategy = add("s", INFY);
            Bar bar = Bar.flat(INFY, Interval.FIVE_MINUTE, LocalDateTime.now(), PRICE);
            when(historicalBarLoader.loadBars(eq(List.of(INFY)), eq(Interval.FIVE_MINUTE), any(), any()))
                    .thenReturn(List.of(Map.of(INFY, bar), Map.of(INFY, bar), Map.of(INFY, bar)));

            strategy.loadBars(3, Interval.FIVE_MINUTE);

            assertThat(strategy.bars).hasSize(3);
        }

        @Test
        @DisplayName("syncData persists while trading")
        void syncData() {
            RecordingStrategy strategy = addTrading("s", INFY);

            strategy.syncData();

            verify(strategyDataRepository).save(eq("s"), any());
        }

        @Test
        @DisplayName("class parameters come from the factory")
        void classParameters() {
            assertThat(strategyEngine.getAllStrategyClassNames()).contains("RecordingStrategy");
            assertThat(strategyEngine.getStrategyClassParameters("RecordingStrategy")).containsEntry("size", 1);
        }
    }

    /** Strategy that records what it receives and can be told to fail in a given hook. */
    static class RecordingStrategy extends StrategyTemplate {

        @StrategyParameter
        private int size = 1;

        @StrategyVariable
        private double lastPrice;

        final List<Tick> ticks = new ArrayList<>();
        final List<Map<String, Bar>> bars = new ArrayList<>();
        int initCount;
        int stopCount;
        boolean failOnInit;
        boolean failOnTick;
        boolean failOnBars;
        boolean loadHistoryOnInit;

        RecordingStrategy(StrategyContext context, String strategyName, List<String> instruments) {
            super(context, strategyName, instruments);
        }

        @Override
        public void onInit() {
            initCount++;
            if (failOnInit) {
                throw new IllegalStateException("init failure");
            }
            if (loadHistoryOnInit) {
                loadBars(1);
            }
        }

        @Override
        public void onStart() {}

        @Override
        public void onStop() {
            stopCount++;
        }

        @Override
        public void onTick(Tick tick) {
            ticks.add(tick);
            if (failOnTick) {
                throw new IllegalStateException("tick failure");
            }
        }

        @Override
        public void onBars(Map<String, Bar> slice) {
            bars.add(slice);
            if (failOnBars) {
                throw new IllegalStateException("bar failure");
            }
        }
    }
}
