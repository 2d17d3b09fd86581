package com.portfoliotrader.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.portfoliotrader.domain.enums.Direction;
import com.portfoliotrader.domain.enums.Offset;
import com.portfoliotrader.domain.enums.OrderStatus;
import com.portfoliotrader.domain.enums.StrategyState;
import com.portfoliotrader.domain.model.Order;
import com.portfoliotrader.domain.model.StrategySnapshot;
import com.portfoliotrader.domain.model.Trade;
import com.portfoliotrader.strategy.base.StrategyContext;
import com.portfoliotrader.strategy.base.StrategyParameter;
import com.portfoliotrader.strategy.base.StrategyTemplate;
import com.portfoliotrader.strategy.base.StrategyVariable;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.convert.ConversionException;

/**
 * Unit tests for {@link StrategyTemplate} covering the order helpers, the rebalance split,
 * fill accounting, and parameter/variable handling.
 */
class StrategyTemplateTest {

    private static final String INFY = "NSE:INFY";
    private static final String TCS = "NSE:TCS";
    private static final BigDecimal PRICE = new BigDecimal("1500.00");

    private StrategyContext context;
    private TestStrategy strategy;
    private AtomicInteger nextOrderId;

    @BeforeEach
    void setUp() {
        context = mock(StrategyContext.class);
        nextOrderId = new AtomicInteger(1);
        when(context.sendOrder(any(), anyString(), any(), any(), any(), anyInt(), anyBoolean(), anyBoolean()))
                .thenAnswer(invocation -> List.of(String.valueOf(nextOrderId.getAndIncrement())));

        strategy = new TestStrategy(context, "test", List.of(INFY, TCS));
    }

    private void startTrading() {
        strategy.markInitialized();
        strategy.markTrading();
    }

    private Trade fill(String instrument, Direction direction, int volume) {
        return Trade.builder()
                .tradeId("T" + nextOrderId.get())
                .orderId("O")
                .instrument(instrument)
                .direction(direction)
                .volume(volume)
                .price(PRICE)
                .build();
    }

    // ========================
    // ORDER HELPERS
    // ========================

    @Nested
    @DisplayName("Order helpers")
    class OrderHelpers {

        @Test
        @DisplayName("orders are dropped while not trading")
        void ignoredWhenNotTrading() {
            assertThat(strategy.buy(INFY, PRICE, 1)).isEmpty();

            verify(context, never())
                    .sendOrder(any(), anyString(), any(), any(), any(), anyInt(), anyBoolean(), anyBoolean());
        }

        @Test
        @DisplayName("submitted ids are tracked as active")
        void idsTrackedActive() {
            startTrading();

            List<String> ids = strategy.shortSell(INFY, PRICE, 2);

            assertThat(ids).containsExactly("1");
            assertThat(strategy.getActiveOrderIds()).containsExactly("1");
            verify(context).sendOrder(strategy, INFY, Direction.SHORT, Offset.OPEN, PRICE, 2, false, false);
        }

        @Test
        @DisplayName("cancelAll cancels every active order")
        void cancelAllCancelsActive() {
            startTrading();
            strategy.buy(INFY, PRICE, 1);
            strategy.buy(TCS, PRICE, 1);

            strategy.cancelAll();

            verify(context).cancelOrder(strategy, "1");
            verify(context).cancelOrder(strategy, "2");
        }

        @Test
        @DisplayName("terminal order update clears the active id")
        void terminalUpdateClearsActive() {
            startTrading();
            strategy.buy(INFY, PRICE, 1);

            strategy.updateOrder(
                    Order.builder().orderId("1").instrument(INFY).status(OrderStatus.COMPLETE).build());

            assertThat(strategy.getActiveOrderIds()).isEmpty();
        }
    }

    // ========================
    // REBALANCE
    // ========================

    @Nested
    @DisplayName("Rebalance")
    class Rebalance {

        @BeforeEach
        void trading() {
            startTrading();
        }

        @Test
        @DisplayName("flat to +3 sends a single buy of 3")
        void flatToLong() {
            strategy.setTarget(INFY, 3);

            strategy.rebalanceToPrices(Map.of(INFY, PRICE));

            verify(context).sendOrder(strategy, INFY, Direction.LONG, Offset.OPEN, PRICE, 3, false, false);
            verify(context, never()).sendOrder(
                    any(), anyString(), eq(Direction.SHORT), any(), any(), anyInt(), anyBoolean(), anyBoolean());
        }

        @Test
        @DisplayName("+3 to -2 sends sell 3 then short 2")
        void longToShort() {
            strategy.updateTrade(fill(INFY, Direction.LONG, 3));
            strategy.setTarget(INFY, -2);

            strategy.rebalanceToPrices(Map.of(INFY, PRICE));

            verify(context).sendOrder(strategy, INFY, Direction.SHORT, Offset.CLOSE, PRICE, 3, false, false);
            verify(context).sendOrder(strategy, INFY, Direction.SHORT, Offset.OPEN, PRICE, 2, false, false);
        }

        @Test
        @DisplayName("-3 to +2 sends cover 3 then buy 2")
        void shortToLong() {
            strategy.updateTrade(fill(INFY, Direction.SHORT, 3));
            strategy.setTarget(INFY, 2);

            strategy.rebalanceToPrices(Map.of(INFY, PRICE));

            verify(context).sendOrder(strategy, INFY, Direction.LONG, Offset.CLOSE, PRICE, 3, false, false);
            verify(context).sendOrder(strategy, INFY, Direction.LONG, Offset.OPEN, PRICE, 2, false, false);
        }

        @Test
        @DisplayName("+5 to +2 only sells the difference")
        void partialReduce() {
            strategy.updateTrade(fill(INFY, Direction.LONG, 5));
            strategy.setTarget(INFY, 2);

            strategy.rebalanceToPrices(Map.of(INFY, PRICE));

            verify(context).sendOrder(strategy, INFY, Direction.SHORT, Offset.CLOSE, PRICE, 3, false, false);
            verify(context, never()).sendOrder(
                    any(), anyString(), any(), eq(Offset.OPEN), any(), anyInt(), anyBoolean(), anyBoolean());
        }

        @Test
        @DisplayName("at target no orders are sent")
        void idempotentAtTarget() {
            strategy.updateTrade(fill(INFY, Direction.LONG, 3));
            strategy.setTarget(INFY, 3);

            strategy.rebalanceToPrices(Map.of(INFY, PRICE));

            verify(context, never())
                    .sendOrder(any(), anyString(), any(), any(), any(), anyInt(), anyBoolean(), anyBoolean());
        }

        @Test
        @DisplayName("working orders are cancelled before new ones are sent")
        void cancelsBeforeSending() {
            strategy.buy(TCS, PRICE, 1);
            strategy.setTarget(INFY, 1);

            strategy.rebalanceToPrices(Map.of(INFY, PRICE));

            verify(context).cancelOrder(strategy, "1");
        }

        @Test
        @DisplayName("instruments without a reference price are left alone")
        void skipsMissingPrices() {
            strategy.setTarget(INFY, 1);
            strategy.setTarget(TCS, 1);

            strategy.rebalanceToPrices(Map.of(INFY, PRICE));

            verify(context, never()).sendOrder(
                    any(), eq(TCS), any(), any(), any(), anyInt(), anyBoolean(), anyBoolean());
        }
    }

    // ========================
    // FILLS
    // ========================

    @Test
    @DisplayName("fills move the position by signed volume whatever the offset")
    void fillsApplySignedVolume() {
        strategy.updateTrade(fill(INFY, Direction.LONG, 4));
        strategy.updateTrade(fill(INFY, Direction.SHORT, 6));

        assertThat(strategy.getPos(INFY)).isEqualTo(-2);
        assertThat(strategy.getPos(TCS)).isZero();
    }

    // ========================
    // PARAMETERS & VARIABLES
    // ========================

    @Nested
    @DisplayName("Parameters and variables")
    class ParametersAndVariables {

        @Test
        @DisplayName("parameters are listed in declaration order with defaults")
        void parameterDefaults() {
            assertThat(strategy.getParameterNames()).containsExactly("fixedSize", "threshold");
            assertThat(strategy.getParameters()).containsEntry("fixedSize", 1).containsEntry("threshold", 0.5);
        }

        @Test
        @DisplayName("updateSetting converts values and ignores unknown keys")
        void updateSettingConverts() {
            Map<String, Object> setting = new HashMap<>();
            setting.put("fixedSize", "7");
            setting.put("threshold", 2);
            setting.put("unknown", "x");
            setting.put("lastSignal", 9.0);

            strategy.updateSetting(setting);

            assertThat(strategy.getParameters()).containsEntry("fixedSize", 7).containsEntry("threshold", 2.0);
            assertThat(strategy.getVariables()).containsEntry("lastSignal", 0.0);
        }

        @Test
        @DisplayName("updateSetting rejects values that do not fit the field")
        void updateSettingRejectsBadValue() {
            assertThatThrownBy(() -> strategy.updateSetting(Map.of("fixedSize", "many")))
                    .isInstanceOf(ConversionException.class);
        }

        @Test
        @DisplayName("variables start with the engine-managed entries")
        void variableOrder() {
            assertThat(strategy.getVariableNames())
                    .containsExactly("initialized", "trading", "positions", "targets", "lastSignal", "note");
        }

        @Test
        @DisplayName("restoreVariables merges positions and skips lifecycle flags")
        void restoreVariables() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("initialized", true);
            data.put("trading", true);
            data.put("positions", Map.of(INFY, 3));
            data.put("targets", Map.of(INFY, 3L));
            data.put("lastSignal", 1.25);
            data.put("note", null);

            strategy.restoreVariables(data);

            assertThat(strategy.isInited()).isFalse();
            assertThat(strategy.isTrading()).isFalse();
            assertThat(strategy.getPos(INFY)).isEqualTo(3);
            assertThat(strategy.getPos(TCS)).isZero();
            assertThat(strategy.getTarget(INFY)).isEqualTo(3);
            assertThat(strategy.getVariables()).containsEntry("lastSignal", 1.25).containsEntry("note", "");
        }

        @Test
        @DisplayName("snapshot carries state, parameters and variables")
        void snapshot() {
            strategy.markInitialized();

            StrategySnapshot snapshot = strategy.getData();

            assertThat(snapshot.getStrategyName()).isEqualTo("test");
            assertThat(snapshot.getClassName()).isEqualTo("TestStrategy");
            assertThat(snapshot.getState()).isEqualTo(StrategyState.INITIALIZED);
            assertThat(snapshot.getInstruments()).containsExactly(INFY, TCS);
            assertThat(snapshot.getVariables()).containsEntry("initialized", true);
        }
    }

    // ========================
    // LIFECYCLE FLAGS
    // ========================

    @Nested
    @DisplayName("Lifecycle flags")
    class LifecycleFlags {

        @Test
        @DisplayName("putEvent is silent until initialized")
        void putEventNeedsInit() {
            strategy.putEvent();
            verify(context, never()).putStrategyEvent(strategy);

            strategy.markInitialized();
            strategy.putEvent();
            verify(context).putStrategyEvent(strategy);
        }

        @Test
        @DisplayName("syncData only persists while trading")
        void syncDataNeedsTrading() {
            strategy.markInitialized();
            strategy.syncData();
            verify(context, never()).syncStrategyData(strategy);

            strategy.markTrading();
            strategy.syncData();
            verify(context).syncStrategyData(strategy);
        }

        @Test
        @DisplayName("stop returns to STOPPED, forceOffline to CREATED")
        void stopAndOffline() {
            startTrading();
            strategy.markStopped();
            assertThat(strategy.getState()).isEqualTo(StrategyState.STOPPED);
            assertThat(strategy.isInited()).isTrue();

            strategy.forceOffline();
            assertThat(strategy.getState()).isEqualTo(StrategyState.CREATED);
            assertThat(strategy.isInited()).isFalse();
            assertThat(strategy.isTrading()).isFalse();
        }
    }

    /** Minimal strategy with one parameter of each numeric kind and two variables. */
    static class TestStrategy extends StrategyTemplate {

        @StrategyParameter
        private int fixedSize = 1;

        @StrategyParameter
        private double threshold = 0.5;

        @StrategyVariable
        private double lastSignal;

        @StrategyVariable
        private String note = "";

        TestStrategy(StrategyContext context, String strategyName, List<String> instruments) {
            super(context, strategyName, instruments);
        }

        @Override
        public void onInit() {}

        @Override
        public void onStart() {}

        @Override
        public void onStop() {}
    }
}
