package com.portfoliotrader.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.portfoliotrader.exception.UnknownStrategyClassException;
import com.portfoliotrader.strategy.StrategyFactory;
import com.portfoliotrader.strategy.base.StrategyContext;
import com.portfoliotrader.strategy.base.StrategyTemplate;
import com.portfoliotrader.strategy.impl.PairTradingStrategy;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StrategyFactoryTest {

    private StrategyFactory strategyFactory;
    private StrategyContext context;

    @BeforeEach
    void setUp() {
        strategyFactory = new StrategyFactory();
        context = mock(StrategyContext.class);
    }

    @Test
    @DisplayName("built-in strategies are registered")
    void builtInsRegistered() {
        assertThat(strategyFactory.getClassNames()).contains("PairTradingStrategy", "PortfolioBollChannelStrategy");
        assertThat(strategyFactory.isRegistered("PairTradingStrategy")).isTrue();
        assertThat(strategyFactory.getClassParameters("PortfolioBollChannelStrategy", context))
                .containsEntry("windowHours", 2)
                .containsEntry("slMultiplier", 5.2);
    }

    @Test
    @DisplayName("create applies setting over the class defaults")
    void createAppliesSetting() {
        StrategyTemplate strategy = strategyFactory.create(
                "PairTradingStrategy", context, "pair", List.of("NSE:A", "NSE:B"), Map.of("fixedSize", 5));

        assertThat(strategy).isInstanceOf(PairTradingStrategy.class);
        assertThat(strategy.getStrategyName()).isEqualTo("pair");
        assertThat(strategy.getParameters()).containsEntry("fixedSize", 5).containsEntry("bollWindow", 20);
    }

    @Test
    @DisplayName("unknown class name is rejected")
    void unknownClass() {
        assertThatThrownBy(() -> strategyFactory.create("Nope", context, "x", List.of("NSE:A"), null))
                .isInstanceOf(UnknownStrategyClassException.class);
    }

    @Test
    @DisplayName("class parameters are the defaults of a fresh instance")
    void classParameters() {
        Map<String, Object> parameters = strategyFactory.getClassParameters("PairTradingStrategy", context);

        assertThat(parameters)
                .containsOnlyKeys("tickAdd", "bollWindow", "bollDev", "fixedSize", "leg1Ratio", "leg2Ratio")
                .containsEntry("bollDev", 2.0);
    }

    @Test
    @DisplayName("additional classes can be registered")
    void registerAdditionalClass() {
        strategyFactory.register("AnotherPair", PairTradingStrategy::new);

        assertThat(strategyFactory.getClassNames()).containsExactly("AnotherPair", "PairTradingStrategy", "PortfolioBollChannelStrategy");
    }
}
