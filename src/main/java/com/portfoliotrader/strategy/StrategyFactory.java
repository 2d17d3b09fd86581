package com.portfoliotrader.strategy;

import com.portfoliotrader.exception.UnknownStrategyClassException;
import com.portfoliotrader.strategy.base.StrategyContext;
import com.portfoliotrader.strategy.base.StrategyTemplate;
import com.portfoliotrader.strategy.impl.PairTradingStrategy;
import com.portfoliotrader.strategy.impl.PortfolioBollChannelStrategy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Registry of strategy classes by name, and the place strategy instances are built.
 *
 * <p>Built-in strategies are registered in the constructor. Additional strategy classes are
 * added with {@link #register} at startup; nothing is discovered or loaded at runtime.
 *
 * <p><b>Adding a strategy class:</b>
 * <ol>
 *   <li>Extend {@link StrategyTemplate} with a {@code (StrategyContext, String, List<String>)} constructor</li>
 *   <li>Annotate tunables with {@code @StrategyParameter} and reported state with {@code @StrategyVariable}</li>
 *   <li>Register it here, or call {@link #register} from a configuration bean</li>
 * </ol>
 *
 * <p>Strategy instances are plain Java objects, not Spring beans.
 */
@Component
public class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    private final Map<String, StrategyConstructor> constructors = new ConcurrentHashMap<>();

    public StrategyFactory() {
        register(PairTradingStrategy.class.getSimpleName(), PairTradingStrategy::new);
        register(PortfolioBollChannelStrategy.class.getSimpleName(), PortfolioBollChannelStrategy::new);
    }

    public void register(String className, StrategyConstructor constructor) {
        StrategyConstructor previous = constructors.put(className, constructor);
        if (previous != null) {
            log.warn("Strategy class {} re-registered, previous constructor replaced", className);
        } else {
            log.info("Strategy class registered: {}", className);
        }
    }

    public boolean isRegistered(String className) {
        return constructors.containsKey(className);
    }

    /**
     * Builds an instance and applies {@code setting} to its parameters.
     *
     * @throws UnknownStrategyClassException if the class name is not registered
     * @throws org.springframework.core.convert.ConversionException if a setting value does not fit its parameter
     */
    public StrategyTemplate create(
            String className,
            StrategyContext context,
            String strategyName,
            List<String> instruments,
            Map<String, Object> setting) {
        StrategyConstructor constructor = constructors.get(className);
        if (constructor == null) {
            throw new UnknownStrategyClassException(className);
        }

        StrategyTemplate strategy = constructor.create(context, strategyName, instruments);
        if (setting != null) {
            strategy.updateSetting(setting);
        }
        log.debug("Strategy created: name={} class={} instruments={}", strategyName, className, instruments);
        return strategy;
    }

    public List<String> getClassNames() {
        List<String> names = new ArrayList<>(constructors.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Default parameter values of a strategy class, read from a throwaway instance
     * with no instruments.
     *
     * @throws UnknownStrategyClassException if the class name is not registered
     */
    public Map<String, Object> getClassParameters(String className, StrategyContext context) {
        return create(className, context, className, List.of(), null).getParameters();
    }
}
