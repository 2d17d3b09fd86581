package com.portfoliotrader.core.engine;

import com.portfoliotrader.config.EngineProperties;
import com.portfoliotrader.domain.model.StrategySetting;
import com.portfoliotrader.repository.redis.StrategySettingRedisRepository;
import jakarta.annotation.PreDestroy;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the strategy roster from Redis once the application is ready, and stops every
 * trading strategy on shutdown.
 *
 * <p>Strategies come back in CREATED state. They are only initialized automatically when
 * {@code portfoliotrader.engine.auto-init} is set; starting is always an explicit command.
 */
@Component
public class EngineBootstrap implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(EngineBootstrap.class);

    private final StrategyEngine strategyEngine;
    private final EngineEventDispatcher engineEventDispatcher;
    private final StrategySettingRedisRepository strategySettingRepository;
    private final EngineProperties engineProperties;

    public EngineBootstrap(
            StrategyEngine strategyEngine,
            EngineEventDispatcher engineEventDispatcher,
            StrategySettingRedisRepository strategySettingRepository,
            EngineProperties engineProperties) {
        this.strategyEngine = strategyEngine;
        this.engineEventDispatcher = engineEventDispatcher;
        this.strategySettingRepository = strategySettingRepository;
        this.engineProperties = engineProperties;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        Map<String, StrategySetting> roster;
        try {
            roster = strategySettingRepository.findAll();
        } catch (DataAccessException e) {
            log.error("Failed to load strategy roster, starting with no strategies: {}", e.getMessage(), e);
            return;
        }

        int restored = engineEventDispatcher.call(() -> {
            int added = 0;
            for (Map.Entry<String, StrategySetting> entry : roster.entrySet()) {
                StrategySetting setting = entry.getValue();
                if (strategyEngine.addStrategy(
                        setting.getClassName(), entry.getKey(), setting.getInstruments(), setting.getSetting())) {
                    added++;
                }
            }
            return added;
        });
        log.info("Strategy roster restored: {} of {} strategies", restored, roster.size());

        if (engineProperties.isAutoInit()) {
            engineEventDispatcher.call(strategyEngine::initAllStrategies);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping all trading strategies");
        engineEventDispatcher.call(() -> {
            strategyEngine.close();
            return null;
        });
    }
}
