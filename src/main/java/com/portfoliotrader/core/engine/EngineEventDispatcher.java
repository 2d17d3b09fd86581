package com.portfoliotrader.core.engine;

import com.portfoliotrader.config.EngineProperties;
import com.portfoliotrader.event.OrderEvent;
import com.portfoliotrader.event.TickEvent;
import com.portfoliotrader.event.TradeEvent;
import com.portfoliotrader.exception.BusinessException;
import com.portfoliotrader.exception.ErrorCode;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Moves inbound broker events and control commands onto the engine event thread.
 *
 * <p>Broker callbacks arrive on SDK threads and REST commands on servlet threads. Both are
 * funnelled through the single-thread {@code engineEventExecutor}, so the engine and every
 * strategy see one event at a time, in arrival order.
 *
 * <p>Only ticks may be shed under load: once {@code tickBacklogLimit} ticks are waiting, new
 * ticks are dropped. Order and trade updates are always queued, since a lost fill could never
 * be recovered.
 */
@Component
public class EngineEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EngineEventDispatcher.class);

    private final StrategyEngine strategyEngine;
    private final AsyncTaskExecutor engineEventExecutor;
    private final int tickBacklogLimit;

    private final AtomicInteger pendingTicks = new AtomicInteger();

    public EngineEventDispatcher(
            StrategyEngine strategyEngine,
            @Qualifier("engineEventExecutor") AsyncTaskExecutor engineEventExecutor,
            EngineProperties engineProperties) {
        this.strategyEngine = strategyEngine;
        this.engineEventExecutor = engineEventExecutor;
        this.tickBacklogLimit = engineProperties.getTickBacklogLimit();
    }

    @EventListener
    public void onTick(TickEvent event) {
        if (pendingTicks.incrementAndGet() > tickBacklogLimit) {
            pendingTicks.decrementAndGet();
            log.warn("Tick backlog at {}, tick for {} dropped", tickBacklogLimit, event.getTick().getInstrument());
            return;
        }
        boolean queued = dispatch("tick", () -> {
            try {
                strategyEngine.processTick(event.getTick());
            } finally {
                pendingTicks.decrementAndGet();
            }
        });
        if (!queued) {
            pendingTicks.decrementAndGet();
        }
    }

    @EventListener
    public void onOrder(OrderEvent event) {
        if (!dispatch("order", () -> strategyEngine.processOrder(event.getOrder()))) {
            log.error("Order update lost: {}", event.getOrder());
        }
    }

    @EventListener
    public void onTrade(TradeEvent event) {
        if (!dispatch("trade", () -> strategyEngine.processTrade(event.getTrade()))) {
            log.error("Trade update lost: {}", event.getTrade());
        }
    }

    /**
     * Runs a command on the event thread and waits for its result. Must not be called from
     * the event thread itself.
     *
     * @throws BusinessException if the executor refuses the command or the wait is interrupted
     */
    public <T> T call(Callable<T> command) {
        try {
            return engineEventExecutor.submit(command).get();
        } catch (TaskRejectedException e) {
            throw new BusinessException(ErrorCode.INTERNAL_ERROR, "Engine event thread is not accepting commands");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.INTERNAL_ERROR, "Interrupted waiting for the engine");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new BusinessException(ErrorCode.INTERNAL_ERROR, "Engine command failed: " + e.getCause());
        }
    }

    /** @return false if the executor refused the task, which only happens once it is shut down */
    private boolean dispatch(String kind, Runnable task) {
        try {
            engineEventExecutor.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.error("Unhandled error processing {} event: {}", kind, e.getMessage(), e);
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            log.error("Engine event thread rejected a {} event: {}", kind, e.getMessage());
            return false;
        }
    }
}
