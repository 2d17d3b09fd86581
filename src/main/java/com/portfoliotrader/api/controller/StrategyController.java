package com.portfoliotrader.api.controller;

import com.portfoliotrader.api.dto.request.AddStrategyRequest;
import com.portfoliotrader.api.dto.request.EditStrategyRequest;
import com.portfoliotrader.core.engine.EngineEventDispatcher;
import com.portfoliotrader.core.engine.StrategyEngine;
import com.portfoliotrader.domain.model.StrategySnapshot;
import com.portfoliotrader.exception.BusinessException;
import com.portfoliotrader.exception.ErrorCode;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for strategy management.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/strategies -- snapshots of all strategies</li>
 *   <li>GET /api/strategies/{name} -- snapshot of one strategy</li>
 *   <li>GET /api/strategies/classes -- registered strategy classes</li>
 *   <li>GET /api/strategies/classes/{className}/parameters -- class default parameters</li>
 *   <li>POST /api/strategies -- add a strategy</li>
 *   <li>POST /api/strategies/{name}/init -- queue initialization (202, runs in the background)</li>
 *   <li>POST /api/strategies/{name}/start -- start trading</li>
 *   <li>POST /api/strategies/{name}/stop -- stop trading and cancel working orders</li>
 *   <li>PUT /api/strategies/{name} -- edit parameters (not while trading)</li>
 *   <li>DELETE /api/strategies/{name} -- remove (not while trading)</li>
 *   <li>POST /api/strategies/init-all, start-all, stop-all -- bulk lifecycle</li>
 * </ul>
 *
 * <p>Every command runs on the engine event thread via {@link EngineEventDispatcher}.
 * A refused command returns 409 and the reason is in the strategy log.
 */
@RestController
@RequestMapping("/api/strategies")
public class StrategyController {

    private static final Logger log = LoggerFactory.getLogger(StrategyController.class);

    private final StrategyEngine strategyEngine;
    private final EngineEventDispatcher engineEventDispatcher;

    public StrategyController(StrategyEngine strategyEngine, EngineEventDispatcher engineEventDispatcher) {
        this.strategyEngine = strategyEngine;
        this.engineEventDispatcher = engineEventDispatcher;
    }

    @GetMapping
    public ResponseEntity<List<StrategySnapshot>> listStrategies() {
        return ResponseEntity.ok(engineEventDispatcher.call(strategyEngine::getAllStrategySnapshots));
    }

    @GetMapping("/{name}")
    public ResponseEntity<StrategySnapshot> getStrategy(@PathVariable String name) {
        return ResponseEntity.ok(engineEventDispatcher.call(() -> strategyEngine.getStrategySnapshot(name)));
    }

    @GetMapping("/classes")
    public ResponseEntity<List<String>> listClasses() {
        return ResponseEntity.ok(strategyEngine.getAllStrategyClassNames());
    }

    @GetMapping("/classes/{className}/parameters")
    public ResponseEntity<Map<String, Object>> getClassParameters(@PathVariable String className) {
        return ResponseEntity.ok(strategyEngine.getStrategyClassParameters(className));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> addStrategy(@Valid @RequestBody AddStrategyRequest request) {
        boolean added = engineEventDispatcher.call(() -> strategyEngine.addStrategy(
                request.getClassName(), request.getStrategyName(), request.getInstruments(), request.getSetting()));
        if (!added) {
            throw new BusinessException(
                    ErrorCode.BAD_REQUEST, "Strategy not added, see strategy log: " + request.getStrategyName());
        }
        log.info("Strategy added via API: {} ({})", request.getStrategyName(), request.getClassName());
        return ResponseEntity.ok(Map.of("message", "Strategy added", "strategyName", request.getStrategyName()));
    }

    /**
     * Queues initialization and returns immediately. Completion shows up as a state event
     * and in the snapshot's {@code state}.
     */
    @PostMapping("/{name}/init")
    public ResponseEntity<Map<String, Object>> initStrategy(@PathVariable String name) {
        engineEventDispatcher.call(() -> {
            strategyEngine.getStrategyOrThrow(name);
            return strategyEngine.initStrategy(name);
        });
        return ResponseEntity.accepted().body(Map.of("message", "Initialization queued", "strategyName", name));
    }

    @PostMapping("/{name}/start")
    public ResponseEntity<Map<String, Object>> startStrategy(@PathVariable String name) {
        requireAccepted(name, "start", engineEventDispatcher.call(() -> strategyEngine.startStrategy(name)));
        return ResponseEntity.ok(Map.of("message", "Strategy started", "strategyName", name));
    }

    @PostMapping("/{name}/stop")
    public ResponseEntity<Map<String, Object>> stopStrategy(@PathVariable String name) {
        requireAccepted(name, "stop", engineEventDispatcher.call(() -> strategyEngine.stopStrategy(name)));
        return ResponseEntity.ok(Map.of("message", "Strategy stopped", "strategyName", name));
    }

    @PutMapping("/{name}")
    public ResponseEntity<Map<String, Object>> editStrategy(
            @PathVariable String name, @Valid @RequestBody EditStrategyRequest request) {
        requireAccepted(
                name, "edit", engineEventDispatcher.call(() -> strategyEngine.editStrategy(name, request.getSetting())));
        return ResponseEntity.ok(Map.of("message", "Strategy updated", "strategyName", name));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Map<String, Object>> removeStrategy(@PathVariable String name) {
        requireAccepted(name, "remove", engineEventDispatcher.call(() -> strategyEngine.removeStrategy(name)));
        return ResponseEntity.ok(Map.of("message", "Strategy removed", "strategyName", name));
    }

    @PostMapping("/init-all")
    public ResponseEntity<Map<String, Object>> initAll() {
        int queued = engineEventDispatcher.call(() -> strategyEngine.initAllStrategies().size());
        return ResponseEntity.accepted().body(Map.of("message", "Initialization queued", "count", queued));
    }

    @PostMapping("/start-all")
    public ResponseEntity<Map<String, Object>> startAll() {
        engineEventDispatcher.call(() -> {
            strategyEngine.startAllStrategies();
            return null;
        });
        return ResponseEntity.ok(Map.of("message", "All strategies started"));
    }

    @PostMapping("/stop-all")
    public ResponseEntity<Map<String, Object>> stopAll() {
        engineEventDispatcher.call(() -> {
            strategyEngine.stopAllStrategies();
            return null;
        });
        return ResponseEntity.ok(Map.of("message", "All strategies stopped"));
    }

    private void requireAccepted(String name, String operation, boolean accepted) {
        if (!accepted) {
            engineEventDispatcher.call(() -> strategyEngine.getStrategyOrThrow(name));
            throw new BusinessException(
                    ErrorCode.INVALID_LIFECYCLE_TRANSITION,
                    String.format("Cannot %s strategy %s in its current state", operation, name));
        }
    }
}
