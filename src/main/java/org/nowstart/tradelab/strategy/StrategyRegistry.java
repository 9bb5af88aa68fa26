package org.nowstart.tradelab.strategy;

import jakarta.annotation.PostConstruct;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradelab.data.exception.ErrorCode;
import org.nowstart.tradelab.data.exception.TradingException;
import org.nowstart.tradelab.strategy.core.BoundStrategy;
import org.nowstart.tradelab.strategy.core.StrategyEngine;
import org.nowstart.tradelab.strategy.core.StrategyParams;
import org.nowstart.tradelab.strategy.core.TradingStrategy;
import org.springframework.stereotype.Service;

/**
 * Looks up strategy engines by name and binds them to parameter records.
 */
@Service
@RequiredArgsConstructor
public class StrategyRegistry {

    private final List<StrategyEngine<? extends StrategyParams>> engines;
    private Map<String, StrategyEngine<? extends StrategyParams>> enginesByName = Map.of();

    @PostConstruct
    void init() {
        Map<String, StrategyEngine<? extends StrategyParams>> byName = new HashMap<>();
        for (StrategyEngine<? extends StrategyParams> engine : engines) {
            String name = normalize(engine.name());
            StrategyEngine<? extends StrategyParams> previous = byName.put(name, engine);
            if (previous != null) {
                throw new IllegalStateException("Duplicate strategy engine registered for name=" + name);
            }
        }
        enginesByName = Map.copyOf(byName);
    }

    public Set<String> names() {
        return new TreeSet<>(enginesByName.keySet());
    }

    public StrategyEngine<? extends StrategyParams> getRequired(String strategyName) {
        StrategyEngine<? extends StrategyParams> engine = enginesByName.get(normalize(strategyName));
        if (engine == null) {
            throw new TradingException(ErrorCode.INVALID_PARAMETER, "No strategy engine registered for name=" + strategyName);
        }
        return engine;
    }

    public TradingStrategy bind(String strategyName, StrategyParams params) {
        return bindInternal(getRequired(strategyName), params);
    }

    /**
     * Binds the named engine to whichever of {@code candidates} matches its parameter type.
     */
    public TradingStrategy bindConfigured(String strategyName, Collection<? extends StrategyParams> candidates) {
        StrategyEngine<? extends StrategyParams> engine = getRequired(strategyName);
        for (StrategyParams candidate : candidates) {
            if (engine.parameterType().isInstance(candidate)) {
                return bindInternal(engine, candidate);
            }
        }
        throw new TradingException(
                ErrorCode.INVALID_PARAMETER,
                "No parameters configured for strategy name=" + strategyName
                        + ", required=" + engine.parameterType().getSimpleName()
        );
    }

    public int requiredWarmupBars(String strategyName, StrategyParams params) {
        return requiredWarmupInternal(getRequired(strategyName), params);
    }

    private <P extends StrategyParams> TradingStrategy bindInternal(StrategyEngine<P> engine, StrategyParams params) {
        return new BoundStrategy<>(engine, castParams(engine, params));
    }

    private <P extends StrategyParams> int requiredWarmupInternal(StrategyEngine<P> engine, StrategyParams params) {
        return engine.requiredWarmupBars(castParams(engine, params));
    }

    private <P extends StrategyParams> P castParams(StrategyEngine<P> engine, StrategyParams params) {
        if (!engine.parameterType().isInstance(params)) {
            throw new TradingException(
                    ErrorCode.INVALID_PARAMETER,
                    "Invalid params type for strategy name=" + engine.name()
                            + ", required=" + engine.parameterType().getSimpleName()
                            + ", actual=" + (params == null ? "null" : params.getClass().getSimpleName())
            );
        }
        return engine.parameterType().cast(params);
    }

    private String normalize(String strategyName) {
        if (strategyName == null || strategyName.isBlank()) {
            throw new TradingException(ErrorCode.INVALID_PARAMETER, "strategy name is required");
        }
        return strategyName.trim().toLowerCase(Locale.ROOT);
    }
}
