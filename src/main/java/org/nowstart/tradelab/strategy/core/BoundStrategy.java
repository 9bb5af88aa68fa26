package org.nowstart.tradelab.strategy.core;

import java.util.List;
import org.nowstart.tradelab.data.dto.Bar;
import org.nowstart.tradelab.data.dto.Signal;

/**
 * Engine paired with a read-only parameter record.
 */
public record BoundStrategy<P extends StrategyParams>(
        StrategyEngine<P> engine,
        P params
) implements TradingStrategy {

    public BoundStrategy {
        if (engine == null) {
            throw new IllegalArgumentException("engine is required");
        }
        if (params == null) {
            throw new IllegalArgumentException("params are required");
        }
    }

    @Override
    public String name() {
        return engine.name();
    }

    @Override
    public List<Signal> generateSignals(List<Bar> bars) {
        return engine.generateSignals(bars, params);
    }
}
