package org.nowstart.tradelab.strategy.core;

import java.util.List;
import org.nowstart.tradelab.data.dto.Bar;
import org.nowstart.tradelab.data.dto.Signal;

public interface StrategyEngine<P extends StrategyParams> {

    String name();

    Class<P> parameterType();

    int requiredWarmupBars(P params);

    List<Signal> generateSignals(List<Bar> bars, P params);
}
