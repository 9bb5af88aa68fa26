package org.nowstart.tradelab.strategy.ma;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.tradelab.data.dto.Bar;
import org.nowstart.tradelab.data.dto.Signal;
import org.nowstart.tradelab.data.dto.SignalAttribute;
import org.nowstart.tradelab.data.type.SignalType;
import org.nowstart.tradelab.strategy.core.Indicators;
import org.nowstart.tradelab.strategy.core.StrategyEngine;
import org.springframework.stereotype.Component;

/**
 * Simple moving average crossover: BUY when the fast average crosses above the slow one, SELL on the
 * opposite cross.
 */
@Component
public class MaCrossStrategyEngine implements StrategyEngine<MaCrossParams> {

    public static final String NAME = "ma-cross";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Class<MaCrossParams> parameterType() {
        return MaCrossParams.class;
    }

    @Override
    public int requiredWarmupBars(MaCrossParams params) {
        return params.slowPeriod() + 1;
    }

    @Override
    public List<Signal> generateSignals(List<Bar> bars, MaCrossParams params) {
        List<Signal> signals = new ArrayList<>();
        if (bars == null || bars.isEmpty()) {
            return signals;
        }

        double[] close = Indicators.closes(bars);
        double[] fast = Indicators.simpleMovingAverage(close, params.fastPeriod());
        double[] slow = Indicators.simpleMovingAverage(close, params.slowPeriod());

        for (int i = 1; i < bars.size(); i++) {
            SignalType type;
            String reason;
            if (Indicators.crossedAbove(fast, slow, i)) {
                type = SignalType.BUY;
                reason = "golden_cross";
            } else if (Indicators.crossedBelow(fast, slow, i)) {
                type = SignalType.SELL;
                reason = "death_cross";
            } else {
                continue;
            }
            signals.add(Signal.of(type, bars.get(i), 1.0, List.of(
                    SignalAttribute.number("ma.fast", fast[i]),
                    SignalAttribute.number("ma.slow", slow[i]),
                    SignalAttribute.text("reason", reason)
            )));
        }
        return signals;
    }
}
