package org.nowstart.tradelab.strategy.rsi;

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
 * Mean-reversion on RSI thresholds: BUY when RSI climbs back above the oversold level, SELL when it drops
 * back below the overbought level.
 */
@Component
public class RsiThresholdStrategyEngine implements StrategyEngine<RsiThresholdParams> {

    public static final String NAME = "rsi-threshold";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Class<RsiThresholdParams> parameterType() {
        return RsiThresholdParams.class;
    }

    @Override
    public int requiredWarmupBars(RsiThresholdParams params) {
        return params.period() + 1;
    }

    @Override
    public List<Signal> generateSignals(List<Bar> bars, RsiThresholdParams params) {
        List<Signal> signals = new ArrayList<>();
        if (bars == null || bars.isEmpty()) {
            return signals;
        }

        double oversold = params.oversold();
        double overbought = params.overbought();
        double[] rsi = Indicators.relativeStrengthIndex(Indicators.closes(bars), params.period());

        for (int i = 1; i < bars.size(); i++) {
            double current = rsi[i];
            double previous = rsi[i - 1];
            if (!Double.isFinite(current) || !Double.isFinite(previous)) {
                continue;
            }

            if (current > oversold && previous <= oversold) {
                double strength = Math.max((oversold - previous) / oversold, 0.0);
                signals.add(Signal.of(SignalType.BUY, bars.get(i), strength, List.of(
                        SignalAttribute.number("rsi", current),
                        SignalAttribute.text("reason", "rising_from_oversold")
                )));
            } else if (current < overbought && previous >= overbought) {
                double strength = Math.max((previous - overbought) / (100.0 - overbought), 0.0);
                signals.add(Signal.of(SignalType.SELL, bars.get(i), strength, List.of(
                        SignalAttribute.number("rsi", current),
                        SignalAttribute.text("reason", "falling_from_overbought")
                )));
            }
        }
        return signals;
    }
}
