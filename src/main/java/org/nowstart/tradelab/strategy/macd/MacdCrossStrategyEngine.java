package org.nowstart.tradelab.strategy.macd;

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
 * MACD line crossing its signal line. Strength is the absolute histogram at the cross.
 */
@Component
public class MacdCrossStrategyEngine implements StrategyEngine<MacdCrossParams> {

    public static final String NAME = "macd-cross";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Class<MacdCrossParams> parameterType() {
        return MacdCrossParams.class;
    }

    @Override
    public int requiredWarmupBars(MacdCrossParams params) {
        return params.slowPeriod() + params.signalPeriod();
    }

    @Override
    public List<Signal> generateSignals(List<Bar> bars, MacdCrossParams params) {
        List<Signal> signals = new ArrayList<>();
        if (bars == null || bars.isEmpty()) {
            return signals;
        }

        double[] close = Indicators.closes(bars);
        double[] emaFast = Indicators.exponentialMovingAverage(close, params.fastPeriod());
        double[] emaSlow = Indicators.exponentialMovingAverage(close, params.slowPeriod());
        double[] macd = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            macd[i] = emaFast[i] - emaSlow[i];
        }
        double[] signalLine = Indicators.exponentialMovingAverage(macd, params.signalPeriod());

        for (int i = 1; i < bars.size(); i++) {
            SignalType type;
            String reason;
            if (Indicators.crossedAbove(macd, signalLine, i)) {
                type = SignalType.BUY;
                reason = "macd_golden_cross";
            } else if (Indicators.crossedBelow(macd, signalLine, i)) {
                type = SignalType.SELL;
                reason = "macd_death_cross";
            } else {
                continue;
            }
            double histogram = macd[i] - signalLine[i];
            signals.add(Signal.of(type, bars.get(i), Math.abs(histogram), List.of(
                    SignalAttribute.number("macd.line", macd[i]),
                    SignalAttribute.number("macd.signal", signalLine[i]),
                    SignalAttribute.number("macd.histogram", histogram),
                    SignalAttribute.text("reason", reason)
            )));
        }
        return signals;
    }
}
