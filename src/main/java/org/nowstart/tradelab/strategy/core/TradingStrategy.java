package org.nowstart.tradelab.strategy.core;

import java.util.List;
import org.nowstart.tradelab.data.dto.Bar;
import org.nowstart.tradelab.data.dto.Signal;

/**
 * A strategy ready to run: a name plus a pure function from an ascending bar series to signals.
 *
 * <p>Implementations must not mutate {@code bars} and must return signals ordered by date. The returned
 * signals carry an empty symbol; the executor stamps the run symbol on them.
 */
public interface TradingStrategy {

    String name();

    List<Signal> generateSignals(List<Bar> bars);
}
