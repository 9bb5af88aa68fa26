package org.nowstart.tradelab.strategy.core;

public interface StrategyParams {
}
