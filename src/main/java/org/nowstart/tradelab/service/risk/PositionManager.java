package org.nowstart.tradelab.service.risk;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradelab.data.dto.ConcentrationStats;
import org.nowstart.tradelab.data.dto.Position;
import org.nowstart.tradelab.data.dto.PositionSummary;
import org.nowstart.tradelab.data.dto.PositionView;
import org.nowstart.tradelab.data.exception.ErrorCode;
import org.nowstart.tradelab.data.exception.TradingException;
import org.nowstart.tradelab.data.type.OrderSide;
import org.nowstart.tradelab.service.execution.ExecutionFill;
import org.nowstart.tradelab.service.execution.FrictionModel;
import org.nowstart.tradelab.service.execution.Ledger;
import org.springframework.stereotype.Service;

/**
 * Interactive ledger used outside the backtest loop, by the simulated broker and by risk checks.
 *
 * <p>Marks positions at the last known price per symbol, falling back to the average cost when no price has
 * been seen. Every public method synchronizes on the manager, so fills from several threads apply one at a
 * time.
 */
@Slf4j
@Service
public class PositionManager {

    private final FrictionModel frictionModel;
    private final Ledger ledger;
    private final Map<String, Double> currentPrices = new HashMap<>();

    public PositionManager(FrictionModel frictionModel) {
        this.frictionModel = frictionModel;
        this.ledger = new Ledger(frictionModel.initialCapital());
    }

    public synchronized double getCash() {
        return ledger.cash();
    }

    public double getInitialCapital() {
        return ledger.initialCapital();
    }

    public synchronized Optional<PositionView> getPosition(String symbol) {
        Position position = ledger.position(symbol);
        if (!position.hasQuantity()) {
            return Optional.empty();
        }
        return Optional.of(view(position));
    }

    public synchronized List<PositionView> getAllPositions() {
        List<PositionView> views = new ArrayList<>();
        for (Position position : ledger.openPositions()) {
            views.add(view(position));
        }
        return views;
    }

    public synchronized boolean hasPosition(String symbol) {
        return ledger.quantity(symbol) > 0;
    }

    public synchronized long getPositionQuantity(String symbol) {
        return ledger.quantity(symbol);
    }

    public synchronized double getPositionValue(String symbol) {
        return getPosition(symbol).map(PositionView::marketValue).orElse(0.0);
    }

    public synchronized double getTotalPositionValue() {
        double total = 0.0;
        for (PositionView view : getAllPositions()) {
            total += view.marketValue();
        }
        return total;
    }

    public synchronized double getTotalValue() {
        return ledger.cash() + getTotalPositionValue();
    }

    public synchronized double getTotalProfitLoss() {
        double total = 0.0;
        for (PositionView view : getAllPositions()) {
            total += view.profitLoss();
        }
        return total;
    }

    /**
     * Books a priced fill. Returns the gross profit for sells and {@code null} for buys.
     *
     * @throws TradingException with {@code INSUFFICIENT_FUNDS} or {@code INSUFFICIENT_POSITION} when the fill
     *                          does not fit the ledger; the ledger is left unchanged in that case
     */
    public synchronized Double applyFill(String symbol, ExecutionFill fill) {
        if (symbol == null || symbol.isBlank()) {
            throw new TradingException(ErrorCode.INVALID_PARAMETER, "symbol is required");
        }
        Double profit = null;
        if (fill.side() == OrderSide.BUY) {
            ledger.applyBuy(symbol, fill);
        } else {
            profit = ledger.applySell(symbol, fill);
        }
        currentPrices.put(symbol, fill.effectivePrice());
        log.info(
                "event=position_updated symbol={} side={} quantity={} price={} held={} cash={}",
                symbol,
                fill.side(),
                fill.quantity(),
                fill.effectivePrice(),
                ledger.quantity(symbol),
                ledger.cash()
        );
        return profit;
    }

    /**
     * Validates a fill against the ledger without booking it.
     *
     * @throws TradingException the same exception {@link #applyFill} would raise
     */
    public synchronized void checkFill(String symbol, ExecutionFill fill) {
        if (symbol == null || symbol.isBlank()) {
            throw new TradingException(ErrorCode.INVALID_PARAMETER, "symbol is required");
        }
        ledger.checkFill(symbol, fill);
    }

    public synchronized Optional<Double> getLastPrice(String symbol) {
        return Optional.ofNullable(currentPrices.get(symbol));
    }

    public synchronized void updateCurrentPrices(Map<String, Double> prices) {
        for (Map.Entry<String, Double> entry : prices.entrySet()) {
            Double price = entry.getValue();
            if (price != null && Double.isFinite(price) && price > 0.0) {
                currentPrices.put(entry.getKey(), price);
            }
        }
    }

    public synchronized Map<String, Double> getPositionWeights() {
        double totalValue = getTotalValue();
        Map<String, Double> weights = new LinkedHashMap<>();
        if (totalValue <= 0.0) {
            return weights;
        }
        for (PositionView view : getAllPositions()) {
            weights.put(view.symbol(), view.marketValue() / totalValue);
        }
        return weights;
    }

    public synchronized PositionSummary getPositionSummary() {
        List<PositionView> views = getAllPositions();
        double positionValue = 0.0;
        double profitLoss = 0.0;
        for (PositionView view : views) {
            positionValue += view.marketValue();
            profitLoss += view.profitLoss();
        }
        return new PositionSummary(ledger.cash() + positionValue, ledger.cash(), positionValue, views.size(), profitLoss, views);
    }

    public synchronized ConcentrationStats calculateConcentration() {
        Map<String, Double> weights = getPositionWeights();
        if (weights.isEmpty()) {
            return ConcentrationStats.EMPTY;
        }
        double max = 0.0;
        double sum = 0.0;
        double herfindahl = 0.0;
        for (double weight : weights.values()) {
            max = Math.max(max, weight);
            sum += weight;
            herfindahl += weight * weight;
        }
        return new ConcentrationStats(max, sum / weights.size(), herfindahl);
    }

    /**
     * Signed, lot-rounded share deltas that would move the book to {@code targetWeights} of current total
     * value. Symbols without a price are skipped; held symbols absent from the targets are sold down to zero.
     * Nothing is applied.
     */
    public synchronized Map<String, Long> rebalancePositions(Map<String, Double> targetWeights, Map<String, Double> prices) {
        double totalValue = getTotalValue();
        Map<String, Long> adjustments = new LinkedHashMap<>();
        for (Map.Entry<String, Double> target : targetWeights.entrySet()) {
            String symbol = target.getKey();
            Double price = prices.get(symbol);
            if (price == null || !Double.isFinite(price) || price <= 0.0) {
                continue;
            }
            double weight = target.getValue() == null ? 0.0 : Math.max(target.getValue(), 0.0);
            long targetQuantity = frictionModel.roundToLot((long) Math.floor(totalValue * weight / price));
            long delta = targetQuantity - ledger.quantity(symbol);
            if (delta != 0) {
                adjustments.put(symbol, delta);
            }
        }
        for (Position position : ledger.openPositions()) {
            if (!targetWeights.containsKey(position.symbol())) {
                adjustments.put(position.symbol(), -position.quantity());
            }
        }
        return adjustments;
    }

    /**
     * Forced liquidation at {@code price}: credits gross revenue without fees and returns it.
     */
    public synchronized double clearPosition(String symbol, double price) {
        double revenue = ledger.liquidate(symbol, price);
        if (revenue > 0.0) {
            currentPrices.put(symbol, price);
            log.warn("event=position_cleared symbol={} price={} revenue={}", symbol, price, revenue);
        }
        return revenue;
    }

    public synchronized double clearAllPositions(Map<String, Double> prices) {
        double total = 0.0;
        for (Position position : ledger.openPositions()) {
            Double price = prices.get(position.symbol());
            if (price != null) {
                total += clearPosition(position.symbol(), price);
            }
        }
        return total;
    }

    public synchronized void reset() {
        ledger.reset();
        currentPrices.clear();
    }

    private PositionView view(Position position) {
        double price = currentPrices.getOrDefault(position.symbol(), position.averageCost());
        double marketValue = position.quantity() * price;
        double profitLoss = (price - position.averageCost()) * position.quantity();
        double ratio = position.averageCost() > 0.0 ? (price - position.averageCost()) / position.averageCost() : 0.0;
        return new PositionView(position.symbol(), position.quantity(), position.averageCost(), price, marketValue, profitLoss, ratio);
    }
}
