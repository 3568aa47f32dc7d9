package org.nowstart.walkforward.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.walkforward.data.dto.CostModel;
import org.nowstart.walkforward.data.dto.EquityPoint;
import org.nowstart.walkforward.data.dto.Position;
import org.nowstart.walkforward.data.dto.SimulationResult;
import org.nowstart.walkforward.data.dto.Trade;
import org.nowstart.walkforward.data.property.BacktestProperties;
import org.nowstart.walkforward.data.type.ExitReason;
import org.nowstart.walkforward.data.type.IntrabarExitPolicy;
import org.nowstart.walkforward.data.type.TradeDirection;
import org.nowstart.walkforward.risk.PositionSizer;
import org.nowstart.walkforward.strategy.core.OhlcvCandle;
import org.nowstart.walkforward.strategy.core.PositionSnapshot;
import org.nowstart.walkforward.strategy.core.StrategyInput;
import org.nowstart.walkforward.strategy.core.StrategySignal;
import org.nowstart.walkforward.strategy.core.TradingStrategy;
import org.springframework.stereotype.Service;

/**
 * Event-driven bar replay. Symbols share one timeline and are visited in lexicographic order at each
 * timestamp; every open position is checked against its stop-loss and take-profit before the strategy
 * sees the bar.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationService {

    private final PositionSizer positionSizer;
    private final BacktestProperties backtestProperties;

    public SimulationResult simulate(
            Map<String, List<OhlcvCandle>> barsBySymbol,
            TradingStrategy strategy,
            CostModel costModel,
            double initialBalance
    ) {
        if (barsBySymbol == null) {
            throw new IllegalArgumentException("barsBySymbol is required");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        if (costModel == null) {
            throw new IllegalArgumentException("costModel is required");
        }
        if (!Double.isFinite(initialBalance) || initialBalance <= 0.0) {
            throw new IllegalArgumentException("initialBalance must be finite and > 0");
        }

        Map<String, List<OhlcvCandle>> series = sanitize(barsBySymbol);
        TreeSet<Instant> timeline = new TreeSet<>();
        for (List<OhlcvCandle> bars : series.values()) {
            for (OhlcvCandle bar : bars) {
                timeline.add(bar.timestamp());
            }
        }

        Run run = new Run(strategy, costModel, initialBalance);
        Map<String, Integer> cursors = new HashMap<>();
        Map<String, Double> lastClose = new HashMap<>();
        for (Instant timestamp : timeline) {
            for (Map.Entry<String, List<OhlcvCandle>> entry : series.entrySet()) {
                String symbol = entry.getKey();
                List<OhlcvCandle> bars = entry.getValue();
                int cursor = cursors.getOrDefault(symbol, 0);
                if (cursor >= bars.size() || !bars.get(cursor).timestamp().equals(timestamp)) {
                    continue;
                }
                run.onBar(symbol, bars, cursor);
                lastClose.put(symbol, bars.get(cursor).close());
                cursors.put(symbol, cursor + 1);
            }
            run.markToMarket(timestamp, lastClose);
        }

        log.debug(
                "[Simulation][Done] strategy={} bars={} trades={} open={} skipped={} rejected={} finalBalance={}",
                strategy.name(),
                timeline.size(),
                run.trades.size(),
                run.openPositions.size(),
                run.skippedBars,
                run.rejectedEntries,
                run.balance
        );
        return new SimulationResult(
                run.trades,
                run.equityCurve,
                new ArrayList<>(run.openPositions.values()),
                initialBalance,
                run.balance,
                run.skippedBars,
                run.rejectedEntries
        );
    }

    private Map<String, List<OhlcvCandle>> sanitize(Map<String, List<OhlcvCandle>> barsBySymbol) {
        Map<String, List<OhlcvCandle>> out = new TreeMap<>();
        for (Map.Entry<String, List<OhlcvCandle>> entry : new TreeMap<>(barsBySymbol).entrySet()) {
            String symbol = entry.getKey();
            List<OhlcvCandle> bars = entry.getValue();
            if (bars == null || bars.isEmpty()) {
                log.info("[Simulation] skipping symbol={} reason=no_bars", symbol);
                continue;
            }
            List<OhlcvCandle> accepted = new ArrayList<>(bars.size());
            Instant previous = null;
            for (OhlcvCandle bar : bars) {
                if (bar == null || !bar.isWellFormed()) {
                    log.warn("[Simulation] dropping malformed bar symbol={} bar={}", symbol, bar);
                    continue;
                }
                if (previous != null && !bar.timestamp().isAfter(previous)) {
                    log.warn(
                            "[Simulation] dropping duplicate or out-of-order bar symbol={} timestamp={} previous={}",
                            symbol,
                            bar.timestamp(),
                            previous
                    );
                    continue;
                }
                accepted.add(bar);
                previous = bar.timestamp();
            }
            if (accepted.isEmpty()) {
                log.info("[Simulation] skipping symbol={} reason=no_valid_bars", symbol);
                continue;
            }
            out.put(symbol, List.copyOf(accepted));
        }
        return out;
    }

    private final class Run {

        private final TradingStrategy strategy;
        private final CostModel costModel;
        private final int warmup;
        private final Map<String, Position> openPositions = new TreeMap<>();
        private final List<Trade> trades = new ArrayList<>();
        private final List<EquityPoint> equityCurve = new ArrayList<>();
        private double balance;
        private int skippedBars;
        private int rejectedEntries;

        private Run(TradingStrategy strategy, CostModel costModel, double initialBalance) {
            this.strategy = strategy;
            this.costModel = costModel;
            this.warmup = Math.max(0, strategy.requiredWarmupCandles());
            this.balance = initialBalance;
        }

        private void onBar(String symbol, List<OhlcvCandle> bars, int index) {
            OhlcvCandle bar = bars.get(index);
            Position position = openPositions.get(symbol);
            if (position != null && closeOnProtectiveLevel(position, bar)) {
                return;
            }

            List<OhlcvCandle> history = bars.subList(0, index + 1);
            if (history.size() < warmup) {
                skippedBars++;
                log.debug(
                        "[Simulation] warmup skip symbol={} timestamp={} history={} required={}",
                        symbol,
                        bar.timestamp(),
                        history.size(),
                        warmup
                );
                return;
            }

            StrategySignal signal = strategy.evaluate(new StrategyInput(symbol, history, PositionSnapshot.of(position)));
            if (signal == null) {
                return;
            }
            switch (signal.action()) {
                case EXIT -> {
                    if (position != null) {
                        close(position, bar.timestamp(), bar.close(), ExitReason.SIGNAL);
                    }
                }
                case ENTER_LONG, ENTER_SHORT -> {
                    if (position == null) {
                        open(symbol, bar, signal);
                    }
                }
                default -> {
                }
            }
        }

        private boolean closeOnProtectiveLevel(Position position, OhlcvCandle bar) {
            boolean longSide = position.direction() == TradeDirection.LONG;
            boolean stopHit = position.hasStopLoss()
                    && (longSide ? bar.low() <= position.stopLoss() : bar.high() >= position.stopLoss());
            boolean targetHit = position.hasTakeProfit()
                    && (longSide ? bar.high() >= position.takeProfit() : bar.low() <= position.takeProfit());

            if (stopHit && targetHit) {
                if (backtestProperties.intrabarExitPolicy() == IntrabarExitPolicy.TAKE_PROFIT_FIRST) {
                    stopHit = false;
                } else {
                    targetHit = false;
                }
            }
            if (stopHit) {
                // a bar that opens through the stop fills at the open
                double fill = longSide
                        ? Math.min(position.stopLoss(), bar.open())
                        : Math.max(position.stopLoss(), bar.open());
                close(position, bar.timestamp(), fill, ExitReason.STOP_LOSS);
                return true;
            }
            if (targetHit) {
                close(position, bar.timestamp(), position.takeProfit(), ExitReason.TAKE_PROFIT);
                return true;
            }
            return false;
        }

        private void open(String symbol, OhlcvCandle bar, StrategySignal signal) {
            TradeDirection direction = signal.action().direction();
            double rawEntry = Double.isNaN(signal.entryPrice()) ? bar.close() : signal.entryPrice();
            if (!Double.isFinite(rawEntry) || rawEntry <= 0.0) {
                reject(symbol, bar, "non_positive_entry", rawEntry);
                return;
            }
            if (signal.stopLoss() == rawEntry) {
                reject(symbol, bar, "stop_loss_equals_entry", rawEntry);
                return;
            }
            double fill = costModel.fillPrice(direction, rawEntry);
            if (!Double.isFinite(fill) || fill <= 0.0) {
                reject(symbol, bar, "non_positive_fill", fill);
                return;
            }
            double volume = positionSizer.size(fill, signal.stopLoss(), balance, backtestProperties.riskFraction());
            if (!Double.isFinite(volume) || volume <= 0.0) {
                reject(symbol, bar, "non_positive_volume", fill);
                return;
            }
            openPositions.put(symbol, new Position(
                    symbol,
                    direction,
                    bar.timestamp(),
                    fill,
                    volume,
                    signal.stopLoss(),
                    signal.takeProfit()
            ));
        }

        private void reject(String symbol, OhlcvCandle bar, String reason, double price) {
            rejectedEntries++;
            log.warn(
                    "[Simulation] entry rejected symbol={} timestamp={} reason={} price={}",
                    symbol,
                    bar.timestamp(),
                    reason,
                    price
            );
        }

        private void close(Position position, Instant exitTime, double exitPrice, ExitReason reason) {
            double commission = costModel.commission(position.volume());
            double profitLoss = position.unrealizedPnl(exitPrice, costModel.contractSize()) - commission;
            trades.add(new Trade(
                    position.symbol(),
                    position.direction(),
                    position.entryTime(),
                    exitTime,
                    position.entryPrice(),
                    exitPrice,
                    position.volume(),
                    profitLoss,
                    commission,
                    reason
            ));
            balance += profitLoss;
            openPositions.remove(position.symbol());
        }

        private void markToMarket(Instant timestamp, Map<String, Double> lastClose) {
            double unrealized = 0.0;
            for (Position position : openPositions.values()) {
                Double mark = lastClose.get(position.symbol());
                if (mark != null) {
                    unrealized += position.unrealizedPnl(mark, costModel.contractSize());
                }
            }
            equityCurve.add(new EquityPoint(timestamp, balance, balance + unrealized, openPositions.size()));
        }
    }
}
