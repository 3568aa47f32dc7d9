package org.nowstart.walkforward.data.dto;

import org.nowstart.walkforward.data.type.TradeDirection;

/**
 * Execution costs applied by the simulation. Spread and slippage are absolute price offsets,
 * commission is charged per unit of volume when a position closes.
 */
public record CostModel(
        double spread,
        double slippage,
        double commissionPerLot,
        double contractSize
) {
    public static final CostModel FREE = new CostModel(0.0, 0.0, 0.0, 1.0);

    public CostModel {
        if (!Double.isFinite(spread) || spread < 0.0) {
            throw new IllegalArgumentException("spread must be finite and >= 0");
        }
        if (!Double.isFinite(slippage) || slippage < 0.0) {
            throw new IllegalArgumentException("slippage must be finite and >= 0");
        }
        if (!Double.isFinite(commissionPerLot) || commissionPerLot < 0.0) {
            throw new IllegalArgumentException("commission-per-lot must be finite and >= 0");
        }
        if (!Double.isFinite(contractSize) || contractSize <= 0.0) {
            throw new IllegalArgumentException("contract-size must be finite and > 0");
        }
    }

    public double fillPrice(TradeDirection direction, double signalPrice) {
        return signalPrice + (direction.sign() * (spread + slippage));
    }

    public double commission(double volume) {
        return volume * commissionPerLot;
    }
}
