package org.nowstart.walkforward.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.nowstart.walkforward.data.dto.CostModel;
import org.nowstart.walkforward.data.type.IntrabarExitPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "walkforward.backtest")
public record BacktestProperties(
        // starting account balance
        @Positive @DefaultValue("100000") double initialBalance,
        // absolute price offset added against the trader on entry
        @PositiveOrZero @DefaultValue("0") double spread,
        // extra absolute price offset on entry
        @PositiveOrZero @DefaultValue("0") double slippage,
        // commission charged per lot when a position closes
        @PositiveOrZero @DefaultValue("0") double commissionPerLot,
        // units per lot used for P&L
        @Positive @DefaultValue("1") double contractSize,
        // fraction of balance risked per trade
        @Positive @DecimalMax("1.0") @DefaultValue("0.01") double riskFraction,
        // tie-break when one bar touches both stop-loss and take-profit
        @NotNull @DefaultValue("STOP_LOSS_FIRST") IntrabarExitPolicy intrabarExitPolicy,
        @Positive @DefaultValue("0.01") double minVolume,
        @Positive @DefaultValue("100") double maxVolume,
        @Positive @DefaultValue("0.01") double volumeStep
) {
    public BacktestProperties {
        if (maxVolume < minVolume) {
            throw new IllegalArgumentException("max-volume must be >= min-volume");
        }
    }

    public CostModel toCostModel() {
        return new CostModel(spread, slippage, commissionPerLot, contractSize);
    }
}
