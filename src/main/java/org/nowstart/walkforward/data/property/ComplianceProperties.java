package org.nowstart.walkforward.data.property;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.ZoneId;
import org.nowstart.walkforward.data.dto.ComplianceRules;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "walkforward.compliance")
public record ComplianceProperties(
        // required total return, e.g. 0.10 = 10%
        @DefaultValue("0.10") double profitTarget,
        // allowed intraday loss against the previous close
        @PositiveOrZero @DefaultValue("0.05") double maxDailyLoss,
        // allowed close-to-peak drawdown
        @PositiveOrZero @DefaultValue("0.10") double maxTotalDrawdown,
        @PositiveOrZero @DefaultValue("4") int minTradingDays,
        // calendar used to cut trading days
        @NotNull @DefaultValue("UTC") ZoneId zoneId
) {
    public ComplianceRules toRules() {
        return new ComplianceRules(profitTarget, maxDailyLoss, maxTotalDrawdown, minTradingDays);
    }
}
