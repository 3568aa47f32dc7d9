package org.nowstart.walkforward.data.property;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "walkforward.monte-carlo")
public record MonteCarloProperties(
        // number of resampled equity paths
        @Positive @DefaultValue("1000") int simulations,
        @DefaultValue("42") long seed,
        @Positive @DefaultValue("4") int parallelism
) {
}
