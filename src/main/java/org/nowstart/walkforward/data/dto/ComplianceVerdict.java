package org.nowstart.walkforward.data.dto;

import java.util.List;
import org.nowstart.walkforward.data.type.ComplianceRule;

public record ComplianceVerdict(
        boolean compliant,
        List<ComplianceRule> violatedRules,
        List<String> reasons,
        ComplianceMetrics metrics,
        List<DailyComplianceStat> dailyStats
) {
    public ComplianceVerdict {
        violatedRules = List.copyOf(violatedRules);
        reasons = List.copyOf(reasons);
        dailyStats = List.copyOf(dailyStats);
    }

    public boolean isViolated(ComplianceRule rule) {
        return violatedRules.contains(rule);
    }
}
