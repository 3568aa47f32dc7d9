package org.nowstart.walkforward.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.walkforward.data.dto.ComplianceMetrics;
import org.nowstart.walkforward.data.dto.ComplianceVerdict;
import org.nowstart.walkforward.data.dto.WindowSpec;
import org.nowstart.walkforward.data.type.ComplianceRule;

class ReportExportServiceTest {

    private final ReportExportService service = new ReportExportService(new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));

    @Test
    void toJson_writesIsoTimestamps() {
        WindowSpec window = new WindowSpec(
                1,
                Instant.parse("2024-01-01T00:00:00Z"),
                Instant.parse("2024-03-31T00:00:00Z"),
                Instant.parse("2024-03-31T00:00:00Z"),
                Instant.parse("2024-04-30T00:00:00Z")
        );

        String json = service.toJson(window);

        assertThat(json).contains("\"windowIndex\" : 1").contains("\"isStart\" : \"2024-01-01T00:00:00Z\"");
    }

    @Test
    void toJson_writesViolatedRulesByName() {
        ComplianceVerdict verdict = new ComplianceVerdict(
                false,
                List.of(ComplianceRule.DAILY_LOSS),
                List.of("daily drawdown -6.00% exceeds limit 5.00%"),
                new ComplianceMetrics(100_000, 99_000, -0.01, -0.06, null, 0.0, 4),
                List.of()
        );

        String json = service.toJson(verdict);

        assertThat(json).contains("\"compliant\" : false").contains("DAILY_LOSS").contains("exceeds limit");
    }

    @Test
    void toJson_rejectsNull() {
        assertThatThrownBy(() -> service.toJson(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
