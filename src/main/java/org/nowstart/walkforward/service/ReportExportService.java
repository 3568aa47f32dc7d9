package org.nowstart.walkforward.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * JSON rendering of engine outputs: walk-forward reports, Monte Carlo distributions and compliance verdicts.
 */
@Service
@RequiredArgsConstructor
public class ReportExportService {

    private final ObjectMapper objectMapper;

    public String toJson(Object report) {
        if (report == null) {
            throw new IllegalArgumentException("report is required");
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + report.getClass().getSimpleName(), e);
        }
    }
}
