package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

public record AdminHealthResponse(
        Budget budget,
        CostSummary costs,
        Throughput throughput,
        List<DriftAlert> driftAlerts,
        List<Prompt> activePrompts
) {

    public record Budget(boolean active, double dailyBudget, double dailySpend, double remaining) {
    }

    public record CostSummary(double total, double averageDaily, long callsProcessed, List<DailyCost> days) {
    }

    public record DailyCost(LocalDate date, double totalCost, long callsProcessed) {
    }

    public record Throughput(long processed, double averagePerDay, double validationPassRate) {
    }

    /**
     * Severity is HIGH above 3 standard deviations, MEDIUM above 2, LOW otherwise.
     */
    public record DriftAlert(OffsetDateTime createdAt, double maxDeviation, String severity, String driftReport) {
    }

    public record Prompt(String name, String version, String description) {
    }
}
