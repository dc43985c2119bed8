package com.meridian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageSnapshot {

    private String organizationId;

    private LocalDate day;

    private double dailyCostUsd;

    private long requestCount;

    private long inFlight;

    private double maxDailyCostUsd;

    private double remainingUsd;

    private double usagePercent;

    private BudgetStatus status;
}
