package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AbcXyzQuery {

    // lookback window in days, ending at endDate (today when absent)
    private Integer days;
    private LocalDate endDate;
    private TrendGranularity granularity;
    private DemandMeasure demandMeasure;
    private boolean forceRefresh;

    public TrendGranularity getGranularity() {
        return granularity != null ? granularity : TrendGranularity.MONTH;
    }

    public DemandMeasure getDemandMeasure() {
        return demandMeasure != null ? demandMeasure : DemandMeasure.QUANTITY;
    }
}
