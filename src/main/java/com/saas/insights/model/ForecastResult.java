package com.saas.insights.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Point forecast of a usage or revenue metric")
public class ForecastResult {

    @Schema(description = "Forecast metric", example = "tokens")
    private String metric;

    @Schema(description = "Forecast horizon", example = "30d")
    private ForecastPeriod period;

    @Schema(description = "Latest observed value (last smoothed week for usage, MRR for revenue)", example = "48210")
    private double currentValue;

    @Schema(description = "Forecasted value at the end of the horizon", example = "52340")
    private double forecastedValue;

    @Schema(description = "Fixed band around the forecast (±15% usage, ±10% revenue)")
    private ConfidenceInterval confidenceInterval;

    @Schema(description = "Trend label", example = "increasing")
    private Trend trend;

    @Schema(description = "Growth rate in percent", example = "8.25")
    private double growthRate;

    @Schema(description = "Revenue breakdown, present on revenue forecasts only")
    private RevenueFactors revenueFactors;
}
