package my.adsoptimizer.app.dto;

import java.time.LocalDate;

public record CreativeMetricsDto(
		long impressions,
		long clicks,
		Double conversions,
		Long costMicros,
		Double ctr,
		Double cvr,
		Double cpa,
		LocalDate periodStart,
		LocalDate periodEnd
) {
}
