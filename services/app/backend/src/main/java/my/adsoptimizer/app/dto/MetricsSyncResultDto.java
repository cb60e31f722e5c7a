package my.adsoptimizer.app.dto;

import java.time.LocalDate;
import java.util.List;

public record MetricsSyncResultDto(
		Long accountId,
		int adsRead,
		int creativesCreated,
		int creativesUpdated,
		int metricsWritten,
		List<String> removedFields,
		int attempts,
		LocalDate periodStart,
		LocalDate periodEnd
) {
}
