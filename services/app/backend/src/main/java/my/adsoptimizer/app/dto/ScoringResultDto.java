package my.adsoptimizer.app.dto;

import java.time.LocalDateTime;

public record ScoringResultDto(
		Long accountId,
		int best,
		int worst,
		int unknown,
		int belowThreshold,
		int scorablePopulation,
		boolean populationBucketed,
		LocalDateTime scoredAt
) {
}
