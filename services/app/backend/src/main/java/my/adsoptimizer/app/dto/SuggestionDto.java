package my.adsoptimizer.app.dto;

import java.time.LocalDateTime;
import java.util.List;

public record SuggestionDto(
		Long suggestionId,
		Long creativeId,
		Long runId,
		List<String> headlines,
		List<String> descriptions,
		List<Long> exemplarIds,
		List<Double> similarityScores,
		boolean validationPassed,
		List<String> validationErrors,
		String promptVersion,
		String modelUsed,
		LocalDateTime createdAt
) {
}
