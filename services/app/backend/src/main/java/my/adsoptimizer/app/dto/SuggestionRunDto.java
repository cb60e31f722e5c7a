package my.adsoptimizer.app.dto;

import my.adsoptimizer.app.domain.SuggestionRunStatus;

import java.time.LocalDateTime;

public record SuggestionRunDto(
		Long runId,
		Long accountId,
		SuggestionRunStatus status,
		int creativesProcessed,
		int suggestionsGenerated,
		String error,
		LocalDateTime startedAt,
		LocalDateTime finishedAt
) {
}
