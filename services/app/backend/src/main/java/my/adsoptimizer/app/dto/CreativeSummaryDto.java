package my.adsoptimizer.app.dto;

import my.adsoptimizer.app.domain.CreativeBucket;

import java.time.LocalDateTime;
import java.util.List;

public record CreativeSummaryDto(
		Long creativeId,
		Long accountId,
		String externalAdId,
		String status,
		List<String> headlines,
		List<String> descriptions,
		CreativeBucket bucket,
		Double bucketScore,
		String bucketExplanation,
		LocalDateTime scoredAt
) {
}
