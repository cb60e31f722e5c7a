package my.adsoptimizer.app.service;

import my.adsoptimizer.app.domain.Creative;
import my.adsoptimizer.app.domain.CreativeBucket;
import my.adsoptimizer.app.domain.CreativeMetrics;
import my.adsoptimizer.app.dto.CreativeDetailDto;
import my.adsoptimizer.app.dto.CreativeMetricsDto;
import my.adsoptimizer.app.dto.CreativeSummaryDto;
import my.adsoptimizer.app.repository.CreativeMetricsRepository;
import my.adsoptimizer.app.repository.CreativeRepository;
import my.adsoptimizer.app.scoring.MetricSnapshot;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
public class CreativeQueryService {
	static final int DEFAULT_LIMIT = 50;
	static final int MAX_LIMIT = 200;

	private final CreativeRepository creativeRepository;
	private final CreativeMetricsRepository metricsRepository;

	public CreativeQueryService(CreativeRepository creativeRepository, CreativeMetricsRepository metricsRepository) {
		this.creativeRepository = creativeRepository;
		this.metricsRepository = metricsRepository;
	}

	/**
	 * Best creatives come back by descending score, worst by ascending score. Without a bucket the
	 * account's creatives are listed by id.
	 */
	@Transactional(readOnly = true)
	public List<CreativeSummaryDto> list(Long accountId, CreativeBucket bucket, Integer limit) {
		int effectiveLimit = limit == null ? DEFAULT_LIMIT : limit;
		if (effectiveLimit < 1 || effectiveLimit > MAX_LIMIT) {
			throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
		}
		PageRequest page = PageRequest.of(0, effectiveLimit);
		List<Creative> creatives;
		if (bucket == null) {
			creatives = creativeRepository.findByAccountIdOrderByCreativeIdAsc(accountId);
			if (creatives.size() > effectiveLimit) {
				creatives = creatives.subList(0, effectiveLimit);
			}
		} else if (bucket == CreativeBucket.WORST) {
			creatives = creativeRepository.findByAccountIdAndBucketOrderByBucketScoreAscCreativeIdAsc(accountId, bucket, page);
		} else {
			creatives = creativeRepository.findByAccountIdAndBucketOrderByBucketScoreDescCreativeIdAsc(accountId, bucket, page);
		}
		return creatives.stream().map(CreativeQueryService::toSummary).toList();
	}

	@Transactional(readOnly = true)
	public CreativeDetailDto detail(Long creativeId) {
		Creative creative = creativeRepository.findById(creativeId)
				.orElseThrow(() -> CreativeNotFoundException.creative(creativeId));
		CreativeMetrics metrics = metricsRepository.findById(creativeId).orElse(null);
		return new CreativeDetailDto(toSummary(creative), toMetrics(metrics), explainPerformance(creative, metrics));
	}

	static String explainPerformance(Creative creative, CreativeMetrics metrics) {
		String marker = marker(creative);
		if (metrics == null) {
			return marker + " | No metrics collected";
		}
		MetricSnapshot snapshot = MetricSnapshot.of(metrics);
		List<String> parts = new ArrayList<>();
		parts.add(String.format(Locale.ROOT, "Impressions: %,d", snapshot.impressions()));
		parts.add(String.format(Locale.ROOT, "Clicks: %,d", snapshot.clicks()));
		parts.add(snapshot.ctr() == null ? "CTR: N/A" : String.format(Locale.ROOT, "CTR: %.2f%%", snapshot.ctr() * 100));
		if (!snapshot.conversionsCollected()) {
			parts.add("Conversions: not collected");
		} else {
			parts.add(String.format(Locale.ROOT, "Conversions: %.1f", snapshot.conversions()));
			parts.add(snapshot.cvr() == null ? "CVR: 0%" : String.format(Locale.ROOT, "CVR: %.2f%%", snapshot.cvr() * 100));
		}
		parts.add(snapshot.cpa() == null ? "CPA: N/A" : String.format(Locale.ROOT, "CPA: $%.2f", snapshot.cpa()));
		parts.add(snapshot.costCollected()
				? String.format(Locale.ROOT, "Cost: $%.2f", snapshot.cost())
				: "Cost: not collected");
		return marker + " | " + String.join(" | ", parts);
	}

	private static String marker(Creative creative) {
		if (creative.getBucket() == CreativeBucket.BEST) {
			return "BEST PERFORMER";
		}
		if (creative.getBucket() == CreativeBucket.WORST) {
			return "NEEDS IMPROVEMENT";
		}
		return creative.getBucketScore() == null ? "INSUFFICIENT DATA" : "AVERAGE";
	}

	static CreativeSummaryDto toSummary(Creative creative) {
		return new CreativeSummaryDto(
				creative.getCreativeId(),
				creative.getAccountId(),
				creative.getExternalAdId(),
				creative.getStatus(),
				List.copyOf(creative.getHeadlines()),
				List.copyOf(creative.getDescriptions()),
				creative.getBucket(),
				creative.getBucketScore(),
				creative.getBucketExplanation(),
				creative.getScoredAt()
		);
	}

	private static CreativeMetricsDto toMetrics(CreativeMetrics metrics) {
		if (metrics == null) {
			return null;
		}
		MetricSnapshot snapshot = MetricSnapshot.of(metrics);
		return new CreativeMetricsDto(
				metrics.getImpressions(),
				metrics.getClicks(),
				metrics.getConversions(),
				metrics.getCostMicros(),
				snapshot.ctr(),
				snapshot.cvr(),
				snapshot.cpa(),
				metrics.getPeriodStart(),
				metrics.getPeriodEnd()
		);
	}
}
