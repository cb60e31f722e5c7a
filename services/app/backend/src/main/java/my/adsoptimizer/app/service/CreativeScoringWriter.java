package my.adsoptimizer.app.service;

import my.adsoptimizer.app.domain.Creative;
import my.adsoptimizer.app.domain.CreativeMetrics;
import my.adsoptimizer.app.dto.ScoringResultDto;
import my.adsoptimizer.app.repository.CreativeMetricsRepository;
import my.adsoptimizer.app.repository.CreativeRepository;
import my.adsoptimizer.app.scoring.ClassificationResult;
import my.adsoptimizer.app.scoring.CreativeScore;
import my.adsoptimizer.app.scoring.CreativeScoringEngine;
import my.adsoptimizer.app.scoring.MetricSnapshot;
import my.adsoptimizer.app.scoring.ScoringCandidate;
import my.adsoptimizer.app.scoring.ScoringPolicy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies the enabled creatives of one account and writes bucket, score and explanation back in a
 * single transaction. Callers serialize invocations per account.
 */
@Service
public class CreativeScoringWriter {
	static final String ACTIVE_STATUS = "ENABLED";

	private final CreativeRepository creativeRepository;
	private final CreativeMetricsRepository metricsRepository;
	private final CreativeScoringEngine engine;
	private final ScoringPolicy policy;

	public CreativeScoringWriter(CreativeRepository creativeRepository,
								 CreativeMetricsRepository metricsRepository,
								 CreativeScoringEngine engine,
								 ScoringPolicy policy) {
		this.creativeRepository = creativeRepository;
		this.metricsRepository = metricsRepository;
		this.engine = engine;
		this.policy = policy;
	}

	@Transactional
	public ScoringResultDto scoreAccount(Long accountId) {
		List<Creative> creatives = creativeRepository.findByAccountIdAndStatusOrderByCreativeIdAsc(accountId, ACTIVE_STATUS);
		List<Long> ids = creatives.stream().map(Creative::getCreativeId).toList();
		Map<Long, CreativeMetrics> metricsById = new HashMap<>();
		if (!ids.isEmpty()) {
			for (CreativeMetrics metrics : metricsRepository.findByCreativeIdIn(ids)) {
				metricsById.put(metrics.getCreativeId(), metrics);
			}
		}

		List<ScoringCandidate> candidates = new ArrayList<>(creatives.size());
		for (Creative creative : creatives) {
			CreativeMetrics metrics = metricsById.get(creative.getCreativeId());
			candidates.add(new ScoringCandidate(creative.getCreativeId(), metrics == null ? null : MetricSnapshot.of(metrics)));
		}
		ClassificationResult result = engine.classify(candidates, policy);
		Map<Long, CreativeScore> scores = result.byCreativeId();

		LocalDateTime now = LocalDateTime.now();
		for (Creative creative : creatives) {
			CreativeScore score = scores.get(creative.getCreativeId());
			creative.setBucket(score.bucket());
			creative.setBucketScore(score.score());
			creative.setBucketExplanation(score.explanation());
			creative.setScoredAt(now);
			creative.setUpdatedAt(now);
		}
		creativeRepository.saveAll(creatives);

		return new ScoringResultDto(accountId,
				result.counts().best(),
				result.counts().worst(),
				result.counts().unknown(),
				result.counts().belowThreshold(),
				result.scorablePopulation(),
				result.populationBucketed(),
				now);
	}
}
