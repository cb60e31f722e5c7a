package my.adsoptimizer.app.scoring;

import my.adsoptimizer.app.domain.CreativeBucket;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Ranks one account's creatives against each other and assigns best/worst/unknown buckets.
 * All sub-scores are percentile ranks within the scorable population, so the outcome for a creative
 * depends on the whole population passed to {@link #classify}.
 */
public class CreativeScoringEngine {
	public static final String EXPLANATION_BELOW_THRESHOLD = "insufficient volume";
	public static final String EXPLANATION_AVERAGE = "average performance";
	public static final String EXPLANATION_SMALL_POPULATION = "insufficient population to compare";

	static final double WEIGHT_CTR = 0.25;
	static final double WEIGHT_CVR = 0.35;
	static final double WEIGHT_CPA = 0.25;
	static final double WEIGHT_VOLUME = 0.15;

	private static final double BAND_EPSILON = 1e-9;
	private static final Comparator<Ranked> RANK_ORDER = Comparator
			.comparingDouble((Ranked ranked) -> ranked.breakdown().composite()).reversed()
			.thenComparingLong(Ranked::creativeId);

	public ClassificationResult classify(List<ScoringCandidate> candidates, ScoringPolicy policy) {
		ScoringPolicy effectivePolicy = policy == null ? ScoringPolicy.defaults() : policy;
		if (candidates == null || candidates.isEmpty()) {
			return new ClassificationResult(List.of(), BucketCounts.EMPTY, 0, false);
		}
		List<ScoringCandidate> scorable = new ArrayList<>();
		for (ScoringCandidate candidate : candidates) {
			if (candidate == null) {
				throw new IllegalArgumentException("candidates must not contain null entries");
			}
			if (isScorable(candidate, effectivePolicy)) {
				scorable.add(candidate);
			}
		}

		Map<Long, ScoreBreakdown> breakdowns = computeBreakdowns(scorable);
		List<Ranked> ranking = new ArrayList<>();
		for (ScoringCandidate candidate : scorable) {
			ranking.add(new Ranked(candidate.creativeId(), candidate.metrics(), breakdowns.get(candidate.creativeId())));
		}
		ranking.sort(RANK_ORDER);

		int population = ranking.size();
		boolean bucketed = population >= effectivePolicy.minPopulationForBucketing();
		int bandSize = bucketed ? bandSize(population, effectivePolicy.bandPercent()) : 0;

		Map<Long, CreativeScore> scored = new HashMap<>();
		for (int i = 0; i < population; i++) {
			Ranked ranked = ranking.get(i);
			CreativeBucket bucket;
			String explanation;
			if (!bucketed) {
				bucket = CreativeBucket.UNKNOWN;
				explanation = EXPLANATION_SMALL_POPULATION + " (" + population + " < "
						+ effectivePolicy.minPopulationForBucketing() + ")";
			} else if (i < bandSize) {
				bucket = CreativeBucket.BEST;
				explanation = "top " + percentLabel(effectivePolicy.bandPercent()) + " | " + describe(ranked);
			} else if (i >= population - bandSize) {
				bucket = CreativeBucket.WORST;
				explanation = "bottom " + percentLabel(effectivePolicy.bandPercent()) + " | " + describe(ranked);
			} else {
				bucket = CreativeBucket.UNKNOWN;
				explanation = EXPLANATION_AVERAGE;
			}
			scored.put(ranked.creativeId(), new CreativeScore(ranked.creativeId(), bucket,
					ranked.breakdown().composite(), explanation, ranked.breakdown(), false));
		}

		int best = 0;
		int worst = 0;
		int unknown = 0;
		int belowThreshold = 0;
		List<CreativeScore> results = new ArrayList<>(candidates.size());
		for (ScoringCandidate candidate : candidates) {
			CreativeScore score = scored.get(candidate.creativeId());
			if (score == null) {
				score = new CreativeScore(candidate.creativeId(), CreativeBucket.UNKNOWN, null,
						EXPLANATION_BELOW_THRESHOLD, null, true);
				belowThreshold++;
			} else if (score.bucket() == CreativeBucket.BEST) {
				best++;
			} else if (score.bucket() == CreativeBucket.WORST) {
				worst++;
			} else {
				unknown++;
			}
			results.add(score);
		}
		return new ClassificationResult(List.copyOf(results),
				new BucketCounts(best, worst, unknown, belowThreshold),
				population,
				bucketed);
	}

	static int bandSize(int population, double bandPercent) {
		int size = Math.max(1, (int) Math.floor(population * bandPercent + BAND_EPSILON));
		return Math.min(size, population / 2);
	}

	/**
	 * Mid-rank percentile of each value within {@code values}, in [0, 1]. Equal values share a rank;
	 * a single value ranks 0.5.
	 */
	static Map<Long, Double> percentileRanks(Map<Long, Double> values) {
		Map<Long, Double> ranks = new HashMap<>();
		int n = values.size();
		if (n == 0) {
			return ranks;
		}
		if (n == 1) {
			values.keySet().forEach(id -> ranks.put(id, 0.5));
			return ranks;
		}
		List<Double> sorted = new ArrayList<>(values.values());
		sorted.sort(Comparator.naturalOrder());
		for (Map.Entry<Long, Double> entry : values.entrySet()) {
			double value = entry.getValue();
			int less = lowerBound(sorted, value);
			int equal = upperBound(sorted, value) - less;
			double rank = (less + (equal - 1) / 2.0) / (n - 1);
			ranks.put(entry.getKey(), clamp(rank));
		}
		return ranks;
	}

	private boolean isScorable(ScoringCandidate candidate, ScoringPolicy policy) {
		MetricSnapshot metrics = candidate.metrics();
		return metrics != null
				&& metrics.impressions() >= policy.minImpressions()
				&& metrics.clicks() >= policy.minClicks();
	}

	private Map<Long, ScoreBreakdown> computeBreakdowns(List<ScoringCandidate> scorable) {
		Map<Long, Double> ctrRanks = percentileRanks(collect(scorable, MetricSnapshot::ctr));
		Map<Long, Double> cvrRanks = percentileRanks(collect(scorable, MetricSnapshot::cvr));
		Map<Long, Double> cpaRanks = percentileRanks(collect(scorable, this::invertedCpa));
		Map<Long, Double> volumeRanks = percentileRanks(collect(scorable, metrics -> (double) metrics.impressions()));

		Map<Long, ScoreBreakdown> breakdowns = new HashMap<>();
		for (ScoringCandidate candidate : scorable) {
			long id = candidate.creativeId();
			Double ctrScore = ctrRanks.get(id);
			Double cvrScore = cvrRanks.get(id);
			Double cpaScore = cpaRanks.get(id);
			if (cpaScore != null && !hasConversions(candidate.metrics())) {
				cpaScore = 0.0;
			}
			double volumeScore = volumeRanks.getOrDefault(id, 0.0);
			double weighted = WEIGHT_VOLUME * volumeScore;
			double weights = WEIGHT_VOLUME;
			if (ctrScore != null) {
				weighted += WEIGHT_CTR * ctrScore;
				weights += WEIGHT_CTR;
			}
			if (cvrScore != null) {
				weighted += WEIGHT_CVR * cvrScore;
				weights += WEIGHT_CVR;
			}
			if (cpaScore != null) {
				weighted += WEIGHT_CPA * cpaScore;
				weights += WEIGHT_CPA;
			}
			breakdowns.put(id, new ScoreBreakdown(ctrScore, cvrScore, cpaScore, volumeScore, clamp(weighted / weights)));
		}
		return breakdowns;
	}

	// Higher is better; no conversions ranks below every converting creative.
	private Double invertedCpa(MetricSnapshot metrics) {
		if (!metrics.conversionsCollected() || !metrics.costCollected()) {
			return null;
		}
		Double cpa = metrics.cpa();
		return cpa == null ? Double.NEGATIVE_INFINITY : -cpa;
	}

	private boolean hasConversions(MetricSnapshot metrics) {
		return metrics.conversions() != null && metrics.conversions() > 0;
	}

	private Map<Long, Double> collect(List<ScoringCandidate> scorable, Function<MetricSnapshot, Double> extractor) {
		Map<Long, Double> values = new HashMap<>();
		for (ScoringCandidate candidate : scorable) {
			Double value = extractor.apply(candidate.metrics());
			if (value != null && !value.isNaN()) {
				values.put(candidate.creativeId(), value);
			}
		}
		return values;
	}

	private String describe(Ranked ranked) {
		MetricSnapshot metrics = ranked.metrics();
		ScoreBreakdown breakdown = ranked.breakdown();
		List<String> parts = new ArrayList<>();
		Double ctr = metrics.ctr();
		parts.add(ctr == null ? "CTR: n/a" : format("CTR: %.2f%% (score: %.2f)", ctr * 100, breakdown.ctrScore()));
		if (!metrics.conversionsCollected()) {
			parts.add("CVR: not collected");
		} else {
			Double cvr = metrics.cvr();
			parts.add(cvr == null ? "CVR: n/a" : format("CVR: %.2f%% (score: %.2f)", cvr * 100, breakdown.cvrScore()));
		}
		if (breakdown.cpaScore() == null) {
			parts.add("CPA: not collected");
		} else if (metrics.cpa() == null) {
			parts.add(format("CPA: n/a, no conversions (score: %.2f)", breakdown.cpaScore()));
		} else {
			parts.add(format("CPA: $%.2f (score: %.2f)", metrics.cpa(), breakdown.cpaScore()));
		}
		parts.add(format("Volume: %,d imp (score: %.2f)", metrics.impressions(), breakdown.volumeScore()));
		parts.add(format("Composite: %.3f", breakdown.composite()));
		return String.join(" | ", parts);
	}

	private static String percentLabel(double bandPercent) {
		return Math.round(bandPercent * 100) + "%";
	}

	private static String format(String pattern, Object... args) {
		return String.format(Locale.ROOT, pattern, args);
	}

	private static int lowerBound(List<Double> sorted, double value) {
		int low = 0;
		int high = sorted.size();
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (sorted.get(mid) < value) {
				low = mid + 1;
			} else {
				high = mid;
			}
		}
		return low;
	}

	private static int upperBound(List<Double> sorted, double value) {
		int low = 0;
		int high = sorted.size();
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (sorted.get(mid) <= value) {
				low = mid + 1;
			} else {
				high = mid;
			}
		}
		return low;
	}

	private static double clamp(double value) {
		return Math.max(0.0, Math.min(1.0, value));
	}

	private record Ranked(long creativeId, MetricSnapshot metrics, ScoreBreakdown breakdown) {
	}
}
