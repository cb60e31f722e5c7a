package my.adsoptimizer.app.scoring;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param scores             one entry per input candidate, in input order
 * @param populationBucketed {@code false} when the scorable population was too small for best/worst bands
 */
public record ClassificationResult(List<CreativeScore> scores,
								   BucketCounts counts,
								   int scorablePopulation,
								   boolean populationBucketed) {
	public Map<Long, CreativeScore> byCreativeId() {
		Map<Long, CreativeScore> result = new LinkedHashMap<>();
		for (CreativeScore score : scores) {
			result.put(score.creativeId(), score);
		}
		return result;
	}
}
