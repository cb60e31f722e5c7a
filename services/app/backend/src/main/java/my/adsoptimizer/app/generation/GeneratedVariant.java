package my.adsoptimizer.app.generation;

import my.adsoptimizer.app.validation.CreativeVariant;
import my.adsoptimizer.app.validation.ValidationOutcome;

import java.util.List;

/**
 * One parsed model variant with its validation outcome and the exemplars it was prompted with.
 */
public record GeneratedVariant(CreativeVariant raw,
							   ValidationOutcome validation,
							   List<Long> exemplarIds,
							   List<Double> similarityScores,
							   String promptVersion,
							   String model) {
	public GeneratedVariant {
		exemplarIds = List.copyOf(exemplarIds);
		similarityScores = List.copyOf(similarityScores);
	}
}
