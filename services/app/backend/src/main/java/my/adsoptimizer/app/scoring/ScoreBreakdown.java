package my.adsoptimizer.app.scoring;

/**
 * Population-relative sub-scores. A {@code null} component was not collected for the creative and
 * did not contribute to the composite.
 */
public record ScoreBreakdown(Double ctrScore,
							 Double cvrScore,
							 Double cpaScore,
							 double volumeScore,
							 double composite) {
}
