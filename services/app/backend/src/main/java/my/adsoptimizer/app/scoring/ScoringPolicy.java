package my.adsoptimizer.app.scoring;

public record ScoringPolicy(int minImpressions,
							int minClicks,
							double bandPercent,
							int minPopulationForBucketing) {
	public static final int DEFAULT_MIN_IMPRESSIONS = 100;
	public static final int DEFAULT_MIN_CLICKS = 10;
	public static final double DEFAULT_BAND_PERCENT = 0.20;
	public static final int DEFAULT_MIN_POPULATION = 5;

	public ScoringPolicy {
		if (minImpressions < 0 || minClicks < 0) {
			throw new IllegalArgumentException("Volume thresholds must not be negative");
		}
		if (bandPercent <= 0 || bandPercent > 0.5) {
			throw new IllegalArgumentException("bandPercent must be in (0, 0.5]");
		}
		if (minPopulationForBucketing < 1) {
			throw new IllegalArgumentException("minPopulationForBucketing must be at least 1");
		}
	}

	public static ScoringPolicy defaults() {
		return new ScoringPolicy(DEFAULT_MIN_IMPRESSIONS, DEFAULT_MIN_CLICKS, DEFAULT_BAND_PERCENT, DEFAULT_MIN_POPULATION);
	}
}
