package my.adsoptimizer.app.scoring;

import my.adsoptimizer.app.domain.CreativeMetrics;

/**
 * Read-only view of a creative's aggregated window metrics. {@code conversions} and {@code costMicros}
 * are {@code null} when the reporting API did not return them, which is distinct from zero.
 */
public record MetricSnapshot(long impressions,
							 long clicks,
							 Double conversions,
							 Long costMicros) {
	private static final double MICROS_PER_UNIT = 1_000_000d;

	public static MetricSnapshot of(CreativeMetrics metrics) {
		if (metrics == null) {
			return null;
		}
		return new MetricSnapshot(metrics.getImpressions(), metrics.getClicks(),
				metrics.getConversions(), metrics.getCostMicros());
	}

	public Double ctr() {
		if (impressions <= 0) {
			return null;
		}
		return (double) clicks / impressions;
	}

	public Double cvr() {
		if (conversions == null || clicks <= 0) {
			return null;
		}
		return conversions / clicks;
	}

	/**
	 * Cost per conversion in currency units, {@code null} when there were no conversions or when
	 * either input was not collected.
	 */
	public Double cpa() {
		if (conversions == null || costMicros == null || conversions <= 0) {
			return null;
		}
		return costMicros / MICROS_PER_UNIT / conversions;
	}

	public boolean conversionsCollected() {
		return conversions != null;
	}

	public boolean costCollected() {
		return costMicros != null;
	}

	public Double cost() {
		return costMicros == null ? null : costMicros / MICROS_PER_UNIT;
	}
}
