package my.adsoptimizer.app.validation;

/**
 * Structural limits of a responsive search ad.
 */
public record RsaConstraints(int maxHeadlineLength,
							 int maxDescriptionLength,
							 int minHeadlines,
							 int maxHeadlines,
							 int minDescriptions,
							 int maxDescriptions,
							 int minTruncatedLength) {
	public static final RsaConstraints RESPONSIVE_SEARCH_AD = new RsaConstraints(30, 90, 3, 15, 2, 4, 3);
}
