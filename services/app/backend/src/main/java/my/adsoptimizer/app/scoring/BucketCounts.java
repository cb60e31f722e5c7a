package my.adsoptimizer.app.scoring;

public record BucketCounts(int best, int worst, int unknown, int belowThreshold) {
	public static final BucketCounts EMPTY = new BucketCounts(0, 0, 0, 0);

	public int total() {
		return best + worst + unknown + belowThreshold;
	}
}
