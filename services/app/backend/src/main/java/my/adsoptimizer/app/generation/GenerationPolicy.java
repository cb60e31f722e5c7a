package my.adsoptimizer.app.generation;

public record GenerationPolicy(int topKExemplars, int numVariants, int bestPoolLimit) {
	public static final int DEFAULT_TOP_K = 5;
	public static final int DEFAULT_NUM_VARIANTS = 3;
	public static final int DEFAULT_BEST_POOL_LIMIT = 20;

	public GenerationPolicy {
		if (topKExemplars < 1 || numVariants < 1 || bestPoolLimit < 1) {
			throw new IllegalArgumentException("Generation limits must be positive");
		}
	}

	public static GenerationPolicy defaults() {
		return new GenerationPolicy(DEFAULT_TOP_K, DEFAULT_NUM_VARIANTS, DEFAULT_BEST_POOL_LIMIT);
	}
}
