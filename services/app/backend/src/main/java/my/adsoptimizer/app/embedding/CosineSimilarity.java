package my.adsoptimizer.app.embedding;

public final class CosineSimilarity {
	private CosineSimilarity() {
	}

	/**
	 * Cosine of the angle between two vectors, 0 when either has zero length.
	 */
	public static double between(float[] a, float[] b) {
		if (a == null || b == null || a.length != b.length) {
			throw new IllegalArgumentException("Vectors must be non-null and of equal dimension");
		}
		double dot = 0;
		double normA = 0;
		double normB = 0;
		for (int i = 0; i < a.length; i++) {
			dot += (double) a[i] * b[i];
			normA += (double) a[i] * a[i];
			normB += (double) b[i] * b[i];
		}
		if (normA == 0 || normB == 0) {
			return 0.0;
		}
		return dot / Math.sqrt(normA * normB);
	}
}
