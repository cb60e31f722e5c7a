package my.adsoptimizer.app.embedding;

import java.util.List;

public interface EmbeddingClient {
	/**
	 * Embeds every text in one request. The result is parallel to {@code texts}.
	 */
	List<float[]> embedAll(List<String> texts);

	default float[] embed(String text) {
		List<float[]> vectors = embedAll(List.of(text));
		if (vectors.isEmpty()) {
			throw new EmbeddingServiceException("Embedding response was empty", null);
		}
		return vectors.get(0);
	}

	String model();
}
