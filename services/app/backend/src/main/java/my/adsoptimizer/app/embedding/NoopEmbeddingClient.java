package my.adsoptimizer.app.embedding;

import java.util.List;

public class NoopEmbeddingClient implements EmbeddingClient {
	@Override
	public List<float[]> embedAll(List<String> texts) {
		throw new EmbeddingServiceException("Embeddings disabled", null);
	}

	@Override
	public String model() {
		return "noop";
	}
}
