package my.adsoptimizer.app.embedding;

import my.adsoptimizer.app.domain.Creative;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Nearest-neighbour lookup of exemplar creatives by cosine similarity of their text embeddings.
 */
public class SimilarCreativeRetriever {
	private static final Logger logger = LoggerFactory.getLogger(SimilarCreativeRetriever.class);
	private static final int MAX_ATTEMPTS = 2;
	private static final Comparator<ScoredExemplar> SIMILARITY_ORDER = Comparator
			.comparingDouble(ScoredExemplar::similarity).reversed()
			.thenComparingLong(ScoredExemplar::creativeId);

	private final EmbeddingClient embeddingClient;
	private final EmbeddingCache cache;

	public SimilarCreativeRetriever(EmbeddingClient embeddingClient, EmbeddingCache cache) {
		this.embeddingClient = embeddingClient;
		this.cache = cache;
	}

	/**
	 * Returns up to {@code k} creatives of {@code pool} ordered by descending similarity to
	 * {@code target}, ties by ascending creative id. The caller restricts the pool to best-bucket
	 * creatives of the target's account.
	 *
	 * @throws EmbeddingServiceException when the embedding service fails twice in a row
	 */
	public List<ScoredExemplar> findSimilar(Creative target, List<Creative> pool, int k) {
		if (target == null || pool == null || pool.isEmpty() || k <= 0) {
			return List.of();
		}
		List<Creative> candidates = new ArrayList<>();
		for (Creative creative : pool) {
			if (creative != null && !creative.getCreativeId().equals(target.getCreativeId())) {
				candidates.add(creative);
			}
		}
		if (candidates.isEmpty()) {
			return List.of();
		}
		List<Creative> all = new ArrayList<>(candidates.size() + 1);
		all.add(target);
		all.addAll(candidates);
		Map<Long, float[]> vectors = vectorsFor(all);

		float[] targetVector = vectors.get(target.getCreativeId());
		List<ScoredExemplar> scored = new ArrayList<>(candidates.size());
		for (Creative candidate : candidates) {
			float[] candidateVector = vectors.get(candidate.getCreativeId());
			if (candidateVector.length != targetVector.length) {
				throw new EmbeddingServiceException("Embedding dimensions differ between creative " + target.getCreativeId()
						+ " (" + targetVector.length + ") and creative " + candidate.getCreativeId()
						+ " (" + candidateVector.length + ")", null);
			}
			double similarity = CosineSimilarity.between(targetVector, candidateVector);
			scored.add(new ScoredExemplar(candidate, similarity));
		}
		scored.sort(SIMILARITY_ORDER);
		List<ScoredExemplar> top = List.copyOf(scored.subList(0, Math.min(k, scored.size())));
		if (logger.isInfoEnabled()) {
			logger.info("Retrieved {} exemplars for creative {} (similarities={})", top.size(),
					target.getCreativeId(), top.stream()
							.map(exemplar -> String.format(Locale.ROOT, "%.3f", exemplar.similarity()))
							.toList());
		}
		return top;
	}

	private Map<Long, float[]> vectorsFor(List<Creative> creatives) {
		Map<Long, float[]> vectors = new LinkedHashMap<>();
		Map<Long, String> missingTexts = new LinkedHashMap<>();
		Map<Long, String> missingHashes = new LinkedHashMap<>();
		String model = embeddingClient.model();
		for (Creative creative : creatives) {
			Long id = creative.getCreativeId();
			if (vectors.containsKey(id) || missingTexts.containsKey(id)) {
				continue;
			}
			String text = CreativeText.of(creative);
			String hash = CreativeText.hash(text);
			float[] cached = cache.get(model, id, hash);
			if (cached != null) {
				vectors.put(id, cached);
			} else {
				missingTexts.put(id, text);
				missingHashes.put(id, hash);
			}
		}
		if (missingTexts.isEmpty()) {
			return vectors;
		}
		List<Long> ids = new ArrayList<>(missingTexts.keySet());
		List<float[]> embedded = embedWithRetry(new ArrayList<>(missingTexts.values()));
		for (int i = 0; i < ids.size(); i++) {
			Long id = ids.get(i);
			float[] vector = embedded.get(i);
			cache.put(model, id, missingHashes.get(id), vector);
			vectors.put(id, vector);
		}
		return vectors;
	}

	private List<float[]> embedWithRetry(List<String> texts) {
		RuntimeException last = null;
		for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
			try {
				List<float[]> vectors = embeddingClient.embedAll(texts);
				checkShape(texts, vectors);
				return vectors;
			} catch (RuntimeException ex) {
				last = ex;
				logger.warn("Embedding request failed (attempt {}/{}, texts={}): {}",
						attempt, MAX_ATTEMPTS, texts.size(), ex.getMessage());
			}
		}
		throw new EmbeddingServiceException("Embedding service failed after " + MAX_ATTEMPTS + " attempts: "
				+ (last == null ? "unknown error" : last.getMessage()), last);
	}

	private void checkShape(List<String> texts, List<float[]> vectors) {
		if (vectors == null || vectors.size() != texts.size()) {
			throw new EmbeddingServiceException("Expected " + texts.size() + " embeddings but received "
					+ (vectors == null ? 0 : vectors.size()), null);
		}
		int dimension = -1;
		for (float[] vector : vectors) {
			if (vector == null || vector.length == 0) {
				throw new EmbeddingServiceException("Embedding response contained an empty vector", null);
			}
			if (dimension >= 0 && vector.length != dimension) {
				throw new EmbeddingServiceException("Embedding dimensions differ within one response", null);
			}
			dimension = vector.length;
		}
	}
}
