package my.adsoptimizer.app.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;

/**
 * Vectors keyed by embedding model, creative id and the hash of the text they were computed from.
 * A creative whose text changed, or a switch to another model, produces a new key, so the previous
 * vector is never returned again.
 */
public class EmbeddingCache {
	private final Cache<Key, float[]> cache;

	public EmbeddingCache(long maxSize, Duration ttl) {
		this.cache = Caffeine.newBuilder()
				.maximumSize(maxSize)
				.expireAfterWrite(ttl)
				.recordStats()
				.build();
	}

	public float[] get(String model, long creativeId, String textHash) {
		return cache.getIfPresent(new Key(model, creativeId, textHash));
	}

	public void put(String model, long creativeId, String textHash, float[] vector) {
		cache.put(new Key(model, creativeId, textHash), vector);
	}

	public long size() {
		cache.cleanUp();
		return cache.estimatedSize();
	}

	public long hitCount() {
		return cache.stats().hitCount();
	}

	private record Key(String model, long creativeId, String textHash) {
	}
}
