package my.adsoptimizer.app.config;

import my.adsoptimizer.app.embedding.EmbeddingCache;
import my.adsoptimizer.app.embedding.EmbeddingClient;
import my.adsoptimizer.app.embedding.NoopEmbeddingClient;
import my.adsoptimizer.app.embedding.OpenAiEmbeddingClient;
import my.adsoptimizer.app.embedding.SimilarCreativeRetriever;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EmbeddingConfig {
	private static final Logger logger = LoggerFactory.getLogger(EmbeddingConfig.class);
	static final String DEFAULT_MODEL = "text-embedding-3-small";
	static final int DEFAULT_DIMENSIONS = 1536;
	static final long DEFAULT_CACHE_SIZE = 10_000;
	static final int DEFAULT_CACHE_TTL_MINUTES = 24 * 60;

	@Bean
	@ConditionalOnProperty(name = "app.embedding.provider", havingValue = "openai")
	public OpenAiEmbeddingClient openAiEmbeddingClient(AppProperties properties) {
		AppProperties.Embedding.OpenAi openai = properties.embedding().openai();
		if (openai == null || openai.apiKey() == null || openai.apiKey().isBlank()) {
			throw new IllegalStateException("app.embedding.openai.api-key is required when app.embedding.provider=openai");
		}
		String model = openai.model() == null || openai.model().isBlank() ? DEFAULT_MODEL : openai.model();
		Integer dimensions = openai.dimensions() == null ? DEFAULT_DIMENSIONS : openai.dimensions();
		logger.info("Embedding client enabled (provider=openai, model={}, dimensions={}).", model, dimensions);
		return new OpenAiEmbeddingClient(openai.baseUrl(), openai.apiKey(), model, dimensions);
	}

	@Bean
	@ConditionalOnMissingBean(EmbeddingClient.class)
	public NoopEmbeddingClient noopEmbeddingClient() {
		logger.info("Embedding client disabled (provider=noop).");
		return new NoopEmbeddingClient();
	}

	@Bean
	public EmbeddingCache embeddingCache(AppProperties properties) {
		AppProperties.Embedding.Cache cache = properties.embedding() == null ? null : properties.embedding().cache();
		long maxSize = cache == null || cache.maxSize() == null ? DEFAULT_CACHE_SIZE : cache.maxSize();
		int ttlMinutes = cache == null || cache.ttlMinutes() == null ? DEFAULT_CACHE_TTL_MINUTES : cache.ttlMinutes();
		return new EmbeddingCache(maxSize, Duration.ofMinutes(ttlMinutes));
	}

	@Bean
	public SimilarCreativeRetriever similarCreativeRetriever(EmbeddingClient embeddingClient, EmbeddingCache embeddingCache) {
		return new SimilarCreativeRetriever(embeddingClient, embeddingCache);
	}
}
