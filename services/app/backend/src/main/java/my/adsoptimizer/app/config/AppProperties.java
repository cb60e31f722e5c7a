package my.adsoptimizer.app.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Optimizer optimizer,
		Llm llm,
		Embedding embedding,
		Reporting reporting,
		Features features
) {
	public record Optimizer(
			Scoring scoring,
			Generation generation,
			ReportingRetries reporting
	) {
		public record Scoring(
				Integer minImpressions,
				Integer minClicks,
				Double bandPercent,
				Integer minPopulationForBucketing,
				Integer lockTimeoutSeconds
		) {
		}

		public record Generation(
				Integer topKExemplars,
				Integer numVariants,
				Integer bestPoolLimit
		) {
		}

		public record ReportingRetries(
				Integer maxFieldRemovalRetries
		) {
		}
	}

	public record Llm(
			@NotBlank String provider,
			OpenAi openai
	) {
		public record OpenAi(
				String apiKey,
				String baseUrl,
				String model,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}

	public record Embedding(
			@NotBlank String provider,
			OpenAi openai,
			Cache cache
	) {
		public record OpenAi(
				String apiKey,
				String baseUrl,
				String model,
				Integer dimensions
		) {
		}

		public record Cache(
				Long maxSize,
				Integer ttlMinutes
		) {
		}
	}

	public record Reporting(
			String provider,
			GoogleAds googleAds
	) {
		public record GoogleAds(
				String baseUrl,
				String apiVersion,
				String developerToken,
				String accessToken,
				String loginCustomerId
		) {
		}
	}

	public record Features(
			boolean applySuggestions
	) {
	}
}
