package my.adsoptimizer.app.config;

import my.adsoptimizer.app.generation.GenerationPolicy;
import my.adsoptimizer.app.generation.SuggestionGenerator;
import my.adsoptimizer.app.generation.SuggestionPromptBuilder;
import my.adsoptimizer.app.generation.VariantResponseParser;
import my.adsoptimizer.app.llm.LlmClient;
import my.adsoptimizer.app.scoring.CreativeScoringEngine;
import my.adsoptimizer.app.scoring.ScoringPolicy;
import my.adsoptimizer.app.validation.CreativeVariantValidator;
import my.adsoptimizer.app.validation.RsaConstraints;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;

/**
 * Builds the immutable policies from {@link AppProperties} and wires the engines that consume them.
 */
@Configuration
@EnableConfigurationProperties(AppProperties.class)
public class OptimizerConfig {
	@Bean
	public ScoringPolicy scoringPolicy(AppProperties properties) {
		AppProperties.Optimizer.Scoring scoring = properties.optimizer() == null ? null : properties.optimizer().scoring();
		if (scoring == null) {
			return ScoringPolicy.defaults();
		}
		return new ScoringPolicy(
				valueOr(scoring.minImpressions(), ScoringPolicy.DEFAULT_MIN_IMPRESSIONS),
				valueOr(scoring.minClicks(), ScoringPolicy.DEFAULT_MIN_CLICKS),
				scoring.bandPercent() == null ? ScoringPolicy.DEFAULT_BAND_PERCENT : scoring.bandPercent(),
				valueOr(scoring.minPopulationForBucketing(), ScoringPolicy.DEFAULT_MIN_POPULATION));
	}

	@Bean
	public GenerationPolicy generationPolicy(AppProperties properties) {
		AppProperties.Optimizer.Generation generation = properties.optimizer() == null ? null : properties.optimizer().generation();
		if (generation == null) {
			return GenerationPolicy.defaults();
		}
		return new GenerationPolicy(
				valueOr(generation.topKExemplars(), GenerationPolicy.DEFAULT_TOP_K),
				valueOr(generation.numVariants(), GenerationPolicy.DEFAULT_NUM_VARIANTS),
				valueOr(generation.bestPoolLimit(), GenerationPolicy.DEFAULT_BEST_POOL_LIMIT));
	}

	@Bean
	public CreativeScoringEngine creativeScoringEngine() {
		return new CreativeScoringEngine();
	}

	@Bean
	public CreativeVariantValidator creativeVariantValidator() {
		return new CreativeVariantValidator(RsaConstraints.RESPONSIVE_SEARCH_AD);
	}

	@Bean
	public SuggestionGenerator suggestionGenerator(LlmClient llmClient,
												   CreativeVariantValidator validator,
												   ObjectMapper objectMapper) {
		return new SuggestionGenerator(llmClient,
				new SuggestionPromptBuilder(validator.constraints()),
				new VariantResponseParser(objectMapper),
				validator);
	}

	private static int valueOr(Integer value, int fallback) {
		return value == null ? fallback : value;
	}
}
