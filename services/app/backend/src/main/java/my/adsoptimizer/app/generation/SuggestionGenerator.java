package my.adsoptimizer.app.generation;

import my.adsoptimizer.app.domain.Creative;
import my.adsoptimizer.app.domain.CreativeBucket;
import my.adsoptimizer.app.embedding.ScoredExemplar;
import my.adsoptimizer.app.llm.LlmClient;
import my.adsoptimizer.app.llm.LlmCompletion;
import my.adsoptimizer.app.validation.CreativeVariant;
import my.adsoptimizer.app.validation.CreativeVariantValidator;
import my.adsoptimizer.app.validation.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Prompts the model once with the target creative and its exemplars and validates every variant it
 * returns. Nothing is persisted here; a parse failure therefore leaves no partial output behind.
 */
public class SuggestionGenerator {
	private static final Logger logger = LoggerFactory.getLogger(SuggestionGenerator.class);

	private final LlmClient llmClient;
	private final SuggestionPromptBuilder promptBuilder;
	private final VariantResponseParser responseParser;
	private final CreativeVariantValidator validator;

	public SuggestionGenerator(LlmClient llmClient,
							   SuggestionPromptBuilder promptBuilder,
							   VariantResponseParser responseParser,
							   CreativeVariantValidator validator) {
		this.llmClient = llmClient;
		this.promptBuilder = promptBuilder;
		this.responseParser = responseParser;
		this.validator = validator;
	}

	/**
	 * @throws NoExemplarsAvailableException when {@code exemplars} is empty
	 * @throws GenerationParseException      when the response does not hold {@code numVariants} variants
	 */
	public List<GeneratedVariant> generate(Creative target, List<ScoredExemplar> exemplars, int numVariants) {
		if (target == null) {
			throw new IllegalArgumentException("target is required");
		}
		if (numVariants < 1) {
			throw new IllegalArgumentException("numVariants must be at least 1");
		}
		if (exemplars == null || exemplars.isEmpty()) {
			throw new NoExemplarsAvailableException(target.getCreativeId());
		}
		List<Long> exemplarIds = new ArrayList<>(exemplars.size());
		List<Double> similarities = new ArrayList<>(exemplars.size());
		for (ScoredExemplar exemplar : exemplars) {
			if (exemplar.creative().getBucket() != CreativeBucket.BEST) {
				throw new IllegalArgumentException("Exemplar " + exemplar.creativeId() + " is not in the BEST bucket");
			}
			exemplarIds.add(exemplar.creativeId());
			similarities.add(exemplar.similarity());
		}

		String prompt = promptBuilder.build(target, exemplars, numVariants);
		LlmCompletion completion = llmClient.complete(SuggestionPromptBuilder.SYSTEM_PROMPT, prompt,
				VariantResponseParser.SCHEMA_NAME, responseParser.responseSchema());
		List<CreativeVariant> variants = responseParser.parse(completion.text(), numVariants);

		List<GeneratedVariant> generated = new ArrayList<>(variants.size());
		int passed = 0;
		for (CreativeVariant variant : variants) {
			ValidationOutcome outcome = validator.validate(variant);
			if (outcome.passed()) {
				passed++;
			} else {
				logger.warn("Variant for creative {} failed validation: {}", target.getCreativeId(), outcome.errors());
			}
			generated.add(new GeneratedVariant(variant, outcome, exemplarIds, similarities,
					SuggestionPromptBuilder.PROMPT_VERSION, completion.model()));
		}
		logger.info("Generated {} variants for creative {} ({} passed validation, exemplars={})",
				generated.size(), target.getCreativeId(), passed, exemplarIds);
		return List.copyOf(generated);
	}
}
