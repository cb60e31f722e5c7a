package my.adsoptimizer.app.generation;

import my.adsoptimizer.app.domain.Creative;
import my.adsoptimizer.app.embedding.ScoredExemplar;
import my.adsoptimizer.app.validation.RsaConstraints;

import java.util.List;
import java.util.Locale;

public class SuggestionPromptBuilder {
	public static final String PROMPT_VERSION = "v1.1";
	public static final String SYSTEM_PROMPT = "You are an expert Google Ads copywriter specializing in Responsive Search Ads. "
			+ "Your goal is to create compelling, conversion-focused ad copy that follows RSA best practices. "
			+ "Respond in JSON only. Do not wrap in Markdown code fences.";

	private static final int MAX_EXEMPLARS_IN_PROMPT = 5;
	private static final int MAX_EXEMPLAR_HEADLINES = 5;
	private static final int MAX_EXEMPLAR_DESCRIPTIONS = 2;

	private final RsaConstraints constraints;

	public SuggestionPromptBuilder(RsaConstraints constraints) {
		this.constraints = constraints;
	}

	public String build(Creative target, List<ScoredExemplar> exemplars, int numVariants) {
		StringBuilder prompt = new StringBuilder();
		prompt.append("I need to improve a low-performing Google Responsive Search Ad (RSA). Below is the current ad copy, ")
				.append("followed by examples of high-performing ads from the same account.\n\n");
		prompt.append("**Current Ad (Needs Improvement):**\n");
		prompt.append("Headlines: ").append(joinOrNone(target.getHeadlines())).append('\n');
		prompt.append("Descriptions: ").append(joinOrNone(target.getDescriptions())).append("\n\n");

		prompt.append("**High-Performing Ads (Learn from these):**\n");
		int shown = Math.min(MAX_EXEMPLARS_IN_PROMPT, exemplars.size());
		for (int i = 0; i < shown; i++) {
			ScoredExemplar exemplar = exemplars.get(i);
			Creative creative = exemplar.creative();
			if (i > 0) {
				prompt.append('\n');
			}
			prompt.append(String.format(Locale.ROOT, "High-Performing Example %d (similarity: %.2f):%n", i + 1, exemplar.similarity()));
			prompt.append("Headlines: ").append(joinOrNone(head(creative.getHeadlines(), MAX_EXEMPLAR_HEADLINES))).append('\n');
			prompt.append("Descriptions: ").append(joinOrNone(head(creative.getDescriptions(), MAX_EXEMPLAR_DESCRIPTIONS))).append('\n');
		}

		prompt.append("\n**Task:**\n");
		prompt.append("Generate ").append(numVariants).append(" improved RSA variants that:\n");
		prompt.append("1. Learn from the patterns and messaging in high-performing examples\n");
		prompt.append("2. Maintain similar tone, value propositions, and keyword usage\n");
		prompt.append("3. Improve upon the current ad's weaknesses\n");
		prompt.append("4. Follow RSA best practices (clear CTA, benefits-focused, specific)\n\n");

		prompt.append("**Strict Constraints:**\n");
		prompt.append("- Each headline: maximum ").append(constraints.maxHeadlineLength()).append(" characters\n");
		prompt.append("- Each description: maximum ").append(constraints.maxDescriptionLength()).append(" characters\n");
		prompt.append("- Provide ").append(constraints.minHeadlines()).append('-').append(constraints.maxHeadlines())
				.append(" headlines per variant\n");
		prompt.append("- Provide ").append(constraints.minDescriptions()).append('-').append(constraints.maxDescriptions())
				.append(" descriptions per variant\n");
		prompt.append("- All headlines must be unique (no duplicates)\n");
		prompt.append("- All descriptions must be unique (no duplicates)\n\n");

		prompt.append("**Output Format:**\n");
		prompt.append("Return one JSON object with a \"variants\" array of exactly ").append(numVariants)
				.append(" entries, each holding \"headlines\" and \"descriptions\" string arrays:\n");
		prompt.append("{\"variants\": [{\"headlines\": [\"...\"], \"descriptions\": [\"...\"]}]}\n\n");
		prompt.append("Be specific, compelling, and ensure all constraints are met.\n");
		return prompt.toString();
	}

	private static List<String> head(List<String> values, int limit) {
		if (values == null) {
			return List.of();
		}
		return values.subList(0, Math.min(limit, values.size()));
	}

	private static String joinOrNone(List<String> values) {
		if (values == null || values.isEmpty()) {
			return "None";
		}
		return String.join(", ", values);
	}
}
