package my.adsoptimizer.app.llm;

import java.util.Map;

public interface LlmClient {
	/**
	 * Sends one system/user prompt pair and returns the model's text answer.
	 *
	 * @throws LlmRequestException when the call fails or the response carries no text
	 */
	default LlmCompletion complete(String systemPrompt, String userPrompt) {
		return complete(systemPrompt, userPrompt, null, null);
	}

	/**
	 * Same as {@link #complete(String, String)} but asks for JSON matching {@code schema} when one is given.
	 */
	LlmCompletion complete(String systemPrompt, String userPrompt, String schemaName, Map<String, Object> schema);

	String model();
}
