package my.adsoptimizer.app.llm;

import java.util.Map;

public class NoopLlmClient implements LlmClient {
	@Override
	public LlmCompletion complete(String systemPrompt, String userPrompt, String schemaName, Map<String, Object> schema) {
		throw new LlmRequestException("LLM disabled", null, false, null);
	}

	@Override
	public String model() {
		return "noop";
	}
}
