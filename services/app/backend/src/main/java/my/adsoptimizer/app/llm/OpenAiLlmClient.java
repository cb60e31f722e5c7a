package my.adsoptimizer.app.llm;

import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class OpenAiLlmClient implements LlmClient {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(2);
	private static final double TEMPERATURE = 0.8;
	private static final int MAX_TOKENS = 1500;

	private final RestClient restClient;
	private final String model;

	public OpenAiLlmClient(String baseUrl, String apiKey, String model) {
		this(baseUrl, apiKey, model, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
	}

	public OpenAiLlmClient(String baseUrl, String apiKey, String model, Duration connectTimeout, Duration readTimeout) {
		this.restClient = OpenAiRestClients.create(baseUrl, apiKey,
				connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout,
				readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.model = model;
	}

	@Override
	public LlmCompletion complete(String systemPrompt, String userPrompt, String schemaName, Map<String, Object> schema) {
		Map<String, Object> request = new HashMap<>();
		request.put("model", model);
		request.put("messages", List.of(
				Map.of("role", "system", "content", systemPrompt == null ? "" : systemPrompt),
				Map.of("role", "user", "content", userPrompt == null ? "" : userPrompt)));
		request.put("temperature", TEMPERATURE);
		request.put("max_tokens", MAX_TOKENS);
		request.put("n", 1);
		if (schemaName != null && schema != null) {
			request.put("response_format", Map.of(
					"type", "json_schema",
					"json_schema", Map.of(
							"name", schemaName,
							"schema", schema,
							"strict", true
					)));
		}

		Map<?, ?> response;
		try {
			response = restClient.post().uri("/chat/completions").body(request).retrieve().body(Map.class);
		} catch (Exception ex) {
			throw LlmRequestException.from(ex);
		}
		String text = extractContent(response);
		if (text == null || text.isBlank()) {
			throw new LlmRequestException("No completion content", null, false, null);
		}
		return new LlmCompletion(text, model);
	}

	@Override
	public String model() {
		return model;
	}

	private String extractContent(Map<?, ?> response) {
		if (response == null) {
			return null;
		}
		Object choices = response.get("choices");
		if (!(choices instanceof List<?> list) || list.isEmpty()) {
			return null;
		}
		Object first = list.get(0);
		if (!(first instanceof Map<?, ?> choice)) {
			return null;
		}
		Object message = choice.get("message");
		if (!(message instanceof Map<?, ?> messageMap)) {
			return null;
		}
		Object content = messageMap.get("content");
		return content == null ? null : content.toString();
	}
}
