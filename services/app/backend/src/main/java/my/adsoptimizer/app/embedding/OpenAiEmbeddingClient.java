package my.adsoptimizer.app.embedding;

import my.adsoptimizer.app.llm.LlmRequestException;
import my.adsoptimizer.app.llm.OpenAiRestClients;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class OpenAiEmbeddingClient implements EmbeddingClient {
	private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
	private static final Duration READ_TIMEOUT = Duration.ofSeconds(60);

	private final RestClient restClient;
	private final String model;
	private final Integer dimensions;

	public OpenAiEmbeddingClient(String baseUrl, String apiKey, String model, Integer dimensions) {
		this.restClient = OpenAiRestClients.create(baseUrl, apiKey, CONNECT_TIMEOUT, READ_TIMEOUT);
		this.model = model;
		this.dimensions = dimensions;
	}

	@Override
	public List<float[]> embedAll(List<String> texts) {
		if (texts == null || texts.isEmpty()) {
			return List.of();
		}
		Map<String, Object> request = new HashMap<>();
		request.put("model", model);
		request.put("input", texts);
		if (dimensions != null) {
			request.put("dimensions", dimensions);
		}
		Map<?, ?> response;
		try {
			response = restClient.post().uri("/embeddings").body(request).retrieve().body(Map.class);
		} catch (Exception ex) {
			throw LlmRequestException.from(ex);
		}
		return parseVectors(response);
	}

	@Override
	public String model() {
		return model;
	}

	private List<float[]> parseVectors(Map<?, ?> response) {
		Object data = response == null ? null : response.get("data");
		if (!(data instanceof List<?> items)) {
			throw new LlmRequestException("Embedding response has no data", null, false, null);
		}
		Map<Integer, float[]> byIndex = new TreeMap<>();
		int position = 0;
		for (Object item : items) {
			if (!(item instanceof Map<?, ?> itemMap)) {
				throw new LlmRequestException("Invalid embedding item", null, false, null);
			}
			Object index = itemMap.get("index");
			int key = index instanceof Number number ? number.intValue() : position;
			byIndex.put(key, toVector(itemMap.get("embedding")));
			position += 1;
		}
		return new ArrayList<>(byIndex.values());
	}

	private float[] toVector(Object embedding) {
		if (!(embedding instanceof List<?> values)) {
			throw new LlmRequestException("Invalid embedding vector", null, false, null);
		}
		float[] vector = new float[values.size()];
		for (int i = 0; i < values.size(); i++) {
			Object value = values.get(i);
			if (!(value instanceof Number number)) {
				throw new LlmRequestException("Invalid embedding component", null, false, null);
			}
			vector[i] = number.floatValue();
		}
		return vector;
	}
}
