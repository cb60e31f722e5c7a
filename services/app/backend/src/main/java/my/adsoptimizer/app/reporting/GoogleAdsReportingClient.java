package my.adsoptimizer.app.reporting;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ReportingClient} over the Google Ads REST {@code googleAds:search} endpoint. The access token
 * is supplied by the account-connection flow and passed in as configuration.
 */
public class GoogleAdsReportingClient implements ReportingClient {
	private static final Pattern QUOTED_FIELD = Pattern.compile("'([a-z_]+(?:\\.[a-z_]+)+)'");
	private static final List<String> FIELD_ERROR_KEYWORDS = List.of("field", "invalid", "unknown", "not supported");
	private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
	private static final Duration READ_TIMEOUT = Duration.ofMinutes(2);
	private static final int MAX_PAGES = 100;

	private final RestClient restClient;
	private final ObjectMapper objectMapper;
	private final String apiVersion;

	public GoogleAdsReportingClient(String baseUrl,
									String apiVersion,
									String developerToken,
									String accessToken,
									String loginCustomerId,
									ObjectMapper objectMapper) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(CONNECT_TIMEOUT);
		requestFactory.setReadTimeout(READ_TIMEOUT);
		RestClient.Builder builder = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
				.defaultHeader("developer-token", developerToken)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
		if (loginCustomerId != null && !loginCustomerId.isBlank()) {
			builder.defaultHeader("login-customer-id", loginCustomerId.replace("-", ""));
		}
		this.restClient = builder.build();
		this.objectMapper = objectMapper;
		this.apiVersion = apiVersion;
	}

	@Override
	public List<ReportingRow> search(String customerId, ReportingQuery query) {
		String gaql = query.toGaql();
		String uri = "/" + apiVersion + "/customers/" + customerId.replace("-", "") + "/googleAds:search";
		List<ReportingRow> rows = new ArrayList<>();
		String pageToken = null;
		int pages = 0;
		do {
			Map<String, Object> body = new HashMap<>();
			body.put("query", gaql);
			if (pageToken != null) {
				body.put("pageToken", pageToken);
			}
			Map<?, ?> response;
			try {
				response = restClient.post().uri(uri).body(body).retrieve().body(Map.class);
			} catch (RestClientResponseException ex) {
				throw toApiException(ex, query);
			}
			if (response == null) {
				break;
			}
			Object results = response.get("results");
			if (results instanceof List<?> list) {
				for (Object result : list) {
					if (result instanceof Map<?, ?> resultMap) {
						Map<String, Object> flat = new LinkedHashMap<>();
						flatten("", resultMap, flat);
						rows.add(new ReportingRow(flat));
					}
				}
			}
			Object next = response.get("nextPageToken");
			pageToken = next instanceof String token && !token.isBlank() ? token : null;
			pages += 1;
		} while (pageToken != null && pages < MAX_PAGES);
		return rows;
	}

	ReportingApiException toApiException(RestClientResponseException ex, ReportingQuery query) {
		List<String> messages = new ArrayList<>();
		boolean queryErrorCode = false;
		try {
			JsonNode root = objectMapper.readTree(ex.getResponseBodyAsString());
			JsonNode error = root.path("error");
			if (error.path("message").isString()) {
				messages.add(error.path("message").asString());
			}
			for (JsonNode detail : error.path("details")) {
				for (JsonNode item : detail.path("errors")) {
					if (item.path("message").isString()) {
						messages.add(item.path("message").asString());
					}
					if (item.path("errorCode").has("queryError")) {
						queryErrorCode = true;
					}
				}
			}
		} catch (Exception parseEx) {
			messages.add(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
		}
		Set<String> invalidFields = new LinkedHashSet<>();
		for (String message : messages) {
			Matcher matcher = QUOTED_FIELD.matcher(message);
			while (matcher.find()) {
				if (query.fields().contains(matcher.group(1))) {
					invalidFields.add(matcher.group(1));
				}
			}
		}
		boolean fieldError = queryErrorCode || !invalidFields.isEmpty() || mentionsFieldProblem(messages);
		String summary = "Google Ads search failed (status=" + ex.getStatusCode().value() + "): " + String.join("; ", messages);
		return new ReportingApiException(summary, invalidFields, fieldError, messages, ex);
	}

	private static boolean mentionsFieldProblem(List<String> messages) {
		for (String message : messages) {
			String lower = message.toLowerCase(Locale.ROOT);
			for (String keyword : FIELD_ERROR_KEYWORDS) {
				if (lower.contains(keyword)) {
					return true;
				}
			}
		}
		return false;
	}

	static void flatten(String prefix, Map<?, ?> source, Map<String, Object> target) {
		for (Map.Entry<?, ?> entry : source.entrySet()) {
			String key = prefix.isEmpty() ? toSnakeCase(entry.getKey().toString())
					: prefix + "." + toSnakeCase(entry.getKey().toString());
			Object value = entry.getValue();
			if (value instanceof Map<?, ?> nested) {
				flatten(key, nested, target);
			} else if (value != null) {
				target.put(key, value);
			}
		}
	}

	static String toSnakeCase(String camel) {
		StringBuilder result = new StringBuilder(camel.length() + 4);
		for (char c : camel.toCharArray()) {
			if (Character.isUpperCase(c)) {
				result.append('_').append(Character.toLowerCase(c));
			} else {
				result.append(c);
			}
		}
		return result.toString();
	}
}
