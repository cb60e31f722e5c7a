package my.adsoptimizer.app.llm;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Failure of a call to an OpenAI-compatible HTTP endpoint (chat completions or embeddings).
 */
public class LlmRequestException extends RuntimeException {
	private final Integer statusCode;
	private final boolean retryable;

	public LlmRequestException(String message, Integer statusCode, boolean retryable, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.retryable = retryable;
	}

	public static LlmRequestException from(Exception ex) {
		if (ex instanceof LlmRequestException llmEx) {
			return llmEx;
		}
		if (ex instanceof RestClientResponseException responseEx) {
			int status = responseEx.getStatusCode().value();
			boolean retryable = status == 408 || status == 429 || status >= 500;
			return new LlmRequestException(safeMessage(ex), status, retryable, ex);
		}
		if (ex instanceof ResourceAccessException) {
			return new LlmRequestException(safeMessage(ex), null, true, ex);
		}
		return new LlmRequestException(safeMessage(ex), null, false, ex);
	}

	public Integer getStatusCode() {
		return statusCode;
	}

	public boolean isRetryable() {
		return retryable;
	}

	private static String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}
}
