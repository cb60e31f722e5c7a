package my.adsoptimizer.app.reporting;

import java.util.List;
import java.util.Set;

/**
 * Rejection of a reporting query. {@code invalidFields} lists the selected fields the API named as
 * unrecognized or unavailable; it is empty when the error did not point at specific fields.
 */
public class ReportingApiException extends RuntimeException {
	private final Set<String> invalidFields;
	private final boolean fieldError;
	private final List<String> apiMessages;

	public ReportingApiException(String message,
								 Set<String> invalidFields,
								 boolean fieldError,
								 List<String> apiMessages,
								 Throwable cause) {
		super(message, cause);
		this.invalidFields = invalidFields == null ? Set.of() : Set.copyOf(invalidFields);
		this.fieldError = fieldError;
		this.apiMessages = apiMessages == null ? List.of() : List.copyOf(apiMessages);
	}

	public Set<String> getInvalidFields() {
		return invalidFields;
	}

	public boolean isFieldError() {
		return fieldError;
	}

	public List<String> getApiMessages() {
		return apiMessages;
	}
}
