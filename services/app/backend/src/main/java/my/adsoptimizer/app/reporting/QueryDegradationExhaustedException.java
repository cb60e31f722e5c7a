package my.adsoptimizer.app.reporting;

import java.util.List;

public class QueryDegradationExhaustedException extends RuntimeException {
	private final List<String> lastAttemptedFields;
	private final int attempts;

	public QueryDegradationExhaustedException(List<String> lastAttemptedFields, int attempts, RuntimeException lastError) {
		super("Query still failing after " + attempts + " attempts with fields " + lastAttemptedFields
				+ ": " + (lastError == null ? "unknown error" : lastError.getMessage()), lastError);
		this.lastAttemptedFields = List.copyOf(lastAttemptedFields);
		this.attempts = attempts;
	}

	public List<String> getLastAttemptedFields() {
		return lastAttemptedFields;
	}

	public int getAttempts() {
		return attempts;
	}

	public RuntimeException getLastError() {
		return (RuntimeException) getCause();
	}
}
