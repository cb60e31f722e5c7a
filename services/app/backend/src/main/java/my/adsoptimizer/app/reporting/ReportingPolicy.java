package my.adsoptimizer.app.reporting;

import java.util.List;

/**
 * @param knownInvalidFields removed in order when the API reports a field problem without naming the field
 */
public record ReportingPolicy(int maxFieldRemovalRetries, List<String> knownInvalidFields) {
	public static final int DEFAULT_MAX_FIELD_REMOVAL_RETRIES = 3;
	public static final List<String> DEFAULT_KNOWN_INVALID_FIELDS = List.of(
			"metrics.conversion_rate",
			"metrics.value_micros",
			"metrics.cost_per_all_conversion");

	public ReportingPolicy {
		if (maxFieldRemovalRetries < 0) {
			throw new IllegalArgumentException("maxFieldRemovalRetries must not be negative");
		}
		knownInvalidFields = knownInvalidFields == null ? List.of() : List.copyOf(knownInvalidFields);
	}

	public static ReportingPolicy defaults() {
		return new ReportingPolicy(DEFAULT_MAX_FIELD_REMOVAL_RETRIES, DEFAULT_KNOWN_INVALID_FIELDS);
	}
}
