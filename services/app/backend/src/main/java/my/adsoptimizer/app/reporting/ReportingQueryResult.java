package my.adsoptimizer.app.reporting;

import java.util.List;
import java.util.Set;

/**
 * Rows of a possibly narrowed query. A field in {@code removedFields} was not collected; readers must
 * treat its absence as unknown rather than as zero.
 */
public record ReportingQueryResult(List<ReportingRow> rows,
								   List<String> collectedFields,
								   Set<String> removedFields,
								   int attempts) {
	public ReportingQueryResult {
		rows = List.copyOf(rows);
		collectedFields = List.copyOf(collectedFields);
		removedFields = Set.copyOf(removedFields);
	}

	public boolean isCollected(String field) {
		return collectedFields.contains(field);
	}

	public boolean isDegraded() {
		return !removedFields.isEmpty();
	}
}
