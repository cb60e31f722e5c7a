package my.adsoptimizer.app.reporting;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A declarative GAQL-style query: selected fields, one resource and an optional WHERE predicate.
 */
public record ReportingQuery(String resource, List<String> fields, String filter) {
	public ReportingQuery {
		if (resource == null || resource.isBlank()) {
			throw new IllegalArgumentException("resource is required");
		}
		if (fields == null || fields.isEmpty()) {
			throw new IllegalArgumentException("at least one field is required");
		}
		fields = List.copyOf(fields);
	}

	public ReportingQuery withoutFields(Collection<String> excluded) {
		List<String> remaining = new ArrayList<>(fields);
		remaining.removeAll(excluded);
		return new ReportingQuery(resource, remaining, filter);
	}

	public String toGaql() {
		StringBuilder query = new StringBuilder("SELECT ")
				.append(String.join(", ", fields))
				.append(" FROM ")
				.append(resource);
		if (filter != null && !filter.isBlank()) {
			query.append(" WHERE ").append(filter);
		}
		return query.toString();
	}
}
