package my.adsoptimizer.app.reporting;

import java.util.List;
import java.util.Map;

public record ReportingRow(Map<String, Object> values) {
	public ReportingRow {
		values = Map.copyOf(values);
	}

	public boolean has(String field) {
		return values.containsKey(field);
	}

	public String text(String field) {
		Object value = values.get(field);
		return value == null ? null : value.toString();
	}

	public Long longValue(String field) {
		Object value = values.get(field);
		if (value instanceof Number number) {
			return number.longValue();
		}
		if (value instanceof String text && !text.isBlank()) {
			return Long.parseLong(text.trim());
		}
		return null;
	}

	public Double doubleValue(String field) {
		Object value = values.get(field);
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		if (value instanceof String text && !text.isBlank()) {
			return Double.parseDouble(text.trim());
		}
		return null;
	}

	public List<?> list(String field) {
		Object value = values.get(field);
		return value instanceof List<?> list ? list : List.of();
	}
}
