package my.adsoptimizer.app.reporting;

import java.util.List;

public interface ReportingClient {
	/**
	 * Runs the query for one customer account. Each row maps snake_case dotted field names
	 * ({@code metrics.cost_micros}) to their values; fields missing from a row were not returned.
	 *
	 * @throws ReportingApiException when the API rejects the query
	 */
	List<ReportingRow> search(String customerId, ReportingQuery query);
}
