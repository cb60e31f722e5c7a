package my.adsoptimizer.app.reporting;

import java.util.List;

public class NoopReportingClient implements ReportingClient {
	@Override
	public List<ReportingRow> search(String customerId, ReportingQuery query) {
		throw new ReportingApiException("Reporting disabled", null, false, List.of(), null);
	}
}
