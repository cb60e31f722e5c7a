package my.adsoptimizer.app.reporting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs a reporting query and, when the API rejects specific fields, drops exactly those fields and
 * retries. The loop accumulates an exclusion set; it gives up after
 * {@link ReportingPolicy#maxFieldRemovalRetries()} narrowing retries.
 */
public class ResilientQueryExecutor {
	private static final Logger logger = LoggerFactory.getLogger(ResilientQueryExecutor.class);

	private final ReportingClient client;
	private final ReportingPolicy policy;

	public ResilientQueryExecutor(ReportingClient client, ReportingPolicy policy) {
		this.client = client;
		this.policy = policy == null ? ReportingPolicy.defaults() : policy;
	}

	/**
	 * @throws QueryDegradationExhaustedException when the query still fails after the retry ceiling
	 *                                            or no further field can be removed
	 * @throws ReportingApiException              when the API fails for a reason unrelated to fields
	 */
	public ReportingQueryResult execute(String customerId, ReportingQuery query) {
		Set<String> excluded = new LinkedHashSet<>();
		int maxAttempts = policy.maxFieldRemovalRetries() + 1;
		ReportingQuery current = query;
		for (int attempt = 1; ; attempt++) {
			try {
				List<ReportingRow> rows = client.search(customerId, current);
				if (!excluded.isEmpty()) {
					logger.warn("Query on {} succeeded after removing fields {} (customer={}, attempt={})",
							query.resource(), excluded, customerId, attempt);
				} else {
					logger.debug("Query on {} returned {} rows (customer={})", query.resource(), rows.size(), customerId);
				}
				return new ReportingQueryResult(rows, current.fields(), excluded, attempt);
			} catch (ReportingApiException ex) {
				if (!ex.isFieldError()) {
					throw ex;
				}
				logger.warn("Query on {} rejected (customer={}, attempt {}/{}, invalidFields={}): {}",
						query.resource(), customerId, attempt, maxAttempts, ex.getInvalidFields(), ex.getMessage());
				if (attempt >= maxAttempts) {
					throw new QueryDegradationExhaustedException(current.fields(), attempt, ex);
				}
				Set<String> toRemove = fieldsToRemove(current, ex);
				if (toRemove.isEmpty() || toRemove.size() >= current.fields().size()) {
					throw new QueryDegradationExhaustedException(current.fields(), attempt, ex);
				}
				excluded.addAll(toRemove);
				current = query.withoutFields(excluded);
				logger.info("Retrying query on {} without {}", query.resource(), toRemove);
			}
		}
	}

	private Set<String> fieldsToRemove(ReportingQuery current, ReportingApiException ex) {
		Set<String> named = new LinkedHashSet<>();
		for (String field : ex.getInvalidFields()) {
			if (current.fields().contains(field)) {
				named.add(field);
			}
		}
		if (!named.isEmpty() || !ex.getInvalidFields().isEmpty()) {
			return named;
		}
		for (String known : policy.knownInvalidFields()) {
			if (current.fields().contains(known)) {
				return Set.of(known);
			}
		}
		return Set.of();
	}
}
