package my.adsoptimizer.app.service;

/**
 * Another scoring pass for the same account held the lock past the configured wait.
 */
public class ScoringInProgressException extends RuntimeException {
	private final Long accountId;

	public ScoringInProgressException(Long accountId) {
		super("Scoring already in progress for account " + accountId);
		this.accountId = accountId;
	}

	public Long getAccountId() {
		return accountId;
	}
}
