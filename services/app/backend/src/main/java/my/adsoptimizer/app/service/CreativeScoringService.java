package my.adsoptimizer.app.service;

import my.adsoptimizer.app.config.AppProperties;
import my.adsoptimizer.app.dto.ScoringResultDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-flight scoring per account. Runs for different accounts proceed in parallel; a second run
 * for the same account waits up to the configured timeout and then fails.
 */
@Service
public class CreativeScoringService {
	private static final Logger logger = LoggerFactory.getLogger(CreativeScoringService.class);
	private static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(60);

	private final CreativeScoringWriter scoringWriter;
	private final Duration lockTimeout;
	private final Map<Long, ReentrantLock> accountLocks = new ConcurrentHashMap<>();

	public CreativeScoringService(CreativeScoringWriter scoringWriter, AppProperties properties) {
		this.scoringWriter = scoringWriter;
		Integer seconds = properties == null || properties.optimizer() == null || properties.optimizer().scoring() == null
				? null
				: properties.optimizer().scoring().lockTimeoutSeconds();
		this.lockTimeout = seconds == null ? DEFAULT_LOCK_TIMEOUT : Duration.ofSeconds(Math.max(0, seconds));
	}

	public ScoringResultDto score(Long accountId) {
		if (accountId == null) {
			throw new IllegalArgumentException("accountId is required");
		}
		ReentrantLock lock = accountLocks.computeIfAbsent(accountId, id -> new ReentrantLock());
		boolean acquired;
		try {
			acquired = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new ScoringInProgressException(accountId);
		}
		if (!acquired) {
			logger.warn("Scoring for account {} still running after {}s; rejecting request", accountId, lockTimeout.toSeconds());
			throw new ScoringInProgressException(accountId);
		}
		try {
			ScoringResultDto result = scoringWriter.scoreAccount(accountId);
			logger.info("Scored account {} (best={}, worst={}, unknown={}, belowThreshold={}, population={})",
					accountId, result.best(), result.worst(), result.unknown(), result.belowThreshold(),
					result.scorablePopulation());
			return result;
		} finally {
			lock.unlock();
		}
	}
}
