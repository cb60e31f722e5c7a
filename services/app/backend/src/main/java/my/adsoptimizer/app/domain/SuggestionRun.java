package my.adsoptimizer.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "suggestion_runs")
public class SuggestionRun {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "run_id")
	private Long runId;

	@Column(name = "account_id", nullable = false)
	private Long accountId;

	@Enumerated(EnumType.STRING)
	@Column(name = "status", nullable = false)
	private SuggestionRunStatus status;

	@Column(name = "creatives_processed", nullable = false)
	private int creativesProcessed;

	@Column(name = "suggestions_generated", nullable = false)
	private int suggestionsGenerated;

	@Column(name = "error", length = 2000)
	private String error;

	@Column(name = "started_at", nullable = false)
	private LocalDateTime startedAt;

	@Column(name = "finished_at")
	private LocalDateTime finishedAt;

	public Long getRunId() {
		return runId;
	}

	public void setRunId(Long runId) {
		this.runId = runId;
	}

	public Long getAccountId() {
		return accountId;
	}

	public void setAccountId(Long accountId) {
		this.accountId = accountId;
	}

	public SuggestionRunStatus getStatus() {
		return status;
	}

	public void setStatus(SuggestionRunStatus status) {
		this.status = status;
	}

	public int getCreativesProcessed() {
		return creativesProcessed;
	}

	public void setCreativesProcessed(int creativesProcessed) {
		this.creativesProcessed = creativesProcessed;
	}

	public int getSuggestionsGenerated() {
		return suggestionsGenerated;
	}

	public void setSuggestionsGenerated(int suggestionsGenerated) {
		this.suggestionsGenerated = suggestionsGenerated;
	}

	public String getError() {
		return error;
	}

	public void setError(String error) {
		this.error = error;
	}

	public LocalDateTime getStartedAt() {
		return startedAt;
	}

	public void setStartedAt(LocalDateTime startedAt) {
		this.startedAt = startedAt;
	}

	public LocalDateTime getFinishedAt() {
		return finishedAt;
	}

	public void setFinishedAt(LocalDateTime finishedAt) {
		this.finishedAt = finishedAt;
	}
}
