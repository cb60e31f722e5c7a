package my.adsoptimizer.app.domain;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A generated creative variant. Rows are written once and never updated; a newer suggestion for the
 * same creative supersedes older ones.
 */
@Entity
@Table(name = "suggestions")
public class Suggestion {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "suggestion_id")
	private Long suggestionId;

	@Column(name = "creative_id", nullable = false, updatable = false)
	private Long creativeId;

	@Column(name = "run_id", updatable = false)
	private Long runId;

	@ElementCollection(fetch = FetchType.EAGER)
	@CollectionTable(name = "suggestion_headlines", joinColumns = @JoinColumn(name = "suggestion_id"))
	@OrderColumn(name = "position")
	@Column(name = "text", nullable = false)
	private List<String> headlines = new ArrayList<>();

	@ElementCollection(fetch = FetchType.EAGER)
	@CollectionTable(name = "suggestion_descriptions", joinColumns = @JoinColumn(name = "suggestion_id"))
	@OrderColumn(name = "position")
	@Column(name = "text", nullable = false)
	private List<String> descriptions = new ArrayList<>();

	@ElementCollection(fetch = FetchType.EAGER)
	@CollectionTable(name = "suggestion_exemplars", joinColumns = @JoinColumn(name = "suggestion_id"))
	@OrderColumn(name = "position")
	private List<ExemplarReference> exemplars = new ArrayList<>();

	@Column(name = "validation_passed", nullable = false, updatable = false)
	private boolean validationPassed;

	@ElementCollection(fetch = FetchType.EAGER)
	@CollectionTable(name = "suggestion_validation_errors", joinColumns = @JoinColumn(name = "suggestion_id"))
	@OrderColumn(name = "position")
	@Column(name = "message", nullable = false, length = 500)
	private List<String> validationErrors = new ArrayList<>();

	@Column(name = "prompt_version", nullable = false, updatable = false)
	private String promptVersion;

	@Column(name = "model_used", nullable = false, updatable = false)
	private String modelUsed;

	@Column(name = "created_at", nullable = false, updatable = false)
	private LocalDateTime createdAt;

	protected Suggestion() {
	}

	public Suggestion(Long creativeId,
					  Long runId,
					  List<String> headlines,
					  List<String> descriptions,
					  List<ExemplarReference> exemplars,
					  boolean validationPassed,
					  List<String> validationErrors,
					  String promptVersion,
					  String modelUsed,
					  LocalDateTime createdAt) {
		this.creativeId = creativeId;
		this.runId = runId;
		this.headlines = new ArrayList<>(headlines);
		this.descriptions = new ArrayList<>(descriptions);
		this.exemplars = new ArrayList<>(exemplars);
		this.validationPassed = validationPassed;
		this.validationErrors = new ArrayList<>(validationErrors);
		this.promptVersion = promptVersion;
		this.modelUsed = modelUsed;
		this.createdAt = createdAt;
	}

	public Long getSuggestionId() {
		return suggestionId;
	}

	public Long getCreativeId() {
		return creativeId;
	}

	public Long getRunId() {
		return runId;
	}

	public List<String> getHeadlines() {
		return List.copyOf(headlines);
	}

	public List<String> getDescriptions() {
		return List.copyOf(descriptions);
	}

	public List<ExemplarReference> getExemplars() {
		return List.copyOf(exemplars);
	}

	public List<Long> getExemplarIds() {
		return exemplars.stream().map(ExemplarReference::getExemplarCreativeId).toList();
	}

	public List<Double> getSimilarityScores() {
		return exemplars.stream().map(ExemplarReference::getSimilarityScore).toList();
	}

	public boolean isValidationPassed() {
		return validationPassed;
	}

	public List<String> getValidationErrors() {
		return List.copyOf(validationErrors);
	}

	public String getPromptVersion() {
		return promptVersion;
	}

	public String getModelUsed() {
		return modelUsed;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}
}
