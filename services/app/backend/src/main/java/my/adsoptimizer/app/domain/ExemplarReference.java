package my.adsoptimizer.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class ExemplarReference {
	@Column(name = "exemplar_creative_id", nullable = false)
	private Long exemplarCreativeId;

	@Column(name = "similarity_score", nullable = false)
	private double similarityScore;

	protected ExemplarReference() {
	}

	public ExemplarReference(Long exemplarCreativeId, double similarityScore) {
		this.exemplarCreativeId = exemplarCreativeId;
		this.similarityScore = similarityScore;
	}

	public Long getExemplarCreativeId() {
		return exemplarCreativeId;
	}

	public double getSimilarityScore() {
		return similarityScore;
	}
}
