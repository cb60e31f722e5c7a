package my.adsoptimizer.app.domain;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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

@Entity
@Table(name = "creatives")
public class Creative {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "creative_id")
	private Long creativeId;

	@Column(name = "account_id", nullable = false)
	private Long accountId;

	@Column(name = "external_ad_id", nullable = false)
	private String externalAdId;

	@Column(name = "status", nullable = false)
	private String status;

	@ElementCollection(fetch = FetchType.EAGER)
	@CollectionTable(name = "creative_headlines", joinColumns = @JoinColumn(name = "creative_id"))
	@OrderColumn(name = "position")
	@Column(name = "text", nullable = false)
	private List<String> headlines = new ArrayList<>();

	@ElementCollection(fetch = FetchType.EAGER)
	@CollectionTable(name = "creative_descriptions", joinColumns = @JoinColumn(name = "creative_id"))
	@OrderColumn(name = "position")
	@Column(name = "text", nullable = false)
	private List<String> descriptions = new ArrayList<>();

	@Enumerated(EnumType.STRING)
	@Column(name = "bucket", nullable = false)
	private CreativeBucket bucket = CreativeBucket.UNKNOWN;

	@Column(name = "bucket_score")
	private Double bucketScore;

	@Column(name = "bucket_explanation", length = 2000)
	private String bucketExplanation;

	@Column(name = "scored_at")
	private LocalDateTime scoredAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public Long getCreativeId() {
		return creativeId;
	}

	public void setCreativeId(Long creativeId) {
		this.creativeId = creativeId;
	}

	public Long getAccountId() {
		return accountId;
	}

	public void setAccountId(Long accountId) {
		this.accountId = accountId;
	}

	public String getExternalAdId() {
		return externalAdId;
	}

	public void setExternalAdId(String externalAdId) {
		this.externalAdId = externalAdId;
	}

	public String getStatus() {
		return status;
	}

	public void setStatus(String status) {
		this.status = status;
	}

	public List<String> getHeadlines() {
		return headlines;
	}

	public void setHeadlines(List<String> headlines) {
		this.headlines = headlines == null ? new ArrayList<>() : new ArrayList<>(headlines);
	}

	public List<String> getDescriptions() {
		return descriptions;
	}

	public void setDescriptions(List<String> descriptions) {
		this.descriptions = descriptions == null ? new ArrayList<>() : new ArrayList<>(descriptions);
	}

	public CreativeBucket getBucket() {
		return bucket;
	}

	public void setBucket(CreativeBucket bucket) {
		this.bucket = bucket;
	}

	public Double getBucketScore() {
		return bucketScore;
	}

	public void setBucketScore(Double bucketScore) {
		this.bucketScore = bucketScore;
	}

	public String getBucketExplanation() {
		return bucketExplanation;
	}

	public void setBucketExplanation(String bucketExplanation) {
		this.bucketExplanation = bucketExplanation;
	}

	public LocalDateTime getScoredAt() {
		return scoredAt;
	}

	public void setScoredAt(LocalDateTime scoredAt) {
		this.scoredAt = scoredAt;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}
}
