package my.adsoptimizer.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Aggregated metrics of one creative over the ingestion window. Nullable columns hold values the
 * reporting API did not return for this account; {@code null} means "not collected", never zero.
 */
@Entity
@Table(name = "creative_metrics")
public class CreativeMetrics {
	@Id
	@Column(name = "creative_id")
	private Long creativeId;

	@Column(name = "impressions", nullable = false)
	private long impressions;

	@Column(name = "clicks", nullable = false)
	private long clicks;

	@Column(name = "conversions")
	private Double conversions;

	@Column(name = "cost_micros")
	private Long costMicros;

	@Column(name = "period_start", nullable = false)
	private LocalDate periodStart;

	@Column(name = "period_end", nullable = false)
	private LocalDate periodEnd;

	@Column(name = "collected_at", nullable = false)
	private LocalDateTime collectedAt;

	public Long getCreativeId() {
		return creativeId;
	}

	public void setCreativeId(Long creativeId) {
		this.creativeId = creativeId;
	}

	public long getImpressions() {
		return impressions;
	}

	public void setImpressions(long impressions) {
		this.impressions = impressions;
	}

	public long getClicks() {
		return clicks;
	}

	public void setClicks(long clicks) {
		this.clicks = clicks;
	}

	public Double getConversions() {
		return conversions;
	}

	public void setConversions(Double conversions) {
		this.conversions = conversions;
	}

	public Long getCostMicros() {
		return costMicros;
	}

	public void setCostMicros(Long costMicros) {
		this.costMicros = costMicros;
	}

	public LocalDate getPeriodStart() {
		return periodStart;
	}

	public void setPeriodStart(LocalDate periodStart) {
		this.periodStart = periodStart;
	}

	public LocalDate getPeriodEnd() {
		return periodEnd;
	}

	public void setPeriodEnd(LocalDate periodEnd) {
		this.periodEnd = periodEnd;
	}

	public LocalDateTime getCollectedAt() {
		return collectedAt;
	}

	public void setCollectedAt(LocalDateTime collectedAt) {
		this.collectedAt = collectedAt;
	}
}
