package my.adsoptimizer.app.service;

import my.adsoptimizer.app.domain.Creative;
import my.adsoptimizer.app.domain.CreativeMetrics;
import my.adsoptimizer.app.dto.MetricsSyncResultDto;
import my.adsoptimizer.app.reporting.ReportingQuery;
import my.adsoptimizer.app.reporting.ReportingQueryResult;
import my.adsoptimizer.app.reporting.ReportingRow;
import my.adsoptimizer.app.reporting.ResilientQueryExecutor;
import my.adsoptimizer.app.repository.CreativeMetricsRepository;
import my.adsoptimizer.app.repository.CreativeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls ad-level metrics for one account over a trailing window and upserts the creatives and their
 * metric snapshots. A metric whose field was dropped from the query is stored as {@code null}.
 * Impressions and clicks have no such representation: when either was dropped the creatives are
 * still refreshed but no snapshot is written, so the previous one (if any) stays in place.
 */
@Service
public class MetricsIngestionService {
	private static final Logger logger = LoggerFactory.getLogger(MetricsIngestionService.class);

	public static final int DEFAULT_WINDOW_DAYS = 90;
	static final String FIELD_AD_ID = "ad_group_ad.ad.id";
	static final String FIELD_STATUS = "ad_group_ad.status";
	static final String FIELD_HEADLINES = "ad_group_ad.ad.responsive_search_ad.headlines";
	static final String FIELD_DESCRIPTIONS = "ad_group_ad.ad.responsive_search_ad.descriptions";
	static final String FIELD_IMPRESSIONS = "metrics.impressions";
	static final String FIELD_CLICKS = "metrics.clicks";
	static final String FIELD_COST_MICROS = "metrics.cost_micros";
	static final String FIELD_CONVERSIONS = "metrics.conversions";

	private static final List<String> WINDOW_FIELDS = List.of(
			FIELD_AD_ID,
			"ad_group_ad.ad.type",
			FIELD_STATUS,
			FIELD_HEADLINES,
			FIELD_DESCRIPTIONS,
			"ad_group.id",
			"campaign.id",
			FIELD_IMPRESSIONS,
			FIELD_CLICKS,
			FIELD_COST_MICROS,
			"metrics.ctr",
			FIELD_CONVERSIONS,
			"metrics.conversion_rate",
			"metrics.cost_per_conversion");

	private final ResilientQueryExecutor queryExecutor;
	private final CreativeRepository creativeRepository;
	private final CreativeMetricsRepository metricsRepository;

	public MetricsIngestionService(ResilientQueryExecutor queryExecutor,
								   CreativeRepository creativeRepository,
								   CreativeMetricsRepository metricsRepository) {
		this.queryExecutor = queryExecutor;
		this.creativeRepository = creativeRepository;
		this.metricsRepository = metricsRepository;
	}

	static ReportingQuery windowQuery(LocalDate start, LocalDate end) {
		return new ReportingQuery("ad_group_ad", WINDOW_FIELDS,
				"ad_group_ad.status = 'ENABLED' AND segments.date BETWEEN '" + start + "' AND '" + end + "'");
	}

	@Transactional
	public MetricsSyncResultDto sync(Long accountId, String customerId, Integer days) {
		if (accountId == null) {
			throw new IllegalArgumentException("accountId is required");
		}
		if (customerId == null || customerId.isBlank()) {
			throw new IllegalArgumentException("customerId is required");
		}
		int window = days == null ? DEFAULT_WINDOW_DAYS : days;
		if (window < 1) {
			throw new IllegalArgumentException("days must be at least 1");
		}
		LocalDate end = LocalDate.now();
		LocalDate start = end.minusDays(window);
		ReportingQueryResult result = queryExecutor.execute(customerId, windowQuery(start, end));

		boolean volumeCollected = result.isCollected(FIELD_IMPRESSIONS) && result.isCollected(FIELD_CLICKS);
		if (!volumeCollected) {
			logger.warn("Metrics sync for account {} could not collect impressions/clicks; metric snapshots not written",
					accountId);
		}

		Map<String, AdAggregate> ads = new LinkedHashMap<>();
		for (ReportingRow row : result.rows()) {
			String adId = row.text(FIELD_AD_ID);
			if (adId == null || adId.isBlank()) {
				continue;
			}
			ads.computeIfAbsent(adId, AdAggregate::new).add(row, result);
		}

		LocalDateTime now = LocalDateTime.now();
		int created = 0;
		int updated = 0;
		int metricsWritten = 0;
		for (AdAggregate ad : ads.values()) {
			Creative creative = creativeRepository.findByAccountIdAndExternalAdId(accountId, ad.adId).orElse(null);
			if (creative == null) {
				creative = new Creative();
				creative.setAccountId(accountId);
				creative.setExternalAdId(ad.adId);
				created++;
			} else {
				updated++;
			}
			creative.setStatus(ad.status == null ? "ENABLED" : ad.status);
			if (ad.headlines != null) {
				creative.setHeadlines(ad.headlines);
			}
			if (ad.descriptions != null) {
				creative.setDescriptions(ad.descriptions);
			}
			creative.setUpdatedAt(now);
			creative = creativeRepository.save(creative);
			if (!volumeCollected) {
				continue;
			}

			CreativeMetrics metrics = metricsRepository.findById(creative.getCreativeId()).orElseGet(CreativeMetrics::new);
			metrics.setCreativeId(creative.getCreativeId());
			metrics.setImpressions(ad.impressions);
			metrics.setClicks(ad.clicks);
			metrics.setConversions(ad.conversions);
			metrics.setCostMicros(ad.costMicros);
			metrics.setPeriodStart(start);
			metrics.setPeriodEnd(end);
			metrics.setCollectedAt(now);
			metricsRepository.save(metrics);
			metricsWritten++;
		}

		if (result.isDegraded()) {
			logger.warn("Metrics sync for account {} ran without fields {}", accountId, result.removedFields());
		}
		logger.info("Metrics sync for account {} finished (ads={}, created={}, updated={}, metrics={}, attempts={})",
				accountId, ads.size(), created, updated, metricsWritten, result.attempts());
		return new MetricsSyncResultDto(accountId, ads.size(), created, updated, metricsWritten,
				List.copyOf(result.removedFields()), result.attempts(), start, end);
	}

	static List<String> assetTexts(List<?> assets) {
		List<String> texts = new ArrayList<>();
		for (Object asset : assets) {
			if (asset instanceof Map<?, ?> map && map.get("text") != null) {
				texts.add(map.get("text").toString());
			} else if (asset instanceof String text) {
				texts.add(text);
			}
		}
		return texts;
	}

	// The REST API omits zero-valued metrics, so a collected field missing from a row counts as zero.
	// Volume totals are only read when both volume fields were collected.
	private static final class AdAggregate {
		private final String adId;
		private String status;
		private List<String> headlines;
		private List<String> descriptions;
		private long impressions;
		private long clicks;
		private Double conversions;
		private Long costMicros;

		private AdAggregate(String adId) {
			this.adId = adId;
		}

		private void add(ReportingRow row, ReportingQueryResult result) {
			if (row.has(FIELD_STATUS)) {
				status = row.text(FIELD_STATUS);
			}
			if (result.isCollected(FIELD_HEADLINES) && headlines == null) {
				headlines = assetTexts(row.list(FIELD_HEADLINES));
			}
			if (result.isCollected(FIELD_DESCRIPTIONS) && descriptions == null) {
				descriptions = assetTexts(row.list(FIELD_DESCRIPTIONS));
			}
			impressions += valueOrZero(row.longValue(FIELD_IMPRESSIONS));
			clicks += valueOrZero(row.longValue(FIELD_CLICKS));
			if (result.isCollected(FIELD_CONVERSIONS)) {
				Double value = row.doubleValue(FIELD_CONVERSIONS);
				conversions = (conversions == null ? 0.0 : conversions) + (value == null ? 0.0 : value);
			}
			if (result.isCollected(FIELD_COST_MICROS)) {
				costMicros = (costMicros == null ? 0L : costMicros) + valueOrZero(row.longValue(FIELD_COST_MICROS));
			}
		}

		private static long valueOrZero(Long value) {
			return value == null ? 0L : value;
		}
	}
}
