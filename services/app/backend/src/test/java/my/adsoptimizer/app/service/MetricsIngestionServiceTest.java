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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricsIngestionServiceTest {
	@Mock
	private ResilientQueryExecutor queryExecutor;

	@Mock
	private CreativeRepository creativeRepository;

	@Mock
	private CreativeMetricsRepository metricsRepository;

	@Test
	void degradedQueryLeavesRemovedMetricsUncollected() {
		ReportingQuery query = MetricsIngestionService.windowQuery(LocalDate.now().minusDays(30), LocalDate.now());
		ReportingQuery narrowed = query.withoutFields(List.of(MetricsIngestionService.FIELD_CONVERSIONS));
		Map<String, Object> values = new HashMap<>();
		values.put(MetricsIngestionService.FIELD_AD_ID, "11");
		values.put(MetricsIngestionService.FIELD_STATUS, "ENABLED");
		values.put(MetricsIngestionService.FIELD_HEADLINES, List.of(Map.of("text", "Fresh Bread"), Map.of("text", "Order Now")));
		values.put(MetricsIngestionService.FIELD_DESCRIPTIONS, List.of(Map.of("text", "Baked daily.")));
		values.put(MetricsIngestionService.FIELD_IMPRESSIONS, "1000");
		values.put(MetricsIngestionService.FIELD_CLICKS, "50");
		when(queryExecutor.execute(eq("123-456-7890"), any(ReportingQuery.class))).thenReturn(new ReportingQueryResult(
				List.of(new ReportingRow(values)), narrowed.fields(), Set.of(MetricsIngestionService.FIELD_CONVERSIONS), 2));
		when(creativeRepository.findByAccountIdAndExternalAdId(1L, "11")).thenReturn(Optional.empty());
		when(creativeRepository.save(any(Creative.class))).thenAnswer(invocation -> {
			Creative creative = invocation.getArgument(0);
			creative.setCreativeId(100L);
			return creative;
		});
		when(metricsRepository.findById(100L)).thenReturn(Optional.empty());

		MetricsSyncResultDto result = service().sync(1L, "123-456-7890", 30);

		assertThat(result.adsRead()).isEqualTo(1);
		assertThat(result.creativesCreated()).isEqualTo(1);
		assertThat(result.removedFields()).containsExactly(MetricsIngestionService.FIELD_CONVERSIONS);
		assertThat(result.attempts()).isEqualTo(2);
		assertThat(result.metricsWritten()).isEqualTo(1);
		assertThat(result.periodEnd()).isEqualTo(result.periodStart().plusDays(30));

		ArgumentCaptor<CreativeMetrics> saved = ArgumentCaptor.forClass(CreativeMetrics.class);
		verify(metricsRepository).save(saved.capture());
		CreativeMetrics metrics = saved.getValue();
		assertThat(metrics.getCreativeId()).isEqualTo(100L);
		assertThat(metrics.getImpressions()).isEqualTo(1000L);
		assertThat(metrics.getClicks()).isEqualTo(50L);
		assertThat(metrics.getConversions()).isNull();
		assertThat(metrics.getCostMicros()).isZero();

		ArgumentCaptor<Creative> creative = ArgumentCaptor.forClass(Creative.class);
		verify(creativeRepository).save(creative.capture());
		assertThat(creative.getValue().getHeadlines()).containsExactly("Fresh Bread", "Order Now");
		assertThat(creative.getValue().getDescriptions()).containsExactly("Baked daily.");
	}

	@Test
	void rowsOfTheSameAdAreSummedAndExistingCreativeIsUpdated() {
		List<ReportingRow> rows = new ArrayList<>();
		rows.add(row("11", "400", "20", "2.0", "1000000"));
		rows.add(row("11", "600", "30", null, "3000000"));
		ReportingQuery query = MetricsIngestionService.windowQuery(LocalDate.now(), LocalDate.now());
		when(queryExecutor.execute(eq("42"), any(ReportingQuery.class)))
				.thenReturn(new ReportingQueryResult(rows, query.fields(), Set.of(), 1));
		Creative existing = new Creative();
		existing.setCreativeId(7L);
		existing.setAccountId(1L);
		existing.setExternalAdId("11");
		existing.setHeadlines(List.of("Old"));
		when(creativeRepository.findByAccountIdAndExternalAdId(1L, "11")).thenReturn(Optional.of(existing));
		when(creativeRepository.save(existing)).thenReturn(existing);
		CreativeMetrics previous = new CreativeMetrics();
		previous.setCreativeId(7L);
		previous.setImpressions(5L);
		when(metricsRepository.findById(7L)).thenReturn(Optional.of(previous));

		MetricsSyncResultDto result = service().sync(1L, "42", null);

		assertThat(result.creativesUpdated()).isEqualTo(1);
		assertThat(result.creativesCreated()).isZero();
		assertThat(result.periodEnd()).isEqualTo(result.periodStart().plusDays(MetricsIngestionService.DEFAULT_WINDOW_DAYS));
		assertThat(previous.getImpressions()).isEqualTo(1000L);
		assertThat(previous.getClicks()).isEqualTo(50L);
		assertThat(previous.getConversions()).isEqualTo(2.0);
		assertThat(previous.getCostMicros()).isEqualTo(4_000_000L);
		assertThat(existing.getHeadlines()).isEmpty();
		verify(metricsRepository, times(1)).save(previous);
	}

	@Test
	void removedVolumeFieldsRefreshCreativesButWriteNoMetrics() {
		ReportingQuery query = MetricsIngestionService.windowQuery(LocalDate.now().minusDays(7), LocalDate.now());
		ReportingQuery narrowed = query.withoutFields(List.of(MetricsIngestionService.FIELD_IMPRESSIONS));
		Map<String, Object> values = new HashMap<>();
		values.put(MetricsIngestionService.FIELD_AD_ID, "11");
		values.put(MetricsIngestionService.FIELD_CLICKS, "50");
		values.put(MetricsIngestionService.FIELD_HEADLINES, List.of(Map.of("text", "Fresh Bread")));
		when(queryExecutor.execute(eq("42"), any(ReportingQuery.class))).thenReturn(new ReportingQueryResult(
				List.of(new ReportingRow(values)), narrowed.fields(), Set.of(MetricsIngestionService.FIELD_IMPRESSIONS), 2));
		Creative existing = new Creative();
		existing.setCreativeId(7L);
		existing.setAccountId(1L);
		existing.setExternalAdId("11");
		when(creativeRepository.findByAccountIdAndExternalAdId(1L, "11")).thenReturn(Optional.of(existing));
		when(creativeRepository.save(existing)).thenReturn(existing);

		MetricsSyncResultDto result = service().sync(1L, "42", 7);

		assertThat(result.adsRead()).isEqualTo(1);
		assertThat(result.creativesUpdated()).isEqualTo(1);
		assertThat(result.metricsWritten()).isZero();
		assertThat(result.removedFields()).containsExactly(MetricsIngestionService.FIELD_IMPRESSIONS);
		assertThat(existing.getHeadlines()).containsExactly("Fresh Bread");
		verifyNoInteractions(metricsRepository);
	}

	@Test
	void rowsWithoutAdIdAreIgnored() {
		ReportingQuery query = MetricsIngestionService.windowQuery(LocalDate.now(), LocalDate.now());
		when(queryExecutor.execute(eq("42"), any(ReportingQuery.class))).thenReturn(new ReportingQueryResult(
				List.of(new ReportingRow(Map.of(MetricsIngestionService.FIELD_IMPRESSIONS, "10"))), query.fields(), Set.of(), 1));

		MetricsSyncResultDto result = service().sync(1L, "42", 7);

		assertThat(result.adsRead()).isZero();
		verifyNoInteractions(creativeRepository, metricsRepository);
	}

	@Test
	void invalidArgumentsAreRejected() {
		assertThatThrownBy(() -> service().sync(null, "42", 7)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> service().sync(1L, " ", 7)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> service().sync(1L, "42", 0)).isInstanceOf(IllegalArgumentException.class);
		verifyNoInteractions(queryExecutor);
	}

	@Test
	void windowQueryFiltersEnabledAdsInDateRange() {
		String gaql = MetricsIngestionService.windowQuery(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31)).toGaql();

		assertThat(gaql).startsWith("SELECT ad_group_ad.ad.id, ")
				.contains(" FROM ad_group_ad WHERE ")
				.endsWith("ad_group_ad.status = 'ENABLED' AND segments.date BETWEEN '2024-01-01' AND '2024-03-31'");
		assertThat(MetricsIngestionService.assetTexts(List.of(Map.of("text", "A"), "B", Map.of("pinned", "X"))))
				.containsExactly("A", "B");
	}

	private MetricsIngestionService service() {
		return new MetricsIngestionService(queryExecutor, creativeRepository, metricsRepository);
	}

	private static ReportingRow row(String adId, String impressions, String clicks, String conversions, String costMicros) {
		Map<String, Object> values = new HashMap<>();
		values.put(MetricsIngestionService.FIELD_AD_ID, adId);
		values.put(MetricsIngestionService.FIELD_IMPRESSIONS, impressions);
		values.put(MetricsIngestionService.FIELD_CLICKS, clicks);
		if (conversions != null) {
			values.put(MetricsIngestionService.FIELD_CONVERSIONS, conversions);
		}
		values.put(MetricsIngestionService.FIELD_COST_MICROS, costMicros);
		return new ReportingRow(values);
	}
}
