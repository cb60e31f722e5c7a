package my.adsoptimizer.app.api;

import my.adsoptimizer.app.reporting.QueryDegradationExhaustedException;
import my.adsoptimizer.app.reporting.ReportingApiException;
import my.adsoptimizer.app.service.CreativeQueryService;
import my.adsoptimizer.app.service.CreativeScoringService;
import my.adsoptimizer.app.service.MetricsIngestionService;
import my.adsoptimizer.app.service.ScoringInProgressException;
import my.adsoptimizer.app.service.SuggestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Set;

import static org.hamcrest.Matchers.matchesPattern;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AccountControllerTest {
	@Mock
	private MetricsIngestionService ingestionService;

	@Mock
	private CreativeScoringService scoringService;

	@Mock
	private CreativeQueryService queryService;

	@Mock
	private SuggestionService suggestionService;

	private MockMvc mockMvc;

	@BeforeEach
	void setUp() {
		AccountController controller = new AccountController(ingestionService, scoringService, queryService, suggestionService);
		mockMvc = MockMvcBuilders.standaloneSetup(controller)
				.setControllerAdvice(new RestExceptionHandler())
				.build();
	}

	@Test
	void concurrentScoringMapsToConflict() throws Exception {
		when(scoringService.score(7L)).thenThrow(new ScoringInProgressException(7L));

		mockMvc.perform(post("/api/accounts/7/scoring"))
				.andExpect(status().isConflict())
				.andExpect(jsonPath("$.title").value("Scoring in progress"))
				.andExpect(jsonPath("$.path").value("/api/accounts/7/scoring"));
	}

	@Test
	void exhaustedDegradationReportsLastAttemptedFields() throws Exception {
		ReportingApiException lastError = new ReportingApiException("still invalid", Set.of("metrics.clicks"), true,
				List.of(), null);
		when(ingestionService.sync(eq(1L), eq("42"), any()))
				.thenThrow(new QueryDegradationExhaustedException(List.of("ad_group_ad.ad.id", "metrics.clicks"), 4, lastError));

		mockMvc.perform(post("/api/accounts/1/metrics-sync")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"customerId\":\"42\"}"))
				.andExpect(status().isBadGateway())
				.andExpect(jsonPath("$.attempts").value(4))
				.andExpect(jsonPath("$.lastAttemptedFields[1]").value("metrics.clicks"));
	}

	@Test
	void unexpectedFailureCarriesReference() throws Exception {
		when(suggestionService.runBatch(anyLong(), any())).thenThrow(new IllegalStateException("database gone"));

		mockMvc.perform(post("/api/accounts/1/suggestion-runs"))
				.andExpect(status().isInternalServerError())
				.andExpect(jsonPath("$.reference", matchesPattern("SG-[0-9A-F]{8}")))
				.andExpect(jsonPath("$.detail", matchesPattern("Unexpected error, ref SG-[0-9A-F]{8}")));
	}

	@Test
	void batchSizeIsValidated() throws Exception {
		mockMvc.perform(post("/api/accounts/1/suggestion-runs")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"maxCreatives\":0}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Validation failed"));
	}
}
