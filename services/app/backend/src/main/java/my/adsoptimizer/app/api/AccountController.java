package my.adsoptimizer.app.api;

import jakarta.validation.Valid;
import my.adsoptimizer.app.domain.CreativeBucket;
import my.adsoptimizer.app.dto.CreativeSummaryDto;
import my.adsoptimizer.app.dto.MetricsSyncRequestDto;
import my.adsoptimizer.app.dto.MetricsSyncResultDto;
import my.adsoptimizer.app.dto.ScoringResultDto;
import my.adsoptimizer.app.dto.SuggestionRunDto;
import my.adsoptimizer.app.dto.SuggestionRunRequestDto;
import my.adsoptimizer.app.service.CreativeQueryService;
import my.adsoptimizer.app.service.CreativeScoringService;
import my.adsoptimizer.app.service.MetricsIngestionService;
import my.adsoptimizer.app.service.SuggestionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/accounts/{accountId}")
public class AccountController {
	private final MetricsIngestionService ingestionService;
	private final CreativeScoringService scoringService;
	private final CreativeQueryService queryService;
	private final SuggestionService suggestionService;

	public AccountController(MetricsIngestionService ingestionService,
							 CreativeScoringService scoringService,
							 CreativeQueryService queryService,
							 SuggestionService suggestionService) {
		this.ingestionService = ingestionService;
		this.scoringService = scoringService;
		this.queryService = queryService;
		this.suggestionService = suggestionService;
	}

	@PostMapping("/metrics-sync")
	public MetricsSyncResultDto syncMetrics(@PathVariable("accountId") Long accountId,
											@Valid @RequestBody MetricsSyncRequestDto request) {
		return ingestionService.sync(accountId, request.customerId(), request.days());
	}

	@PostMapping("/scoring")
	public ScoringResultDto score(@PathVariable("accountId") Long accountId) {
		return scoringService.score(accountId);
	}

	@GetMapping("/creatives")
	public List<CreativeSummaryDto> creatives(@PathVariable("accountId") Long accountId,
											  @RequestParam(name = "bucket", required = false) CreativeBucket bucket,
											  @RequestParam(name = "limit", required = false) Integer limit) {
		return queryService.list(accountId, bucket, limit);
	}

	@PostMapping("/suggestion-runs")
	public SuggestionRunDto runSuggestions(@PathVariable("accountId") Long accountId,
										   @Valid @RequestBody(required = false) SuggestionRunRequestDto request) {
		return suggestionService.runBatch(accountId, request);
	}

	@GetMapping("/suggestion-runs")
	public List<SuggestionRunDto> suggestionRuns(@PathVariable("accountId") Long accountId) {
		return suggestionService.listRuns(accountId);
	}
}
