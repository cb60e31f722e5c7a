package my.adsoptimizer.app.service;

import my.adsoptimizer.app.config.AppProperties;
import my.adsoptimizer.app.domain.Creative;
import my.adsoptimizer.app.domain.CreativeBucket;
import my.adsoptimizer.app.domain.Suggestion;
import my.adsoptimizer.app.domain.SuggestionRun;
import my.adsoptimizer.app.domain.SuggestionRunStatus;
import my.adsoptimizer.app.dto.ApplySuggestionResponseDto;
import my.adsoptimizer.app.dto.SuggestionDto;
import my.adsoptimizer.app.dto.SuggestionRequestDto;
import my.adsoptimizer.app.dto.SuggestionRunDto;
import my.adsoptimizer.app.dto.SuggestionRunRequestDto;
import my.adsoptimizer.app.embedding.ScoredExemplar;
import my.adsoptimizer.app.embedding.SimilarCreativeRetriever;
import my.adsoptimizer.app.generation.GeneratedVariant;
import my.adsoptimizer.app.generation.GenerationPolicy;
import my.adsoptimizer.app.generation.NoExemplarsAvailableException;
import my.adsoptimizer.app.generation.SuggestionGenerator;
import my.adsoptimizer.app.repository.CreativeRepository;
import my.adsoptimizer.app.repository.SuggestionRepository;
import my.adsoptimizer.app.repository.SuggestionRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class SuggestionService {
	private static final Logger logger = LoggerFactory.getLogger(SuggestionService.class);
	static final int DEFAULT_BATCH_SIZE = 10;
	static final String APPLY_NOT_IMPLEMENTED = "Apply functionality not yet implemented";

	private final CreativeRepository creativeRepository;
	private final SuggestionRepository suggestionRepository;
	private final SuggestionRunRepository runRepository;
	private final SuggestionRunRecorder runRecorder;
	private final SimilarCreativeRetriever retriever;
	private final SuggestionGenerator generator;
	private final GenerationPolicy policy;
	private final AppProperties properties;

	public SuggestionService(CreativeRepository creativeRepository,
							 SuggestionRepository suggestionRepository,
							 SuggestionRunRepository runRepository,
							 SuggestionRunRecorder runRecorder,
							 SimilarCreativeRetriever retriever,
							 SuggestionGenerator generator,
							 GenerationPolicy policy,
							 AppProperties properties) {
		this.creativeRepository = creativeRepository;
		this.suggestionRepository = suggestionRepository;
		this.runRepository = runRepository;
		this.runRecorder = runRecorder;
		this.retriever = retriever;
		this.generator = generator;
		this.policy = policy;
		this.properties = properties;
	}

	/**
	 * Generates and stores suggestions for one creative. The request is recorded as a run of its own;
	 * a failed generation marks that run FAILED and propagates.
	 */
	public List<SuggestionDto> generateForCreative(Long creativeId, SuggestionRequestDto request) {
		Creative creative = creativeRepository.findById(creativeId)
				.orElseThrow(() -> CreativeNotFoundException.creative(creativeId));
		int numVariants = request == null || request.numVariants() == null ? policy.numVariants() : request.numVariants();
		int topK = request == null || request.topK() == null ? policy.topKExemplars() : request.topK();

		SuggestionRun run = runRecorder.start(creative.getAccountId());
		List<Suggestion> saved;
		try {
			saved = generateFor(creative, numVariants, topK, run.getRunId());
		} catch (RuntimeException ex) {
			runRecorder.finish(run.getRunId(), SuggestionRunStatus.FAILED, 1, 0, describe(creative, ex));
			throw ex;
		}
		runRecorder.finish(run.getRunId(), SuggestionRunStatus.COMPLETED, 1, saved.size(), null);
		return saved.stream().map(SuggestionService::toDto).toList();
	}

	/**
	 * Generates suggestions for the lowest-scored WORST creatives of an account. Failures of single
	 * creatives are collected on the run and do not stop the pass.
	 */
	public SuggestionRunDto runBatch(Long accountId, SuggestionRunRequestDto request) {
		if (accountId == null) {
			throw new IllegalArgumentException("accountId is required");
		}
		int maxCreatives = request == null || request.maxCreatives() == null ? DEFAULT_BATCH_SIZE : request.maxCreatives();
		if (maxCreatives < 1) {
			throw new IllegalArgumentException("maxCreatives must be at least 1");
		}
		List<Creative> targets = creativeRepository.findByAccountIdAndBucketOrderByBucketScoreAscCreativeIdAsc(
				accountId, CreativeBucket.WORST, PageRequest.of(0, maxCreatives));
		SuggestionRun run = runRecorder.start(accountId);

		int processed = 0;
		int generated = 0;
		List<String> failures = new ArrayList<>();
		for (Creative target : targets) {
			processed++;
			try {
				generated += generateFor(target, policy.numVariants(), policy.topKExemplars(), run.getRunId()).size();
			} catch (RuntimeException ex) {
				logger.warn("Suggestion run {} failed for creative {}: {}", run.getRunId(), target.getCreativeId(), ex.getMessage());
				failures.add(describe(target, ex));
				if (ex instanceof NoExemplarsAvailableException) {
					// Every remaining creative shares the same empty pool.
					processed += skipRemaining(targets, processed, failures);
					break;
				}
			}
		}

		SuggestionRunStatus status;
		if (failures.isEmpty()) {
			status = SuggestionRunStatus.COMPLETED;
		} else if (generated > 0) {
			status = SuggestionRunStatus.PARTIAL;
		} else {
			status = SuggestionRunStatus.FAILED;
		}
		SuggestionRun finished = runRecorder.finish(run.getRunId(), status, processed, generated,
				failures.isEmpty() ? null : String.join("; ", failures));
		logger.info("Suggestion run {} for account {} finished (status={}, creatives={}, suggestions={})",
				finished.getRunId(), accountId, status, processed, generated);
		return toDto(finished);
	}

	public List<SuggestionRunDto> listRuns(Long accountId) {
		return runRepository.findByAccountIdOrderByStartedAtDesc(accountId).stream()
				.map(SuggestionService::toDto)
				.toList();
	}

	public List<SuggestionDto> history(Long creativeId) {
		if (!creativeRepository.existsById(creativeId)) {
			throw CreativeNotFoundException.creative(creativeId);
		}
		return suggestionRepository.findByCreativeIdOrderByCreatedAtDescSuggestionIdDesc(creativeId).stream()
				.map(SuggestionService::toDto)
				.toList();
	}

	/**
	 * Pushing a suggestion to the ad platform is not supported yet; the stored suggestion is left as is.
	 */
	public ApplySuggestionResponseDto apply(Long suggestionId) {
		boolean enabled = properties != null && properties.features() != null && properties.features().applySuggestions();
		if (!enabled) {
			throw new FeatureDisabledException("Applying suggestions is disabled");
		}
		if (!suggestionRepository.existsById(suggestionId)) {
			throw CreativeNotFoundException.suggestion(suggestionId);
		}
		logger.info("Apply requested for suggestion {}", suggestionId);
		return new ApplySuggestionResponseDto(suggestionId, false, APPLY_NOT_IMPLEMENTED);
	}

	private List<Suggestion> generateFor(Creative target, int numVariants, int topK, Long runId) {
		List<Creative> pool = creativeRepository.findByAccountIdAndBucketOrderByBucketScoreDescCreativeIdAsc(
				target.getAccountId(), CreativeBucket.BEST, PageRequest.of(0, policy.bestPoolLimit()));
		List<ScoredExemplar> exemplars = retriever.findSimilar(target, pool, topK);
		if (exemplars.isEmpty()) {
			throw new NoExemplarsAvailableException(target.getCreativeId());
		}
		List<GeneratedVariant> variants = generator.generate(target, exemplars, numVariants);
		return runRecorder.saveVariants(target.getCreativeId(), runId, variants);
	}

	private int skipRemaining(List<Creative> targets, int processed, List<String> failures) {
		int skipped = 0;
		for (Creative remaining : targets.subList(processed, targets.size())) {
			failures.add("creative " + remaining.getCreativeId() + ": skipped, no exemplars");
			skipped++;
		}
		return skipped;
	}

	private static String describe(Creative creative, RuntimeException ex) {
		String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
		return "creative " + creative.getCreativeId() + ": " + message;
	}

	static SuggestionDto toDto(Suggestion suggestion) {
		return new SuggestionDto(
				suggestion.getSuggestionId(),
				suggestion.getCreativeId(),
				suggestion.getRunId(),
				suggestion.getHeadlines(),
				suggestion.getDescriptions(),
				suggestion.getExemplarIds(),
				suggestion.getSimilarityScores(),
				suggestion.isValidationPassed(),
				suggestion.getValidationErrors(),
				suggestion.getPromptVersion(),
				suggestion.getModelUsed(),
				suggestion.getCreatedAt()
		);
	}

	static SuggestionRunDto toDto(SuggestionRun run) {
		return new SuggestionRunDto(
				run.getRunId(),
				run.getAccountId(),
				run.getStatus(),
				run.getCreativesProcessed(),
				run.getSuggestionsGenerated(),
				run.getError(),
				run.getStartedAt(),
				run.getFinishedAt()
		);
	}
}
