package my.adsoptimizer.app.service;

import my.adsoptimizer.app.domain.ExemplarReference;
import my.adsoptimizer.app.domain.Suggestion;
import my.adsoptimizer.app.domain.SuggestionRun;
import my.adsoptimizer.app.domain.SuggestionRunStatus;
import my.adsoptimizer.app.generation.GeneratedVariant;
import my.adsoptimizer.app.repository.SuggestionRepository;
import my.adsoptimizer.app.repository.SuggestionRunRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Short transactions around a suggestion run. Model calls happen between these steps, outside any
 * transaction.
 */
@Service
public class SuggestionRunRecorder {
	static final int MAX_ERROR_LENGTH = 2000;
	static final int MAX_MESSAGE_LENGTH = 500;

	private final SuggestionRunRepository runRepository;
	private final SuggestionRepository suggestionRepository;

	public SuggestionRunRecorder(SuggestionRunRepository runRepository, SuggestionRepository suggestionRepository) {
		this.runRepository = runRepository;
		this.suggestionRepository = suggestionRepository;
	}

	@Transactional
	public SuggestionRun start(Long accountId) {
		SuggestionRun run = new SuggestionRun();
		run.setAccountId(accountId);
		run.setStatus(SuggestionRunStatus.RUNNING);
		run.setStartedAt(LocalDateTime.now());
		return runRepository.save(run);
	}

	/**
	 * Stores one suggestion per variant, failed variants included, in the order given.
	 */
	@Transactional
	public List<Suggestion> saveVariants(Long creativeId, Long runId, List<GeneratedVariant> variants) {
		LocalDateTime now = LocalDateTime.now();
		List<Suggestion> suggestions = new ArrayList<>(variants.size());
		for (GeneratedVariant variant : variants) {
			List<ExemplarReference> exemplars = new ArrayList<>(variant.exemplarIds().size());
			for (int i = 0; i < variant.exemplarIds().size(); i++) {
				exemplars.add(new ExemplarReference(variant.exemplarIds().get(i), variant.similarityScores().get(i)));
			}
			List<String> messages = variant.validation().messages().stream()
					.map(message -> truncate(message, MAX_MESSAGE_LENGTH))
					.toList();
			suggestions.add(new Suggestion(
					creativeId,
					runId,
					variant.validation().normalized().headlines(),
					variant.validation().normalized().descriptions(),
					exemplars,
					variant.validation().passed(),
					messages,
					variant.promptVersion(),
					variant.model(),
					now));
		}
		return suggestionRepository.saveAll(suggestions);
	}

	@Transactional
	public SuggestionRun finish(Long runId,
								SuggestionRunStatus status,
								int creativesProcessed,
								int suggestionsGenerated,
								String error) {
		SuggestionRun run = runRepository.findById(runId)
				.orElseThrow(() -> new IllegalStateException("Suggestion run " + runId + " disappeared"));
		run.setStatus(status);
		run.setCreativesProcessed(creativesProcessed);
		run.setSuggestionsGenerated(suggestionsGenerated);
		run.setError(error == null ? null : truncate(error, MAX_ERROR_LENGTH));
		run.setFinishedAt(LocalDateTime.now());
		return runRepository.save(run);
	}

	private static String truncate(String value, int max) {
		return value.length() <= max ? value : value.substring(0, max);
	}
}
