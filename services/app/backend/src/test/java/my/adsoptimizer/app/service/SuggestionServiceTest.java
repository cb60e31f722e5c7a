package my.adsoptimizer.app.service;

import my.adsoptimizer.app.config.AppProperties;
import my.adsoptimizer.app.domain.Creative;
import my.adsoptimizer.app.domain.CreativeBucket;
import my.adsoptimizer.app.domain.ExemplarReference;
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
import my.adsoptimizer.app.llm.LlmRequestException;
import my.adsoptimizer.app.repository.CreativeRepository;
import my.adsoptimizer.app.repository.SuggestionRepository;
import my.adsoptimizer.app.repository.SuggestionRunRepository;
import my.adsoptimizer.app.validation.CreativeVariant;
import my.adsoptimizer.app.validation.CreativeVariantValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static my.adsoptimizer.app.support.CreativeFixtures.creative;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SuggestionServiceTest {
	private static final Long RUN_ID = 50L;

	@Mock
	private CreativeRepository creativeRepository;

	@Mock
	private SuggestionRepository suggestionRepository;

	@Mock
	private SuggestionRunRepository runRepository;

	@Mock
	private SuggestionRunRecorder recorder;

	@Mock
	private SimilarCreativeRetriever retriever;

	@Mock
	private SuggestionGenerator generator;

	private final Creative exemplar = creative(9L, CreativeBucket.BEST);
	private final List<Creative> bestPool = List.of(exemplar);

	@BeforeEach
	void setUp() {
		exemplar.setBucketScore(0.95);
	}

	@Test
	void generatesAndStoresVariantsForOneCreative() {
		Creative target = creative(1L, CreativeBucket.WORST);
		when(creativeRepository.findById(1L)).thenReturn(Optional.of(target));
		when(recorder.start(1L)).thenReturn(run(SuggestionRunStatus.RUNNING));
		stubPool();
		List<ScoredExemplar> exemplars = List.of(new ScoredExemplar(exemplar, 0.88));
		when(retriever.findSimilar(target, bestPool, 4)).thenReturn(exemplars);
		List<GeneratedVariant> variants = List.of(variant(), variant());
		when(generator.generate(target, exemplars, 2)).thenReturn(variants);
		when(recorder.saveVariants(1L, RUN_ID, variants)).thenReturn(List.of(suggestion(1L), suggestion(1L)));

		List<SuggestionDto> result = service(false).generateForCreative(1L, new SuggestionRequestDto(2, 4));

		assertThat(result).hasSize(2);
		assertThat(result.get(0).exemplarIds()).containsExactly(9L);
		assertThat(result.get(0).similarityScores()).containsExactly(0.88);
		verify(recorder).finish(RUN_ID, SuggestionRunStatus.COMPLETED, 1, 2, null);
	}

	@Test
	void emptyBestPoolFailsWithNoExemplarsAndMarksRunFailed() {
		Creative target = creative(1L, CreativeBucket.WORST);
		when(creativeRepository.findById(1L)).thenReturn(Optional.of(target));
		when(recorder.start(1L)).thenReturn(run(SuggestionRunStatus.RUNNING));
		when(creativeRepository.findByAccountIdAndBucketOrderByBucketScoreDescCreativeIdAsc(1L, CreativeBucket.BEST,
				PageRequest.of(0, GenerationPolicy.DEFAULT_BEST_POOL_LIMIT))).thenReturn(List.of());
		when(retriever.findSimilar(target, List.of(), GenerationPolicy.DEFAULT_TOP_K)).thenReturn(List.of());

		assertThatThrownBy(() -> service(false).generateForCreative(1L, null))
				.isInstanceOf(NoExemplarsAvailableException.class);
		verifyNoInteractions(generator);
		verify(recorder).finish(eq(RUN_ID), eq(SuggestionRunStatus.FAILED), eq(1), eq(0), startsWith("creative 1: "));
	}

	@Test
	void unknownCreativeIsNotFound() {
		when(creativeRepository.findById(3L)).thenReturn(Optional.empty());

		assertThatThrownBy(() -> service(false).generateForCreative(3L, null))
				.isInstanceOf(CreativeNotFoundException.class);
		verifyNoInteractions(recorder);
	}

	@Test
	void batchContinuesPastFailuresAndEndsPartial() {
		Creative first = creative(1L, CreativeBucket.WORST);
		Creative second = creative(2L, CreativeBucket.WORST);
		when(creativeRepository.findByAccountIdAndBucketOrderByBucketScoreAscCreativeIdAsc(1L, CreativeBucket.WORST,
				PageRequest.of(0, 2))).thenReturn(List.of(first, second));
		when(recorder.start(1L)).thenReturn(run(SuggestionRunStatus.RUNNING));
		stubPool();
		List<ScoredExemplar> exemplars = List.of(new ScoredExemplar(exemplar, 0.7));
		when(retriever.findSimilar(any(Creative.class), eq(bestPool), eq(GenerationPolicy.DEFAULT_TOP_K))).thenReturn(exemplars);
		List<GeneratedVariant> variants = List.of(variant());
		when(generator.generate(first, exemplars, GenerationPolicy.DEFAULT_NUM_VARIANTS))
				.thenThrow(new LlmRequestException("upstream timeout", 504, true, null));
		when(generator.generate(second, exemplars, GenerationPolicy.DEFAULT_NUM_VARIANTS)).thenReturn(variants);
		when(recorder.saveVariants(2L, RUN_ID, variants)).thenReturn(List.of(suggestion(2L)));
		when(recorder.finish(eq(RUN_ID), any(), anyInt(), anyInt(), any())).thenAnswer(invocation -> {
			SuggestionRun finished = run(invocation.getArgument(1));
			finished.setCreativesProcessed(invocation.getArgument(2));
			finished.setSuggestionsGenerated(invocation.getArgument(3));
			finished.setError(invocation.getArgument(4));
			return finished;
		});

		SuggestionRunDto result = service(false).runBatch(1L, new SuggestionRunRequestDto(2));

		assertThat(result.status()).isEqualTo(SuggestionRunStatus.PARTIAL);
		assertThat(result.creativesProcessed()).isEqualTo(2);
		assertThat(result.suggestionsGenerated()).isEqualTo(1);
		assertThat(result.error()).isEqualTo("creative 1: upstream timeout");
	}

	@Test
	void batchStopsWhenNoExemplarsExist() {
		Creative first = creative(1L, CreativeBucket.WORST);
		Creative second = creative(2L, CreativeBucket.WORST);
		Creative third = creative(3L, CreativeBucket.WORST);
		when(creativeRepository.findByAccountIdAndBucketOrderByBucketScoreAscCreativeIdAsc(1L, CreativeBucket.WORST,
				PageRequest.of(0, SuggestionService.DEFAULT_BATCH_SIZE))).thenReturn(List.of(first, second, third));
		when(recorder.start(1L)).thenReturn(run(SuggestionRunStatus.RUNNING));
		when(creativeRepository.findByAccountIdAndBucketOrderByBucketScoreDescCreativeIdAsc(1L, CreativeBucket.BEST,
				PageRequest.of(0, GenerationPolicy.DEFAULT_BEST_POOL_LIMIT))).thenReturn(List.of());
		when(retriever.findSimilar(first, List.of(), GenerationPolicy.DEFAULT_TOP_K)).thenReturn(List.of());
		when(recorder.finish(eq(RUN_ID), any(), anyInt(), anyInt(), any())).thenAnswer(invocation -> {
			SuggestionRun finished = run(invocation.getArgument(1));
			finished.setCreativesProcessed(invocation.getArgument(2));
			finished.setError(invocation.getArgument(4));
			return finished;
		});

		SuggestionRunDto result = service(false).runBatch(1L, null);

		assertThat(result.status()).isEqualTo(SuggestionRunStatus.FAILED);
		assertThat(result.creativesProcessed()).isEqualTo(3);
		assertThat(result.error()).contains("creative 2: skipped, no exemplars", "creative 3: skipped, no exemplars");
		verify(retriever, never()).findSimilar(eq(second), anyList(), anyInt());
		verifyNoInteractions(generator);
	}

	@Test
	void batchWithoutWorstCreativesCompletesEmpty() {
		when(creativeRepository.findByAccountIdAndBucketOrderByBucketScoreAscCreativeIdAsc(1L, CreativeBucket.WORST,
				PageRequest.of(0, SuggestionService.DEFAULT_BATCH_SIZE))).thenReturn(List.of());
		when(recorder.start(1L)).thenReturn(run(SuggestionRunStatus.RUNNING));
		when(recorder.finish(RUN_ID, SuggestionRunStatus.COMPLETED, 0, 0, null)).thenReturn(run(SuggestionRunStatus.COMPLETED));

		assertThat(service(false).runBatch(1L, new SuggestionRunRequestDto(null)).status())
				.isEqualTo(SuggestionRunStatus.COMPLETED);
	}

	@Test
	void applyIsRejectedWhileFeatureIsOff() {
		assertThatThrownBy(() -> service(false).apply(5L)).isInstanceOf(FeatureDisabledException.class);
		verifyNoInteractions(suggestionRepository);
	}

	@Test
	void enabledApplyReportsNotImplementedWithoutChanges() {
		when(suggestionRepository.existsById(5L)).thenReturn(true);

		ApplySuggestionResponseDto response = service(true).apply(5L);

		assertThat(response.success()).isFalse();
		assertThat(response.message()).isEqualTo(SuggestionService.APPLY_NOT_IMPLEMENTED);
		verify(suggestionRepository, never()).save(any());
	}

	@Test
	void applyOfUnknownSuggestionIsNotFound() {
		when(suggestionRepository.existsById(anyLong())).thenReturn(false);

		assertThatThrownBy(() -> service(true).apply(6L)).isInstanceOf(CreativeNotFoundException.class);
	}

	@Test
	void historyRequiresExistingCreative() {
		when(creativeRepository.existsById(8L)).thenReturn(false);

		assertThatThrownBy(() -> service(false).history(8L)).isInstanceOf(CreativeNotFoundException.class);
		verifyNoInteractions(suggestionRepository);
	}

	private void stubPool() {
		when(creativeRepository.findByAccountIdAndBucketOrderByBucketScoreDescCreativeIdAsc(1L, CreativeBucket.BEST,
				PageRequest.of(0, GenerationPolicy.DEFAULT_BEST_POOL_LIMIT))).thenReturn(bestPool);
	}

	private SuggestionService service(boolean applyEnabled) {
		AppProperties properties = new AppProperties(null, null, null, null, new AppProperties.Features(applyEnabled));
		return new SuggestionService(creativeRepository, suggestionRepository, runRepository, recorder, retriever,
				generator, GenerationPolicy.defaults(), properties);
	}

	private static SuggestionRun run(SuggestionRunStatus status) {
		SuggestionRun run = new SuggestionRun();
		run.setRunId(RUN_ID);
		run.setAccountId(1L);
		run.setStatus(status);
		run.setStartedAt(LocalDateTime.now());
		return run;
	}

	private static GeneratedVariant variant() {
		CreativeVariant raw = new CreativeVariant(List.of("Fresh Bread Daily", "Order Online Now", "Local Favorites"),
				List.of("Baked every morning.", "Free delivery over $20."));
		return new GeneratedVariant(raw, new CreativeVariantValidator().validate(raw), List.of(9L), List.of(0.88),
				"v1.0", "gpt-test");
	}

	private static Suggestion suggestion(Long creativeId) {
		return new Suggestion(creativeId, RUN_ID, List.of("Fresh Bread Daily", "Order Online Now", "Local Favorites"),
				List.of("Baked every morning.", "Free delivery over $20."), List.of(new ExemplarReference(9L, 0.88)),
				true, List.of(), "v1.0", "gpt-test", LocalDateTime.now());
	}
}
