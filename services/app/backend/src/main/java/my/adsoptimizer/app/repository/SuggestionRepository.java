package my.adsoptimizer.app.repository;

import my.adsoptimizer.app.domain.Suggestion;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SuggestionRepository extends JpaRepository<Suggestion, Long> {
	List<Suggestion> findByCreativeIdOrderByCreatedAtDescSuggestionIdDesc(Long creativeId);

	List<Suggestion> findByRunIdOrderBySuggestionIdAsc(Long runId);
}
