package my.adsoptimizer.app.repository;

import my.adsoptimizer.app.domain.SuggestionRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SuggestionRunRepository extends JpaRepository<SuggestionRun, Long> {
	List<SuggestionRun> findByAccountIdOrderByStartedAtDesc(Long accountId);
}
