package my.adsoptimizer.app.repository;

import my.adsoptimizer.app.domain.CreativeMetrics;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface CreativeMetricsRepository extends JpaRepository<CreativeMetrics, Long> {
	List<CreativeMetrics> findByCreativeIdIn(Collection<Long> creativeIds);
}
