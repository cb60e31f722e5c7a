package my.adsoptimizer.app.repository;

import my.adsoptimizer.app.domain.Creative;
import my.adsoptimizer.app.domain.CreativeBucket;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CreativeRepository extends JpaRepository<Creative, Long> {
	List<Creative> findByAccountIdAndStatusOrderByCreativeIdAsc(Long accountId, String status);

	List<Creative> findByAccountIdOrderByCreativeIdAsc(Long accountId);

	List<Creative> findByAccountIdAndBucketOrderByBucketScoreDescCreativeIdAsc(Long accountId,
																			   CreativeBucket bucket,
																			   Pageable pageable);

	List<Creative> findByAccountIdAndBucketOrderByBucketScoreAscCreativeIdAsc(Long accountId,
																			  CreativeBucket bucket,
																			  Pageable pageable);

	Optional<Creative> findByAccountIdAndExternalAdId(Long accountId, String externalAdId);
}
