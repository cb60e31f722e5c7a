package my.adsoptimizer.app.scoring;

import my.adsoptimizer.app.domain.CreativeBucket;

public record CreativeScore(long creativeId,
							CreativeBucket bucket,
							Double score,
							String explanation,
							ScoreBreakdown breakdown,
							boolean belowThreshold) {
}
