package my.adsoptimizer.app.embedding;

import my.adsoptimizer.app.domain.Creative;

public record ScoredExemplar(Creative creative, double similarity) {
	public long creativeId() {
		return creative.getCreativeId();
	}
}
