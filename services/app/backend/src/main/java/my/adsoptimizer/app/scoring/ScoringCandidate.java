package my.adsoptimizer.app.scoring;

public record ScoringCandidate(long creativeId, MetricSnapshot metrics) {
}
