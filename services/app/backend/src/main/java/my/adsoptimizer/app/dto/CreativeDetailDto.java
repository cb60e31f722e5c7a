package my.adsoptimizer.app.dto;

public record CreativeDetailDto(CreativeSummaryDto creative, CreativeMetricsDto metrics, String performanceExplanation) {
}
