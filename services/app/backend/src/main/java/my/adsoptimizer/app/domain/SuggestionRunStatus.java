package my.adsoptimizer.app.domain;

public enum SuggestionRunStatus {
	RUNNING,
	COMPLETED,
	PARTIAL,
	FAILED
}
