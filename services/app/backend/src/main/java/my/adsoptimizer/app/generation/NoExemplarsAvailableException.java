package my.adsoptimizer.app.generation;

public class NoExemplarsAvailableException extends RuntimeException {
	private final Long creativeId;

	public NoExemplarsAvailableException(Long creativeId) {
		super("No best-performing exemplars available for creative " + creativeId + "; run scoring first");
		this.creativeId = creativeId;
	}

	public Long getCreativeId() {
		return creativeId;
	}
}
