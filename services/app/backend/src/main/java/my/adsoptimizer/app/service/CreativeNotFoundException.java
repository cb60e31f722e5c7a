package my.adsoptimizer.app.service;

public class CreativeNotFoundException extends RuntimeException {
	public CreativeNotFoundException(String message) {
		super(message);
	}

	public static CreativeNotFoundException creative(Long creativeId) {
		return new CreativeNotFoundException("Creative " + creativeId + " not found");
	}

	public static CreativeNotFoundException suggestion(Long suggestionId) {
		return new CreativeNotFoundException("Suggestion " + suggestionId + " not found");
	}
}
