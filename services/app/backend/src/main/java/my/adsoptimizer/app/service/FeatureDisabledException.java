package my.adsoptimizer.app.service;

public class FeatureDisabledException extends RuntimeException {
	public FeatureDisabledException(String message) {
		super(message);
	}
}
