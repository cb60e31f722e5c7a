package my.adsoptimizer.app.generation;

public class GenerationParseException extends RuntimeException {
	private final int expectedVariants;
	private final int parsedVariants;

	public GenerationParseException(String message, int expectedVariants, int parsedVariants) {
		super(message);
		this.expectedVariants = expectedVariants;
		this.parsedVariants = parsedVariants;
	}

	public int getExpectedVariants() {
		return expectedVariants;
	}

	public int getParsedVariants() {
		return parsedVariants;
	}
}
