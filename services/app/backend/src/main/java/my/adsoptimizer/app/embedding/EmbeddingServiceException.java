package my.adsoptimizer.app.embedding;

public class EmbeddingServiceException extends RuntimeException {
	public EmbeddingServiceException(String message, Throwable cause) {
		super(message, cause);
	}
}
