package my.adsoptimizer.app.api;

import jakarta.servlet.http.HttpServletRequest;
import my.adsoptimizer.app.embedding.EmbeddingServiceException;
import my.adsoptimizer.app.generation.GenerationParseException;
import my.adsoptimizer.app.generation.NoExemplarsAvailableException;
import my.adsoptimizer.app.llm.LlmRequestException;
import my.adsoptimizer.app.reporting.QueryDegradationExhaustedException;
import my.adsoptimizer.app.reporting.ReportingApiException;
import my.adsoptimizer.app.service.CreativeNotFoundException;
import my.adsoptimizer.app.service.FeatureDisabledException;
import my.adsoptimizer.app.service.ScoringInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

@RestControllerAdvice
public class RestExceptionHandler {
	private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);

	@ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
	public ProblemDetail handleBadRequest(Exception ex, HttpServletRequest request) {
		logger.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ProblemDetail handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
		logger.warn("Validation failed on {}", request.getRequestURI());
		ProblemDetail detail = problem(HttpStatus.BAD_REQUEST, "Validation failed", null, request);
		List<String> errors = ex.getBindingResult().getFieldErrors().stream()
				.map(this::formatFieldError)
				.toList();
		detail.setProperty("errors", errors);
		return detail;
	}

	@ExceptionHandler({CreativeNotFoundException.class, NoResourceFoundException.class})
	public ProblemDetail handleNotFound(Exception ex, HttpServletRequest request) {
		String message = ex instanceof CreativeNotFoundException ? ex.getMessage() : "Resource not found.";
		return problem(HttpStatus.NOT_FOUND, "Not Found", message, request);
	}

	@ExceptionHandler(ScoringInProgressException.class)
	public ProblemDetail handleScoringInProgress(ScoringInProgressException ex, HttpServletRequest request) {
		return problem(HttpStatus.CONFLICT, "Scoring in progress", ex.getMessage(), request);
	}

	@ExceptionHandler(NoExemplarsAvailableException.class)
	public ProblemDetail handleNoExemplars(NoExemplarsAvailableException ex, HttpServletRequest request) {
		logger.warn("No exemplars on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.CONFLICT, "No exemplars available", ex.getMessage(), request);
	}

	@ExceptionHandler(FeatureDisabledException.class)
	public ProblemDetail handleFeatureDisabled(FeatureDisabledException ex, HttpServletRequest request) {
		return problem(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), request);
	}

	@ExceptionHandler({EmbeddingServiceException.class, GenerationParseException.class, LlmRequestException.class,
			ReportingApiException.class, QueryDegradationExhaustedException.class})
	public ProblemDetail handleUpstream(RuntimeException ex, HttpServletRequest request) {
		logger.warn("Upstream service failed on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = problem(HttpStatus.BAD_GATEWAY, "Upstream service failed", ex.getMessage(), request);
		if (ex instanceof QueryDegradationExhaustedException exhausted) {
			detail.setProperty("lastAttemptedFields", exhausted.getLastAttemptedFields());
			detail.setProperty("attempts", exhausted.getAttempts());
		}
		return detail;
	}

	@ExceptionHandler(Exception.class)
	public ProblemDetail handleUnhandled(Exception ex, HttpServletRequest request) {
		String reference = "SG-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
		logger.error("Unexpected error on {} (ref={})", request.getRequestURI(), reference, ex);
		ProblemDetail detail = problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
				"Unexpected error, ref " + reference, request);
		detail.setProperty("reference", reference);
		return detail;
	}

	private ProblemDetail problem(HttpStatus status, String title, String message, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(status);
		detail.setTitle(title);
		if (message != null) {
			detail.setDetail(message);
		}
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	private String formatFieldError(FieldError error) {
		return error.getField() + ": " + error.getDefaultMessage();
	}
}
