package my.adsoptimizer.app.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * @param normalized the variant after trimming, truncation and de-duplication
 * @param errors     fatal findings; {@code passed} is {@code false} whenever this is non-empty
 * @param warnings   non-fatal normalizations that were applied
 */
public record ValidationOutcome(CreativeVariant normalized,
								boolean passed,
								List<String> errors,
								List<String> warnings) {
	public ValidationOutcome {
		errors = List.copyOf(errors);
		warnings = List.copyOf(warnings);
	}

	/**
	 * Errors followed by warnings, the latter prefixed so a reviewer can tell them apart.
	 */
	public List<String> messages() {
		List<String> messages = new ArrayList<>(errors);
		for (String warning : warnings) {
			messages.add("warning: " + warning);
		}
		return List.copyOf(messages);
	}
}
