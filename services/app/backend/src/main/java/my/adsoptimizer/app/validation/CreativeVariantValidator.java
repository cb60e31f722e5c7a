package my.adsoptimizer.app.validation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class CreativeVariantValidator {
	private static final String TRAILING_SEPARATORS = ",;:-|/";

	private final RsaConstraints constraints;

	public CreativeVariantValidator() {
		this(RsaConstraints.RESPONSIVE_SEARCH_AD);
	}

	public CreativeVariantValidator(RsaConstraints constraints) {
		this.constraints = constraints;
	}

	public RsaConstraints constraints() {
		return constraints;
	}

	public ValidationOutcome validate(CreativeVariant variant) {
		List<String> errors = new ArrayList<>();
		List<String> warnings = new ArrayList<>();
		CreativeVariant input = variant == null ? new CreativeVariant(List.of(), List.of()) : variant;

		List<String> headlines = normalizeField("headline", input.headlines(),
				constraints.maxHeadlineLength(), constraints.maxHeadlines(), errors, warnings);
		List<String> descriptions = normalizeField("description", input.descriptions(),
				constraints.maxDescriptionLength(), constraints.maxDescriptions(), errors, warnings);

		if (headlines.size() < constraints.minHeadlines()) {
			errors.add("only " + headlines.size() + " unique headlines after dedup, minimum "
					+ constraints.minHeadlines() + " required");
		}
		if (descriptions.size() < constraints.minDescriptions()) {
			errors.add("only " + descriptions.size() + " unique descriptions after dedup, minimum "
					+ constraints.minDescriptions() + " required");
		}
		return new ValidationOutcome(new CreativeVariant(headlines, descriptions), errors.isEmpty(), errors, warnings);
	}

	private List<String> normalizeField(String label,
										List<String> values,
										int maxLength,
										int maxCount,
										List<String> errors,
										List<String> warnings) {
		Set<String> unique = new LinkedHashSet<>();
		int position = 0;
		for (String raw : values) {
			position += 1;
			String text = raw == null ? "" : raw.trim();
			if (text.isEmpty()) {
				errors.add(label + " " + position + " is empty; dropped");
				continue;
			}
			if (text.length() > maxLength) {
				String truncated = truncate(text, maxLength);
				if (truncated.length() < constraints.minTruncatedLength()) {
					errors.add(label + " " + position + " exceeds " + maxLength
							+ " characters and is shorter than " + constraints.minTruncatedLength()
							+ " characters once truncated; dropped");
					continue;
				}
				warnings.add(label + " " + position + " truncated from " + text.length() + " to "
						+ truncated.length() + " characters");
				text = truncated;
			}
			if (!unique.add(text)) {
				warnings.add("duplicate " + label + " removed: \"" + text + "\"");
			}
		}
		List<String> result = new ArrayList<>(unique);
		if (result.size() > maxCount) {
			warnings.add(result.size() + " " + label + "s provided, kept the first " + maxCount);
			result = new ArrayList<>(result.subList(0, maxCount));
		}
		return List.copyOf(result);
	}

	static String truncate(String text, int maxLength) {
		if (text.length() <= maxLength) {
			return text;
		}
		int cut = -1;
		for (int i = maxLength; i > 0; i--) {
			if (Character.isWhitespace(text.charAt(i))) {
				cut = i;
				break;
			}
		}
		String candidate = cut < 0 ? text.substring(0, maxLength) : text.substring(0, cut).stripTrailing();
		int end = candidate.length();
		while (end > 0 && (TRAILING_SEPARATORS.indexOf(candidate.charAt(end - 1)) >= 0
				|| Character.isWhitespace(candidate.charAt(end - 1)))) {
			end -= 1;
		}
		return candidate.substring(0, end);
	}
}
