package my.adsoptimizer.app.embedding;

import my.adsoptimizer.app.domain.Creative;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

public final class CreativeText {
	static final String EMPTY_PLACEHOLDER = "Empty ad";

	private CreativeText() {
	}

	/**
	 * Headlines joined by {@code " | "}, then the descriptions, as embedded for similarity search.
	 */
	public static String of(Creative creative) {
		if (creative == null) {
			return EMPTY_PLACEHOLDER;
		}
		return of(creative.getHeadlines(), creative.getDescriptions());
	}

	public static String of(List<String> headlines, List<String> descriptions) {
		List<String> parts = new ArrayList<>();
		String headlineText = join(headlines, " | ");
		if (!headlineText.isEmpty()) {
			parts.add(headlineText);
		}
		String descriptionText = join(descriptions, " ");
		if (!descriptionText.isEmpty()) {
			parts.add(descriptionText);
		}
		String text = String.join(" ", parts).trim();
		return text.isEmpty() ? EMPTY_PLACEHOLDER : text;
	}

	public static String hash(String text) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException ex) {
			throw new IllegalStateException("SHA-256 not available", ex);
		}
	}

	private static String join(List<String> values, String separator) {
		if (values == null || values.isEmpty()) {
			return "";
		}
		List<String> cleaned = new ArrayList<>();
		for (String value : values) {
			if (value != null && !value.isBlank()) {
				cleaned.add(value.trim());
			}
		}
		return String.join(separator, cleaned);
	}
}
