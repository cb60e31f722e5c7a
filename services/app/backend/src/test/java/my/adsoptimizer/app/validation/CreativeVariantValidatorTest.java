package my.adsoptimizer.app.validation;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CreativeVariantValidatorTest {
	private final CreativeVariantValidator validator = new CreativeVariantValidator();

	@Test
	void acceptsWellFormedVariant() {
		ValidationOutcome outcome = validator.validate(new CreativeVariant(
				List.of("Fast Home Delivery", "Fresh Local Produce", "Order Online Today"),
				List.of("Groceries at your door in an hour.", "Pick from thousands of local products.")));

		assertThat(outcome.passed()).isTrue();
		assertThat(outcome.errors()).isEmpty();
		assertThat(outcome.warnings()).isEmpty();
		assertThat(outcome.normalized().headlines()).hasSize(3);
	}

	@Test
	void unbreakableOverlongHeadlineIsHardCutAtLimit() {
		ValidationOutcome outcome = validator.validate(new CreativeVariant(
				List.of("A".repeat(40), "Second Headline", "Third Headline"),
				List.of("Description one is fine.", "Description two is fine.")));

		assertThat(outcome.passed()).isTrue();
		assertThat(outcome.normalized().headlines()).containsExactly("A".repeat(30), "Second Headline", "Third Headline");
		assertThat(outcome.warnings()).contains("headline 1 truncated from 40 to 30 characters");
	}

	@Test
	void singleOverlongHeadlineWithOneDescriptionReportsMissingCounts() {
		ValidationOutcome outcome = validator.validate(new CreativeVariant(
				List.of("A".repeat(40)),
				List.of("ok")));

		assertThat(outcome.passed()).isFalse();
		assertThat(outcome.normalized().headlines()).containsExactly("A".repeat(30));
		assertThat(outcome.errors()).containsExactly(
				"only 1 unique headlines after dedup, minimum 3 required",
				"only 1 unique descriptions after dedup, minimum 2 required");
	}

	@Test
	void truncationLeavingTooFewCharactersDropsTheItem() {
		ValidationOutcome outcome = validator.validate(new CreativeVariant(
				List.of("Go " + "x".repeat(40), "Second Headline", "Third Headline"),
				List.of("Description one is fine.", "Description two is fine.")));

		assertThat(outcome.passed()).isFalse();
		assertThat(outcome.normalized().headlines()).containsExactly("Second Headline", "Third Headline");
		assertThat(outcome.errors()).contains(
				"headline 1 exceeds 30 characters and is shorter than 3 characters once truncated; dropped",
				"only 2 unique headlines after dedup, minimum 3 required");
	}

	@Test
	void overlongHeadlineIsTruncatedAtWordBoundaryWithWarning() {
		ValidationOutcome outcome = validator.validate(new CreativeVariant(
				List.of("Save Big On Premium Running Shoes Today", "Free Returns", "Shop The Sale"),
				List.of("Description one is fine.", "Description two is fine.")));

		assertThat(outcome.passed()).isTrue();
		String truncated = outcome.normalized().headlines().get(0);
		assertThat(truncated).isEqualTo("Save Big On Premium Running");
		assertThat(truncated.length()).isLessThanOrEqualTo(30);
		assertThat(outcome.warnings()).anySatisfy(warning -> assertThat(warning).contains("truncated from 39 to 27"));
	}

	@Test
	void duplicatesAreRemovedAfterTrimming() {
		ValidationOutcome outcome = validator.validate(new CreativeVariant(
				List.of("Same Headline", "  Same Headline ", "Other Headline", "Third One"),
				List.of("Description one is fine.", "Description one is fine.", "Description two.")));

		assertThat(outcome.passed()).isTrue();
		assertThat(outcome.normalized().headlines()).containsExactly("Same Headline", "Other Headline", "Third One");
		assertThat(outcome.normalized().descriptions()).containsExactly("Description one is fine.", "Description two.");
		assertThat(outcome.warnings()).contains("duplicate headline removed: \"Same Headline\"");
	}

	@Test
	void duplicatesThatBreakMinimumFailValidation() {
		ValidationOutcome outcome = validator.validate(new CreativeVariant(
				List.of("Same", "Same", "Other"),
				List.of("Description one is fine.", "Description two is fine.")));

		assertThat(outcome.passed()).isFalse();
		assertThat(outcome.errors()).containsExactly("only 2 unique headlines after dedup, minimum 3 required");
	}

	@Test
	void headlineComparisonIsCaseSensitive() {
		ValidationOutcome outcome = validator.validate(new CreativeVariant(
				List.of("Buy Now", "buy now", "BUY NOW"),
				List.of("Description one is fine.", "Description two is fine.")));

		assertThat(outcome.passed()).isTrue();
		assertThat(outcome.normalized().headlines()).hasSize(3);
	}

	@Test
	void emptyItemsAreErrors() {
		ValidationOutcome outcome = validator.validate(new CreativeVariant(
				List.of("One", "Two", "Three", "   "),
				List.of("Description one is fine.", "Description two is fine.")));

		assertThat(outcome.passed()).isFalse();
		assertThat(outcome.errors()).containsExactly("headline 4 is empty; dropped");
		assertThat(outcome.normalized().headlines()).containsExactly("One", "Two", "Three");
	}

	@Test
	void extraItemsBeyondMaximumAreCutWithWarning() {
		List<String> headlines = new ArrayList<>();
		for (int i = 1; i <= 17; i++) {
			headlines.add("Headline " + i);
		}
		ValidationOutcome outcome = validator.validate(new CreativeVariant(headlines,
				List.of("D one.", "D two.", "D three.", "D four.", "D five.")));

		assertThat(outcome.passed()).isTrue();
		assertThat(outcome.normalized().headlines()).hasSize(15).endsWith("Headline 15");
		assertThat(outcome.normalized().descriptions()).hasSize(4);
		assertThat(outcome.warnings()).hasSize(2);
	}

	@Test
	void tooFewDescriptionsIsAnError() {
		ValidationOutcome outcome = validator.validate(new CreativeVariant(
				List.of("One", "Two", "Three"),
				List.of("Only one description.")));

		assertThat(outcome.passed()).isFalse();
		assertThat(outcome.errors()).containsExactly("only 1 unique descriptions after dedup, minimum 2 required");
		assertThat(outcome.messages()).containsExactly("only 1 unique descriptions after dedup, minimum 2 required");
	}

	@Test
	void truncationStripsTrailingSeparators() {
		assertThat(CreativeVariantValidator.truncate("Great Deals, Every Day - Shop Now", 24))
				.isEqualTo("Great Deals, Every Day");
		assertThat(CreativeVariantValidator.truncate("Short", 30)).isEqualTo("Short");
		assertThat(CreativeVariantValidator.truncate("B".repeat(35), 30)).isEqualTo("B".repeat(30));
	}

	@Test
	void validationIsDeterministic() {
		CreativeVariant variant = new CreativeVariant(
				List.of("Save Big On Premium Running Shoes Today", "Dup", "Dup", "X"),
				List.of("D one.", "D one."));

		assertThat(validator.validate(variant)).isEqualTo(validator.validate(variant));
	}
}
