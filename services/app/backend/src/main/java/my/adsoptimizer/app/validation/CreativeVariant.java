package my.adsoptimizer.app.validation;

import java.util.List;

public record CreativeVariant(List<String> headlines, List<String> descriptions) {
	public CreativeVariant {
		headlines = headlines == null ? List.of() : List.copyOf(headlines);
		descriptions = descriptions == null ? List.of() : List.copyOf(descriptions);
	}
}
