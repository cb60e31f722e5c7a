package my.adsoptimizer.app.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

public record SuggestionRequestDto(@Positive @Max(10) Integer numVariants, @Positive @Max(20) Integer topK) {
}
