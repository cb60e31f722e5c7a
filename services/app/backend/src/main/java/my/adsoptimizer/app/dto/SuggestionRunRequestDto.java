package my.adsoptimizer.app.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

public record SuggestionRunRequestDto(@Positive @Max(100) Integer maxCreatives) {
}
