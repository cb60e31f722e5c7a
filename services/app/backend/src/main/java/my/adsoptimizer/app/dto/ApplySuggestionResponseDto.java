package my.adsoptimizer.app.dto;

public record ApplySuggestionResponseDto(Long suggestionId, boolean success, String message) {
}
