package my.adsoptimizer.app.api;

import my.adsoptimizer.app.dto.ApplySuggestionResponseDto;
import my.adsoptimizer.app.service.SuggestionService;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/suggestions")
public class SuggestionController {
	private final SuggestionService suggestionService;

	public SuggestionController(SuggestionService suggestionService) {
		this.suggestionService = suggestionService;
	}

	@PostMapping("/{suggestionId}/apply")
	public ApplySuggestionResponseDto apply(@PathVariable("suggestionId") Long suggestionId) {
		return suggestionService.apply(suggestionId);
	}
}
