package my.adsoptimizer.app.api;

import jakarta.validation.Valid;
import my.adsoptimizer.app.dto.CreativeDetailDto;
import my.adsoptimizer.app.dto.SuggestionDto;
import my.adsoptimizer.app.dto.SuggestionRequestDto;
import my.adsoptimizer.app.service.CreativeQueryService;
import my.adsoptimizer.app.service.SuggestionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/creatives/{creativeId}")
public class CreativeController {
	private final CreativeQueryService queryService;
	private final SuggestionService suggestionService;

	public CreativeController(CreativeQueryService queryService, SuggestionService suggestionService) {
		this.queryService = queryService;
		this.suggestionService = suggestionService;
	}

	@GetMapping
	public CreativeDetailDto get(@PathVariable("creativeId") Long creativeId) {
		return queryService.detail(creativeId);
	}

	@PostMapping("/suggestions")
	public List<SuggestionDto> generate(@PathVariable("creativeId") Long creativeId,
										@Valid @RequestBody(required = false) SuggestionRequestDto request) {
		return suggestionService.generateForCreative(creativeId, request);
	}

	@GetMapping("/suggestions")
	public List<SuggestionDto> history(@PathVariable("creativeId") Long creativeId) {
		return suggestionService.history(creativeId);
	}
}
