package my.adsoptimizer.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record MetricsSyncRequestDto(@NotBlank String customerId, @Positive Integer days) {
}
