package my.adsoptimizer.app.config;

import my.adsoptimizer.app.reporting.GoogleAdsReportingClient;
import my.adsoptimizer.app.reporting.NoopReportingClient;
import my.adsoptimizer.app.reporting.ReportingClient;
import my.adsoptimizer.app.reporting.ReportingPolicy;
import my.adsoptimizer.app.reporting.ResilientQueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;

@Configuration
public class ReportingConfig {
	private static final Logger logger = LoggerFactory.getLogger(ReportingConfig.class);
	static final String DEFAULT_BASE_URL = "https://googleads.googleapis.com";
	static final String DEFAULT_API_VERSION = "v18";

	@Bean
	@ConditionalOnProperty(name = "app.reporting.provider", havingValue = "google-ads")
	public GoogleAdsReportingClient googleAdsReportingClient(AppProperties properties, ObjectMapper objectMapper) {
		AppProperties.Reporting.GoogleAds googleAds = properties.reporting().googleAds();
		if (googleAds == null || isBlank(googleAds.developerToken()) || isBlank(googleAds.accessToken())) {
			throw new IllegalStateException(
					"app.reporting.google-ads.developer-token and access-token are required when app.reporting.provider=google-ads");
		}
		String baseUrl = isBlank(googleAds.baseUrl()) ? DEFAULT_BASE_URL : googleAds.baseUrl();
		String apiVersion = isBlank(googleAds.apiVersion()) ? DEFAULT_API_VERSION : googleAds.apiVersion();
		logger.info("Reporting client enabled (provider=google-ads, apiVersion={}).", apiVersion);
		return new GoogleAdsReportingClient(baseUrl, apiVersion, googleAds.developerToken(), googleAds.accessToken(),
				googleAds.loginCustomerId(), objectMapper);
	}

	@Bean
	@ConditionalOnMissingBean(ReportingClient.class)
	public NoopReportingClient noopReportingClient() {
		logger.info("Reporting client disabled (provider=none).");
		return new NoopReportingClient();
	}

	@Bean
	public ReportingPolicy reportingPolicy(AppProperties properties) {
		AppProperties.Optimizer.ReportingRetries retries = properties.optimizer() == null ? null : properties.optimizer().reporting();
		int maxRetries = retries == null || retries.maxFieldRemovalRetries() == null
				? ReportingPolicy.DEFAULT_MAX_FIELD_REMOVAL_RETRIES
				: retries.maxFieldRemovalRetries();
		return new ReportingPolicy(maxRetries, ReportingPolicy.DEFAULT_KNOWN_INVALID_FIELDS);
	}

	@Bean
	public ResilientQueryExecutor resilientQueryExecutor(ReportingClient reportingClient, ReportingPolicy reportingPolicy) {
		return new ResilientQueryExecutor(reportingClient, reportingPolicy);
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
