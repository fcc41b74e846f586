package com.lolanalyzer.riot.config;

import com.lolanalyzer.riot.infra.RateWindow;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app.riot")
public record RiotApiProperties(
	@NotBlank String apiKey,
	@NotBlank String baseUrl,
	@NotBlank String dataDragonUrl,
	@NotBlank String dataDragonLocale,
	@NotEmpty List<RateWindow> rateLimits,
	@NotEmpty List<RateWindow> dataDragonRateLimits,
	@NotNull Duration defaultRetryAfter,
	boolean coalesceInFlight,
	@NotNull Duration connectTimeout,
	@NotNull Duration readTimeout
) {}
