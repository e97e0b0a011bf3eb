package dev.wh40kmeta.scraper.fetch;

import java.time.Duration;

/**
 * Configuration record for {@link RateLimitedFetcher} instances. Encapsulates the upstream host,
 * the randomized delay window, the retry policy and the request timeout.
 */
public record FetcherConfig(
		String baseUrl,
		Duration minDelay,
		Duration maxDelay,
		int maxRetries,
		Duration backoffFactor,
		Duration timeout,
		String userAgent) {

	public static final String DEFAULT_BASE_URL = "https://wahapedia.ru";
	public static final String USER_AGENT = "WH40K-Meta-Analyzer/0.1.0 (Web Scraper Bot)";

	public FetcherConfig {
		if (baseUrl == null || baseUrl.isBlank()) {
			throw new IllegalArgumentException("baseUrl must not be empty");
		}
		if (minDelay.isNegative() || maxDelay.compareTo(minDelay) < 0) {
			throw new IllegalArgumentException("Invalid delay window: " + minDelay + " - " + maxDelay);
		}
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must be >= 0");
		}
		baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
	}

	public static FetcherConfig defaults() {
		return new FetcherConfig(
				DEFAULT_BASE_URL,
				Duration.ofMillis(2000),
				Duration.ofMillis(3000),
				3,
				Duration.ofSeconds(1),
				Duration.ofSeconds(30),
				USER_AGENT);
	}

	public FetcherConfig withBaseUrl(String baseUrl) {
		return new FetcherConfig(baseUrl, minDelay, maxDelay, maxRetries, backoffFactor, timeout, userAgent);
	}

	public FetcherConfig withDelays(Duration minDelay, Duration maxDelay) {
		return new FetcherConfig(baseUrl, minDelay, maxDelay, maxRetries, backoffFactor, timeout, userAgent);
	}

	public FetcherConfig withRetries(int maxRetries, Duration backoffFactor) {
		return new FetcherConfig(baseUrl, minDelay, maxDelay, maxRetries, backoffFactor, timeout, userAgent);
	}
}
