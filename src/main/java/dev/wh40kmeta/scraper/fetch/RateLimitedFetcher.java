package dev.wh40kmeta.scraper.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches pages from the upstream wiki, waiting a randomized delay between requests and retrying
 * transient failures with exponential backoff. Not thread-safe: one instance per extraction thread.
 */
public class RateLimitedFetcher {
	private static final Logger logger = LoggerFactory.getLogger(RateLimitedFetcher.class);

	static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

	/** Functional interface for operations that can throw IOException and InterruptedException */
	@FunctionalInterface
	private interface IOSupplier<T> {
		T get() throws IOException, InterruptedException;
	}

	/** Non-2xx response; retried only for the statuses in {@link #RETRYABLE_STATUSES} */
	static class HttpStatusException extends IOException {
		private final int status;

		HttpStatusException(String url, int status) {
			super("HTTP " + status + " for " + url);
			this.status = status;
		}

		boolean retryable() {
			return RETRYABLE_STATUSES.contains(status);
		}
	}

	private final FetcherConfig config;
	private final HttpClient httpClient;
	private final Random random;
	private long lastRequestNanos = -1;
	private FetchFailure lastFailure;

	public RateLimitedFetcher(FetcherConfig config) {
		this(config, new Random());
	}

	RateLimitedFetcher(FetcherConfig config, Random random) {
		this.config = config;
		this.random = random;
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(config.timeout())
				.build();
	}

	/**
	 * Fetch the body of a page. Relative URLs are resolved against the configured base URL.
	 *
	 * @return the page body, or empty when the request failed after all retries
	 */
	public Optional<String> fetch(String url) {
		String absolute = absoluteUrl(url);
		try {
			waitForSlot();
			logger.info("Fetching: {}", absolute);
			String body = retry(absolute, () -> get(absolute));
			lastFailure = null;
			logger.debug("Fetched {} characters from {}", body.length(), absolute);
			return Optional.of(body);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return failed(absolute, e);
		} catch (IOException | IllegalArgumentException e) {
			return failed(absolute, e);
		} finally {
			lastRequestNanos = System.nanoTime();
		}
	}

	/** Fetch a page and parse it with jsoup, using the resolved URL as base URI */
	public Optional<Document> fetchDocument(String url) {
		String absolute = absoluteUrl(url);
		return fetch(absolute).map(body -> Jsoup.parse(body, absolute));
	}

	/** The failure of the most recent {@link #fetch} call, or null when it succeeded */
	public FetchFailure lastFailure() {
		return lastFailure;
	}

	public String absoluteUrl(String url) {
		if (url.startsWith("http")) {
			return url;
		}
		return config.baseUrl() + (url.startsWith("/") ? url : "/" + url);
	}

	private Optional<String> failed(String url, Exception e) {
		lastFailure = new FetchFailure(url, e);
		logger.error("Failed to fetch {}: {}", url, lastFailure.message());
		return Optional.empty();
	}

	private void waitForSlot() throws InterruptedException {
		long delayMillis = nextDelay().toMillis();
		if (lastRequestNanos < 0) {
			return;
		}
		long elapsedMillis = (System.nanoTime() - lastRequestNanos) / 1_000_000L;
		if (elapsedMillis < delayMillis) {
			long sleepMillis = delayMillis - elapsedMillis;
			logger.debug("Rate limiting: sleeping {} ms", sleepMillis);
			Thread.sleep(sleepMillis);
		}
	}

	Duration nextDelay() {
		long min = config.minDelay().toMillis();
		long max = config.maxDelay().toMillis();
		if (max <= min) {
			return Duration.ofMillis(min);
		}
		return Duration.ofMillis(min + (long) (random.nextDouble() * (max - min)));
	}

	private String get(String url) throws IOException, InterruptedException {
		HttpRequest request = HttpRequest.newBuilder()
				.uri(URI.create(withoutFragment(url)))
				.timeout(config.timeout())
				.header("User-Agent", config.userAgent())
				.GET()
				.build();
		HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		if (response.statusCode() < 200 || response.statusCode() >= 300) {
			throw new HttpStatusException(url, response.statusCode());
		}
		return response.body();
	}

	private static String withoutFragment(String url) {
		int hash = url.indexOf('#');
		return hash >= 0 ? url.substring(0, hash) : url;
	}

	/**
	 * Retry an operation with exponential backoff
	 *
	 * @throws IOException If all retry attempts fail or the failure is not retryable
	 * @throws InterruptedException If the thread is interrupted during backoff
	 */
	private <T> T retry(String url, IOSupplier<T> operation) throws IOException, InterruptedException {
		int retries = 0;
		while (true) {
			try {
				return operation.get();
			} catch (HttpStatusException e) {
				if (!e.retryable() || retries >= config.maxRetries()) {
					throw e;
				}
				retries = backoff(url, retries, e);
			} catch (IOException e) {
				if (retries >= config.maxRetries()) {
					throw e;
				}
				retries = backoff(url, retries, e);
			}
		}
	}

	private int backoff(String url, int retries, IOException cause) throws InterruptedException {
		// factor * 2^retries: 1s, 2s, 4s with the default factor
		long backoffMillis = config.backoffFactor().toMillis() * (1L << retries);
		logger.warn("Retrying {} in {} ms after: {}", url, backoffMillis, cause.getMessage());
		Thread.sleep(backoffMillis);
		return retries + 1;
	}
}
