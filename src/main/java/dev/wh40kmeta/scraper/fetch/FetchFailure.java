package dev.wh40kmeta.scraper.fetch;

/** Network or HTTP failure for a single URL, after retries were exhausted */
public record FetchFailure(String url, Throwable cause) {

	public String message() {
		return cause != null && cause.getMessage() != null
				? cause.getMessage()
				: cause != null ? cause.getClass().getSimpleName() : "Unknown error";
	}

	@Override
	public String toString() {
		return "FetchFailure[%s - %s]".formatted(url, message());
	}
}
