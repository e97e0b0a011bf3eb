package dev.wh40kmeta.scraper.extract;

import dev.wh40kmeta.scraper.fetch.FetchFailure;

/** A single item could not be extracted: its page was unavailable or its markup was not as expected */
public class ParseFailure extends Exception {
	private final FetchFailure fetchFailure;

	public ParseFailure(String message) {
		super(message);
		this.fetchFailure = null;
	}

	private ParseFailure(FetchFailure fetchFailure) {
		super("Failed to fetch " + fetchFailure.url() + ": " + fetchFailure.message(), fetchFailure.cause());
		this.fetchFailure = fetchFailure;
	}

	public static ParseFailure of(FetchFailure fetchFailure) {
		return new ParseFailure(fetchFailure);
	}

	/** True when the page could not be fetched, as opposed to unexpected markup */
	public boolean isFetchFailure() {
		return fetchFailure != null;
	}

	public FetchFailure fetchFailure() {
		return fetchFailure;
	}
}
