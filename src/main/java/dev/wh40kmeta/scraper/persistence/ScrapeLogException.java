package dev.wh40kmeta.scraper.persistence;

/** Scrape log storage failed */
public class ScrapeLogException extends RuntimeException {
	public ScrapeLogException(String message, Throwable cause) {
		super(message, cause);
	}
}
