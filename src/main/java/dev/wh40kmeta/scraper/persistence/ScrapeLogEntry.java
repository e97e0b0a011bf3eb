package dev.wh40kmeta.scraper.persistence;

import java.time.Instant;

/** One row of the scrape log */
public record ScrapeLogEntry(
		String source,
		String scrapeType,
		String status,
		Instant startedAt,
		Instant completedAt,
		int itemsProcessed,
		int itemsFailed,
		String errorMessage) {

	/** Throwaway row used to check that the log table accepts writes */
	public static ScrapeLogEntry connectionTest() {
		return new ScrapeLogEntry("test", "connection_test", "completed", Instant.now(), null, 0, 0, null);
	}
}
