package dev.wh40kmeta.scraper.persistence;

/** Storage for scrape log rows */
public interface ScrapeLogRepository {

	/**
	 * Store a scrape log row
	 *
	 * @return the id of the new row
	 * @throws ScrapeLogException if the row could not be written
	 */
	long write(ScrapeLogEntry entry);

	/** Insert a test row and delete it again; false if either step failed */
	boolean verifyWritable();
}
