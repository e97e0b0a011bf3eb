package dev.wh40kmeta.scraper.bus;

/** Broker could not be reached or used */
public class BusException extends RuntimeException {
	public BusException(String message) {
		super(message);
	}

	public BusException(String message, Throwable cause) {
		super(message, cause);
	}
}
