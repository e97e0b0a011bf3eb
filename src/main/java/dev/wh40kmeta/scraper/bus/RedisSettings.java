package dev.wh40kmeta.scraper.bus;

/** Connection settings of the Redis broker */
public record RedisSettings(String host, int port, int database, String password) {

	@Override
	public String toString() {
		return "redis://%s:%d/%d".formatted(host, port, database);
	}
}
