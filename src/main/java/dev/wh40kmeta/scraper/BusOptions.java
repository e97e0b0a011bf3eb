package dev.wh40kmeta.scraper;

import dev.wh40kmeta.scraper.bus.BusTransport;
import dev.wh40kmeta.scraper.bus.LocalBusTransport;
import dev.wh40kmeta.scraper.bus.MessageBus;
import dev.wh40kmeta.scraper.bus.RedisBusTransport;
import dev.wh40kmeta.scraper.bus.RedisSettings;
import picocli.CommandLine.Option;

/** Broker options shared by all commands; defaults come from the environment */
public class BusOptions {

	@Option(
			names = {"--redis-host"},
			description = "Redis host (default: $REDIS_HOST or localhost)",
			defaultValue = "${env:REDIS_HOST:-localhost}")
	String host;

	@Option(
			names = {"--redis-port"},
			description = "Redis port (default: $REDIS_PORT or 6379)",
			defaultValue = "${env:REDIS_PORT:-6379}")
	int port;

	@Option(
			names = {"--redis-db"},
			description = "Redis database index (default: $REDIS_DB or 0)",
			defaultValue = "${env:REDIS_DB:-0}")
	int database;

	@Option(
			names = {"--redis-password"},
			description = "Redis password (default: $REDIS_PASSWORD)",
			defaultValue = "${env:REDIS_PASSWORD}")
	String password;

	@Option(
			names = {"--local-bus"},
			description = "Publish to an in-process bus instead of Redis (for dry runs)")
	boolean localBus;

	public RedisSettings settings() {
		return new RedisSettings(host, port, database, password);
	}

	public BusTransport transport() {
		return localBus ? new LocalBusTransport() : new RedisBusTransport(settings());
	}

	/**
	 * Create and open the message bus
	 *
	 * @throws dev.wh40kmeta.scraper.bus.BusException if the broker is unreachable
	 */
	public MessageBus openBus() {
		return new MessageBus(transport()).open();
	}
}
