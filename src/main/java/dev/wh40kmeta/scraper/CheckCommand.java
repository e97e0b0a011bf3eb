package dev.wh40kmeta.scraper;

import dev.wh40kmeta.scraper.bus.BusException;
import dev.wh40kmeta.scraper.bus.Channel;
import dev.wh40kmeta.scraper.bus.Envelope;
import dev.wh40kmeta.scraper.bus.MessageBus;
import dev.wh40kmeta.scraper.persistence.ScrapeLogRepository;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/** Check command to verify the broker and scrape log database connections */
@Command(
		name = "check",
		description = "Verify broker connectivity, pub/sub delivery and scrape log writes",
		mixinStandardHelpOptions = true)
public class CheckCommand implements Callable<Integer> {

	@Option(
			names = {"--timeout"},
			description = "Seconds to wait for the pub/sub test message (default: 5)",
			defaultValue = "5")
	private int timeoutSeconds;

	@Mixin
	private BusOptions busOptions;

	@Mixin
	private DatabaseOptions databaseOptions;

	@Override
	public Integer call() throws Exception {
		System.out.println("Connection Check");
		System.out.println("================");

		var failures = 0;
		MessageBus bus = null;
		try {
			bus = busOptions.openBus();
		} catch (BusException e) {
			System.out.println("  Broker: FAILED - " + e.getMessage());
			failures++;
		}

		if (bus != null) {
			try (MessageBus opened = bus) {
				boolean pong = opened.ping();
				System.out.println("  Broker ping: " + (pong ? "OK" : "FAILED"));
				if (!pong) {
					failures++;
				}
				boolean delivered = roundTrip(opened);
				System.out.println("  Pub/sub round trip: " + (delivered ? "OK" : "FAILED"));
				if (!delivered) {
					failures++;
				}
			}
		}

		Optional<ScrapeLogRepository> repository = databaseOptions.repository();
		if (repository.isEmpty()) {
			System.out.println("  Database: not configured");
		} else {
			boolean writable = repository.get().verifyWritable();
			System.out.println("  Database write test: " + (writable ? "OK" : "FAILED"));
			if (!writable) {
				failures++;
			}
		}

		System.out.println();
		System.out.println(failures == 0 ? "All checks passed" : failures + " check(s) failed");
		return failures == 0 ? 0 : 1;
	}

	private boolean roundTrip(MessageBus bus) throws InterruptedException {
		var received = new CountDownLatch(1);
		bus.subscribe(Channel.HEALTH_CHECK, envelope -> received.countDown());
		// Redis subscriptions are established asynchronously
		Thread.sleep(500);
		bus.publish(Channel.HEALTH_CHECK, Envelope.status(null, "check", null));
		return received.await(timeoutSeconds, TimeUnit.SECONDS);
	}
}
