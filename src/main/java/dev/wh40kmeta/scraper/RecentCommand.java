package dev.wh40kmeta.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.wh40kmeta.scraper.bus.BusException;
import dev.wh40kmeta.scraper.bus.Channel;
import dev.wh40kmeta.scraper.bus.Envelope;
import dev.wh40kmeta.scraper.bus.MessageBus;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/** Recent command to print the buffered messages of a channel */
@Command(
		name = "recent",
		description = "Print the most recent messages of a channel, newest first",
		mixinStandardHelpOptions = true)
public class RecentCommand implements Callable<Integer> {

	@Option(
			names = {"-c", "--channel"},
			description = "Channel name, e.g. scraper:faction:discovered",
			required = true)
	private String channel;

	@Option(
			names = {"-n", "--limit"},
			description = "Maximum number of messages to print (default: 10)",
			defaultValue = "10")
	private int limit;

	@Mixin
	private BusOptions busOptions;

	@Override
	public Integer call() throws Exception {
		Channel target;
		try {
			target = Channel.of(channel);
		} catch (IllegalArgumentException e) {
			System.err.println("Error: " + e.getMessage());
			return 1;
		}

		var mapper = new ObjectMapper();
		try (MessageBus bus = busOptions.openBus()) {
			var messages = bus.recent(target, limit);
			for (Envelope envelope : messages) {
				System.out.println(mapper.writeValueAsString(envelope));
			}
			System.err.println(messages.size() + " message(s) on " + target);
			return 0;
		} catch (BusException e) {
			System.err.println("Error: " + e.getMessage());
			return 1;
		}
	}
}
