package dev.wh40kmeta.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.wh40kmeta.scraper.bus.BusException;
import dev.wh40kmeta.scraper.bus.Channel;
import dev.wh40kmeta.scraper.bus.MessageBus;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/** Listen command to print messages as they are published */
@Command(
		name = "listen",
		description = "Subscribe to channels and print messages until interrupted",
		mixinStandardHelpOptions = true)
public class ListenCommand implements Callable<Integer> {

	@Option(
			names = {"-c", "--channel"},
			description = "Channels to subscribe to (if not specified, all channels)",
			split = ",")
	private List<String> channels;

	@Option(
			names = {"-n", "--count"},
			description = "Exit after this many messages (default: run until interrupted)",
			defaultValue = "-1")
	private int count;

	@Mixin
	private BusOptions busOptions;

	@Override
	public Integer call() throws Exception {
		List<Channel> targets;
		try {
			targets = channels == null
					? Arrays.asList(Channel.values())
					: channels.stream().map(Channel::of).toList();
		} catch (IllegalArgumentException e) {
			System.err.println("Error: " + e.getMessage());
			return 1;
		}

		MessageBus bus;
		try {
			bus = busOptions.openBus();
		} catch (BusException e) {
			System.err.println("Error: " + e.getMessage());
			return 1;
		}

		var mapper = new ObjectMapper();
		var done = new CountDownLatch(count > 0 ? count : 1);
		Runtime.getRuntime().addShutdownHook(new Thread(bus::close, "ListenShutdown"));
		for (Channel channel : targets) {
			bus.subscribe(channel, envelope -> {
				try {
					System.out.println(channel + " " + mapper.writeValueAsString(envelope));
				} catch (JsonProcessingException e) {
					System.err.println("Unprintable message on " + channel + ": " + e.getMessage());
				}
				if (count > 0) {
					done.countDown();
				}
			});
		}
		System.err.println("Listening on " + targets.size() + " channel(s), press Ctrl+C to stop");

		try {
			done.await();
		} finally {
			bus.close();
		}
		return 0;
	}
}
