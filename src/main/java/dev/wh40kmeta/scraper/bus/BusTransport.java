package dev.wh40kmeta.scraper.bus;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/** Raw broker operations used by {@link MessageBus}; payloads are serialized envelopes */
public interface BusTransport extends AutoCloseable {

	/**
	 * Connect to the broker
	 *
	 * @throws BusException if the broker cannot be reached
	 */
	void connect();

	boolean ping();

	void publish(String channel, String payload);

	/** Prepend to a list, trimming it to {@code maxLength} entries and refreshing its expiry */
	void pushRecent(String key, String payload, int maxLength, Duration ttl);

	/** Up to {@code limit} entries of a list, newest first */
	List<String> recent(String key, int limit);

	/**
	 * Replace a hash and a list with the given entries: the hash maps each key to its value, the list
	 * holds the values in iteration order. Both expire after {@code ttl}.
	 */
	void replaceIndex(String hashKey, String listKey, Map<String, String> entries, Duration ttl);

	Optional<String> hashValue(String hashKey, String field);

	/** All entries of a list, first to last */
	List<String> listValues(String listKey);

	/** Register a listener receiving raw payloads of a channel, in arrival order */
	void subscribe(String channel, Consumer<String> listener);

	String describe();

	@Override
	void close();
}
