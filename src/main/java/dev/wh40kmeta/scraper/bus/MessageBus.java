package dev.wh40kmeta.scraper.bus;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes envelopes to broker channels and keeps a bounded list of recent messages per channel.
 * Messages received for subscribed channels are handed to a single dispatch thread that calls the
 * registered handlers in registration order.
 */
public class MessageBus implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(MessageBus.class);

	public static final String SOURCE = "wahapedia-scraper";
	public static final int RECENT_LIMIT = 100;
	public static final Duration RECENT_TTL = Duration.ofHours(1);
	public static final String FACTION_CODES_KEY = "wahapedia:faction_codes";
	public static final String FACTION_LIST_KEY = "wahapedia:faction_list";
	public static final Duration FACTION_TTL = Duration.ofHours(24);

	private record Delivery(Channel channel, String payload) {}

	private static final Delivery POISON_PILL = new Delivery(null, null);

	private final BusTransport transport;
	private final ObjectMapper objectMapper;
	private final BlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();
	private final Map<Channel, List<Consumer<Envelope>>> handlers = new ConcurrentHashMap<>();
	private final AtomicBoolean open = new AtomicBoolean(false);
	private final AtomicBoolean dispatching = new AtomicBoolean(false);
	private Thread dispatchThread;
	private Instant lastStamp = Instant.EPOCH;

	public MessageBus(BusTransport transport) {
		this.transport = transport;
		this.objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	}

	/**
	 * Connect the underlying transport
	 *
	 * @throws BusException if the broker is unreachable
	 */
	public MessageBus open() {
		if (open.compareAndSet(false, true)) {
			try {
				transport.connect();
				logger.info("Message bus connected to {}", transport.describe());
			} catch (RuntimeException e) {
				open.set(false);
				throw e instanceof BusException be
						? be
						: new BusException("Failed to connect to " + transport.describe(), e);
			}
		}
		return this;
	}

	public boolean isOpen() {
		return open.get();
	}

	public boolean ping() {
		try {
			return open.get() && transport.ping();
		} catch (RuntimeException e) {
			logger.error("Broker ping failed: {}", e.getMessage());
			return false;
		}
	}

	/**
	 * Publish an envelope, stamping it with the current time and the source tag. The envelope is
	 * also recorded in the channel's recent-message list.
	 *
	 * @return false if the bus is not open or the envelope could not be sent
	 */
	public boolean publish(Channel channel, Envelope envelope) {
		if (!open.get()) {
			logger.warn("Message bus not open, dropping {} message for {}", envelope.type(), channel);
			return false;
		}
		String payload;
		try {
			payload = objectMapper.writeValueAsString(envelope.stamped(nextTimestamp(), SOURCE));
			transport.publish(channel.key(), payload);
			logger.debug("Published {} message to {}", envelope.type(), channel);
		} catch (Exception e) {
			logger.error("Failed to publish {} message to {}: {}", envelope.type(), channel, e.getMessage());
			return false;
		}
		try {
			transport.pushRecent(channel.recentKey(), payload, RECENT_LIMIT, RECENT_TTL);
		} catch (RuntimeException e) {
			logger.debug("Failed to record recent message for {}: {}", channel, e.getMessage());
		}
		return true;
	}

	/**
	 * Register a handler for a channel. The first registration starts the dispatch thread.
	 *
	 * @throws BusException if the bus is not open
	 */
	public void subscribe(Channel channel, Consumer<Envelope> handler) {
		if (!open.get()) {
			throw new BusException("Message bus not open");
		}
		List<Consumer<Envelope>> channelHandlers = handlers.computeIfAbsent(channel, c -> {
			transport.subscribe(c.key(), payload -> enqueue(c, payload));
			logger.info("Subscribed to channel {}", c);
			return new CopyOnWriteArrayList<>();
		});
		channelHandlers.add(handler);
		startDispatcher();
	}

	/** Most recent envelopes of a channel, newest first */
	public List<Envelope> recent(Channel channel, int limit) {
		if (!open.get() || limit <= 0) {
			return List.of();
		}
		try {
			List<Envelope> result = new ArrayList<>();
			for (String payload : transport.recent(channel.recentKey(), limit)) {
				result.add(objectMapper.readValue(payload, Envelope.class));
			}
			return result;
		} catch (Exception e) {
			logger.error("Failed to read recent messages of {}: {}", channel, e.getMessage());
			return List.of();
		}
	}

	/**
	 * Replace the stored faction index with the given factions, keyed by faction code. The index
	 * keeps a hash by code and a list in the given order, both expiring after {@link #FACTION_TTL}.
	 *
	 * @return false if the bus is not open or the index could not be written
	 */
	public boolean storeFactions(Map<String, ?> factionsByCode) {
		if (!open.get()) {
			return false;
		}
		try {
			Map<String, String> entries = new LinkedHashMap<>();
			for (Map.Entry<String, ?> entry : factionsByCode.entrySet()) {
				entries.put(entry.getKey(), objectMapper.writeValueAsString(entry.getValue()));
			}
			transport.replaceIndex(FACTION_CODES_KEY, FACTION_LIST_KEY, entries, FACTION_TTL);
			logger.info("Stored {} factions", entries.size());
			return true;
		} catch (Exception e) {
			logger.error("Failed to store factions: {}", e.getMessage());
			return false;
		}
	}

	/** A faction of the stored index by its code */
	public Optional<JsonNode> storedFaction(String code) {
		if (!open.get()) {
			return Optional.empty();
		}
		try {
			Optional<String> value = transport.hashValue(FACTION_CODES_KEY, code);
			return value.isPresent() ? Optional.of(objectMapper.readTree(value.get())) : Optional.empty();
		} catch (Exception e) {
			logger.error("Failed to read stored faction {}: {}", code, e.getMessage());
			return Optional.empty();
		}
	}

	/** All factions of the stored index, in discovery order */
	public List<JsonNode> storedFactions() {
		if (!open.get()) {
			return List.of();
		}
		try {
			List<JsonNode> result = new ArrayList<>();
			for (String value : transport.listValues(FACTION_LIST_KEY)) {
				result.add(objectMapper.readTree(value));
			}
			return result;
		} catch (Exception e) {
			logger.error("Failed to read stored factions: {}", e.getMessage());
			return List.of();
		}
	}

	/** Number of handlers registered for a channel */
	public int handlerCount(Channel channel) {
		List<Consumer<Envelope>> channelHandlers = handlers.get(channel);
		return channelHandlers != null ? channelHandlers.size() : 0;
	}

	private synchronized String nextTimestamp() {
		Instant now = Instant.now();
		if (now.isBefore(lastStamp)) {
			now = lastStamp;
		}
		lastStamp = now;
		return now.toString();
	}

	private void enqueue(Channel channel, String payload) {
		try {
			deliveries.put(new Delivery(channel, payload));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while queueing message for {}", channel, e);
		}
	}

	private void startDispatcher() {
		if (dispatching.compareAndSet(false, true)) {
			dispatchThread = new Thread(this::dispatch, "MessageBusDispatcher");
			dispatchThread.setDaemon(true);
			dispatchThread.start();
			logger.debug("Dispatch thread started");
		}
	}

	private void dispatch() {
		while (true) {
			try {
				Delivery delivery = deliveries.take();
				if (delivery == POISON_PILL) {
					break;
				}
				deliver(delivery);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Dispatch thread interrupted");
				break;
			}
		}
		logger.debug("Dispatch thread stopped");
	}

	private void deliver(Delivery delivery) {
		Envelope envelope;
		try {
			envelope = objectMapper.readValue(delivery.payload(), Envelope.class);
		} catch (Exception e) {
			logger.error("Dropping unreadable message on {}: {}", delivery.channel(), e.getMessage());
			return;
		}
		for (Consumer<Envelope> handler : handlers.getOrDefault(delivery.channel(), List.of())) {
			try {
				handler.accept(envelope);
			} catch (Exception e) {
				logger.error("Message handler for {} failed: {}", delivery.channel(), e.getMessage(), e);
			}
		}
	}

	/** Stop the dispatch thread after it has delivered the queued messages, then close the transport */
	@Override
	public void close() {
		if (dispatching.compareAndSet(true, false)) {
			try {
				deliveries.put(POISON_PILL);
				dispatchThread.join(5000);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.error("Interrupted while stopping dispatch thread", e);
			}
		}
		handlers.clear();
		if (open.compareAndSet(true, false)) {
			transport.close();
			logger.info("Message bus closed");
		}
	}
}
