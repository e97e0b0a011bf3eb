package dev.wh40kmeta.scraper.bus;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MessageBusTest {

	private final ObjectMapper mapper = new ObjectMapper();
	private MessageBus bus;

	@BeforeEach
	void setUp() {
		bus = new MessageBus(new LocalBusTransport()).open();
	}

	@AfterEach
	void tearDown() {
		bus.close();
	}

	private Envelope faction(String name) {
		ObjectNode data = mapper.createObjectNode();
		data.put("name", name);
		return Envelope.of(MessageType.FACTION_DISCOVERED, "10th", data);
	}

	@Test
	void testPublishedEnvelopeIsRecorded() {
		// Given
		Envelope envelope = faction("Orks");

		// When
		boolean published = bus.publish(Channel.FACTION_DISCOVERED, envelope);

		// Then
		assertThat(published).isTrue();
		List<Envelope> recent = bus.recent(Channel.FACTION_DISCOVERED, 1);
		assertThat(recent).hasSize(1);
		assertThat(recent.get(0).type()).isEqualTo(envelope.type());
		assertThat(recent.get(0).version()).isEqualTo("10th");
		assertThat(recent.get(0).data()).isEqualTo(envelope.data());
		assertThat(recent.get(0).source()).isEqualTo(MessageBus.SOURCE);
		assertThat(recent.get(0).timestamp()).isNotBlank();
	}

	@Test
	void testRecentListIsBoundedAndNewestFirst() {
		// When
		for (int i = 0; i < 150; i++) {
			bus.publish(Channel.UNIT_EXTRACTED, faction("unit-" + i));
		}

		// Then
		List<Envelope> recent = bus.recent(Channel.UNIT_EXTRACTED, 500);
		assertThat(recent).hasSize(MessageBus.RECENT_LIMIT);
		assertThat(recent.get(0).data().path("name").asText()).isEqualTo("unit-149");
		assertThat(recent.get(99).data().path("name").asText()).isEqualTo("unit-50");
		assertThat(bus.recent(Channel.UNIT_EXTRACTED, 5)).hasSize(5);
	}

	@Test
	void testRecentOfUnusedChannelIsEmpty() {
		// When/Then
		assertThat(bus.recent(Channel.WARGEAR_FOUND, 10)).isEmpty();
		assertThat(bus.recent(Channel.WARGEAR_FOUND, 0)).isEmpty();
	}

	@Test
	void testTimestampsDoNotDecrease() {
		// When
		for (int i = 0; i < 20; i++) {
			bus.publish(Channel.FACTION_DISCOVERED, faction("f" + i));
		}

		// Then
		List<Envelope> recent = bus.recent(Channel.FACTION_DISCOVERED, 20);
		for (int i = 1; i < recent.size(); i++) {
			Instant newer = Instant.parse(recent.get(i - 1).timestamp());
			Instant older = Instant.parse(recent.get(i).timestamp());
			assertThat(newer).isAfterOrEqualTo(older);
		}
	}

	@Test
	void testSubscriberReceivesMessagesInOrder() throws InterruptedException {
		// Given
		List<String> received = new CopyOnWriteArrayList<>();
		CountDownLatch latch = new CountDownLatch(3);
		bus.subscribe(Channel.FACTION_DISCOVERED, envelope -> {
			received.add(envelope.data().path("name").asText());
			latch.countDown();
		});

		// When
		bus.publish(Channel.FACTION_DISCOVERED, faction("M1"));
		bus.publish(Channel.FACTION_DISCOVERED, faction("M2"));
		bus.publish(Channel.FACTION_DISCOVERED, faction("M3"));

		// Then
		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(received).containsExactly("M1", "M2", "M3");
	}

	@Test
	void testSubscriberOnlyReceivesItsChannel() throws InterruptedException {
		// Given
		List<Envelope> received = new CopyOnWriteArrayList<>();
		CountDownLatch latch = new CountDownLatch(1);
		bus.subscribe(Channel.STATUS_COMPLETED, envelope -> {
			received.add(envelope);
			latch.countDown();
		});

		// When
		bus.publish(Channel.FACTION_DISCOVERED, faction("Orks"));
		bus.publish(Channel.STATUS_COMPLETED, Envelope.status("10th", "completed", null));

		// Then
		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(received).hasSize(1);
		assertThat(received.get(0).type()).isEqualTo(MessageType.STATUS_UPDATE);
		assertThat(received.get(0).status()).isEqualTo("completed");
	}

	@Test
	void testFailingHandlerDoesNotAffectOthers() throws InterruptedException {
		// Given
		CountDownLatch latch = new CountDownLatch(2);
		bus.subscribe(Channel.FACTION_DISCOVERED, envelope -> {
			throw new IllegalStateException("handler failure");
		});
		bus.subscribe(Channel.FACTION_DISCOVERED, envelope -> latch.countDown());

		// When
		bus.publish(Channel.FACTION_DISCOVERED, faction("M1"));
		bus.publish(Channel.FACTION_DISCOVERED, faction("M2"));

		// Then
		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(bus.handlerCount(Channel.FACTION_DISCOVERED)).isEqualTo(2);
	}

	@Test
	void testCloseDeliversQueuedMessages() {
		// Given
		List<String> received = new CopyOnWriteArrayList<>();
		bus.subscribe(Channel.FACTION_DISCOVERED, envelope -> received.add(envelope.data().path("name").asText()));
		bus.publish(Channel.FACTION_DISCOVERED, faction("M1"));
		bus.publish(Channel.FACTION_DISCOVERED, faction("M2"));

		// When
		bus.close();

		// Then
		assertThat(received).containsExactly("M1", "M2");
	}

	@Test
	void testReopenedBusDeliversToNewSubscribers() throws InterruptedException {
		// Given
		List<String> stale = new CopyOnWriteArrayList<>();
		bus.subscribe(Channel.FACTION_DISCOVERED, envelope -> stale.add("stale"));
		bus.close();
		bus.open();
		CountDownLatch latch = new CountDownLatch(1);
		bus.subscribe(Channel.FACTION_DISCOVERED, envelope -> latch.countDown());

		// When
		bus.publish(Channel.FACTION_DISCOVERED, faction("Orks"));

		// Then
		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(bus.handlerCount(Channel.FACTION_DISCOVERED)).isEqualTo(1);
		assertThat(stale).isEmpty();
	}

	@Test
	void testStoreFactionsReplacesIndex() {
		// Given
		bus.storeFactions(Map.of("squats", Map.of("name", "Squats", "code", "squats")));
		Map<String, Object> factions = new LinkedHashMap<>();
		factions.put("orks", Map.of("name", "Orks", "code", "orks"));
		factions.put("necrons", Map.of("name", "Necrons", "code", "necrons"));

		// When
		boolean stored = bus.storeFactions(factions);

		// Then
		assertThat(stored).isTrue();
		assertThat(bus.storedFactions())
				.extracting(node -> node.path("code").asText())
				.containsExactly("orks", "necrons");
		assertThat(bus.storedFaction("necrons")).hasValueSatisfying(node -> assertThat(node.path("name").asText())
				.isEqualTo("Necrons"));
		assertThat(bus.storedFaction("squats")).isEmpty();
	}

	@Test
	void testStoreFactionsFailureReturnsFalse() {
		// Given
		MessageBus failing = new MessageBus(new FailingTransport()).open();

		// When/Then
		assertThat(failing.storeFactions(Map.of("orks", Map.of("name", "Orks")))).isFalse();
		assertThat(failing.storedFactions()).isEmpty();
		assertThat(failing.storedFaction("orks")).isEmpty();
		failing.close();
	}

	@Test
	void testClosedBusRejectsOperations() {
		// Given
		bus.close();

		// When/Then
		assertThat(bus.isOpen()).isFalse();
		assertThat(bus.publish(Channel.FACTION_DISCOVERED, faction("Orks"))).isFalse();
		assertThat(bus.recent(Channel.FACTION_DISCOVERED, 10)).isEmpty();
		assertThat(bus.ping()).isFalse();
		assertThatThrownBy(() -> bus.subscribe(Channel.FACTION_DISCOVERED, envelope -> {}))
				.isInstanceOf(BusException.class);
	}

	@Test
	void testPublishFailureReturnsFalse() {
		// Given
		MessageBus failing = new MessageBus(new FailingTransport()).open();

		// When
		boolean published = failing.publish(Channel.FACTION_DISCOVERED, faction("Orks"));

		// Then
		assertThat(published).isFalse();
		failing.close();
	}

	@Test
	void testConnectFailureThrowsBusException() {
		// Given
		FailingTransport transport = new FailingTransport();
		transport.refuseConnections = true;
		MessageBus unreachable = new MessageBus(transport);

		// When/Then
		assertThatThrownBy(unreachable::open)
				.isInstanceOf(BusException.class)
				.hasMessageContaining("failing");
		assertThat(unreachable.isOpen()).isFalse();
	}

	@Test
	void testRedisUnreachable() throws IOException {
		// Given
		int port;
		try (ServerSocket socket = new ServerSocket(0)) {
			port = socket.getLocalPort();
		}
		MessageBus redisBus = new MessageBus(new RedisBusTransport(new RedisSettings("127.0.0.1", port, 0, null)));

		// When/Then
		assertThatThrownBy(redisBus::open).isInstanceOf(BusException.class).hasMessageContaining("127.0.0.1");
		assertThat(redisBus.isOpen()).isFalse();
	}

	@Test
	void testPing() {
		// When/Then
		assertThat(bus.ping()).isTrue();
	}

	/** Transport whose broker operations always fail */
	static class FailingTransport implements BusTransport {
		boolean refuseConnections;

		@Override
		public void connect() {
			if (refuseConnections) {
				throw new IllegalStateException("connection refused");
			}
		}

		@Override
		public boolean ping() {
			return false;
		}

		@Override
		public void publish(String channel, String payload) {
			throw new IllegalStateException("broker gone");
		}

		@Override
		public void pushRecent(String key, String payload, int maxLength, Duration ttl) {
			throw new IllegalStateException("broker gone");
		}

		@Override
		public List<String> recent(String key, int limit) {
			throw new IllegalStateException("broker gone");
		}

		@Override
		public void replaceIndex(String hashKey, String listKey, Map<String, String> entries, Duration ttl) {
			throw new IllegalStateException("broker gone");
		}

		@Override
		public Optional<String> hashValue(String hashKey, String field) {
			throw new IllegalStateException("broker gone");
		}

		@Override
		public List<String> listValues(String listKey) {
			throw new IllegalStateException("broker gone");
		}

		@Override
		public void subscribe(String channel, Consumer<String> listener) {}

		@Override
		public String describe() {
			return "failing";
		}

		@Override
		public void close() {}
	}
}
