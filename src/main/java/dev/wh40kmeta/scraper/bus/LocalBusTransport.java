package dev.wh40kmeta.scraper.bus;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process transport: listeners are called synchronously on the publishing thread and recent
 * lists live in memory. Used for runs without a broker and for tests.
 */
public class LocalBusTransport implements BusTransport {

	private record RecentList(Deque<String> entries, long expiresAtMillis) {}

	private record Hash(Map<String, String> fields, long expiresAtMillis) {}

	private final Map<String, List<Consumer<String>>> listeners = new HashMap<>();
	private final Map<String, RecentList> lists = new HashMap<>();
	private final Map<String, Hash> hashes = new HashMap<>();

	@Override
	public void connect() {}

	@Override
	public boolean ping() {
		return true;
	}

	@Override
	public void publish(String channel, String payload) {
		List<Consumer<String>> channelListeners;
		synchronized (this) {
			channelListeners = listeners.getOrDefault(channel, List.of());
		}
		for (Consumer<String> listener : channelListeners) {
			listener.accept(payload);
		}
	}

	@Override
	public synchronized void pushRecent(String key, String payload, int maxLength, Duration ttl) {
		RecentList current = live(key);
		Deque<String> entries = current != null ? current.entries() : new ArrayDeque<>();
		entries.addFirst(payload);
		while (entries.size() > maxLength) {
			entries.removeLast();
		}
		lists.put(key, new RecentList(entries, System.currentTimeMillis() + ttl.toMillis()));
	}

	@Override
	public synchronized List<String> recent(String key, int limit) {
		RecentList current = live(key);
		if (current == null) {
			return List.of();
		}
		List<String> result = new ArrayList<>();
		Iterator<String> it = current.entries().iterator();
		while (it.hasNext() && result.size() < limit) {
			result.add(it.next());
		}
		return result;
	}

	@Override
	public synchronized void replaceIndex(String hashKey, String listKey, Map<String, String> entries, Duration ttl) {
		hashes.remove(hashKey);
		lists.remove(listKey);
		if (entries.isEmpty()) {
			return;
		}
		long expiresAt = System.currentTimeMillis() + ttl.toMillis();
		hashes.put(hashKey, new Hash(new HashMap<>(entries), expiresAt));
		lists.put(listKey, new RecentList(new ArrayDeque<>(entries.values()), expiresAt));
	}

	@Override
	public synchronized Optional<String> hashValue(String hashKey, String field) {
		Hash hash = hashes.get(hashKey);
		if (hash == null) {
			return Optional.empty();
		}
		if (hash.expiresAtMillis() <= System.currentTimeMillis()) {
			hashes.remove(hashKey);
			return Optional.empty();
		}
		return Optional.ofNullable(hash.fields().get(field));
	}

	@Override
	public synchronized List<String> listValues(String listKey) {
		RecentList current = live(listKey);
		return current != null ? new ArrayList<>(current.entries()) : List.of();
	}

	private RecentList live(String key) {
		RecentList current = lists.get(key);
		if (current != null && current.expiresAtMillis() <= System.currentTimeMillis()) {
			lists.remove(key);
			return null;
		}
		return current;
	}

	@Override
	public synchronized void subscribe(String channel, Consumer<String> listener) {
		listeners.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(listener);
	}

	@Override
	public String describe() {
		return "local";
	}

	@Override
	public synchronized void close() {
		listeners.clear();
	}
}
