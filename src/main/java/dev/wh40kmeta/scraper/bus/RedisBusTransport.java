package dev.wh40kmeta.scraper.bus;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Redis pub/sub transport on Lettuce. Incoming messages are dispatched on the connection thread so
 * that they reach {@link MessageBus} in arrival order.
 */
public class RedisBusTransport implements BusTransport {
	private static final Logger logger = LoggerFactory.getLogger(RedisBusTransport.class);

	private final RedisSettings settings;
	private LettuceConnectionFactory connectionFactory;
	private StringRedisTemplate template;
	private RedisMessageListenerContainer listenerContainer;

	public RedisBusTransport(RedisSettings settings) {
		this.settings = settings;
	}

	@Override
	public void connect() {
		RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
		config.setHostName(settings.host());
		config.setPort(settings.port());
		config.setDatabase(settings.database());
		if (settings.password() != null && !settings.password().isEmpty()) {
			config.setPassword(settings.password());
		}

		try {
			connectionFactory = new LettuceConnectionFactory(config);
			connectionFactory.afterPropertiesSet();
			template = new StringRedisTemplate(connectionFactory);

			String pong = template.execute((RedisCallback<String>) RedisConnection::ping);
			logger.debug("Redis at {} answered {}", settings, pong);

			listenerContainer = new RedisMessageListenerContainer();
			listenerContainer.setConnectionFactory(connectionFactory);
			listenerContainer.setTaskExecutor(new SyncTaskExecutor());
			listenerContainer.afterPropertiesSet();
			listenerContainer.start();
		} catch (RuntimeException e) {
			close();
			throw new BusException("Redis unreachable at " + settings + ": " + e.getMessage(), e);
		}
	}

	@Override
	public boolean ping() {
		return "PONG".equalsIgnoreCase(template.execute((RedisCallback<String>) RedisConnection::ping));
	}

	@Override
	public void publish(String channel, String payload) {
		Long receivers = template.convertAndSend(channel, payload);
		logger.trace("Message on {} reached {} subscribers", channel, receivers);
	}

	@Override
	public void pushRecent(String key, String payload, int maxLength, Duration ttl) {
		template.opsForList().leftPush(key, payload);
		template.opsForList().trim(key, 0, maxLength - 1);
		template.expire(key, ttl);
	}

	@Override
	public List<String> recent(String key, int limit) {
		List<String> values = template.opsForList().range(key, 0, limit - 1);
		return values != null ? values : List.of();
	}

	@Override
	public void replaceIndex(String hashKey, String listKey, Map<String, String> entries, Duration ttl) {
		template.delete(List.of(hashKey, listKey));
		if (entries.isEmpty()) {
			return;
		}
		template.opsForHash().putAll(hashKey, entries);
		template.opsForList().rightPushAll(listKey, entries.values());
		template.expire(hashKey, ttl);
		template.expire(listKey, ttl);
	}

	@Override
	public Optional<String> hashValue(String hashKey, String field) {
		return Optional.ofNullable(template.opsForHash().get(hashKey, field)).map(Object::toString);
	}

	@Override
	public List<String> listValues(String listKey) {
		List<String> values = template.opsForList().range(listKey, 0, -1);
		return values != null ? values : List.of();
	}

	@Override
	public void subscribe(String channel, Consumer<String> listener) {
		listenerContainer.addMessageListener(
				(message, pattern) -> listener.accept(new String(message.getBody(), StandardCharsets.UTF_8)),
				new ChannelTopic(channel));
	}

	@Override
	public String describe() {
		return settings.toString();
	}

	@Override
	public void close() {
		if (listenerContainer != null) {
			try {
				listenerContainer.stop();
				listenerContainer.destroy();
			} catch (Exception e) {
				logger.warn("Failed to stop Redis listener container: {}", e.getMessage());
			}
			listenerContainer = null;
		}
		if (connectionFactory != null) {
			connectionFactory.destroy();
			connectionFactory = null;
		}
	}
}
