package dev.wh40kmeta.scraper.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.wh40kmeta.scraper.model.Faction;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Typed publishing helpers for extraction stages, bound to one game version */
public class StagePublisher {
	private static final Logger logger = LoggerFactory.getLogger(StagePublisher.class);

	private final MessageBus bus;
	private final String versionId;
	private final ObjectMapper objectMapper = new ObjectMapper();

	public StagePublisher(MessageBus bus, String versionId) {
		this.bus = bus;
		this.versionId = versionId;
	}

	/** Status channel for a status name; unknown names are announced as started */
	public static Channel statusChannel(String status) {
		if (status == null) {
			return Channel.STATUS_STARTED;
		}
		return switch (status) {
			case "completed" -> Channel.STATUS_COMPLETED;
			case "failed", "error" -> Channel.STATUS_FAILED;
			default -> Channel.STATUS_STARTED;
		};
	}

	public boolean status(String status, Map<String, ?> details) {
		JsonNode detailsNode = objectMapper.valueToTree(details != null ? details : Map.of());
		boolean published = bus.publish(statusChannel(status), Envelope.status(versionId, status, detailsNode));
		if (published) {
			logger.debug("Published status {}: {}", status, details);
		}
		return published;
	}

	/** Publish all records of a stage in one envelope with a count */
	public boolean batch(MessageType type, Channel channel, List<?> records) {
		try {
			JsonNode data = objectMapper.valueToTree(records);
			boolean published = bus.publish(channel, Envelope.batch(type, versionId, records.size(), data));
			if (published) {
				logger.info("Published {} records to {}", records.size(), channel);
			}
			return published;
		} catch (IllegalArgumentException e) {
			logger.error("Failed to serialize {} records: {}", type.wireName(), e.getMessage());
			return false;
		}
	}

	/** Publish the discovered factions and, once published, store them as the faction index */
	public boolean factions(List<Faction> factions) {
		boolean published = batch(MessageType.FACTION_DISCOVERED, Channel.FACTION_DISCOVERED, factions);
		if (published) {
			Map<String, Faction> byCode = new LinkedHashMap<>();
			for (Faction faction : factions) {
				if (faction.code() != null) {
					byCode.putIfAbsent(faction.code(), faction);
				}
			}
			bus.storeFactions(byCode);
		}
		return published;
	}

	/** Publish a single record */
	public boolean item(MessageType type, Channel channel, Object record) {
		try {
			return bus.publish(channel, Envelope.of(type, versionId, objectMapper.valueToTree(record)));
		} catch (IllegalArgumentException e) {
			logger.error("Failed to serialize {} record: {}", type.wireName(), e.getMessage());
			return false;
		}
	}

	/** Announce that the scraped game version differs from the one of the previous run */
	public boolean versionChange(String previousVersion, String newVersion) {
		ObjectNode data = objectMapper.createObjectNode();
		data.put("from", previousVersion);
		data.put("to", newVersion);
		return bus.publish(Channel.VERSION_CHANGE, Envelope.of(MessageType.VERSION_CHANGE, newVersion, data));
	}

	/** Version announced by the most recent version change, if any is still buffered */
	public Optional<String> lastAnnouncedVersion() {
		return bus.recent(Channel.VERSION_CHANGE, 1).stream()
				.findFirst()
				.map(Envelope::data)
				.map(data -> data.path("to"))
				.filter(JsonNode::isTextual)
				.map(JsonNode::asText);
	}
}
