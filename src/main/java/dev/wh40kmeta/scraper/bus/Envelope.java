package dev.wh40kmeta.scraper.bus;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Unit of transport on the bus. The timestamp and source are filled in by {@link MessageBus} when
 * the envelope is published.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "version", "status", "count", "data", "details", "timestamp", "source"})
public record Envelope(
		@JsonProperty("type") MessageType type,
		@JsonProperty("version") String version,
		@JsonProperty("status") String status,
		@JsonProperty("count") Integer count,
		@JsonProperty("data") JsonNode data,
		@JsonProperty("details") JsonNode details,
		@JsonProperty("timestamp") String timestamp,
		@JsonProperty("source") String source) {

	public static Envelope of(MessageType type, String version, JsonNode data) {
		return new Envelope(type, version, null, null, data, null, null, null);
	}

	public static Envelope batch(MessageType type, String version, int count, JsonNode data) {
		return new Envelope(type, version, null, count, data, null, null, null);
	}

	public static Envelope status(String version, String status, JsonNode details) {
		return new Envelope(MessageType.STATUS_UPDATE, version, status, null, null, details, null, null);
	}

	public Envelope stamped(String timestamp, String source) {
		return new Envelope(type, version, status, count, data, details, timestamp, source);
	}
}
