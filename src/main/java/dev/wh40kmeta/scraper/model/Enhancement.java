package dev.wh40kmeta.scraper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** An enhancement of a detachment; cost is null when the points value could not be parsed */
@JsonPropertyOrder({"name", "cost", "detachment_name", "faction_code", "source", "version_id"})
public record Enhancement(
		@JsonProperty("name") String name,
		@JsonProperty("cost") Integer cost,
		@JsonProperty("detachment_name") String detachmentName,
		@JsonProperty("faction_code") String factionCode,
		@JsonProperty("source") String source,
		@JsonProperty("version_id") String versionId) {}
