package dev.wh40kmeta.scraper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** One wargear option line of a unit datasheet */
@JsonPropertyOrder({"name", "unit_name", "faction_code", "source", "version_id"})
public record Wargear(
		@JsonProperty("name") String name,
		@JsonProperty("unit_name") String unitName,
		@JsonProperty("faction_code") String factionCode,
		@JsonProperty("source") String source,
		@JsonProperty("version_id") String versionId) {}
