package dev.wh40kmeta.scraper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/** A unit datasheet; wargear is filled in by the wargear stage through {@link #withWargear} */
@JsonPropertyOrder({"name", "faction_code", "base_points", "url", "wargear", "source", "version_id"})
public record Unit(
		@JsonProperty("name") String name,
		@JsonProperty("faction_code") String factionCode,
		@JsonProperty("base_points") Integer basePoints,
		@JsonProperty("url") String url,
		@JsonProperty("wargear") List<String> wargear,
		@JsonProperty("source") String source,
		@JsonProperty("version_id") String versionId) {

	public Unit {
		wargear = wargear == null ? List.of() : List.copyOf(wargear);
	}

	public Unit withWargear(List<String> wargear) {
		return new Unit(name, factionCode, basePoints, url, wargear, source, versionId);
	}
}
