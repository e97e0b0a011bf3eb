package dev.wh40kmeta.scraper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** The army rule heading of a faction page */
@JsonPropertyOrder({"faction_name", "faction_code", "faction_url", "army_rule_name", "source", "version_id"})
public record ArmyRule(
		@JsonProperty("faction_name") String factionName,
		@JsonProperty("faction_code") String factionCode,
		@JsonProperty("faction_url") String factionUrl,
		@JsonProperty("army_rule_name") String armyRuleName,
		@JsonProperty("source") String source,
		@JsonProperty("version_id") String versionId) {}
