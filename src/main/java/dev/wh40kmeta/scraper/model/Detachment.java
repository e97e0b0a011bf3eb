package dev.wh40kmeta.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A detachment of a faction. The faction page and anchor name are kept so that the enhancement stage
 * can locate the detachment's section again; they are not published.
 */
@JsonPropertyOrder({"name", "faction_code", "detachment_rule_name", "source", "version_id"})
public record Detachment(
		@JsonProperty("name") String name,
		@JsonProperty("faction_code") String factionCode,
		@JsonProperty("detachment_rule_name") String detachmentRuleName,
		@JsonProperty("source") String source,
		@JsonProperty("version_id") String versionId,
		@JsonIgnore String factionUrl,
		@JsonIgnore String anchor) {}
