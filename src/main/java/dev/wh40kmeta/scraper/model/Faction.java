package dev.wh40kmeta.scraper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** A faction listed in the upstream navigation, unique by code within one game version */
@JsonPropertyOrder({"name", "code", "url", "source", "version_id"})
public record Faction(
		@JsonProperty("name") String name,
		@JsonProperty("code") String code,
		@JsonProperty("url") String url,
		@JsonProperty("source") String source,
		@JsonProperty("version_id") String versionId) {}
