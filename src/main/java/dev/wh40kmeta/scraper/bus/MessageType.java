package dev.wh40kmeta.scraper.bus;

import com.fasterxml.jackson.annotation.JsonValue;

/** Closed set of envelope types understood by downstream consumers */
public enum MessageType {
	FACTION_DISCOVERED("faction_discovered"),
	ARMY_RULE_EXTRACTED("army_rule_extracted"),
	DETACHMENT_EXTRACTED("detachment_extracted"),
	ENHANCEMENT_FOUND("enhancement_found"),
	UNIT_EXTRACTED("unit_extracted"),
	WARGEAR_FOUND("wargear_found"),
	STATUS_UPDATE("status_update"),
	ERROR_REPORT("error_report"),
	VERSION_CHANGE("version_change");

	private final String wireName;

	MessageType(String wireName) {
		this.wireName = wireName;
	}

	@JsonValue
	public String wireName() {
		return wireName;
	}
}
