package dev.wh40kmeta.scraper.bus;

/** Closed set of bus channels the scraper publishes to */
public enum Channel {
	FACTION_DISCOVERED("scraper:faction:discovered"),
	ARMY_RULE_EXTRACTED("scraper:army_rule:extracted"),
	DETACHMENT_EXTRACTED("scraper:detachment:extracted"),
	ENHANCEMENT_FOUND("scraper:enhancement:found"),
	UNIT_EXTRACTED("scraper:unit:extracted"),
	WARGEAR_FOUND("scraper:wargear:found"),
	STATUS_STARTED("scraper:status:started"),
	STATUS_COMPLETED("scraper:status:completed"),
	STATUS_FAILED("scraper:status:failed"),
	VERSION_CHANGE("scraper:version:change"),
	HEALTH_CHECK("scraper:health:check");

	private final String key;

	Channel(String key) {
		this.key = key;
	}

	/** Channel name on the broker */
	public String key() {
		return key;
	}

	/** Key of the list holding the most recent messages of this channel */
	public String recentKey() {
		return "messages:" + key + ":recent";
	}

	/** Look up a channel by broker name or enum name */
	public static Channel of(String name) {
		for (Channel channel : values()) {
			if (channel.key.equals(name) || channel.name().equalsIgnoreCase(name)) {
				return channel;
			}
		}
		throw new IllegalArgumentException("Unknown channel: " + name);
	}

	@Override
	public String toString() {
		return key;
	}
}
