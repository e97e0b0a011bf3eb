package dev.wh40kmeta.scraper.service;

import java.util.Arrays;

/** Supported rules sources */
public enum ScrapeSource {
	WAHAPEDIA("wahapedia");

	private final String id;

	ScrapeSource(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}

	/**
	 * Look up a source by id; null or blank selects the default source
	 *
	 * @throws IllegalArgumentException for an unknown id
	 */
	public static ScrapeSource of(String id) {
		if (id == null || id.isBlank()) {
			return WAHAPEDIA;
		}
		for (ScrapeSource source : values()) {
			if (source.id.equalsIgnoreCase(id)) {
				return source;
			}
		}
		throw new IllegalArgumentException("Service " + id + " not registered. Available: "
				+ Arrays.stream(values()).map(ScrapeSource::id).toList());
	}
}
