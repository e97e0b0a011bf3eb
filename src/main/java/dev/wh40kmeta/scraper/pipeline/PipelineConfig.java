package dev.wh40kmeta.scraper.pipeline;

import dev.wh40kmeta.scraper.service.ScrapeSource;
import dev.wh40kmeta.scraper.url.VersionedUrlResolver;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration record for pipeline runs. The faction filter holds normalized faction codes; an
 * empty filter selects every discovered faction.
 */
public record PipelineConfig(ScrapeSource source, String versionId, Set<String> factionFilter, boolean wargear) {

	public PipelineConfig {
		factionFilter = factionFilter == null ? Set.of() : Set.copyOf(factionFilter);
	}

	/** Config with a filter built from faction codes or display names */
	public static PipelineConfig of(ScrapeSource source, String versionId, List<String> factions) {
		Set<String> filter = new LinkedHashSet<>();
		if (factions != null) {
			factions.stream()
					.map(VersionedUrlResolver::normalizeFactionCode)
					.filter(Objects::nonNull)
					.forEach(filter::add);
		}
		return new PipelineConfig(source, versionId, filter, true);
	}

	public PipelineConfig withoutWargear() {
		return new PipelineConfig(source, versionId, factionFilter, false);
	}

	public boolean selects(String factionCode, String factionName) {
		return factionFilter.isEmpty()
				|| factionFilter.contains(factionCode)
				|| factionFilter.contains(VersionedUrlResolver.normalizeFactionCode(factionName));
	}
}
