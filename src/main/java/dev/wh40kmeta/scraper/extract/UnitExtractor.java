package dev.wh40kmeta.scraper.extract;

import dev.wh40kmeta.scraper.model.Faction;
import dev.wh40kmeta.scraper.model.Unit;
import dev.wh40kmeta.scraper.url.VersionedUrlResolver;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/** Extracts the visible unit datasheets of a faction */
public class UnitExtractor extends BaseExtractor<Faction, Unit> {

	public UnitExtractor(ExtractorConfig config) {
		super(config);
	}

	@Override
	public String stage() {
		return "units";
	}

	@Override
	public String describe(Faction faction) {
		return faction.name();
	}

	@Override
	public List<Unit> extract(Faction faction) throws ParseFailure {
		String pageUrl = resolver.factionDatasheetsUrl(faction.code());
		if (pageUrl == null) {
			throw new ParseFailure("No datasheets URL for faction " + faction.name());
		}
		Document document = fetchShared(pageUrl);

		var datasheets = document.select(selectors.datasheet());
		if (datasheets.isEmpty()) {
			throw new ParseFailure("No datasheets found for " + faction.name());
		}

		List<Unit> units = new ArrayList<>();
		for (Element datasheet : datasheets) {
			String name = text(datasheet.selectFirst(selectors.unitName()));
			if (name.isEmpty()) {
				logger.warn("Datasheet without unit name on {}", pageUrl);
				continue;
			}
			Integer points = null;
			for (Element priceTag : datasheet.select(selectors.priceTag())) {
				points = parsePoints(text(priceTag));
				if (points != null) {
					break;
				}
			}
			String url = resolver.unitDatasheetUrl(faction.code(), VersionedUrlResolver.normalizeFactionCode(name));
			units.add(new Unit(name, faction.code(), points, url, List.of(), SOURCE, versionId));
		}
		logger.info("Found {} units for {}", units.size(), faction.name());
		return units;
	}
}
