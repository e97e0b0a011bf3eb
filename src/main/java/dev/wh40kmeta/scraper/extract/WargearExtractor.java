package dev.wh40kmeta.scraper.extract;

import dev.wh40kmeta.scraper.model.Unit;
import dev.wh40kmeta.scraper.model.Wargear;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/** Extracts the wargear options listed on a unit's datasheet */
public class WargearExtractor extends BaseExtractor<Unit, Wargear> {

	public WargearExtractor(ExtractorConfig config) {
		super(config);
	}

	@Override
	public String stage() {
		return "wargear";
	}

	@Override
	public String describe(Unit unit) {
		return unit.factionCode() + "/" + unit.name();
	}

	@Override
	public List<Wargear> extract(Unit unit) throws ParseFailure {
		if (unit.url() == null) {
			throw new ParseFailure("No datasheet URL for unit " + unit.name());
		}
		Document document = fetchShared(unit.url());

		Element datasheet = null;
		for (Element candidate : document.select(selectors.datasheet())) {
			if (text(candidate.selectFirst(selectors.unitName())).equals(unit.name())) {
				datasheet = candidate;
				break;
			}
		}
		if (datasheet == null) {
			throw new ParseFailure("Datasheet of " + unit.name() + " not found");
		}

		Elements elements = datasheet.getAllElements();
		int headingIndex = -1;
		for (int i = 0; i < elements.size(); i++) {
			if (elements.get(i).ownText().trim().equalsIgnoreCase(selectors.wargearHeading())) {
				headingIndex = i;
				break;
			}
		}
		if (headingIndex < 0) {
			logger.debug("No wargear options on datasheet of {}", unit.name());
			return List.of();
		}

		Element list = null;
		for (int i = headingIndex + 1; i < elements.size(); i++) {
			if (elements.get(i).is(selectors.wargearList())) {
				list = elements.get(i);
				break;
			}
		}
		if (list == null) {
			throw new ParseFailure("Wargear options of " + unit.name() + " have no list");
		}

		List<Wargear> wargear = new ArrayList<>();
		for (Element item : list.select(selectors.wargearItem())) {
			String option = text(item);
			if (!option.isEmpty()) {
				wargear.add(new Wargear(option, unit.name(), unit.factionCode(), SOURCE, versionId));
			}
		}
		logger.debug("Found {} wargear options for {}", wargear.size(), unit.name());
		return wargear;
	}
}
