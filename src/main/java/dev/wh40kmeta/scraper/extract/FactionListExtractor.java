package dev.wh40kmeta.scraper.extract;

import dev.wh40kmeta.scraper.model.Faction;
import dev.wh40kmeta.scraper.url.VersionedUrlResolver;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Discovers factions from the navigation dropdown of the quick start page. The dropdown content is
 * part of the markup, only hidden until hover, and sits next to the factions navigation button.
 */
public class FactionListExtractor extends BaseExtractor<String, Faction> {

	public FactionListExtractor(ExtractorConfig config) {
		super(config);
	}

	@Override
	public String stage() {
		return "factions";
	}

	@Override
	public String describe(String pageUrl) {
		return pageUrl;
	}

	/** Extract factions from the quick start page of the resolver's version */
	public List<Faction> extract() throws ParseFailure {
		return extract(resolver.quickStartUrl());
	}

	@Override
	public List<Faction> extract(String pageUrl) throws ParseFailure {
		Document document = fetch(pageUrl);

		Element navButton = document.selectFirst(selectors.factionNavButton());
		if (navButton == null) {
			throw new ParseFailure("Could not find faction navigation button");
		}
		Element dropdown = null;
		for (Element sibling = navButton.nextElementSibling(); sibling != null; sibling = sibling.nextElementSibling()) {
			if (sibling.hasClass(selectors.factionDropdownClass())) {
				dropdown = sibling;
				break;
			}
		}
		if (dropdown == null) {
			throw new ParseFailure("Could not find faction dropdown content");
		}

		List<Faction> factions = new ArrayList<>();
		Set<String> codes = new LinkedHashSet<>();
		for (Element link : dropdown.select(selectors.factionLink())) {
			String name = text(link);
			String url = link.absUrl("href");
			if (name.isEmpty() || url.isEmpty()) {
				logger.debug("Ignoring faction link without name or target: {}", link);
				continue;
			}
			String code = factionCode(url);
			if (code == null) {
				code = VersionedUrlResolver.normalizeFactionCode(name);
			}
			if (!codes.add(code)) {
				logger.debug("Ignoring duplicate faction {}", code);
				continue;
			}
			factions.add(new Faction(name, code, url, SOURCE, versionId));
			logger.debug("Extracted faction: {} ({})", name, code);
		}
		logger.info("Found {} factions", factions.size());
		return factions;
	}

	/** Path segment after {@code factions}, e.g. space-marines for /wh40k10ed/factions/space-marines/ */
	static String factionCode(String url) {
		String path = stripFragment(url);
		int query = path.indexOf('?');
		if (query >= 0) {
			path = path.substring(0, query);
		}
		String[] parts = path.split("/");
		for (int i = 0; i < parts.length - 1; i++) {
			if (parts[i].equals("factions") && !parts[i + 1].isEmpty()) {
				return parts[i + 1];
			}
		}
		return null;
	}
}
