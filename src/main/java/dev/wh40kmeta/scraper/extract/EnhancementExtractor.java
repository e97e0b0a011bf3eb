package dev.wh40kmeta.scraper.extract;

import dev.wh40kmeta.scraper.model.Detachment;
import dev.wh40kmeta.scraper.model.Enhancement;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * Extracts the enhancements of a detachment from the enhancement tables of its section on the
 * faction page. The faction page is fetched once for all detachments of a faction.
 */
public class EnhancementExtractor extends BaseExtractor<Detachment, Enhancement> {

	public EnhancementExtractor(ExtractorConfig config) {
		super(config);
	}

	@Override
	public String stage() {
		return "enhancements";
	}

	@Override
	public String describe(Detachment detachment) {
		return detachment.factionCode() + "/" + detachment.name();
	}

	@Override
	public List<Enhancement> extract(Detachment detachment) throws ParseFailure {
		String pageUrl = detachment.factionUrl() != null
				? detachment.factionUrl()
				: resolver.factionUrl(detachment.factionCode());
		if (pageUrl == null) {
			throw new ParseFailure("No faction URL for detachment " + detachment.name());
		}
		Document document = fetchShared(pageUrl);

		Element detachmentAnchor = null;
		for (Element anchor : document.select(selectors.detachmentAnchor())) {
			if (anchor.attr("name").equals(detachment.anchor())) {
				detachmentAnchor = anchor;
				break;
			}
		}
		if (detachmentAnchor == null) {
			throw new ParseFailure("Detachment anchor " + detachment.anchor() + " not found");
		}

		Element enhancementAnchor = null;
		for (Element sibling = detachmentAnchor.nextElementSibling();
				sibling != null;
				sibling = sibling.nextElementSibling()) {
			if (sibling.is(selectors.detachmentAnchor())) {
				break;
			}
			if (sibling.is(selectors.enhancementAnchor())) {
				enhancementAnchor = sibling;
				break;
			}
		}
		if (enhancementAnchor == null) {
			throw new ParseFailure("No enhancements section for detachment " + detachment.name());
		}

		Element container = findFollowing(enhancementAnchor, selectors.columnsContainer(), selectors.sectionAnchor());
		if (container == null) {
			throw new ParseFailure("No enhancement tables for detachment " + detachment.name());
		}

		List<Enhancement> enhancements = new ArrayList<>();
		for (Element table : container.select(selectors.enhancementTable())) {
			for (Element item : table.select(selectors.enhancementItem())) {
				Elements spans = item.select("span");
				String name = spans.isEmpty() ? text(item) : text(spans.first());
				if (name.isEmpty()) {
					continue;
				}
				Integer cost = spans.size() > 1 ? parsePoints(text(spans.last())) : null;
				enhancements.add(new Enhancement(
						name, cost, detachment.name(), detachment.factionCode(), SOURCE, versionId));
			}
		}
		logger.info("Found {} enhancements for {}", enhancements.size(), detachment.name());
		return enhancements;
	}
}
